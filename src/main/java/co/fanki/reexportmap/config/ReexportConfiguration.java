package co.fanki.reexportmap.config;

import co.fanki.reexportmap.analysis.application.AnalysisSettings;
import co.fanki.reexportmap.analysis.application.ReexportAnalysisService;
import co.fanki.reexportmap.analysis.application.ReportWriter;
import co.fanki.reexportmap.analysis.domain.DuplicateBindingPolicy;
import co.fanki.reexportmap.analysis.domain.EntryPointLocator;
import co.fanki.reexportmap.analysis.domain.ExportExtractor;
import co.fanki.reexportmap.analysis.domain.PackageVersionResolver;
import co.fanki.reexportmap.analysis.domain.ReexportResolver;
import co.fanki.reexportmap.analysis.domain.python.PythonExportExtractor;
import co.fanki.reexportmap.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the analysis pipeline from the {@code reexport.*} properties.
 *
 * <p>An empty upstream root means the upstream package is installed next
 * to the downstream one. An empty distribution name defaults to the
 * package name, and an empty version is looked up in the installed
 * distribution metadata.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ReexportConfiguration {

    /**
     * Builds the analysis settings.
     *
     * @param downstreamRoot the downstream source root
     * @param downstreamPackage the downstream package name
     * @param downstreamDistribution the downstream distribution name
     * @param downstreamVersion the explicit downstream version
     * @param upstreamRoot the upstream source root, blank for the
     *        downstream root
     * @param upstreamPackage the upstream package name
     * @param upstreamDistribution the upstream distribution name
     * @param upstreamVersion the explicit upstream version
     * @param workerThreads the worker pool size
     * @return the settings
     */
    @Bean
    public AnalysisSettings analysisSettings(
            @Value("${reexport.downstream.root:./site-packages}")
            final String downstreamRoot,
            @Value("${reexport.downstream.package:langchain}")
            final String downstreamPackage,
            @Value("${reexport.downstream.distribution:}")
            final String downstreamDistribution,
            @Value("${reexport.downstream.version:}")
            final String downstreamVersion,
            @Value("${reexport.upstream.root:}")
            final String upstreamRoot,
            @Value("${reexport.upstream.package:langchain_core}")
            final String upstreamPackage,
            @Value("${reexport.upstream.distribution:}")
            final String upstreamDistribution,
            @Value("${reexport.upstream.version:}")
            final String upstreamVersion,
            @Value("${reexport.worker-threads:4}")
            final int workerThreads) {

        Preconditions.requireNonBlank(downstreamRoot,
                "reexport.downstream.root must not be blank");

        final Path downstreamPath = Path.of(downstreamRoot);
        final Path upstreamPath = Path.of(Preconditions.defaultIfBlank(
                upstreamRoot, downstreamRoot));

        return new AnalysisSettings(
                new AnalysisSettings.PackageSource(downstreamPath,
                        downstreamPackage, downstreamDistribution,
                        downstreamVersion),
                new AnalysisSettings.PackageSource(upstreamPath,
                        upstreamPackage, upstreamDistribution,
                        upstreamVersion),
                workerThreads);
    }

    /**
     * Provides the Python import and export extractor.
     *
     * @param settings the analysis settings
     * @return the extractor bound to the upstream package
     */
    @Bean
    public ExportExtractor exportExtractor(final AnalysisSettings settings) {
        return new PythonExportExtractor(settings.upstream().packageName());
    }

    /**
     * Provides the re-export resolver.
     *
     * @param policy how repeated imports of the same local name are
     *        resolved
     * @return the resolver
     */
    @Bean
    public ReexportResolver reexportResolver(
            @Value("${reexport.duplicate-binding-policy:LAST_WINS}")
            final String policy) {
        return new ReexportResolver(DuplicateBindingPolicy.fromString(policy));
    }

    /**
     * Provides the entry point locator.
     *
     * @return the locator
     */
    @Bean
    public EntryPointLocator entryPointLocator() {
        return new EntryPointLocator();
    }

    /**
     * Provides the installed version resolver.
     *
     * @return the version resolver
     */
    @Bean
    public PackageVersionResolver packageVersionResolver() {
        return new PackageVersionResolver();
    }

    /**
     * Provides the analysis service.
     *
     * @param locator the entry point locator
     * @param extractor the extractor
     * @param resolver the resolver
     * @param versionResolver the version resolver
     * @param settings the analysis settings
     * @return the service
     */
    @Bean
    public ReexportAnalysisService reexportAnalysisService(
            final EntryPointLocator locator,
            final ExportExtractor extractor,
            final ReexportResolver resolver,
            final PackageVersionResolver versionResolver,
            final AnalysisSettings settings) {
        return new ReexportAnalysisService(locator, extractor, resolver,
                versionResolver, settings);
    }

    /**
     * Provides the report writer.
     *
     * @return the writer
     */
    @Bean
    public ReportWriter reportWriter() {
        return new ReportWriter(new ObjectMapper());
    }

}
