package co.fanki.reexportmap.analysis.application;

import co.fanki.reexportmap.analysis.domain.EntryPointLocator;
import co.fanki.reexportmap.analysis.domain.EntryPointModule;
import co.fanki.reexportmap.analysis.domain.ExportExtractor;
import co.fanki.reexportmap.analysis.domain.ModuleAnalysis;
import co.fanki.reexportmap.analysis.domain.PackageReport;
import co.fanki.reexportmap.analysis.domain.PackageVersionResolver;
import co.fanki.reexportmap.analysis.domain.ReexportResolver;
import co.fanki.reexportmap.analysis.domain.SourceUnavailableException;
import co.fanki.reexportmap.shared.DomainException;
import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds the re-export report of a downstream package.
 *
 * <p>Flow:</p>
 * <ol>
 *   <li>Check the source roots and resolve both package versions</li>
 *   <li>Locate the public entry points of the downstream package</li>
 *   <li>Analyze every entry point on a worker pool</li>
 *   <li>Aggregate the results into a report sorted by module path</li>
 * </ol>
 *
 * <p>Failures are recovered per module and recorded in the report. Only a
 * missing or unreadable downstream source root aborts the run.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReexportAnalysisService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReexportAnalysisService.class);

    private final EntryPointLocator locator;
    private final ExportExtractor extractor;
    private final ReexportResolver resolver;
    private final PackageVersionResolver versionResolver;
    private final AnalysisSettings settings;

    /**
     * Creates a new ReexportAnalysisService.
     *
     * @param theLocator the entry point locator
     * @param theExtractor the import and export extractor
     * @param theResolver the re-export resolver
     * @param theVersionResolver the installed version resolver
     * @param theSettings the packages to analyze
     */
    public ReexportAnalysisService(
            final EntryPointLocator theLocator,
            final ExportExtractor theExtractor,
            final ReexportResolver theResolver,
            final PackageVersionResolver theVersionResolver,
            final AnalysisSettings theSettings) {
        locator = Preconditions.requireNonNull(theLocator,
                "Locator is required");
        extractor = Preconditions.requireNonNull(theExtractor,
                "Extractor is required");
        resolver = Preconditions.requireNonNull(theResolver,
                "Resolver is required");
        versionResolver = Preconditions.requireNonNull(theVersionResolver,
                "Version resolver is required");
        settings = Preconditions.requireNonNull(theSettings,
                "Settings are required");
    }

    /**
     * Analyzes the downstream package.
     *
     * @return the package report
     * @throws SourceUnavailableException if the downstream source root is
     *         missing or cannot be walked
     */
    public PackageReport analyze() {
        final AnalysisSettings.PackageSource downstream = settings.downstream();
        final AnalysisSettings.PackageSource upstream = settings.upstream();

        if (!Files.isDirectory(downstream.root())) {
            throw new SourceUnavailableException("Downstream source tree",
                    downstream.root());
        }
        if (!Files.isDirectory(upstream.root())) {
            LOG.warn("Upstream source tree not found at {}; its version"
                    + " cannot be resolved", upstream.root());
        }

        final String downstreamVersion = versionResolver.resolve(
                downstream.root(), downstream.distribution(),
                downstream.version());
        final String upstreamVersion = versionResolver.resolve(
                upstream.root(), upstream.distribution(), upstream.version());

        LOG.info("Analyzing {} {} for re-exports of {} {}",
                downstream.packageName(), downstreamVersion,
                upstream.packageName(), upstreamVersion);

        final List<EntryPointModule> entryPoints;
        try {
            entryPoints = locator.locate(downstream.root(),
                    downstream.packageName());
        } catch (final IOException e) {
            throw new SourceUnavailableException("Downstream source tree",
                    downstream.root(), e);
        } catch (final UncheckedIOException e) {
            throw new SourceUnavailableException("Downstream source tree",
                    downstream.root(), e.getCause());
        }

        if (entryPoints.isEmpty()) {
            LOG.warn("No public entry points found for package '{}' in {};"
                    + " the report will be empty",
                    downstream.packageName(), downstream.root());
        }

        final List<ModuleAnalysis> modules = analyzeAll(entryPoints);

        final PackageReport report = resolver.aggregate(
                new PackageReport.Metadata(
                        downstream.packageName(),
                        upstream.packageName(),
                        downstreamVersion,
                        upstreamVersion,
                        entryPoints.size()),
                modules);

        if (!entryPoints.isEmpty()
                && report.summary().modulesImportingUpstream() == 0) {
            LOG.warn("No entry point imports from '{}'; check that the"
                    + " upstream package name is right",
                    extractor.upstreamPackage());
        }
        if (report.summary().modulesWithErrors() > 0) {
            LOG.warn("{} of {} modules could not be analyzed",
                    report.summary().modulesWithErrors(), entryPoints.size());
        }

        return report;
    }

    /**
     * Analyzes the entry points concurrently, returning results in
     * submission order.
     */
    private List<ModuleAnalysis> analyzeAll(
            final List<EntryPointModule> entryPoints) {

        if (entryPoints.isEmpty()) {
            return List.of();
        }

        final int threads = Math.min(settings.workerThreads(),
                entryPoints.size());
        LOG.info("Analyzing {} entry points with {} worker(s)",
                entryPoints.size(), threads);

        final List<ModuleAnalysis> results = new ArrayList<>(
                entryPoints.size());
        final ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            final List<Future<ModuleAnalysis>> futures = new ArrayList<>(
                    entryPoints.size());
            for (final EntryPointModule module : entryPoints) {
                futures.add(executor.submit(
                        () -> extractor.analyze(module, resolver)));
            }

            for (int i = 0; i < futures.size(); i++) {
                final EntryPointModule module = entryPoints.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (final ExecutionException e) {
                    LOG.error("Unexpected error analyzing {}", module.file(),
                            e.getCause());
                    results.add(ModuleAnalysis.failure(module,
                            "Unexpected error: " + e.getCause()));
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new DomainException("Analysis interrupted",
                            "INTERRUPTED", e);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        return results;
    }

}
