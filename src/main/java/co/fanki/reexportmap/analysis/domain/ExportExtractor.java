package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Abstract strategy for extracting upstream imports and public exports
 * from the source of an entry point module.
 *
 * <p>Subclasses implement the language-specific {@link #extract(String)};
 * this class provides the template method {@link #analyze} that reads the
 * module, extracts its facts and resolves its re-exports, turning read and
 * parse failures into a failed {@link ModuleAnalysis} so that one broken
 * module never stops the others.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class ExportExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExportExtractor.class);

    private final String upstreamPackage;

    /**
     * Creates an extractor for imports from the given upstream package.
     *
     * @param theUpstreamPackage the upstream package identifier, e.g.
     *        "langchain_core"
     */
    protected ExportExtractor(final String theUpstreamPackage) {
        upstreamPackage = Preconditions.requireNonBlank(theUpstreamPackage,
                "Upstream package is required");
    }

    /**
     * Returns the language identifier for this extractor.
     *
     * @return the language name, e.g. "python"
     */
    public abstract String language();

    /**
     * Extracts the upstream import bindings and the public export list
     * from a module's source text.
     *
     * <p>Implementations must be stateless so that modules can be
     * extracted concurrently.</p>
     *
     * @param source the module source text
     * @return the extracted bindings and exports
     * @throws SourceSyntaxException if the source cannot be parsed
     */
    public abstract ExtractionResult extract(String source);

    /**
     * Returns the upstream package identifier imports are matched against.
     *
     * @return the upstream package identifier
     */
    public String upstreamPackage() {
        return upstreamPackage;
    }

    /**
     * Checks whether a module name belongs to the upstream package.
     *
     * <p>Matches the package itself and its submodules, but not a
     * different package that merely shares the prefix: with upstream
     * {@code langchain_core}, {@code langchain_core.tools} matches and
     * {@code langchain_core_extra} does not.</p>
     *
     * @param module the dotted module name
     * @return true if the module is the upstream package or inside it
     */
    public boolean isUpstream(final String module) {
        return module.equals(upstreamPackage)
                || module.startsWith(upstreamPackage + ".");
    }

    /**
     * Reads, extracts and resolves one entry point module.
     *
     * @param module the entry point to analyze
     * @param resolver the resolver that computes the re-exports
     * @return the module analysis, failed if the module could not be read
     *         or parsed
     */
    public ModuleAnalysis analyze(final EntryPointModule module,
            final ReexportResolver resolver) {
        Preconditions.requireNonNull(module, "Module is required");
        Preconditions.requireNonNull(resolver, "Resolver is required");

        LOG.debug("Analyzing: {}", module.file());

        final String source;
        try {
            source = Files.readString(module.file());
        } catch (final IOException e) {
            LOG.warn("Error reading {}: {}", module.file(), e.toString());
            return ModuleAnalysis.failure(module,
                    "Cannot read module: " + e);
        }

        try {
            return resolver.resolve(module, extract(source));
        } catch (final SourceSyntaxException e) {
            LOG.warn("Error analyzing {}: {}", module.file(), e.getMessage());
            return ModuleAnalysis.failure(module,
                    "SyntaxError: " + e.getMessage());
        }
    }

}
