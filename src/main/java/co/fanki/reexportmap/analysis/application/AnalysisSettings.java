package co.fanki.reexportmap.analysis.application;

import co.fanki.reexportmap.shared.Preconditions;

import java.nio.file.Path;

/**
 * What to analyze and how.
 *
 * @param downstream the package whose entry points are analyzed
 * @param upstream the package whose symbols are looked for
 * @param workerThreads the number of modules analyzed concurrently
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisSettings(
        PackageSource downstream,
        PackageSource upstream,
        int workerThreads
) {

    /**
     * Where an installed package lives and how to find its version.
     *
     * @param root the directory holding the package directory
     * @param packageName the import name, e.g. "langchain_core"
     * @param distribution the distribution name used for version lookup
     * @param version an explicit version, blank to look it up
     */
    public record PackageSource(
            Path root,
            String packageName,
            String distribution,
            String version) {

        /**
         * Creates a new package source.
         *
         * @param root the source root, never null
         * @param packageName the package name, never blank
         * @param distribution the distribution name, defaults to the
         *        package name when blank
         * @param version the explicit version, may be blank
         */
        public PackageSource {
            Preconditions.requireNonNull(root, "Package root is required");
            Preconditions.requireNonBlank(packageName,
                    "Package name is required");
            distribution = Preconditions.defaultIfBlank(distribution,
                    packageName);
            version = version == null ? "" : version.trim();
        }
    }

    /**
     * Creates new analysis settings.
     *
     * @param downstream the downstream package, never null
     * @param upstream the upstream package, never null
     * @param workerThreads the worker pool size, must be positive
     */
    public AnalysisSettings {
        Preconditions.requireNonNull(downstream,
                "Downstream package is required");
        Preconditions.requireNonNull(upstream,
                "Upstream package is required");
        Preconditions.requirePositive(workerThreads,
                "Worker threads must be positive");
    }

}
