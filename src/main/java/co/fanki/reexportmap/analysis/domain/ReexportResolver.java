package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns extracted facts into re-exports and module results into a package
 * report.
 *
 * <p>A name is a re-export when it is both declared in {@code __all__} and
 * bound by an upstream import. Matching is done on the local name, which
 * is the name documentation readers actually import.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReexportResolver {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReexportResolver.class);

    private final DuplicateBindingPolicy policy;

    /**
     * Creates a resolver using the given duplicate binding policy.
     *
     * @param thePolicy the policy for names imported more than once
     */
    public ReexportResolver(final DuplicateBindingPolicy thePolicy) {
        policy = Preconditions.requireNonNull(thePolicy,
                "Duplicate binding policy is required");
    }

    /**
     * Resolves the re-exports of a single module.
     *
     * @param module the analyzed entry point
     * @param extraction the facts extracted from its source
     * @return the module analysis, or a failure if the policy rejects a
     *         duplicate binding
     */
    public ModuleAnalysis resolve(final EntryPointModule module,
            final ExtractionResult extraction) {
        Preconditions.requireNonNull(module, "Module is required");
        Preconditions.requireNonNull(extraction, "Extraction is required");

        final Map<String, ImportOrigin> imports = new LinkedHashMap<>();
        for (final ImportBinding binding : extraction.bindings()) {
            final ImportOrigin previous = imports.get(binding.localName());
            if (previous == null) {
                imports.put(binding.localName(), binding.origin());
                continue;
            }
            switch (policy) {
                case LAST_WINS -> imports.put(binding.localName(),
                        binding.origin());
                case FIRST_WINS -> LOG.debug("Keeping first binding of {}"
                        + " in {}", binding.localName(), module.modulePath());
                case FAIL -> {
                    if (!previous.equals(binding.origin())) {
                        return ModuleAnalysis.failure(module,
                                "Conflicting imports for '"
                                        + binding.localName() + "': "
                                        + describe(previous) + " and "
                                        + describe(binding.origin()));
                    }
                }
                default -> throw new IllegalStateException(
                        "Unhandled policy: " + policy);
            }
        }

        final Map<String, ReexportEntry> reexports = new LinkedHashMap<>();
        for (final String name : extraction.exports()) {
            final ImportOrigin origin = imports.get(name);
            if (origin != null && !reexports.containsKey(name)) {
                reexports.put(name, new ReexportEntry(name, origin));
            }
        }

        return new ModuleAnalysis(module.modulePath(), module.relativeFile(),
                null, imports, extraction.exports(),
                new ArrayList<>(reexports.values()));
    }

    /**
     * Sorts the module analyses by module path and computes the summary.
     *
     * @param metadata the package metadata
     * @param modules the module analyses in any order
     * @return the package report
     */
    public PackageReport aggregate(final PackageReport.Metadata metadata,
            final List<ModuleAnalysis> modules) {
        Preconditions.requireNonNull(metadata, "Metadata is required");
        Preconditions.requireNonNull(modules, "Modules are required");

        final List<ModuleAnalysis> sorted = new ArrayList<>(modules);
        sorted.sort((a, b) -> ModulePathOrder.INSTANCE.compare(
                a.modulePath(), b.modulePath()));

        int totalReexports = 0;
        int modulesWithReexports = 0;
        int modulesWithErrors = 0;
        int modulesImportingUpstream = 0;
        for (final ModuleAnalysis module : sorted) {
            totalReexports += module.reexports().size();
            if (module.hasReexports()) {
                modulesWithReexports++;
            }
            if (module.failed()) {
                modulesWithErrors++;
            }
            if (module.importsUpstream()) {
                modulesImportingUpstream++;
            }
        }

        return new PackageReport(metadata, sorted,
                new PackageReport.Summary(totalReexports,
                        modulesWithReexports, modulesWithErrors,
                        modulesImportingUpstream));
    }

    private static String describe(final ImportOrigin origin) {
        return origin.originModule() + "." + origin.originalName();
    }

}
