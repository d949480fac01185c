package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The analysis of a single entry point module.
 *
 * <p>A failed analysis carries an error description and empty binding,
 * export and re-export collections. Maps keep insertion order so that the
 * serialized report follows source order.</p>
 *
 * @param modulePath the dotted module path, e.g. {@code langchain.tools}
 * @param file the init file relative to the source root
 * @param error the failure description, null when the module was analyzed
 * @param importsFromUpstream local name to upstream origin
 * @param declaredPublicExports the {@code __all__} names in source order
 * @param reexports the exported names that are upstream bindings
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ModuleAnalysis(
        String modulePath,
        String file,
        String error,
        Map<String, ImportOrigin> importsFromUpstream,
        List<String> declaredPublicExports,
        List<ReexportEntry> reexports
) {

    /**
     * Creates a new module analysis.
     *
     * @param modulePath the module path, never blank
     * @param file the relative init file, never blank
     * @param error the error description, may be null
     * @param importsFromUpstream the upstream bindings, never null
     * @param declaredPublicExports the public exports, never null
     * @param reexports the confirmed re-exports, never null
     */
    public ModuleAnalysis {
        Preconditions.requireNonBlank(modulePath, "Module path is required");
        Preconditions.requireNonBlank(file, "File is required");
        Preconditions.requireNonNull(importsFromUpstream,
                "Imports are required");
        Preconditions.requireNonNull(declaredPublicExports,
                "Exports are required");
        Preconditions.requireNonNull(reexports, "Re-exports are required");
        importsFromUpstream = Collections.unmodifiableMap(
                new LinkedHashMap<>(importsFromUpstream));
        declaredPublicExports = List.copyOf(declaredPublicExports);
        reexports = List.copyOf(reexports);
    }

    /**
     * Creates the analysis of a module that could not be read or parsed.
     *
     * @param module the module that failed
     * @param error the failure description, never blank
     * @return an analysis with the error set and everything else empty
     */
    public static ModuleAnalysis failure(final EntryPointModule module,
            final String error) {
        Preconditions.requireNonNull(module, "Module is required");
        Preconditions.requireNonBlank(error, "Error is required");
        return new ModuleAnalysis(module.modulePath(), module.relativeFile(),
                error, Map.of(), List.of(), List.of());
    }

    /**
     * Checks whether the module could not be analyzed.
     *
     * @return true if an error was recorded
     */
    public boolean failed() {
        return error != null;
    }

    /**
     * Checks whether the module forwards at least one upstream symbol.
     *
     * @return true if the module has re-exports
     */
    public boolean hasReexports() {
        return !reexports.isEmpty();
    }

    /**
     * Checks whether the module imports anything from the upstream package.
     *
     * @return true if at least one upstream binding was found
     */
    public boolean importsUpstream() {
        return !importsFromUpstream.isEmpty();
    }

    /**
     * Returns the re-exports keyed by local name, in export order.
     *
     * @return unmodifiable map of local name to upstream origin
     */
    public Map<String, ImportOrigin> reexportMap() {
        final Map<String, ImportOrigin> map = new LinkedHashMap<>();
        for (final ReexportEntry entry : reexports) {
            map.put(entry.localName(), entry.origin());
        }
        return Collections.unmodifiableMap(map);
    }

}
