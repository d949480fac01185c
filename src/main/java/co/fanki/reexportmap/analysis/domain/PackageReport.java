package co.fanki.reexportmap.analysis.domain;

import co.fanki.reexportmap.shared.Preconditions;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * The re-export map of a whole downstream package.
 *
 * <p>Modules are kept in module path order. The JSON form produced by
 * {@link #toJson()} has a fixed field order and contains no timestamps or
 * absolute paths, so two runs over the same trees produce identical
 * bytes.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class PackageReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Describes the analyzed packages.
     *
     * @param downstreamPackage the downstream package name
     * @param upstreamPackage the upstream package identifier
     * @param downstreamVersion the downstream version
     * @param upstreamVersion the upstream version
     * @param totalModulesScanned the number of entry points analyzed
     */
    public record Metadata(
            String downstreamPackage,
            String upstreamPackage,
            String downstreamVersion,
            String upstreamVersion,
            int totalModulesScanned) {}

    /**
     * Counters computed over all modules.
     *
     * @param totalReexports the number of re-export entries
     * @param modulesWithReexports modules with at least one re-export
     * @param modulesWithErrors modules that could not be analyzed
     * @param modulesImportingUpstream modules with at least one upstream
     *        import
     */
    public record Summary(
            int totalReexports,
            int modulesWithReexports,
            int modulesWithErrors,
            int modulesImportingUpstream) {}

    private final Metadata metadata;

    private final List<ModuleAnalysis> modules;

    private final Summary summary;

    /**
     * Creates a new report.
     *
     * <p>Use {@link ReexportResolver#aggregate} to compute the summary and
     * module order.</p>
     *
     * @param theMetadata the package metadata, never null
     * @param theModules the module analyses in report order, never null
     * @param theSummary the summary counters, never null
     */
    public PackageReport(final Metadata theMetadata,
            final List<ModuleAnalysis> theModules,
            final Summary theSummary) {
        metadata = Preconditions.requireNonNull(theMetadata,
                "Metadata is required");
        modules = List.copyOf(Preconditions.requireNonNull(theModules,
                "Modules are required"));
        summary = Preconditions.requireNonNull(theSummary,
                "Summary is required");
    }

    /**
     * Returns the package metadata.
     *
     * @return the metadata
     */
    public Metadata metadata() {
        return metadata;
    }

    /**
     * Returns the module analyses in module path order.
     *
     * @return unmodifiable list of module analyses
     */
    public List<ModuleAnalysis> modules() {
        return modules;
    }

    /**
     * Returns the summary counters.
     *
     * @return the summary
     */
    public Summary summary() {
        return summary;
    }

    /**
     * Builds the JSON tree of this report.
     *
     * @return the root JSON object
     */
    public ObjectNode toJson() {
        final ObjectNode root = MAPPER.createObjectNode();

        final ObjectNode metadataObj = MAPPER.createObjectNode();
        metadataObj.put("downstream_package", metadata.downstreamPackage());
        metadataObj.put("upstream_package", metadata.upstreamPackage());
        metadataObj.put("downstream_version", metadata.downstreamVersion());
        metadataObj.put("upstream_version", metadata.upstreamVersion());
        metadataObj.put("total_modules_scanned",
                metadata.totalModulesScanned());
        root.set("metadata", metadataObj);

        final ArrayNode modulesArray = MAPPER.createArrayNode();
        for (final ModuleAnalysis module : modules) {
            final ObjectNode moduleObj = MAPPER.createObjectNode();
            moduleObj.put("module_path", module.modulePath());
            moduleObj.put("file", module.file());
            if (module.error() != null) {
                moduleObj.put("error", module.error());
            } else {
                moduleObj.putNull("error");
            }
            moduleObj.set("imports_from_upstream",
                    originsToJson(module.importsFromUpstream()));

            final ArrayNode exportsArray = MAPPER.createArrayNode();
            for (final String name : module.declaredPublicExports()) {
                exportsArray.add(name);
            }
            moduleObj.set("declared_public_exports", exportsArray);
            moduleObj.set("reexports", originsToJson(module.reexportMap()));
            modulesArray.add(moduleObj);
        }
        root.set("modules", modulesArray);

        final ObjectNode summaryObj = MAPPER.createObjectNode();
        summaryObj.put("total_reexports", summary.totalReexports());
        summaryObj.put("modules_with_reexports",
                summary.modulesWithReexports());
        summaryObj.put("modules_with_errors", summary.modulesWithErrors());
        summaryObj.put("modules_importing_upstream",
                summary.modulesImportingUpstream());
        root.set("summary", summaryObj);

        return root;
    }

    private static ObjectNode originsToJson(
            final Map<String, ImportOrigin> origins) {
        final ObjectNode obj = MAPPER.createObjectNode();
        for (final Map.Entry<String, ImportOrigin> entry
                : origins.entrySet()) {
            final ObjectNode originObj = MAPPER.createObjectNode();
            originObj.put("origin_module", entry.getValue().originModule());
            originObj.put("original_name", entry.getValue().originalName());
            obj.set(entry.getKey(), originObj);
        }
        return obj;
    }

}
