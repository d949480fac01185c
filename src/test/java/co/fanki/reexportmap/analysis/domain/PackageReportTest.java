package co.fanki.reexportmap.analysis.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for PackageReport.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class PackageReportTest {

    @Test
    void whenSerializing_shouldWriteSectionsInFixedOrder() {
        final ObjectNode json = report().toJson();

        assertEquals(List.of("metadata", "modules", "summary"),
                fieldNames(json));
        assertEquals(List.of("downstream_package", "upstream_package",
                "downstream_version", "upstream_version",
                "total_modules_scanned"), fieldNames(json.get("metadata")));
        assertEquals(List.of("module_path", "file", "error",
                "imports_from_upstream", "declared_public_exports",
                "reexports"), fieldNames(json.get("modules").get(0)));
        assertEquals(List.of("total_reexports", "modules_with_reexports",
                "modules_with_errors", "modules_importing_upstream"),
                fieldNames(json.get("summary")));
    }

    @Test
    void whenSerializing_givenReexport_shouldWriteOriginAndAlias() {
        final JsonNode module = report().toJson().get("modules").get(0);

        assertTrue(module.get("error").isNull());
        final JsonNode reexport = module.get("reexports").get("LLMChain");
        assertEquals("langchain_core.chains",
                reexport.get("origin_module").asText());
        assertEquals("Chain", reexport.get("original_name").asText());
        assertEquals(List.of("LLMChain", "PromptTemplate"),
                fieldNames(module.get("imports_from_upstream")));
        assertEquals("helper",
                module.get("declared_public_exports").get(1).asText());
    }

    @Test
    void whenSerializing_givenFailedModule_shouldWriteErrorAndEmptySections() {
        final JsonNode module = report().toJson().get("modules").get(1);

        assertEquals("SyntaxError: invalid syntax (line 3, column 7)",
                module.get("error").asText());
        assertEquals(0, module.get("imports_from_upstream").size());
        assertTrue(module.get("declared_public_exports").isArray());
        assertEquals(0, module.get("reexports").size());
    }

    @Test
    void whenSerializing_shouldWriteMetadataAndSummaryValues() {
        final ObjectNode json = report().toJson();

        assertEquals("langchain",
                json.get("metadata").get("downstream_package").asText());
        assertEquals("latest",
                json.get("metadata").get("upstream_version").asText());
        assertEquals(2,
                json.get("metadata").get("total_modules_scanned").asInt());
        assertEquals(1, json.get("summary").get("total_reexports").asInt());
        assertEquals(1,
                json.get("summary").get("modules_with_errors").asInt());
    }

    private static PackageReport report() {
        final Map<String, ImportOrigin> imports = new LinkedHashMap<>();
        imports.put("LLMChain",
                new ImportOrigin("langchain_core.chains", "Chain"));
        imports.put("PromptTemplate",
                new ImportOrigin("langchain_core.prompts", "PromptTemplate"));

        final ModuleAnalysis root = new ModuleAnalysis("langchain",
                "langchain/__init__.py", null, imports,
                List.of("LLMChain", "helper"),
                List.of(new ReexportEntry("LLMChain",
                        imports.get("LLMChain"))));
        final ModuleAnalysis broken = ModuleAnalysis.failure(
                new EntryPointModule("langchain", List.of("agents"),
                        Path.of("langchain/agents/__init__.py")),
                "SyntaxError: invalid syntax (line 3, column 7)");

        return new PackageReport(
                new PackageReport.Metadata("langchain", "langchain_core",
                        "0.3.7", "latest", 2),
                List.of(root, broken),
                new PackageReport.Summary(1, 1, 1, 1));
    }

    private static List<String> fieldNames(final JsonNode node) {
        final List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

}
