package co.fanki.reexportmap.analysis.application;

import co.fanki.reexportmap.analysis.domain.ImportOrigin;
import co.fanki.reexportmap.analysis.domain.ModuleAnalysis;
import co.fanki.reexportmap.analysis.domain.PackageReport;
import co.fanki.reexportmap.analysis.domain.ReexportEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ReportWriter.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void whenWriting_givenNestedOutputPath_shouldCreateParentsAndWriteJson()
            throws IOException {
        final Path output = tempDir.resolve("reports/2024/import_mappings.json");

        new ReportWriter(mapper).write(report(), output);

        final String content = Files.readString(output);
        assertTrue(content.endsWith("}\n"));
        assertFalse(content.contains("\r"));
        final JsonNode json = mapper.readTree(content);
        assertEquals("Chain", json.get("modules").get(0).get("reexports")
                .get("LLMChain").get("original_name").asText());
        assertEquals(1, json.get("summary").get("total_reexports").asInt());
    }

    @Test
    void whenRendering_shouldIndentWithTwoSpacesPerLevel() {
        final String json = new ReportWriter(mapper).render(report());

        assertTrue(json.startsWith("{\n  \"metadata\" : {\n    "));
        assertTrue(json.contains("\"declared_public_exports\" : [\n"));
    }

    @Test
    void whenWriting_givenExistingFile_shouldOverwriteIt() throws IOException {
        final Path output = tempDir.resolve("import_mappings.json");
        Files.writeString(output, "stale");

        new ReportWriter(mapper).write(report(), output);

        assertEquals(new ReportWriter(mapper).render(report()),
                Files.readString(output));
    }

    private static PackageReport report() {
        final ImportOrigin origin = new ImportOrigin("langchain_core.chains",
                "Chain");
        final ModuleAnalysis module = new ModuleAnalysis("langchain",
                "langchain/__init__.py", null, Map.of("LLMChain", origin),
                List.of("LLMChain"),
                List.of(new ReexportEntry("LLMChain", origin)));
        return new PackageReport(
                new PackageReport.Metadata("langchain", "langchain_core",
                        "0.3.7", "0.3.15", 1),
                List.of(module),
                new PackageReport.Summary(1, 1, 0, 1));
    }

}
