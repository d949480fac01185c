package co.fanki.reexportmap.analysis.application;

import co.fanki.reexportmap.analysis.domain.PackageReport;
import co.fanki.reexportmap.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link PackageReport} as pretty-printed JSON and logs its
 * summary.
 *
 * <p>Line endings are always {@code \n}, so the same report produces the
 * same bytes on every platform.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReportWriter.class);

    private final ObjectWriter writer;

    /**
     * Creates a report writer using the given mapper.
     *
     * @param objectMapper the Jackson mapper
     */
    public ReportWriter(final ObjectMapper objectMapper) {
        Preconditions.requireNonNull(objectMapper, "Object mapper is required");
        final DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentObjectsWith(indenter);
        printer.indentArraysWith(indenter);
        writer = objectMapper.writer(printer);
    }

    /**
     * Renders the report as JSON text.
     *
     * @param report the report
     * @return the JSON text, ending with a newline
     */
    public String render(final PackageReport report) {
        Preconditions.requireNonNull(report, "Report is required");
        try {
            return writer.writeValueAsString(report.toJson()) + "\n";
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report", e);
        }
    }

    /**
     * Writes the report to a file, creating parent directories as needed.
     *
     * @param report the report
     * @param output the target file
     * @throws IOException if the file cannot be written
     */
    public void write(final PackageReport report, final Path output)
            throws IOException {
        Preconditions.requireNonNull(output, "Output path is required");

        final String json = render(report);
        final Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, json, StandardCharsets.UTF_8);

        final PackageReport.Summary summary = report.summary();
        LOG.info("Report written to {}", output);
        LOG.info("Summary: {} modules scanned, {} re-exports from {} in {}"
                        + " modules, {} modules with errors",
                report.metadata().totalModulesScanned(),
                summary.totalReexports(),
                report.metadata().upstreamPackage(),
                summary.modulesWithReexports(),
                summary.modulesWithErrors());
    }

}
