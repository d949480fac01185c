package co.fanki.reexportmap.cli;

import co.fanki.reexportmap.analysis.application.ReexportAnalysisService;
import co.fanki.reexportmap.analysis.application.ReportWriter;
import co.fanki.reexportmap.analysis.domain.PackageReport;
import co.fanki.reexportmap.analysis.domain.SourceUnavailableException;
import co.fanki.reexportmap.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs one analysis at startup and writes the report.
 *
 * <p>The exit code is 0 when a report was written, even if some modules
 * failed to parse. It is 1 when the downstream source is missing or the
 * report cannot be written. Disabled with
 * {@code reexport.runner.enabled=false}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "reexport.runner.enabled", havingValue = "true",
        matchIfMissing = true)
public class ReexportMapperRunner implements CommandLineRunner,
        ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ReexportMapperRunner.class);

    /** Exit code for a run that could not produce a report. */
    public static final int FAILURE = 1;

    private final ReexportAnalysisService analysisService;
    private final ReportWriter reportWriter;
    private final Path output;

    private int exitCode;

    /**
     * Creates a new ReexportMapperRunner.
     *
     * @param theAnalysisService the analysis service
     * @param theReportWriter the report writer
     * @param theOutput the report file path
     */
    public ReexportMapperRunner(
            final ReexportAnalysisService theAnalysisService,
            final ReportWriter theReportWriter,
            @Value("${reexport.output:import_mappings.json}")
            final String theOutput) {
        analysisService = Preconditions.requireNonNull(theAnalysisService,
                "Analysis service is required");
        reportWriter = Preconditions.requireNonNull(theReportWriter,
                "Report writer is required");
        Preconditions.requireNonBlank(theOutput,
                "reexport.output must not be blank");
        output = Path.of(theOutput);
    }

    @Override
    public void run(final String... args) {
        final PackageReport report;
        try {
            report = analysisService.analyze();
        } catch (final SourceUnavailableException e) {
            LOG.error("Cannot analyze [{}]: {}", e.getErrorCode(),
                    e.getMessage());
            exitCode = FAILURE;
            return;
        }

        try {
            reportWriter.write(report, output);
        } catch (final IOException e) {
            LOG.error("Error writing report to {}", output, e);
            exitCode = FAILURE;
            return;
        }
        exitCode = 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
