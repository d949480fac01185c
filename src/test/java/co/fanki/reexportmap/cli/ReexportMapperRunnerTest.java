package co.fanki.reexportmap.cli;

import co.fanki.reexportmap.analysis.application.ReexportAnalysisService;
import co.fanki.reexportmap.analysis.application.ReportWriter;
import co.fanki.reexportmap.analysis.domain.PackageReport;
import co.fanki.reexportmap.analysis.domain.SourceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Unit tests for ReexportMapperRunner.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ReexportMapperRunnerTest {

    private static final String OUTPUT = "out/import_mappings.json";

    private ReexportAnalysisService analysisService;
    private ReportWriter reportWriter;
    private ReexportMapperRunner runner;

    @BeforeEach
    void setUp() {
        analysisService = createMock(ReexportAnalysisService.class);
        reportWriter = createMock(ReportWriter.class);
        runner = new ReexportMapperRunner(analysisService, reportWriter,
                OUTPUT);
    }

    @Test
    void whenRunning_givenSuccessfulAnalysis_shouldWriteReportAndExitZero()
            throws IOException {
        final PackageReport report = emptyReport();
        expect(analysisService.analyze()).andReturn(report);
        reportWriter.write(report, Path.of(OUTPUT));
        expectLastCall();
        replay(analysisService, reportWriter);

        runner.run();

        verify(analysisService, reportWriter);
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void whenRunning_givenMissingDownstreamSource_shouldExitOneWithoutWriting() {
        expect(analysisService.analyze()).andThrow(
                new SourceUnavailableException("Downstream source tree",
                        Path.of("/nowhere")));
        replay(analysisService, reportWriter);

        runner.run();

        verify(analysisService, reportWriter);
        assertEquals(ReexportMapperRunner.FAILURE, runner.getExitCode());
    }

    @Test
    void whenRunning_givenUnwritableOutput_shouldExitOne() throws IOException {
        final PackageReport report = emptyReport();
        expect(analysisService.analyze()).andReturn(report);
        reportWriter.write(report, Path.of(OUTPUT));
        expectLastCall().andThrow(new IOException("Read-only file system"));
        replay(analysisService, reportWriter);

        runner.run();

        verify(analysisService, reportWriter);
        assertEquals(ReexportMapperRunner.FAILURE, runner.getExitCode());
    }

    private static PackageReport emptyReport() {
        return new PackageReport(
                new PackageReport.Metadata("langchain", "langchain_core",
                        "latest", "latest", 0),
                List.of(),
                new PackageReport.Summary(0, 0, 0, 0));
    }

}
