package de.conciso.ratingsim.runner;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.report.JsonReportWriter;
import de.conciso.ratingsim.report.MarkdownReportWriter;
import de.conciso.ratingsim.report.ReportWriter;
import de.conciso.ratingsim.service.AccuracyEvaluator;
import de.conciso.ratingsim.service.Aggregator;
import de.conciso.ratingsim.service.GroundTruthComposer;
import de.conciso.ratingsim.service.LogNormalParameterizer;
import de.conciso.ratingsim.service.NoiseInjector;
import de.conciso.ratingsim.service.PopulationGenerator;
import de.conciso.ratingsim.service.SimulationService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SimulationRunnerTest {

    @TempDir
    Path outputDir;

    @Test
    void runSimulatesAndWritesReports() {
        SimulationConfig config = SimulationConfig.reference().withPopulationSize(400);

        new SimulationRunner(newService(), newReportWriter(), config, 2).run();

        assertThat(outputDir.resolve("runner").resolve("runner.json")).exists();
        assertThat(outputDir.resolve("runner").resolve("runner.md")).content().contains("Wiederholungen");
    }

    @Test
    void nonPositiveRunCountIsRejectedBeforeAnythingRuns() {
        SimulationConfig config = SimulationConfig.reference().withPopulationSize(400);

        assertThatThrownBy(() -> new SimulationRunner(newService(), newReportWriter(), config, 0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("runs");
        assertThatThrownBy(() -> new SimulationRunner(newService(), newReportWriter(), config, -3))
                .isInstanceOf(InvalidParameterException.class);
        assertThat(outputDir).isEmptyDirectory();
    }

    private static SimulationService newService() {
        LogNormalParameterizer parameterizer = new LogNormalParameterizer();
        return new SimulationService(new PopulationGenerator(parameterizer),
                new GroundTruthComposer(), new NoiseInjector(parameterizer), new Aggregator(), new AccuracyEvaluator());
    }

    private ReportWriter newReportWriter() {
        return new ReportWriter(outputDir.toString(), "runner", false,
                new JsonReportWriter(), new MarkdownReportWriter());
    }
}
