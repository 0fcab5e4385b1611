package de.conciso.ratingsim.report;

import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;

@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String outputPath;
    private final String runLabel;
    private final boolean includeScatter;

    private final JsonReportWriter jsonReportWriter;
    private final MarkdownReportWriter markdownReportWriter;

    public ReportWriter(
            @Value("${ratingsim.output.path:./reports}") String outputPath,
            @Value("${ratingsim.run.label:}") String runLabel,
            @Value("${ratingsim.report.include-scatter:false}") boolean includeScatter,
            JsonReportWriter jsonReportWriter,
            MarkdownReportWriter markdownReportWriter
    ) {
        this.outputPath = outputPath;
        this.runLabel = runLabel;
        this.includeScatter = includeScatter;
        this.jsonReportWriter = jsonReportWriter;
        this.markdownReportWriter = markdownReportWriter;
    }

    /**
     * Writes {@code <output>/<label>/<label>.json} and {@code .md}. A failed write is
     * logged and reported as empty; the computed result is not affected.
     */
    public Optional<Path> write(SimulationResult result, List<AggregatedAccuracy> replications, int runs) {
        ReportData data = ReportData.of(result, replications, runLabel, runs, includeScatter);

        String baseName = (runLabel != null && !runLabel.isBlank())
                ? runLabel
                : "ratingsim_" + LocalDateTime.now().format(TIMESTAMP_FORMAT);

        try {
            Path dir = Path.of(outputPath).resolve(baseName);
            Files.createDirectories(dir);

            Path jsonPath = dir.resolve(baseName + ".json");
            jsonReportWriter.write(data, jsonPath);
            log.info("JSON report written: {}", jsonPath);

            Path mdPath = dir.resolve(baseName + ".md");
            markdownReportWriter.write(data, mdPath);
            log.info("Markdown report written: {}", mdPath);

            return Optional.of(dir);
        } catch (IOException e) {
            log.error("Failed to write reports", e);
            return Optional.empty();
        }
    }
}
