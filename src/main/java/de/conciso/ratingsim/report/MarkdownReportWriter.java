package de.conciso.ratingsim.report;

import de.conciso.ratingsim.model.AccuracyMetrics;
import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.PopulationSlice;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.model.SimulationResult;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
public class MarkdownReportWriter {

    private static final DateTimeFormatter DISPLAY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    public void write(ReportData data, Path path) throws IOException {
        Files.writeString(path, render(data), StandardCharsets.UTF_8);
    }

    String render(ReportData data) {
        SimulationResult result = data.result();
        SimulationConfig config = result.config();
        StringBuilder sb = new StringBuilder();

        sb.append("# RatingSim Report — ").append(DISPLAY_FORMAT.format(data.timestamp())).append("\n\n");

        // Konfiguration
        sb.append("## Konfiguration\n\n");
        sb.append("| Parameter | Wert |\n|---|---|\n");
        if (data.runLabel() != null && !data.runLabel().isBlank()) {
            sb.append("| Run-Label | ").append(data.runLabel()).append(" |\n");
        }
        sb.append("| Entitäten (N) | ").append(config.populationSize()).append(" |\n");
        sb.append("| Attribute (K) | ").append(config.attributeCount()).append(" |\n");
        sb.append(String.format("| Attribut-Mittelwert / -σ | %s / %s |%n", config.attributeMean(), config.attributeSd()));
        sb.append("| Rauschmodelle | ").append(config.regimes().stream()
                .map(NoiseRegime::name).collect(Collectors.joining(", "))).append(" |\n");
        sb.append("| Mixed-Gewicht | ").append(config.mixedWeight()).append(" |\n");
        sb.append("| Seed | ").append(config.seed()).append(" |\n");
        sb.append("| Läufe | ").append(data.runs()).append(" |\n\n");

        sb.append("Rangfehler = wahrer Rang − geschätzter Rang (Durchschnittsränge bei Gleichstand), ")
          .append("σ = Populations-Standardabweichung, r = Pearson-Korrelation von ln(Schätzung) und ln(Wahrheit). ")
          .append("Slices werden immer über den wahren Rang gebildet.\n\n");

        sb.append("## Ergebnisse\n\n");
        for (TrueRatingDefinition definition : config.definitions()) {
            sb.append("### Wahres Rating: ").append(definition.label()).append("\n\n");
            sb.append("| Rauschen | Regel |");
            for (PopulationSlice slice : config.slices()) {
                sb.append(" σ Rangfehler (").append(slice.name()).append(") | r (").append(slice.name()).append(") |");
            }
            sb.append("\n|---|---|");
            sb.append("---|---|".repeat(config.slices().size()));
            sb.append("\n");
            for (NoiseRegime regime : config.regimes()) {
                for (CombinationRule rule : config.rules()) {
                    sb.append("| ").append(regime.name()).append(" | ").append(rule.label()).append(" |");
                    for (PopulationSlice slice : config.slices()) {
                        AccuracyMetrics m = result.table().get(definition, regime, rule, slice);
                        sb.append(" ").append(fmt(m.rankErrorSd(), "%.1f"))
                          .append(" | ").append(fmt(m.logCorrelation(), "%.3f")).append(" |");
                    }
                    sb.append("\n");
                }
            }
            sb.append("\n");
        }

        if (!data.replications().isEmpty()) {
            sb.append("## Wiederholungen (").append(data.runs()).append(" Läufe)\n\n");
            sb.append("| Wahrheit | Rauschen | Regel | Slice | Ø σ Rangfehler | ±σ | Ø r | ±σ |\n");
            sb.append("|---|---|---|---|---|---|---|---|\n");
            for (AggregatedAccuracy a : data.replications()) {
                sb.append(String.format("| %s | %s | %s | %s | %s | %s | %s | %s |%n",
                        a.key().definition().label(), a.key().regime().name(),
                        a.key().rule().label(), a.key().slice().name(),
                        fmt(a.avgRankErrorSd(), "%.1f"), fmt(a.stdDevRankErrorSd(), "%.1f"),
                        fmt(a.avgLogCorrelation(), "%.3f"), fmt(a.stdDevLogCorrelation(), "%.3f")));
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    private String fmt(double v, String pattern) {
        return Double.isFinite(v) ? String.format(Locale.ROOT, pattern, v) : "—";
    }
}
