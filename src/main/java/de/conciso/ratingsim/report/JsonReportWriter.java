package de.conciso.ratingsim.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.conciso.ratingsim.model.AccuracyMetrics;
import de.conciso.ratingsim.model.AggregatedAccuracy;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.EvaluationKey;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.PopulationSlice;
import de.conciso.ratingsim.model.ScatterPoint;
import de.conciso.ratingsim.model.SimulationConfig;
import de.conciso.ratingsim.model.SimulationResult;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(ReportData data, Path path) throws IOException {
        objectMapper.writeValue(path.toFile(), toMap(data));
    }

    Map<String, Object> toMap(ReportData data) {
        SimulationResult result = data.result();
        SimulationConfig config = result.config();

        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", data.timestamp().toString());

        Map<String, Object> configuration = new LinkedHashMap<>();
        configuration.put("runLabel", data.runLabel());
        configuration.put("populationSize", config.populationSize());
        configuration.put("attributeCount", config.attributeCount());
        configuration.put("attributeMean", config.attributeMean());
        configuration.put("attributeSd", config.attributeSd());
        configuration.put("noiseRegimes", config.regimes().stream().map(NoiseRegime::name).toList());
        configuration.put("definitions", config.definitions().stream().map(TrueRatingDefinition::label).toList());
        configuration.put("mixedWeight", config.mixedWeight());
        configuration.put("rules", config.rules().stream().map(CombinationRule::label).toList());
        configuration.put("slices", config.slices().stream().map(PopulationSlice::name).toList());
        configuration.put("seed", config.seed());
        configuration.put("runs", data.runs());
        json.put("configuration", configuration);

        List<Map<String, Object>> cells = new ArrayList<>();
        result.table().cells().forEach((key, metrics) -> cells.add(cellToMap(key, metrics)));
        json.put("results", cells);

        if (!data.replications().isEmpty()) {
            json.put("replications", data.replications().stream().map(this::replicationToMap).toList());
        }

        if (data.includeScatter()) {
            List<Map<String, Object>> scatter = new ArrayList<>();
            for (EvaluationKey key : result.table().cells().keySet()) {
                Map<String, Object> series = keyToMap(key);
                series.put("points", result.scatter(key.definition(), key.regime(), key.rule(), key.slice())
                        .stream().map(this::pointToMap).toList());
                scatter.add(series);
            }
            json.put("scatter", scatter);
        }
        return json;
    }

    private Map<String, Object> cellToMap(EvaluationKey key, AccuracyMetrics metrics) {
        Map<String, Object> m = keyToMap(key);
        m.put("sliceSize", metrics.sliceSize());
        m.put("rankErrorSd", r(metrics.rankErrorSd()));
        m.put("logCorrelation", r(metrics.logCorrelation()));
        return m;
    }

    private Map<String, Object> replicationToMap(AggregatedAccuracy a) {
        Map<String, Object> m = keyToMap(a.key());
        m.put("runs", a.runs());
        m.put("avgRankErrorSd", r(a.avgRankErrorSd()));
        m.put("stdDevRankErrorSd", r(a.stdDevRankErrorSd()));
        m.put("avgLogCorrelation", r(a.avgLogCorrelation()));
        m.put("stdDevLogCorrelation", r(a.stdDevLogCorrelation()));
        return m;
    }

    private Map<String, Object> keyToMap(EvaluationKey key) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("definition", key.definition().label());
        m.put("regime", key.regime().name());
        m.put("rule", key.rule().label());
        m.put("slice", key.slice().name());
        return m;
    }

    private Map<String, Object> pointToMap(ScatterPoint p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("entity", p.entity());
        m.put("logTruth", p.logTruth());
        m.put("logEstimate", p.logEstimate());
        return m;
    }

    // NaN (degenerate slice) becomes null
    private Double r(double v) {
        if (!Double.isFinite(v)) return null;
        return Math.round(v * 10000.0) / 10000.0;
    }
}
