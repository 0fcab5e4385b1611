package de.conciso.ratingsim.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Accuracy cells addressable by (definition, regime, rule, slice), in evaluation order.
 */
public record EvaluationTable(Map<EvaluationKey, AccuracyMetrics> cells) {

    public EvaluationTable {
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }

    public Optional<AccuracyMetrics> find(EvaluationKey key) {
        return Optional.ofNullable(cells.get(key));
    }

    public AccuracyMetrics get(TrueRatingDefinition definition, NoiseRegime regime,
                               CombinationRule rule, PopulationSlice slice) {
        EvaluationKey key = new EvaluationKey(definition, regime, rule, slice);
        return find(key).orElseThrow(() -> new IllegalArgumentException("No evaluation cell for " + key));
    }

    public int size() {
        return cells.size();
    }
}
