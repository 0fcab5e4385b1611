package de.conciso.ratingsim.service;

import de.conciso.ratingsim.model.AttributeMatrix;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.EstimateKey;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.RatingSeries;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class Aggregator {

    public RatingSeries aggregate(AttributeMatrix observations, CombinationRule rule) {
        double[] estimates = new double[observations.entities()];
        for (int i = 0; i < estimates.length; i++) {
            estimates[i] = rule.combine(observations.row(i));
        }
        return RatingSeries.of(estimates);
    }

    /**
     * One estimate per (regime, rule) pair.
     */
    public Map<EstimateKey, RatingSeries> aggregateAll(Map<NoiseRegime, AttributeMatrix> observations,
                                                       List<CombinationRule> rules) {
        Map<EstimateKey, RatingSeries> estimates = new LinkedHashMap<>();
        observations.forEach((regime, matrix) -> {
            for (CombinationRule rule : rules) {
                estimates.put(new EstimateKey(regime, rule), aggregate(matrix, rule));
            }
        });
        return estimates;
    }
}
