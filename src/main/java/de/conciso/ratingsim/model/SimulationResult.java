package de.conciso.ratingsim.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Everything one run produced: the ground truth, every noisy observation matrix, every
 * estimate and the evaluation table. Kept whole so reports can slice the raw series
 * without re-running the pipeline.
 */
public record SimulationResult(
        SimulationConfig config,
        AttributeMatrix trueAttributes,
        Map<TrueRatingDefinition, RatingSeries> trueRatings,
        Map<NoiseRegime, AttributeMatrix> observations,
        Map<EstimateKey, RatingSeries> estimates,
        EvaluationTable table
) {

    public SimulationResult {
        trueRatings = Map.copyOf(trueRatings);
        observations = Map.copyOf(observations);
        estimates = Map.copyOf(estimates);
    }

    public RatingSeries truth(TrueRatingDefinition definition) {
        return require(trueRatings.get(definition), definition);
    }

    public AttributeMatrix observation(NoiseRegime regime) {
        return require(observations.get(regime), regime);
    }

    public RatingSeries estimate(NoiseRegime regime, CombinationRule rule) {
        EstimateKey key = new EstimateKey(regime, rule);
        return require(estimates.get(key), key);
    }

    /**
     * (ln truth, ln estimate) for the members of {@code slice}, best true rank first.
     */
    public List<ScatterPoint> scatter(TrueRatingDefinition definition, NoiseRegime regime,
                                      CombinationRule rule, PopulationSlice slice) {
        RatingSeries truth = truth(definition);
        RatingSeries estimate = estimate(regime, rule);
        int[] members = truth.ranking().top(slice.memberCount(truth.size()));
        List<ScatterPoint> points = new ArrayList<>(members.length);
        for (int entity : members) {
            points.add(new ScatterPoint(entity, Math.log(truth.value(entity)), Math.log(estimate.value(entity))));
        }
        return points;
    }

    private static <T> T require(T value, Object key) {
        if (value == null) {
            throw new IllegalArgumentException("Not part of this run: " + key);
        }
        return value;
    }
}
