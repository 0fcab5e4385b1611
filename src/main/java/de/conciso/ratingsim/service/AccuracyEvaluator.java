package de.conciso.ratingsim.service;

import de.conciso.ratingsim.exception.InvalidParameterException;
import de.conciso.ratingsim.exception.NumericalException;
import de.conciso.ratingsim.model.AccuracyMetrics;
import de.conciso.ratingsim.model.CombinationRule;
import de.conciso.ratingsim.model.EstimateKey;
import de.conciso.ratingsim.model.EvaluationKey;
import de.conciso.ratingsim.model.EvaluationTable;
import de.conciso.ratingsim.model.NoiseRegime;
import de.conciso.ratingsim.model.PopulationSlice;
import de.conciso.ratingsim.model.RatingSeries;
import de.conciso.ratingsim.model.TrueRatingDefinition;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares an estimate with a true rating over a population slice.
 *
 * <p>Slice members are always taken from the TRUE ranking, so every estimator is
 * judged on the same group of entities. Rank error is {@code trueRank - estimatedRank}
 * using average ranks for ties; its dispersion is the population standard deviation
 * (divide by n). A slice with at most one member has no defined correlation and
 * reports NaN for that cell only.
 */
@Service
public class AccuracyEvaluator {

    private static final Logger log = LoggerFactory.getLogger(AccuracyEvaluator.class);

    public AccuracyMetrics evaluate(RatingSeries truth, RatingSeries estimate, PopulationSlice slice) {
        if (truth.size() != estimate.size()) {
            throw InvalidParameterException.of("estimate size", estimate.size(), String.valueOf(truth.size()));
        }
        int[] members = truth.ranking().top(slice.memberCount(truth.size()));

        double[] rankErrors = new double[members.length];
        double[] logTruth = new double[members.length];
        double[] logEstimate = new double[members.length];
        for (int m = 0; m < members.length; m++) {
            int entity = members[m];
            rankErrors[m] = truth.rank(entity) - estimate.rank(entity);
            logTruth[m] = Math.log(truth.value(entity));
            logEstimate[m] = Math.log(estimate.value(entity));
        }

        if (members.length <= 1) {
            log.warn("Slice {} has {} member(s), correlation undefined", slice.name(), members.length);
            double rankErrorSd = members.length == 0 ? Double.NaN : 0.0;
            return new AccuracyMetrics(rankErrorSd, Double.NaN, members.length);
        }

        double rankErrorSd = new StandardDeviation(false).evaluate(rankErrors);
        double correlation = new PearsonsCorrelation().correlation(logEstimate, logTruth);
        if (!Double.isFinite(rankErrorSd) || !Double.isFinite(correlation)) {
            throw new NumericalException(String.format(
                    "Non-finite accuracy over slice %s (%d members): rankErrorSd=%s correlation=%s",
                    slice.name(), members.length, rankErrorSd, correlation));
        }
        return new AccuracyMetrics(rankErrorSd, correlation, members.length);
    }

    /**
     * Evaluates every (definition, regime, rule, slice) combination present in the inputs.
     */
    public EvaluationTable evaluateAll(Map<TrueRatingDefinition, RatingSeries> truths,
                                       Map<EstimateKey, RatingSeries> estimates,
                                       List<PopulationSlice> slices) {
        Map<EvaluationKey, AccuracyMetrics> cells = new LinkedHashMap<>();
        truths.forEach((definition, truth) ->
                estimates.forEach((estimateKey, estimate) -> {
                    NoiseRegime regime = estimateKey.regime();
                    CombinationRule rule = estimateKey.rule();
                    for (PopulationSlice slice : slices) {
                        AccuracyMetrics metrics = evaluate(truth, estimate, slice);
                        log.debug("[{}/{}/{}/{}] rankErrorSd={} logCorrelation={}",
                                definition.label(), regime.name(), rule.label(), slice.name(),
                                fmt(metrics.rankErrorSd()), fmt(metrics.logCorrelation()));
                        cells.put(new EvaluationKey(definition, regime, rule, slice), metrics);
                    }
                }));
        return new EvaluationTable(cells);
    }

    private String fmt(double v) {
        return String.format("%.4f", v);
    }
}
