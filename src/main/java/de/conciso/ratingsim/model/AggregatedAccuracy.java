package de.conciso.ratingsim.model;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.Arrays;
import java.util.List;

/**
 * One evaluation cell averaged over replicated runs. NaN cells (degenerate slices) are
 * left out of the averages; if no run produced a finite value the average stays NaN.
 */
public record AggregatedAccuracy(
        EvaluationKey key,
        int runs,
        double avgRankErrorSd,   double stdDevRankErrorSd,
        double avgLogCorrelation, double stdDevLogCorrelation,
        List<AccuracyMetrics> runResults
) {
    public static AggregatedAccuracy of(EvaluationKey key, List<AccuracyMetrics> runResults) {
        double[] rankErrors   = finite(runResults.stream().mapToDouble(AccuracyMetrics::rankErrorSd).toArray());
        double[] correlations = finite(runResults.stream().mapToDouble(AccuracyMetrics::logCorrelation).toArray());

        return new AggregatedAccuracy(key, runResults.size(),
                mean(rankErrors),   stdDev(rankErrors),
                mean(correlations), stdDev(correlations),
                List.copyOf(runResults));
    }

    private static double[] finite(double[] v) {
        return Arrays.stream(v).filter(Double::isFinite).toArray();
    }

    private static double mean(double[] v) {
        return new Mean().evaluate(v);
    }

    // population sd, same as the per-run rank error sd
    private static double stdDev(double[] v) {
        return new StandardDeviation(false).evaluate(v);
    }
}
