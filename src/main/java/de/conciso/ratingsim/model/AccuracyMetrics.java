package de.conciso.ratingsim.model;

/**
 * Fidelity of one estimate against one true rating over one slice.
 *
 * @param rankErrorSd    population sd of (true rank - estimated rank) over the slice
 * @param logCorrelation Pearson correlation of ln(estimate) and ln(truth); NaN when the
 *                       slice has at most one member
 * @param sliceSize      number of entities in the slice
 */
public record AccuracyMetrics(double rankErrorSd, double logCorrelation, int sliceSize) {

    public boolean isDegenerate() {
        return sliceSize <= 1;
    }
}
