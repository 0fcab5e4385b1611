package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.util.Arrays;

/**
 * One rating per entity together with the ranking derived from it. The ranking is
 * computed once, on construction, and never updated.
 */
public final class RatingSeries {

    private final double[] values;
    private final Ranking ranking;

    private RatingSeries(double[] values) {
        this.values = values;
        this.ranking = Ranking.descending(values);
    }

    public static RatingSeries of(double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (!(values[i] > 0.0) || Double.isInfinite(values[i])) {
                throw InvalidParameterException.of("rating[" + i + "]", values[i], "a finite value > 0");
            }
        }
        return new RatingSeries(values.clone());
    }

    public int size() {
        return values.length;
    }

    public double value(int entity) {
        return values[entity];
    }

    public double rank(int entity) {
        return ranking.rankOf(entity);
    }

    public double[] values() {
        return values.clone();
    }

    public Ranking ranking() {
        return ranking;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RatingSeries other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }
}
