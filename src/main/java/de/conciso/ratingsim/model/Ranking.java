package de.conciso.ratingsim.model;

import org.apache.commons.math3.stat.ranking.NaNStrategy;
import org.apache.commons.math3.stat.ranking.NaturalRanking;
import org.apache.commons.math3.stat.ranking.TiesStrategy;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Descending ranking of a scalar series: the largest value gets rank 1. Tied values
 * all receive the average of the ranks they span, so ranks can be fractional
 * (two entities tied for first both get 1.5).
 */
public final class Ranking {

    private static final NaturalRanking AVERAGE_RANKING =
            new NaturalRanking(NaNStrategy.FAILED, TiesStrategy.AVERAGE);

    private final double[] ranks;

    private Ranking(double[] ranks) {
        this.ranks = ranks;
    }

    public static Ranking descending(double[] values) {
        double[] negated = new double[values.length];
        for (int i = 0; i < values.length; i++) negated[i] = -values[i];
        return new Ranking(AVERAGE_RANKING.rank(negated));
    }

    public int size() {
        return ranks.length;
    }

    public double rankOf(int entity) {
        return ranks[entity];
    }

    public double[] ranks() {
        return ranks.clone();
    }

    /**
     * Entities with rank {@code <= count}, best first (ties by entity index).
     */
    public int[] top(int count) {
        return IntStream.range(0, ranks.length)
                .filter(i -> ranks[i] <= count)
                .boxed()
                .sorted(Comparator.comparingDouble((Integer i) -> ranks[i]).thenComparingInt(i -> i))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ranking other && Arrays.equals(ranks, other.ranks);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ranks);
    }
}
