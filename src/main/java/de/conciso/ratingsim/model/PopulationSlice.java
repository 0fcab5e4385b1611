package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.math.BigDecimal;

/**
 * The top {@code fraction} of the population by TRUE rank. Members are the entities
 * whose true rank is at most {@link #memberCount(int)}; with average ranks a tie
 * straddling the cut-off is left out entirely.
 */
public record PopulationSlice(String name, double fraction) {

    public PopulationSlice {
        if (!(fraction > 0.0 && fraction <= 1.0)) {
            throw InvalidParameterException.of("slice fraction", fraction, "a value in (0, 1]");
        }
    }

    public static PopulationSlice all() {
        return new PopulationSlice("all", 1.0);
    }

    public static PopulationSlice top(double fraction) {
        if (fraction == 1.0) return all();
        String percent = BigDecimal.valueOf(fraction).movePointRight(2).stripTrailingZeros().toPlainString();
        return new PopulationSlice("top-" + percent + "%", fraction);
    }

    public int memberCount(int populationSize) {
        // guard against 0.1 * 10000 landing a hair above 1000
        return Math.max(1, (int) Math.ceil(fraction * populationSize - 1e-9));
    }

    @Override
    public String toString() {
        return name;
    }
}
