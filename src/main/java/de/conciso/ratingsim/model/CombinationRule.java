package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.util.Locale;

/**
 * Aggregation applied to the (noisy) attribute observations of one entity.
 */
public enum CombinationRule {
    SUM("sum"),
    PRODUCT("product");

    private final String label;

    CombinationRule(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public double combine(double[] observations) {
        if (this == SUM) {
            double sum = 0.0;
            for (double o : observations) sum += o;
            return sum;
        }
        double product = 1.0;
        for (double o : observations) product *= o;
        return product;
    }

    public static CombinationRule parse(String text) {
        String name = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        for (CombinationRule r : values()) {
            if (r.label.equals(name)) return r;
        }
        throw InvalidParameterException.of("combination rule", text, "sum or product");
    }
}
