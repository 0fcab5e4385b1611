package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.util.Locale;

/**
 * How the latent attributes of an entity combine into its true rating.
 */
public enum TrueRatingDefinition {

    /** Product of all attributes. */
    PRODUCT("product"),

    /**
     * Product of the first ceil(K/2) attributes plus the weighted product of the rest.
     */
    MIXED("mixed"),

    /** Sum of all attributes. */
    SUM("sum");

    private final String label;

    TrueRatingDefinition(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public double rate(double[] attributes, double mixedWeight) {
        return switch (this) {
            case PRODUCT -> product(attributes, 0, attributes.length);
            case SUM -> {
                double sum = 0.0;
                for (double a : attributes) sum += a;
                yield sum;
            }
            case MIXED -> {
                int split = (attributes.length + 1) / 2;
                yield product(attributes, 0, split)
                        + mixedWeight * product(attributes, split, attributes.length);
            }
        };
    }

    public static TrueRatingDefinition parse(String text) {
        String name = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        for (TrueRatingDefinition d : values()) {
            if (d.label.equals(name)) return d;
        }
        throw InvalidParameterException.of("true rating definition", text, "one of product, mixed, sum");
    }

    private static double product(double[] values, int from, int to) {
        double p = 1.0;
        for (int i = from; i < to; i++) p *= values[i];
        return p;
    }
}
