package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Maps a true attribute value to the linear-scale standard deviation of its noisy
 * observation. {@code constant} is only meaningful for {@link Kind#CONSTANT} and is
 * zero for every other kind.
 */
public record NoiseRegime(Kind kind, double constant) {

    public enum Kind {
        INVERSE_PROPORTIONAL("inverse-proportional"),
        SQRT_PROPORTIONAL("sqrt-proportional"),
        LINEAR_PROPORTIONAL("linear-proportional"),
        CONSTANT("constant"),
        NONE("none");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public NoiseRegime {
        if (kind == null) {
            throw InvalidParameterException.of("kind", null, "a noise regime kind");
        }
        if (kind == Kind.CONSTANT) {
            if (!Double.isFinite(constant) || constant < 0) {
                throw InvalidParameterException.of("constant", constant, "a finite value >= 0");
            }
            // -0.0 would break record equality with 0.0
            constant = constant + 0.0;
        } else {
            constant = 0.0;
        }
    }

    public static NoiseRegime inverseProportional() {
        return new NoiseRegime(Kind.INVERSE_PROPORTIONAL, 0.0);
    }

    public static NoiseRegime sqrtProportional() {
        return new NoiseRegime(Kind.SQRT_PROPORTIONAL, 0.0);
    }

    public static NoiseRegime linearProportional() {
        return new NoiseRegime(Kind.LINEAR_PROPORTIONAL, 0.0);
    }

    public static NoiseRegime constant(double sd) {
        return new NoiseRegime(Kind.CONSTANT, sd);
    }

    public static NoiseRegime none() {
        return new NoiseRegime(Kind.NONE, 0.0);
    }

    /**
     * Parses a regime name as produced by {@link #name()}, e.g. {@code sqrt-proportional}
     * or {@code constant-0.25}.
     */
    public static NoiseRegime parse(String text) {
        String name = text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
        String constantPrefix = Kind.CONSTANT.label() + "-";
        if (name.startsWith(constantPrefix)) {
            try {
                return constant(Double.parseDouble(name.substring(constantPrefix.length())));
            } catch (NumberFormatException e) {
                throw InvalidParameterException.of("noise regime", text, "constant-<sd>");
            }
        }
        for (Kind kind : Kind.values()) {
            if (kind != Kind.CONSTANT && kind.label().equals(name)) {
                return new NoiseRegime(kind, 0.0);
            }
        }
        throw InvalidParameterException.of("noise regime", text,
                "one of inverse-proportional, sqrt-proportional, linear-proportional, none, constant-<sd>");
    }

    public String name() {
        if (kind == Kind.CONSTANT) {
            return kind.label() + "-" + BigDecimal.valueOf(constant).stripTrailingZeros().toPlainString();
        }
        return kind.label();
    }

    /**
     * Linear-scale noise sd for an observation of {@code trueValue}.
     */
    public double noiseSd(double trueValue) {
        return switch (kind) {
            case INVERSE_PROPORTIONAL -> 1.0 / trueValue;
            case SQRT_PROPORTIONAL -> Math.sqrt(trueValue);
            case LINEAR_PROPORTIONAL -> trueValue;
            case CONSTANT -> constant;
            case NONE -> 0.0;
        };
    }

    @Override
    public String toString() {
        return name();
    }
}
