package de.conciso.ratingsim.model;

import de.conciso.ratingsim.exception.InvalidParameterException;

import java.util.List;

/**
 * Parameters of one simulation run. Validated on construction; an invalid value
 * aborts the run before any sampling happens.
 */
public record SimulationConfig(
        int populationSize,
        int attributeCount,
        double attributeMean,
        double attributeSd,
        List<NoiseRegime> regimes,
        List<TrueRatingDefinition> definitions,
        double mixedWeight,
        List<CombinationRule> rules,
        List<PopulationSlice> slices,
        long seed
) {

    public SimulationConfig {
        if (populationSize < 1) throw InvalidParameterException.of("populationSize", populationSize, ">= 1");
        if (attributeCount < 1) throw InvalidParameterException.of("attributeCount", attributeCount, ">= 1");
        if (!(attributeMean > 0.0) || Double.isInfinite(attributeMean)) {
            throw InvalidParameterException.of("attributeMean", attributeMean, "a finite value > 0");
        }
        // sd 0 gives identical true ratings, which nothing can rank
        if (!(attributeSd > 0.0) || Double.isInfinite(attributeSd)) {
            throw InvalidParameterException.of("attributeSd", attributeSd, "a finite value > 0");
        }
        if (!Double.isFinite(mixedWeight) || mixedWeight < 0.0) {
            throw InvalidParameterException.of("mixedWeight", mixedWeight, "a finite value >= 0");
        }
        regimes = nonEmpty("regimes", regimes);
        definitions = nonEmpty("definitions", definitions);
        rules = nonEmpty("rules", rules);
        slices = nonEmpty("slices", slices);
    }

    /**
     * The reference study: 10000 entities, 10 attributes with mean 2 and sd 1, the five
     * standard noise regimes, both definitions, both rules, slices all/10%/1%, seed 13.
     */
    public static SimulationConfig reference() {
        return new SimulationConfig(10_000, 10, 2.0, 1.0,
                standardRegimes(),
                List.of(TrueRatingDefinition.PRODUCT, TrueRatingDefinition.MIXED),
                5.0,
                List.of(CombinationRule.SUM, CombinationRule.PRODUCT),
                List.of(PopulationSlice.all(), PopulationSlice.top(0.1), PopulationSlice.top(0.01)),
                13L);
    }

    public static List<NoiseRegime> standardRegimes() {
        return List.of(
                NoiseRegime.inverseProportional(),
                NoiseRegime.sqrtProportional(),
                NoiseRegime.constant(0.125),
                NoiseRegime.constant(0.25),
                NoiseRegime.constant(1.0));
    }

    public SimulationConfig withSeed(long newSeed) {
        return new SimulationConfig(populationSize, attributeCount, attributeMean, attributeSd,
                regimes, definitions, mixedWeight, rules, slices, newSeed);
    }

    public SimulationConfig withPopulationSize(int newSize) {
        return new SimulationConfig(newSize, attributeCount, attributeMean, attributeSd,
                regimes, definitions, mixedWeight, rules, slices, seed);
    }

    public SimulationConfig withRegimes(List<NoiseRegime> newRegimes) {
        return new SimulationConfig(populationSize, attributeCount, attributeMean, attributeSd,
                newRegimes, definitions, mixedWeight, rules, slices, seed);
    }

    public SimulationConfig withDefinitions(List<TrueRatingDefinition> newDefinitions) {
        return new SimulationConfig(populationSize, attributeCount, attributeMean, attributeSd,
                regimes, newDefinitions, mixedWeight, rules, slices, seed);
    }

    private static <T> List<T> nonEmpty(String name, List<T> values) {
        if (values == null || values.isEmpty()) {
            throw InvalidParameterException.of(name, values, "at least one entry");
        }
        return List.copyOf(values);
    }
}
