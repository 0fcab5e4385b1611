package de.conciso.ratingsim.model;

public record EvaluationKey(
        TrueRatingDefinition definition,
        NoiseRegime regime,
        CombinationRule rule,
        PopulationSlice slice
) {}
