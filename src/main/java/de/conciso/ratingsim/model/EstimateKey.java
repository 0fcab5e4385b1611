package de.conciso.ratingsim.model;

public record EstimateKey(NoiseRegime regime, CombinationRule rule) {}
