package de.conciso.ratingsim.model;

public record ScatterPoint(int entity, double logTruth, double logEstimate) {}
