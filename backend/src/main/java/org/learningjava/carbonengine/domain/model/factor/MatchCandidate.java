package org.learningjava.carbonengine.domain.model.factor;

public record MatchCandidate(EmissionFactorRecord factor, double similarity) {}
