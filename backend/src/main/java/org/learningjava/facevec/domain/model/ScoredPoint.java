package org.learningjava.facevec.domain.model;

public record ScoredPoint(VectorPoint point, float score) {}
