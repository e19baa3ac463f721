package org.learningjava.facevec.domain.model;

public enum DistanceMetric {
    COSINE("Cosine"),
    EUCLID("Euclid"),
    DOT("Dot");

    private final String wireName;

    DistanceMetric(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
