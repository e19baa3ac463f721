package org.learningjava.facevec.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Conjunction of field-equals conditions evaluated against point payloads.
 */
public record PointFilter(List<FieldMatch> must) {

    public record FieldMatch(String key, Object value) {}

    public PointFilter {
        must = must == null ? List.of() : List.copyOf(must);
    }

    public static PointFilter matching(String key, Object value) {
        return new PointFilter(List.of(new FieldMatch(key, value)));
    }

    public PointFilter and(String key, Object value) {
        List<FieldMatch> next = new ArrayList<>(must);
        next.add(new FieldMatch(key, value));
        return new PointFilter(next);
    }
}
