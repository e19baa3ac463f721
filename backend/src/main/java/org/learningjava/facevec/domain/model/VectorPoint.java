package org.learningjava.facevec.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A point as the storage client sees it: id, dense vector and a flat payload.
 * The vector may be empty when it was not requested.
 */
public record VectorPoint(String id, float[] vector, Map<String, Object> payload) {

    public VectorPoint {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? new float[0] : vector.clone();
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorPoint other)) return false;
        return id.equals(other.id) && Arrays.equals(vector, other.vector) && payload.equals(other.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, Arrays.hashCode(vector), payload);
    }

    @Override
    public String toString() {
        return "VectorPoint[id=" + id + ", dim=" + vector.length + ", payload=" + payload + "]";
    }
}
