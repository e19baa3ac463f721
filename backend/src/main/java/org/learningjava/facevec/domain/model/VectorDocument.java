package org.learningjava.facevec.domain.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The persisted unit of the vector store. Immutable; use {@link #toBuilder()}
 * to derive a copy with selected fields overridden.
 */
public record VectorDocument(
        String id,
        String content,
        float[] embedding,
        Map<String, String> metadata,
        boolean deleted,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt
) {

    public VectorDocument {
        content = content == null ? "" : content;
        embedding = embedding == null ? new float[0] : embedding.clone();
        metadata = metadata == null || metadata.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static VectorDocument of(String id, String content, float[] embedding) {
        return builder().id(id).content(content).embedding(embedding).build();
    }

    @Override
    public float[] embedding() {
        return embedding.clone();
    }

    public int dimension() {
        return embedding.length;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .content(content)
                .embedding(embedding)
                .metadata(metadata)
                .deleted(deleted)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .deletedAt(deletedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VectorDocument other)) return false;
        return deleted == other.deleted
                && Objects.equals(id, other.id)
                && Objects.equals(content, other.content)
                && Arrays.equals(embedding, other.embedding)
                && Objects.equals(metadata, other.metadata)
                && Objects.equals(createdAt, other.createdAt)
                && Objects.equals(updatedAt, other.updatedAt)
                && Objects.equals(deletedAt, other.deletedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, content, Arrays.hashCode(embedding), metadata, deleted, createdAt, updatedAt, deletedAt);
    }

    @Override
    public String toString() {
        return "VectorDocument[id=" + id + ", content=" + content + ", dim=" + embedding.length
                + ", deleted=" + deleted + ", createdAt=" + createdAt + ", updatedAt=" + updatedAt
                + ", deletedAt=" + deletedAt + "]";
    }

    public static final class Builder {
        private String id;
        private String content;
        private float[] embedding;
        private Map<String, String> metadata;
        private boolean deleted;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant deletedAt;

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder embedding(float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder deleted(boolean deleted) {
            this.deleted = deleted;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder deletedAt(Instant deletedAt) {
            this.deletedAt = deletedAt;
            return this;
        }

        public VectorDocument build() {
            return new VectorDocument(id, content, embedding, metadata, deleted, createdAt, updatedAt, deletedAt);
        }
    }
}
