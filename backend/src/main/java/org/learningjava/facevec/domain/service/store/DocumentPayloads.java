package org.learningjava.facevec.domain.service.store;

import org.learningjava.facevec.domain.error.StoreOperationException;
import org.learningjava.facevec.domain.model.VectorDocument;
import org.learningjava.facevec.domain.model.VectorPoint;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps documents to point payloads and back. Metadata keys get a {@code meta_}
 * prefix so they never collide with the reserved fields.
 */
public final class DocumentPayloads {

    public static final String CONTENT = "content";
    public static final String IS_DELETED = "is_deleted";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";
    public static final String DELETED_AT = "deleted_at";
    public static final String META_PREFIX = "meta_";

    private DocumentPayloads() {}

    public static Map<String, Object> build(String content,
                                            Map<String, String> metadata,
                                            boolean deleted,
                                            Instant createdAt,
                                            Instant updatedAt,
                                            Instant deletedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(CONTENT, content == null ? "" : content);
        payload.put(IS_DELETED, deleted);
        payload.put(CREATED_AT, createdAt.toString());
        payload.put(UPDATED_AT, updatedAt.toString());
        if (deletedAt != null) {
            payload.put(DELETED_AT, deletedAt.toString());
        }
        if (metadata != null) {
            metadata.forEach((k, v) -> payload.put(META_PREFIX + k, v == null ? "" : v));
        }
        return payload;
    }

    /**
     * @param fallbackCreatedAt used when the payload carries no creation time
     * @throws StoreOperationException if a timestamp field is present but not an ISO-8601 instant
     */
    public static VectorDocument toDocument(VectorPoint point, Instant fallbackCreatedAt) {
        Map<String, Object> payload = point.payload();
        Map<String, String> metadata = new LinkedHashMap<>();
        payload.forEach((k, v) -> {
            if (k.startsWith(META_PREFIX) && v != null) {
                metadata.put(k.substring(META_PREFIX.length()), v.toString());
            }
        });

        Instant createdAt = instant(payload, CREATED_AT);
        return VectorDocument.builder()
                .id(point.id())
                .content(string(payload.get(CONTENT)))
                .embedding(point.vector())
                .metadata(metadata)
                .deleted(bool(payload.get(IS_DELETED)))
                .createdAt(createdAt != null ? createdAt : fallbackCreatedAt)
                .updatedAt(instant(payload, UPDATED_AT))
                .deletedAt(instant(payload, DELETED_AT))
                .build();
    }

    private static String string(Object value) {
        return value == null ? "" : value.toString();
    }

    private static boolean bool(Object value) {
        if (value instanceof Boolean b) return b;
        return value != null && Boolean.parseBoolean(value.toString());
    }

    private static Instant instant(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null || value.toString().isBlank()) return null;
        try {
            return Instant.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new StoreOperationException("Malformed timestamp in payload field '" + key + "': " + value, e);
        }
    }
}
