package org.learningjava.facevec.application.port;

import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.model.VectorDocument;

import java.util.List;
import java.util.Optional;

public interface VectorStorePort {

    void ensureCollectionReady(CancellationToken cancellation);

    default void ensureCollectionReady() {
        ensureCollectionReady(CancellationToken.NONE);
    }

    VectorDocument upsert(VectorDocument document, CancellationToken cancellation);

    default VectorDocument upsert(VectorDocument document) {
        return upsert(document, CancellationToken.NONE);
    }

    /** Soft delete. Returns false when no document has this id. */
    boolean downsert(String id, CancellationToken cancellation);

    default boolean downsert(String id) {
        return downsert(id, CancellationToken.NONE);
    }

    List<VectorDocument> search(float[] query, int topK, boolean includeDeleted, CancellationToken cancellation);

    default List<VectorDocument> search(float[] query, int topK, boolean includeDeleted) {
        return search(query, topK, includeDeleted, CancellationToken.NONE);
    }

    default List<VectorDocument> search(float[] query, int topK) {
        return search(query, topK, false, CancellationToken.NONE);
    }

    /** Soft-deleted documents are returned too. */
    Optional<VectorDocument> get(String id, CancellationToken cancellation);

    default Optional<VectorDocument> get(String id) {
        return get(id, CancellationToken.NONE);
    }
}
