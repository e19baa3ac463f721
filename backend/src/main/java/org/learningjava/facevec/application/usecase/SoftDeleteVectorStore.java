package org.learningjava.facevec.application.usecase;

import org.learningjava.facevec.application.port.StorageClientPort;
import org.learningjava.facevec.application.port.VectorStorePort;
import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.error.InvalidDimensionException;
import org.learningjava.facevec.domain.error.StoreOperationException;
import org.learningjava.facevec.domain.model.PointFilter;
import org.learningjava.facevec.domain.model.ScoredPoint;
import org.learningjava.facevec.domain.model.VectorDocument;
import org.learningjava.facevec.domain.model.VectorPoint;
import org.learningjava.facevec.domain.options.VectorStoreOptions;
import org.learningjava.facevec.domain.service.store.CollectionLifecycleManager;
import org.learningjava.facevec.domain.service.store.DocumentPayloads;
import org.learningjava.facevec.domain.service.store.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Vector store with enforced 512-d embeddings and soft deletes.
 *
 * <p>Vector length and id format are checked before any network call. Every
 * operation first waits for the collection to be ready. Deletion never removes
 * a point; it rewrites the payload with {@code is_deleted=true}.</p>
 */
public class SoftDeleteVectorStore implements VectorStorePort {

    private static final Logger log = LoggerFactory.getLogger(SoftDeleteVectorStore.class);

    private final StorageClientPort client;
    private final VectorStoreOptions options;
    private final CollectionLifecycleManager lifecycle;
    private final Clock clock;

    public SoftDeleteVectorStore(StorageClientPort client,
                                 VectorStoreOptions options,
                                 CollectionLifecycleManager lifecycle,
                                 Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.options = Objects.requireNonNull(options, "options");
        this.lifecycle = Objects.requireNonNull(lifecycle, "lifecycle");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SoftDeleteVectorStore(StorageClientPort client, VectorStoreOptions options) {
        this(client, options,
                new CollectionLifecycleManager(client, options.collectionName(), options.vectorSize(), options.autoCreateCollection()),
                Clock.systemUTC());
    }

    @Override
    public void ensureCollectionReady(CancellationToken cancellation) {
        lifecycle.ensureReady(cancellation);
    }

    public CollectionLifecycleManager lifecycle() {
        return lifecycle;
    }

    @Override
    public VectorDocument upsert(VectorDocument document, CancellationToken cancellation) {
        Objects.requireNonNull(document, "document");
        validateDimension(document.dimension());
        String id = Identifiers.canonical(document.id());

        lifecycle.ensureReady(cancellation);

        Optional<VectorDocument> existing = retrieve(id, cancellation);
        Instant now = clock.instant();
        Instant createdAt = existing.map(VectorDocument::createdAt).orElse(now);

        Map<String, Object> payload = DocumentPayloads.build(
                document.content(), document.metadata(), false, createdAt, now, null);
        write(new VectorPoint(id, document.embedding(), payload), cancellation);
        log.info("Upserted vector {}", id);

        return document.toBuilder()
                .id(id)
                .createdAt(createdAt)
                .updatedAt(now)
                .deleted(false)
                .deletedAt(null)
                .build();
    }

    @Override
    public boolean downsert(String id, CancellationToken cancellation) {
        String canonical = Identifiers.canonical(id);
        lifecycle.ensureReady(cancellation);

        Optional<VectorDocument> existing = retrieve(canonical, cancellation);
        if (existing.isEmpty()) {
            log.debug("Soft delete skipped, no vector {}", canonical);
            return false;
        }

        VectorDocument doc = existing.get();
        Instant now = clock.instant();
        Map<String, Object> payload = DocumentPayloads.build(
                doc.content(), doc.metadata(), true, doc.createdAt(), now, now);
        write(new VectorPoint(canonical, doc.embedding(), payload), cancellation);
        log.info("Soft deleted vector {}", canonical);
        return true;
    }

    @Override
    public List<VectorDocument> search(float[] query, int topK, boolean includeDeleted, CancellationToken cancellation) {
        Objects.requireNonNull(query, "query");
        validateDimension(query.length);
        validateTopK(topK);
        lifecycle.ensureReady(cancellation);

        PointFilter filter = includeDeleted ? null : PointFilter.matching(DocumentPayloads.IS_DELETED, false);

        cancellation.throwIfCancellationRequested();
        List<ScoredPoint> hits = callStore("search", () ->
                client.searchPoints(options.collectionName(), query, filter, topK, true, true));

        Instant now = clock.instant();
        return hits.stream()
                .map(hit -> DocumentPayloads.toDocument(hit.point(), now))
                .toList();
    }

    @Override
    public Optional<VectorDocument> get(String id, CancellationToken cancellation) {
        String canonical = Identifiers.canonical(id);
        lifecycle.ensureReady(cancellation);
        return retrieve(canonical, cancellation);
    }

    private Optional<VectorDocument> retrieve(String canonicalId, CancellationToken cancellation) {
        cancellation.throwIfCancellationRequested();
        List<VectorPoint> points = callStore("retrieve", () ->
                client.retrievePoints(options.collectionName(), List.of(canonicalId), true, true));
        if (points == null || points.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(DocumentPayloads.toDocument(points.get(0), clock.instant()));
    }

    private void write(VectorPoint point, CancellationToken cancellation) {
        cancellation.throwIfCancellationRequested();
        callStore("upsert", () -> {
            client.upsertPoints(options.collectionName(), List.of(point));
            return null;
        });
    }

    private <T> T callStore(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (StoreOperationException | CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new StoreOperationException("Vector store " + operation + " failed on '"
                    + options.collectionName() + "': " + e.getMessage(), e);
        }
    }

    private void validateDimension(int actual) {
        if (actual != options.vectorSize()) {
            throw new InvalidDimensionException(options.vectorSize(), actual);
        }
    }

    private static void validateTopK(int topK) {
        if (topK <= 0 || topK > VectorStoreOptions.MAX_TOP_K) {
            throw new IllegalArgumentException("topK must be between 1 and " + VectorStoreOptions.MAX_TOP_K + ", got " + topK);
        }
    }
}
