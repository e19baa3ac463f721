package org.learningjava.facevec.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.error.CollectionUnavailableException;
import org.learningjava.facevec.domain.error.InvalidDimensionException;
import org.learningjava.facevec.domain.error.InvalidIdentifierException;
import org.learningjava.facevec.domain.error.StoreOperationException;
import org.learningjava.facevec.domain.model.VectorDocument;
import org.learningjava.facevec.domain.model.VectorPoint;
import org.learningjava.facevec.domain.options.VectorStoreOptions;
import org.learningjava.facevec.domain.service.store.CollectionLifecycleManager;
import org.learningjava.facevec.support.FakeStorageClient;
import org.learningjava.facevec.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.facevec.support.TestImages.unitVector;

class SoftDeleteVectorStoreTest {

    private static final String ALICE = "11111111-1111-1111-1111-111111111111";
    private static final String BOB = "22222222-2222-2222-2222-222222222222";
    private static final Instant T0 = Instant.parse("2024-03-01T12:00:00Z");

    private FakeStorageClient client;
    private MutableClock clock;
    private VectorStoreOptions options;
    private SoftDeleteVectorStore store;

    @BeforeEach
    void setUp() {
        client = new FakeStorageClient();
        clock = new MutableClock(T0);
        options = VectorStoreOptions.defaults();
        CollectionLifecycleManager lifecycle = new CollectionLifecycleManager(
                client, options.collectionName(), options.vectorSize(), true);
        store = new SoftDeleteVectorStore(client, options, lifecycle, clock);
    }

    @Test
    void alice_is_stored_soft_deleted_and_hidden_from_search() {
        float[] embedding = unitVector(512, 7);
        store.upsert(VectorDocument.of(ALICE, "Alice", embedding));

        assertEquals("Alice", store.get(ALICE).orElseThrow().content());

        assertTrue(store.downsert(ALICE));
        assertTrue(store.get(ALICE).orElseThrow().deleted());

        List<VectorDocument> hits = store.search(embedding, 5);
        assertTrue(hits.stream().noneMatch(d -> d.id().equals(ALICE)));
    }

    @Test
    void wrong_dimension_is_rejected_before_any_store_call() {
        InvalidDimensionException ex = assertThrows(InvalidDimensionException.class,
                () -> store.upsert(VectorDocument.of(ALICE, "Alice", new float[128])));

        assertEquals(512, ex.getExpected());
        assertEquals(128, ex.getActual());
        assertThrows(InvalidDimensionException.class, () -> store.search(new float[511], 5));
        assertEquals(0, client.totalCalls());
    }

    @Test
    void invalid_id_is_rejected_before_any_store_call() {
        assertThrows(InvalidIdentifierException.class,
                () -> store.upsert(VectorDocument.of("alice", "Alice", unitVector(512, 0))));
        assertThrows(InvalidIdentifierException.class, () -> store.get("not-a-uuid"));
        assertThrows(InvalidIdentifierException.class, () -> store.downsert(""));
        assertEquals(0, client.totalCalls());
    }

    @Test
    void round_trip_returns_content_metadata_and_embedding() {
        VectorDocument doc = VectorDocument.builder()
                .id(ALICE.toUpperCase())
                .content("Alice")
                .embedding(unitVector(512, 3))
                .metadata(Map.of("camera", "lobby"))
                .build();

        VectorDocument written = store.upsert(doc);
        VectorDocument read = store.get(ALICE).orElseThrow();

        assertEquals(ALICE, written.id());
        assertEquals(ALICE, read.id());
        assertEquals("Alice", read.content());
        assertEquals(Map.of("camera", "lobby"), read.metadata());
        assertArrayEquals(unitVector(512, 3), read.embedding());
        assertFalse(read.deleted());
        assertEquals(T0, read.createdAt());
        assertEquals(T0, read.updatedAt());
        assertNull(read.deletedAt());
    }

    @Test
    void created_at_survives_later_upserts_and_updated_at_moves() {
        store.upsert(VectorDocument.of(ALICE, "Alice v1", unitVector(512, 1)));
        clock.advance(Duration.ofHours(2));

        VectorDocument second = store.upsert(VectorDocument.builder()
                .id(ALICE).content("Alice v2").embedding(unitVector(512, 2))
                .createdAt(Instant.parse("1999-01-01T00:00:00Z")) // caller value is ignored
                .build());

        VectorDocument read = store.get(ALICE).orElseThrow();
        assertEquals(T0, second.createdAt());
        assertEquals(T0, read.createdAt());
        assertEquals(T0.plus(Duration.ofHours(2)), read.updatedAt());
        assertEquals("Alice v2", read.content());
    }

    @Test
    void downsert_marks_deleted_without_removing_point() {
        store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1)));
        clock.advance(Duration.ofMinutes(5));

        assertTrue(store.downsert(ALICE));

        VectorPoint raw = client.stored(options.collectionName(), ALICE);
        assertNotNull(raw);
        assertEquals(true, raw.payload().get("is_deleted"));
        VectorDocument read = store.get(ALICE).orElseThrow();
        assertTrue(read.deleted());
        assertEquals(T0, read.createdAt());
        assertEquals(T0.plus(Duration.ofMinutes(5)), read.deletedAt());
        assertEquals(read.deletedAt(), read.updatedAt());
        assertArrayEquals(unitVector(512, 1), read.embedding());
    }

    @Test
    void upsert_over_malformed_created_at_fails_without_rewriting_it() {
        store.ensureCollectionReady();
        client.upsertPoints(options.collectionName(), List.of(new VectorPoint(ALICE, unitVector(512, 1),
                Map.of("content", "Alice", "is_deleted", false, "created_at", "yesterday"))));
        int writes = client.pointWrites();

        assertThrows(StoreOperationException.class,
                () -> store.upsert(VectorDocument.of(ALICE, "Alice v2", unitVector(512, 1))));

        assertEquals(writes, client.pointWrites());
        assertEquals("yesterday", client.stored(options.collectionName(), ALICE).payload().get("created_at"));
    }

    @Test
    void downsert_of_unknown_id_returns_false_and_writes_nothing() {
        assertFalse(store.downsert(BOB));
        assertEquals(0, client.pointWrites());
    }

    @Test
    void upsert_after_downsert_revives_the_document() {
        store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1)));
        store.downsert(ALICE);

        store.upsert(VectorDocument.of(ALICE, "Alice again", unitVector(512, 1)));

        VectorDocument read = store.get(ALICE).orElseThrow();
        assertFalse(read.deleted());
        assertNull(read.deletedAt());
    }

    @Test
    void search_excludes_deleted_unless_asked() {
        store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1)));
        store.upsert(VectorDocument.of(BOB, "Bob", unitVector(512, 2)));
        store.downsert(ALICE);

        List<VectorDocument> live = store.search(unitVector(512, 1), 10);
        List<VectorDocument> all = store.search(unitVector(512, 1), 10, true);

        assertEquals(List.of(BOB), live.stream().map(VectorDocument::id).toList());
        assertEquals(2, all.size());
        assertEquals(ALICE, all.get(0).id()); // closest first
        assertTrue(all.get(0).deleted());
    }

    @Test
    void search_respects_top_k() {
        for (int i = 0; i < 5; i++) {
            String id = String.format("%08d-0000-0000-0000-000000000000", i);
            store.upsert(VectorDocument.of(id, "doc" + i, unitVector(512, i)));
        }
        assertEquals(2, store.search(unitVector(512, 0), 2).size());
    }

    @Test
    void top_k_out_of_range_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> store.search(unitVector(512, 0), 0));
        assertThrows(IllegalArgumentException.class, () -> store.search(unitVector(512, 0), 10_001));
        assertEquals(0, client.totalCalls());
    }

    @Test
    void get_of_unknown_id_is_empty() {
        assertEquals(Optional.empty(), store.get(BOB));
    }

    @Test
    void collection_is_created_once_on_first_use() {
        store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1)));
        store.get(ALICE);
        store.search(unitVector(512, 1), 1);

        assertEquals(1, client.createCalls.get());
        assertEquals(1, client.listCalls.get());
    }

    @Test
    void unreachable_collection_surfaces_and_writes_nothing() {
        client.failListWith(new IllegalStateException("connection refused"));

        assertThrows(CollectionUnavailableException.class,
                () -> store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1))));
        assertEquals(0, client.pointWrites());
    }

    @Test
    void storage_errors_are_wrapped() {
        store.ensureCollectionReady();
        client.failPointCallsWith(new IllegalStateException("503"));

        StoreOperationException ex = assertThrows(StoreOperationException.class, () -> store.get(ALICE));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void cancelled_token_aborts_before_writing() {
        store.ensureCollectionReady();
        CancellationToken token = CancellationToken.create();
        token.cancel();

        assertThrows(CancellationException.class,
                () -> store.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 1)), token));
        assertEquals(0, client.pointWrites());
    }

    @Test
    void convenience_constructor_wires_its_own_lifecycle() {
        SoftDeleteVectorStore simple = new SoftDeleteVectorStore(client, options);

        simple.upsert(VectorDocument.of(ALICE, "Alice", unitVector(512, 4)));

        assertTrue(simple.lifecycle().isReady());
        assertTrue(simple.get(ALICE).isPresent());
    }
}
