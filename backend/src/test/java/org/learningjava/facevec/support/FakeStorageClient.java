package org.learningjava.facevec.support;

import org.learningjava.facevec.application.port.StorageClientPort;
import org.learningjava.facevec.domain.model.DistanceMetric;
import org.learningjava.facevec.domain.model.PointFilter;
import org.learningjava.facevec.domain.model.ScoredPoint;
import org.learningjava.facevec.domain.model.VectorPoint;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory storage client with call counters and failure injection.
 * Search ranks by cosine similarity and applies payload equality filters.
 */
public class FakeStorageClient implements StorageClientPort {

    private final Map<String, Map<String, VectorPoint>> collections = new ConcurrentHashMap<>();

    public final AtomicInteger listCalls = new AtomicInteger();
    public final AtomicInteger createCalls = new AtomicInteger();
    public final AtomicInteger upsertCalls = new AtomicInteger();
    public final AtomicInteger searchCalls = new AtomicInteger();
    public final AtomicInteger retrieveCalls = new AtomicInteger();

    private volatile RuntimeException listFailure;
    private volatile RuntimeException pointFailure;
    private volatile long listDelayMillis;

    public FakeStorageClient withCollection(String name) {
        collections.putIfAbsent(name, new LinkedHashMap<>());
        return this;
    }

    public void failListWith(RuntimeException e) {
        this.listFailure = e;
    }

    public void failPointCallsWith(RuntimeException e) {
        this.pointFailure = e;
    }

    public void delayListBy(long millis) {
        this.listDelayMillis = millis;
    }

    public int totalCalls() {
        return listCalls.get() + createCalls.get() + upsertCalls.get() + searchCalls.get() + retrieveCalls.get();
    }

    public int pointWrites() {
        return upsertCalls.get();
    }

    public synchronized VectorPoint stored(String collection, String id) {
        Map<String, VectorPoint> points = collections.get(collection);
        return points == null ? null : points.get(id);
    }

    @Override
    public Set<String> listCollections() {
        listCalls.incrementAndGet();
        if (listDelayMillis > 0) {
            try {
                Thread.sleep(listDelayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (listFailure != null) {
            throw listFailure;
        }
        return Set.copyOf(collections.keySet());
    }

    @Override
    public void createCollection(String name, int vectorSize, DistanceMetric distance) {
        createCalls.incrementAndGet();
        collections.putIfAbsent(name, new LinkedHashMap<>());
    }

    @Override
    public synchronized void upsertPoints(String collectionName, List<VectorPoint> points) {
        upsertCalls.incrementAndGet();
        failIfConfigured();
        Map<String, VectorPoint> target = collection(collectionName);
        points.forEach(p -> target.put(p.id(), p));
    }

    @Override
    public synchronized List<ScoredPoint> searchPoints(String collectionName, float[] vector, PointFilter filter,
                                                       int limit, boolean withPayload, boolean withVectors) {
        searchCalls.incrementAndGet();
        failIfConfigured();
        List<ScoredPoint> hits = new ArrayList<>();
        for (VectorPoint p : collection(collectionName).values()) {
            if (filter != null && !matches(p, filter)) {
                continue;
            }
            hits.add(new ScoredPoint(shape(p, withPayload, withVectors), cosine(vector, p.vector())));
        }
        hits.sort(Comparator.comparingDouble(ScoredPoint::score).reversed());
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public synchronized List<VectorPoint> retrievePoints(String collectionName, List<String> ids,
                                                         boolean withPayload, boolean withVectors) {
        retrieveCalls.incrementAndGet();
        failIfConfigured();
        Map<String, VectorPoint> points = collection(collectionName);
        List<VectorPoint> out = new ArrayList<>();
        for (String id : ids) {
            VectorPoint p = points.get(id);
            if (p != null) out.add(shape(p, withPayload, withVectors));
        }
        return out;
    }

    private Map<String, VectorPoint> collection(String name) {
        Map<String, VectorPoint> points = collections.get(name);
        if (points == null) {
            throw new IllegalStateException("Collection not found: " + name);
        }
        return points;
    }

    private void failIfConfigured() {
        if (pointFailure != null) throw pointFailure;
    }

    private static boolean matches(VectorPoint p, PointFilter filter) {
        for (PointFilter.FieldMatch m : filter.must()) {
            if (!Objects.equals(p.payload().get(m.key()), m.value())) {
                return false;
            }
        }
        return true;
    }

    private static VectorPoint shape(VectorPoint p, boolean withPayload, boolean withVectors) {
        return new VectorPoint(p.id(), withVectors ? p.vector() : null, withPayload ? p.payload() : null);
    }

    private static float cosine(float[] a, float[] b) {
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < Math.min(a.length, b.length); i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        return na == 0 || nb == 0 ? 0f : (float) (dot / (Math.sqrt(na) * Math.sqrt(nb)));
    }
}
