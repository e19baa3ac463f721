package org.learningjava.facevec.domain.service.store;

import org.learningjava.facevec.application.port.StorageClientPort;
import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.error.CollectionUnavailableException;
import org.learningjava.facevec.domain.model.DistanceMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Makes sure the target collection exists before first use.
 *
 * <p>{@code UNVERIFIED -> READY} happens once per process (or once after
 * {@link #invalidate()}), under a lock with a re-check, so concurrent first
 * callers issue at most one create call. A failed check leaves the state
 * {@code UNVERIFIED} so the next caller retries.</p>
 */
public class CollectionLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(CollectionLifecycleManager.class);

    public enum State { UNVERIFIED, READY }

    private final StorageClientPort client;
    private final String collectionName;
    private final int vectorSize;
    private final boolean autoCreate;
    private final ReentrantLock lock = new ReentrantLock();
    private volatile boolean ready;

    public CollectionLifecycleManager(StorageClientPort client, String collectionName, int vectorSize, boolean autoCreate) {
        this.client = client;
        this.collectionName = collectionName;
        this.vectorSize = vectorSize;
        this.autoCreate = autoCreate;
    }

    public void ensureReady(CancellationToken cancellation) {
        if (ready) {
            return;
        }

        cancellation.throwIfCancellationRequested();
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for collection check");
        }
        try {
            if (ready) {
                return;
            }
            cancellation.throwIfCancellationRequested();

            Set<String> existing;
            try {
                existing = client.listCollections();
            } catch (RuntimeException e) {
                throw new CollectionUnavailableException(collectionName, e);
            }

            if (!existing.contains(collectionName)) {
                if (autoCreate) {
                    cancellation.throwIfCancellationRequested();
                    try {
                        client.createCollection(collectionName, vectorSize, DistanceMetric.COSINE);
                    } catch (RuntimeException e) {
                        throw new CollectionUnavailableException(collectionName, e);
                    }
                    log.info("Created collection '{}' (size={}, distance={})", collectionName, vectorSize, DistanceMetric.COSINE);
                } else {
                    log.warn("Collection '{}' does not exist and auto-create is disabled", collectionName);
                }
            } else {
                log.debug("Collection '{}' already exists", collectionName);
            }

            ready = true;
        } finally {
            lock.unlock();
        }
    }

    public State state() {
        return ready ? State.READY : State.UNVERIFIED;
    }

    public boolean isReady() {
        return ready;
    }

    /** Forces the next call to re-check, e.g. after a configuration change. */
    public void invalidate() {
        lock.lock();
        try {
            ready = false;
        } finally {
            lock.unlock();
        }
    }

    public String collectionName() {
        return collectionName;
    }
}
