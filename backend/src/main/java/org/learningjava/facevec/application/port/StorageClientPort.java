package org.learningjava.facevec.application.port;

import org.learningjava.facevec.domain.model.DistanceMetric;
import org.learningjava.facevec.domain.model.PointFilter;
import org.learningjava.facevec.domain.model.ScoredPoint;
import org.learningjava.facevec.domain.model.VectorPoint;

import java.util.List;
import java.util.Set;

public interface StorageClientPort {

    Set<String> listCollections();

    void createCollection(String name, int vectorSize, DistanceMetric distance);

    void upsertPoints(String collectionName, List<VectorPoint> points);

    /** Ranked most-similar first. {@code filter} may be null. */
    List<ScoredPoint> searchPoints(String collectionName, float[] vector, PointFilter filter,
                                   int limit, boolean withPayload, boolean withVectors);

    List<VectorPoint> retrievePoints(String collectionName, List<String> ids,
                                     boolean withPayload, boolean withVectors);
}
