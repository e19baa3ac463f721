package org.learningjava.facevec.domain.options;

import java.net.URI;
import java.time.Duration;

/**
 * Validated, immutable vector store configuration.
 */
public record VectorStoreOptions(
        URI endpoint,
        String apiKey,
        String collectionName,
        int vectorSize,
        boolean autoCreateCollection,
        Duration timeout
) {

    /** The only vector size this store accepts (ArcFace embeddings). */
    public static final int REQUIRED_VECTOR_SIZE = 512;
    public static final int MAX_TOP_K = 10_000;
    public static final String DEFAULT_COLLECTION = "arcface-sandbox";
    public static final String DEFAULT_ENDPOINT = "http://localhost:6333";

    public VectorStoreOptions {
        if (endpoint == null || !endpoint.isAbsolute()
                || !("http".equalsIgnoreCase(endpoint.getScheme()) || "https".equalsIgnoreCase(endpoint.getScheme()))) {
            throw new IllegalArgumentException("endpoint must be an absolute http(s) URL, got " + endpoint);
        }
        if (collectionName == null || collectionName.isBlank()) {
            throw new IllegalArgumentException("collectionName is required");
        }
        if (vectorSize != REQUIRED_VECTOR_SIZE) {
            throw new IllegalArgumentException("vectorSize must be " + REQUIRED_VECTOR_SIZE + ", got " + vectorSize);
        }
        apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
        timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeout);
        }
    }

    public static VectorStoreOptions defaults() {
        return new VectorStoreOptions(URI.create(DEFAULT_ENDPOINT), null, DEFAULT_COLLECTION,
                REQUIRED_VECTOR_SIZE, true, Duration.ofSeconds(5));
    }

    public VectorStoreOptions withAutoCreateCollection(boolean autoCreate) {
        return new VectorStoreOptions(endpoint, apiKey, collectionName, vectorSize, autoCreate, timeout);
    }

    public VectorStoreOptions withCollectionName(String name) {
        return new VectorStoreOptions(endpoint, apiKey, name, vectorSize, autoCreateCollection, timeout);
    }
}
