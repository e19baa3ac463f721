package org.learningjava.facevec.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.learningjava.facevec.domain.options.VectorStoreOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

@Component
@Validated
@ConfigurationProperties(prefix = "facevec.store")
public class VectorStoreProperties {
    @NotBlank
    private String endpoint = VectorStoreOptions.DEFAULT_ENDPOINT;
    private String apiKey;
    @NotBlank
    private String collectionName = VectorStoreOptions.DEFAULT_COLLECTION;
    private int vectorSize = VectorStoreOptions.REQUIRED_VECTOR_SIZE;
    private boolean autoCreateCollection = true;
    private boolean ensureOnStartup = true;
    @Min(1)
    private long timeoutMs = 5000;

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String v) { this.endpoint = v; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String v) { this.apiKey = v; }
    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String v) { this.collectionName = v; }
    public int getVectorSize() { return vectorSize; }
    public void setVectorSize(int v) { this.vectorSize = v; }
    public boolean isAutoCreateCollection() { return autoCreateCollection; }
    public void setAutoCreateCollection(boolean v) { this.autoCreateCollection = v; }
    public boolean isEnsureOnStartup() { return ensureOnStartup; }
    public void setEnsureOnStartup(boolean v) { this.ensureOnStartup = v; }
    public long getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(long v) { this.timeoutMs = v; }

    public VectorStoreOptions toOptions() {
        return new VectorStoreOptions(
                URI.create(endpoint),
                apiKey,
                collectionName,
                vectorSize,
                autoCreateCollection,
                Duration.ofMillis(timeoutMs)
        );
    }
}
