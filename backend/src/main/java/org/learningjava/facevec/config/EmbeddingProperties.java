package org.learningjava.facevec.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.learningjava.facevec.domain.options.EmbeddingOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Component
@Validated
@ConfigurationProperties(prefix = "facevec.embedding")
public class EmbeddingProperties {
    @NotBlank
    private String modelPath = "models/arcface.onnx";
    private String expectedContentHash;
    private boolean verifyChecksum = true;
    @Pattern(regexp = "(?i)cpu|cuda")
    private String executionProvider = "cpu";
    @Min(0) @Max(15)
    private int cudaDeviceId = 0;
    @Min(1) @Max(EmbeddingOptions.MAX_BATCH_SIZE_LIMIT)
    private int maxBatchSize = 64;
    @DecimalMin("0.0") @DecimalMax(value = "1.0", inclusive = false)
    private double headroomFraction = 0.1;
    @Min(0)
    private int maxConcurrentBatches = 0;   // 0 = half the available processors
    private boolean fallbackEnabled = false;
    private boolean verboseLogging = false;

    public String getModelPath() { return modelPath; }
    public void setModelPath(String v) { this.modelPath = v; }
    public String getExpectedContentHash() { return expectedContentHash; }
    public void setExpectedContentHash(String v) { this.expectedContentHash = v; }
    public boolean isVerifyChecksum() { return verifyChecksum; }
    public void setVerifyChecksum(boolean v) { this.verifyChecksum = v; }
    public String getExecutionProvider() { return executionProvider; }
    public void setExecutionProvider(String v) { this.executionProvider = v; }
    public int getCudaDeviceId() { return cudaDeviceId; }
    public void setCudaDeviceId(int v) { this.cudaDeviceId = v; }
    public int getMaxBatchSize() { return maxBatchSize; }
    public void setMaxBatchSize(int v) { this.maxBatchSize = v; }
    public double getHeadroomFraction() { return headroomFraction; }
    public void setHeadroomFraction(double v) { this.headroomFraction = v; }
    public int getMaxConcurrentBatches() { return maxConcurrentBatches; }
    public void setMaxConcurrentBatches(int v) { this.maxConcurrentBatches = v; }
    public boolean isFallbackEnabled() { return fallbackEnabled; }
    public void setFallbackEnabled(boolean v) { this.fallbackEnabled = v; }
    public boolean isVerboseLogging() { return verboseLogging; }
    public void setVerboseLogging(boolean v) { this.verboseLogging = v; }

    public EmbeddingOptions toOptions() {
        return new EmbeddingOptions(
                Path.of(modelPath),
                expectedContentHash,
                verifyChecksum,
                executionProvider,
                cudaDeviceId,
                maxBatchSize,
                headroomFraction,
                maxConcurrentBatches,
                fallbackEnabled,
                verboseLogging
        );
    }
}
