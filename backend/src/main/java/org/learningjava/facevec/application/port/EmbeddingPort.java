package org.learningjava.facevec.application.port;

import org.learningjava.facevec.domain.concurrent.CancellationToken;
import org.learningjava.facevec.domain.model.ModelInfo;

import java.util.stream.Stream;

public interface EmbeddingPort {

    /** One L2-normalized vector for one aligned face image. */
    float[] generate(byte[] image, CancellationToken cancellation);

    default float[] generate(byte[] image) {
        return generate(image, CancellationToken.NONE);
    }

    /**
     * Lazily embeds {@code images} in input order. The returned stream pulls from the
     * source on demand and can be consumed once.
     */
    Stream<float[]> generateBatch(Iterable<byte[]> images, CancellationToken cancellation);

    default Stream<float[]> generateBatch(Iterable<byte[]> images) {
        return generateBatch(images, CancellationToken.NONE);
    }

    ModelInfo modelInfo();
}
