package org.learningjava.facevec.domain.service.embedding;

import org.learningjava.facevec.domain.error.ImageDecodeException;
import org.learningjava.facevec.domain.model.FloatTensor;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;

/**
 * Turns an aligned face crop into a {@code [1, 3, 112, 112]} tensor.
 *
 * <p>Pixels are mapped through {@code (v - 127.5) / 128} and written in B, G, R
 * channel order, which is the layout the ArcFace model expects. Stateless and
 * safe to share between threads.</p>
 */
public final class ImagePreprocessor {

    public static final int TARGET_SIZE = 112;
    private static final float MEAN = 127.5f;
    private static final float STD = 128f;

    private ImagePreprocessor() {}

    public static FloatTensor toTensor(byte[] imageBytes) {
        Objects.requireNonNull(imageBytes, "imageBytes");
        if (imageBytes.length == 0) {
            throw new ImageDecodeException("Image payload is empty");
        }
        return toTensor(new ByteArrayInputStream(imageBytes));
    }

    public static FloatTensor toTensor(InputStream source) {
        Objects.requireNonNull(source, "source");
        BufferedImage image;
        try {
            image = ImageIO.read(source);
        } catch (IOException | RuntimeException e) {
            throw new ImageDecodeException("Could not decode image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ImageDecodeException("Unsupported or corrupt image format");
        }

        BufferedImage rgb = resize(image);
        FloatTensor tensor = new FloatTensor(1, 3, TARGET_SIZE, TARGET_SIZE);
        for (int y = 0; y < TARGET_SIZE; y++) {
            for (int x = 0; x < TARGET_SIZE; x++) {
                int pixel = rgb.getRGB(x, y);
                int r = (pixel >> 16) & 0xFF;
                int g = (pixel >> 8) & 0xFF;
                int b = pixel & 0xFF;
                tensor.set(0, 0, y, x, normalize(b));
                tensor.set(0, 1, y, x, normalize(g));
                tensor.set(0, 2, y, x, normalize(r));
            }
        }
        return tensor;
    }

    static float normalize(int channelValue) {
        return (channelValue - MEAN) / STD;
    }

    private static BufferedImage resize(BufferedImage source) {
        if (source.getWidth() == TARGET_SIZE && source.getHeight() == TARGET_SIZE
                && source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage out = new BufferedImage(TARGET_SIZE, TARGET_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, TARGET_SIZE, TARGET_SIZE, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
