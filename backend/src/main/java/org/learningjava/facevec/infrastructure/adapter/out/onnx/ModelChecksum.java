package org.learningjava.facevec.infrastructure.adapter.out.onnx;

import org.learningjava.facevec.domain.error.ModelUnavailableException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

final class ModelChecksum {

    private ModelChecksum() {}

    static String sha256(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] buf = new byte[64 * 1024];
            int read;
            while ((read = in.read(buf)) != -1) {
                digest.update(buf, 0, read);
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (IOException e) {
            throw new ModelUnavailableException("Could not read model file " + file + ": " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static void verify(Path file, String expectedSha256) {
        String expected = expectedSha256.replace(" ", "").toLowerCase(Locale.ROOT);
        String actual = sha256(file);
        if (!actual.equals(expected)) {
            throw new ModelUnavailableException("Model checksum mismatch for " + file
                    + ". Expected " + expected + ", got " + actual);
        }
    }
}
