package telemetry.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 helpers shared by the sampler and the privacy scrubber.
 */
public final class Hashes {
    private static final HexFormat HEX = HexFormat.of();

    private Hashes() {
    }

    /**
     * Returns the SHA-256 digest of the UTF-8 bytes of {@code value}.
     */
    public static byte[] sha256(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Returns the lowercase hex form of the first {@code bytes} bytes of the SHA-256 digest.
     *
     * @param value the text to hash
     * @param bytes number of digest bytes to keep, 1 to 32
     */
    public static String sha256Hex(String value, int bytes) {
        if (bytes < 1 || bytes > 32) {
            throw new IllegalArgumentException("bytes must be in [1, 32], got: " + bytes);
        }
        return HEX.formatHex(sha256(value), 0, bytes);
    }
}
