package telemetry.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HashesTest {

    @Test
    void sha256HexMatchesKnownDigest() {
        // SHA-256("abc") = ba7816bf 8f01cfea ...
        assertEquals("ba7816bf", Hashes.sha256Hex("abc", 4));
        assertEquals("ba7816bf8f01cfea", Hashes.sha256Hex("abc", 8));
    }

    @Test
    void sha256HexRejectsOutOfRangeLength() {
        assertThrows(IllegalArgumentException.class, () -> Hashes.sha256Hex("abc", 0));
        assertThrows(IllegalArgumentException.class, () -> Hashes.sha256Hex("abc", 33));
    }
}
