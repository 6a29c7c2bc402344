package com.chanakya.sessiontoken.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.chanakya.sessiontoken.util.Base64UrlUtil;

@DisplayName("SessionSigner")
class SessionSignerTest {

    private final SessionSigner signer = new SessionSigner();

    @Test
    @DisplayName("should produce the same signature for the same key")
    void shouldBeDeterministic() {
        assertEquals(signer.signature("xyz", "abc"), signer.signature("xyz", "abc"));
    }

    @Test
    @DisplayName("should produce different signatures for different keys")
    void shouldDependOnKey() {
        assertNotEquals(signer.signature("xyz", "abc"), signer.signature("xyz", "qrs"));
    }

    @Test
    @DisplayName("should produce a 256-bit digest")
    void shouldProduce256BitDigest() {
        assertEquals(32, signer.sign("xyz", "abc").length);
        assertEquals(43, signer.signature("xyz", "abc").length());
    }

    @Test
    @DisplayName("should match the HMAC-SHA256 reference vector")
    void shouldMatchReferenceVector() {
        // HMAC-SHA256(key="key", "The quick brown fox jumps over the lazy dog")
        byte[] expected = hex("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8");
        assertEquals(Base64UrlUtil.encode(expected),
                signer.signature("The quick brown fox jumps over the lazy dog", "key"));
    }

    @Test
    @DisplayName("should verify only the matching signature")
    void shouldVerify() {
        String signature = signer.signature("xyz", "abc");

        assertTrue(signer.verify("xyz", signature, "abc"));
        assertFalse(signer.verify("xyz", signature, "qrs"));
        assertFalse(signer.verify("xyw", signature, "abc"));
        assertFalse(signer.verify("xyz", "", "abc"));
    }

    @Test
    @DisplayName("should reject other encodings of the same signature bytes")
    void shouldRejectAlternateEncodings() {
        String signature = signer.signature("xyz", "abc");

        assertFalse(signer.verify("xyz", signature + "=", "abc"));
        assertFalse(signer.verify("xyz", flipLowBit(signature), "abc"));
    }

    private static String flipLowBit(String segment) {
        String alphabet = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_";
        char last = segment.charAt(segment.length() - 1);
        char flipped = alphabet.charAt(alphabet.indexOf(last) ^ 1);
        return segment.substring(0, segment.length() - 1) + flipped;
    }

    private static byte[] hex(String s) {
        byte[] out = new byte[s.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) Integer.parseInt(s.substring(2 * i, 2 * i + 2), 16);
        }
        return out;
    }
}
