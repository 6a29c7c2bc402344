package com.chanakya.sessiontoken.util;

import com.chanakya.sessiontoken.exception.TokenDecodeException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

public final class Base64UrlUtil {

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Encoder PADDED_ENCODER = Base64.getUrlEncoder();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private Base64UrlUtil() {}

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    public static String encode(String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Encodes with trailing '=' padding, so 32 bytes always yield 44 characters.
     */
    public static String encodePadded(byte[] data) {
        return PADDED_ENCODER.encodeToString(data);
    }

    /**
     * Decodes padded or unpadded base64url text.
     *
     * @throws TokenDecodeException if the text uses characters outside the URL-safe
     *                              alphabet or has an impossible length or padding
     */
    public static byte[] decode(String encoded) {
        return decode(encoded, "value");
    }

    public static byte[] decode(String encoded, String segment) {
        try {
            return DECODER.decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new TokenDecodeException(segment, "Malformed base64url " + segment, e);
        }
    }

    public static String decodeToString(String encoded) {
        return new String(decode(encoded), StandardCharsets.UTF_8);
    }
}
