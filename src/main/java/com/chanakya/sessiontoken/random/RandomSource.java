package com.chanakya.sessiontoken.random;

import java.util.Random;

/**
 * The generator chosen for session ids and secret keys.
 *
 * @param generator         a {@link java.security.SecureRandom} when one could be created,
 *                          otherwise a plain {@link Random}
 * @param usingSecureSource whether {@code generator} is cryptographically secure
 */
public record RandomSource(Random generator, boolean usingSecureSource) {

    public byte[] randomBytes(int length) {
        byte[] out = new byte[length];
        generator.nextBytes(out);
        return out;
    }
}
