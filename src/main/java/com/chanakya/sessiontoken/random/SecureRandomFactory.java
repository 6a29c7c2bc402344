package com.chanakya.sessiontoken.random;

import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;

@FunctionalInterface
public interface SecureRandomFactory {

    SecureRandom create() throws NoSuchAlgorithmException;

    /**
     * Uses the platform default when {@code algorithm} is blank, otherwise
     * {@link SecureRandom#getInstance(String)}.
     */
    static SecureRandomFactory forAlgorithm(String algorithm) {
        if (algorithm == null || algorithm.isBlank()) {
            return SecureRandom::new;
        }
        return () -> SecureRandom.getInstance(algorithm);
    }
}
