package com.chanakya.sessiontoken.random;

import com.chanakya.sessiontoken.config.SessionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.ProviderException;
import java.util.Random;
import java.util.function.BooleanSupplier;

@Component
public class RandomSourceProvider {

    private static final Logger log = LoggerFactory.getLogger(RandomSourceProvider.class);

    public static final String INSECURE_GENERATOR_WARNING =
            "A secure pseudo-random number generator is not available on your system. "
                    + "Falling back to a non-cryptographic generator.";
    public static final String MISSING_SECRET_KEY_WARNING =
            "A secure pseudo-random number generator is not available "
                    + "and no SESSION_SECRET_KEY has been set. "
                    + "Setting a secret key will mitigate the lack of a secure generator.";

    private final SecureRandomFactory secureRandomFactory;
    private final BooleanSupplier secretKeyConfigured;
    private volatile RandomSource randomSource;

    @Autowired
    public RandomSourceProvider(SessionProperties properties) {
        this(SecureRandomFactory.forAlgorithm(properties.randomAlgorithm()), properties::hasSecretKey);
    }

    public RandomSourceProvider(SecureRandomFactory secureRandomFactory, BooleanSupplier secretKeyConfigured) {
        this.secureRandomFactory = secureRandomFactory;
        this.secretKeyConfigured = secretKeyConfigured;
    }

    /**
     * Selects the generator on first use and returns the same one afterwards.
     *
     * <p>When no {@link java.security.SecureRandom} can be created this falls back to
     * {@link Random} and logs a warning, plus a second one if no secret key is configured to
     * reseed the fallback with. The choice and the warnings are held per provider; the
     * application runs a single provider bean, which makes them process-wide. Tests build
     * fresh providers to start from an unselected state.
     */
    public RandomSource obtain() {
        RandomSource source = randomSource;
        if (source == null) {
            synchronized (this) {
                source = randomSource;
                if (source == null) {
                    source = select();
                    randomSource = source;
                }
            }
        }
        return source;
    }

    /**
     * Mixes the secret key into the fallback generator's seed. Does nothing for a secure
     * source or when no key is given.
     */
    public void reseedIfNeeded(RandomSource source, String secretKey) {
        if (source.usingSecureSource() || secretKey == null || secretKey.isEmpty()) {
            return;
        }
        Random generator = source.generator();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(ByteBuffer.allocate(2 * Long.BYTES)
                    .putLong(generator.nextLong())
                    .putLong(System.nanoTime())
                    .array());
            digest.update(secretKey.getBytes(StandardCharsets.UTF_8));
            generator.setSeed(ByteBuffer.wrap(digest.digest()).getLong());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private RandomSource select() {
        try {
            return new RandomSource(secureRandomFactory.create(), true);
        } catch (NoSuchAlgorithmException | ProviderException e) {
            log.warn(INSECURE_GENERATOR_WARNING);
            if (!secretKeyConfigured.getAsBoolean()) {
                log.warn(MISSING_SECRET_KEY_WARNING);
            }
            return new RandomSource(new Random(), false);
        }
    }
}
