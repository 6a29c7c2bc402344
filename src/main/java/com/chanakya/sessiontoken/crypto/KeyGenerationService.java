package com.chanakya.sessiontoken.crypto;

import com.chanakya.sessiontoken.random.RandomSource;
import com.chanakya.sessiontoken.random.RandomSourceProvider;
import com.chanakya.sessiontoken.util.Base64UrlUtil;
import org.springframework.stereotype.Service;

@Service
public class KeyGenerationService {

    private static final int RANDOM_BYTES = 32;

    private final RandomSourceProvider randomSourceProvider;

    public KeyGenerationService(RandomSourceProvider randomSourceProvider) {
        this.randomSourceProvider = randomSourceProvider;
    }

    /**
     * Generates a 256-bit random id as base64url (43 chars).
     */
    public String generateRandomId(String secretKey) {
        return Base64UrlUtil.encode(nextBytes(secretKey));
    }

    /**
     * Generates a 256-bit secret key as padded base64url (44 chars).
     */
    public String generateSecretKey(String secretKey) {
        return Base64UrlUtil.encodePadded(nextBytes(secretKey));
    }

    private byte[] nextBytes(String secretKey) {
        RandomSource source = randomSourceProvider.obtain();
        randomSourceProvider.reseedIfNeeded(source, secretKey);
        return source.randomBytes(RANDOM_BYTES);
    }
}
