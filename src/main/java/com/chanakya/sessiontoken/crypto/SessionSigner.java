package com.chanakya.sessiontoken.crypto;

import com.chanakya.sessiontoken.util.Base64UrlUtil;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

@Service
public class SessionSigner {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    /**
     * Computes HMAC-SHA256 over the UTF-8 bytes of the payload segment.
     */
    public byte[] sign(String payloadSegment, String secretKey) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secretKey.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(payloadSegment.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Session signing failed", e);
        }
    }

    public String signature(String payloadSegment, String secretKey) {
        return Base64UrlUtil.encode(sign(payloadSegment, secretKey));
    }

    /**
     * Constant-time comparison of the expected signature segment with the presented one.
     * Compares encoded text, so only the exact unpadded encoding verifies.
     */
    public boolean verify(String payloadSegment, String signatureSegment, String secretKey) {
        byte[] expected = signature(payloadSegment, secretKey).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, signatureSegment.getBytes(StandardCharsets.UTF_8));
    }
}
