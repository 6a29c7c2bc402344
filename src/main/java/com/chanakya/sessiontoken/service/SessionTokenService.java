package com.chanakya.sessiontoken.service;

import com.chanakya.sessiontoken.config.SessionProperties;
import com.chanakya.sessiontoken.crypto.KeyGenerationService;
import com.chanakya.sessiontoken.crypto.SessionPayloadEncoder;
import com.chanakya.sessiontoken.crypto.SessionSigner;
import com.chanakya.sessiontoken.exception.SessionConfigurationException;
import com.chanakya.sessiontoken.exception.TokenDecodeException;
import com.chanakya.sessiontoken.util.Base64UrlUtil;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Map;

@Service
public class SessionTokenService {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenService.class);

    private static final char SEPARATOR = '.';

    private final SessionProperties properties;
    private final KeyGenerationService keyGenerationService;
    private final SessionPayloadEncoder payloadEncoder;
    private final SessionSigner signer;

    public SessionTokenService(SessionProperties properties,
                               KeyGenerationService keyGenerationService,
                               SessionPayloadEncoder payloadEncoder,
                               SessionSigner signer) {
        this.properties = properties;
        this.keyGenerationService = keyGenerationService;
        this.payloadEncoder = payloadEncoder;
        this.signer = signer;
    }

    @PostConstruct
    public void validateConfiguration() {
        if (properties.signSessions() && !properties.hasSecretKey()) {
            throw new SessionConfigurationException(
                    "session.sign-sessions is enabled but no session.secret-key (SESSION_SECRET_KEY) is set");
        }
        log.info("Session tokens will be {}", properties.signSessions() ? "signed" : "unsigned");
    }

    public String generateSessionId() {
        return generateSessionId(Map.of());
    }

    public String generateSessionId(Map<String, ?> extraPayload) {
        return generateSessionId(properties.signSessions(), properties.secretKey(), extraPayload);
    }

    /**
     * Generates a new session token. An unsigned token is the base64url JSON payload; a signed
     * token appends {@code "." + base64url(HMAC-SHA256(secretKey, payloadSegment))}.
     *
     * @param signed       whether to append an HMAC signature
     * @param secretKey    signing key, required when {@code signed} is true
     * @param extraPayload additional payload fields, may be null; must not contain {@code session_id}
     * @throws SessionConfigurationException if {@code extraPayload} contains {@code session_id}
     *                                       or a signed token is requested without a key
     */
    public String generateSessionId(boolean signed, String secretKey, Map<String, ?> extraPayload) {
        if (signed && isMissing(secretKey)) {
            throw new SessionConfigurationException("A secret key is required to generate signed session ids");
        }

        String sessionId = keyGenerationService.generateRandomId(secretKey);
        String payloadSegment = payloadEncoder.encode(sessionId, extraPayload);
        if (!signed) {
            return payloadSegment;
        }
        return payloadSegment + SEPARATOR + signer.signature(payloadSegment, secretKey);
    }

    public boolean checkSessionIdSignature(String token) {
        return checkSessionIdSignature(token, properties.secretKey(), properties.signSessions());
    }

    /**
     * Checks the signature of a token. Malformed input of any kind yields {@code false}.
     * When {@code signed} is false every token passes.
     */
    public boolean checkSessionIdSignature(String token, String secretKey, boolean signed) {
        if (!signed) {
            return true;
        }
        if (token == null || isMissing(secretKey)) {
            return false;
        }

        int separator = token.indexOf(SEPARATOR);
        if (separator < 0 || separator != token.lastIndexOf(SEPARATOR)) {
            log.debug("Rejecting session token without exactly one separator");
            return false;
        }
        String payloadSegment = token.substring(0, separator);
        String signatureSegment = token.substring(separator + 1);

        try {
            Base64UrlUtil.decode(payloadSegment, "payload");
            Base64UrlUtil.decode(signatureSegment, "signature");
        } catch (TokenDecodeException e) {
            log.debug("Rejecting session token with undecodable {} segment", e.getSegment());
            return false;
        }
        return signer.verify(payloadSegment, signatureSegment, secretKey);
    }

    /**
     * Same as {@link #checkSessionIdSignature(String, String, boolean)} for a token received
     * as UTF-8 bytes.
     */
    public boolean checkSessionIdSignature(byte[] token, String secretKey, boolean signed) {
        if (!signed) {
            return true;
        }
        if (token == null) {
            return false;
        }
        return checkSessionIdSignature(new String(token, StandardCharsets.UTF_8), secretKey, true);
    }

    /**
     * Decodes the payload of a signed or unsigned token. Does not check the signature.
     *
     * @throws TokenDecodeException if the payload segment is not base64url JSON
     */
    public Map<String, Object> getTokenPayload(String token) {
        if (token == null) {
            throw new TokenDecodeException("payload", "Session token is missing", null);
        }
        int separator = token.indexOf(SEPARATOR);
        String payloadSegment = separator < 0 ? token : token.substring(0, separator);
        return payloadEncoder.decode(payloadSegment);
    }

    public String getSessionId(String token) {
        Object sessionId = getTokenPayload(token).get(SessionPayloadEncoder.SESSION_ID_KEY);
        if (!(sessionId instanceof String)) {
            throw new TokenDecodeException("payload", "Session payload has no session_id", null);
        }
        return (String) sessionId;
    }

    public String generateSecretKey() {
        return keyGenerationService.generateSecretKey(properties.secretKey());
    }

    private static boolean isMissing(String secretKey) {
        return secretKey == null || secretKey.isEmpty();
    }
}
