package com.chanakya.sessiontoken.crypto;

import com.chanakya.sessiontoken.exception.SessionConfigurationException;
import com.chanakya.sessiontoken.exception.TokenDecodeException;
import com.chanakya.sessiontoken.util.Base64UrlUtil;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class SessionPayloadEncoder {

    public static final String SESSION_ID_KEY = "session_id";

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SessionPayloadEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Builds {"session_id": ..., ...extra} and encodes its JSON as base64url.
     * The session id is always the first field.
     */
    public String encode(String sessionId, Map<String, ?> extraPayload) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SESSION_ID_KEY, sessionId);
        if (extraPayload != null) {
            if (extraPayload.containsKey(SESSION_ID_KEY)) {
                throw new SessionConfigurationException(
                        "extra_payload for session tokens may not contain '" + SESSION_ID_KEY + "'");
            }
            payload.putAll(extraPayload);
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JacksonException e) {
            throw new SessionConfigurationException("Session payload is not JSON serializable: " + e.getOriginalMessage());
        }
        return Base64UrlUtil.encode(json);
    }

    public Map<String, Object> decode(String payloadSegment) {
        byte[] json = Base64UrlUtil.decode(payloadSegment, "payload");
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JacksonException e) {
            throw new TokenDecodeException("payload", "Session payload is not a JSON object", e);
        }
        // a literal JSON null binds to null rather than failing
        if (payload == null) {
            throw new TokenDecodeException("payload", "Session payload is not a JSON object", null);
        }
        return payload;
    }
}
