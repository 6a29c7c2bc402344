package com.chanakya.sessiontoken.crypto;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.chanakya.sessiontoken.exception.SessionConfigurationException;
import com.chanakya.sessiontoken.exception.TokenDecodeException;
import com.chanakya.sessiontoken.util.Base64UrlUtil;
import tools.jackson.databind.json.JsonMapper;

@DisplayName("SessionPayloadEncoder")
class SessionPayloadEncoderTest {

    private final SessionPayloadEncoder encoder = new SessionPayloadEncoder(JsonMapper.builder().build());

    @Test
    @DisplayName("should write compact JSON with session_id first")
    void shouldWriteSessionIdFirst() {
        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("user", "alice");
        extra.put("foo", 10);

        String segment = encoder.encode("abc", extra);

        assertEquals("{\"session_id\":\"abc\",\"user\":\"alice\",\"foo\":10}", Base64UrlUtil.decodeToString(segment));
    }

    @Test
    @DisplayName("should accept a null extra payload")
    void shouldAcceptNullExtra() {
        assertEquals("{\"session_id\":\"abc\"}", Base64UrlUtil.decodeToString(encoder.encode("abc", null)));
    }

    @Test
    @DisplayName("should reject an extra payload that reuses session_id")
    void shouldRejectReservedKey() {
        assertThrows(SessionConfigurationException.class, () -> encoder.encode("abc", Map.of("session_id", 10)));
    }

    @Test
    @DisplayName("should decode nested values in order")
    void shouldDecode() {
        String segment = encoder.encode("abc", Map.of("roles", List.of("admin", "viewer")));

        Map<String, Object> payload = encoder.decode(segment);

        assertEquals(List.of("session_id", "roles"), List.copyOf(payload.keySet()));
        assertEquals(List.of("admin", "viewer"), payload.get("roles"));
    }

    @Test
    @DisplayName("should reject payloads that are not JSON objects")
    void shouldRejectNonObjects() {
        assertThrows(TokenDecodeException.class, () -> encoder.decode(Base64UrlUtil.encode("[1,2]")));
        assertThrows(TokenDecodeException.class, () -> encoder.decode(Base64UrlUtil.encode("null")));
        assertThrows(TokenDecodeException.class, () -> encoder.decode(Base64UrlUtil.encode("not json")));
        assertThrows(TokenDecodeException.class, () -> encoder.decode("!!"));
    }
}
