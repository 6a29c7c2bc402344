package com.chanakya.sessiontoken.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "session")
public record SessionProperties(
        String secretKey,
        boolean signSessions,
        String randomAlgorithm
) {

    public boolean hasSecretKey() {
        return secretKey != null && !secretKey.isEmpty();
    }
}
