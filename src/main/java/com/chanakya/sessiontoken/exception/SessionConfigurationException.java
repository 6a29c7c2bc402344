package com.chanakya.sessiontoken.exception;

/**
 * Raised when a session token operation is called with arguments or settings
 * that can never succeed, such as signing without a secret key.
 */
public class SessionConfigurationException extends RuntimeException {
    public SessionConfigurationException(String message) {
        super(message);
    }
}
