package com.chanakya.sessiontoken.exception;

import lombok.Getter;

@Getter
public class TokenDecodeException extends RuntimeException {

    private final String segment;

    public TokenDecodeException(String segment, String message, Throwable cause) {
        super(message, cause);
        this.segment = segment;
    }
}
