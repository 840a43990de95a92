package com.poisearch.exception;

import lombok.Getter;

/**
 * Base class for application errors reported to clients.
 * <p>
 * Each error carries a short stable {@code code} naming the error kind, next to a
 * human-readable message.
 * </p>
 */
@Getter
public abstract class PoiSearchException extends RuntimeException {

    private final String code;

    protected PoiSearchException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected PoiSearchException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
