package com.poisearch.exception;

import lombok.Getter;

/**
 * An index build or refresh attempt could not complete.
 * <p>
 * The snapshot served before the attempt stays valid. Retryable failures (store
 * timeouts, lock waits) are mapped to HTTP 503 so clients can try again.
 * </p>
 */
@Getter
public class IndexBuildException extends PoiSearchException {

    public static final String CODE = "ixbuild";

    private final boolean retryable;

    public IndexBuildException(String message, boolean retryable) {
        super(CODE, message);
        this.retryable = retryable;
    }

    public IndexBuildException(String message, boolean retryable, Throwable cause) {
        super(CODE, message, cause);
        this.retryable = retryable;
    }
}
