package com.poisearch.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Thrown when a referenced point of interest does not exist (HTTP 404).
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class PoiNotFoundException extends PoiSearchException {

    public static final String CODE = "dnexist";

    public PoiNotFoundException(long id) {
        super(CODE, "Point of interest " + id + " does not exist.");
    }
}
