package com.queryguard.service.core.model;

/** A time range that is empty, inverted, or in the wrong relation to another range. */
public class InvalidRangeException extends IllegalArgumentException {

    public InvalidRangeException(String message) {
        super(message);
    }
}
