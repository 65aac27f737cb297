package com.queryguard.controller.rest;

import java.time.Instant;
import org.springframework.http.HttpStatus;

/** JSON body of every client-visible error; {@code path} is null outside a servlet request. */
public record ErrorPayload(Instant timestamp, int status, String error, String message, String path) {

    static ErrorPayload of(HttpStatus status, String message, String path) {
        return new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message, path);
    }
}
