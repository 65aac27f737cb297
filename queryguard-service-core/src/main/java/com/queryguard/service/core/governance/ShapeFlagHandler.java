package com.queryguard.service.core.governance;

/** Receives flagged shapes from the dispatch bus, one dedicated worker thread per handler. */
public interface ShapeFlagHandler {
    void handle(ShapeFlaggedEvent event);
}
