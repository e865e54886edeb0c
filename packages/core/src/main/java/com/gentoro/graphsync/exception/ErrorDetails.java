package com.gentoro.graphsync.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for structured logging. */
public record ErrorDetails(
    String type,
    String message,
    GraphSyncErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
