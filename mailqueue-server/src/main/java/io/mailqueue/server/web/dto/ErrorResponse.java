package io.mailqueue.server.web.dto;

import java.time.Instant;

/**
 * Generic error response.
 *
 * @param code      machine-readable code
 * @param message   human readable message
 * @param timestamp when the error was produced
 */
public record ErrorResponse(String code, String message, Instant timestamp) {}
