package com.nisfix.compliance.exception;

import java.time.OffsetDateTime;

/**
 * JSON body of every failed request. {@code error} is the stable machine-readable code.
 */
public record ErrorResponse(String error, String message, int status, OffsetDateTime timestamp, String path) {}
