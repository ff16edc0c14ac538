package io.github.loregraph.exception;

/**
 * RFC 7807 problem body.
 */
public record ErrorResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance) {
}
