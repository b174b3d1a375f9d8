package it.unimib.datai.podman.common.errors;

/**
 * Handle on the HTTP response of a failed exchange, as supplied by the transport layer.
 * Implementations are read on every call and must not be mutated once handed to an exception.
 */
public interface ApiResponse {

    int statusCode();

    String reason();
}
