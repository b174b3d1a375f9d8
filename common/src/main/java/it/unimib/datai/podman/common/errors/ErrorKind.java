package it.unimib.datai.podman.common.errors;

/**
 * Classification shared by every exception of the taxonomy, so callers can switch on a
 * value instead of walking the type hierarchy or matching message text.
 */
public enum ErrorKind {
    /** HTTP 4xx: the request was wrong and must be corrected before it is sent again. */
    CLIENT_ERROR(false),
    /** HTTP 5xx: the service failed; a later attempt may succeed. */
    SERVER_ERROR(true),
    NOT_FOUND(false),
    IMAGE_NOT_FOUND(false),
    /** The HTTP exchange failed without a status code (I/O error, aborted exchange). */
    TRANSPORT(true),
    /** A response arrived with a status that is neither a success nor a 4xx/5xx error. */
    UNEXPECTED_STATUS(false),
    /** A streamed payload could not be decoded; the stream has to be fetched again. */
    STREAM_PARSE(false),
    /** No connection to the service could be established. */
    CONNECTION(true),
    BUILD(false),
    CONTAINER(false),
    INVALID_ARGUMENT(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether repeating the same call unchanged can succeed. Backoff is up to the caller.
     */
    public boolean retryable() {
        return retryable;
    }
}
