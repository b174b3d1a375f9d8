package it.unimib.datai.podman.common.errors;

/**
 * Common view over every exception raised by this library, including the ones that do not
 * share a superclass ({@link ApiException}, {@link StreamParseException}).
 */
public interface PodmanFailure {

    ErrorKind kind();

    /**
     * Human-readable diagnostic. Deterministic and free of side effects.
     */
    String render();
}
