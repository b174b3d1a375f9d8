package it.unimib.datai.podman.common.errors;

/**
 * Base class for conditions reported by this library itself, as opposed to arbitrary exceptions
 * thrown by the code underneath it.
 */
public abstract class PodmanException extends DockerException {

    protected PodmanException(String message) {
        super(message);
    }

    protected PodmanException(String message, Throwable cause) {
        super(message, cause);
    }
}
