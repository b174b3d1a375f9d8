package it.unimib.datai.podman.common.errors;

/**
 * Root of the library-native hierarchy under its Docker-compatible name, so handlers written
 * against that naming still match.
 */
public abstract class DockerException extends RuntimeException implements PodmanFailure {

    protected DockerException(String message) {
        super(message);
    }

    protected DockerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String render() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return render();
    }
}
