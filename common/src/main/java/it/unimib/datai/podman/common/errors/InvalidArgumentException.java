package it.unimib.datai.podman.common.errors;

/**
 * Parameter to a library method was not valid.
 */
public class InvalidArgumentException extends PodmanException {

    public InvalidArgumentException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_ARGUMENT;
    }
}
