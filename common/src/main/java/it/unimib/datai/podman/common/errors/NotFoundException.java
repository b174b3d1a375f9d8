package it.unimib.datai.podman.common.errors;

/**
 * Resource not found on the service. Named for compatibility with the Docker client taxonomy.
 */
public class NotFoundException extends ApiException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, ApiResponse response) {
        super(message, response);
    }

    public NotFoundException(String message, ApiResponse response, String explanation) {
        super(message, response, explanation);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
