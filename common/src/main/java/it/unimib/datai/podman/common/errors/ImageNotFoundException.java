package it.unimib.datai.podman.common.errors;

/**
 * Image not found on the service.
 *
 * <p>Deliberately not a subtype of {@link NotFoundException}: callers that pull and retry on a
 * missing image catch this type alone.
 */
public class ImageNotFoundException extends ApiException {

    public ImageNotFoundException(String message) {
        super(message);
    }

    public ImageNotFoundException(String message, ApiResponse response) {
        super(message, response);
    }

    public ImageNotFoundException(String message, ApiResponse response, String explanation) {
        super(message, response, explanation);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.IMAGE_NOT_FOUND;
    }
}
