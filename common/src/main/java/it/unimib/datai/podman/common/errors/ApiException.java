package it.unimib.datai.podman.common.errors;

/**
 * Failure of an HTTP exchange with the service.
 *
 * <p>The status code is read from the attached {@link ApiResponse} each time it is needed, so
 * it reflects the response state at call time. Once a response is attached its reason phrase
 * replaces the message given to the constructor when the exception is rendered; the explanation
 * is appended in parentheses and never replaces anything.
 */
public class ApiException extends RuntimeException implements PodmanFailure {
    private final transient ApiResponse response;
    private final String explanation;

    public ApiException(String message) {
        this(message, null, null, null);
    }

    public ApiException(String message, ApiResponse response) {
        this(message, response, null, null);
    }

    public ApiException(String message, ApiResponse response, String explanation) {
        this(message, response, explanation, null);
    }

    private ApiException(String message, ApiResponse response, String explanation, Throwable cause) {
        super(message, cause);
        this.response = response;
        this.explanation = explanation;
    }

    /**
     * Exchange that failed before any response arrived.
     */
    public static ApiException transportFailure(String message, String explanation, Throwable cause) {
        return new ApiException(message, null, explanation, cause);
    }

    public ApiResponse response() {
        return response;
    }

    public String explanation() {
        return explanation;
    }

    /**
     * @return the response status code, or {@code null} when no response is attached
     */
    public Integer statusCode() {
        if (response == null) {
            return null;
        }
        return response.statusCode();
    }

    public boolean isError() {
        return isClientError() || isServerError();
    }

    public boolean isClientError() {
        int code = statusOrZero();
        return code >= 400 && code < 500;
    }

    public boolean isServerError() {
        int code = statusOrZero();
        return code >= 500 && code < 600;
    }

    @Override
    public ErrorKind kind() {
        if (isClientError()) {
            return ErrorKind.CLIENT_ERROR;
        }
        if (isServerError()) {
            return ErrorKind.SERVER_ERROR;
        }
        return response == null ? ErrorKind.TRANSPORT : ErrorKind.UNEXPECTED_STATUS;
    }

    @Override
    public String render() {
        String msg = super.getMessage();
        if (response != null) {
            msg = response.reason();
        }

        if (isClientError()) {
            msg = statusCode() + " Client Error: " + msg;
        } else if (isServerError()) {
            msg = statusCode() + " Server Error: " + msg;
        }

        if (explanation != null && !explanation.isEmpty()) {
            msg = msg + " (" + explanation + ")";
        }
        return msg;
    }

    @Override
    public String getMessage() {
        return render();
    }

    private int statusOrZero() {
        Integer code = statusCode();
        return code == null ? 0 : code;
    }
}
