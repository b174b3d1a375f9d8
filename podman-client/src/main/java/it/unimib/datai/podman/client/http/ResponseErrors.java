package it.unimib.datai.podman.client.http;

import it.unimib.datai.podman.common.errors.ApiException;
import it.unimib.datai.podman.common.errors.ApiResponse;
import it.unimib.datai.podman.common.errors.ImageNotFoundException;
import it.unimib.datai.podman.common.errors.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Turns completed HTTP exchanges and transport failures into {@link ApiException}s.
 * Called by the transport layer; never issues or retries requests itself.
 */
public final class ResponseErrors {
    private static final Logger log = LoggerFactory.getLogger(ResponseErrors.class);

    static final String UNKNOWN_CAUSE = "Unknown";

    private ResponseErrors() {}

    public static void raiseForStatus(HttpResponse<String> response, ResourceKind resource) {
        raiseForStatus(HttpApiResponse.of(response), response.body(), resource);
    }

    /**
     * Returns normally for 2xx status codes. Redirects are not followed here, so a 3xx is an error.
     *
     * @throws ImageNotFoundException on 404 for {@link ResourceKind#IMAGE}
     * @throws NotFoundException on 404 for any other resource kind
     * @throws ApiException on every other non-2xx status
     */
    public static void raiseForStatus(ApiResponse response, String body, ResourceKind resource) {
        Objects.requireNonNull(response, "response");
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return;
        }

        ErrorBody err = ErrorBody.fromBody(body);
        String cause = err.cause() == null || err.cause().isBlank() ? UNKNOWN_CAUSE : err.cause();
        String explanation = err.message() == null || err.message().isBlank()
                ? "Request returned HTTP " + status
                : err.message();

        ApiException ex;
        if (status == 404 && resource == ResourceKind.IMAGE) {
            ex = new ImageNotFoundException(cause, response, explanation);
        } else if (status == 404) {
            ex = new NotFoundException(cause, response, explanation);
        } else {
            ex = new ApiException(cause, response, explanation);
        }
        log.debug("Request for {} failed: {}", resource, ex.render());
        throw ex;
    }

    /**
     * Exception for an exchange that produced no response at all.
     */
    public static ApiException transportFailure(String action, IOException cause) {
        String detail = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        log.debug("Transport failure during {}: {}", action, detail);
        return ApiException.transportFailure("I/O error during " + action, detail, cause);
    }

    /**
     * Exception for an exchange interrupted while waiting for the response. Restores the
     * interrupt flag.
     */
    public static ApiException interrupted(String action, InterruptedException cause) {
        Thread.currentThread().interrupt();
        return ApiException.transportFailure("Interrupted during " + action, null, cause);
    }
}
