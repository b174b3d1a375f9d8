package it.unimib.datai.podman.client.http;

import it.unimib.datai.podman.common.errors.ApiResponse;

import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * {@link ApiResponse} view over a JDK {@link HttpResponse}. Wraps the response the transport
 * received, it does not copy it.
 */
public final class HttpApiResponse implements ApiResponse {
    private final HttpResponse<?> response;

    private HttpApiResponse(HttpResponse<?> response) {
        this.response = response;
    }

    public static HttpApiResponse of(HttpResponse<?> response) {
        return new HttpApiResponse(Objects.requireNonNull(response, "response"));
    }

    @Override
    public int statusCode() {
        return response.statusCode();
    }

    @Override
    public String reason() {
        return ReasonPhrases.of(response.statusCode());
    }

    public HttpResponse<?> unwrap() {
        return response;
    }

    @Override
    public String toString() {
        return "HttpApiResponse[" + response.statusCode() + " " + response.uri() + "]";
    }
}
