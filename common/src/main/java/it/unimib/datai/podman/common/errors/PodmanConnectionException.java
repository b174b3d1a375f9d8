package it.unimib.datai.podman.common.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connecting to the service failed before any HTTP exchange took place.
 *
 * <p>Rendered as {@code " | "}-joined segments, always in this order: message, host,
 * environment, cause. Only the variables in {@link #RELEVANT_VARIABLES} are ever rendered.
 */
public class PodmanConnectionException extends PodmanException {

    public static final Set<String> RELEVANT_VARIABLES = Set.of(
            "DOCKER_HOST", "DOCKER_TLS_VERIFY", "DOCKER_CERT_PATH",
            "CONTAINER_HOST", "CONTAINER_TLS_VERIFY", "CONTAINER_CERT_PATH"
    );

    static final String SEPARATOR = " | ";

    private final Map<String, String> environment;
    private final String host;
    private final Throwable originalError;

    public PodmanConnectionException(String message) {
        this(message, null, null, null);
    }

    public PodmanConnectionException(String message, Map<String, String> environment, String host,
                                     Throwable originalError) {
        super(message, originalError);
        this.environment = environment == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        this.host = host;
        this.originalError = originalError;
    }

    public Map<String, String> environment() {
        return environment;
    }

    public String host() {
        return host;
    }

    public Throwable originalError() {
        return originalError;
    }

    /**
     * @return the allow-listed subset of {@link #environment()}, in its original order
     */
    public Map<String, String> relevantEnvironment() {
        if (environment == null) {
            return Map.of();
        }
        Map<String, String> relevant = new LinkedHashMap<>();
        environment.forEach((key, value) -> {
            if (key != null && RELEVANT_VARIABLES.contains(key)) {
                relevant.put(key, value);
            }
        });
        return relevant;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONNECTION;
    }

    @Override
    public String render() {
        List<String> segments = new ArrayList<>();
        segments.add(super.render());

        if (host != null && !host.isEmpty()) {
            segments.add("Host: " + host);
        }

        Map<String, String> relevant = relevantEnvironment();
        if (!relevant.isEmpty()) {
            StringBuilder env = new StringBuilder("Environment:");
            relevant.forEach((key, value) -> env.append("\n  ").append(key).append('=').append(value));
            segments.add(env.toString());
        }

        if (originalError != null) {
            segments.add("Caused by: " + describe(originalError));
        }
        return String.join(SEPARATOR, segments);
    }

    private static String describe(Throwable error) {
        if (error instanceof PodmanFailure) {
            return ((PodmanFailure) error).render();
        }
        String message = error.getMessage();
        return message != null ? message : error.toString();
    }
}
