package it.unimib.datai.podman.client.config;

import it.unimib.datai.podman.common.errors.PodmanConnectionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection settings after environment overrides were applied.
 *
 * @param environment the connection variables that were set when resolving, used for diagnostics
 */
public record ResolvedConnection(
        String serviceName,
        String host,
        String identity,
        boolean tlsVerify,
        String certPath,
        Map<String, String> environment
) {

    public ResolvedConnection {
        environment = environment == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    /**
     * Builds the exception for a failed connection attempt to {@link #host()}, carrying the
     * environment snapshot taken at resolution time.
     */
    public PodmanConnectionException failure(String message, Throwable cause) {
        return new PodmanConnectionException(message, environment, host, cause);
    }
}
