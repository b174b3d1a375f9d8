package it.unimib.datai.podman.common.errors;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PodmanConnectionExceptionTest {

    @Test
    void rendersMessageHostAndFilteredEnvironment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("DOCKER_HOST", "tcp://x");
        env.put("UNRELATED", "y");

        PodmanConnectionException ex = new PodmanConnectionException(
                "cannot connect", env, "unix:///var/run/podman.sock", null);

        assertThat(ex.render()).isEqualTo(String.join(" | ",
                "cannot connect",
                "Host: unix:///var/run/podman.sock",
                "Environment:\n  DOCKER_HOST=tcp://x"));
        assertThat(ex.render()).doesNotContain("UNRELATED");
    }

    @Test
    void environmentKeepsOriginalOrderAcrossBothNamingFamilies() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("CONTAINER_TLS_VERIFY", "1");
        env.put("AWS_SECRET_ACCESS_KEY", "hunter2");
        env.put("DOCKER_CERT_PATH", "/certs");
        env.put("CONTAINER_HOST", "ssh://core@host/run/podman/podman.sock");

        PodmanConnectionException ex = new PodmanConnectionException("cannot connect", env, null, null);

        assertThat(ex.render()).isEqualTo("cannot connect | Environment:"
                + "\n  CONTAINER_TLS_VERIFY=1"
                + "\n  DOCKER_CERT_PATH=/certs"
                + "\n  CONTAINER_HOST=ssh://core@host/run/podman/podman.sock");
        assertThat(ex.render()).doesNotContain("hunter2");
        assertThat(ex.relevantEnvironment()).containsOnlyKeys("CONTAINER_TLS_VERIFY", "DOCKER_CERT_PATH", "CONTAINER_HOST");
        assertThat(ex.environment()).containsKey("AWS_SECRET_ACCESS_KEY");
    }

    @Test
    void environmentWithoutRelevantEntriesAddsNoSegment() {
        PodmanConnectionException ex = new PodmanConnectionException(
                "cannot connect", Map.of("PATH", "/usr/bin"), null, null);

        assertThat(ex.render()).isEqualTo("cannot connect");
    }

    @Test
    void emptyHostIsSkipped() {
        PodmanConnectionException ex = new PodmanConnectionException("cannot connect", null, "", null);

        assertThat(ex.render()).isEqualTo("cannot connect");
    }

    @Test
    void causeIsRenderedLastAndChained() {
        IOException io = new IOException("Connection refused");

        PodmanConnectionException ex = new PodmanConnectionException(
                "cannot connect", Map.of("CONTAINER_HOST", "tcp://10.0.0.5:8080"), "tcp://10.0.0.5:8080", io);

        assertThat(ex.render()).isEqualTo("cannot connect | Host: tcp://10.0.0.5:8080"
                + " | Environment:\n  CONTAINER_HOST=tcp://10.0.0.5:8080"
                + " | Caused by: Connection refused");
        assertThat(ex.getCause()).isSameAs(io);
        assertThat(ex.originalError()).isSameAs(io);
    }

    @Test
    void libraryCauseIsRenderedThroughItsOwnRendering() {
        ApiException transport = ApiException.transportFailure("handshake failed", "EOF", null);

        PodmanConnectionException ex = new PodmanConnectionException("cannot connect", null, null, transport);

        assertThat(ex.render()).isEqualTo("cannot connect | Caused by: handshake failed (EOF)");
    }

    @Test
    void causeWithoutMessageFallsBackToToString() {
        PodmanConnectionException ex = new PodmanConnectionException(
                "cannot connect", null, null, new IllegalStateException());

        assertThat(ex.render()).isEqualTo("cannot connect | Caused by: java.lang.IllegalStateException");
    }

    @Test
    void nullKeyInEnvironmentIsFilteredOut() {
        Map<String, String> env = new HashMap<>();
        env.put(null, "x");
        env.put("DOCKER_HOST", "tcp://x");

        PodmanConnectionException ex = new PodmanConnectionException("cannot connect", env, null, null);

        assertThat(ex.relevantEnvironment()).containsOnlyKeys("DOCKER_HOST");
        assertThat(ex.getMessage()).isEqualTo("cannot connect | Environment:\n  DOCKER_HOST=tcp://x");
    }

    @Test
    void messageOnly() {
        PodmanConnectionException ex = new PodmanConnectionException("cannot connect");

        assertThat(ex.getMessage()).isEqualTo("cannot connect");
        assertThat(ex.kind()).isEqualTo(ErrorKind.CONNECTION);
        assertThat(ex.relevantEnvironment()).isEmpty();
    }
}
