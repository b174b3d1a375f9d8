package it.unimib.datai.podman.client.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import it.unimib.datai.podman.common.errors.PodmanConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Stream;

public final class ConnectionConfigStore {
    private static final Logger log = LoggerFactory.getLogger(ConnectionConfigStore.class);

    static final String DEFAULT_HOST = "unix:///run/podman/podman.sock";

    // Snapshot order is fixed so diagnostics compare equal across runs.
    private static final List<String> SNAPSHOT_VARIABLES = PodmanConnectionException.RELEVANT_VARIABLES.stream()
            .sorted()
            .toList();

    private final Path path;
    private final ObjectMapper yaml;
    private final Function<String, String> getenv;

    public ConnectionConfigStore() {
        this(defaultPath(System::getenv), System::getenv);
    }

    public ConnectionConfigStore(Path path) {
        this(path, System::getenv);
    }

    public ConnectionConfigStore(Path path, Function<String, String> getenv) {
        this.path = path;
        this.getenv = getenv;
        this.yaml = new ObjectMapper(new YAMLFactory())
                .findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Reads the service table. A missing or empty file yields an empty table.
     */
    public ConnectionConfig load() {
        if (!Files.isRegularFile(path)) {
            log.debug("No connection config at {}", path);
            return new ConnectionConfig();
        }
        try {
            JsonNode root = yaml.readTree(path.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                return new ConnectionConfig();
            }
            return yaml.treeToValue(root, ConnectionConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config: " + path, e);
        }
    }

    /**
     * Resolves the service to talk to. Host precedence: {@code CONTAINER_HOST}, {@code DOCKER_HOST},
     * the active service of the config file ({@code CONTAINER_CONNECTION} selects another one),
     * then the rootful default socket.
     */
    public ResolvedConnection loadResolved() {
        ConnectionConfig cfg = load();

        String serviceName = firstNonBlank(getenv.apply("CONTAINER_CONNECTION"), cfg.getActiveService());
        ServiceDestination dest = (serviceName == null) ? null : cfg.getServices().get(serviceName);
        if (serviceName != null && dest == null) {
            log.debug("Service '{}' is not defined in {}", serviceName, path);
        }

        String host = firstNonBlank(
                getenv.apply("CONTAINER_HOST"),
                getenv.apply("DOCKER_HOST"),
                dest == null ? null : dest.getUri(),
                DEFAULT_HOST);
        String identity = dest == null ? null : dest.getIdentity();
        boolean tlsVerify = isTruthy(firstNonBlank(getenv.apply("CONTAINER_TLS_VERIFY"), getenv.apply("DOCKER_TLS_VERIFY")));
        String certPath = firstNonBlank(getenv.apply("CONTAINER_CERT_PATH"), getenv.apply("DOCKER_CERT_PATH"));

        return new ResolvedConnection(serviceName, host, identity, tlsVerify, certPath, environmentSnapshot());
    }

    public Path getPath() {
        return path;
    }

    private Map<String, String> environmentSnapshot() {
        Map<String, String> env = new LinkedHashMap<>();
        for (String name : SNAPSHOT_VARIABLES) {
            String value = getenv.apply(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        return env;
    }

    private static boolean isTruthy(String value) {
        if (value == null) {
            return false;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return !v.isEmpty() && !v.equals("0") && !v.equals("false") && !v.equals("no");
    }

    // $XDG_CONFIG_HOME/podman-java/config.yaml, falling back to ~/.config
    static Path defaultPath(Function<String, String> getenv) {
        String xdg = getenv.apply("XDG_CONFIG_HOME");
        Path base = (xdg == null || xdg.isBlank())
                ? Path.of(System.getProperty("user.home"), ".config")
                : Path.of(xdg);
        return base.resolve("podman-java").resolve("config.yaml");
    }

    private static String firstNonBlank(String... candidates) {
        return Stream.of(candidates)
                .filter(c -> c != null && !c.isBlank())
                .findFirst()
                .orElse(null);
    }
}
