package it.unimib.datai.podman.client.build;

import com.fasterxml.jackson.databind.JsonNode;
import it.unimib.datai.podman.common.errors.BuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Drains the JSON output of an image build. The log is collected in full before a
 * {@link BuildException} is raised, so the exception never depends on the open stream.
 */
public final class BuildLogCollector {
    private static final Logger log = LoggerFactory.getLogger(BuildLogCollector.class);

    static final String UNKNOWN_REASON = "Unknown";

    // "Successfully built 3f2a1b2c3d4e", or a full id on its own line with or without "sha256:"
    private static final Pattern IMAGE_ID = Pattern.compile(
            "^(?:Successfully built ([0-9a-f]{12,64})|(?:sha256:)?([0-9a-f]{64}))$");

    private BuildLogCollector() {}

    /**
     * @throws BuildException on an {@code error} entry, or when the stream ends without an image id
     */
    public static BuildResult collect(Iterator<JsonNode> stream) {
        List<String> lines = new ArrayList<>();
        String imageId = null;

        while (stream.hasNext()) {
            JsonNode entry = stream.next();

            String error = errorOf(entry);
            if (error != null) {
                log.debug("Build failed after {} log lines: {}", lines.size(), error);
                throw new BuildException(error, lines);
            }

            JsonNode chunk = entry.path("stream");
            if (chunk.isTextual()) {
                for (String line : chunk.asText().split("\n")) {
                    if (line.isEmpty()) {
                        continue;
                    }
                    lines.add(line);
                    String id = matchImageId(line);
                    if (id != null) {
                        imageId = id;
                    }
                }
            }

            JsonNode aux = entry.path("aux").path("ID");
            if (aux.isTextual() && !aux.asText().isBlank()) {
                imageId = stripDigestPrefix(aux.asText());
            }
        }

        if (imageId == null) {
            throw new BuildException(UNKNOWN_REASON, lines);
        }
        log.debug("Build produced image {} ({} log lines)", imageId, lines.size());
        return new BuildResult(imageId, lines);
    }

    private static String errorOf(JsonNode entry) {
        JsonNode error = entry.path("error");
        if (error.isTextual() && !error.asText().isBlank()) {
            return error.asText().strip();
        }
        JsonNode detail = entry.path("errorDetail").path("message");
        if (detail.isTextual() && !detail.asText().isBlank()) {
            return detail.asText().strip();
        }
        return null;
    }

    private static String matchImageId(String line) {
        Matcher m = IMAGE_ID.matcher(line.strip());
        if (!m.matches()) {
            return null;
        }
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    private static String stripDigestPrefix(String id) {
        return id.startsWith("sha256:") ? id.substring("sha256:".length()) : id;
    }
}
