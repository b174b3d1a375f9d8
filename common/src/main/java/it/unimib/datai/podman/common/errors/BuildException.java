package it.unimib.datai.podman.common.errors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Error occurred during an image build.
 *
 * <p>The build log is drained from the supplied iterable when the exception is created, so it
 * stays readable after the stream it came from has been closed.
 */
public class BuildException extends PodmanException {
    private final List<String> buildLog;

    public BuildException(String reason, Iterable<String> buildLog) {
        super(reason);
        this.buildLog = capture(buildLog);
    }

    public String reason() {
        return render();
    }

    public List<String> buildLog() {
        return buildLog;
    }

    /**
     * @return at most the last {@code lines} entries of the build log
     */
    public List<String> tail(int lines) {
        if (lines < 0) {
            throw new IllegalArgumentException("lines must be >= 0");
        }
        int from = Math.max(0, buildLog.size() - lines);
        return buildLog.subList(from, buildLog.size());
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.BUILD;
    }

    private static List<String> capture(Iterable<String> log) {
        if (log == null) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : log) {
            lines.add(line);
        }
        return Collections.unmodifiableList(lines);
    }
}
