package it.unimib.datai.podman.common.errors;

import java.util.List;
import java.util.Objects;

/**
 * A container exited with a non-zero status.
 *
 * <p>The message is composed once, in the constructor. The container may change state
 * afterwards; the message keeps describing the run that failed.
 */
public class ContainerException extends PodmanException {
    private final transient ContainerReference container;
    private final int exitStatus;
    private final List<String> command;
    private final String commandLine;
    private final String image;
    private final List<String> stderr;

    public ContainerException(ContainerReference container, int exitStatus, String command,
                              String image, List<String> stderr) {
        super(composeMessage(exitStatus, Objects.requireNonNull(command, "command"), image, stderr));
        this.container = container;
        this.exitStatus = exitStatus;
        this.command = null;
        this.commandLine = command;
        this.image = image;
        this.stderr = stderr == null ? null : List.copyOf(stderr);
    }

    public ContainerException(ContainerReference container, int exitStatus, List<String> command,
                              String image, List<String> stderr) {
        super(composeMessage(exitStatus, String.join(" ", Objects.requireNonNull(command, "command")), image, stderr));
        this.container = container;
        this.exitStatus = exitStatus;
        this.command = List.copyOf(command);
        this.commandLine = null;
        this.image = image;
        this.stderr = stderr == null ? null : List.copyOf(stderr);
    }

    public ContainerReference container() {
        return container;
    }

    public int exitStatus() {
        return exitStatus;
    }

    /**
     * @return the argument vector, or {@code null} when the command was given as a single string
     */
    public List<String> command() {
        return command;
    }

    /**
     * @return the command string as given, or {@code null} when the command was an argument vector
     */
    public String commandLine() {
        return commandLine;
    }

    public String image() {
        return image;
    }

    /**
     * @return the lines the container wrote to stderr, or {@code null} when none were captured
     */
    public List<String> stderr() {
        return stderr;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONTAINER;
    }

    private static String composeMessage(int exitStatus, String command, String image, List<String> stderr) {
        if (exitStatus == 0) {
            throw new IllegalArgumentException("exit status 0 is not a container failure");
        }
        String err = stderr == null ? "" : ": " + String.join("\n", stderr);
        return "Command '" + command + "' in image '" + image
                + "' returned non-zero exit status " + exitStatus + err;
    }
}
