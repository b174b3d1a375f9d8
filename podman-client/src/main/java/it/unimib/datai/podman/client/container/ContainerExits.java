package it.unimib.datai.podman.client.container;

import it.unimib.datai.podman.common.errors.ContainerException;
import it.unimib.datai.podman.common.errors.ContainerReference;

import java.util.List;

/**
 * Exit status check used after a container run completes. Keeps a zero status away from
 * {@link ContainerException}, which does not accept one.
 */
public final class ContainerExits {

    private ContainerExits() {}

    public static void check(ContainerReference container, int exitStatus, String command,
                             String image, List<String> stderr) {
        if (exitStatus != 0) {
            throw new ContainerException(container, exitStatus, command, image, stderr);
        }
    }

    public static void check(ContainerReference container, int exitStatus, List<String> command,
                             String image, List<String> stderr) {
        if (exitStatus != 0) {
            throw new ContainerException(container, exitStatus, command, image, stderr);
        }
    }
}
