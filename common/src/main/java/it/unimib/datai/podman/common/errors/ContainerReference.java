package it.unimib.datai.podman.common.errors;

/**
 * Minimal view of a container domain object. {@link ContainerException} keeps a reference to it
 * but does not own it.
 */
public interface ContainerReference {

    String id();

    default String name() {
        return id();
    }
}
