package it.unimib.datai.podman.client.http;

/**
 * The kind of resource a request addressed; decides which not-found type a 404 becomes.
 */
public enum ResourceKind {
    CONTAINER,
    IMAGE,
    NETWORK,
    VOLUME,
    POD,
    SECRET,
    MANIFEST,
    OTHER
}
