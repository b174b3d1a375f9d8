package it.unimib.datai.podman.client.build;

import java.util.List;

public record BuildResult(String imageId, List<String> log) {

    public BuildResult {
        log = List.copyOf(log);
    }
}
