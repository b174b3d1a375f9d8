package it.unimib.datai.podman.client.stream;

import java.nio.charset.StandardCharsets;

public record StreamFrame(StreamType type, byte[] payload) {

    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}
