package it.unimib.datai.podman.client.stream;

public enum StreamType {
    STDIN(0),
    STDOUT(1),
    STDERR(2);

    private final int code;

    StreamType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the stream type for a frame header byte, or {@code null} if none matches
     */
    static StreamType fromCode(int code) {
        for (StreamType t : values()) {
            if (t.code == code) {
                return t;
            }
        }
        return null;
    }
}
