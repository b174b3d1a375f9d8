package it.unimib.datai.podman.common.errors;

/**
 * A streamed payload (multiplexed frames, chunked JSON) could not be decoded. Local to the
 * decoder: there is no HTTP status involved.
 */
public class StreamParseException extends RuntimeException implements PodmanFailure {

    public StreamParseException(String reason) {
        super(reason);
    }

    public StreamParseException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public String reason() {
        return super.getMessage();
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STREAM_PARSE;
    }

    @Override
    public String render() {
        return reason();
    }
}
