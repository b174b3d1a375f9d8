package it.unimib.datai.podman.client.stream;

import it.unimib.datai.podman.common.errors.StreamParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Decodes attach/logs output of a container started without a TTY. Each frame is an 8-byte
 * header {@code [type, 0, 0, 0, size (uint32, big-endian)]} followed by {@code size} bytes.
 *
 * <p>The decoder reads from the caller's stream and does not close it.
 */
public final class MultiplexedStreamDecoder {
    static final int HEADER_SIZE = 8;

    private final InputStream in;
    private long offset;

    public MultiplexedStreamDecoder(InputStream in) {
        this.in = Objects.requireNonNull(in, "in");
    }

    /**
     * @return the next frame, or {@code null} at a clean end of stream
     * @throws StreamParseException if the header is malformed or the stream ends inside a frame
     */
    public StreamFrame next() {
        long frameOffset = offset;
        byte[] header = readUpTo(HEADER_SIZE);
        if (header.length == 0) {
            return null;
        }
        if (header.length < HEADER_SIZE) {
            throw new StreamParseException("Truncated frame header at offset " + frameOffset
                    + ": expected " + HEADER_SIZE + " bytes, got " + header.length
                    + " [" + HexFormat.of().formatHex(header) + "]");
        }

        StreamType type = StreamType.fromCode(header[0] & 0xFF);
        if (type == null) {
            throw new StreamParseException("Unknown stream type " + (header[0] & 0xFF)
                    + " at offset " + frameOffset + " [" + HexFormat.of().formatHex(header) + "]");
        }
        if (header[1] != 0 || header[2] != 0 || header[3] != 0) {
            throw new StreamParseException("Invalid frame header padding at offset " + frameOffset
                    + " [" + HexFormat.of().formatHex(header) + "]");
        }

        long size = ((header[4] & 0xFFL) << 24)
                | ((header[5] & 0xFFL) << 16)
                | ((header[6] & 0xFFL) << 8)
                | (header[7] & 0xFFL);
        if (size > Integer.MAX_VALUE - HEADER_SIZE) {
            throw new StreamParseException("Frame at offset " + frameOffset + " declares " + size
                    + " bytes, more than a single frame can hold");
        }

        byte[] payload = readUpTo((int) size);
        if (payload.length < size) {
            throw new StreamParseException("Truncated " + type.name().toLowerCase(Locale.ROOT) + " frame at offset "
                    + frameOffset + ": header declares " + size + " bytes, got " + payload.length);
        }
        return new StreamFrame(type, payload);
    }

    public List<StreamFrame> readAll() {
        List<StreamFrame> frames = new ArrayList<>();
        StreamFrame frame;
        while ((frame = next()) != null) {
            frames.add(frame);
        }
        return frames;
    }

    /**
     * Byte offset of the next unread frame.
     */
    public long offset() {
        return offset;
    }

    private byte[] readUpTo(int length) {
        try {
            byte[] bytes = in.readNBytes(length);
            offset += bytes.length;
            return bytes;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read multiplexed stream at offset " + offset, e);
        }
    }
}
