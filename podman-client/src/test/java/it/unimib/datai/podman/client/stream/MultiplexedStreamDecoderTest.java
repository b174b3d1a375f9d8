package it.unimib.datai.podman.client.stream;

import it.unimib.datai.podman.common.errors.StreamParseException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiplexedStreamDecoderTest {

    private static byte[] frame(int type, String text) {
        byte[] payload = text.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(type);
        out.write(0);
        out.write(0);
        out.write(0);
        out.write((payload.length >>> 24) & 0xFF);
        out.write((payload.length >>> 16) & 0xFF);
        out.write((payload.length >>> 8) & 0xFF);
        out.write(payload.length & 0xFF);
        out.writeBytes(payload);
        return out.toByteArray();
    }

    private static MultiplexedStreamDecoder decoder(byte[]... chunks) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (byte[] chunk : chunks) {
            out.writeBytes(chunk);
        }
        return new MultiplexedStreamDecoder(new ByteArrayInputStream(out.toByteArray()));
    }

    @Test
    void decodesStdoutAndStderrFrames() {
        MultiplexedStreamDecoder d = decoder(frame(1, "hello\n"), frame(2, "warning: low disk\n"), frame(1, ""));

        List<StreamFrame> frames = d.readAll();

        assertThat(frames).extracting(StreamFrame::type)
                .containsExactly(StreamType.STDOUT, StreamType.STDERR, StreamType.STDOUT);
        assertThat(frames.get(0).text()).isEqualTo("hello\n");
        assertThat(frames.get(1).text()).isEqualTo("warning: low disk\n");
        assertThat(frames.get(2).payload()).isEmpty();
        assertThat(d.offset()).isEqualTo(8 + 6 + 8 + 18 + 8);
    }

    @Test
    void emptyStreamHasNoFrames() {
        assertThat(decoder().next()).isNull();
    }

    @Test
    void unknownStreamTypeReportsOffsetAndHeader() {
        MultiplexedStreamDecoder d = decoder(frame(1, "ok"), frame(7, "??"));

        assertThat(d.next().text()).isEqualTo("ok");
        assertThatThrownBy(d::next)
                .isInstanceOf(StreamParseException.class)
                .hasMessage("Unknown stream type 7 at offset 10 [0700000000000002]");
    }

    @Test
    void nonZeroPaddingIsRejected() {
        byte[] bad = frame(1, "x");
        bad[2] = 5;

        assertThatThrownBy(() -> decoder(bad).next())
                .isInstanceOf(StreamParseException.class)
                .hasMessageContaining("Invalid frame header padding at offset 0");
    }

    @Test
    void truncatedHeaderIsRejected() {
        assertThatThrownBy(() -> decoder(new byte[]{1, 0, 0}).next())
                .isInstanceOf(StreamParseException.class)
                .hasMessage("Truncated frame header at offset 0: expected 8 bytes, got 3 [010000]");
    }

    @Test
    void truncatedPayloadIsRejected() {
        byte[] full = frame(2, "0123456789");
        byte[] cut = java.util.Arrays.copyOf(full, full.length - 4);

        assertThatThrownBy(() -> decoder(cut).next())
                .isInstanceOf(StreamParseException.class)
                .hasMessage("Truncated stderr frame at offset 0: header declares 10 bytes, got 6");
    }
}
