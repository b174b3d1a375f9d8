package it.unimib.datai.podman.client.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.podman.common.errors.StreamParseException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Iterates over a chunked JSON stream (one document per line, as sent by build, pull and
 * events endpoints). Blank lines are skipped. Does not close the reader.
 */
public final class JsonStreamDecoder implements Iterator<JsonNode> {
    static final int MAX_EXCERPT = 80;

    private final BufferedReader reader;
    private final ObjectMapper mapper;
    private long lineNumber;
    private JsonNode pending;

    public JsonStreamDecoder(BufferedReader reader) {
        this(reader, new ObjectMapper());
    }

    public JsonStreamDecoder(BufferedReader reader, ObjectMapper mapper) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.mapper = mapper;
    }

    /**
     * @throws StreamParseException if the next line is not valid JSON
     */
    @Override
    public boolean hasNext() {
        if (pending == null) {
            pending = readNext();
        }
        return pending != null;
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        JsonNode node = pending;
        pending = null;
        return node;
    }

    public long lineNumber() {
        return lineNumber;
    }

    private JsonNode readNext() {
        String line;
        while ((line = readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                return mapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new StreamParseException("Malformed JSON at line " + lineNumber + ": " + excerpt(line), e);
            }
        }
        return null;
    }

    private String readLine() {
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON stream after line " + lineNumber, e);
        }
    }

    private static String excerpt(String line) {
        String trimmed = line.strip();
        if (trimmed.length() <= MAX_EXCERPT) {
            return trimmed;
        }
        return trimmed.substring(0, MAX_EXCERPT) + "...";
    }
}
