package com.workq.process;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Line codec of the worker to supervisor channel. A worker writes one JSON object per line on its
 * standard output, prefixed with {@value #PREFIX}; every other line is ordinary output.
 */
public final class IpcMessageCodec {

    public static final String PREFIX = "@@workq-ipc ";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private IpcMessageCodec() {
    }

    public static String encode(IpcMessage message) {
        try {
            return PREFIX + MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode IPC message " + message, e);
        }
    }

    /**
     * @return the message carried by {@code line}, or empty if the line is ordinary output
     * @throws IllegalArgumentException if the line has the prefix but no valid message
     */
    public static Optional<IpcMessage> decode(String line) {
        if (line == null || !line.startsWith(PREFIX)) {
            return Optional.empty();
        }
        String json = line.substring(PREFIX.length()).trim();
        try {
            return Optional.of(MAPPER.readValue(json, IpcMessage.class));
        } catch (JsonProcessingException | RuntimeException e) {
            throw new IllegalArgumentException("Malformed IPC message: " + json, e);
        }
    }
}
