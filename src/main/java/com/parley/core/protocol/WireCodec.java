package com.parley.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Encodes worker requests and decodes worker responses.
 *
 * <p>Persistent workers answer with one JSON object per line. One-shot workers print
 * their single response between {@link #OUTPUT_START_MARKER} and {@link #OUTPUT_END_MARKER}
 * so that stray stdout from the agent runtime does not corrupt it.
 */
public class WireCodec {

    public static final String OUTPUT_START_MARKER = "---PARLEY_OUTPUT_START---";
    public static final String OUTPUT_END_MARKER = "---PARLEY_OUTPUT_END---";

    private final ObjectMapper objectMapper;

    public WireCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(WireRequest request) {
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode worker request " + request.requestId(), e);
        }
    }

    public WireResponse decodeLine(String line) {
        if (line == null || line.isBlank()) {
            throw new ProtocolParseException("Empty worker output line");
        }
        WireResponse response;
        try {
            response = objectMapper.readValue(line, WireResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolParseException("Malformed worker output line: " + abbreviate(line), e);
        }
        if (response == null || response.requestId() == null || response.requestId().isBlank()) {
            throw new ProtocolParseException("Worker response without requestId: " + abbreviate(line));
        }
        if (!WireResponse.SUCCESS.equals(response.status()) && !WireResponse.ERROR.equals(response.status())) {
            throw new ProtocolParseException("Worker response with unknown status '" + response.status() + "'");
        }
        return response;
    }

    /**
     * Extracts the framed response from the full stdout of a one-shot worker.
     * The last framed block wins.
     */
    public WireResponse decodeFramed(String stdout) {
        if (stdout == null) {
            throw new ProtocolParseException("Worker produced no output");
        }
        int start = stdout.lastIndexOf(OUTPUT_START_MARKER);
        int end = start >= 0 ? stdout.indexOf(OUTPUT_END_MARKER, start) : -1;
        if (start < 0 || end < 0) {
            throw new ProtocolParseException("Worker output is missing output markers");
        }
        String json = stdout.substring(start + OUTPUT_START_MARKER.length(), end).trim();
        try {
            WireResponse response = objectMapper.readValue(json, WireResponse.class);
            if (response == null || response.status() == null) {
                throw new ProtocolParseException("Framed worker output has no status");
            }
            return response;
        } catch (JsonProcessingException e) {
            throw new ProtocolParseException("Malformed framed worker output: " + abbreviate(json), e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
