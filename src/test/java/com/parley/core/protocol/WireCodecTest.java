package com.parley.core.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class WireCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final WireCodec codec = new WireCodec(objectMapper);

    @Nested
    @DisplayName("encode")
    class Encode {

        @Test
        @DisplayName("query request carries routing fields and omits nulls")
        void queryRequest() throws Exception {
            String line = codec.encode(WireRequest.query("req-1", "hello", null, "main", "chat-1", true));

            var node = objectMapper.readTree(line);
            assertEquals("req-1", node.get("requestId").asText());
            assertEquals("query", node.get("command").asText());
            assertEquals("main", node.get("namespace").asText());
            assertTrue(node.get("privileged").asBoolean());
            assertFalse(node.has("sessionId"));
            assertFalse(node.has("isScheduledTask"));
            assertFalse(line.contains("\n"));
        }

        @Test
        @DisplayName("scheduled request is flagged")
        void scheduledRequest() throws Exception {
            String line = codec.encode(WireRequest.scheduled("task-1", "p", "s", "ns", "chat", false));

            assertTrue(objectMapper.readTree(line).get("isScheduledTask").asBoolean());
        }
    }

    @Nested
    @DisplayName("decodeLine")
    class DecodeLine {

        @Test
        @DisplayName("parses a success response")
        void success() {
            var response = codec.decodeLine(
                    "{\"requestId\":\"req-1\",\"status\":\"success\",\"result\":\"hi\",\"newSessionId\":\"s2\"}");

            assertEquals("req-1", response.requestId());
            assertTrue(response.isSuccess());
            assertEquals("hi", response.result());
            assertEquals("s2", response.newSessionId());
        }

        @Test
        @DisplayName("ignores unknown fields")
        void unknownFields() {
            var response = codec.decodeLine("{\"requestId\":\"r\",\"status\":\"error\",\"error\":\"x\",\"extra\":1}");

            assertFalse(response.isSuccess());
            assertEquals("x", response.error());
        }

        @Test
        @DisplayName("rejects non-JSON, missing id and unknown status")
        void rejectsBadLines() {
            assertThrows(ProtocolParseException.class, () -> codec.decodeLine("Starting agent..."));
            assertThrows(ProtocolParseException.class, () -> codec.decodeLine("{\"status\":\"success\"}"));
            assertThrows(ProtocolParseException.class, () -> codec.decodeLine("{\"requestId\":\"r\",\"status\":\"done\"}"));
            assertThrows(ProtocolParseException.class, () -> codec.decodeLine("  "));
        }
    }

    @Nested
    @DisplayName("decodeFramed")
    class DecodeFramed {

        @Test
        @DisplayName("extracts the JSON between markers, ignoring surrounding noise")
        void framed() {
            String stdout = "booting\n" + WireCodec.OUTPUT_START_MARKER + "\n"
                    + "{\"status\":\"success\",\"result\":\"done\"}\n"
                    + WireCodec.OUTPUT_END_MARKER + "\ntrailing\n";

            var response = codec.decodeFramed(stdout);

            assertTrue(response.isSuccess());
            assertEquals("done", response.result());
        }

        @Test
        @DisplayName("last framed block wins")
        void lastBlockWins() {
            String block1 = WireCodec.OUTPUT_START_MARKER + "{\"status\":\"error\",\"error\":\"first\"}"
                    + WireCodec.OUTPUT_END_MARKER;
            String block2 = WireCodec.OUTPUT_START_MARKER + "{\"status\":\"success\",\"result\":\"second\"}"
                    + WireCodec.OUTPUT_END_MARKER;

            assertEquals("second", codec.decodeFramed(block1 + "\n" + block2).result());
        }

        @Test
        @DisplayName("missing markers is a parse failure")
        void missingMarkers() {
            assertThrows(ProtocolParseException.class, () -> codec.decodeFramed("{\"status\":\"success\"}"));
            assertThrows(ProtocolParseException.class,
                    () -> codec.decodeFramed(WireCodec.OUTPUT_START_MARKER + "{\"status\":\"success\"}"));
        }
    }

    @Test
    @DisplayName("request ids embed prefix and creation time")
    void requestIds() {
        var clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

        String id = RequestIds.next("sub", clock, 4);

        assertTrue(id.matches("sub-1700000000000-[0-9a-z]{4}"), id);
    }
}
