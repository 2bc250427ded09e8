package me.golemcore.agent.adapter.outbound.transport;

import okio.Buffer;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SseEventReaderTest {

    @Test
    void shouldParseEventNamesMultiLineDataAndComments() throws IOException {
        Buffer source = new Buffer().writeUtf8(": comment\n"
                + "event: delta\n"
                + "data: line one\n"
                + "data: line two\n"
                + "\n"
                + "id: 7\n"
                + "data:no-space\n"
                + "\n");
        List<String> seen = new ArrayList<>();

        SseEventReader.read(source, (event, data) -> {
            seen.add(event + "|" + data);
            return true;
        });

        assertEquals(List.of("delta|line one\nline two", "null|no-space"), seen);
    }

    @Test
    void shouldDispatchTrailingEventWithoutBlankLine() throws IOException {
        Buffer source = new Buffer().writeUtf8("data: last");
        List<String> seen = new ArrayList<>();

        SseEventReader.read(source, (event, data) -> seen.add(data));

        assertEquals(List.of("last"), seen);
    }

    @Test
    void shouldStopWhenHandlerReturnsFalse() throws IOException {
        Buffer source = new Buffer().writeUtf8("data: a\n\ndata: b\n\n");
        List<String> seen = new ArrayList<>();

        SseEventReader.read(source, (event, data) -> {
            seen.add(data);
            return false;
        });

        assertEquals(List.of("a"), seen);
    }

    @Test
    void shouldIgnoreBlankLinesWithoutData() throws IOException {
        Buffer source = new Buffer().writeUtf8("\n\nevent: ping\n\n");
        List<String> seen = new ArrayList<>();

        SseEventReader.read(source, (event, data) -> seen.add(data));

        assertTrue(seen.isEmpty());
    }
}
