package com.openforge.streamkit.llm.sse;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Server-Sent Events framing over a character stream.
 *
 * Wire format (one event):
 *   event: content_block_delta
 *   data: {"type":"content_block_delta","index":0,...}
 *   (blank line)
 *
 * Rules:
 *   - "event:" sets the type; "data:" lines are joined with '\n'
 *   - a blank line dispatches the event; lines starting with ':' are comments
 *   - "id:" and "retry:" are accepted and ignored
 *   - one space after the colon is stripped
 *   - an event without an "event:" line is typed "message"
 *   - a final event not followed by a blank line is still delivered
 */
@Slf4j
public class SseEventSource implements FramedEventSource {

    static final String DEFAULT_EVENT_TYPE = "message";

    private final BufferedReader reader;
    private boolean exhausted;

    public SseEventSource(Reader reader) {
        this.reader = reader instanceof BufferedReader buffered
                ? buffered
                : new BufferedReader(reader);
    }

    @Override
    public Optional<RawEvent> next() throws IOException {
        if (exhausted) return Optional.empty();

        String       eventType = null;
        List<String> dataLines = new ArrayList<>();

        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (eventType != null || !dataLines.isEmpty()) {
                    return Optional.of(toEvent(eventType, dataLines));
                }
                continue;
            }
            if (line.startsWith(":")) continue;

            int colon = line.indexOf(':');
            if (colon < 0) continue;

            String field = line.substring(0, colon);
            String value = line.substring(colon + 1);
            if (value.startsWith(" ")) value = value.substring(1);

            switch (field) {
                case "event" -> eventType = value;
                case "data"  -> dataLines.add(value);
                case "id", "retry" -> { }
                default -> log.debug("[SseEventSource] Ignoring unknown field '{}'", field);
            }
        }

        exhausted = true;
        if (eventType != null || !dataLines.isEmpty()) {
            return Optional.of(toEvent(eventType, dataLines));
        }
        return Optional.empty();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }

    private static RawEvent toEvent(String eventType, List<String> dataLines) {
        return new RawEvent(eventType != null ? eventType : DEFAULT_EVENT_TYPE,
                String.join("\n", dataLines));
    }
}
