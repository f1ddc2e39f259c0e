package com.openforge.streamkit.llm.sse;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * Blocking pull source of framed events.
 *
 * {@link #next()} blocks until an event is available. An empty result means
 * the stream ended cleanly; an {@link IOException} means the transport failed
 * (including reads attempted after {@link #close()}).
 */
public interface FramedEventSource extends Closeable {

    Optional<RawEvent> next() throws IOException;
}
