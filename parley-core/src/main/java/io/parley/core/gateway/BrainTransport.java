package io.parley.core.gateway;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;

/**
 * Duplex text-frame connection to the brain.
 *
 * <p>Each {@link #open} replaces any previous connection. Implementations must deliver frames of one
 * connection to the listener in arrival order, from a single thread at a time.
 */
public interface BrainTransport {
    void open(URI uri, Duration connectTimeout, TransportListener listener) throws IOException;

    boolean send(String frame);

    boolean probe();

    void close();
}
