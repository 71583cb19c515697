package com.codereview.orchestrator.broker;

import java.io.IOException;

/**
 * Transport-side handle the broker delivers events through.
 *
 * The transport owns the underlying connection: it serializes the event
 * and writes it to the wire in {@link #send}, and closes the connection
 * when the broker drops the subscriber in {@link #close}.
 */
@FunctionalInterface
public interface MessageSink {

    /**
     * Deliver one event. Any exception marks the subscriber as dead and
     * causes the broker to unregister it.
     */
    void send(ProgressEvent event) throws IOException;

    /** Called once after the broker has removed this subscriber on its own initiative. */
    default void close() throws IOException {}
}
