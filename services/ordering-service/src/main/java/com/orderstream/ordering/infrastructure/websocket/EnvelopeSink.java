package com.orderstream.ordering.infrastructure.websocket;

import java.io.IOException;

/** Writes one serialized envelope to a client connection. */
@FunctionalInterface
public interface EnvelopeSink {

    void send(String frame) throws IOException;

    /** Called once when forwarding stops because a send failed. */
    default void abort() throws IOException {
    }
}
