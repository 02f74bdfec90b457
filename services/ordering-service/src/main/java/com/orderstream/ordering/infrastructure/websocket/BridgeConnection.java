package com.orderstream.ordering.infrastructure.websocket;

import com.orderstream.ordering.domain.bus.Subscription;
import com.orderstream.syncmodel.EntityType;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Handle for one client connection forwarded by the {@link TransportBridge}. Closing it
 * unsubscribes from the bus and ends the forwarding loop.
 */
public final class BridgeConnection implements AutoCloseable {

    private final String connectionId;
    private final Subscription subscription;
    private final AtomicLong forwarded = new AtomicLong();

    BridgeConnection(String connectionId, Subscription subscription) {
        this.connectionId = connectionId;
        this.subscription = subscription;
    }

    public String connectionId() {
        return connectionId;
    }

    public Set<EntityType> channels() {
        return subscription.channels();
    }

    public boolean isOpen() {
        return !subscription.isClosed();
    }

    /** Envelopes written to the client so far. */
    public long forwarded() {
        return forwarded.get();
    }

    Subscription subscription() {
        return subscription;
    }

    void recordForwarded() {
        forwarded.incrementAndGet();
    }

    @Override
    public void close() {
        subscription.close();
    }
}
