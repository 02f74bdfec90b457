package com.orderstream.ordering.infrastructure.websocket;

import com.orderstream.observability.CorrelationContext;
import com.orderstream.observability.CorrelationContextHolder;
import com.orderstream.observability.MetricFactory;
import com.orderstream.ordering.domain.bus.ChangeEventBus;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.EnvelopeSerializer;
import io.micrometer.core.instrument.Counter;
import java.io.IOException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects client sessions to the {@link ChangeEventBus}.
 *
 * <p>{@link #open} subscribes before returning, so every envelope published after the call is
 * forwarded. One forwarding task per connection drains the subscription in order and writes each
 * envelope to the sink; that order is the only ordering guarantee clients get. Nothing is resent
 * after a disconnect: a reconnecting client starts with a fresh bootstrap.
 */
public class TransportBridge {

    private static final Logger log = LoggerFactory.getLogger(TransportBridge.class);

    private final ChangeEventBus bus;
    private final Executor executor;
    private final Counter sendFailures;

    public TransportBridge(ChangeEventBus bus, Executor executor, MetricFactory metrics) {
        this.bus = bus;
        this.executor = executor;
        this.sendFailures = metrics.counter("sync.transport.send.failures", "Envelopes that could not be written to a client");
    }

    /**
     * Subscribes {@code channels} (all channels when empty) and starts forwarding to {@code sink}.
     */
    public BridgeConnection open(String connectionId, Set<EntityType> channels, EnvelopeSink sink) {
        var connection = new BridgeConnection(connectionId, bus.subscribe(channels));
        var context = new CorrelationContext(connectionId, null, null);
        executor.execute(() -> CorrelationContextHolder.runWithContext(context, () -> forward(connection, sink)));
        log.info("Bridge {} opened on {}", connectionId, connection.channels());
        return connection;
    }

    private void forward(BridgeConnection connection, EnvelopeSink sink) {
        boolean failed = false;
        try {
            while (true) {
                Optional<ChangeEnvelope<?>> next = connection.subscription().next();
                if (next.isEmpty()) {
                    break;
                }
                ChangeEnvelope<?> envelope = next.get();
                try {
                    sink.send(EnvelopeSerializer.serialize(envelope));
                    connection.recordForwarded();
                } catch (IOException | RuntimeException e) {
                    sendFailures.increment();
                    log.warn("Bridge {} failed to send {} {}, closing",
                            connection.connectionId(), envelope.entityType().value(), envelope.entityId(), e);
                    failed = true;
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            connection.close();
        }
        if (failed) {
            abort(connection, sink);
        }
        log.info("Bridge {} closed after forwarding {} envelopes", connection.connectionId(), connection.forwarded());
    }

    private static void abort(BridgeConnection connection, EnvelopeSink sink) {
        try {
            sink.abort();
        } catch (IOException | RuntimeException e) {
            log.warn("Bridge {} could not close its client connection", connection.connectionId(), e);
        }
    }
}
