package com.orderstream.ordering.domain.bus;

import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One subscriber's view of the bus: an unbounded FIFO of envelopes in publish order.
 *
 * <p>Every envelope offered is kept until consumed, so two publishes before one read are both
 * delivered. Closing unregisters from the bus, discards the backlog and wakes any blocked reader.
 */
public final class Subscription implements AutoCloseable {

    private static final Slot END = new Slot(null);

    private final Set<EntityType> channels;
    private final BlockingQueue<Slot> queue = new LinkedBlockingQueue<>();
    private final Consumer<Subscription> onClose;
    private volatile boolean closed;

    Subscription(Set<EntityType> channels, Consumer<Subscription> onClose) {
        this.channels = Set.copyOf(channels);
        this.onClose = onClose;
    }

    public Set<EntityType> channels() {
        return channels;
    }

    boolean offer(ChangeEnvelope<?> envelope) {
        if (closed) {
            return false;
        }
        return queue.offer(new Slot(envelope));
    }

    /**
     * Blocks until the next envelope is available.
     *
     * @return the next envelope, or empty once the subscription is closed
     */
    public Optional<ChangeEnvelope<?>> next() throws InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Waits up to {@code timeout} for the next envelope.
     *
     * @return the next envelope, or empty on timeout or once closed
     */
    public Optional<ChangeEnvelope<?>> poll(Duration timeout) throws InterruptedException {
        Slot slot = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return slot == null ? Optional.empty() : unwrap(slot);
    }

    /** Envelopes waiting to be consumed. */
    public int backlog() {
        return closed ? 0 : queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        queue.clear();
        queue.offer(END);
        onClose.accept(this);
    }

    private Optional<ChangeEnvelope<?>> unwrap(Slot slot) {
        if (slot == END) {
            // keep the marker so later reads also see the end
            queue.offer(END);
            return Optional.empty();
        }
        return Optional.of(slot.envelope());
    }

    private record Slot(ChangeEnvelope<?> envelope) {
    }
}
