package com.orderstream.ordering.domain.bus;

import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Process-wide publish/subscribe dispatcher with one channel per {@link EntityType}.
 *
 * <p>A subscriber sees only envelopes published after it subscribed; there is no replay. A late
 * subscriber must bootstrap current state through the read-all endpoints. Publishing never blocks
 * on a slow subscriber because every subscription owns its own queue.
 */
public interface ChangeEventBus {

    /**
     * Delivers the envelope to every subscription currently registered on {@code channel}.
     *
     * @throws IllegalArgumentException if the envelope is malformed or belongs to another channel
     */
    void publish(EntityType channel, ChangeEnvelope<?> envelope);

    /** Publishes on the envelope's own channel. */
    default void publish(ChangeEnvelope<?> envelope) {
        publish(envelope.entityType(), envelope);
    }

    /**
     * Registers a subscription on the given channels. An empty set subscribes to every channel.
     */
    Subscription subscribe(Set<EntityType> channels);

    default Subscription subscribe(EntityType... channels) {
        if (channels.length == 0) {
            return subscribe(EnumSet.allOf(EntityType.class));
        }
        return subscribe(EnumSet.copyOf(Arrays.asList(channels)));
    }

    /** Number of open subscriptions. */
    int subscriberCount();
}
