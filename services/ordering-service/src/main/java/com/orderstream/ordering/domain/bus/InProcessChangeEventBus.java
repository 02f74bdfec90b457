package com.orderstream.ordering.domain.bus;

import com.orderstream.observability.MetricFactory;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.EnvelopeValidator;
import io.micrometer.core.instrument.Counter;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChangeEventBus} for a single process.
 *
 * <p>Each channel holds a copy-on-write set of subscriptions, so publishers iterate a stable
 * snapshot without locking and a subscription registered mid-publish simply misses that envelope.
 * Delivery is a non-blocking offer onto each subscription's own queue.
 */
public class InProcessChangeEventBus implements ChangeEventBus {

    private static final Logger log = LoggerFactory.getLogger(InProcessChangeEventBus.class);

    private final Map<EntityType, Set<Subscription>> channels = new EnumMap<>(EntityType.class);
    private final Set<Subscription> open = ConcurrentHashMap.newKeySet();
    private final Map<EntityType, Counter> published = new EnumMap<>(EntityType.class);

    public InProcessChangeEventBus(MetricFactory metrics) {
        for (EntityType type : EntityType.values()) {
            channels.put(type, new CopyOnWriteArraySet<>());
            published.put(type, metrics.counter("sync.envelopes.published",
                    "Change envelopes published on the bus", "entity_type", type.value()));
        }
        metrics.gauge("sync.subscribers.active", "Open bus subscriptions", open, Set::size);
    }

    @Override
    public void publish(EntityType channel, ChangeEnvelope<?> envelope) {
        var validation = EnvelopeValidator.validate(envelope);
        if (!validation.valid()) {
            throw new IllegalArgumentException("Invalid envelope: " + String.join("; ", validation.errors()));
        }
        if (envelope.entityType() != channel) {
            throw new IllegalArgumentException("%s envelope published on %s channel"
                    .formatted(envelope.entityType().value(), channel.value()));
        }

        int delivered = 0;
        for (Subscription subscription : channels.get(channel)) {
            if (subscription.offer(envelope)) {
                delivered++;
            }
        }
        published.get(channel).increment();
        log.debug("Published {} {} {} to {} subscribers",
                envelope.operation().value(), channel.value(), envelope.entityId(), delivered);
    }

    @Override
    public Subscription subscribe(Set<EntityType> requested) {
        Set<EntityType> wanted = requested.isEmpty() ? EnumSet.allOf(EntityType.class) : EnumSet.copyOf(requested);
        var subscription = new Subscription(wanted, this::unsubscribe);
        open.add(subscription);
        for (EntityType type : wanted) {
            channels.get(type).add(subscription);
        }
        log.debug("Subscription opened on {}", wanted);
        return subscription;
    }

    @Override
    public int subscriberCount() {
        return open.size();
    }

    private void unsubscribe(Subscription subscription) {
        for (EntityType type : subscription.channels()) {
            channels.get(type).remove(subscription);
        }
        open.remove(subscription);
        log.debug("Subscription closed on {}", subscription.channels());
    }
}
