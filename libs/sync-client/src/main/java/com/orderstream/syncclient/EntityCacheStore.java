package com.orderstream.syncclient;

import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Identifiable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Client-resident copy of one entity collection.
 * <p>
 * Seeded once by {@link #bootstrap()} and then mutated only through {@link #apply(ChangeEnvelope)}
 * in delivery order. Holds at most one entry per id and keeps insertion order.
 * <p>
 * Envelopes may arrive while a bootstrap read is in flight. Those envelopes are applied
 * immediately and also remembered; when the read returns, the collection is replaced and the
 * remembered envelopes are replayed on top so that none of them is lost.
 *
 * @param <T> entity record type
 */
public class EntityCacheStore<T extends Identifiable> {

    private static final Logger log = LoggerFactory.getLogger(EntityCacheStore.class);

    private final EntityType entityType;
    private final Class<T> payloadType;
    private final BootstrapSource<T> source;
    private final Map<String, T> entries = new LinkedHashMap<>();
    private final List<ChangeEnvelope<T>> appliedDuringBootstrap = new ArrayList<>();
    private final List<CacheListener<T>> listeners = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    private int bootstrapsInFlight;
    private boolean bootstrapped;

    public EntityCacheStore(EntityType entityType, Class<T> payloadType, BootstrapSource<T> source) {
        if (entityType.payloadType() != payloadType) {
            throw new IllegalArgumentException(
                    payloadType.getSimpleName() + " is not the payload type of " + entityType.value());
        }
        this.entityType = entityType;
        this.payloadType = payloadType;
        this.source = source;
    }

    public EntityType entityType() {
        return entityType;
    }

    public Class<T> payloadType() {
        return payloadType;
    }

    /**
     * Reads the whole collection once and replaces the current contents with it.
     * On failure the current contents are kept and the failure is logged.
     *
     * @return true if the read succeeded
     */
    public boolean bootstrap() {
        synchronized (lock) {
            if (bootstrapsInFlight++ == 0) {
                appliedDuringBootstrap.clear();
            }
        }

        List<T> fetched;
        try {
            fetched = source.fetchAll();
        } catch (RuntimeException e) {
            log.warn("Bootstrap of {} cache failed, keeping {} cached entries", entityType.value(), size(), e);
            synchronized (lock) {
                finishBootstrap();
            }
            return false;
        }

        List<T> snapshot;
        synchronized (lock) {
            entries.clear();
            for (T entity : fetched) {
                entries.putIfAbsent(entity.id(), entity);
            }
            for (ChangeEnvelope<T> envelope : appliedDuringBootstrap) {
                mutate(envelope);
            }
            int replayed = appliedDuringBootstrap.size();
            finishBootstrap();
            bootstrapped = true;
            snapshot = List.copyOf(entries.values());
            log.info("Bootstrapped {} cache with {} entries ({} replayed)", entityType.value(), snapshot.size(), replayed);
        }
        for (CacheListener<T> listener : listeners) {
            listener.onReset(snapshot);
        }
        return true;
    }

    /**
     * Applies one change. Must be called in delivery order.
     * <ul>
     *   <li>Add appends unless the id is already present.</li>
     *   <li>Update replaces the entry with the same id; an unknown id is logged and ignored.</li>
     *   <li>Delete removes the entry; an unknown id is ignored.</li>
     * </ul>
     *
     * @throws IllegalArgumentException if the envelope belongs to another entity type
     */
    public void apply(ChangeEnvelope<T> envelope) {
        if (envelope.entityType() != entityType) {
            throw new IllegalArgumentException(
                    "Envelope for " + envelope.entityType() + " applied to " + entityType.value() + " cache");
        }
        List<T> snapshot;
        synchronized (lock) {
            if (bootstrapsInFlight > 0) {
                appliedDuringBootstrap.add(envelope);
            }
            if (!mutate(envelope)) {
                return;
            }
            snapshot = List.copyOf(entries.values());
        }
        for (CacheListener<T> listener : listeners) {
            listener.onChange(envelope, snapshot);
        }
    }

    /** Immutable snapshot of the current contents in insertion order. */
    public List<T> view() {
        synchronized (lock) {
            return List.copyOf(entries.values());
        }
    }

    public Optional<T> find(String id) {
        synchronized (lock) {
            return Optional.ofNullable(entries.get(id));
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    /** True once a bootstrap has succeeded. An empty, never-bootstrapped store reads as empty. */
    public boolean isBootstrapped() {
        synchronized (lock) {
            return bootstrapped;
        }
    }

    public void addListener(CacheListener<T> listener) {
        listeners.add(listener);
    }

    public void removeListener(CacheListener<T> listener) {
        listeners.remove(listener);
    }

    private void finishBootstrap() {
        if (--bootstrapsInFlight == 0) {
            appliedDuringBootstrap.clear();
        }
    }

    /** Returns true if the collection changed. Caller holds {@link #lock}. */
    private boolean mutate(ChangeEnvelope<T> envelope) {
        String id = envelope.entityId();
        switch (envelope.operation()) {
            case ADD:
                if (entries.containsKey(id)) {
                    return false;
                }
                entries.put(id, envelope.payload());
                return true;
            case UPDATE:
                if (!entries.containsKey(id)) {
                    log.warn("Ignoring Update for unknown {} {}", entityType.value(), id);
                    return false;
                }
                entries.put(id, envelope.payload());
                return true;
            case DELETE:
                return entries.remove(id) != null;
            default:
                throw new IllegalStateException("Unhandled operation " + envelope.operation());
        }
    }
}
