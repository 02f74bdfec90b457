package com.orderstream.syncclient;

import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.EnvelopeSerializer;
import com.orderstream.syncmodel.EnvelopeValidator;
import com.orderstream.syncmodel.Identifiable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Hands incoming wire frames to the matching {@link EntityCacheStore}.
 * <p>
 * Frames are queued in arrival order and consumed by a single thread, so
 * {@link EntityCacheStore#apply(ChangeEnvelope)} never runs concurrently and sees every frame
 * in delivery order. Submitting never overwrites a frame that has not been consumed yet.
 */
public class EnvelopeRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeRouter.class);

    private final Map<EntityType, EntityCacheStore<? extends Identifiable>> stores = new EnumMap<>(EntityType.class);
    private final BlockingQueue<String> frames = new LinkedBlockingQueue<>();
    private final String threadName;

    private volatile Thread consumer;
    private volatile boolean closed;

    public EnvelopeRouter(String threadName) {
        this.threadName = threadName;
    }

    public void register(EntityCacheStore<? extends Identifiable> store) {
        stores.put(store.entityType(), store);
    }

    /** Enqueues a raw frame. Never blocks. */
    public void submit(String frame) {
        if (closed) {
            log.debug("Router closed, dropping frame");
            return;
        }
        frames.add(frame);
    }

    /** Starts the consumer thread. Calling it again while running is a no-op. */
    public synchronized void start() {
        if (consumer != null && consumer.isAlive()) {
            return;
        }
        closed = false;
        Thread thread = new Thread(this::consumeLoop, threadName);
        thread.setDaemon(true);
        consumer = thread;
        thread.start();
    }

    /**
     * Processes every frame currently queued on the calling thread. Only for use when the
     * consumer thread has not been started.
     *
     * @return number of frames processed
     */
    public int drain() {
        if (consumer != null && consumer.isAlive()) {
            throw new IllegalStateException("drain() while the consumer thread is running");
        }
        int processed = 0;
        String frame;
        while ((frame = frames.poll()) != null) {
            dispatch(frame);
            processed++;
        }
        return processed;
    }

    /** Frames waiting to be consumed. */
    public int backlog() {
        return frames.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        Thread thread = consumer;
        consumer = null;
        if (thread != null) {
            thread.interrupt();
        }
        frames.clear();
    }

    private void consumeLoop() {
        while (!closed) {
            String frame;
            try {
                frame = frames.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                dispatch(frame);
            } catch (RuntimeException e) {
                log.error("Failed to apply frame {}", frame, e);
            }
        }
    }

    private void dispatch(String frame) {
        var parsed = EnvelopeSerializer.tryDeserialize(frame);
        if (parsed.isEmpty()) {
            log.warn("Discarding malformed frame {}", frame);
            return;
        }
        ChangeEnvelope<? extends Identifiable> envelope = parsed.get();
        var validation = EnvelopeValidator.validate(envelope);
        if (!validation.valid()) {
            log.warn("Discarding malformed frame {}: {}", frame, validation.errors());
            return;
        }
        EntityCacheStore<? extends Identifiable> store = stores.get(envelope.entityType());
        if (store == null) {
            log.debug("No cache registered for {}, skipping", envelope.entityType().value());
            return;
        }
        log.debug("Applying {} {} {}", envelope.operation().value(), envelope.entityType().value(), envelope.entityId());
        apply(store, envelope);
    }

    private static <T extends Identifiable> void apply(EntityCacheStore<T> store, ChangeEnvelope<?> envelope) {
        store.apply(envelope.as(store.payloadType()));
    }
}
