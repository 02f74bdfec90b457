package com.orderstream.syncclient;

import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Event;
import com.orderstream.syncmodel.Identifiable;
import com.orderstream.syncmodel.Order;
import com.orderstream.syncmodel.OrderItem;
import com.orderstream.syncmodel.Product;
import com.orderstream.syncmodel.Settings;
import com.orderstream.syncmodel.Station;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Keeps one {@link EntityCacheStore} per entity type in step with the ordering service.
 * <p>
 * {@link #connect()} opens the change stream first and then bootstraps every store
 * concurrently. Frames that arrive while a bootstrap read is in flight are replayed by the
 * store once the read completes. Nothing is resent after a disconnect: {@link #reconnect()}
 * repeats the whole connect-then-bootstrap sequence.
 */
public class SyncClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncClient.class);

    /** Creates {@link BootstrapSource}s for each entity type. */
    public interface BootstrapSourceFactory {
        <T extends Identifiable> BootstrapSource<T> create(EntityType entityType, Class<T> payloadType);
    }

    private final URI changeStreamUri;
    private final WebSocketClient webSocketClient;
    private final EntityCacheStore<Category> categories;
    private final EntityCacheStore<Product> products;
    private final EntityCacheStore<Station> stations;
    private final EntityCacheStore<Order> orders;
    private final EntityCacheStore<OrderItem> orderItems;
    private final EntityCacheStore<Settings> settings;
    private final EntityCacheStore<Event> events;
    private final List<EntityCacheStore<? extends Identifiable>> stores;
    private final EnvelopeRouter router = new EnvelopeRouter("sync-client-consumer");
    private final SimpleAsyncTaskExecutor bootstrapExecutor = new SimpleAsyncTaskExecutor("sync-client-bootstrap-");

    private WebSocketSession session;
    private ChangeStreamClientHandler handler;

    public SyncClient(URI changeStreamUri, WebSocketClient webSocketClient, BootstrapSourceFactory sources) {
        this.changeStreamUri = changeStreamUri;
        this.webSocketClient = webSocketClient;
        this.bootstrapExecutor.setDaemon(true);
        this.categories = createStore(EntityType.CATEGORY, Category.class, sources);
        this.products = createStore(EntityType.PRODUCT, Product.class, sources);
        this.stations = createStore(EntityType.STATION, Station.class, sources);
        this.orders = createStore(EntityType.ORDER, Order.class, sources);
        this.orderItems = createStore(EntityType.ORDER_ITEM, OrderItem.class, sources);
        this.settings = createStore(EntityType.SETTINGS, Settings.class, sources);
        this.events = createStore(EntityType.EVENT, Event.class, sources);
        this.stores = List.of(categories, products, stations, orders, orderItems, settings, events);
        stores.forEach(router::register);
    }

    /**
     * Client for a service at {@code baseUrl} (e.g. {@code http://localhost:8080}) with the change
     * stream at {@code webSocketPath}.
     */
    public static SyncClient forService(String baseUrl, String webSocketPath) {
        var restTemplate = new RestTemplate();
        URI wsUri = URI.create(baseUrl.replaceFirst("^http", "ws") + webSocketPath);
        return new SyncClient(wsUri, new StandardWebSocketClient(), new BootstrapSourceFactory() {
            @Override
            public <T extends Identifiable> BootstrapSource<T> create(EntityType entityType, Class<T> payloadType) {
                return new RestBootstrapSource<>(restTemplate, baseUrl, entityType, payloadType);
            }
        });
    }

    /**
     * Opens the change stream and bootstraps every cache.
     *
     * @return true if every bootstrap read succeeded; failed stores stay as they were
     * @throws SyncClientException if the change stream cannot be opened
     */
    public synchronized boolean connect() {
        router.start();
        handler = new ChangeStreamClientHandler(router);
        try {
            session = webSocketClient.execute(handler, new WebSocketHttpHeaders(), changeStreamUri).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncClientException("Interrupted while connecting to " + changeStreamUri, e);
        } catch (ExecutionException e) {
            throw new SyncClientException("Could not open change stream " + changeStreamUri, e.getCause());
        }
        return bootstrapAll();
    }

    /** Closes the current stream, if any, and connects again from scratch. */
    public synchronized boolean reconnect() {
        closeSession();
        return connect();
    }

    /** Re-reads every collection without touching the stream. */
    public boolean bootstrapAll() {
        List<CompletableFuture<Boolean>> pending = new ArrayList<>();
        for (EntityCacheStore<? extends Identifiable> store : stores) {
            pending.add(CompletableFuture.supplyAsync(store::bootstrap, bootstrapExecutor));
        }
        boolean allSucceeded = true;
        for (CompletableFuture<Boolean> future : pending) {
            try {
                allSucceeded &= future.join();
            } catch (CompletionException e) {
                log.error("Bootstrap task failed", e.getCause());
                allSucceeded = false;
            }
        }
        log.info("Bootstrap finished for {} caches, all succeeded: {}", stores.size(), allSucceeded);
        return allSucceeded;
    }

    public boolean isConnected() {
        return session != null && session.isOpen();
    }

    public EntityCacheStore<Category> categories() {
        return categories;
    }

    public EntityCacheStore<Product> products() {
        return products;
    }

    public EntityCacheStore<Station> stations() {
        return stations;
    }

    public EntityCacheStore<Order> orders() {
        return orders;
    }

    public EntityCacheStore<OrderItem> orderItems() {
        return orderItems;
    }

    public EntityCacheStore<Settings> settings() {
        return settings;
    }

    public EntityCacheStore<Event> events() {
        return events;
    }

    @Override
    public synchronized void close() {
        closeSession();
        router.close();
    }

    private void closeSession() {
        if (session == null) {
            return;
        }
        try {
            if (session.isOpen()) {
                session.close(CloseStatus.NORMAL);
            }
        } catch (IOException e) {
            log.warn("Error closing change stream session {}", session.getId(), e);
        } finally {
            session = null;
        }
    }

    private static <T extends Identifiable> EntityCacheStore<T> createStore(
            EntityType type, Class<T> payloadType, BootstrapSourceFactory sources) {
        return new EntityCacheStore<>(type, payloadType, sources.create(type, payloadType));
    }

    /** Thrown when the change stream cannot be opened. */
    public static class SyncClientException extends RuntimeException {
        public SyncClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
