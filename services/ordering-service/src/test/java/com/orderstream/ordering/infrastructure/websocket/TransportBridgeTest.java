package com.orderstream.ordering.infrastructure.websocket;

import static org.assertj.core.api.Assertions.assertThat;

import com.orderstream.observability.MetricFactory;
import com.orderstream.ordering.domain.bus.InProcessChangeEventBus;
import com.orderstream.syncmodel.Category;
import com.orderstream.syncmodel.ChangeEnvelope;
import com.orderstream.syncmodel.EntityType;
import com.orderstream.syncmodel.Product;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

@DisplayName("TransportBridge")
class TransportBridgeTest {

    private SimpleMeterRegistry registry;
    private InProcessChangeEventBus bus;
    private TransportBridge bridge;
    private BridgeConnection connection;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        var metrics = new MetricFactory(registry, "test-service");
        bus = new InProcessChangeEventBus(metrics);
        var executor = new SimpleAsyncTaskExecutor("bridge-test-");
        executor.setDaemon(true);
        bridge = new TransportBridge(bus, executor, metrics);
    }

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    @DisplayName("forwards serialized envelopes in publish order")
    void forwardsInOrder() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        connection = bridge.open("conn-1", Set.of(), frames::add);

        bus.publish(ChangeEnvelope.added(new Category("c-1", "Drinks")));
        bus.publish(ChangeEnvelope.updated(new Category("c-1", "Cold drinks")));
        bus.publish(ChangeEnvelope.deleted(EntityType.CATEGORY, "c-1"));

        assertThat(frames.poll(5, TimeUnit.SECONDS)).contains("\"operation\":\"Add\"");
        assertThat(frames.poll(5, TimeUnit.SECONDS)).contains("Cold drinks");
        assertThat(frames.poll(5, TimeUnit.SECONDS))
                .isEqualTo("{\"entity_type\":\"Category\",\"operation\":\"Delete\",\"payload\":\"c-1\"}");
    }

    @Test
    @DisplayName("only forwards the requested channels")
    void filtersChannels() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        connection = bridge.open("conn-2", Set.of(EntityType.PRODUCT), frames::add);

        bus.publish(ChangeEnvelope.added(new Category("c-1", "Drinks")));
        bus.publish(ChangeEnvelope.added(new Product("p-1", "Cola", "c-1", new BigDecimal("3.00"), true)));

        String frame = frames.poll(5, TimeUnit.SECONDS);
        assertThat(frame).contains("\"entity_type\":\"Product\"").contains("\"price\":3.00");
        assertThat(frames.poll(100, TimeUnit.MILLISECONDS)).isNull();
    }

    @Test
    @DisplayName("a failed send closes the connection and counts the failure")
    void sendFailureCloses() throws Exception {
        var attempted = new CountDownLatch(1);
        connection = bridge.open("conn-3", Set.of(), frame -> {
            attempted.countDown();
            throw new IOException("broken pipe");
        });

        bus.publish(ChangeEnvelope.added(new Category("c-1", "Drinks")));

        assertThat(attempted.await(5, TimeUnit.SECONDS)).isTrue();
        waitUntilClosed(connection);
        assertThat(bus.subscriberCount()).isZero();
        assertThat(registry.get("sync.transport.send.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("a runtime failure while sending also closes the connection and aborts the sink")
    void runtimeSendFailureCloses() throws Exception {
        var aborted = new CountDownLatch(1);
        connection = bridge.open("conn-5", Set.of(), new EnvelopeSink() {
            @Override
            public void send(String frame) {
                throw new IllegalStateException("The WebSocket session has been closed");
            }

            @Override
            public void abort() {
                aborted.countDown();
            }
        });

        bus.publish(ChangeEnvelope.added(new Category("c-1", "Drinks")));

        assertThat(aborted.await(5, TimeUnit.SECONDS)).isTrue();
        waitUntilClosed(connection);
        for (int i = 0; i < 100; i++) {
            bus.publish(ChangeEnvelope.added(new Category("c-" + i, "Extra")));
        }
        assertThat(bus.subscriberCount()).isZero();
        assertThat(connection.subscription().backlog()).isZero();
        assertThat(registry.get("sync.transport.send.failures").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("closing the connection unsubscribes from the bus")
    void closeUnsubscribes() {
        connection = bridge.open("conn-4", Set.of(EntityType.ORDER), frame -> { });
        assertThat(bus.subscriberCount()).isEqualTo(1);

        connection.close();

        assertThat(connection.isOpen()).isFalse();
        assertThat(bus.subscriberCount()).isZero();
    }

    private static void waitUntilClosed(BridgeConnection connection) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (connection.isOpen() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(connection.isOpen()).isFalse();
    }
}
