package com.ryuqq.agentmesh.testkit.contract;

import com.ryuqq.agentmesh.core.contract.Channels;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.TransportUnavailableException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.spi.ConnectionListener;
import com.ryuqq.agentmesh.core.spi.Subscription;
import com.ryuqq.agentmesh.core.spi.Transport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract tests every {@link Transport} adapter must pass.
 *
 * <p>Adapters extend this class and supply a fresh transport plus hooks to simulate a
 * dropped and restored connection.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryTransportContractTest extends AbstractTransportContractTest {
 *     {@literal @}Override
 *     protected Transport createTransport() { return new InMemoryTransport(); }
 *     ...
 * }
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public abstract class AbstractTransportContractTest {

    protected static final long DELIVERY_TIMEOUT_MS = 2000;

    protected static final AgentId ALICE = AgentId.of("alice");
    protected static final AgentId BOB = AgentId.of("bob");

    protected Transport transport;

    /**
     * @return a new, connected transport
     */
    protected abstract Transport createTransport();

    /**
     * Simulates a transient connection drop.
     */
    protected abstract void dropConnection(Transport transport);

    /**
     * Restores a previously dropped connection.
     */
    protected abstract void restoreConnection(Transport transport);

    /**
     * Releases the transport after each test.
     */
    protected abstract void closeTransport(Transport transport);

    @BeforeEach
    void setUpTransport() {
        transport = createTransport();
    }

    @AfterEach
    void tearDownTransport() {
        if (transport != null) {
            closeTransport(transport);
        }
    }

    @Test
    void publish_SubscribedChannel_DeliversEqualEnvelope() throws InterruptedException {
        // Given
        BlockingQueue<Envelope> received = new LinkedBlockingQueue<>();
        transport.subscribe(Channels.inbox(BOB), received::add);
        Envelope envelope = Envelope.request(ALICE, BOB, Payload.of("q", "hello"));

        // When
        int receivers = transport.publish(Channels.inbox(BOB), envelope);

        // Then
        assertEquals(1, receivers);
        Envelope delivered = received.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        assertEquals(envelope, delivered);
    }

    @Test
    void publish_NoSubscribers_ReturnsZero() {
        int receivers = transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty()));

        assertEquals(0, receivers);
    }

    @Test
    void publish_MultipleSubscribers_EachReceivesOnce() throws InterruptedException {
        // Given
        BlockingQueue<Envelope> first = new LinkedBlockingQueue<>();
        BlockingQueue<Envelope> second = new LinkedBlockingQueue<>();
        transport.subscribe(Channels.BROADCAST, first::add);
        transport.subscribe(Channels.BROADCAST, second::add);

        // When
        int receivers = transport.publish(Channels.BROADCAST, Envelope.broadcast(ALICE, Payload.empty()));

        // Then
        assertEquals(2, receivers);
        assertNotNull(first.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertNotNull(second.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertNull(first.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void publish_SamePublisher_PreservesOrderPerSubscription() throws InterruptedException {
        // Given
        int count = 200;
        List<Long> sequence = new ArrayList<>();
        CountDownLatch done = new CountDownLatch(count);
        transport.subscribe(Channels.inbox(BOB), envelope -> {
            synchronized (sequence) {
                sequence.add(envelope.payload().getLong("seq").orElseThrow());
            }
            done.countDown();
        });

        // When
        for (int i = 0; i < count; i++) {
            transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.of("seq", i)));
        }

        // Then
        assertTrue(done.await(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        synchronized (sequence) {
            for (int i = 0; i < count; i++) {
                assertEquals(Long.valueOf(i), sequence.get(i));
            }
        }
    }

    @Test
    void publish_SlowHandler_DoesNotBlockPublisher() throws InterruptedException {
        // Given
        CountDownLatch release = new CountDownLatch(1);
        transport.subscribe(Channels.inbox(BOB), envelope -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        // When
        long start = System.nanoTime();
        for (int i = 0; i < 10; i++) {
            transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty()));
        }
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        release.countDown();

        // Then
        assertTrue(elapsedMs < 1000, "publish blocked for " + elapsedMs + "ms");
    }

    @Test
    void publish_HandlerThrows_LaterEnvelopesStillDelivered() throws InterruptedException {
        // Given
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch second = new CountDownLatch(1);
        transport.subscribe(Channels.inbox(BOB), envelope -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("handler failure");
            }
            second.countDown();
        });

        // When
        assertDoesNotThrow(() -> transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty())));
        transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty()));

        // Then
        assertTrue(second.await(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void close_StopsDelivery_AndIsIdempotent() throws InterruptedException {
        // Given
        BlockingQueue<Envelope> received = new LinkedBlockingQueue<>();
        Subscription subscription = transport.subscribe(Channels.inbox(BOB), received::add);

        // When
        subscription.close();
        subscription.close();
        int receivers = transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty()));

        // Then
        assertFalse(subscription.isActive());
        assertEquals(0, receivers);
        assertNull(received.poll(100, TimeUnit.MILLISECONDS));
    }

    @Test
    void dropConnection_PublishAndSubscribeFailRetryably() {
        // Given
        Subscription subscription = transport.subscribe(Channels.inbox(BOB), envelope -> { });

        // When
        dropConnection(transport);

        // Then
        assertFalse(transport.isConnected());
        assertFalse(subscription.isActive());
        TransportUnavailableException publishError = assertThrows(TransportUnavailableException.class,
            () -> transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty())));
        assertTrue(publishError.isRetryable());
        assertThrows(TransportUnavailableException.class,
            () -> transport.subscribe(Channels.inbox(BOB), envelope -> { }));
    }

    @Test
    void restoreConnection_NotifiesListeners_WithoutResubscribing() throws InterruptedException {
        // Given
        CountDownLatch dropped = new CountDownLatch(1);
        CountDownLatch restored = new CountDownLatch(1);
        transport.addConnectionListener(new ConnectionListener() {
            @Override
            public void onDisconnected() {
                dropped.countDown();
            }

            @Override
            public void onReconnected() {
                restored.countDown();
            }
        });
        BlockingQueue<Envelope> received = new LinkedBlockingQueue<>();
        Subscription old = transport.subscribe(Channels.inbox(BOB), received::add);

        // When
        dropConnection(transport);
        restoreConnection(transport);

        // Then
        assertTrue(dropped.await(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertTrue(restored.await(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        assertTrue(transport.isConnected());
        assertFalse(old.isActive());
        assertEquals(0, transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty())));

        transport.subscribe(Channels.inbox(BOB), received::add);
        assertEquals(1, transport.publish(Channels.inbox(BOB), Envelope.notification(ALICE, BOB, Payload.empty())));
        assertNotNull(received.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void publish_BlankChannel_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class,
            () -> transport.publish(" ", Envelope.notification(ALICE, BOB, Payload.empty())));
        assertThrows(IllegalArgumentException.class, () -> transport.subscribe(Channels.inbox(BOB), null));
    }
}
