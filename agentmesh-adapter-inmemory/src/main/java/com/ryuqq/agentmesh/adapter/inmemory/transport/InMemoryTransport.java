package com.ryuqq.agentmesh.adapter.inmemory.transport;

import com.ryuqq.agentmesh.core.codec.EnvelopeCodec;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.TransportUnavailableException;
import com.ryuqq.agentmesh.core.spi.ConnectionListener;
import com.ryuqq.agentmesh.core.spi.InboundHandler;
import com.ryuqq.agentmesh.core.spi.Subscription;
import com.ryuqq.agentmesh.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process implementation of {@link Transport}.
 *
 * <p>One instance simulates a single broker connection shared by every agent of a process.
 * Each envelope is encoded to JSON on publish and decoded again for each subscription, so
 * subscribers never share instances with the publisher and the wire format is exercised
 * end to end.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Channels:</strong> ConcurrentHashMap&lt;String, Set&lt;InMemorySubscription&gt;&gt;</li>
 *   <li><strong>Delivery lanes:</strong> each subscription owns a FIFO queue drained by at most one
 *       thread of the shared delivery pool at a time</li>
 *   <li><strong>Connection events:</strong> listeners are notified in order on a dedicated single thread</li>
 * </ul>
 *
 * <p><strong>Connection simulation:</strong> {@link #disconnect()} invalidates every subscription and makes
 * publish/subscribe fail with {@link TransportUnavailableException}; {@link #reconnect()} restores the
 * connection but does not restore subscriptions.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryTransport transport = new InMemoryTransport();
 * transport.subscribe(Channels.inbox(bob), envelope -&gt; log.info("got {}", envelope.id()));
 * transport.publish(Channels.inbox(bob), Envelope.notification(alice, bob, Payload.empty()));
 * transport.close();
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class InMemoryTransport implements Transport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransport.class);

    private final EnvelopeCodec codec;

    /**
     * Active subscriptions per channel.
     */
    private final ConcurrentHashMap<String, Set<InMemorySubscription>> channels = new ConcurrentHashMap<>();

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * Runs delivery lanes. Cached so a blocked handler never starves other subscriptions.
     */
    private final ExecutorService deliveryPool;

    /**
     * Serializes connection listener callbacks.
     */
    private final ExecutorService eventExecutor;

    private final AtomicBoolean connected = new AtomicBoolean(true);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong publishedCount = new AtomicLong();

    public InMemoryTransport() {
        this(new EnvelopeCodec());
    }

    /**
     * @param codec codec used to copy envelopes through the wire format
     * @throws IllegalArgumentException if codec is null
     */
    public InMemoryTransport(EnvelopeCodec codec) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.codec = codec;
        this.deliveryPool = Executors.newCachedThreadPool(daemonThreads("agentmesh-transport-delivery"));
        this.eventExecutor = Executors.newSingleThreadExecutor(daemonThreads("agentmesh-transport-events"));
    }

    @Override
    public int publish(String channel, Envelope envelope) {
        requireChannel(channel);
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        ensureConnected();

        String wire = codec.encode(envelope);
        int receivers = 0;
        Set<InMemorySubscription> subscriptions = channels.get(channel);
        if (subscriptions != null) {
            for (InMemorySubscription subscription : subscriptions) {
                if (subscription.offer(wire)) {
                    receivers++;
                }
            }
        }
        publishedCount.incrementAndGet();

        if (receivers == 0) {
            log.debug("No subscribers on channel {}, envelope {} dropped", channel, envelope.id().getValue());
        }
        return receivers;
    }

    @Override
    public Subscription subscribe(String channel, InboundHandler handler) {
        requireChannel(channel);
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        ensureConnected();

        InMemorySubscription subscription = new InMemorySubscription(channel, handler);
        channels.computeIfAbsent(channel, key -> ConcurrentHashMap.newKeySet()).add(subscription);
        log.debug("Subscribed to channel {}", channel);
        return subscription;
    }

    @Override
    public boolean isConnected() {
        return connected.get() && !closed.get();
    }

    @Override
    public void addConnectionListener(ConnectionListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
    }

    @Override
    public void removeConnectionListener(ConnectionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Simulates a dropped connection.
     *
     * <p>Every subscription becomes inactive and pending deliveries are discarded.
     * Calling it while already disconnected has no effect.</p>
     */
    public void disconnect() {
        if (closed.get() || !connected.compareAndSet(true, false)) {
            return;
        }
        invalidateAllSubscriptions();
        log.warn("Transport connection dropped");
        notifyListeners(true);
    }

    /**
     * Restores a dropped connection. Subscriptions are not restored.
     */
    public void reconnect() {
        if (closed.get() || !connected.compareAndSet(false, true)) {
            return;
        }
        log.info("Transport connection restored");
        notifyListeners(false);
    }

    /**
     * Shuts the transport down. Further calls fail with {@link TransportUnavailableException}.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        connected.set(false);
        invalidateAllSubscriptions();
        listeners.clear();
        eventExecutor.shutdown();
        deliveryPool.shutdown();
        try {
            if (!deliveryPool.awaitTermination(1, TimeUnit.SECONDS)) {
                deliveryPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            deliveryPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("Transport closed");
    }

    /**
     * Number of active subscriptions on a channel. Used for test assertions.
     *
     * @param channel channel name
     * @return active subscription count
     */
    public int subscriberCount(String channel) {
        Set<InMemorySubscription> subscriptions = channels.get(channel);
        if (subscriptions == null) {
            return 0;
        }
        int count = 0;
        for (InMemorySubscription subscription : subscriptions) {
            if (subscription.isActive()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Total number of successful publish calls. Used for test assertions.
     *
     * @return publish count
     */
    public long publishedCount() {
        return publishedCount.get();
    }

    private void ensureConnected() {
        if (closed.get()) {
            throw new TransportUnavailableException("Transport is closed");
        }
        if (!connected.get()) {
            throw new TransportUnavailableException("Transport connection is down");
        }
    }

    private void invalidateAllSubscriptions() {
        for (Set<InMemorySubscription> subscriptions : channels.values()) {
            for (InMemorySubscription subscription : subscriptions) {
                subscription.deactivate();
            }
        }
        channels.clear();
    }

    private void notifyListeners(boolean disconnected) {
        try {
            eventExecutor.execute(() -> {
                for (ConnectionListener listener : listeners) {
                    try {
                        if (disconnected) {
                            listener.onDisconnected();
                        } else {
                            listener.onReconnected();
                        }
                    } catch (RuntimeException e) {
                        log.error("Connection listener failed", e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Transport closed, connection event dropped");
        }
    }

    private static void requireChannel(String channel) {
        if (channel == null || channel.isBlank()) {
            throw new IllegalArgumentException("channel cannot be null or blank");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Subscription with its own serial delivery lane.
     *
     * <p>{@code scheduled} guarantees at most one pool thread drains the lane, which keeps
     * delivery in publication order.</p>
     */
    private final class InMemorySubscription implements Subscription {

        private final String channel;
        private final InboundHandler handler;
        private final Queue<String> lane = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean(false);
        private final AtomicBoolean active = new AtomicBoolean(true);

        InMemorySubscription(String channel, InboundHandler handler) {
            this.channel = channel;
            this.handler = handler;
        }

        boolean offer(String wire) {
            if (!active.get()) {
                return false;
            }
            lane.add(wire);
            scheduleDrain();
            return true;
        }

        private void scheduleDrain() {
            if (scheduled.compareAndSet(false, true)) {
                try {
                    deliveryPool.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    scheduled.set(false);
                    lane.clear();
                }
            }
        }

        private void drain() {
            String wire;
            while (active.get() && (wire = lane.poll()) != null) {
                deliver(wire);
            }
            scheduled.set(false);
            if (active.get() && !lane.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(String wire) {
            try {
                handler.handle(codec.decode(wire));
            } catch (RuntimeException e) {
                log.error("Handler on channel {} threw, envelope skipped", channel, e);
            }
        }

        void deactivate() {
            active.set(false);
            lane.clear();
        }

        @Override
        public String channel() {
            return channel;
        }

        @Override
        public boolean isActive() {
            return active.get();
        }

        @Override
        public void close() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            lane.clear();
            Set<InMemorySubscription> subscriptions = channels.get(channel);
            if (subscriptions != null) {
                subscriptions.remove(this);
            }
            log.debug("Unsubscribed from channel {}", channel);
        }
    }
}
