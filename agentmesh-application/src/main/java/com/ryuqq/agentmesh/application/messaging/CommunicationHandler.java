package com.ryuqq.agentmesh.application.messaging;

import com.ryuqq.agentmesh.core.contract.Channels;
import com.ryuqq.agentmesh.core.contract.Envelope;
import com.ryuqq.agentmesh.core.exception.AgentMeshException;
import com.ryuqq.agentmesh.core.exception.PeerGoneException;
import com.ryuqq.agentmesh.core.exception.RequestTimeoutException;
import com.ryuqq.agentmesh.core.exception.TransportUnavailableException;
import com.ryuqq.agentmesh.core.model.AgentId;
import com.ryuqq.agentmesh.core.model.MessageId;
import com.ryuqq.agentmesh.core.model.Payload;
import com.ryuqq.agentmesh.core.protection.BackoffCalculator;
import com.ryuqq.agentmesh.core.spi.ConnectionListener;
import com.ryuqq.agentmesh.core.spi.InboundHandler;
import com.ryuqq.agentmesh.core.spi.Subscription;
import com.ryuqq.agentmesh.core.spi.Transport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes envelopes between agents over a {@link Transport}.
 *
 * <p>The handler owns the agent address book of a process: each registered agent is subscribed to
 * its inbox channel and to the broadcast channel, and every inbound envelope is either matched to an
 * outstanding request or handed to the agent's {@link InboundHandler}.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Registration: subscribe with retry and exponential backoff, re-subscribe after a transport reconnect</li>
 *   <li>Correlation: one-shot reply slots keyed by request id, released on reply, timeout, publish failure
 *       or peer loss</li>
 *   <li>Isolation: handler exceptions are logged and never reach the transport</li>
 *   <li>History: a bounded log of sent envelopes for diagnostics</li>
 * </ul>
 *
 * <p><strong>Request Flow:</strong></p>
 * <pre>
 * 1. request(to, envelope, timeout) inserts a slot for envelope.id()
 * 2. the envelope is published to inbox:{to}
 * 3. a response with correlationId == envelope.id() arriving on the requester's inbox resolves the slot
 * 4. otherwise the timeout fires RequestTimeoutException, or deregister fires PeerGoneException
 * </pre>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CommunicationHandler handler = new CommunicationHandler(transport);
 * handler.register(bob, envelope -&gt; handler.respond(envelope, bob, Payload.of("ack", true)));
 * handler.register(alice, envelope -&gt; { });
 * Envelope reply = handler.sendAndWait(bob, Envelope.request(alice, bob, Payload.of("topic", "x")),
 *     Duration.ofSeconds(5));
 * </pre>
 *
 * <p>Thread-safe. All methods may be called concurrently from any thread.</p>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public class CommunicationHandler {

    private static final Logger log = LoggerFactory.getLogger(CommunicationHandler.class);

    private static final long WAIT_GRACE_MS = 1000;

    private final Transport transport;
    private final MessagingConfig config;
    private final BackoffCalculator backoff;

    private final ConcurrentHashMap<AgentId, Registration> registrations = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<MessageId, PendingReply> pending = new ConcurrentHashMap<>();

    /**
     * Sent envelopes, oldest first. Guarded by itself.
     */
    private final List<Envelope> history = new ArrayList<>();

    private final ScheduledThreadPoolExecutor timeouts;
    private final ConnectionListener connectionListener = new ReconnectListener();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CommunicationHandler(Transport transport) {
        this(transport, new MessagingConfig());
    }

    /**
     * Creates a handler bound to the given transport.
     *
     * @param transport the pub/sub transport (not null)
     * @param config messaging settings (not null)
     */
    public CommunicationHandler(Transport transport, MessagingConfig config) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.transport = transport;
        this.config = config;
        this.backoff = config.subscribeBackoff();
        this.timeouts = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "agentmesh-request-timeout");
            thread.setDaemon(true);
            return thread;
        });
        this.timeouts.setRemoveOnCancelPolicy(true);
        transport.addConnectionListener(connectionListener);
    }

    /**
     * Registers an agent, subscribing its inbox and the broadcast channel.
     *
     * <p>Registering an already registered agent swaps its handler in place. Subsequent
     * envelopes go to the new handler only; live subscriptions are kept, and subscriptions
     * lost to a connection drop are re-established.</p>
     *
     * @param agentId the agent address (not the broadcast address)
     * @param handler receives every envelope not consumed by a pending request
     * @throws TransportUnavailableException when subscribing still fails after
     *         {@link MessagingConfig#subscribeMaxAttempts()} attempts
     */
    public void register(AgentId agentId, InboundHandler handler) {
        ensureOpen();
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        if (agentId.isBroadcast()) {
            throw new IllegalArgumentException("the broadcast address cannot be registered");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }

        Registration created = new Registration(agentId, handler);
        Registration existing = registrations.putIfAbsent(agentId, created);
        Registration registration = existing != null ? existing : created;
        synchronized (registration) {
            InboundHandler previous = registration.handler;
            registration.handler = handler;
            if (!registration.isSubscribed()) {
                try {
                    subscribeWithRetry(registration);
                } catch (RuntimeException e) {
                    if (existing == null) {
                        registrations.remove(agentId, registration);
                        registration.release();
                    } else {
                        // stays registered so the reconnect path restores it
                        registration.handler = previous;
                    }
                    throw e;
                }
            }
        }
        log.info("Agent registered: {}", agentId.getValue());
    }

    /**
     * Removes an agent and fails every outstanding request it takes part in.
     *
     * @param agentId the agent to remove
     * @return true when the agent was registered
     */
    public boolean deregister(AgentId agentId) {
        if (agentId == null) {
            throw new IllegalArgumentException("agentId cannot be null");
        }
        Registration registration = registrations.remove(agentId);
        if (registration == null) {
            return false;
        }
        synchronized (registration) {
            registration.release();
        }

        int failed = 0;
        for (PendingReply slot : pending.values()) {
            if (slot.involves(agentId) && slot.fail(new PeerGoneException(agentId))) {
                failed++;
            }
        }
        log.info("Agent deregistered: {} (failed {} outstanding requests)", agentId.getValue(), failed);
        return true;
    }

    public boolean isRegistered(AgentId agentId) {
        return agentId != null && registrations.containsKey(agentId);
    }

    /**
     * Publishes an envelope to the inbox of {@code to}.
     *
     * @param to the addressee, must equal {@code envelope.to()}
     * @param envelope the envelope to send
     * @return the number of subscriptions the envelope was handed to
     * @throws TransportUnavailableException when the transport connection is down
     */
    public int send(AgentId to, Envelope envelope) {
        ensureOpen();
        requireAddressed(to, envelope);
        int receivers = transport.publish(Channels.inbox(to), envelope);
        record(envelope);
        if (receivers == 0) {
            log.debug("No subscriber for inbox of {} (envelope {})", to.getValue(), envelope.id().getValue());
        }
        return receivers;
    }

    /**
     * Sends a request and returns a future completed by the correlated response.
     *
     * <p>The future fails with {@link RequestTimeoutException} when no response arrives within
     * {@code timeout}, and with {@link PeerGoneException} when either side is deregistered first.
     * Cancelling the future releases the reply slot.</p>
     *
     * @param to the addressee
     * @param envelope a {@code request} envelope sent by a registered agent
     * @param timeout how long to wait for the response (positive)
     * @return the future response
     * @throws TransportUnavailableException when publishing fails; the slot is released first
     */
    public CompletableFuture<Envelope> request(AgentId to, Envelope envelope, Duration timeout) {
        ensureOpen();
        requireAddressed(to, envelope);
        if (!envelope.kind().isRequest()) {
            throw new IllegalArgumentException("envelope kind must be request (current: " + envelope.kind() + ")");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        PendingReply slot = new PendingReply(envelope.id(), envelope.from(), to);
        if (pending.putIfAbsent(slot.requestId(), slot) != null) {
            throw new IllegalArgumentException("request " + envelope.id().getValue() + " is already outstanding");
        }
        // checked after the slot is visible, so a concurrent deregister either fails it or is seen here
        if (!registrations.containsKey(envelope.from())) {
            pending.remove(slot.requestId(), slot);
            throw new IllegalStateException(
                "requester " + envelope.from().getValue() + " must be registered to receive the response");
        }
        slot.future().whenComplete((response, error) -> release(slot));
        slot.attachTimer(timeouts.schedule(
            () -> slot.fail(new RequestTimeoutException(slot.requestId(), timeout)),
            timeout.toMillis(),
            TimeUnit.MILLISECONDS
        ));

        try {
            send(to, envelope);
        } catch (RuntimeException e) {
            slot.fail(e);
            throw e;
        }
        return slot.future();
    }

    /**
     * Blocking form of {@link #request(AgentId, Envelope, Duration)}.
     *
     * @return the response envelope
     * @throws RequestTimeoutException when no response arrives within {@code timeout}
     * @throws PeerGoneException when either agent is deregistered while waiting
     */
    public Envelope sendAndWait(AgentId to, Envelope envelope, Duration timeout) {
        CompletableFuture<Envelope> future = request(to, envelope, timeout);
        try {
            return future.get(timeout.toMillis() + WAIT_GRACE_MS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new AgentMeshException("REQUEST_FAILED", String.valueOf(cause.getMessage()), cause);
        } catch (TimeoutException e) {
            RequestTimeoutException timeoutException = new RequestTimeoutException(envelope.id(), timeout);
            future.completeExceptionally(timeoutException);
            throw timeoutException;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(false);
            throw new AgentMeshException("INTERRUPTED", "Interrupted while waiting for " + envelope.id().getValue(), e);
        }
    }

    /**
     * Sends the response to {@code request} on behalf of {@code from}.
     *
     * @return the response that was sent
     */
    public Envelope respond(Envelope request, AgentId from, Payload payload) {
        Envelope response = Envelope.response(request, from, payload);
        send(response.to(), response);
        return response;
    }

    /**
     * Publishes an envelope to every registered agent except its sender.
     *
     * @param envelope an envelope addressed to {@link AgentId#BROADCAST}
     * @return the number of subscriptions the envelope was handed to
     */
    public int broadcast(Envelope envelope) {
        ensureOpen();
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (!envelope.to().isBroadcast()) {
            throw new IllegalArgumentException("broadcast envelopes must be addressed to " + AgentId.BROADCAST);
        }
        int receivers = transport.publish(Channels.BROADCAST, envelope);
        record(envelope);
        return receivers;
    }

    /**
     * Returns the most recent sent envelopes involving an agent, oldest first.
     *
     * @param agentId sender or addressee to filter on, or null for all envelopes
     * @param limit maximum number of entries (positive)
     */
    public List<Envelope> history(AgentId agentId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        List<Envelope> matching = new ArrayList<>();
        synchronized (history) {
            for (Envelope envelope : history) {
                if (agentId == null || agentId.equals(envelope.from()) || agentId.equals(envelope.to())) {
                    matching.add(envelope);
                }
            }
        }
        int from = Math.max(0, matching.size() - limit);
        return List.copyOf(matching.subList(from, matching.size()));
    }

    public HandlerStatus status() {
        int historySize;
        synchronized (history) {
            historySize = history.size();
        }
        return new HandlerStatus(
            new HashSet<>(registrations.keySet()),
            pending.size(),
            historySize,
            transport.isConnected()
        );
    }

    /**
     * Fails every outstanding request, deregisters every agent and stops the timeout scheduler.
     *
     * <p>Idempotent. The handler rejects further work afterwards.</p>
     */
    public void shutdown() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        transport.removeConnectionListener(connectionListener);
        for (PendingReply slot : pending.values()) {
            slot.fail(new PeerGoneException(slot.peer()));
        }
        for (AgentId agentId : new ArrayList<>(registrations.keySet())) {
            deregister(agentId);
        }
        timeouts.shutdownNow();
        log.info("CommunicationHandler shut down");
    }

    private void onInbox(Registration registration, Envelope envelope) {
        if (registrations.get(registration.agentId) != registration) {
            log.warn("Undeliverable envelope {} for {}: agent not registered",
                envelope.id().getValue(), registration.agentId.getValue());
            return;
        }
        if (envelope.kind().isResponse() && envelope.hasCorrelationId()) {
            PendingReply slot = pending.get(envelope.correlationId());
            if (slot != null && slot.requester().equals(registration.agentId)) {
                if (!slot.resolve(envelope)) {
                    log.debug("Duplicate response {} ignored", envelope.id().getValue());
                }
                return;
            }
        }
        deliver(registration, envelope);
    }

    private void onBroadcast(Registration registration, Envelope envelope) {
        if (registration.agentId.equals(envelope.from())) {
            return;
        }
        if (registrations.get(registration.agentId) != registration) {
            return;
        }
        deliver(registration, envelope);
    }

    private void deliver(Registration registration, Envelope envelope) {
        InboundHandler handler = registration.handler;
        try {
            handler.handle(envelope);
        } catch (RuntimeException e) {
            log.error("Handler of {} failed on envelope {} (kind: {})",
                registration.agentId.getValue(), envelope.id().getValue(), envelope.kind().getValue(), e);
        }
    }

    /**
     * Subscribes both channels of a registration, retrying while the transport is unavailable.
     * Callers hold the registration's monitor.
     */
    private void subscribeWithRetry(Registration registration) {
        int maxAttempts = config.subscribeMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                registration.release();
                registration.inbox = transport.subscribe(
                    Channels.inbox(registration.agentId), envelope -> onInbox(registration, envelope));
                registration.broadcast = transport.subscribe(
                    Channels.BROADCAST, envelope -> onBroadcast(registration, envelope));
                return;
            } catch (TransportUnavailableException e) {
                registration.release();
                if (attempt >= maxAttempts) {
                    log.error("Subscribing {} failed after {} attempts", registration.agentId.getValue(), attempt);
                    throw e;
                }
                long delayMs = backoff.calculate(attempt);
                log.warn("Subscribing {} failed (attempt {}/{}), retrying in {}ms: {}",
                    registration.agentId.getValue(), attempt, maxAttempts, delayMs, e.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private void resubscribeAll() {
        AtomicInteger restored = new AtomicInteger();
        registrations.forEach((agentId, registration) -> {
            synchronized (registration) {
                if (registrations.get(agentId) != registration) {
                    return;
                }
                try {
                    subscribeWithRetry(registration);
                    restored.incrementAndGet();
                } catch (TransportUnavailableException e) {
                    log.error("Could not restore subscriptions of {} after reconnect", agentId.getValue(), e);
                }
            }
        });
        log.info("Transport reconnected, restored {} registrations", restored.get());
    }

    private void release(PendingReply slot) {
        pending.remove(slot.requestId(), slot);
        slot.cancelTimer();
    }

    private void record(Envelope envelope) {
        synchronized (history) {
            history.add(envelope);
            if (history.size() > config.historyLimit()) {
                history.subList(0, history.size() - config.historyRetain()).clear();
            }
        }
    }

    private void requireAddressed(AgentId to, Envelope envelope) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        if (to.isBroadcast()) {
            throw new IllegalArgumentException("use broadcast() for the broadcast address");
        }
        if (!to.equals(envelope.to())) {
            throw new IllegalArgumentException(
                "envelope is addressed to " + envelope.to().getValue() + ", not " + to.getValue());
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("CommunicationHandler is shut down");
        }
    }

    private final class ReconnectListener implements ConnectionListener {

        @Override
        public void onDisconnected() {
            log.warn("Transport connection lost; {} registrations waiting for reconnect", registrations.size());
        }

        @Override
        public void onReconnected() {
            if (!closed.get()) {
                resubscribeAll();
            }
        }
    }

    private static final class Registration {

        private final AgentId agentId;
        private volatile InboundHandler handler;
        private volatile Subscription inbox;
        private volatile Subscription broadcast;

        private Registration(AgentId agentId, InboundHandler handler) {
            this.agentId = agentId;
            this.handler = handler;
        }

        private boolean isSubscribed() {
            Subscription currentInbox = inbox;
            Subscription currentBroadcast = broadcast;
            return currentInbox != null && currentInbox.isActive()
                && currentBroadcast != null && currentBroadcast.isActive();
        }

        private void release() {
            if (inbox != null) {
                inbox.close();
                inbox = null;
            }
            if (broadcast != null) {
                broadcast.close();
                broadcast = null;
            }
        }
    }
}
