package com.ryuqq.agentmesh.core.spi;

import com.ryuqq.agentmesh.core.contract.Envelope;

/**
 * Publish/subscribe broker SPI carrying envelopes between agents.
 *
 * <p>Channels are named strings; see {@link com.ryuqq.agentmesh.core.contract.Channels} for the
 * inbox and broadcast naming scheme.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods may be called from any thread</li>
 *   <li>Non-blocking publish: a slow handler never blocks the publisher</li>
 *   <li>Ordering: envelopes from one publisher on one channel reach each subscription in publication order</li>
 *   <li>No internal retry: a dropped connection surfaces as {@link com.ryuqq.agentmesh.core.exception.TransportUnavailableException}
 *       and invalidates every subscription; re-subscribing is the caller's job</li>
 *   <li>Isolation: an exception thrown by a handler never propagates to the publisher</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Subscription inbox = transport.subscribe(Channels.inbox(agentId), envelope -&gt; handle(envelope));
 * int receivers = transport.publish(Channels.inbox(peerId), Envelope.request(agentId, peerId, payload));
 * inbox.close();
 * </pre>
 *
 * @author AgentMesh Team
 * @since 1.0.0
 */
public interface Transport {

    /**
     * Publishes an envelope to a channel.
     *
     * @param channel target channel
     * @param envelope envelope to deliver
     * @return number of subscriptions the envelope was handed to (0 when nobody listens)
     * @throws IllegalArgumentException if channel is blank or envelope is null
     * @throws com.ryuqq.agentmesh.core.exception.TransportUnavailableException if the connection is down
     */
    int publish(String channel, Envelope envelope);

    /**
     * Subscribes a handler to a channel.
     *
     * @param channel channel to listen on
     * @param handler callback for delivered envelopes
     * @return handle used to stop delivery
     * @throws IllegalArgumentException if channel is blank or handler is null
     * @throws com.ryuqq.agentmesh.core.exception.TransportUnavailableException if the connection is down
     */
    Subscription subscribe(String channel, InboundHandler handler);

    /**
     * @return true while the underlying connection is usable
     */
    boolean isConnected();

    /**
     * Registers a listener for connection drops and reconnects.
     *
     * @param listener listener to notify
     * @throws IllegalArgumentException if listener is null
     */
    void addConnectionListener(ConnectionListener listener);

    /**
     * Removes a previously added listener. Unknown listeners are ignored.
     *
     * @param listener listener to remove
     */
    void removeConnectionListener(ConnectionListener listener);
}
