package com.virtualsol.discovery.modules.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.virtualsol.discovery.config.DiscoveryProperties;
import com.virtualsol.discovery.config.SchedulerConfig;
import com.virtualsol.discovery.modules.stream.event.StreamConnectedEvent;
import com.virtualsol.discovery.modules.stream.event.StreamDisconnectedEvent;
import com.virtualsol.discovery.modules.stream.event.StreamGaveUpEvent;
import com.virtualsol.discovery.util.BackoffUtils;
import com.virtualsol.discovery.util.MintValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the single PumpPortal connection.
 *
 * <p>On every open it subscribes to new-token and migration events and re-sends trade
 * subscriptions. A ping goes out every ping interval; a missing pong within the pong timeout
 * terminates the socket. Closed sockets are replaced with exponential backoff until the
 * attempt limit, after which a {@link StreamGaveUpEvent} is published and retries stop.
 *
 * <p>Decoded events are published on the application event bus from the socket thread.
 */
@Service
public class PumpPortalStreamService {

    private static final Logger logger = LoggerFactory.getLogger(PumpPortalStreamService.class);

    private final DiscoveryProperties.Stream config;
    private final StreamMessageDecoder decoder;
    private final ApplicationEventPublisher eventPublisher;
    private final TaskScheduler scheduler;
    private final StreamSocket.Factory socketFactory;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;

    private final Set<String> subscribedMints = ConcurrentHashMap.newKeySet();

    private volatile StreamSocket socket;
    private volatile boolean connecting;
    private volatile boolean shouldReconnect;
    private int reconnectAttempts;

    private ScheduledFuture<?> pingTask;
    private ScheduledFuture<?> pongTimeoutTask;
    private ScheduledFuture<?> reconnectTask;

    public PumpPortalStreamService(DiscoveryProperties properties,
                                   StreamMessageDecoder decoder,
                                   ApplicationEventPublisher eventPublisher,
                                   @Qualifier(SchedulerConfig.STREAM_SCHEDULER) TaskScheduler scheduler,
                                   StreamSocket.Factory socketFactory,
                                   ObjectMapper objectMapper,
                                   Tracer tracer) {
        this.config = properties.getStream();
        this.decoder = decoder;
        this.eventPublisher = eventPublisher;
        this.scheduler = scheduler;
        this.socketFactory = socketFactory;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
    }

    public synchronized void start() {
        shouldReconnect = true;
        reconnectAttempts = 0;
        connect();
    }

    /**
     * Stops reconnecting and closes the current socket.
     */
    public synchronized void stop() {
        shouldReconnect = false;
        cancel(reconnectTask);
        reconnectTask = null;
        stopHeartbeat();
        StreamSocket current = socket;
        socket = null;
        connecting = false;
        if (current != null) {
            current.close();
        }
        logger.info("PumpPortal stream stopped");
    }

    public boolean isConnected() {
        StreamSocket current = socket;
        return current != null && current.isOpen();
    }

    public int getSubscribedTokenCount() {
        return subscribedMints.size();
    }

    public Set<String> getSubscribedMints() {
        return Set.copyOf(subscribedMints);
    }

    /**
     * Subscribes to trades for mints not already subscribed. Subscriptions survive reconnects.
     *
     * @return number of newly subscribed mints
     */
    public int subscribeTokens(Collection<String> mints) {
        List<String> added = new ArrayList<>();
        for (String mint : mints) {
            if (MintValidator.isValid(mint) && subscribedMints.add(mint)) {
                added.add(mint);
            }
        }
        if (!added.isEmpty() && isConnected()) {
            send(tradeRequest("subscribeTokenTrade", added));
            logger.info("Subscribed to trades for {} tokens ({} total)", added.size(), subscribedMints.size());
        }
        return added.size();
    }

    public int unsubscribeTokens(Collection<String> mints) {
        List<String> removed = new ArrayList<>();
        for (String mint : mints) {
            if (subscribedMints.remove(mint)) {
                removed.add(mint);
            }
        }
        if (!removed.isEmpty() && isConnected()) {
            send(tradeRequest("unsubscribeTokenTrade", removed));
            logger.info("Unsubscribed from trades for {} tokens", removed.size());
        }
        return removed.size();
    }

    synchronized void connect() {
        if (!shouldReconnect) {
            return;
        }
        StreamSocket current = socket;
        if (current != null && (current.isOpen() || connecting)) {
            logger.debug("PumpPortal connection already open or in progress");
            return;
        }

        String url = config.resolveUrl();
        logger.info("Connecting to PumpPortal: {}", config.getUrl());
        connecting = true;
        try {
            ConnectionListener listener = new ConnectionListener();
            StreamSocket created = socketFactory.create(URI.create(url), listener);
            listener.bind(created);
            socket = created;
            created.connect();
        } catch (RuntimeException e) {
            logger.error("PumpPortal connection error: {}", e.getMessage(), e);
            socket = null;
            connecting = false;
            scheduleReconnect();
        }
    }

    private void handleOpen(StreamSocket source) {
        synchronized (this) {
            if (source != socket) {
                return;
            }
            connecting = false;
            reconnectAttempts = 0;
            logger.info("PumpPortal WebSocket connected");

            send(methodRequest("subscribeNewToken"));
            send(methodRequest("subscribeMigration"));
            if (!subscribedMints.isEmpty()) {
                send(tradeRequest("subscribeTokenTrade", new ArrayList<>(subscribedMints)));
            }
            logger.info("Subscribed to newToken and migration events, {} trade subscriptions restored",
                    subscribedMints.size());

            startHeartbeat();
        }
        eventPublisher.publishEvent(new StreamConnectedEvent(Instant.now()));
    }

    private void handleMessage(StreamSocket source, String raw) {
        if (source != socket) {
            return;
        }
        Span span = tracer.spanBuilder("PumpPortalStreamService.onMessage").startSpan();
        try {
            decoder.decode(raw).ifPresent(event -> {
                span.setAttribute("event", event.getClass().getSimpleName());
                eventPublisher.publishEvent(event);
            });
        } catch (RuntimeException e) {
            // a failing handler must not take the connection down
            span.recordException(e);
            logger.error("Error handling stream message", e);
        } finally {
            span.end();
        }
    }

    private void handleClose(StreamSocket source, int code, String reason, boolean remote) {
        boolean reconnect;
        synchronized (this) {
            if (source != socket) {
                return;
            }
            logger.warn("PumpPortal WebSocket closed: code={}, reason={}, remote={}", code, reason, remote);
            stopHeartbeat();
            socket = null;
            connecting = false;
            reconnect = shouldReconnect;
        }
        eventPublisher.publishEvent(new StreamDisconnectedEvent(code, reason, remote));
        if (reconnect) {
            scheduleReconnect();
        }
    }

    private void handlePong(StreamSocket source) {
        if (source != socket) {
            return;
        }
        synchronized (this) {
            cancel(pongTimeoutTask);
            pongTimeoutTask = null;
        }
    }

    synchronized void scheduleReconnect() {
        if (!shouldReconnect) {
            return;
        }
        if (reconnectAttempts >= config.getMaxReconnectAttempts()) {
            logger.error("PumpPortal max reconnection attempts reached ({})", reconnectAttempts);
            shouldReconnect = false;
            eventPublisher.publishEvent(new StreamGaveUpEvent(reconnectAttempts));
            return;
        }

        reconnectAttempts++;
        Duration delay = BackoffUtils.delayForAttempt(reconnectAttempts,
                config.getInitialReconnectDelay(), config.getMaxReconnectDelay());
        logger.warn("Reconnecting to PumpPortal in {}ms (attempt {}/{})",
                delay.toMillis(), reconnectAttempts, config.getMaxReconnectAttempts());
        reconnectTask = scheduler.schedule(this::connect, Instant.now().plus(delay));
    }

    private synchronized void startHeartbeat() {
        stopHeartbeat();
        Duration interval = config.getPingInterval();
        pingTask = scheduler.scheduleAtFixedRate(this::ping, Instant.now().plus(interval), interval);
    }

    private synchronized void stopHeartbeat() {
        cancel(pingTask);
        cancel(pongTimeoutTask);
        pingTask = null;
        pongTimeoutTask = null;
    }

    synchronized void ping() {
        StreamSocket current = socket;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.sendPing();
        } catch (RuntimeException e) {
            logger.warn("Ping failed: {}", e.getMessage());
            current.terminate();
            return;
        }
        cancel(pongTimeoutTask);
        pongTimeoutTask = scheduler.schedule(() -> onPongTimeout(current),
                Instant.now().plus(config.getPongTimeout()));
    }

    private void onPongTimeout(StreamSocket target) {
        if (target != socket) {
            return;
        }
        logger.warn("PumpPortal pong timeout after {}ms, terminating socket", config.getPongTimeout().toMillis());
        target.terminate();
    }

    private void send(String payload) {
        StreamSocket current = socket;
        if (current == null || !current.isOpen()) {
            logger.warn("Cannot send, PumpPortal socket not open");
            return;
        }
        try {
            current.send(payload);
        } catch (RuntimeException e) {
            logger.error("Failed to send to PumpPortal: {}", e.getMessage());
        }
    }

    private String methodRequest(String method) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("method", method);
        return write(node);
    }

    private String tradeRequest(String method, Collection<String> mints) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("method", method);
        ArrayNode keys = node.putArray("keys");
        mints.forEach(keys::add);
        return write(node);
    }

    private String write(ObjectNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize stream request", e);
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Routes callbacks for one socket; callbacks from a replaced socket are ignored.
     */
    private final class ConnectionListener implements StreamSocket.Listener {

        private volatile StreamSocket source;

        void bind(StreamSocket source) {
            this.source = source;
        }

        @Override
        public void onOpen() {
            handleOpen(source);
        }

        @Override
        public void onMessage(String message) {
            handleMessage(source, message);
        }

        @Override
        public void onClose(int code, String reason, boolean remote) {
            handleClose(source, code, reason, remote);
        }

        @Override
        public void onError(Exception error) {
            logger.error("PumpPortal WebSocket error: {}", error.getMessage());
        }

        @Override
        public void onPong() {
            handlePong(source);
        }
    }
}
