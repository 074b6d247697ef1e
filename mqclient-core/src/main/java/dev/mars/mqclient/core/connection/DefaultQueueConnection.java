package dev.mars.mqclient.core.connection;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.mqclient.api.ConnectionState;
import dev.mars.mqclient.api.ErrorSink;
import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.QueueConnection;
import dev.mars.mqclient.api.adapter.BackendAdapter;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.adapter.BrokerSession;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionClosedException;
import dev.mars.mqclient.api.error.ConnectionLostException;
import dev.mars.mqclient.api.error.MqClientException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.health.HealthStatusInfo;
import dev.mars.mqclient.api.messaging.AckState;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.MessageConsumer;
import dev.mars.mqclient.api.messaging.MessagePublisher;
import dev.mars.mqclient.api.metrics.MetricsProvider;
import dev.mars.mqclient.api.metrics.NoOpMetricsProvider;
import dev.mars.mqclient.core.retry.BackoffPolicy;
import dev.mars.mqclient.core.retry.Sleeper;
import dev.mars.mqclient.core.serialization.EnvelopeCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Queue connection that drives a {@link BackendAdapter} through
 * {@code NOT_CONNECTED -> CONNECTING -> OPEN -> CLOSED}.
 *
 * <p>Two locks are involved. The lifecycle lock serializes connect and disconnect so
 * the adapter never sees them concurrently. The I/O lock is taken around adapter calls
 * only when the adapter declares them unsafe to overlap. {@link #close()} takes
 * neither before disconnecting the adapter, so a thread blocked in a receive is
 * released promptly.</p>
 *
 * <p>When an adapter reports a lost transport the connection reports it to the error
 * sink, reconnects within the configured attempt budget and, for publish and receive,
 * retries the operation once. Acks and nacks are not retried: their receipts belong
 * to the dead session and the broker will redeliver.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-03
 * @version 1.0
 */
public class DefaultQueueConnection implements QueueConnection {

    private static final Logger logger = LoggerFactory.getLogger(DefaultQueueConnection.class);

    private final BackendAdapter adapter;
    private final QueueConfiguration configuration;
    private final BackendCapabilities capabilities;
    private final ErrorSink errorSink;
    private final MetricsProvider metrics;
    private final Sleeper sleeper;
    private final BackoffPolicy connectBackoff;
    private final EnvelopeCodec envelopeCodec = new EnvelopeCodec();

    private final Object lifecycleLock = new Object();
    private final ReentrantLock ioLock = new ReentrantLock();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.NOT_CONNECTED);
    private final Set<DefaultMessageHandle> outstanding = ConcurrentHashMap.newKeySet();
    private final ScheduledThreadPoolExecutor deadlineScheduler;
    private final ExecutorService releaseExecutor;

    private volatile BrokerSession session;

    public DefaultQueueConnection(BackendAdapter adapter, QueueConfiguration configuration) {
        this(adapter, configuration, ErrorSink.logging(), NoOpMetricsProvider.INSTANCE, Sleeper.SYSTEM);
    }

    public DefaultQueueConnection(BackendAdapter adapter, QueueConfiguration configuration, ErrorSink errorSink,
                                  MetricsProvider metrics, Sleeper sleeper) {
        this.adapter = Objects.requireNonNull(adapter, "adapter cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.errorSink = Objects.requireNonNull(errorSink, "errorSink cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper cannot be null");
        this.capabilities = adapter.getCapabilities();
        this.connectBackoff = BackoffPolicy.from(configuration);
        this.deadlineScheduler = new ScheduledThreadPoolExecutor(1,
            daemonThreadFactory("mqclient-ack-deadline-" + configuration.getQueueName()));
        this.deadlineScheduler.setRemoveOnCancelPolicy(true);
        this.releaseExecutor = Executors.newSingleThreadExecutor(
            daemonThreadFactory("mqclient-release-" + configuration.getQueueName()));
        logger.debug("Created connection for queue '{}' on broker client '{}' with capabilities {}",
            configuration.getQueueName(), adapter.getBrokerClient(), capabilities);
    }

    @Override
    public void open() {
        synchronized (lifecycleLock) {
            ConnectionState current = state.get();
            if (current == ConnectionState.CLOSED) {
                throw new ConnectionClosedException("Cannot open a closed connection to queue '"
                    + configuration.getQueueName() + "'");
            }
            if (current == ConnectionState.OPEN) {
                return;
            }
            if (!state.compareAndSet(current, ConnectionState.CONNECTING)) {
                throw new ConnectionClosedException("Connection to queue '" + configuration.getQueueName()
                    + "' was closed while opening");
            }
            try {
                session = connectWithRetry();
                if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                    adapter.disconnect();
                    throw new ConnectionClosedException("Connection was closed while opening");
                }
                logger.info("Opened {} connection to {} for queue '{}' (session {})",
                    adapter.getBrokerClient(), session.endpoint(), configuration.getQueueName(),
                    session.sessionNumber());
            } catch (RuntimeException e) {
                state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.NOT_CONNECTED);
                throw e;
            }
        }
    }

    @Override
    public MessagePublisher createPublisher() {
        checkNotClosed();
        return new DefaultMessagePublisher(this);
    }

    @Override
    public MessageConsumer createConsumer() {
        checkNotClosed();
        return new DefaultMessageConsumer(this);
    }

    @Override
    public ConnectionState getState() {
        return state.get();
    }

    @Override
    public BackendCapabilities getCapabilities() {
        return capabilities;
    }

    @Override
    public QueueConfiguration getConfiguration() {
        return configuration;
    }

    @Override
    public HealthStatusInfo checkHealth() {
        String component = "queue-connection:" + configuration.getQueueName();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("brokerClient", adapter.getBrokerClient());
        details.put("queue", configuration.getQueueName());
        details.put("state", state.get().name());
        details.put("outstandingHandles", outstanding.size());
        BrokerSession current = session;
        if (current != null) {
            details.put("session", current.sessionNumber());
            details.put("connectedAt", current.connectedAt().toString());
        }

        switch (state.get()) {
            case OPEN:
                if (adapter.isConnected()) {
                    return HealthStatusInfo.healthy(component, details);
                }
                return HealthStatusInfo.degraded(component, "Broker connection lost, reconnect pending", details);
            case CONNECTING:
                return HealthStatusInfo.degraded(component, "Connecting", details);
            case CLOSED:
                return HealthStatusInfo.unhealthy(component, "Connection closed", details);
            default:
                return HealthStatusInfo.unhealthy(component, "Not connected", details);
        }
    }

    @Override
    public void close() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            logger.debug("Connection to queue '{}' already closed", configuration.getQueueName());
            return;
        }
        logger.info("Closing {} connection for queue '{}' ({} unsettled message(s) left for redelivery)",
            adapter.getBrokerClient(), configuration.getQueueName(), outstanding.size());

        for (DefaultMessageHandle handle : outstanding) {
            handle.cancelDeadline();
        }
        outstanding.clear();
        deadlineScheduler.shutdownNow();
        releaseExecutor.shutdownNow();

        // Unblocks any receive in progress before waiting for a reconnect to notice the close.
        disconnectQuietly();
        synchronized (lifecycleLock) {
            disconnectQuietly();
        }
        logger.debug("Connection to queue '{}' closed", configuration.getQueueName());
    }

    // ========================================================================
    // Used by publisher, consumer and handles
    // ========================================================================

    /**
     * Runs an adapter call, reconnecting once if the transport was lost.
     *
     * @param retryAfterReconnect whether to repeat the call on the new session
     * @return the call's result, or null if the transport was lost and the call was not repeated
     */
    <T> T execute(String operation, boolean retryAfterReconnect, AdapterCall<T> call) {
        checkUsable();
        BrokerSession sessionBefore = session;
        try {
            return invoke(call);
        } catch (ConnectionLostException e) {
            if (isClosed()) {
                throw new ConnectionClosedException("Connection closed during " + operation, e);
            }
            logger.warn("{} connection lost during {} on queue '{}': {}",
                adapter.getBrokerClient(), operation, configuration.getQueueName(), e.getMessage());
            errorSink.accept(e);
            reconnect(sessionBefore, e);
            if (!retryAfterReconnect) {
                return null;
            }
        } catch (RuntimeException e) {
            if (isClosed()) {
                throw new ConnectionClosedException("Connection closed during " + operation, e);
            }
            throw e;
        }

        try {
            return invoke(call);
        } catch (ConnectionLostException e) {
            if (isClosed()) {
                throw new ConnectionClosedException("Connection closed during " + operation, e);
            }
            throw new BrokerConnectException(adapter.getBrokerClient(), configuration.getAddress(),
                "connection lost again right after reconnecting", e);
        } catch (RuntimeException e) {
            if (isClosed()) {
                throw new ConnectionClosedException("Connection closed during " + operation, e);
            }
            throw e;
        }
    }

    DefaultMessageHandle track(Message message) {
        DefaultMessageHandle handle = new DefaultMessageHandle(message, this, configuration.getAckDeadline());
        outstanding.add(handle);
        try {
            ScheduledFuture<?> timer = deadlineScheduler.schedule(handle::expire,
                configuration.getAckDeadline().toNanos(), TimeUnit.NANOSECONDS);
            handle.attachDeadline(timer);
        } catch (RejectedExecutionException e) {
            outstanding.remove(handle);
            throw new ConnectionClosedException("Connection closed while receiving", e);
        }
        return handle;
    }

    /**
     * Sends the outcome a handle just committed to the broker.
     */
    void settle(DefaultMessageHandle handle, AckState outcome, Duration delay) {
        outstanding.remove(handle);
        Message message = handle.getMessage();
        String operation = outcome == AckState.ACKED ? "ack" : "nack";
        execute(operation, false, adapter -> {
            if (outcome == AckState.ACKED) {
                adapter.ack(message);
            } else if (!capabilities.supportsExplicitNack()) {
                logger.debug("{} has no explicit nack, message {} will be redelivered after its visibility timeout",
                    adapter.getBrokerClient(), message.getDeliveryId());
            } else if (delay != null && !delay.isZero() && !delay.isNegative()
                    && capabilities.supportsDelayedRedelivery()) {
                adapter.nack(message, delay);
            } else {
                adapter.nack(message);
            }
            return null;
        });
        logger.debug("Message {} {} on queue '{}'", message.getDeliveryId(), outcome, configuration.getQueueName());
    }

    /**
     * Called on the deadline thread after a handle moved to TIMED_OUT. The release nack
     * runs on its own thread so the deadline thread never waits on adapter I/O.
     */
    void onDeadlineExpired(DefaultMessageHandle handle) {
        outstanding.remove(handle);
        Message message = handle.getMessage();
        metrics.recordAckDeadlineExpired(configuration.getQueueName());
        logger.warn("Ack deadline of {} expired for message {} on queue '{}'",
            configuration.getAckDeadline(), message.getDeliveryId(), configuration.getQueueName());
        if (!capabilities.supportsExplicitNack() || state.get() != ConnectionState.OPEN) {
            return;
        }
        try {
            releaseExecutor.execute(() -> release(message));
        } catch (RejectedExecutionException e) {
            logger.debug("Connection closing, message {} left for broker redelivery", message.getDeliveryId());
        }
    }

    private void release(Message message) {
        if (state.get() != ConnectionState.OPEN) {
            return;
        }
        try {
            execute("release", false, adapter -> {
                adapter.nack(message);
                return null;
            });
        } catch (MqClientException e) {
            logger.warn("Could not release expired message {}: {}", message.getDeliveryId(), e.getMessage());
        }
    }

    /**
     * Fails fast for handles whose connection is gone.
     */
    void checkOpenForSettlement(String deliveryId) {
        if (isClosed()) {
            throw new ConnectionClosedException("Connection to queue '" + configuration.getQueueName()
                + "' is closed, message " + deliveryId + " will be redelivered by the broker");
        }
    }

    boolean isClosed() {
        return state.get() == ConnectionState.CLOSED;
    }

    void checkNotClosed() {
        if (isClosed()) {
            throw new ConnectionClosedException("Connection to queue '" + configuration.getQueueName() + "' is closed");
        }
    }

    BackendAdapter getAdapter() {
        return adapter;
    }

    MetricsProvider getMetrics() {
        return metrics;
    }

    EnvelopeCodec getEnvelopeCodec() {
        return envelopeCodec;
    }

    int getOutstandingCount() {
        return outstanding.size();
    }

    // ========================================================================
    // Internals
    // ========================================================================

    private void checkUsable() {
        ConnectionState current = state.get();
        if (current == ConnectionState.CLOSED) {
            throw new ConnectionClosedException("Connection to queue '" + configuration.getQueueName() + "' is closed");
        }
        if (current == ConnectionState.NOT_CONNECTED) {
            throw new IllegalStateException("Connection to queue '" + configuration.getQueueName()
                + "' is not open, call open() first");
        }
    }

    private <T> T invoke(AdapterCall<T> call) {
        if (capabilities.concurrentOperationsSafe()) {
            return call.apply(adapter);
        }
        ioLock.lock();
        try {
            return call.apply(adapter);
        } finally {
            ioLock.unlock();
        }
    }

    private void reconnect(BrokerSession failedSession, ConnectionLostException cause) {
        synchronized (lifecycleLock) {
            checkNotClosed();
            if (session != failedSession && state.get() == ConnectionState.OPEN) {
                logger.debug("Connection for queue '{}' already re-established by another thread",
                    configuration.getQueueName());
                return;
            }
            ConnectionState current = state.get();
            if (current == ConnectionState.CLOSED || !state.compareAndSet(current, ConnectionState.CONNECTING)) {
                throw new ConnectionClosedException("Connection closed before reconnecting", cause);
            }
            disconnectQuietly();
            try {
                session = connectWithRetry();
            } catch (RuntimeException e) {
                metrics.recordReconnect(adapter.getBrokerClient(), false);
                state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.NOT_CONNECTED);
                logger.error("Reconnect to {} for queue '{}' failed: {}", configuration.getAddress(),
                    configuration.getQueueName(), e.getMessage());
                if (e instanceof MqClientException && !(e instanceof ConnectionLostException)) {
                    throw e;
                }
                throw new BrokerConnectException(adapter.getBrokerClient(), configuration.getAddress(),
                    "reconnect failed", e);
            }
            if (!state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN)) {
                disconnectQuietly();
                throw new ConnectionClosedException("Connection closed while reconnecting", cause);
            }
            metrics.recordReconnect(adapter.getBrokerClient(), true);
            logger.info("Reconnected {} for queue '{}' (session {})", adapter.getBrokerClient(),
                configuration.getQueueName(), session.sessionNumber());
        }
    }

    private BrokerSession connectWithRetry() {
        int maxAttempts = configuration.getConnectMaxAttempts();
        Duration delay = null;
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            checkNotClosed();
            try {
                BrokerSession opened = adapter.connect(configuration);
                adapter.declareQueue(configuration.getQueueName(), configuration);
                return opened;
            } catch (QueueConflictException e) {
                disconnectQuietly();
                throw e;
            } catch (BrokerConnectException | ConnectionLostException e) {
                lastFailure = e;
                disconnectQuietly();
                if (attempt < maxAttempts) {
                    delay = connectBackoff.next(delay);
                    logger.warn("Connect attempt {}/{} to {} failed: {}. Retrying in {} ms",
                        attempt, maxAttempts, configuration.getAddress(), e.getMessage(), delay.toMillis());
                    pause(delay, e);
                }
            } catch (RuntimeException e) {
                disconnectQuietly();
                throw e;
            }
        }
        throw new BrokerConnectException(adapter.getBrokerClient(), configuration.getAddress(), maxAttempts,
            lastFailure != null ? lastFailure.getMessage() : "no attempt made", lastFailure);
    }

    private void pause(Duration delay, RuntimeException cause) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectException(adapter.getBrokerClient(), configuration.getAddress(),
                "interrupted while waiting to reconnect", cause);
        }
    }

    private void disconnectQuietly() {
        try {
            adapter.disconnect();
        } catch (RuntimeException e) {
            logger.warn("Error while disconnecting {} adapter: {}", adapter.getBrokerClient(), e.getMessage());
        }
    }

    private static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
