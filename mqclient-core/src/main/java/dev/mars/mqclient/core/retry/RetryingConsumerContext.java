package dev.mars.mqclient.core.retry;

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

import dev.mars.mqclient.api.ErrorSink;
import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.QueueConnection;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionClosedException;
import dev.mars.mqclient.api.error.MqClientException;
import dev.mars.mqclient.api.error.RetriesExhaustedException;
import dev.mars.mqclient.api.error.StaleAckException;
import dev.mars.mqclient.api.messaging.AckState;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.MessageConsumer;
import dev.mars.mqclient.api.messaging.MessageHandle;
import dev.mars.mqclient.api.messaging.MessageProcessor;
import dev.mars.mqclient.api.metrics.MetricsProvider;
import dev.mars.mqclient.api.metrics.NoOpMetricsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Consumer loop that runs a {@link MessageProcessor} on every message and decides its
 * outcome: ack on success, a backed-off redelivery on failure, and ack plus a
 * {@link RetriesExhaustedException} on the error sink once the retries are used up.
 *
 * <p>With {@code maxRetries = N} a message that always fails is processed N+1 times.
 * How the retry is delayed depends on the backend:</p>
 * <ul>
 *   <li>delayed redelivery: {@code nack(delay)}, nothing sleeps locally</li>
 *   <li>explicit nack only: sleep for the delay, then {@code nack()}</li>
 *   <li>no nack: sleep for the delay and leave the message to its ack deadline</li>
 * </ul>
 *
 * <p>Retry state is kept per delivery id and never falls below the redelivery count the
 * broker reports, so a message redelivered to a fresh consumer still runs out of
 * retries. Duplicates are not filtered.</p>
 *
 * <p>{@link #run()} ends when the connection is closed or {@link #stop()} is called, and
 * fails with {@link BrokerConnectException} when the broker is unreachable. Every other
 * error goes to the error sink and the loop carries on.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-10-04
 * @version 1.0
 */
public class RetryingConsumerContext implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetryingConsumerContext.class);

    static final int DEFAULT_RETRY_STATE_CAPACITY = 10_000;
    static final String RETRIES_EXHAUSTED = "retries_exhausted";

    private final MessageConsumer consumer;
    private final String queueName;
    private final BackendCapabilities capabilities;
    private final int maxRetries;
    private final BackoffPolicy backoff;
    private final MessageProcessor processor;
    private final ErrorSink errorSink;
    private final MetricsProvider metrics;
    private final Sleeper sleeper;
    private final Map<String, RetryState> retryStates;

    private volatile boolean stopped;

    private RetryingConsumerContext(Builder builder) {
        QueueConfiguration configuration = builder.connection.getConfiguration();
        this.queueName = configuration.getQueueName();
        this.capabilities = builder.connection.getCapabilities();
        this.maxRetries = configuration.getMaxRetries();
        this.backoff = BackoffPolicy.from(configuration);
        this.processor = builder.processor;
        this.errorSink = builder.errorSink;
        this.metrics = builder.metrics;
        this.sleeper = builder.sleeper;
        this.retryStates = boundedMap(builder.retryStateCapacity);
        this.consumer = builder.connection.createConsumer();
        logger.info("Retrying consumer for queue '{}' ready: prefetch {}, maxRetries {}, {}, ack deadline {}",
            queueName, consumer.getEffectivePrefetch(), maxRetries, backoff, configuration.getAckDeadline());
    }

    public static Builder builder(QueueConnection connection) {
        return new Builder(connection);
    }

    /**
     * Polls once and processes every message received.
     *
     * @return the number of messages processed
     */
    public int runOnce() {
        List<MessageHandle> handles = consumer.poll();
        for (MessageHandle handle : handles) {
            try {
                processOne(handle);
            } catch (ConnectionClosedException | BrokerConnectException e) {
                throw e;
            } catch (MqClientException e) {
                report(e);
            }
        }
        return handles.size();
    }

    /**
     * Processes messages until {@link #stop()} is called or the connection is closed.
     *
     * @throws BrokerConnectException if the connection could not be re-established
     */
    public void run() {
        logger.info("Consumer loop started on queue '{}'", queueName);
        while (!stopped && !Thread.currentThread().isInterrupted()) {
            try {
                runOnce();
            } catch (ConnectionClosedException e) {
                logger.info("Connection closed, consumer loop on queue '{}' ends", queueName);
                return;
            } catch (BrokerConnectException e) {
                logger.error("Consumer loop on queue '{}' failed: {}", queueName, e.getMessage());
                throw e;
            } catch (MqClientException e) {
                report(e);
                pauseAfterError();
            } catch (IllegalStateException e) {
                logger.error("Consumer loop on queue '{}' cannot continue: {}", queueName, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                report(new MqClientException("Unexpected error in consumer loop on queue '" + queueName
                    + "': " + e.getMessage(), e));
                pauseAfterError();
            }
        }
        logger.info("Consumer loop on queue '{}' stopped", queueName);
    }

    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    @Override
    public void close() {
        stop();
        consumer.close();
    }

    RetryState getRetryState(String deliveryId) {
        return retryStates.get(deliveryId);
    }

    // ========================================================================
    // Per-message flow
    // ========================================================================

    private void processOne(MessageHandle handle) {
        Message message = handle.getMessage();
        RetryState state = retryStates.computeIfAbsent(message.getDeliveryId(), RetryState::new);
        state.observeRedeliveryCount(message.getRedeliveryCount(), backoff);
        int attempt = state.beginAttempt();
        logger.debug("Processing message {} on queue '{}' (attempt {}, redelivery count {})",
            message.getDeliveryId(), queueName, attempt, message.getRedeliveryCount());

        try (ProcessingScope scope = new ProcessingScope(handle, state)) {
            try {
                processor.process(message);
                scope.succeeded();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scope.failed(e);
            } catch (Exception e) {
                scope.failed(e);
            }
        }
    }

    private void onSuccess(MessageHandle handle, long startedNanos) {
        String deliveryId = handle.getDeliveryId();
        if (handle.ack()) {
            retryStates.remove(deliveryId);
            metrics.recordMessageProcessed(queueName, Duration.ofNanos(System.nanoTime() - startedNanos));
        } else if (handle.getState() == AckState.TIMED_OUT) {
            report(new StaleAckException(deliveryId, AckState.ACKED));
        }
    }

    private void onFailure(MessageHandle handle, RetryState state, Throwable failure) {
        String deliveryId = handle.getDeliveryId();
        metrics.recordMessageFailed(queueName, failure.getClass().getSimpleName());

        if (handle.getState() == AckState.TIMED_OUT) {
            report(new StaleAckException(deliveryId, AckState.NACKED));
            return;
        }

        if (state.getRetriesUsed() >= maxRetries) {
            int attempts = Math.max(state.getAttempts(), state.getRetriesUsed() + 1);
            logger.warn("Message {} on queue '{}' failed {} time(s), dropping it: {}",
                deliveryId, queueName, attempts, failure.getMessage());
            handle.ack();
            retryStates.remove(deliveryId);
            metrics.recordMessageDropped(queueName, RETRIES_EXHAUSTED);
            report(new RetriesExhaustedException(deliveryId, attempts, failure));
            return;
        }

        Duration delay = state.scheduleRetry(backoff);
        metrics.recordMessageRetried(queueName, state.getRetriesUsed());
        logger.warn("Message {} on queue '{}' failed, retry {}/{} in {} ms: {}",
            deliveryId, queueName, state.getRetriesUsed(), maxRetries, delay.toMillis(), failure.getMessage());

        if (capabilities.supportsDelayedRedelivery()) {
            settleRetry(handle, handle.nack(delay));
            return;
        }

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            logger.info("Interrupted while backing off message {}, stopping consumer loop", deliveryId);
            if (capabilities.supportsExplicitNack()) {
                settleRetry(handle, handle.nack());
            }
            return;
        }

        if (capabilities.supportsExplicitNack()) {
            settleRetry(handle, handle.nack());
        } else {
            logger.debug("Leaving message {} for redelivery after its ack deadline", deliveryId);
        }
    }

    private void settleRetry(MessageHandle handle, boolean settled) {
        if (!settled && handle.getState() == AckState.TIMED_OUT) {
            report(new StaleAckException(handle.getDeliveryId(), AckState.NACKED));
        }
    }

    private void report(MqClientException error) {
        try {
            errorSink.accept(error);
        } catch (RuntimeException e) {
            logger.error("Error sink failed while handling '{}': {}", error.getMessage(), e.getMessage(), e);
        }
    }

    private void pauseAfterError() {
        try {
            sleeper.sleep(backoff.getInitial());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
        }
    }

    private static Map<String, RetryState> boundedMap(int capacity) {
        return Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RetryState> eldest) {
                return size() > capacity;
            }
        });
    }

    /**
     * Settles the handle exactly once when processing leaves the try block, whichever
     * way it leaves. A processor that neither returned nor threw a checked or runtime
     * exception counts as failed.
     */
    private final class ProcessingScope implements AutoCloseable {

        private final MessageHandle handle;
        private final RetryState state;
        private final long startedNanos = System.nanoTime();
        private boolean success;
        private Throwable failure;
        private boolean settled;

        ProcessingScope(MessageHandle handle, RetryState state) {
            this.handle = handle;
            this.state = state;
        }

        void succeeded() {
            this.success = true;
        }

        void failed(Throwable failure) {
            this.failure = failure;
        }

        @Override
        public void close() {
            if (settled) {
                return;
            }
            settled = true;
            if (success) {
                onSuccess(handle, startedNanos);
            } else {
                onFailure(handle, state, failure != null ? failure
                    : new IllegalStateException("Processing of message " + handle.getDeliveryId() + " did not complete"));
            }
        }
    }

    public static class Builder {
        private final QueueConnection connection;
        private MessageProcessor processor;
        private ErrorSink errorSink = ErrorSink.logging();
        private MetricsProvider metrics = NoOpMetricsProvider.INSTANCE;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private int retryStateCapacity = DEFAULT_RETRY_STATE_CAPACITY;

        private Builder(QueueConnection connection) {
            this.connection = Objects.requireNonNull(connection, "connection cannot be null");
        }

        public Builder processor(MessageProcessor processor) {
            this.processor = processor;
            return this;
        }

        public Builder errorSink(ErrorSink errorSink) {
            this.errorSink = errorSink;
            return this;
        }

        public Builder metrics(MetricsProvider metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder retryStateCapacity(int retryStateCapacity) {
            this.retryStateCapacity = retryStateCapacity;
            return this;
        }

        public RetryingConsumerContext build() {
            Objects.requireNonNull(processor, "processor cannot be null");
            Objects.requireNonNull(errorSink, "errorSink cannot be null");
            Objects.requireNonNull(metrics, "metrics cannot be null");
            Objects.requireNonNull(sleeper, "sleeper cannot be null");
            if (retryStateCapacity < 1) {
                throw new IllegalArgumentException("retryStateCapacity must be at least 1, got " + retryStateCapacity);
            }
            return new RetryingConsumerContext(this);
        }
    }
}
