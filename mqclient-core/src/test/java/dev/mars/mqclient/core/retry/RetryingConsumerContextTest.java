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

import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.adapter.BackendCapabilities;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.MqClientException;
import dev.mars.mqclient.api.error.RetriesExhaustedException;
import dev.mars.mqclient.api.error.StaleAckException;
import dev.mars.mqclient.api.messaging.AckState;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.MessageProcessor;
import dev.mars.mqclient.api.metrics.MetricsProvider;
import dev.mars.mqclient.api.metrics.NoOpMetricsProvider;
import dev.mars.mqclient.core.connection.DefaultQueueConnection;
import dev.mars.mqclient.test.categories.TestCategories;
import dev.mars.mqclient.test.memory.InMemoryBackendAdapter;
import dev.mars.mqclient.test.memory.InMemoryBroker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@Tag(TestCategories.CORE)
class RetryingConsumerContextTest {

    private static final BackendCapabilities NACK_WITHOUT_DELAY = new BackendCapabilities(true, true, false, 10, true);
    private static final BackendCapabilities NO_NACK = new BackendCapabilities(true, false, false, 10, true);

    private final InMemoryBroker broker = new InMemoryBroker();
    private final List<MqClientException> errors = new CopyOnWriteArrayList<>();
    private final List<Duration> sleeps = new CopyOnWriteArrayList<>();
    private final AtomicInteger invocations = new AtomicInteger();
    private DefaultQueueConnection connection;

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
    }

    private QueueConfiguration.Builder configuration() {
        return QueueConfiguration.builder()
            .brokerClient(InMemoryBackendAdapter.BROKER_CLIENT)
            .address("memory://local")
            .queueName("jobs")
            .maxRetries(2)
            .backoffInitial(Duration.ofMillis(10))
            .backoffMultiplier(2.0)
            .backoffCap(Duration.ofMillis(50))
            .receiveTimeout(Duration.ofMillis(300));
    }

    private DefaultQueueConnection open(BackendCapabilities capabilities, QueueConfiguration configuration) {
        connection = new DefaultQueueConnection(new InMemoryBackendAdapter(broker, capabilities), configuration,
            errors::add, NoOpMetricsProvider.INSTANCE, sleeps::add);
        connection.open();
        return connection;
    }

    private RetryingConsumerContext.Builder context(MetricsProvider metrics) {
        return RetryingConsumerContext.builder(connection)
            .errorSink(errors::add)
            .metrics(metrics)
            .sleeper(sleeps::add);
    }

    private void runUntil(RetryingConsumerContext context, java.util.function.BooleanSupplier done) {
        for (int i = 0; i < 50 && !done.getAsBoolean(); i++) {
            context.runOnce();
        }
        assertTrue(done.getAsBoolean(), "condition not reached within 50 polls");
    }

    @Test
    void testAlwaysFailingProcessorRunsMaxRetriesPlusOneTimes() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().maxRetries(2).build());
        connection.createPublisher().send(new byte[]{1, 2, 3});
        MetricsProvider metrics = mock(MetricsProvider.class);
        RetryingConsumerContext context = context(metrics)
            .processor(message -> {
                invocations.incrementAndGet();
                throw new IllegalStateException("always fails");
            })
            .build();

        runUntil(context, () -> !errors.isEmpty());

        assertEquals(3, invocations.get());
        assertEquals(1, errors.size());
        RetriesExhaustedException exhausted = assertInstanceOf(RetriesExhaustedException.class, errors.get(0));
        assertEquals(3, exhausted.getAttempts());
        assertInstanceOf(IllegalStateException.class, exhausted.getCause());
        assertEquals(1, broker.getAckCount(), "exhausted message is acked so it is not redelivered");
        assertEquals(2, broker.getNackCount());
        assertEquals(0, broker.readyCount("jobs"));
        assertEquals(0, broker.inFlightCount("jobs"));
        assertTrue(sleeps.isEmpty(), "delayed redelivery needs no local sleep");
        assertNull(context.getRetryState(exhausted.getDeliveryId()));
        verify(metrics, times(3)).recordMessageFailed("jobs", "IllegalStateException");
        verify(metrics).recordMessageRetried("jobs", 1);
        verify(metrics).recordMessageRetried("jobs", 2);
        verify(metrics).recordMessageDropped("jobs", RetryingConsumerContext.RETRIES_EXHAUSTED);
    }

    @Test
    void testZeroRetriesProcessesOnce() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().maxRetries(0).build());
        connection.createPublisher().send(new byte[]{1});
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                invocations.incrementAndGet();
                throw new Exception("checked failure");
            })
            .build();

        runUntil(context, () -> !errors.isEmpty());

        assertEquals(1, invocations.get());
        assertEquals(1, ((RetriesExhaustedException) errors.get(0)).getAttempts());
    }

    @Test
    void testSuccessfulProcessingAcks() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().build());
        connection.createPublisher().send("hello".getBytes());
        MetricsProvider metrics = mock(MetricsProvider.class);
        RetryingConsumerContext context = context(metrics)
            .processor(message -> invocations.incrementAndGet())
            .build();

        assertEquals(1, context.runOnce());

        assertEquals(1, invocations.get());
        assertEquals(1, broker.getAckCount());
        assertTrue(errors.isEmpty());
        verify(metrics).recordMessageProcessed(eq("jobs"), any(Duration.class));
    }

    @Test
    void testFailureThenSuccessClearsRetryState() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().build());
        connection.createPublisher().send(new byte[]{9});
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                if (invocations.incrementAndGet() == 1) {
                    throw new IllegalArgumentException("first attempt fails");
                }
            })
            .build();

        runUntil(context, () -> broker.getAckCount() == 1);

        assertEquals(2, invocations.get());
        assertTrue(errors.isEmpty());
    }

    @Test
    void testExplicitNackBackendSleepsThenNacks() {
        open(NACK_WITHOUT_DELAY, configuration().maxRetries(1).build());
        connection.createPublisher().send(new byte[]{1});
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                invocations.incrementAndGet();
                throw new IllegalStateException("fails");
            })
            .build();

        runUntil(context, () -> !errors.isEmpty());

        assertEquals(2, invocations.get());
        assertEquals(List.of(Duration.ofMillis(10)), sleeps);
        assertEquals(1, broker.getNackCount());
    }

    @Test
    void testSuccessiveBackoffDelaysGrowUpToCap() {
        open(NACK_WITHOUT_DELAY, configuration().maxRetries(4).build());
        connection.createPublisher().send(new byte[]{1});
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                invocations.incrementAndGet();
                throw new IllegalStateException("fails");
            })
            .build();

        runUntil(context, () -> !errors.isEmpty());

        assertEquals(5, invocations.get());
        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40),
            Duration.ofMillis(50)), sleeps);
    }

    @Test
    void testBackoffContinuesFromBrokerRedeliveryCountInNewContext() {
        open(NACK_WITHOUT_DELAY, configuration().maxRetries(3).build());
        connection.createPublisher().send(new byte[]{1});
        MessageProcessor failing = message -> {
            invocations.incrementAndGet();
            throw new IllegalStateException("fails");
        };
        RetryingConsumerContext first = context(NoOpMetricsProvider.INSTANCE).processor(failing).build();
        runUntil(first, () -> invocations.get() == 2);

        RetryingConsumerContext second = context(NoOpMetricsProvider.INSTANCE).processor(failing).build();
        runUntil(second, () -> invocations.get() == 3);

        assertEquals(List.of(Duration.ofMillis(10), Duration.ofMillis(20), Duration.ofMillis(40)), sleeps);
        for (int i = 1; i < sleeps.size(); i++) {
            assertTrue(sleeps.get(i).compareTo(sleeps.get(i - 1)) >= 0, "backoff delays must not decrease");
        }
    }

    @Test
    void testBackendWithoutNackLeavesMessageForDeadline() {
        open(NO_NACK, configuration().maxRetries(1).ackDeadline(Duration.ofMillis(300))
            .receiveTimeout(Duration.ofSeconds(1)).build());
        connection.createPublisher().send(new byte[]{1});
        List<Integer> redeliveryCounts = new CopyOnWriteArrayList<>();
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                redeliveryCounts.add(message.getRedeliveryCount());
                if (invocations.incrementAndGet() == 1) {
                    throw new IllegalStateException("first attempt fails");
                }
            })
            .build();

        runUntil(context, () -> broker.getAckCount() == 1);

        assertEquals(List.of(0, 1), redeliveryCounts);
        assertEquals(0, broker.getNackCount());
        assertEquals(List.of(Duration.ofMillis(10)), sleeps);
    }

    @Test
    void testStaleAckAfterDeadlineIsReportedNotRaised() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().ackDeadline(Duration.ofMillis(100)).build());
        connection.createPublisher().send(new byte[]{1});
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                invocations.incrementAndGet();
                await().atMost(5, TimeUnit.SECONDS).until(() -> broker.getNackCount() == 1);
            })
            .build();

        assertEquals(1, context.runOnce());

        assertEquals(1, errors.size());
        StaleAckException stale = assertInstanceOf(StaleAckException.class, errors.get(0));
        assertEquals(AckState.ACKED, stale.getAttemptedState());
        assertEquals(0, broker.getAckCount());
    }

    @Test
    void testRetryStateFloorIsBrokerRedeliveryCount() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().maxRetries(1).build());
        connection.createPublisher().send(new byte[]{1});
        List<Message> firstDelivery = new CopyOnWriteArrayList<>();
        connection.createConsumer().poll(1).forEach(handle -> {
            firstDelivery.add(handle.getMessage());
            handle.nack();
        });
        assertEquals(1, firstDelivery.size());

        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> {
                invocations.incrementAndGet();
                throw new IllegalStateException("fails");
            })
            .build();

        runUntil(context, () -> !errors.isEmpty());

        assertEquals(1, invocations.get(), "one redelivery already used the only retry");
        assertEquals(2, ((RetriesExhaustedException) errors.get(0)).getAttempts());
    }

    @Test
    void testRunEndsWhenConnectionCloses() throws Exception {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().build());
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> invocations.incrementAndGet())
            .build();
        CompletableFuture<Void> loop = CompletableFuture.runAsync(context::run);

        connection.createPublisher().send(new byte[]{1});
        await().atMost(5, TimeUnit.SECONDS).until(() -> invocations.get() == 1);
        connection.close();

        loop.get(5, TimeUnit.SECONDS);
        assertTrue(errors.isEmpty());
    }

    @Test
    void testStopEndsRun() throws Exception {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().build());
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> invocations.incrementAndGet())
            .build();
        CompletableFuture<Void> loop = CompletableFuture.runAsync(context::run);

        context.stop();

        loop.get(5, TimeUnit.SECONDS);
        assertTrue(context.isStopped());
    }

    @Test
    void testRunFailsWhenBrokerStaysUnreachable() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().connectMaxAttempts(2).build());
        RetryingConsumerContext context = context(NoOpMetricsProvider.INSTANCE)
            .processor(message -> invocations.incrementAndGet())
            .build();

        broker.severConnections();
        broker.failNextConnects(10);

        assertThrows(BrokerConnectException.class, context::run);
        assertEquals(0, invocations.get());
    }

    @Test
    void testBuilderRequiresProcessor() {
        open(InMemoryBackendAdapter.FULL_CAPABILITIES, configuration().build());

        assertThrows(NullPointerException.class, () -> RetryingConsumerContext.builder(connection).build());
        assertThrows(IllegalArgumentException.class, () -> RetryingConsumerContext.builder(connection)
            .processor(message -> { })
            .retryStateCapacity(0)
            .build());
    }
}
