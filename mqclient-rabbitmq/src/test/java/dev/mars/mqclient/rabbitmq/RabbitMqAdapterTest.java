package dev.mars.mqclient.rabbitmq;

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

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.GetResponse;
import com.rabbitmq.client.ShutdownSignalException;
import dev.mars.mqclient.api.QueueConfiguration;
import dev.mars.mqclient.api.adapter.BrokerSession;
import dev.mars.mqclient.api.error.BrokerConnectException;
import dev.mars.mqclient.api.error.ConnectionLostException;
import dev.mars.mqclient.api.error.PublishException;
import dev.mars.mqclient.api.error.QueueConflictException;
import dev.mars.mqclient.api.messaging.Message;
import dev.mars.mqclient.api.messaging.PublishReceipt;
import dev.mars.mqclient.core.provider.MqQueueConnectionProvider;
import dev.mars.mqclient.test.categories.TestCategories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RabbitMqAdapter} against a mocked AMQP client.
 */
@Tag(TestCategories.CORE)
class RabbitMqAdapterTest {

    private ConnectionFactory connectionFactory;
    private Connection connection;
    private Channel channel;
    private RabbitMqAdapter adapter;
    private QueueConfiguration configuration;

    @BeforeEach
    void setUp() throws Exception {
        connectionFactory = mock(ConnectionFactory.class);
        connection = mock(Connection.class);
        channel = mock(Channel.class);
        when(connectionFactory.newConnection(anyString())).thenReturn(connection);
        when(connection.createChannel()).thenReturn(channel);
        when(connection.isOpen()).thenReturn(true);
        when(channel.isOpen()).thenReturn(true);

        adapter = new RabbitMqAdapter(connectionFactory);
        configuration = QueueConfiguration.builder()
            .brokerClient("rabbitmq")
            .address("localhost:5672")
            .queueName("orders")
            .prefetch(3)
            .receiveTimeout(Duration.ofMillis(200))
            .build();
    }

    private void connectAndDeclare() {
        adapter.connect(configuration);
        adapter.declareQueue("orders", configuration);
    }

    private static GetResponse delivery(long tag, boolean redeliver, AMQP.BasicProperties properties, byte[] body) {
        return new GetResponse(new Envelope(tag, redeliver, "", "orders"), properties, body, 0);
    }

    private static AMQP.BasicProperties withMessageId(String messageId) {
        return new AMQP.BasicProperties.Builder().messageId(messageId).timestamp(new Date(1_000L)).build();
    }

    @Test
    void testConnectConfiguresConfirmsAndGlobalQos() throws Exception {
        BrokerSession session = adapter.connect(configuration);

        assertEquals("rabbitmq", session.brokerClient());
        assertEquals("amqp://localhost:5672", session.endpoint());
        assertEquals(1L, session.sessionNumber());
        verify(connectionFactory).setUri("amqp://localhost:5672");
        verify(connectionFactory).setAutomaticRecoveryEnabled(false);
        verify(channel).confirmSelect();
        verify(channel).basicQos(3, true);
        assertTrue(adapter.isConnected());
    }

    @Test
    void testAuthTokenIsUsedAsPassword() throws Exception {
        adapter.connect(configuration.toBuilder().authToken("s3cret").build());

        verify(connectionFactory).setPassword("s3cret");
    }

    @Test
    void testConnectFailureIsBrokerConnectError() throws Exception {
        when(connectionFactory.newConnection(anyString())).thenThrow(new IOException("connection refused"));

        BrokerConnectException error = assertThrows(BrokerConnectException.class, () -> adapter.connect(configuration));

        assertEquals("rabbitmq", error.getBrokerClient());
        assertFalse(adapter.isConnected());
    }

    @Test
    void testDeclareUsesDurableProperty() throws Exception {
        QueueConfiguration durable = configuration.toBuilder().adapterProperty("rabbitmq.durable", "true").build();
        adapter.connect(durable);

        adapter.declareQueue("orders", durable);

        verify(channel).queueDeclare("orders", true, false, false, null);
    }

    @Test
    void testPreconditionFailedDeclareIsQueueConflict() throws Exception {
        AMQP.Channel.Close close = new AMQP.Channel.Close.Builder()
            .replyCode(AMQP.PRECONDITION_FAILED)
            .replyText("PRECONDITION_FAILED - inequivalent arg 'durable'")
            .build();
        ShutdownSignalException signal = new ShutdownSignalException(false, false, close, channel);
        when(channel.queueDeclare("orders", false, false, false, null)).thenThrow(new IOException(signal));
        adapter.connect(configuration);

        QueueConflictException error = assertThrows(QueueConflictException.class,
            () -> adapter.declareQueue("orders", configuration));

        assertEquals("orders", error.getQueueName());
    }

    @Test
    void testPublishWaitsForConfirmAndReturnsMessageId() throws Exception {
        connectAndDeclare();
        byte[] payload = {0, 1, 2, (byte) 0xff};

        PublishReceipt receipt = adapter.publish(payload);

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(channel).basicPublish(eq(""), eq("orders"), properties.capture(), eq(payload));
        verify(channel).waitForConfirmsOrDie(200L);
        assertEquals(properties.getValue().getMessageId(), receipt.messageId());
        assertEquals(1, properties.getValue().getDeliveryMode());
    }

    @Test
    void testUnconfirmedPublishIsPublishError() throws Exception {
        connectAndDeclare();
        doThrow(new TimeoutException("no confirm")).when(channel).waitForConfirmsOrDie(anyLong());

        assertThrows(PublishException.class, () -> adapter.publish(new byte[]{1}));
    }

    @Test
    void testPublishOnClosedChannelIsConnectionLost() throws Exception {
        connectAndDeclare();
        ShutdownSignalException signal = new ShutdownSignalException(true, false, null, connection);
        doThrow(new AlreadyClosedException(signal))
            .when(channel).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

        assertThrows(ConnectionLostException.class, () -> adapter.publish(new byte[]{1}));
    }

    @Test
    void testReceiveMapsDeliveries() throws Exception {
        connectAndDeclare();
        AMQP.BasicProperties counted = new AMQP.BasicProperties.Builder()
            .messageId("m-2")
            .headers(Map.of("x-delivery-count", 4L, "tenant", "acme"))
            .build();
        when(channel.basicGet("orders", false)).thenReturn(
            delivery(1, false, withMessageId("m-1"), new byte[]{9}),
            delivery(2, true, counted, new byte[0]),
            null);

        List<Message> messages = adapter.receive(5, Duration.ofMillis(100));

        assertEquals(2, messages.size());
        Message first = messages.get(0);
        assertEquals("m-1", first.getDeliveryId());
        assertArrayEquals(new byte[]{9}, first.getPayload());
        assertEquals(0, first.getRedeliveryCount());
        assertEquals(1_000L, first.getEnqueuedAt().toEpochMilli());

        Message second = messages.get(1);
        assertEquals(4, second.getRedeliveryCount());
        assertEquals("acme", second.getAttributes().get("tenant"));
        assertEquals(0, second.getPayloadSize());
    }

    @Test
    void testReceiveStopsAtMaxCount() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(
            delivery(1, false, withMessageId("a"), new byte[]{1}),
            delivery(2, false, withMessageId("b"), new byte[]{2}),
            delivery(3, false, withMessageId("c"), new byte[]{3}));

        List<Message> messages = adapter.receive(2, Duration.ofMillis(100));

        assertEquals(2, messages.size());
        verify(channel, times(2)).basicGet("orders", false);
    }

    @Test
    void testRedeliverFlagCountsAsRedelivery() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(
            delivery(1, false, withMessageId("m-1"), new byte[]{1}), null,
            delivery(2, true, withMessageId("m-1"), new byte[]{1}), null);

        assertEquals(0, adapter.receive(1, Duration.ofMillis(50)).get(0).getRedeliveryCount());
        assertEquals(1, adapter.receive(1, Duration.ofMillis(50)).get(0).getRedeliveryCount());
    }

    @Test
    void testReceiveReturnsEmptyAfterTimeout() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(null);

        long start = System.nanoTime();
        List<Message> messages = adapter.receive(1, Duration.ofMillis(150));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertTrue(messages.isEmpty());
        assertTrue(elapsedMillis >= 140, "returned after " + elapsedMillis + "ms");
        assertTrue(elapsedMillis < 2_000, "returned after " + elapsedMillis + "ms");
    }

    @Test
    void testRepeatedAckIsSentOnce() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(delivery(7, false, withMessageId("m"), new byte[]{1}));
        Message message = adapter.receive(1, Duration.ofMillis(50)).get(0);

        adapter.ack(message);
        adapter.ack(message);

        verify(channel, times(1)).basicAck(7L, false);
    }

    @Test
    void testNackRequeues() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(delivery(8, false, withMessageId("m"), new byte[]{1}));
        Message message = adapter.receive(1, Duration.ofMillis(50)).get(0);

        adapter.nack(message);
        adapter.nack(message);

        verify(channel, times(1)).basicNack(8L, false, true);
    }

    @Test
    void testDelayedNackIsUnsupported() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(delivery(8, false, withMessageId("m"), new byte[]{1}));
        Message message = adapter.receive(1, Duration.ofMillis(50)).get(0);

        assertFalse(adapter.getCapabilities().supportsDelayedRedelivery());
        assertThrows(UnsupportedOperationException.class, () -> adapter.nack(message, Duration.ofSeconds(1)));
    }

    @Test
    void testSettlementFromPreviousSessionIsIgnored() throws Exception {
        connectAndDeclare();
        when(channel.basicGet("orders", false)).thenReturn(delivery(3, false, withMessageId("m"), new byte[]{1}));
        Message stale = adapter.receive(1, Duration.ofMillis(50)).get(0);

        adapter.disconnect();
        connectAndDeclare();
        adapter.ack(stale);

        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void testDisconnectIsIdempotent() throws Exception {
        connectAndDeclare();

        adapter.disconnect();
        adapter.disconnect();

        verify(connection, times(1)).close();
        assertFalse(adapter.isConnected());
        assertThrows(ConnectionLostException.class, () -> adapter.publish(new byte[]{1}));
    }

    @Test
    void testRegistrarRegistersUnderRabbitmq() {
        MqQueueConnectionProvider provider = new MqQueueConnectionProvider();

        RabbitMqAdapterRegistrar.registerWith(provider);

        assertTrue(provider.isTypeSupported("RabbitMQ"));
    }
}
