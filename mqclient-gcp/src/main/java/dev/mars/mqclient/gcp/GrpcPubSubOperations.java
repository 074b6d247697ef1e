package dev.mars.mqclient.gcp;

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

import com.google.api.core.ApiFuture;
import com.google.api.gax.core.CredentialsProvider;
import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.core.NoCredentialsProvider;
import com.google.api.gax.grpc.GrpcTransportChannel;
import com.google.api.gax.rpc.AlreadyExistsException;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.FixedTransportChannelProvider;
import com.google.api.gax.rpc.TransportChannelProvider;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.pubsub.v1.Publisher;
import com.google.cloud.pubsub.v1.SubscriptionAdminClient;
import com.google.cloud.pubsub.v1.SubscriptionAdminSettings;
import com.google.cloud.pubsub.v1.TopicAdminClient;
import com.google.cloud.pubsub.v1.TopicAdminSettings;
import com.google.cloud.pubsub.v1.stub.GrpcSubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStubSettings;
import com.google.pubsub.v1.AcknowledgeRequest;
import com.google.pubsub.v1.ModifyAckDeadlineRequest;
import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.PullRequest;
import com.google.pubsub.v1.PullResponse;
import com.google.pubsub.v1.ReceivedMessage;
import com.google.pubsub.v1.Subscription;
import com.google.pubsub.v1.TopicName;
import dev.mars.mqclient.api.QueueConfiguration;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link PubSubOperations} over the Google Cloud client libraries. Admin calls use the
 * admin clients; pulls go through the low-level subscriber stub so a receive never
 * starts a background streaming subscriber.
 */
final class GrpcPubSubOperations implements PubSubOperations {

    private static final Logger logger = LoggerFactory.getLogger(GrpcPubSubOperations.class);

    private final TransportChannelProvider channelProvider;
    private final CredentialsProvider credentialsProvider;
    private final ManagedChannel emulatorChannel;
    private final TopicAdminClient topicAdmin;
    private final SubscriptionAdminClient subscriptionAdmin;
    private final SubscriberStub subscriber;

    private Publisher publisher;

    private GrpcPubSubOperations(TransportChannelProvider channelProvider, CredentialsProvider credentialsProvider,
                                 ManagedChannel emulatorChannel) throws IOException {
        this.channelProvider = channelProvider;
        this.credentialsProvider = credentialsProvider;
        this.emulatorChannel = emulatorChannel;
        this.topicAdmin = TopicAdminClient.create(TopicAdminSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider)
            .build());
        this.subscriptionAdmin = SubscriptionAdminClient.create(SubscriptionAdminSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider)
            .build());
        this.subscriber = GrpcSubscriberStub.create(SubscriberStubSettings.newBuilder()
            .setTransportChannelProvider(channelProvider)
            .setCredentialsProvider(credentialsProvider)
            .build());
    }

    /**
     * Opens clients against the emulator when {@code emulatorHost} is set, otherwise against
     * Google Cloud with the configured credentials file or application default credentials.
     */
    static GrpcPubSubOperations open(QueueConfiguration configuration, String emulatorHost)
            throws IOException {
        if (emulatorHost != null && !emulatorHost.isBlank()) {
            ManagedChannel channel = ManagedChannelBuilder.forTarget(emulatorHost).usePlaintext().build();
            logger.info("Using Pub/Sub emulator at {}", emulatorHost);
            try {
                return new GrpcPubSubOperations(
                    FixedTransportChannelProvider.create(GrpcTransportChannel.create(channel)),
                    NoCredentialsProvider.create(), channel);
            } catch (IOException | RuntimeException e) {
                channel.shutdownNow();
                throw e;
            }
        }
        CredentialsProvider credentials;
        String credentialsPath = configuration.getCredentialsPath();
        if (credentialsPath != null && !credentialsPath.isBlank()) {
            try (InputStream in = new FileInputStream(credentialsPath)) {
                credentials = FixedCredentialsProvider.create(
                    GoogleCredentials.fromStream(in).createScoped(TopicAdminSettings.getDefaultServiceScopes()));
            }
        } else {
            credentials = TopicAdminSettings.defaultCredentialsProviderBuilder().build();
        }
        return new GrpcPubSubOperations(TopicAdminSettings.defaultTransportChannelProvider(), credentials, null);
    }

    @Override
    public void ensureTopic(TopicName topic) {
        try {
            topicAdmin.createTopic(topic);
            logger.info("Created Pub/Sub topic {}", topic);
        } catch (AlreadyExistsException e) {
            logger.debug("Pub/Sub topic {} already exists", topic);
        }
    }

    @Override
    public String ensureSubscription(ProjectSubscriptionName subscription, TopicName topic, int ackDeadlineSeconds) {
        try {
            Subscription created = subscriptionAdmin.createSubscription(Subscription.newBuilder()
                .setName(subscription.toString())
                .setTopic(topic.toString())
                .setAckDeadlineSeconds(ackDeadlineSeconds)
                .build());
            logger.info("Created Pub/Sub subscription {}", subscription);
            return created.getTopic();
        } catch (AlreadyExistsException e) {
            return subscriptionAdmin.getSubscription(subscription).getTopic();
        }
    }

    @Override
    public String publish(TopicName topic, PubsubMessage message, Duration timeout)
            throws InterruptedException, TimeoutException {
        ApiFuture<String> future = publisherFor(topic).publish(message);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ApiException apiException) {
                throw apiException;
            }
            throw new IllegalStateException("Publish failed: " + e.getCause(), e.getCause());
        }
    }

    @Override
    public List<ReceivedMessage> pull(ProjectSubscriptionName subscription, int maxMessages, Duration timeout) {
        PullRequest request = PullRequest.newBuilder()
            .setSubscription(subscription.toString())
            .setMaxMessages(maxMessages)
            .build();
        ApiFuture<PullResponse> future = subscriber.pullCallable().futureCall(request);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS).getReceivedMessagesList();
        } catch (TimeoutException e) {
            future.cancel(true);
            return List.of();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof ApiException apiException) {
                throw apiException;
            }
            throw new IllegalStateException("Pull failed: " + e.getCause(), e.getCause());
        }
    }

    @Override
    public void acknowledge(ProjectSubscriptionName subscription, String ackId) {
        subscriber.acknowledgeCallable().call(AcknowledgeRequest.newBuilder()
            .setSubscription(subscription.toString())
            .addAckIds(ackId)
            .build());
    }

    @Override
    public void modifyAckDeadline(ProjectSubscriptionName subscription, String ackId, int seconds) {
        subscriber.modifyAckDeadlineCallable().call(ModifyAckDeadlineRequest.newBuilder()
            .setSubscription(subscription.toString())
            .addAckIds(ackId)
            .setAckDeadlineSeconds(seconds)
            .build());
    }

    @Override
    public synchronized void close() {
        if (publisher != null) {
            publisher.shutdown();
            try {
                publisher.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while shutting down Pub/Sub publisher");
            }
            publisher = null;
        }
        subscriber.close();
        subscriptionAdmin.close();
        topicAdmin.close();
        if (emulatorChannel != null) {
            emulatorChannel.shutdownNow();
        }
    }

    private synchronized Publisher publisherFor(TopicName topic) {
        if (publisher == null) {
            try {
                publisher = Publisher.newBuilder(topic)
                    .setChannelProvider(channelProvider)
                    .setCredentialsProvider(credentialsProvider)
                    .build();
            } catch (IOException e) {
                throw new IllegalStateException("Failed to create Pub/Sub publisher for " + topic, e);
            }
        }
        return publisher;
    }
}
