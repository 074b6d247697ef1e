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

import com.google.pubsub.v1.ProjectSubscriptionName;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.ReceivedMessage;
import com.google.pubsub.v1.TopicName;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * The Pub/Sub calls the adapter makes. Failures surface as
 * {@link com.google.api.gax.rpc.ApiException}.
 */
interface PubSubOperations extends AutoCloseable {

    /**
     * Creates the topic unless it exists.
     */
    void ensureTopic(TopicName topic);

    /**
     * Creates the pull subscription unless it exists.
     *
     * @return the topic the subscription is attached to, which differs from
     *         {@code topic} when an existing subscription belongs to another topic
     */
    String ensureSubscription(ProjectSubscriptionName subscription, TopicName topic, int ackDeadlineSeconds);

    String publish(TopicName topic, PubsubMessage message, Duration timeout)
        throws InterruptedException, TimeoutException;

    /**
     * Pulls up to {@code maxMessages}, returning an empty list if nothing arrives within {@code timeout}.
     */
    List<ReceivedMessage> pull(ProjectSubscriptionName subscription, int maxMessages, Duration timeout);

    void acknowledge(ProjectSubscriptionName subscription, String ackId);

    void modifyAckDeadline(ProjectSubscriptionName subscription, String ackId, int seconds);

    @Override
    void close();
}
