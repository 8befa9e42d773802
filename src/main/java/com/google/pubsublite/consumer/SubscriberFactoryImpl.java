/*
 * Copyright 2024 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.google.pubsublite.consumer;

import com.google.api.core.ApiFuture;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsublite.cloudpubsub.FlowControlSettings;
import com.google.cloud.pubsublite.cloudpubsub.NackHandler;
import com.google.cloud.pubsublite.cloudpubsub.Subscriber;
import com.google.cloud.pubsublite.cloudpubsub.SubscriberSettings;
import com.google.common.annotations.VisibleForTesting;
import com.google.pubsub.v1.PubsubMessage;
import org.slf4j.Logger;

class SubscriberFactoryImpl implements SubscriberFactory {

  private final FlowControlSettings flowControlSettings;
  private final NackHandler nackHandler;

  SubscriberFactoryImpl(long messagesOutstanding, long bytesOutstanding, Logger logger) {
    this.flowControlSettings = FlowControlSettings.builder()
        .setMessagesOutstanding(messagesOutstanding)
        .setBytesOutstanding(bytesOutstanding).build();
    this.nackHandler = loggingNackHandler(logger);
  }

  /**
   * Pub/Sub Lite has no nack. By default a nack fails the subscriber, and no other subscriber could
   * take over the partition. Nacked messages are logged and treated as handled instead.
   */
  @VisibleForTesting
  static NackHandler loggingNackHandler(Logger logger) {
    return new NackHandler() {
      @Override
      public ApiFuture<Void> nack(PubsubMessage message) {
        // TODO: publish nacked messages to a dead letter topic once one can be configured.
        PartitionOffset partitionOffset = PartitionOffset.parse(message.getMessageId());
        logger.atError()
            .addKeyValue("partition", partitionOffset.partition())
            .addKeyValue("offset", partitionOffset.offset())
            .addKeyValue("attributes", message.getAttributesMap())
            .log("handling nacked message");
        return ApiFutures.immediateFuture(null);
      }
    };
  }

  @Override
  public Subscriber newSubscriber(Subscription subscription, MessageReceiver receiver)
      throws ApiException {
    return Subscriber.create(SubscriberSettings.newBuilder()
        .setSubscriptionPath(subscription.path())
        .setReceiver(receiver)
        .setPerPartitionFlowControlSettings(flowControlSettings)
        .setNackHandler(nackHandler)
        .build());
  }
}
