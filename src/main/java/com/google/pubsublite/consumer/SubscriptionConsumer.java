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

import com.google.api.core.ApiService.State;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.pubsub.v1.AckReplyConsumer;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsublite.cloudpubsub.Subscriber;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.io.BaseEncoding;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import com.google.protobuf.ByteString;
import com.google.pubsub.v1.PubsubMessage;
import org.slf4j.Logger;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * Receives from a single subscription. Each message is decoded, handed to the {@link
 * BatchProcessor} and then acked, nacked or left for redelivery according to the {@link
 * DeliveryType}.
 *
 * <p>{@link #receiveMessage} is called concurrently by the subscriber for messages from different
 * partitions.
 */
class SubscriptionConsumer<EventT> implements MessageReceiver {

  private final Subscription subscription;
  private final Decoder<EventT> decoder;
  private final BatchProcessor<EventT> processor;
  private final DeliveryType delivery;
  private final int maxRetries;
  private final Logger logger;
  private final SubscriberFactory factory;
  private final RetryTracker retryTracker = new RetryTracker();

  @GuardedBy("this")
  private boolean stopped = false;

  @GuardedBy("this")
  private Optional<Subscriber> subscriber = Optional.absent();

  SubscriptionConsumer(
      Subscription subscription,
      Decoder<EventT> decoder,
      BatchProcessor<EventT> processor,
      DeliveryType delivery,
      int maxRetries,
      Logger logger,
      SubscriberFactory factory) {
    this.subscription = subscription;
    this.decoder = decoder;
    this.processor = processor;
    this.delivery = delivery;
    this.maxRetries = maxRetries;
    this.logger = logger;
    this.factory = factory;
  }

  Subscription subscription() {
    return subscription;
  }

  @VisibleForTesting
  RetryTracker retryTracker() {
    return retryTracker;
  }

  /**
   * Receives until {@link #stop()} is called or the subscriber fails. A subscriber failing because
   * the backend is unavailable is replaced by a new one.
   *
   * @throws ApiException if the subscriber failed for any other reason
   */
  void receive() throws ApiException {
    while (true) {
      Subscriber current;
      synchronized (this) {
        if (stopped) {
          return;
        }
        current = factory.newSubscriber(subscription, this);
        subscriber = Optional.of(current);
      }
      Optional<Throwable> failure = awaitTermination(current);
      if (!failure.isPresent()) {
        return;
      }
      if (!TransportErrors.isBackendUnavailable(failure.get())) {
        throw TransportErrors.toApiException(failure.get());
      }
      withSubscription(logger.atWarn())
          .setCause(failure.get())
          .log("backend unavailable, resuming receive");
    }
  }

  /** Stops the current subscriber and makes {@link #receive()} return. */
  void stop() {
    Optional<Subscriber> toStop;
    synchronized (this) {
      stopped = true;
      toStop = subscriber;
      subscriber = Optional.absent();
    }
    if (toStop.isPresent()) {
      toStop.get().stopAsync();
    }
  }

  private static Optional<Throwable> awaitTermination(Subscriber subscriber) {
    try {
      subscriber.startAsync();
      subscriber.awaitTerminated();
      return Optional.absent();
    } catch (IllegalStateException e) {
      // Thrown both when the subscriber failed and when it was stopped before it started.
      if (subscriber.state() == State.FAILED) {
        return Optional.of(subscriber.failureCause());
      }
      return Optional.absent();
    }
  }

  @Override
  public void receiveMessage(PubsubMessage message, AckReplyConsumer reply) {
    EventT event;
    try {
      event = decoder.decode(message.getData());
    } catch (DecodeException | RuntimeException e) {
      reply.nack();
      withMessage(logger.atError(), message)
          .setCause(e)
          .addKeyValue("message.value", encodedPayload(message.getData()))
          .log("unable to decode message data");
      return;
    }
    QueueContext context = QueueContext.of(subscription.name(), message.getAttributesMap());
    if (delivery == DeliveryType.AT_MOST_ONCE) {
      reply.ack();
    }
    Optional<Throwable> failure = process(context, event, message);
    if (delivery == DeliveryType.AT_LEAST_ONCE) {
      settle(message, failure).apply(reply);
    }
  }

  private Optional<Throwable> process(QueueContext context, EventT event, PubsubMessage message) {
    try {
      processor.processBatch(context, ImmutableList.of(event));
      return Optional.absent();
    } catch (Exception e) {
      withMessage(logger.atError(), message).setCause(e).log("unable to process event");
      return Optional.of(e);
    }
  }

  /**
   * Decides the outcome of an at least once delivery given the result of processing it. A
   * message is nacked once it failed more than {@code maxRetries} times.
   */
  @VisibleForTesting
  AckDecision settle(PubsubMessage message, Optional<Throwable> failure) {
    String messageId = message.getMessageId();
    if (!failure.isPresent()) {
      Optional<Integer> failures = retryTracker.clear(messageId);
      if (failures.isPresent()) {
        withMessage(logger.atInfo(), message)
            .addKeyValue("failures", failures.get())
            .log("processed previously failed event");
      }
      return AckDecision.ACK;
    }
    if (retryTracker.recordFailure(messageId) > maxRetries) {
      retryTracker.clear(messageId);
      return AckDecision.NACK;
    }
    return AckDecision.WITHHOLD;
  }

  /** Base64 rendering of the raw payload, lossless for data that isn't valid UTF-8. */
  @VisibleForTesting
  static String encodedPayload(ByteString data) {
    return BaseEncoding.base64().encode(data.toByteArray());
  }

  private LoggingEventBuilder withSubscription(LoggingEventBuilder builder) {
    return builder
        .addKeyValue("subscription", subscription.name())
        .addKeyValue("region", subscription.region())
        .addKeyValue("project", subscription.project());
  }

  private LoggingEventBuilder withMessage(LoggingEventBuilder builder, PubsubMessage message) {
    PartitionOffset partitionOffset = PartitionOffset.parse(message.getMessageId());
    return withSubscription(builder)
        .addKeyValue("partition", partitionOffset.partition())
        .addKeyValue("offset", partitionOffset.offset())
        .addKeyValue("attributes", message.getAttributesMap());
  }
}
