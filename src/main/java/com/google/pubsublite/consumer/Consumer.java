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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode.Code;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;

/**
 * Consumes from one or more Pub/Sub Lite subscriptions and hands the decoded events to a {@link
 * BatchProcessor}. Every subscription is received from concurrently, and the underlying subscriber
 * delivers messages from different partitions concurrently.
 *
 * <p>A consumer is {@link #run() run} once and {@link #close() closed} once; it can't be re-used.
 */
public final class Consumer<EventT> implements AutoCloseable {

  private enum State {
    CREATED,
    RUNNING,
    STOPPED
  }

  private final Logger logger;
  private final ImmutableList<SubscriptionConsumer<EventT>> consumers;

  @GuardedBy("this")
  private State state = State.CREATED;

  @GuardedBy("this")
  private Optional<ApiException> failure = Optional.absent();

  @VisibleForTesting
  Consumer(Logger logger, ImmutableList<SubscriptionConsumer<EventT>> consumers) {
    checkArgument(!consumers.isEmpty(), "at least one subscription must be consumed");
    this.logger = logger;
    this.consumers = consumers;
  }

  /**
   * Creates a consumer receiving from every subscription in {@code config}.
   *
   * @throws InvalidConsumerConfigException if {@code config} is invalid
   * @throws ApiException if a subscription can't be addressed
   */
  public static <EventT> Consumer<EventT> create(ConsumerConfig<EventT> config)
      throws InvalidConsumerConfigException, ApiException {
    config.validate();
    SubscriberFactory factory;
    if (config.subscriberFactory().isPresent()) {
      factory = config.subscriberFactory().get();
    } else {
      factory = new SubscriberFactoryImpl(
          config.flowControlMessages(), config.flowControlBytes(), config.logger());
    }
    ImmutableList.Builder<SubscriptionConsumer<EventT>> consumers = ImmutableList.builder();
    for (Subscription subscription : config.subscriptions()) {
      if (!config.subscriberFactory().isPresent()) {
        // Fails early on subscriptions the transport can't address.
        subscription.path();
      }
      consumers.add(new SubscriptionConsumer<>(
          subscription,
          config.decoder(),
          config.processor(),
          config.delivery(),
          config.maxRetries(),
          config.logger(),
          factory));
    }
    return new Consumer<>(config.logger(), consumers.build());
  }

  /**
   * Receives from all subscriptions, blocking until every subscription stopped receiving. Only the
   * first call starts receiving.
   *
   * <p>Receiving stops when the consumer is {@link #close() closed}, the calling thread is
   * interrupted, or any subscription fails with an error other than the backend being unavailable.
   * In the latter case all other subscriptions are stopped as well and the first error is thrown.
   *
   * @throws ConsumerAlreadyStartedException if called more than once
   * @throws ApiException the first fatal subscription error
   * @throws InterruptedException if the calling thread was interrupted while receiving
   */
  public void run() throws ApiException, InterruptedException {
    synchronized (this) {
      if (state != State.CREATED) {
        throw new ConsumerAlreadyStartedException();
      }
      state = State.RUNNING;
    }
    ExecutorService executor = Executors.newFixedThreadPool(
        consumers.size(),
        new ThreadFactoryBuilder().setNameFormat("pubsublite-receive-%d").setDaemon(true).build());
    CompletionService<Void> group = new ExecutorCompletionService<>(executor);
    for (SubscriptionConsumer<EventT> consumer : consumers) {
      group.submit(() -> {
        consumer.receive();
        return null;
      });
    }
    logger.info("Started receiving from {} subscription(s).", consumers.size());
    ApiException firstError = null;
    try {
      for (int i = 0; i < consumers.size(); i++) {
        try {
          group.take().get();
        } catch (ExecutionException e) {
          ApiException error = TransportErrors.toApiException(e.getCause());
          if (firstError == null) {
            firstError = error;
            fail(error);
          } else if (error != firstError) {
            firstError.addSuppressed(error);
          }
        }
      }
    } catch (InterruptedException e) {
      stopReceiving();
      executor.shutdownNow();
      throw e;
    } finally {
      executor.shutdown();
      synchronized (this) {
        state = State.STOPPED;
      }
      logger.info("Stopped receiving.");
    }
    if (firstError != null) {
      throw firstError;
    }
  }

  /**
   * Stops receiving from all subscriptions, causing {@link #run()} to return. Has no effect if the
   * consumer was never run.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (state != State.RUNNING) {
        return;
      }
      state = State.STOPPED;
    }
    stopReceiving();
  }

  /**
   * Throws if the consumer can no longer receive messages because a subscription failed.
   *
   * @throws ApiException with code {@code FAILED_PRECONDITION}, caused by the subscription error
   */
  public void healthy() throws ApiException {
    Optional<ApiException> error;
    synchronized (this) {
      error = failure;
    }
    if (error.isPresent()) {
      throw new ApiException(
          error.get(), TransportErrors.statusCode(Code.FAILED_PRECONDITION), false);
    }
  }

  private void fail(ApiException error) {
    synchronized (this) {
      failure = Optional.of(error);
    }
    logger.atError().setCause(error).log("Subscription failed, stopping all subscriptions.");
    stopReceiving();
  }

  private void stopReceiving() {
    consumers.forEach(SubscriptionConsumer::stop);
  }
}
