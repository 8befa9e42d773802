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

import com.google.api.core.AbstractApiService;
import com.google.api.core.ApiService.Listener;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsublite.cloudpubsub.Subscriber;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Hands out subscribers which fail on start with scripted errors. Once the script of a
 * subscription is exhausted, its subscribers run until stopped.
 */
class FakeSubscriberFactory implements SubscriberFactory {

  static class FakeSubscriber extends AbstractApiService implements Subscriber {
    private final Throwable startupFailure;
    final MessageReceiver receiver;

    FakeSubscriber(Throwable startupFailure, MessageReceiver receiver) {
      this.startupFailure = startupFailure;
      this.receiver = receiver;
    }

    @Override
    protected void doStart() {
      if (startupFailure != null) {
        notifyFailed(startupFailure);
      } else {
        notifyStarted();
      }
    }

    @Override
    protected void doStop() {
      notifyStopped();
    }

    void fail(Throwable t) {
      notifyFailed(t);
    }
  }

  @GuardedBy("this")
  private final Map<String, Deque<Throwable>> scripts = new HashMap<>();

  @GuardedBy("this")
  private final List<FakeSubscriber> created = new ArrayList<>();

  private final Semaphore runningSubscribers = new Semaphore(0);

  /** Subscribers of {@code subscription} fail with {@code failures}, one per subscriber. */
  synchronized FakeSubscriberFactory script(String subscription, Throwable... failures) {
    Deque<Throwable> script = scripts.computeIfAbsent(subscription, unused -> new ArrayDeque<>());
    for (Throwable failure : failures) {
      script.add(failure);
    }
    return this;
  }

  @Override
  public synchronized Subscriber newSubscriber(
      Subscription subscription, MessageReceiver receiver) {
    Deque<Throwable> script = scripts.get(subscription.name());
    Throwable failure = script == null ? null : script.poll();
    FakeSubscriber subscriber = new FakeSubscriber(failure, receiver);
    if (failure == null) {
      subscriber.addListener(new Listener() {
        @Override
        public void running() {
          runningSubscribers.release();
        }
      }, MoreExecutors.directExecutor());
    }
    created.add(subscriber);
    return subscriber;
  }

  synchronized List<FakeSubscriber> created() {
    return new ArrayList<>(created);
  }

  /** Waits until {@code count} subscribers which don't fail on start are running. */
  boolean awaitRunning(int count) throws InterruptedException {
    return runningSubscribers.tryAcquire(count, 10, TimeUnit.SECONDS);
  }
}
