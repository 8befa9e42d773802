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

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.pubsub.v1.MessageReceiver;
import com.google.cloud.pubsublite.cloudpubsub.Subscriber;

/**
 * Creates the subscribers a {@link Consumer} receives from. A subscriber can't be restarted, so a
 * new one is requested every time a subscription resumes receiving.
 */
public interface SubscriberFactory {
  /** Returns a new, not yet started subscriber delivering to {@code receiver}. */
  Subscriber newSubscriber(Subscription subscription, MessageReceiver receiver)
      throws ApiException;
}
