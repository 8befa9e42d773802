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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/** Per-message information handed to a {@link BatchProcessor} alongside the events. */
@AutoValue
public abstract class QueueContext {
  /** The name of the subscription the message was received from. */
  public abstract String subscription();

  /** The attributes of the received message. */
  public abstract ImmutableMap<String, String> metadata();

  public static QueueContext of(String subscription, Map<String, String> metadata) {
    return new AutoValue_QueueContext(subscription, ImmutableMap.copyOf(metadata));
  }
}
