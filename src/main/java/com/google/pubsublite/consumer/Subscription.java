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
import com.google.auto.value.AutoValue;
import com.google.cloud.pubsublite.SubscriptionPath;

/** A Pub/Sub Lite subscription, addressed by project, region and name. */
@AutoValue
public abstract class Subscription {
  public abstract String project();

  public abstract String region();

  public abstract String name();

  public static Subscription of(String project, String region, String name) {
    return new AutoValue_Subscription(project, region, name);
  }

  /** The transport address of this subscription. */
  public SubscriptionPath path() throws ApiException {
    return SubscriptionPath.parse(toString());
  }

  @Override
  public String toString() {
    return String.format(
        "projects/%s/locations/%s/subscriptions/%s", project(), region(), name());
  }
}
