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

import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;

/** Property names understood by {@link ConsumerConfig.Builder#fromProperties}. */
public final class ConfigDefs {

  private ConfigDefs() {
  }

  public static final String PROJECT_FLAG = "pubsublite.project";
  public static final String LOCATION_FLAG = "pubsublite.location";
  public static final String SUBSCRIPTIONS_FLAG = "pubsublite.subscriptions";
  public static final String DELIVERY_FLAG = "pubsublite.delivery";
  public static final String MAX_RETRIES_FLAG = "pubsublite.max_retries";
  public static final String FLOW_CONTROL_PARTITION_MESSAGES_FLAG =
      "pubsublite.partition_flow_control.messages";
  public static final String FLOW_CONTROL_PARTITION_BYTES_FLAG =
      "pubsublite.partition_flow_control.bytes";

  static final int DEFAULT_MAX_RETRIES = 2;
  static final long DEFAULT_FLOW_CONTROL_MESSAGES = Long.MAX_VALUE;
  static final long DEFAULT_FLOW_CONTROL_BYTES = 20_000_000L;

  public static ConfigDef config() {
    return new ConfigDef()
        .define(PROJECT_FLAG, ConfigDef.Type.STRING, null, Importance.HIGH,
            "The project containing the subscriptions from which to consume.")
        .define(LOCATION_FLAG, ConfigDef.Type.STRING, null, Importance.HIGH,
            "The cloud region (like europe-south7) containing the subscriptions.")
        .define(SUBSCRIPTIONS_FLAG, ConfigDef.Type.LIST, "", Importance.HIGH,
            "Comma separated names of the subscriptions from which to consume.")
        .define(DELIVERY_FLAG, ConfigDef.Type.STRING, null, Importance.HIGH,
            "How messages are acknowledged, either at_most_once or at_least_once.")
        .define(
            MAX_RETRIES_FLAG,
            ConfigDef.Type.INT,
            DEFAULT_MAX_RETRIES,
            Importance.MEDIUM,
            "The number of times a message that failed processing is left for redelivery before "
                + "it is nacked. Only used for at_least_once delivery. Set to 2 by default.")
        .define(
            FLOW_CONTROL_PARTITION_MESSAGES_FLAG,
            ConfigDef.Type.LONG,
            DEFAULT_FLOW_CONTROL_MESSAGES,
            Importance.MEDIUM,
            "The number of outstanding messages per-partition allowed. Set to Long.MAX_VALUE by default."
        )
        .define(
            FLOW_CONTROL_PARTITION_BYTES_FLAG,
            ConfigDef.Type.LONG,
            DEFAULT_FLOW_CONTROL_BYTES,
            Importance.MEDIUM,
            "The number of outstanding bytes per-partition allowed. Set to 20MB by default."
        );
  }
}
