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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.ByteString;
import org.apache.kafka.common.config.ConfigException;
import org.junit.Test;
import org.slf4j.LoggerFactory;

public class ConsumerConfigTest {

  private static ConsumerConfig.Builder<String> validBuilder() {
    return ConsumerConfig.<String>builder()
        .setTopics(ImmutableList.of("events"))
        .setProject("my-project")
        .setRegion("us-central1")
        .setDecoder(ByteString::toStringUtf8)
        .setLogger(LoggerFactory.getLogger(ConsumerConfigTest.class))
        .setProcessor((context, batch) -> {})
        .setDelivery(DeliveryType.AT_MOST_ONCE);
  }

  @Test
  public void validate_validConfig() {
    validBuilder().build().validate();
  }

  @Test
  public void validate_emptyConfigReportsEveryMissingField() {
    InvalidConsumerConfigException e = assertThrows(
        InvalidConsumerConfigException.class,
        () -> ConsumerConfig.<String>builder().build().validate());
    assertThat(e.violations()).containsExactly(
        "pubsublite: at least one topic must be set",
        "pubsublite: project must be set",
        "pubsublite: region must be set",
        "pubsublite: decoder must be set",
        "pubsublite: logger must be set",
        "pubsublite: processor must be set",
        "pubsublite: delivery is not valid");
    assertThat(e).hasMessageThat().contains("pubsublite: invalid consumer config");
  }

  @Test
  public void validate_emptyStringsAreMissing() {
    InvalidConsumerConfigException e = assertThrows(
        InvalidConsumerConfigException.class,
        () -> validBuilder().setProject("").setRegion("").build().validate());
    assertThat(e.violations()).containsExactly(
        "pubsublite: project must be set", "pubsublite: region must be set");
  }

  @Test
  public void validate_limits() {
    InvalidConsumerConfigException e = assertThrows(
        InvalidConsumerConfigException.class,
        () -> validBuilder().setMaxRetries(-1).setFlowControlBytes(0).build().validate());
    assertThat(e.violations()).hasSize(2);
  }

  @Test
  public void builder_defaults() {
    ConsumerConfig<String> config = validBuilder().build();
    assertThat(config.maxRetries()).isEqualTo(2);
    assertThat(config.flowControlMessages()).isEqualTo(Long.MAX_VALUE);
    assertThat(config.flowControlBytes()).isEqualTo(20_000_000L);
    assertThat(config.subscriberFactory().isPresent()).isFalse();
  }

  @Test
  public void subscriptions_onePerTopic() {
    ConsumerConfig<String> config =
        validBuilder().setTopics(ImmutableList.of("events", "logs")).build();
    assertThat(config.subscriptions()).containsExactly(
        Subscription.of("my-project", "us-central1", "events"),
        Subscription.of("my-project", "us-central1", "logs")).inOrder();
  }

  @Test
  public void fromProperties_appliesEveryFlag() {
    ConsumerConfig<String> config = ConsumerConfig.<String>builder()
        .fromProperties(ImmutableMap.<String, String>builder()
            .put(ConfigDefs.PROJECT_FLAG, "my-project")
            .put(ConfigDefs.LOCATION_FLAG, "us-central1")
            .put(ConfigDefs.SUBSCRIPTIONS_FLAG, "events,logs")
            .put(ConfigDefs.DELIVERY_FLAG, "at_least_once")
            .put(ConfigDefs.MAX_RETRIES_FLAG, "5")
            .put(ConfigDefs.FLOW_CONTROL_PARTITION_MESSAGES_FLAG, "1000")
            .put(ConfigDefs.FLOW_CONTROL_PARTITION_BYTES_FLAG, "1048576")
            .build())
        .build();
    assertThat(config.project()).isEqualTo("my-project");
    assertThat(config.region()).isEqualTo("us-central1");
    assertThat(config.topics()).containsExactly("events", "logs").inOrder();
    assertThat(config.delivery()).isEqualTo(DeliveryType.AT_LEAST_ONCE);
    assertThat(config.maxRetries()).isEqualTo(5);
    assertThat(config.flowControlMessages()).isEqualTo(1000L);
    assertThat(config.flowControlBytes()).isEqualTo(1048576L);
  }

  @Test
  public void fromProperties_missingValuesAreLeftToValidate() {
    ConsumerConfig<String> config = ConsumerConfig.<String>builder()
        .fromProperties(ImmutableMap.of(ConfigDefs.DELIVERY_FLAG, "exactly_once"))
        .build();
    assertThat(config.delivery()).isNull();
    assertThat(config.maxRetries()).isEqualTo(2);
    InvalidConsumerConfigException e =
        assertThrows(InvalidConsumerConfigException.class, config::validate);
    assertThat(e.violations()).contains("pubsublite: delivery is not valid");
    assertThat(e.violations()).contains("pubsublite: at least one topic must be set");
  }

  @Test
  public void fromProperties_malformedNumberThrows() {
    assertThrows(
        ConfigException.class,
        () -> ConsumerConfig.<String>builder()
            .fromProperties(ImmutableMap.of(ConfigDefs.MAX_RETRIES_FLAG, "two")));
  }
}
