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
import com.google.common.base.Optional;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.slf4j.Logger;

/**
 * Configuration of a {@link Consumer}.
 *
 * <p>Required values may be left unset on the {@link Builder}; {@link #validate()} reports all of
 * the missing ones at once.
 */
@AutoValue
public abstract class ConsumerConfig<EventT> {
  /** Names of the Pub/Sub Lite subscriptions to consume from. */
  public abstract ImmutableList<String> topics();

  public abstract @Nullable String project();

  public abstract @Nullable String region();

  public abstract @Nullable Decoder<EventT> decoder();

  /** Receives every per-message and lifecycle record emitted by the consumer. */
  public abstract @Nullable Logger logger();

  public abstract @Nullable BatchProcessor<EventT> processor();

  public abstract @Nullable DeliveryType delivery();

  /**
   * How many times a message that failed processing is left for redelivery before it is nacked.
   * Only used for {@link DeliveryType#AT_LEAST_ONCE}.
   */
  public abstract int maxRetries();

  public abstract long flowControlMessages();

  public abstract long flowControlBytes();

  /** Overrides how subscribers are created. Defaults to Pub/Sub Lite subscribers. */
  public abstract Optional<SubscriberFactory> subscriberFactory();

  public static <EventT> Builder<EventT> builder() {
    return new AutoValue_ConsumerConfig.Builder<EventT>()
        .setTopics(ImmutableList.of())
        .setMaxRetries(ConfigDefs.DEFAULT_MAX_RETRIES)
        .setFlowControlMessages(ConfigDefs.DEFAULT_FLOW_CONTROL_MESSAGES)
        .setFlowControlBytes(ConfigDefs.DEFAULT_FLOW_CONTROL_BYTES);
  }

  /** Throws an {@link InvalidConsumerConfigException} listing every invalid setting. */
  public void validate() throws InvalidConsumerConfigException {
    List<String> violations = new ArrayList<>();
    if (topics().isEmpty()) {
      violations.add("pubsublite: at least one topic must be set");
    }
    if (Strings.isNullOrEmpty(project())) {
      violations.add("pubsublite: project must be set");
    }
    if (Strings.isNullOrEmpty(region())) {
      violations.add("pubsublite: region must be set");
    }
    if (decoder() == null) {
      violations.add("pubsublite: decoder must be set");
    }
    if (logger() == null) {
      violations.add("pubsublite: logger must be set");
    }
    if (processor() == null) {
      violations.add("pubsublite: processor must be set");
    }
    if (delivery() == null) {
      violations.add("pubsublite: delivery is not valid");
    }
    if (maxRetries() < 0) {
      violations.add("pubsublite: max retries must not be negative");
    }
    if (flowControlMessages() <= 0 || flowControlBytes() <= 0) {
      violations.add("pubsublite: flow control limits must be greater than 0");
    }
    if (!violations.isEmpty()) {
      throw new InvalidConsumerConfigException(violations);
    }
  }

  ImmutableList<Subscription> subscriptions() {
    ImmutableList.Builder<Subscription> subscriptions = ImmutableList.builder();
    for (String topic : topics()) {
      subscriptions.add(Subscription.of(project(), region(), topic));
    }
    return subscriptions.build();
  }

  /** Builder for {@link ConsumerConfig}. */
  @AutoValue.Builder
  public abstract static class Builder<EventT> {
    public abstract Builder<EventT> setTopics(Collection<String> topics);

    public abstract Builder<EventT> setProject(@Nullable String project);

    public abstract Builder<EventT> setRegion(@Nullable String region);

    public abstract Builder<EventT> setDecoder(@Nullable Decoder<EventT> decoder);

    public abstract Builder<EventT> setLogger(@Nullable Logger logger);

    public abstract Builder<EventT> setProcessor(@Nullable BatchProcessor<EventT> processor);

    public abstract Builder<EventT> setDelivery(@Nullable DeliveryType delivery);

    public abstract Builder<EventT> setMaxRetries(int maxRetries);

    /** Sets the number of outstanding messages allowed per partition. */
    public abstract Builder<EventT> setFlowControlMessages(long messages);

    /** Sets the number of outstanding bytes allowed per partition. */
    public abstract Builder<EventT> setFlowControlBytes(long bytes);

    public abstract Builder<EventT> setSubscriberFactory(SubscriberFactory factory);

    /**
     * Applies the settings named in {@link ConfigDefs}. Values which fail to parse throw a {@link
     * org.apache.kafka.common.config.ConfigException}; an unknown delivery type leaves the delivery
     * unset.
     */
    @SuppressWarnings("unchecked")
    public Builder<EventT> fromProperties(Map<String, String> properties) {
      Map<String, Object> values = ConfigDefs.config().parse(properties);
      setTopics((List<String>) values.get(ConfigDefs.SUBSCRIPTIONS_FLAG));
      setProject((String) values.get(ConfigDefs.PROJECT_FLAG));
      setRegion((String) values.get(ConfigDefs.LOCATION_FLAG));
      String delivery = (String) values.get(ConfigDefs.DELIVERY_FLAG);
      setDelivery(delivery == null ? null : DeliveryType.fromFlag(delivery).orNull());
      setMaxRetries((Integer) values.get(ConfigDefs.MAX_RETRIES_FLAG));
      setFlowControlMessages((Long) values.get(ConfigDefs.FLOW_CONTROL_PARTITION_MESSAGES_FLAG));
      setFlowControlBytes((Long) values.get(ConfigDefs.FLOW_CONTROL_PARTITION_BYTES_FLAG));
      return this;
    }

    public abstract ConsumerConfig<EventT> build();
  }
}
