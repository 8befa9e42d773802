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

import com.google.api.core.ApiFuture;
import com.google.cloud.pubsublite.MessageMetadata;
import com.google.cloud.pubsublite.Offset;
import com.google.cloud.pubsublite.Partition;
import com.google.pubsub.v1.PubsubMessage;
import org.junit.Test;
import org.slf4j.LoggerFactory;

public class SubscriberFactoryImplTest {
  @Test
  public void nackHandler_treatsNackAsHandled() throws Exception {
    PubsubMessage message = PubsubMessage.newBuilder()
        .setMessageId(MessageMetadata.of(Partition.of(1), Offset.of(7)).encode())
        .putAttributes("key", "value")
        .build();

    ApiFuture<Void> result = SubscriberFactoryImpl
        .loggingNackHandler(LoggerFactory.getLogger(SubscriberFactoryImplTest.class))
        .nack(message);

    assertThat(result.isDone()).isTrue();
    assertThat(result.get()).isNull();
  }

  @Test
  public void partitionOffset_parsesMessageId() {
    String messageId = MessageMetadata.of(Partition.of(1), Offset.of(7)).encode();
    assertThat(PartitionOffset.parse(messageId)).isEqualTo(PartitionOffset.of(1, 7L));
  }

  @Test
  public void partitionOffset_unparseableIdIsZero() {
    assertThat(PartitionOffset.parse("not-metadata")).isEqualTo(PartitionOffset.of(0, 0L));
    assertThat(PartitionOffset.parse("")).isEqualTo(PartitionOffset.of(0, 0L));
  }
}
