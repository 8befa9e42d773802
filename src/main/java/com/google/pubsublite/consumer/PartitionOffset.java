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
import com.google.cloud.pubsublite.MessageMetadata;

/** The partition and offset encoded in a Pub/Sub Lite message id. */
@AutoValue
abstract class PartitionOffset {
  private static final PartitionOffset UNKNOWN = of(0, 0L);

  abstract int partition();

  abstract long offset();

  static PartitionOffset of(int partition, long offset) {
    return new AutoValue_PartitionOffset(partition, offset);
  }

  /** Returns zero values if {@code messageId} is not an encoded {@link MessageMetadata}. */
  static PartitionOffset parse(String messageId) {
    try {
      MessageMetadata metadata = MessageMetadata.decode(messageId);
      return of((int) metadata.partition().value(), metadata.offset().value());
    } catch (RuntimeException e) {
      // Not produced by Pub/Sub Lite, as with messages built by hand.
      return UNKNOWN;
    }
  }
}
