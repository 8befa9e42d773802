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

import java.util.List;

/**
 * Performs the application work for decoded events.
 *
 * <p>A {@link Consumer} calls {@link #processBatch} from every subscription and partition it
 * receives from, without serializing the calls. Implementations must be thread safe.
 */
@FunctionalInterface
public interface BatchProcessor<EventT> {
  /**
   * Process {@code batch}. Throwing marks every event of the batch as failed, which under {@link
   * DeliveryType#AT_LEAST_ONCE} leads to a redelivery.
   *
   * @param context metadata of the message the batch was decoded from
   */
  void processBatch(QueueContext context, List<EventT> batch) throws Exception;
}
