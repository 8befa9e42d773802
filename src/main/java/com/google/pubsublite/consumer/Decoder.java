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

import com.google.protobuf.ByteString;

/**
 * Turns the payload of a received message into an event.
 *
 * <p>Implementations are called concurrently for messages from different partitions and
 * subscriptions, and must be thread safe.
 */
@FunctionalInterface
public interface Decoder<EventT> {
  EventT decode(ByteString data) throws DecodeException;
}
