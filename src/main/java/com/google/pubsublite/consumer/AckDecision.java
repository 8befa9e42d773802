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

import com.google.cloud.pubsub.v1.AckReplyConsumer;

/** What to tell the transport about a message once it has been processed. */
enum AckDecision {
  ACK {
    @Override
    void apply(AckReplyConsumer reply) {
      reply.ack();
    }
  },
  NACK {
    @Override
    void apply(AckReplyConsumer reply) {
      reply.nack();
    }
  },
  /** Neither ack nor nack, so the message is redelivered. */
  WITHHOLD {
    @Override
    void apply(AckReplyConsumer reply) {}
  };

  abstract void apply(AckReplyConsumer reply);
}
