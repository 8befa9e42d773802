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

import com.google.common.base.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts processing failures per message id. An entry exists only while its message has failed at
 * least once and is neither resolved nor given up on.
 *
 * <p>Messages may be redelivered while an earlier delivery is still being processed, so every
 * update is atomic per message id.
 */
class RetryTracker {
  private final ConcurrentMap<String, Integer> failures = new ConcurrentHashMap<>();

  /** Records a failure and returns the number of failures recorded for {@code messageId}. */
  int recordFailure(String messageId) {
    return failures.merge(messageId, 1, Integer::sum);
  }

  /** Stops tracking {@code messageId}, returning the failures recorded for it, if any. */
  Optional<Integer> clear(String messageId) {
    return Optional.fromNullable(failures.remove(messageId));
  }

  Optional<Integer> attempts(String messageId) {
    return Optional.fromNullable(failures.get(messageId));
  }

  int size() {
    return failures.size();
  }
}
