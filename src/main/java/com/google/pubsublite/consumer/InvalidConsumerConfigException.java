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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Thrown when a {@link ConsumerConfig} is invalid. Lists every violation found. */
public class InvalidConsumerConfigException extends IllegalArgumentException {
  private final ImmutableList<String> violations;

  InvalidConsumerConfigException(List<String> violations) {
    super("pubsublite: invalid consumer config: " + String.join("; ", violations));
    this.violations = ImmutableList.copyOf(violations);
  }

  public ImmutableList<String> violations() {
    return violations;
  }
}
