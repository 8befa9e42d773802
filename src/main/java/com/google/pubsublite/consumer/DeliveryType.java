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

/** How a {@link Consumer} acknowledges the messages it receives. */
public enum DeliveryType {
  /**
   * Messages are acknowledged before they are processed. A processing failure never causes a
   * redelivery.
   */
  AT_MOST_ONCE("at_most_once"),
  /**
   * Messages are acknowledged only after they were processed successfully. Failed messages are
   * left outstanding so they can be redelivered, up to the configured number of retries.
   */
  AT_LEAST_ONCE("at_least_once");

  private final String flag;

  DeliveryType(String flag) {
    this.flag = flag;
  }

  /** The value used for this delivery type in {@link ConfigDefs#DELIVERY_FLAG}. */
  public String flag() {
    return flag;
  }

  static Optional<DeliveryType> fromFlag(String flag) {
    for (DeliveryType type : values()) {
      if (type.flag.equals(flag)) {
        return Optional.of(type);
      }
    }
    return Optional.absent();
  }
}
