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

import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.api.gax.rpc.StatusCode.Code;
import com.google.cloud.pubsublite.internal.CheckedApiException;
import com.google.common.base.Optional;
import com.google.common.base.Throwables;
import io.grpc.Status;
import java.util.concurrent.ExecutionException;

/** Classifies and normalizes the failures reported by subscribers. */
final class TransportErrors {

  private TransportErrors() {
  }

  /** Whether {@code t} reports the backend as temporarily unavailable. */
  static boolean isBackendUnavailable(Throwable t) {
    return code(t).orNull() == Code.UNAVAILABLE;
  }

  static ApiException toApiException(Throwable t) {
    if (t instanceof ExecutionException && t.getCause() != null) {
      return toApiException(t.getCause());
    }
    if (t instanceof ApiException) {
      return (ApiException) t;
    }
    return new ApiException(t, statusCode(code(t).or(Code.INTERNAL)), false);
  }

  static StatusCode statusCode(Code code) {
    return new StatusCode() {
      @Override
      public Code getCode() {
        return code;
      }

      @Override
      public Object getTransportCode() {
        return null;
      }
    };
  }

  private static Optional<Code> code(Throwable t) {
    for (Throwable cause : Throwables.getCausalChain(t)) {
      if (cause instanceof ApiException) {
        return Optional.of(((ApiException) cause).getStatusCode().getCode());
      }
      if (cause instanceof CheckedApiException) {
        return Optional.of(((CheckedApiException) cause).code());
      }
    }
    Status status = Status.fromThrowable(t);
    if (status.getCode() == Status.Code.UNKNOWN) {
      return Optional.absent();
    }
    return Optional.of(Code.valueOf(status.getCode().name()));
  }
}
