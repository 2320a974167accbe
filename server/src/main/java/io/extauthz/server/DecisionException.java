/*
 * Copyright 2026 The ext-authz Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.extauthz.server;

import static com.google.common.base.Preconditions.checkNotNull;

import io.grpc.Status;
import javax.annotation.Nullable;

/**
 * The error that ended a check call without a response. Returned to the proxy as a gRPC status.
 */
public final class DecisionException extends Exception {

  private static final long serialVersionUID = 0L;

  /** The step of the check call that failed. */
  public enum Reason {
    /** A decision id or the per-call metrics could not be allocated. */
    EVAL_START,
    /** No store transaction could be opened. */
    STORE,
    /** The call's deadline expired before the query was evaluated. */
    TIMEOUT,
    /** The request could not be turned into an input document. */
    INPUT_CONVERSION,
    /** The input document could not be turned into an engine value. */
    VALUE_CONVERSION,
    /** The query could not be prepared or evaluated. */
    EVALUATION,
    /** The decision could not be turned into a response. */
    RESPONSE_SHAPING,
  }

  private final Reason reason;

  public DecisionException(Reason reason, String message) {
    this(reason, message, null);
  }

  public DecisionException(Reason reason, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.reason = checkNotNull(reason, "reason");
  }

  public Reason getReason() {
    return reason;
  }

  /** Converts this error to the status the call is closed with. */
  public Status toStatus() {
    Status status = reason == Reason.TIMEOUT ? Status.DEADLINE_EXCEEDED : Status.UNKNOWN;
    return status.withDescription(getMessage()).withCause(getCause());
  }
}
