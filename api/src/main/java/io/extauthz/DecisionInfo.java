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

package io.extauthz;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.time.Instant;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A single audit log entry describing how one check call was decided. It always records the
 * decision actually computed by the policy, never a value forced by dry-run mode.
 */
@AutoValue
public abstract class DecisionInfo {

  public static Builder builder() {
    return new AutoValue_DecisionInfo.Builder().setMetrics(ImmutableMap.<String, Long>of());
  }

  /** Unique identifier of the decision. */
  public abstract String decisionId();

  /** When the entry was produced. */
  public abstract Instant timestamp();

  /** The configured entry point path, if the entry point was given as a path. */
  @Nullable
  public abstract String path();

  /** The configured entry point query, if the entry point was given as a query. */
  @Nullable
  public abstract String query();

  /** Identifier of the store transaction the decision was evaluated in. */
  public abstract long transactionId();

  /** The input document, absent if the request could not be converted. */
  @Nullable
  public abstract Map<String, Object> input();

  /** The raw decision value, absent if evaluation did not complete. */
  @Nullable
  public abstract Object decision();

  /** Results of non-deterministic builtins, when recorded by the engine. */
  @Nullable
  public abstract Map<String, ?> ndBuiltinCache();

  /** Timer values in nanoseconds. */
  public abstract ImmutableMap<String, Long> metrics();

  /** The error that ended the check call, if any. */
  @Nullable
  public abstract Throwable error();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setDecisionId(String decisionId);

    public abstract Builder setTimestamp(Instant timestamp);

    public abstract Builder setPath(@Nullable String path);

    public abstract Builder setQuery(@Nullable String query);

    public abstract Builder setTransactionId(long transactionId);

    public abstract Builder setInput(@Nullable Map<String, Object> input);

    public abstract Builder setDecision(@Nullable Object decision);

    public abstract Builder setNdBuiltinCache(@Nullable Map<String, ?> ndBuiltinCache);

    public abstract Builder setMetrics(Map<String, Long> metrics);

    public abstract Builder setError(@Nullable Throwable error);

    public abstract DecisionInfo build();
  }
}
