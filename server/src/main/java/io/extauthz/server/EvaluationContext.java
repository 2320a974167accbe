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
import static com.google.common.base.Preconditions.checkState;

import io.extauthz.DecisionMetrics;
import io.extauthz.PolicyStore;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * State of a single check call. Owned by the thread running the call and never shared.
 */
final class EvaluationContext {
  private final String decisionId;
  private final DecisionMetrics metrics;
  @Nullable
  private PolicyStore.Transaction transaction;
  @Nullable
  private Map<String, Object> input;
  @Nullable
  private Object decision;
  @Nullable
  private Map<String, ?> ndBuiltinCache;
  private boolean evaluationFailed;
  private boolean finished;

  EvaluationContext(String decisionId, DecisionMetrics metrics) {
    this.decisionId = checkNotNull(decisionId, "decisionId");
    this.metrics = checkNotNull(metrics, "metrics");
  }

  String decisionId() {
    return decisionId;
  }

  DecisionMetrics metrics() {
    return metrics;
  }

  PolicyStore.Transaction transaction() {
    checkState(transaction != null, "no transaction");
    return transaction;
  }

  void setTransaction(PolicyStore.Transaction transaction) {
    checkState(this.transaction == null, "transaction already set");
    this.transaction = checkNotNull(transaction, "transaction");
  }

  @Nullable
  Map<String, Object> input() {
    return input;
  }

  void setInput(Map<String, Object> input) {
    this.input = input;
  }

  @Nullable
  Object decision() {
    return decision;
  }

  @Nullable
  Map<String, ?> ndBuiltinCache() {
    return ndBuiltinCache;
  }

  void setResult(@Nullable Object decision, @Nullable Map<String, ?> ndBuiltinCache) {
    this.decision = decision;
    this.ndBuiltinCache = ndBuiltinCache;
  }

  /** Whether preparing or evaluating the query failed, which aborts the transaction. */
  boolean evaluationFailed() {
    return evaluationFailed;
  }

  void markEvaluationFailed() {
    evaluationFailed = true;
  }

  /** Marks the call finished. Fails if it already was. */
  void finish() {
    checkState(!finished, "decision %s already finished", decisionId);
    finished = true;
  }
}
