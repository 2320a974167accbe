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

/**
 * A compiled entry point query, safe for concurrent evaluation.
 */
public interface PreparedQuery {

  /**
   * Evaluates the query against {@code input} inside {@code transaction}.
   *
   * @param input the value returned by {@link PolicyEngine#toValue}
   * @param transaction the transaction owned by the calling check
   * @param decisionId the identifier of the decision being computed
   * @param metrics per-call metrics the engine records its timers into
   * @param interQueryCache process wide cache of builtin results shared across calls
   * @return the decision and, if the engine tracks them, the non-deterministic builtin results
   */
  EvaluationResult evaluate(Object input, PolicyStore.Transaction transaction, String decisionId,
      DecisionMetrics metrics, BuiltinResultCache interQueryCache) throws EvaluationException;
}
