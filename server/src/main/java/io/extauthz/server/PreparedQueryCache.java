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

import io.extauthz.DecisionMetrics;
import io.extauthz.EntryPoint;
import io.extauthz.EvaluationException;
import io.extauthz.PolicyEngine;
import io.extauthz.PolicyStore;
import io.extauthz.PreparedQuery;
import javax.annotation.Nullable;

/**
 * Holds the entry point query compiled against the current policy set. The query is compiled
 * lazily by the first call that needs it and dropped whenever the policy set is recompiled.
 */
final class PreparedQueryCache {
  private final PolicyEngine engine;
  private final EntryPoint entryPoint;
  private final Object lock = new Object();

  // Must only be mutated while holding lock; read without it on the fast path.
  @Nullable
  private volatile PreparedQuery prepared;

  PreparedQueryCache(PolicyEngine engine, EntryPoint entryPoint) {
    this.engine = checkNotNull(engine, "engine");
    this.entryPoint = checkNotNull(entryPoint, "entryPoint");
  }

  /**
   * Returns the prepared query, compiling it in {@code transaction} if needed. Concurrent callers
   * wait for a compilation in progress instead of starting their own. A failed compilation is
   * not cached.
   */
  PreparedQuery get(PolicyStore.Transaction transaction, DecisionMetrics metrics)
      throws EvaluationException {
    PreparedQuery current = prepared;
    if (current != null) {
      return current;
    }
    synchronized (lock) {
      if (prepared == null) {
        DecisionMetrics.Timer timer = metrics.timer(DecisionMetrics.QUERY_PREPARE);
        timer.start();
        try {
          prepared = checkNotNull(
              engine.prepare(entryPoint, transaction), "engine returned null prepared query");
        } finally {
          timer.stop();
        }
      }
      return prepared;
    }
  }

  /** Drops the prepared query so that the next call compiles it again. */
  void invalidate() {
    synchronized (lock) {
      prepared = null;
    }
  }
}
