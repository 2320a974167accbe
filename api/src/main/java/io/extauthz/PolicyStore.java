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
 * Storage layer holding the policy set and the base documents it is evaluated against. Each check
 * call reads through its own transaction, so concurrent calls never share a transaction handle.
 */
public interface PolicyStore {

  /**
   * Opens a read transaction scoped to a single check call. Implementations may block while the
   * store serializes transaction acquisition.
   *
   * @param metrics the metrics of the call opening the transaction, for store level timers
   */
  Transaction newTransaction(DecisionMetrics metrics) throws StoreException;

  /**
   * Closes {@code transaction}, aborting it when {@code abort} is set and committing it otherwise.
   * A transaction is closed exactly once.
   */
  void close(Transaction transaction, boolean abort) throws StoreException;

  /** A handle to an isolated view of the store. */
  interface Transaction {
    /** Store assigned identifier, reported in decision logs. */
    long id();
  }
}
