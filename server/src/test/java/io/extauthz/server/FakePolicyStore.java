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

import io.extauthz.DecisionMetrics;
import io.extauthz.PolicyStore;
import io.extauthz.StoreException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** A {@link PolicyStore} that records how each transaction was closed. */
final class FakePolicyStore implements PolicyStore {
  private final AtomicLong nextId = new AtomicLong(1);
  private final List<FakeTransaction> opened = Collections.synchronizedList(new ArrayList<>());
  private final Map<Long, Boolean> closed = Collections.synchronizedMap(new LinkedHashMap<>());

  volatile StoreException newTransactionFailure;
  volatile StoreException closeFailure;
  volatile RuntimeException closeCrash;

  @Override
  public Transaction newTransaction(DecisionMetrics metrics) throws StoreException {
    if (newTransactionFailure != null) {
      throw newTransactionFailure;
    }
    FakeTransaction transaction = new FakeTransaction(nextId.getAndIncrement());
    opened.add(transaction);
    return transaction;
  }

  @Override
  public void close(Transaction transaction, boolean abort) throws StoreException {
    if (closed.put(transaction.id(), abort) != null) {
      throw new AssertionError("transaction " + transaction.id() + " closed twice");
    }
    if (closeFailure != null) {
      throw closeFailure;
    }
    if (closeCrash != null) {
      throw closeCrash;
    }
  }

  List<FakeTransaction> opened() {
    synchronized (opened) {
      return new ArrayList<>(opened);
    }
  }

  /** Transaction id to the abort flag it was closed with. */
  Map<Long, Boolean> closed() {
    synchronized (closed) {
      return new LinkedHashMap<>(closed);
    }
  }

  static final class FakeTransaction implements Transaction {
    private final long id;

    FakeTransaction(long id) {
      this.id = id;
    }

    @Override
    public long id() {
      return id;
    }
  }
}
