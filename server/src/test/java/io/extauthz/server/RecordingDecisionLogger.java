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

import static com.google.common.truth.Truth.assertThat;

import io.extauthz.DecisionInfo;
import io.extauthz.DecisionLogException;
import io.extauthz.DecisionLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class RecordingDecisionLogger implements DecisionLogger {
  private final List<DecisionInfo> entries = Collections.synchronizedList(new ArrayList<>());

  volatile DecisionLogException failure;

  @Override
  public void logDecision(DecisionInfo info) throws DecisionLogException {
    entries.add(info);
    if (failure != null) {
      throw failure;
    }
  }

  List<DecisionInfo> entries() {
    synchronized (entries) {
      return new ArrayList<>(entries);
    }
  }

  DecisionInfo onlyEntry() {
    List<DecisionInfo> snapshot = entries();
    assertThat(snapshot).hasSize(1);
    return snapshot.get(0);
  }
}
