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
 * Audit sink receiving exactly one entry per check call that reached a store transaction.
 *
 * <p>A failure to record a decision is reported back to the caller of the check instead of the
 * decision itself, so implementations should only throw when the entry is truly lost.
 */
public interface DecisionLogger {

  void logDecision(DecisionInfo info) throws DecisionLogException;
}
