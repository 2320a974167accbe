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

import java.util.Map;

/**
 * Compiles and executes policy queries. The policy language itself is opaque to the decision
 * pipeline; it only relies on this contract.
 */
public interface PolicyEngine {

  /**
   * Compiles {@code entryPoint} against the currently loaded policy set. The result is cached by
   * the caller and shared by concurrent calls until the policy set is recompiled.
   *
   * @param transaction the transaction of the call that triggered preparation
   */
  PreparedQuery prepare(EntryPoint entryPoint, PolicyStore.Transaction transaction)
      throws EvaluationException;

  /**
   * Converts an input document made of maps, lists, strings, numbers, booleans and nulls into the
   * representation {@link PreparedQuery#evaluate} accepts.
   */
  Object toValue(Map<String, ?> input) throws ConversionException;
}
