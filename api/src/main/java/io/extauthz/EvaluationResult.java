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
import java.util.Map;
import javax.annotation.Nullable;

/** The outcome of evaluating a {@link PreparedQuery}. */
@AutoValue
public abstract class EvaluationResult {

  /**
   * Creates a result.
   *
   * @param decision the JSON-like decision value; {@code null} when the query is undefined
   * @param ndBuiltinCache results of non-deterministic builtins, when the engine records them
   */
  public static EvaluationResult create(
      @Nullable Object decision, @Nullable Map<String, ?> ndBuiltinCache) {
    return new AutoValue_EvaluationResult(decision, ndBuiltinCache);
  }

  /**
   * The decision: a boolean, a {@code Map<String, ?>}, or any other JSON-like value made of lists,
   * strings, numbers and nulls.
   */
  @Nullable
  public abstract Object decision();

  @Nullable
  public abstract Map<String, ?> ndBuiltinCache();
}
