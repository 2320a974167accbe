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

import com.google.auto.value.AutoOneOf;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * The shape of a policy decision, as far as the response translator is concerned: a plain
 * boolean, a mapping that may carry response mutations, or anything else.
 */
@AutoOneOf(DecisionValue.Kind.class)
abstract class DecisionValue {

  /** Key of the allow bit in a structured decision. */
  static final String ALLOWED_KEY = "allowed";

  enum Kind {
    SCALAR,
    STRUCTURED,
    OTHER,
  }

  abstract Kind getKind();

  abstract Boolean scalar();

  /** Insertion ordered view of the decision mapping. Values may be {@code null}. */
  abstract Map<String, Object> structured();

  abstract void other();

  static DecisionValue of(@Nullable Object decision) {
    if (decision instanceof Boolean) {
      return AutoOneOf_DecisionValue.scalar((Boolean) decision);
    }
    if (decision instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) decision).entrySet()) {
        if (!(entry.getKey() instanceof String)) {
          return AutoOneOf_DecisionValue.other();
        }
        copy.put((String) entry.getKey(), entry.getValue());
      }
      return AutoOneOf_DecisionValue.structured(Collections.unmodifiableMap(copy));
    }
    return AutoOneOf_DecisionValue.other();
  }

  /**
   * Returns the allow bit. Decisions that are neither a boolean nor a mapping deny.
   *
   * @throws DecisionException if a mapping lacks a boolean {@code allowed} entry
   */
  boolean isAllowed() throws DecisionException {
    switch (getKind()) {
      case SCALAR:
        return scalar();
      case STRUCTURED:
        if (!structured().containsKey(ALLOWED_KEY)) {
          throw shapingError(
              "unable to determine evaluation result due to missing \"allowed\" key");
        }
        Object allowed = structured().get(ALLOWED_KEY);
        if (!(allowed instanceof Boolean)) {
          throw shapingError(String.format(
              "type assertion error, expected decision to be of type 'boolean' but got '%s'",
              JsonTypes.nameOf(allowed)));
        }
        return (Boolean) allowed;
      case OTHER:
        return false;
      default:
        throw new AssertionError(getKind());
    }
  }

  private static DecisionException shapingError(String message) {
    return new DecisionException(
        DecisionException.Reason.RESPONSE_SHAPING, "failed to get response status: " + message);
  }
}
