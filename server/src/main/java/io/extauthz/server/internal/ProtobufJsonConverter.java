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

package io.extauthz.server.internal;

import com.google.protobuf.ListValue;
import com.google.protobuf.NullValue;
import com.google.protobuf.Struct;
import com.google.protobuf.Value;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Converts JSON-like Java values made of maps, lists, strings, numbers, booleans and nulls to
 * protobuf {@link Struct} and {@link Value}.
 */
public final class ProtobufJsonConverter {
  private ProtobufJsonConverter() {}

  /**
   * Converts a JSON-like mapping to a {@link Struct}. Numbers become doubles.
   *
   * @throws IllegalArgumentException if a key is not a string or a value is not JSON-like
   */
  public static Struct convertToStruct(Map<?, ?> json) {
    Struct.Builder struct = Struct.newBuilder();
    for (Map.Entry<?, ?> entry : json.entrySet()) {
      if (!(entry.getKey() instanceof String)) {
        throw new IllegalArgumentException("invalid key type " + entry.getKey());
      }
      struct.putFields((String) entry.getKey(), convertToValue(entry.getValue()));
    }
    return struct.build();
  }

  /**
   * Converts a JSON-like value to a {@link Value}.
   *
   * @throws IllegalArgumentException if {@code json} is not JSON-like
   */
  public static Value convertToValue(@Nullable Object json) {
    if (json == null) {
      return Value.newBuilder().setNullValue(NullValue.NULL_VALUE).build();
    }
    if (json instanceof Boolean) {
      return Value.newBuilder().setBoolValue((Boolean) json).build();
    }
    if (json instanceof Number) {
      return Value.newBuilder().setNumberValue(((Number) json).doubleValue()).build();
    }
    if (json instanceof String) {
      return Value.newBuilder().setStringValue((String) json).build();
    }
    if (json instanceof Map) {
      return Value.newBuilder().setStructValue(convertToStruct((Map<?, ?>) json)).build();
    }
    if (json instanceof Iterable) {
      ListValue.Builder list = ListValue.newBuilder();
      for (Object element : (Iterable<?>) json) {
        list.addValues(convertToValue(element));
      }
      return Value.newBuilder().setListValue(list).build();
    }
    throw new IllegalArgumentException("invalid value type " + json.getClass().getName());
  }
}
