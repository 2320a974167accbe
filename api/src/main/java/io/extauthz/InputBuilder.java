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

import com.google.protobuf.Message;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Builds the policy input document from an incoming check request.
 */
public interface InputBuilder {

  /**
   * Converts {@code request}, a v2 or v3 {@code CheckRequest}, into a JSON-like document.
   *
   * @param descriptors registry used to decode binary request bodies, or {@code null} if none is
   *     configured
   * @param skipRequestBodyParse whether the request body is passed through unparsed
   */
  Map<String, Object> buildInput(Message request, @Nullable ProtoDescriptorRegistry descriptors,
      boolean skipRequestBodyParse) throws ConversionException;
}
