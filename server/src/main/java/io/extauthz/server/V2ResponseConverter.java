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

import io.envoyproxy.envoy.api.v2.core.HeaderValue;
import io.envoyproxy.envoy.api.v2.core.HeaderValueOption;
import io.envoyproxy.envoy.service.auth.v2.CheckResponse;
import io.envoyproxy.envoy.service.auth.v2.DeniedHttpResponse;
import io.envoyproxy.envoy.service.auth.v2.OkHttpResponse;
import io.envoyproxy.envoy.type.HttpStatus;
import java.util.ArrayList;
import java.util.List;

/**
 * Downgrades v3 check responses to the v2 wire shape.
 *
 * <p>v2 has no equivalent for {@code headers_to_remove}, {@code response_headers_to_add} or
 * {@code dynamic_metadata}; they are dropped.
 */
final class V2ResponseConverter {
  private V2ResponseConverter() {}

  static CheckResponse convert(io.envoyproxy.envoy.service.auth.v3.CheckResponse v3) {
    CheckResponse.Builder v2 = CheckResponse.newBuilder();
    if (v3.hasStatus()) {
      v2.setStatus(v3.getStatus());
    }
    switch (v3.getHttpResponseCase()) {
      case OK_RESPONSE:
        v2.setOkResponse(OkHttpResponse.newBuilder()
            .addAllHeaders(convertHeaders(v3.getOkResponse().getHeadersList())));
        break;
      case DENIED_RESPONSE:
        io.envoyproxy.envoy.service.auth.v3.DeniedHttpResponse denied =
            v3.getDeniedResponse();
        DeniedHttpResponse.Builder v2Denied = DeniedHttpResponse.newBuilder()
            .addAllHeaders(convertHeaders(denied.getHeadersList()))
            .setBody(denied.getBody());
        if (denied.hasStatus()) {
          v2Denied.setStatus(HttpStatus.newBuilder()
              .setCodeValue(denied.getStatus().getCodeValue()));
        }
        v2.setDeniedResponse(v2Denied);
        break;
      case HTTPRESPONSE_NOT_SET:
        break;
      default:
        throw new AssertionError(v3.getHttpResponseCase());
    }
    return v2.build();
  }

  // Only the key and value are carried over.
  private static List<HeaderValueOption> convertHeaders(
      List<io.envoyproxy.envoy.config.core.v3.HeaderValueOption> headers) {
    List<HeaderValueOption> converted = new ArrayList<>(headers.size());
    for (io.envoyproxy.envoy.config.core.v3.HeaderValueOption header : headers) {
      converted.add(HeaderValueOption.newBuilder()
          .setHeader(HeaderValue.newBuilder()
              .setKey(header.getHeader().getKey())
              .setValue(header.getHeader().getValue()))
          .build());
    }
    return converted;
  }
}
