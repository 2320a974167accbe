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

import com.google.common.collect.ImmutableList;
import com.google.protobuf.BoolValue;
import com.google.protobuf.Struct;
import com.google.rpc.Code;
import io.envoyproxy.envoy.config.core.v3.HeaderValue;
import io.envoyproxy.envoy.config.core.v3.HeaderValueOption;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.envoyproxy.envoy.service.auth.v3.DeniedHttpResponse;
import io.envoyproxy.envoy.service.auth.v3.OkHttpResponse;
import io.envoyproxy.envoy.type.v3.HttpStatus;
import io.envoyproxy.envoy.type.v3.StatusCode;
import io.extauthz.server.internal.ProtobufJsonConverter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Turns a policy decision into the v3 {@link CheckResponse} returned to the proxy.
 *
 * <p>A boolean decision only sets the status. A mapping decision may additionally carry:
 * <ul>
 *   <li>{@code headers}: headers added to the upstream request on allow, or to the denial</li>
 *   <li>{@code request_headers_to_remove}: upstream request headers stripped on allow</li>
 *   <li>{@code response_headers_to_add}: headers added to the downstream response on allow</li>
 *   <li>{@code body} and {@code http_status}: the denial sent to the downstream client</li>
 *   <li>{@code dynamic_metadata}: passed to the next filter in the proxy</li>
 * </ul>
 */
public interface CheckResponseTranslator {

  /** The default translator. */
  CheckResponseTranslator INSTANCE = new TranslatorImpl();

  /**
   * Builds the response for {@code decision}.
   *
   * @param decision the raw decision value computed by the policy
   * @throws DecisionException with reason {@link DecisionException.Reason#RESPONSE_SHAPING} if the
   *     decision is a mapping whose entries have the wrong shape
   */
  CheckResponse translate(@Nullable Object decision) throws DecisionException;

  /**
   * Forces {@code response} to an allow with an empty ok response, unless it already allows.
   */
  static CheckResponse applyDryRun(CheckResponse response) {
    if (response.getStatus().getCode() == Code.OK_VALUE) {
      return response;
    }
    return response.toBuilder()
        .setStatus(com.google.rpc.Status.newBuilder().setCode(Code.OK_VALUE))
        .setOkResponse(OkHttpResponse.getDefaultInstance())
        .build();
  }

  /** Default implementation of {@link CheckResponseTranslator}. */
  static final class TranslatorImpl implements CheckResponseTranslator {
    static final String HEADERS = "headers";
    static final String REQUEST_HEADERS_TO_REMOVE = "request_headers_to_remove";
    static final String RESPONSE_HEADERS_TO_ADD = "response_headers_to_add";
    static final String BODY = "body";
    static final String HTTP_STATUS = "http_status";
    static final String DYNAMIC_METADATA = "dynamic_metadata";

    private TranslatorImpl() {}

    @Override
    public CheckResponse translate(@Nullable Object decision) throws DecisionException {
      DecisionValue value = DecisionValue.of(decision);
      boolean allowed = value.isAllowed();
      CheckResponse.Builder response = CheckResponse.newBuilder()
          .setStatus(com.google.rpc.Status.newBuilder()
              .setCode(allowed ? Code.OK_VALUE : Code.PERMISSION_DENIED_VALUE));
      if (value.getKind() != DecisionValue.Kind.STRUCTURED) {
        return response.build();
      }
      Map<String, Object> fields = value.structured();

      List<HeaderValueOption> headers;
      try {
        headers = toHeaderValueOptions(HEADERS, fields.get(HEADERS));
      } catch (IllegalArgumentException e) {
        throw shapingError("failed to get response headers", e);
      }

      try {
        Struct dynamicMetadata = dynamicMetadata(fields);
        if (dynamicMetadata != null) {
          response.setDynamicMetadata(dynamicMetadata);
        }
      } catch (IllegalArgumentException e) {
        throw shapingError("failed to get dynamic metadata", e);
      }

      if (allowed) {
        OkHttpResponse.Builder ok = OkHttpResponse.newBuilder().addAllHeaders(headers);
        try {
          ok.addAllHeadersToRemove(headersToRemove(fields));
        } catch (IllegalArgumentException e) {
          throw shapingError("failed to get request headers to remove", e);
        }
        try {
          ok.addAllResponseHeadersToAdd(toHeaderValueOptions(
              RESPONSE_HEADERS_TO_ADD, fields.get(RESPONSE_HEADERS_TO_ADD)));
        } catch (IllegalArgumentException e) {
          throw shapingError("failed to get response headers to send to client", e);
        }
        response.setOkResponse(ok);
      } else {
        DeniedHttpResponse.Builder denied = DeniedHttpResponse.newBuilder().addAllHeaders(headers);
        try {
          denied.setBody(body(fields));
        } catch (IllegalArgumentException e) {
          throw shapingError("failed to get response body", e);
        }
        try {
          denied.setStatus(httpStatus(fields));
        } catch (IllegalArgumentException e) {
          throw shapingError("failed to get response http status", e);
        }
        response.setDeniedResponse(denied);
      }
      return response.build();
    }

    private static DecisionException shapingError(String context, IllegalArgumentException e) {
      return new DecisionException(
          DecisionException.Reason.RESPONSE_SHAPING, context + ": " + e.getMessage(), e);
    }

    /**
     * Accepts an object, or an array of objects, mapping each header name to a string or an
     * array of strings. Values of the same header are grouped in order of appearance and the
     * first value of each header replaces any existing value instead of being appended.
     */
    static List<HeaderValueOption> toHeaderValueOptions(String key, @Nullable Object raw) {
      if (raw == null) {
        return ImmutableList.of();
      }
      Map<String, List<String>> grouped = new LinkedHashMap<>();
      if (raw instanceof List) {
        for (Object element : (List<?>) raw) {
          if (!(element instanceof Map)) {
            throw new IllegalArgumentException(String.format(
                "type assertion error, expected %s to be of type 'object' but got '%s'",
                key, JsonTypes.nameOf(element)));
          }
          collectHeaders((Map<?, ?>) element, grouped);
        }
      } else if (raw instanceof Map) {
        collectHeaders((Map<?, ?>) raw, grouped);
      } else {
        throw new IllegalArgumentException(String.format(
            "type assertion error, expected %s to be of type 'object' but got '%s'",
            key, JsonTypes.nameOf(raw)));
      }

      List<HeaderValueOption> options = new ArrayList<>();
      for (Map.Entry<String, List<String>> entry : grouped.entrySet()) {
        boolean first = true;
        for (String headerValue : entry.getValue()) {
          HeaderValueOption.Builder option = HeaderValueOption.newBuilder()
              .setHeader(HeaderValue.newBuilder().setKey(entry.getKey()).setValue(headerValue));
          if (first) {
            option.setAppend(BoolValue.of(false));
            first = false;
          }
          options.add(option.build());
        }
      }
      return options;
    }

    private static void collectHeaders(Map<?, ?> headers, Map<String, List<String>> grouped) {
      for (Map.Entry<?, ?> entry : headers.entrySet()) {
        String name = String.valueOf(entry.getKey());
        Object value = entry.getValue();
        List<String> values = grouped.get(name);
        if (values == null) {
          values = new ArrayList<>();
        }
        if (value instanceof String) {
          values.add((String) value);
        } else if (value instanceof List) {
          for (Object element : (List<?>) value) {
            if (!(element instanceof String)) {
              throw new IllegalArgumentException(
                  String.format("invalid value type for header '%s'", name));
            }
            values.add((String) element);
          }
        } else {
          throw new IllegalArgumentException(
              String.format("type assertion error for header '%s'", name));
        }
        if (!values.isEmpty()) {
          grouped.put(name, values);
        }
      }
    }

    private static List<String> headersToRemove(Map<String, Object> fields) {
      Object raw = fields.get(REQUEST_HEADERS_TO_REMOVE);
      if (raw == null) {
        return ImmutableList.of();
      }
      if (!(raw instanceof List)) {
        throw new IllegalArgumentException(String.format(
            "type assertion error, expected request_headers_to_remove to be of type 'array' "
                + "but got '%s'", JsonTypes.nameOf(raw)));
      }
      List<String> names = new ArrayList<>();
      for (Object element : (List<?>) raw) {
        if (!(element instanceof String)) {
          throw new IllegalArgumentException(String.format(
              "type assertion error, expected request_headers_to_remove value to be of type "
                  + "'string' but got '%s'", JsonTypes.nameOf(element)));
        }
        names.add((String) element);
      }
      return names;
    }

    private static String body(Map<String, Object> fields) {
      Object raw = fields.get(BODY);
      if (raw == null) {
        return "";
      }
      if (!(raw instanceof String)) {
        throw new IllegalArgumentException(String.format(
            "type assertion error, expected body to be of type 'string' but got '%s'",
            JsonTypes.nameOf(raw)));
      }
      return (String) raw;
    }

    private static HttpStatus httpStatus(Map<String, Object> fields) {
      Object raw = fields.get(HTTP_STATUS);
      if (raw == null) {
        return HttpStatus.newBuilder().setCode(StatusCode.Forbidden).build();
      }
      if (!(raw instanceof Number)) {
        throw new IllegalArgumentException(String.format(
            "type assertion error, expected http_status to be of type 'number' but got '%s'",
            JsonTypes.nameOf(raw)));
      }
      double number = ((Number) raw).doubleValue();
      int code = (int) number;
      if (code != number) {
        throw new IllegalArgumentException("error converting JSON number to int: " + raw);
      }
      StatusCode statusCode = StatusCode.forNumber(code);
      if (statusCode == null) {
        throw new IllegalArgumentException("Invalid HTTP status code " + code);
      }
      return HttpStatus.newBuilder().setCode(statusCode).build();
    }

    @Nullable
    private static Struct dynamicMetadata(Map<String, Object> fields) {
      Object raw = fields.get(DYNAMIC_METADATA);
      if (raw == null) {
        return null;
      }
      if (!(raw instanceof Map)) {
        throw new IllegalArgumentException(String.format(
            "type assertion error, expected dynamic_metadata to be of type 'object' but got '%s'",
            JsonTypes.nameOf(raw)));
      }
      return ProtobufJsonConverter.convertToStruct((Map<?, ?>) raw);
    }
  }
}
