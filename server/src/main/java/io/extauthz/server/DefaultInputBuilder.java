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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.MethodDescriptor;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import io.envoyproxy.envoy.service.auth.v2.AttributeContext;
import io.extauthz.ConversionException;
import io.extauthz.InputBuilder;
import io.extauthz.ProtoDescriptorRegistry;
import io.grpc.internal.JsonParser;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Builds the policy input from a v2 or v3 {@code CheckRequest}.
 *
 * <p>The input is the JSON rendering of the request (protobuf JSON names for v3, proto field
 * names for v2) with these additions:
 * <ul>
 *   <li>{@code version}: the protocol version and encoding of the rendering</li>
 *   <li>{@code parsed_path}: the request path split into unescaped segments</li>
 *   <li>{@code parsed_query}: the query parameters, each mapped to the list of its values</li>
 *   <li>{@code parsed_body} and {@code truncated_body}: the decoded request body, unless body
 *       parsing is skipped</li>
 * </ul>
 */
public final class DefaultInputBuilder implements InputBuilder {
  private static final Logger logger = Logger.getLogger(DefaultInputBuilder.class.getName());

  public static final DefaultInputBuilder INSTANCE = new DefaultInputBuilder();

  static final ImmutableMap<String, String> V3_VERSION =
      ImmutableMap.of("ext_authz", "v3", "encoding", "protojson");
  static final ImmutableMap<String, String> V2_VERSION =
      ImmutableMap.of("ext_authz", "v2", "encoding", "encoding/json");

  private static final String CONTENT_TYPE = "content-type";
  private static final String CONTENT_LENGTH = "content-length";
  private static final int GRPC_FRAME_HEADER_LENGTH = 5;

  private static final JsonFormat.Printer V3_PRINTER =
      JsonFormat.printer().omittingInsignificantWhitespace();
  private static final JsonFormat.Printer V2_PRINTER =
      JsonFormat.printer().preservingProtoFieldNames().omittingInsignificantWhitespace();

  private DefaultInputBuilder() {}

  @Override
  public Map<String, Object> buildInput(Message request,
      @Nullable ProtoDescriptorRegistry descriptors, boolean skipRequestBodyParse)
      throws ConversionException {
    String path;
    String body;
    Map<String, String> headers;
    ByteString rawBody;
    JsonFormat.Printer printer;
    ImmutableMap<String, String> version;
    if (request instanceof io.envoyproxy.envoy.service.auth.v3.CheckRequest) {
      io.envoyproxy.envoy.service.auth.v3.AttributeContext.HttpRequest http =
          ((io.envoyproxy.envoy.service.auth.v3.CheckRequest) request)
              .getAttributes().getRequest().getHttp();
      path = http.getPath();
      body = http.getBody();
      headers = http.getHeadersMap();
      rawBody = http.getRawBody();
      printer = V3_PRINTER;
      version = V3_VERSION;
    } else if (request instanceof io.envoyproxy.envoy.service.auth.v2.CheckRequest) {
      AttributeContext.HttpRequest http =
          ((io.envoyproxy.envoy.service.auth.v2.CheckRequest) request)
              .getAttributes().getRequest().getHttp();
      path = http.getPath();
      body = http.getBody();
      headers = http.getHeadersMap();
      rawBody = ByteString.EMPTY;
      printer = V2_PRINTER;
      version = V2_VERSION;
    } else {
      throw new ConversionException(
          "unsupported request type " + request.getDescriptorForType().getFullName());
    }

    Map<String, Object> input;
    try {
      input = new LinkedHashMap<>(parseObject(printer.print(request)));
    } catch (InvalidProtocolBufferException e) {
      throw new ConversionException("failed to render request: " + e.getMessage(), e);
    }
    input.put("version", version);

    String rawQuery = "";
    int fragment = path.indexOf('#');
    if (fragment >= 0) {
      path = path.substring(0, fragment);
    }
    int queryStart = path.indexOf('?');
    if (queryStart >= 0) {
      rawQuery = path.substring(queryStart + 1);
      path = path.substring(0, queryStart);
    }
    List<Object> parsedPath = parsePath(path);
    input.put("parsed_path", parsedPath);
    input.put("parsed_query", parseQuery(rawQuery, false));

    if (!skipRequestBodyParse) {
      ParsedBody parsedBody = parseBody(headers, body, rawBody, parsedPath, descriptors);
      input.put("parsed_body", parsedBody.body);
      input.put("truncated_body", parsedBody.truncated);
    }
    return input;
  }

  /** Unescapes the path and splits it on {@code /} after dropping leading slashes. */
  @VisibleForTesting
  static List<Object> parsePath(String rawPath) throws ConversionException {
    String decoded;
    try {
      decoded = URLDecoder.decode(rawPath.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      throw new ConversionException("invalid request path " + rawPath + ": " + e.getMessage(), e);
    }
    int start = 0;
    while (start < decoded.length() && decoded.charAt(start) == '/') {
      start++;
    }
    return new ArrayList<Object>(Splitter.on('/').splitToList(decoded.substring(start)));
  }

  /**
   * Parses {@code a=1&b=2&a=3} into {@code {"a": ["1", "3"], "b": ["2"]}}. Malformed pairs are
   * skipped, unless {@code strict} is set.
   */
  @VisibleForTesting
  static Map<String, Object> parseQuery(String rawQuery, boolean strict)
      throws ConversionException {
    Map<String, Object> parsed = new LinkedHashMap<>();
    for (String pair : Splitter.on('&').omitEmptyStrings().split(rawQuery)) {
      int equals = pair.indexOf('=');
      String key;
      String value;
      try {
        if (pair.indexOf(';') >= 0) {
          throw new IllegalArgumentException("invalid semicolon separator in query");
        }
        key = URLDecoder.decode(equals < 0 ? pair : pair.substring(0, equals),
            StandardCharsets.UTF_8);
        value = equals < 0 ? "" : URLDecoder.decode(pair.substring(equals + 1),
            StandardCharsets.UTF_8);
      } catch (IllegalArgumentException e) {
        if (strict) {
          throw new ConversionException("invalid query " + rawQuery + ": " + e.getMessage(), e);
        }
        continue;
      }
      @SuppressWarnings("unchecked")
      List<Object> values = (List<Object>) parsed.get(key);
      if (values == null) {
        values = new ArrayList<>();
        parsed.put(key, values);
      }
      values.add(value);
    }
    return parsed;
  }

  private static ParsedBody parseBody(Map<String, String> headers, String body,
      ByteString rawBody, List<Object> parsedPath, @Nullable ProtoDescriptorRegistry descriptors)
      throws ConversionException {
    String contentType = headers.get(CONTENT_TYPE);
    if (contentType == null) {
      return ParsedBody.of(new LinkedHashMap<String, Object>());
    }
    if (contentType.contains("application/json")) {
      String payload = !body.isEmpty() ? body : rawBody.toStringUtf8();
      if (payload.isEmpty()) {
        return ParsedBody.of(null);
      }
      if (isTruncated(headers, payload.getBytes(StandardCharsets.UTF_8).length)) {
        return ParsedBody.TRUNCATED;
      }
      return ParsedBody.of(parseJson(payload));
    }
    if (contentType.contains("application/x-www-form-urlencoded")) {
      String payload = !body.isEmpty() ? body : rawBody.toStringUtf8();
      if (payload.isEmpty()) {
        return ParsedBody.of(null);
      }
      if (isTruncated(headers, payload.getBytes(StandardCharsets.UTF_8).length)) {
        return ParsedBody.TRUNCATED;
      }
      return ParsedBody.of(parseQuery(payload, true));
    }
    if (contentType.contains("application/grpc")) {
      if (descriptors == null) {
        return ParsedBody.of(null);
      }
      // Set only when the proxy packs the body as bytes.
      if (rawBody.isEmpty()) {
        logger.log(Level.FINE, "no raw_body field sent");
        return ParsedBody.of(null);
      }
      // A call of method M on service S is a POST to /S/M.
      if (parsedPath.size() != 2) {
        throw new ConversionException("invalid parsed path");
      }
      return parseGrpcBody(rawBody, (String) parsedPath.get(0), (String) parsedPath.get(1),
          descriptors);
    }
    return ParsedBody.of(new LinkedHashMap<String, Object>());
  }

  private static boolean isTruncated(Map<String, String> headers, long bodyLength)
      throws ConversionException {
    String contentLength = headers.get(CONTENT_LENGTH);
    if (contentLength == null) {
      return false;
    }
    long declared;
    try {
      declared = Long.parseLong(contentLength);
    } catch (NumberFormatException e) {
      throw new ConversionException("invalid content-length " + contentLength, e);
    }
    return declared != -1 && declared > bodyLength;
  }

  /** Decodes the first message of a gRPC length-prefixed body. */
  private static ParsedBody parseGrpcBody(ByteString rawBody, String service, String method,
      ProtoDescriptorRegistry descriptors) throws ConversionException {
    if (rawBody.size() < GRPC_FRAME_HEADER_LENGTH) {
      throw new ConversionException("less than 5 bytes");
    }
    if (rawBody.byteAt(0) == 1) {
      logger.log(Level.FINE, "gRPC payload compression not supported");
      return ParsedBody.of(null);
    }
    long size = ((rawBody.byteAt(1) & 0xFFL) << 24)
        | ((rawBody.byteAt(2) & 0xFFL) << 16)
        | ((rawBody.byteAt(3) & 0xFFL) << 8)
        | (rawBody.byteAt(4) & 0xFFL);
    if (size > rawBody.size() - GRPC_FRAME_HEADER_LENGTH) {
      return ParsedBody.TRUNCATED;
    }
    MethodDescriptor methodDescriptor = descriptors.findMethod(service + "." + method);
    if (methodDescriptor == null) {
      logger.log(Level.FINE, "could not find method {0}/{1}", new Object[] {service, method});
      return ParsedBody.of(null);
    }
    ByteString message = rawBody.substring(
        GRPC_FRAME_HEADER_LENGTH, GRPC_FRAME_HEADER_LENGTH + (int) size);
    try {
      DynamicMessage decoded = DynamicMessage.parseFrom(methodDescriptor.getInputType(), message);
      return ParsedBody.of(parseObject(V3_PRINTER.print(decoded)));
    } catch (InvalidProtocolBufferException e) {
      throw new ConversionException("failed to decode gRPC body: " + e.getMessage(), e);
    }
  }

  /** Parses any JSON value, returning {@code null} for a JSON null. */
  @Nullable
  private static Object parseJson(String json) throws ConversionException {
    try {
      return JsonParser.parse(json);
    } catch (IOException | RuntimeException e) {
      throw new ConversionException("invalid JSON: " + e.getMessage(), e);
    }
  }

  private static Map<String, ?> parseObject(String json) throws ConversionException {
    Object parsed = parseJson(json);
    if (!(parsed instanceof Map)) {
      throw new ConversionException("expected a JSON object but got " + JsonTypes.nameOf(parsed));
    }
    @SuppressWarnings("unchecked")
    Map<String, ?> object = (Map<String, ?>) parsed;
    return object;
  }

  private static final class ParsedBody {
    static final ParsedBody TRUNCATED = new ParsedBody(null, true);

    @Nullable
    final Object body;
    final boolean truncated;

    private ParsedBody(@Nullable Object body, boolean truncated) {
      this.body = body;
      this.truncated = truncated;
    }

    static ParsedBody of(@Nullable Object body) {
      return new ParsedBody(body, false);
    }
  }
}
