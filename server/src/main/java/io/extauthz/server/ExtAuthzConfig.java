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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.base.Strings;
import io.extauthz.EntryPoint;
import io.extauthz.ProtoDescriptorRegistry;
import io.grpc.internal.JsonParser;
import io.grpc.internal.JsonUtil;
import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Configuration of the external authorization plugin. Instances are immutable; the entry point
 * is resolved once when the configuration is built and reused by every check call.
 */
@AutoValue
public abstract class ExtAuthzConfig {

  static final String DEFAULT_ADDRESS = ":9191";
  static final String DEFAULT_PATH = "envoy/authz/allow";
  // Same as the grpc-java server default.
  static final int DEFAULT_MAX_RECEIVE_MESSAGE_SIZE = 4 * 1024 * 1024;
  static final int DEFAULT_MAX_SEND_MESSAGE_SIZE = Integer.MAX_VALUE;

  /** Creates a builder populated with the defaults. */
  public static Builder builder() {
    return new AutoValue_ExtAuthzConfig.Builder()
        .setAddress(DEFAULT_ADDRESS)
        .setDryRun(false)
        .setEnableReflection(false)
        .setSkipRequestBodyParse(false)
        .setEnablePerformanceMetrics(false)
        .setMaxReceiveMessageSize(DEFAULT_MAX_RECEIVE_MESSAGE_SIZE)
        .setMaxSendMessageSize(DEFAULT_MAX_SEND_MESSAGE_SIZE);
  }

  /**
   * Parses the JSON plugin configuration. Absent keys keep their defaults and unknown keys are
   * ignored. An empty document yields the default configuration.
   *
   * @throws ExtAuthzConfigException if the document is malformed, both {@code path} and
   *     {@code query} are set, the entry point does not parse, or the descriptor set named by
   *     {@code proto-descriptor} cannot be loaded
   */
  public static ExtAuthzConfig fromJson(@Nullable String json) throws ExtAuthzConfigException {
    if (json == null || json.trim().isEmpty()) {
      return builder().build();
    }
    Object parsed;
    try {
      parsed = JsonParser.parse(json);
    } catch (IOException | RuntimeException e) {
      throw new ExtAuthzConfigException("invalid config: " + e.getMessage(), e);
    }
    if (!(parsed instanceof Map)) {
      throw new ExtAuthzConfigException(
          "invalid config: expected a JSON object but got "
              + (parsed == null ? "null" : parsed.getClass().getSimpleName()));
    }
    @SuppressWarnings("unchecked")
    Map<String, ?> raw = (Map<String, ?>) parsed;
    Builder builder = builder();
    try {
      String address = JsonUtil.getString(raw, "addr");
      if (address != null) {
        builder.setAddress(address);
      }
      builder.setPath(Strings.emptyToNull(JsonUtil.getString(raw, "path")));
      builder.setQuery(Strings.emptyToNull(JsonUtil.getString(raw, "query")));
      Boolean dryRun = JsonUtil.getBoolean(raw, "dry-run");
      if (dryRun != null) {
        builder.setDryRun(dryRun);
      }
      Boolean enableReflection = JsonUtil.getBoolean(raw, "enable-reflection");
      if (enableReflection != null) {
        builder.setEnableReflection(enableReflection);
      }
      Boolean skipBodyParse = JsonUtil.getBoolean(raw, "skip-request-body-parse");
      if (skipBodyParse != null) {
        builder.setSkipRequestBodyParse(skipBodyParse);
      }
      Boolean enableMetrics = JsonUtil.getBoolean(raw, "enable-performance-metrics");
      if (enableMetrics != null) {
        builder.setEnablePerformanceMetrics(enableMetrics);
      }
      Integer maxReceive = JsonUtil.getNumberAsInteger(raw, "grpc-max-recv-msg-size");
      if (maxReceive != null) {
        builder.setMaxReceiveMessageSize(maxReceive);
      }
      Integer maxSend = JsonUtil.getNumberAsInteger(raw, "grpc-max-send-msg-size");
      if (maxSend != null) {
        builder.setMaxSendMessageSize(maxSend);
      }
      builder.setProtoDescriptor(
          Strings.emptyToNull(JsonUtil.getString(raw, "proto-descriptor")));
    } catch (ClassCastException e) {
      throw new ExtAuthzConfigException("invalid config: " + e.getMessage(), e);
    }

    String protoDescriptor = builder.protoDescriptor();
    if (protoDescriptor != null) {
      try {
        builder.setDescriptors(ProtoDescriptorRegistry.readFrom(Paths.get(protoDescriptor)));
      } catch (IOException e) {
        throw new ExtAuthzConfigException(
            "failed to load proto descriptor " + protoDescriptor + ": " + e.getMessage(), e);
      }
    }
    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new ExtAuthzConfigException(e.getMessage(), e);
    }
  }

  /**
   * Listen address: {@code host:port}, {@code grpc://host:port}, {@code unix:///path/to/socket}
   * or {@code unix://@abstract-name}.
   */
  public abstract String address();

  /**
   * Slash separated path of the decision document. Set to the default when neither a path nor a
   * query is configured.
   */
  @Nullable
  public abstract String path();

  /** Reference expression of the decision document. Deprecated in favor of {@link #path()}. */
  @Nullable
  public abstract String query();

  /** The entry point resolved from {@link #path()} or {@link #query()}. */
  public abstract EntryPoint entryPoint();

  /** Whether every check is answered with an allow, while the true decision is still logged. */
  public abstract boolean dryRun();

  public abstract boolean enableReflection();

  /** Whether request bodies are passed to the policy unparsed. */
  public abstract boolean skipRequestBodyParse();

  /** Whether the per-call latency histogram is recorded. */
  public abstract boolean enablePerformanceMetrics();

  public abstract int maxReceiveMessageSize();

  public abstract int maxSendMessageSize();

  /** File system path of the descriptor set, if one is configured. */
  @Nullable
  public abstract String protoDescriptor();

  /** The loaded descriptor set, used to decode {@code application/grpc} request bodies. */
  @Nullable
  public abstract ProtoDescriptorRegistry descriptors();

  public abstract Builder toBuilder();

  /** Builder for {@link ExtAuthzConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setAddress(String address);

    public abstract Builder setPath(@Nullable String path);

    public abstract Builder setQuery(@Nullable String query);

    public abstract Builder setDryRun(boolean dryRun);

    public abstract Builder setEnableReflection(boolean enableReflection);

    public abstract Builder setSkipRequestBodyParse(boolean skipRequestBodyParse);

    public abstract Builder setEnablePerformanceMetrics(boolean enablePerformanceMetrics);

    public abstract Builder setMaxReceiveMessageSize(int maxReceiveMessageSize);

    public abstract Builder setMaxSendMessageSize(int maxSendMessageSize);

    public abstract Builder setProtoDescriptor(@Nullable String protoDescriptor);

    public abstract Builder setDescriptors(@Nullable ProtoDescriptorRegistry descriptors);

    abstract Builder setEntryPoint(EntryPoint entryPoint);

    @Nullable
    abstract String path();

    @Nullable
    abstract String query();

    @Nullable
    abstract String protoDescriptor();

    abstract ExtAuthzConfig autoBuild();

    /**
     * Validates the settings and resolves the entry point.
     *
     * @throws IllegalArgumentException if both a path and a query are set, the query does not
     *     parse, or a message size limit is not positive
     */
    public ExtAuthzConfig build() {
      String path = path();
      String query = query();
      if (!Strings.isNullOrEmpty(path) && !Strings.isNullOrEmpty(query)) {
        throw new IllegalArgumentException(
            "invalid config: specify a value for only the \"path\" field");
      }
      EntryPoint entryPoint;
      if (!Strings.isNullOrEmpty(query)) {
        entryPoint = EntryPoint.parse(query);
      } else {
        if (Strings.isNullOrEmpty(path)) {
          path = DEFAULT_PATH;
          setPath(path);
        }
        entryPoint = EntryPoint.fromPath(path);
      }
      setEntryPoint(entryPoint);
      ExtAuthzConfig config = autoBuild();
      checkArgument(config.maxReceiveMessageSize() > 0,
          "grpc-max-recv-msg-size must be positive: %s", config.maxReceiveMessageSize());
      checkArgument(config.maxSendMessageSize() > 0,
          "grpc-max-send-msg-size must be positive: %s", config.maxSendMessageSize());
      return config;
    }
  }
}
