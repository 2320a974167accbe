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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Struct;
import com.google.protobuf.util.JsonFormat;
import io.extauthz.DecisionInfo;
import io.extauthz.DecisionLogException;
import io.extauthz.DecisionLogger;
import io.extauthz.server.internal.ProtobufJsonConverter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes each decision as one line of JSON to the {@code io.extauthz.decisions} logger at
 * {@code INFO}.
 */
public final class LoggingDecisionLogger implements DecisionLogger {
  static final String LOGGER_NAME = "io.extauthz.decisions";

  private static final JsonFormat.Printer PRINTER =
      JsonFormat.printer().omittingInsignificantWhitespace();

  private final Logger logger;

  public LoggingDecisionLogger() {
    this(Logger.getLogger(LOGGER_NAME));
  }

  @VisibleForTesting
  LoggingDecisionLogger(Logger logger) {
    this.logger = checkNotNull(logger, "logger");
  }

  @Override
  public void logDecision(DecisionInfo info) throws DecisionLogException {
    if (!logger.isLoggable(Level.INFO)) {
      return;
    }
    String line;
    try {
      line = PRINTER.print(toStruct(info));
    } catch (IllegalArgumentException | InvalidProtocolBufferException e) {
      throw new DecisionLogException(
          "failed to encode decision " + info.decisionId() + ": " + e.getMessage(), e);
    }
    logger.log(Level.INFO, line);
  }

  @VisibleForTesting
  static Struct toStruct(DecisionInfo info) {
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("decision_id", info.decisionId());
    entry.put("timestamp", info.timestamp().toString());
    if (info.path() != null) {
      entry.put("path", info.path());
    }
    if (info.query() != null) {
      entry.put("query", info.query());
    }
    entry.put("txn_id", info.transactionId());
    if (info.input() != null) {
      entry.put("input", info.input());
    }
    if (info.decision() != null) {
      entry.put("result", info.decision());
    }
    if (info.ndBuiltinCache() != null) {
      entry.put("nd_builtin_cache", info.ndBuiltinCache());
    }
    entry.put("metrics", info.metrics());
    if (info.error() != null) {
      String message = info.error().getMessage();
      entry.put("error", message != null ? message : info.error().toString());
    }
    return ProtobufJsonConverter.convertToStruct(entry);
  }
}
