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

import com.google.common.base.Supplier;
import com.google.common.base.Ticker;
import com.google.protobuf.Message;
import com.google.rpc.Code;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.extauthz.BuiltinResultCache;
import io.extauthz.ConversionException;
import io.extauthz.DecisionInfo;
import io.extauthz.DecisionLogException;
import io.extauthz.DecisionLogger;
import io.extauthz.DecisionMetrics;
import io.extauthz.EvaluationException;
import io.extauthz.EvaluationResult;
import io.extauthz.InputBuilder;
import io.extauthz.PolicyEngine;
import io.extauthz.PolicyStore;
import io.extauthz.PreparedQuery;
import io.extauthz.StoreException;
import io.extauthz.server.DecisionException.Reason;
import io.grpc.Context;
import io.grpc.Deadline;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Decides a single check request: builds the policy input, evaluates the entry point, shapes the
 * response and records the decision.
 *
 * <p>Every call that opens a store transaction is finalized exactly once, whether it succeeds or
 * fails at any later step: the per-call timers are stopped, one decision log entry is written and
 * the transaction is closed. The transaction is aborted if preparing or evaluating the query
 * failed or the decision could not be logged, and committed otherwise. A decision that could not
 * be logged is never returned; the response status is replaced by {@code UNKNOWN} carrying the
 * logging error. Finalization runs in a context that is not cancelled with the call.
 *
 * <p>Safe for concurrent use.
 */
final class CheckPipeline {
  private static final Logger logger = Logger.getLogger(CheckPipeline.class.getName());

  private final ExtAuthzConfig config;
  private final PolicyStore store;
  private final PolicyEngine engine;
  private final DecisionLogger decisionLogger;
  private final InputBuilder inputBuilder;
  private final PreparedQueryCache preparedQueries;
  private final BuiltinResultCache interQueryCache;
  private final CheckResponseTranslator translator;
  @Nullable
  private final AuthzMetrics metrics;
  private final Supplier<String> decisionIds;
  private final Ticker ticker;
  private final Clock clock;

  CheckPipeline(ExtAuthzConfig config, PolicyStore store, PolicyEngine engine,
      DecisionLogger decisionLogger, InputBuilder inputBuilder, PreparedQueryCache preparedQueries,
      BuiltinResultCache interQueryCache, CheckResponseTranslator translator,
      @Nullable AuthzMetrics metrics, Supplier<String> decisionIds, Ticker ticker, Clock clock) {
    this.config = checkNotNull(config, "config");
    this.store = checkNotNull(store, "store");
    this.engine = checkNotNull(engine, "engine");
    this.decisionLogger = checkNotNull(decisionLogger, "decisionLogger");
    this.inputBuilder = checkNotNull(inputBuilder, "inputBuilder");
    this.preparedQueries = checkNotNull(preparedQueries, "preparedQueries");
    this.interQueryCache = checkNotNull(interQueryCache, "interQueryCache");
    this.translator = checkNotNull(translator, "translator");
    this.metrics = metrics;
    this.decisionIds = checkNotNull(decisionIds, "decisionIds");
    this.ticker = checkNotNull(ticker, "ticker");
    this.clock = checkNotNull(clock, "clock");
  }

  /**
   * Decides {@code request}, a v2 or v3 {@code CheckRequest}.
   *
   * @return the v3 response; in dry-run mode it always allows unless logging failed
   * @throws DecisionException if no response could be produced
   */
  CheckResponse check(Message request) throws DecisionException {
    long startNanos = ticker.read();
    EvaluationContext evaluation = startEvaluation();
    try {
      evaluation.setTransaction(store.newTransaction(evaluation.metrics()));
    } catch (StoreException e) {
      logger.log(Level.SEVERE, "Unable to start new storage transaction.", e);
      throw new DecisionException(Reason.STORE, e.getMessage(), e);
    }

    CheckResponse response = null;
    DecisionException failure = null;
    Throwable unexpected = null;
    try {
      response = decide(evaluation, request);
    } catch (DecisionException e) {
      failure = e;
    } catch (RuntimeException | Error e) {
      unexpected = e;
      throw e;
    } finally {
      Throwable error = failure != null ? failure : unexpected;
      if (logger.isLoggable(Level.FINE)) {
        logger.log(Level.FINE,
            "Returning policy decision. decision-id={0}, query={1}, dry-run={2}, decision={3}, "
                + "err={4}, txn={5}, metrics={6}, total_decision_time={7}",
            new Object[] {evaluation.decisionId(), config.entryPoint(), config.dryRun(),
                evaluation.decision(), error, evaluation.transaction().id(),
                evaluation.metrics().all(), Duration.ofNanos(ticker.read() - startNanos)});
      }
      if (response != null && config.dryRun()) {
        response = CheckResponseTranslator.applyDryRun(response);
      }
      com.google.rpc.Status logFailure = finish(evaluation, error);
      if (response != null && logFailure != null) {
        response = response.toBuilder().setStatus(logFailure).build();
      }
      if (metrics != null) {
        metrics.recordCheckDuration(ticker.read() - startNanos);
      }
    }
    if (failure != null) {
      throw failure;
    }
    return response;
  }

  private EvaluationContext startEvaluation() throws DecisionException {
    try {
      DecisionMetrics callMetrics = new DecisionMetrics(ticker);
      EvaluationContext evaluation = new EvaluationContext(decisionIds.get(), callMetrics);
      callMetrics.timer(DecisionMetrics.SERVER_HANDLER).start();
      return evaluation;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Unable to start new evaluation.", e);
      throw new DecisionException(
          Reason.EVAL_START, "unable to start new evaluation: " + e.getMessage(), e);
    }
  }

  private CheckResponse decide(EvaluationContext evaluation, Message request)
      throws DecisionException {
    Context context = Context.current();
    Deadline deadline = context.getDeadline();
    if (context.isCancelled() || (deadline != null && deadline.isExpired())) {
      throw new DecisionException(Reason.TIMEOUT,
          "check request timed out before query execution", context.cancellationCause());
    }

    Map<String, Object> input;
    try {
      input = inputBuilder.buildInput(
          request, config.descriptors(), config.skipRequestBodyParse());
    } catch (ConversionException e) {
      throw new DecisionException(Reason.INPUT_CONVERSION, e.getMessage(), e);
    }
    evaluation.setInput(input);

    Object value;
    try {
      value = engine.toValue(input);
    } catch (ConversionException e) {
      throw new DecisionException(Reason.VALUE_CONVERSION, e.getMessage(), e);
    }

    EvaluationResult result;
    try {
      PreparedQuery query = preparedQueries.get(evaluation.transaction(), evaluation.metrics());
      result = checkNotNull(
          query.evaluate(value, evaluation.transaction(), evaluation.decisionId(),
              evaluation.metrics(), interQueryCache),
          "evaluation result");
    } catch (EvaluationException | RuntimeException e) {
      evaluation.markEvaluationFailed();
      throw new DecisionException(Reason.EVALUATION, e.getMessage(), e);
    }
    evaluation.setResult(result.decision(), result.ndBuiltinCache());

    return translator.translate(result.decision());
  }

  /**
   * Stops the timers, logs the decision and closes the transaction.
   *
   * @return the status replacing the response status when the decision could not be logged
   */
  @Nullable
  private com.google.rpc.Status finish(EvaluationContext evaluation, @Nullable Throwable error) {
    evaluation.finish();
    Context finalization = Context.current().fork();
    Context previous = finalization.attach();
    try {
      evaluation.metrics().timer(DecisionMetrics.SERVER_HANDLER).stop();
      String logError = null;
      try {
        decisionLogger.logDecision(toDecisionInfo(evaluation, error));
      } catch (DecisionLogException | RuntimeException e) {
        logger.log(Level.WARNING, "Failed to log decision " + evaluation.decisionId(), e);
        logError = e.getMessage() != null ? e.getMessage() : e.toString();
      }
      closeTransaction(evaluation, logError != null || evaluation.evaluationFailed());
      if (logError == null) {
        return null;
      }
      return com.google.rpc.Status.newBuilder()
          .setCode(Code.UNKNOWN_VALUE)
          .setMessage(logError)
          .build();
    } finally {
      finalization.detach(previous);
    }
  }

  private DecisionInfo toDecisionInfo(EvaluationContext evaluation, @Nullable Throwable error) {
    return DecisionInfo.builder()
        .setDecisionId(evaluation.decisionId())
        .setTimestamp(clock.instant())
        .setPath(config.path())
        .setQuery(config.query())
        .setTransactionId(evaluation.transaction().id())
        .setInput(evaluation.input())
        .setDecision(evaluation.decision())
        .setNdBuiltinCache(evaluation.ndBuiltinCache())
        .setMetrics(evaluation.metrics().all())
        .setError(error)
        .build();
  }

  private void closeTransaction(EvaluationContext evaluation, boolean abort) {
    PolicyStore.Transaction transaction = evaluation.transaction();
    try {
      store.close(transaction, abort);
    } catch (StoreException | RuntimeException e) {
      logger.log(Level.WARNING, "Failed to close transaction " + transaction.id(), e);
    }
  }
}
