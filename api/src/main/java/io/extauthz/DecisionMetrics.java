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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import javax.annotation.concurrent.GuardedBy;

/**
 * Named timers collected while a single check call is handled. The store, the policy engine and
 * the decision pipeline all record into the same instance, and the totals are attached to the
 * decision log entry.
 */
public final class DecisionMetrics {

  /** Wall time spent in the check handler, from evaluation start to finalization. */
  public static final String SERVER_HANDLER = "timer_server_handler_ns";

  /** Time the policy engine spends preparing the entry point query. */
  public static final String QUERY_PREPARE = "timer_rego_query_compile_ns";

  /** Time the policy engine spends evaluating the entry point query. */
  public static final String QUERY_EVAL = "timer_rego_query_eval_ns";

  private final Ticker ticker;
  private final ConcurrentMap<String, Timer> timers = new ConcurrentHashMap<>();

  public DecisionMetrics() {
    this(Ticker.systemTicker());
  }

  public DecisionMetrics(Ticker ticker) {
    this.ticker = checkNotNull(ticker, "ticker");
  }

  /** Returns the timer called {@code name}, creating it on first use. */
  public Timer timer(String name) {
    Timer timer = timers.get(name);
    if (timer == null) {
      Timer created = new Timer(Stopwatch.createUnstarted(ticker));
      timer = timers.putIfAbsent(name, created);
      if (timer == null) {
        timer = created;
      }
    }
    return timer;
  }

  /** Returns every timer's accumulated value in nanoseconds, keyed by timer name. */
  public ImmutableSortedMap<String, Long> all() {
    ImmutableSortedMap.Builder<String, Long> builder = ImmutableSortedMap.naturalOrder();
    for (Map.Entry<String, Timer> entry : timers.entrySet()) {
      builder.put(entry.getKey(), entry.getValue().valueNanos());
    }
    return builder.build();
  }

  /** A stopwatch that may be started and stopped repeatedly, accumulating elapsed time. */
  public static final class Timer {
    @GuardedBy("this")
    private final Stopwatch stopwatch;

    private Timer(Stopwatch stopwatch) {
      this.stopwatch = stopwatch;
    }

    /** Starts the timer. Has no effect on a running timer. */
    public synchronized void start() {
      if (!stopwatch.isRunning()) {
        stopwatch.start();
      }
    }

    /** Stops the timer and returns the accumulated nanoseconds. */
    public synchronized long stop() {
      if (stopwatch.isRunning()) {
        stopwatch.stop();
      }
      return stopwatch.elapsed(TimeUnit.NANOSECONDS);
    }

    public synchronized long valueNanos() {
      return stopwatch.elapsed(TimeUnit.NANOSECONDS);
    }
  }
}
