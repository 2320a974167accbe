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

import com.google.common.collect.ImmutableList;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.List;
import java.util.concurrent.TimeUnit;

/** Latency histogram of check calls. */
final class AuthzMetrics {
  static final String INSTRUMENTATION_SCOPE = "io.extauthz.server";
  static final String DURATION_METRIC = "grpc_request_duration_seconds";
  static final AttributeKey<String> HANDLER_KEY = AttributeKey.stringKey("handler");
  static final List<Double> LATENCY_BUCKETS = ImmutableList.of(
      1e-6, 5e-6, 1e-5, 5e-5, 1e-4, 5e-4, 1e-3, 3e-3, 5e-3, 0.1, 1.0);

  private static final Attributes CHECK_ATTRIBUTES = Attributes.of(HANDLER_KEY, "check");

  private final DoubleHistogram checkDuration;

  AuthzMetrics(OpenTelemetry openTelemetry) {
    Meter meter = checkNotNull(openTelemetry, "openTelemetry")
        .getMeter(INSTRUMENTATION_SCOPE);
    this.checkDuration = meter.histogramBuilder(DURATION_METRIC)
        .setUnit("s")
        .setDescription("A histogram of duration for grpc authz requests.")
        .setExplicitBucketBoundariesAdvice(LATENCY_BUCKETS)
        .build();
  }

  void recordCheckDuration(long nanos) {
    checkDuration.record(nanos / (double) TimeUnit.SECONDS.toNanos(1), CHECK_ATTRIBUTES);
  }
}
