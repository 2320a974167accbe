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

import static io.opentelemetry.sdk.testing.assertj.OpenTelemetryAssertions.assertThat;

import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.common.InstrumentationScopeInfo;
import io.opentelemetry.sdk.testing.junit4.OpenTelemetryRule;
import java.util.concurrent.TimeUnit;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class AuthzMetricsTest {
  @Rule
  public final OpenTelemetryRule openTelemetryTesting = OpenTelemetryRule.create();

  @Test
  public void recordsCheckDurationInSeconds() {
    AuthzMetrics metrics = new AuthzMetrics(openTelemetryTesting.getOpenTelemetry());

    metrics.recordCheckDuration(TimeUnit.MILLISECONDS.toNanos(2));
    metrics.recordCheckDuration(TimeUnit.MICROSECONDS.toNanos(3));

    Attributes attributes = Attributes.of(AuthzMetrics.HANDLER_KEY, "check");
    assertThat(openTelemetryTesting.getMetrics())
        .satisfiesExactlyInAnyOrder(
            metric ->
                assertThat(metric)
                    .hasInstrumentationScope(
                        InstrumentationScopeInfo.create(AuthzMetrics.INSTRUMENTATION_SCOPE))
                    .hasName("grpc_request_duration_seconds")
                    .hasUnit("s")
                    .hasDescription("A histogram of duration for grpc authz requests.")
                    .hasHistogramSatisfying(
                        histogram ->
                            histogram.hasPointsSatisfying(
                                point ->
                                    point
                                        .hasCount(2)
                                        .hasSum(0.002 + 0.000003)
                                        .hasAttributes(attributes)
                                        .hasBucketBoundaries(
                                            1e-6, 5e-6, 1e-5, 5e-5, 1e-4, 5e-4, 1e-3, 3e-3, 5e-3,
                                            0.1, 1.0)
                                        .hasBucketCounts(0, 1, 0, 0, 0, 0, 0, 1, 0, 0, 0, 0))));
  }
}
