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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.common.base.Suppliers;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableMap;
import com.google.rpc.Code;
import io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.extauthz.BuiltinResultCache;
import io.grpc.ManagedChannel;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.testing.GrpcCleanupRule;
import java.time.Clock;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class MaxSendMessageSizeInterceptorTest {
  private static final int LIMIT = 256;

  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final FakePolicyEngine engine = new FakePolicyEngine();
  private AuthorizationGrpc.AuthorizationBlockingStub stub;

  @Before
  public void setUp() throws Exception {
    ExtAuthzConfig config = ExtAuthzConfig.builder().build();
    CheckPipeline pipeline = new CheckPipeline(config, new FakePolicyStore(), engine,
        new RecordingDecisionLogger(), DefaultInputBuilder.INSTANCE,
        new PreparedQueryCache(engine, config.entryPoint()), BuiltinResultCache.create(),
        CheckResponseTranslator.INSTANCE, null, Suppliers.ofInstance("id"),
        Ticker.systemTicker(), Clock.systemUTC());
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(InProcessServerBuilder.forName(serverName)
        .directExecutor()
        .addService(ServerInterceptors.intercept(
            new AuthorizationServiceV3(pipeline), new MaxSendMessageSizeInterceptor(LIMIT)))
        .build()
        .start());
    ManagedChannel channel = grpcCleanup.register(
        InProcessChannelBuilder.forName(serverName).directExecutor().build());
    stub = AuthorizationGrpc.newBlockingStub(channel);
  }

  @Test
  public void smallResponsePasses() {
    CheckResponse response = stub.check(CheckPipelineTest.request("/"));

    assertThat(response.getStatus().getCode()).isEqualTo(Code.OK_VALUE);
  }

  @Test
  public void oversizedResponseIsRejected() {
    engine.decision = ImmutableMap.of("allowed", false, "body", Strings.repeat("x", LIMIT * 2));

    StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
        () -> stub.check(CheckPipelineTest.request("/")));

    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.RESOURCE_EXHAUSTED);
    assertThat(e.getStatus().getDescription()).startsWith("trying to send message larger than max");
    assertThat(e.getStatus().getDescription()).endsWith("vs. " + LIMIT + ")");
  }

  @Test
  public void nonPositiveLimitIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MaxSendMessageSizeInterceptor(0));
  }
}
