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

import com.google.rpc.Code;
import io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.extauthz.PluginState;
import io.grpc.Grpc;
import io.grpc.InsecureChannelCredentials;
import io.grpc.ManagedChannel;
import io.grpc.health.v1.HealthCheckRequest;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.health.v1.HealthGrpc;
import io.grpc.netty.NettyChannelBuilder;
import io.grpc.testing.GrpcCleanupRule;
import io.netty.channel.epoll.Epoll;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.junit4.OpenTelemetryRule;
import java.io.File;
import java.net.SocketAddress;
import java.util.List;
import org.junit.After;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExtAuthzPluginTest {
  private static final String NOT_READY = ExtAuthzPlugin.PLUGIN_NAME + "=" + PluginState.NOT_READY;
  private static final String OK = ExtAuthzPlugin.PLUGIN_NAME + "=" + PluginState.OK;

  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();
  @Rule
  public final TemporaryFolder tempFolder = new TemporaryFolder();
  @Rule
  public final OpenTelemetryRule openTelemetryTesting = OpenTelemetryRule.create();

  private final FakePolicyRuntime runtime = new FakePolicyRuntime();
  private ExtAuthzPlugin plugin;

  @After
  public void tearDown() {
    if (plugin != null) {
      plugin.stop();
    }
  }

  @Test
  public void createdNotReady() {
    plugin = newPlugin(tcpConfig().build());

    assertThat(plugin.state()).isEqualTo(PluginState.NOT_READY);
    assertThat(plugin.getListenSocket()).isNull();
    assertThat(runtime.statusUpdates).containsExactly(NOT_READY);
    assertThat(runtime.compilerTriggers).hasSize(1);
  }

  @Test
  public void startServesChecksAndHealth() throws Exception {
    plugin = newPlugin(tcpConfig().build());

    plugin.start();

    assertThat(plugin.state()).isEqualTo(PluginState.OK);
    assertThat(runtime.statusUpdates).containsExactly(NOT_READY, NOT_READY, OK).inOrder();
    ManagedChannel channel = tcpChannel(plugin.getListenSocket());
    CheckResponse response =
        AuthorizationGrpc.newBlockingStub(channel).check(CheckPipelineTest.request("/"));
    assertThat(response.getStatus().getCode()).isEqualTo(Code.OK_VALUE);
    assertThat(HealthGrpc.newBlockingStub(channel)
        .check(HealthCheckRequest.getDefaultInstance()).getStatus())
        .isEqualTo(ServingStatus.SERVING);
    assertThat(runtime.decisionLogger.entries()).hasSize(1);
  }

  @Test
  public void stopMarksNotReady() throws Exception {
    plugin = newPlugin(tcpConfig().build());
    plugin.start();

    plugin.stop();

    assertThat(plugin.state()).isEqualTo(PluginState.NOT_READY);
    assertThat(plugin.getListenSocket()).isNull();
    assertThat(runtime.statusUpdates).containsExactly(NOT_READY, NOT_READY, OK, NOT_READY)
        .inOrder();
  }

  @Test
  public void startTwiceFails() throws Exception {
    plugin = newPlugin(tcpConfig().build());
    plugin.start();

    assertThrows(IllegalStateException.class, () -> plugin.start());
  }

  @Test
  public void invalidSchemeFailsStart() {
    plugin = newPlugin(tcpConfig().setAddress("http://127.0.0.1:0").build());

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, plugin::start);

    assertThat(e).hasMessageThat().isEqualTo("invalid url scheme \"http\"");
    assertThat(plugin.state()).isEqualTo(PluginState.NOT_READY);
  }

  @Test
  public void recompilationResetsPreparedQuery() throws Exception {
    plugin = newPlugin(tcpConfig().build());
    plugin.start();
    AuthorizationGrpc.AuthorizationBlockingStub stub =
        AuthorizationGrpc.newBlockingStub(tcpChannel(plugin.getListenSocket()));

    stub.check(CheckPipelineTest.request("/"));
    stub.check(CheckPipelineTest.request("/"));
    assertThat(runtime.engine.prepareCount.get()).isEqualTo(1);

    runtime.recompile();
    stub.check(CheckPipelineTest.request("/"));
    assertThat(runtime.engine.prepareCount.get()).isEqualTo(2);
  }

  @Test
  public void reconfigureIsNoOp() throws Exception {
    ExtAuthzConfig config = tcpConfig().build();
    plugin = newPlugin(config);

    plugin.reconfigure(config.toBuilder().setDryRun(true).build());

    assertThat(plugin.config()).isSameInstanceAs(config);
  }

  @Test
  public void reflectionAndMetricsEnabled() throws Exception {
    plugin = ExtAuthzPlugin.newBuilder(
            tcpConfig().setEnableReflection(true).setEnablePerformanceMetrics(true).build(),
            runtime)
        .setOpenTelemetry(openTelemetryTesting.getOpenTelemetry())
        .build();
    plugin.start();

    AuthorizationGrpc.newBlockingStub(tcpChannel(plugin.getListenSocket()))
        .check(CheckPipelineTest.request("/"));

    List<MetricData> metrics = openTelemetryTesting.getMetrics();
    assertThat(metrics).hasSize(1);
    assertThat(metrics.get(0).getName()).isEqualTo(AuthzMetrics.DURATION_METRIC);
  }

  @Test
  public void unixSocketReplacesStaleFile() throws Exception {
    Assume.assumeTrue(Epoll.isAvailable());
    File socket = new File(tempFolder.getRoot(), "authz.sock");
    assertThat(socket.createNewFile()).isTrue();
    plugin = newPlugin(tcpConfig().setAddress("unix://" + socket.getAbsolutePath()).build());

    plugin.start();

    assertThat(plugin.state()).isEqualTo(PluginState.OK);
    ManagedChannel channel = grpcCleanup.register(Grpc.newChannelBuilder(
        "unix://" + socket.getAbsolutePath(), InsecureChannelCredentials.create()).build());
    CheckResponse response =
        AuthorizationGrpc.newBlockingStub(channel).check(CheckPipelineTest.request("/"));
    assertThat(response.getStatus().getCode()).isEqualTo(Code.OK_VALUE);
  }

  private ExtAuthzPlugin newPlugin(ExtAuthzConfig config) {
    return ExtAuthzPlugin.newBuilder(config, runtime).build();
  }

  private static ExtAuthzConfig.Builder tcpConfig() {
    return ExtAuthzConfig.builder().setAddress("127.0.0.1:0");
  }

  private ManagedChannel tcpChannel(SocketAddress address) {
    return grpcCleanup.register(NettyChannelBuilder.forAddress(address).usePlaintext().build());
  }
}
