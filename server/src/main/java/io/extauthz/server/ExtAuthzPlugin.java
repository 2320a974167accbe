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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Supplier;
import com.google.common.base.Ticker;
import io.extauthz.BuiltinResultCache;
import io.extauthz.InputBuilder;
import io.extauthz.PluginState;
import io.extauthz.PolicyRuntime;
import io.grpc.Server;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import io.grpc.protobuf.services.ProtoReflectionService;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.opentelemetry.api.OpenTelemetry;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;

/**
 * Serves the v2 and v3 Envoy external authorization APIs for a {@link PolicyRuntime}.
 *
 * <p>The plugin reports {@link PluginState#OK} to the runtime once its listener is bound, and
 * {@link PluginState#NOT_READY} before that and after {@link #stop}. The standard gRPC health
 * service follows the same state.
 */
public final class ExtAuthzPlugin {
  private static final Logger logger = Logger.getLogger(ExtAuthzPlugin.class.getName());

  public static final String PLUGIN_NAME = "envoy_ext_authz_grpc";

  private static final long SHUTDOWN_GRACE_SECONDS = 30;
  private static final long SHUTDOWN_NOW_GRACE_SECONDS = 5;

  private final ExtAuthzConfig config;
  private final PolicyRuntime runtime;
  private final PreparedQueryCache preparedQueries;
  private final AuthorizationServiceV3 v3Service;
  private final AuthorizationServiceV2 v2Service;
  private final HealthStatusManager health = new HealthStatusManager();
  private final Object lock = new Object();

  @GuardedBy("lock")
  private Server server;
  @GuardedBy("lock")
  private EventLoopGroup bossGroup;
  @GuardedBy("lock")
  private EventLoopGroup workerGroup;
  private volatile PluginState state = PluginState.NOT_READY;

  private ExtAuthzPlugin(Builder builder) {
    this.config = builder.config;
    this.runtime = builder.runtime;
    this.preparedQueries = new PreparedQueryCache(runtime.engine(), config.entryPoint());
    AuthzMetrics metrics = config.enablePerformanceMetrics()
        ? new AuthzMetrics(builder.openTelemetry)
        : null;
    CheckPipeline pipeline = new CheckPipeline(
        config,
        runtime.store(),
        runtime.engine(),
        runtime.decisionLogger(),
        builder.inputBuilder,
        preparedQueries,
        builder.interQueryCache,
        CheckResponseTranslator.INSTANCE,
        metrics,
        builder.decisionIds,
        builder.ticker,
        builder.clock);
    this.v3Service = new AuthorizationServiceV3(pipeline);
    this.v2Service = new AuthorizationServiceV2(v3Service);
    health.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.NOT_SERVING);
    runtime.registerCompilerTrigger(preparedQueries::invalidate);
    setState(PluginState.NOT_READY);
  }

  public static Builder newBuilder(ExtAuthzConfig config, PolicyRuntime runtime) {
    return new Builder(config, runtime);
  }

  /**
   * Binds the listener and starts serving.
   *
   * @throws IOException if the listener could not be bound
   * @throws IllegalArgumentException if the configured address is invalid
   * @throws IllegalStateException if already started
   */
  public void start() throws IOException {
    setState(PluginState.NOT_READY);
    ListenAddress address;
    try {
      address = ListenAddress.parse(config.address());
    } catch (IllegalArgumentException e) {
      logger.log(Level.SEVERE, "Unable to create listener.", e);
      throw e;
    }
    synchronized (lock) {
      checkState(server == null, "already started");
      NettyServerBuilder builder;
      if (address.isDomainSocket()) {
        if (!Epoll.isAvailable()) {
          throw new IOException("unix domain sockets are not supported on this platform",
              Epoll.unavailabilityCause());
        }
        if (address.kind() == ListenAddress.Kind.UNIX) {
          deleteStaleSocket(address.target());
        }
        bossGroup = new EpollEventLoopGroup(1);
        workerGroup = new EpollEventLoopGroup();
        builder = NettyServerBuilder.forAddress(address.toSocketAddress())
            .channelType(EpollServerDomainSocketChannel.class)
            .bossEventLoopGroup(bossGroup)
            .workerEventLoopGroup(workerGroup);
      } else {
        builder = NettyServerBuilder.forAddress(address.toSocketAddress());
      }
      builder.maxInboundMessageSize(config.maxReceiveMessageSize());
      if (config.maxSendMessageSize() < Integer.MAX_VALUE) {
        builder.intercept(new MaxSendMessageSizeInterceptor(config.maxSendMessageSize()));
      }
      builder.addService(v3Service)
          .addService(v2Service)
          .addService(health.getHealthService());
      if (config.enableReflection()) {
        builder.addService(newReflectionService());
      }
      Server newServer = builder.build();
      try {
        newServer.start();
      } catch (IOException | RuntimeException e) {
        logger.log(Level.SEVERE, "Listener exited with error.", e);
        shutdownEventLoops();
        throw e;
      }
      server = newServer;
    }
    logger.log(Level.INFO,
        "Starting gRPC server. addr={0}, query={1}, path={2}, dry-run={3}, "
            + "enable-reflection={4}",
        new Object[] {config.address(), config.query(), config.path(), config.dryRun(),
            config.enableReflection()});
    setState(PluginState.OK);
  }

  /** Stops serving, waiting for in-flight calls to finish. */
  public void stop() {
    Server toStop;
    synchronized (lock) {
      toStop = server;
      server = null;
    }
    if (toStop != null) {
      toStop.shutdown();
      try {
        if (!toStop.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
          toStop.shutdownNow();
          toStop.awaitTermination(SHUTDOWN_NOW_GRACE_SECONDS, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        toStop.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    synchronized (lock) {
      shutdownEventLoops();
    }
    setState(PluginState.NOT_READY);
  }

  /** Configuration changes take effect only when the plugin is recreated. */
  public void reconfigure(ExtAuthzConfig newConfig) {
    checkNotNull(newConfig, "newConfig");
    logger.log(Level.FINE, "Ignoring reconfiguration of {0}", PLUGIN_NAME);
  }

  /** Returns the bound address, or {@code null} if not serving. */
  @Nullable
  public SocketAddress getListenSocket() {
    synchronized (lock) {
      return server == null ? null : server.getListenSockets().get(0);
    }
  }

  public PluginState state() {
    return state;
  }

  public ExtAuthzConfig config() {
    return config;
  }

  @VisibleForTesting
  PreparedQueryCache preparedQueries() {
    return preparedQueries;
  }

  private void setState(PluginState newState) {
    state = newState;
    health.setStatus(HealthStatusManager.SERVICE_NAME_ALL_SERVICES,
        newState == PluginState.OK ? ServingStatus.SERVING : ServingStatus.NOT_SERVING);
    runtime.updatePluginStatus(PLUGIN_NAME, newState);
  }

  @GuardedBy("lock")
  private void shutdownEventLoops() {
    if (bossGroup != null) {
      bossGroup.shutdownGracefully();
      bossGroup = null;
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully();
      workerGroup = null;
    }
  }

  private static void deleteStaleSocket(String path) throws IOException {
    try {
      if (Files.deleteIfExists(Paths.get(path))) {
        logger.log(Level.FINE, "Removed stale socket file {0}", path);
      }
    } catch (IOException e) {
      logger.log(Level.WARNING, "Unable to remove socket file " + path, e);
      throw e;
    }
  }

  @SuppressWarnings("deprecation")
  private static io.grpc.BindableService newReflectionService() {
    return ProtoReflectionService.newInstance();
  }

  /** Builder for {@link ExtAuthzPlugin}. */
  public static final class Builder {
    private final ExtAuthzConfig config;
    private final PolicyRuntime runtime;
    private InputBuilder inputBuilder = DefaultInputBuilder.INSTANCE;
    private OpenTelemetry openTelemetry = OpenTelemetry.noop();
    private BuiltinResultCache interQueryCache = BuiltinResultCache.create();
    private Supplier<String> decisionIds = new Supplier<String>() {
      @Override
      public String get() {
        return UUID.randomUUID().toString();
      }
    };
    private Ticker ticker = Ticker.systemTicker();
    private Clock clock = Clock.systemUTC();

    private Builder(ExtAuthzConfig config, PolicyRuntime runtime) {
      this.config = checkNotNull(config, "config");
      this.runtime = checkNotNull(runtime, "runtime");
    }

    public Builder setInputBuilder(InputBuilder inputBuilder) {
      this.inputBuilder = checkNotNull(inputBuilder, "inputBuilder");
      return this;
    }

    /** Sets where the latency histogram is reported when performance metrics are enabled. */
    public Builder setOpenTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = checkNotNull(openTelemetry, "openTelemetry");
      return this;
    }

    public Builder setInterQueryCache(BuiltinResultCache interQueryCache) {
      this.interQueryCache = checkNotNull(interQueryCache, "interQueryCache");
      return this;
    }

    public Builder setDecisionIds(Supplier<String> decisionIds) {
      this.decisionIds = checkNotNull(decisionIds, "decisionIds");
      return this;
    }

    public Builder setTicker(Ticker ticker) {
      this.ticker = checkNotNull(ticker, "ticker");
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = checkNotNull(clock, "clock");
      return this;
    }

    public ExtAuthzPlugin build() {
      return new ExtAuthzPlugin(this);
    }
  }
}
