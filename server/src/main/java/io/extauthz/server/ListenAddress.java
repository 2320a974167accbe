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
import com.google.common.net.HostAndPort;
import io.netty.channel.unix.DomainSocketAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * A parsed listen address. Addresses without a scheme are TCP addresses; the {@code grpc} scheme
 * names a TCP address too, and the {@code unix} scheme a Unix domain socket. A socket name that
 * starts with {@code @} is in the abstract namespace.
 */
@AutoValue
abstract class ListenAddress {
  static final String GRPC_SCHEME = "grpc";
  static final String UNIX_SCHEME = "unix";
  private static final String SCHEME_SEPARATOR = "://";

  enum Kind {
    TCP,
    UNIX,
    UNIX_ABSTRACT,
  }

  abstract Kind kind();

  /** {@code host:port} for TCP, the socket path or {@code @name} for Unix domain sockets. */
  abstract String target();

  boolean isDomainSocket() {
    return kind() != Kind.TCP;
  }

  /**
   * Parses {@code address}.
   *
   * @throws IllegalArgumentException if the scheme is not supported or the address is malformed
   */
  static ListenAddress parse(String address) {
    String url = address.contains(SCHEME_SEPARATOR)
        ? address
        : GRPC_SCHEME + SCHEME_SEPARATOR + address;
    int separator = url.indexOf(SCHEME_SEPARATOR);
    String scheme = url.substring(0, separator);
    String rest = url.substring(separator + SCHEME_SEPARATOR.length());
    switch (scheme) {
      case GRPC_SCHEME:
        int slash = rest.indexOf('/');
        String hostPort = slash < 0 ? rest : rest.substring(0, slash);
        HostAndPort parsed = HostAndPort.fromString(hostPort);
        checkArgument(parsed.hasPort(), "missing port in address %s", address);
        return new AutoValue_ListenAddress(Kind.TCP, hostPort);
      case UNIX_SCHEME:
        checkArgument(!rest.isEmpty() && !rest.equals("@"), "missing socket path in %s", address);
        return new AutoValue_ListenAddress(
            rest.startsWith("@") ? Kind.UNIX_ABSTRACT : Kind.UNIX, rest);
      default:
        throw new IllegalArgumentException(String.format("invalid url scheme \"%s\"", scheme));
    }
  }

  /** Returns the address the server binds. */
  SocketAddress toSocketAddress() {
    switch (kind()) {
      case TCP:
        HostAndPort hostAndPort = HostAndPort.fromString(target());
        if (hostAndPort.getHost().isEmpty()) {
          return new InetSocketAddress(hostAndPort.getPort());
        }
        return new InetSocketAddress(hostAndPort.getHost(), hostAndPort.getPort());
      case UNIX:
        return new DomainSocketAddress(target());
      case UNIX_ABSTRACT:
        // Linux abstract namespace names start with a NUL byte.
        return new DomainSocketAddress("\0" + target().substring(1));
      default:
        throw new AssertionError(kind());
    }
  }
}
