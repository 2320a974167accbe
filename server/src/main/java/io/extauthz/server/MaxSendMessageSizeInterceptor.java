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

import com.google.protobuf.MessageLite;
import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;

/**
 * Fails calls whose response messages are larger than a limit with {@code RESOURCE_EXHAUSTED}.
 */
final class MaxSendMessageSizeInterceptor implements ServerInterceptor {
  private final int maxSendMessageSize;

  MaxSendMessageSizeInterceptor(int maxSendMessageSize) {
    checkArgument(maxSendMessageSize > 0, "maxSendMessageSize must be positive");
    this.maxSendMessageSize = maxSendMessageSize;
  }

  @Override
  public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(ServerCall<ReqT, RespT> call,
      Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    return next.startCall(new SizeLimitingServerCall<>(call, maxSendMessageSize), headers);
  }

  private static final class SizeLimitingServerCall<ReqT, RespT>
      extends SimpleForwardingServerCall<ReqT, RespT> {
    private final int limit;
    // ServerCall methods are never called concurrently.
    private boolean closed;

    SizeLimitingServerCall(ServerCall<ReqT, RespT> delegate, int limit) {
      super(delegate);
      this.limit = limit;
    }

    @Override
    public void sendMessage(RespT message) {
      if (closed) {
        return;
      }
      if (message instanceof MessageLite) {
        int size = ((MessageLite) message).getSerializedSize();
        if (size > limit) {
          closed = true;
          super.close(
              Status.RESOURCE_EXHAUSTED.withDescription(String.format(
                  "trying to send message larger than max (%d vs. %d)", size, limit)),
              new Metadata());
          return;
        }
      }
      super.sendMessage(message);
    }

    @Override
    public void close(Status status, Metadata trailers) {
      if (closed) {
        return;
      }
      closed = true;
      super.close(status, trailers);
    }
  }
}
