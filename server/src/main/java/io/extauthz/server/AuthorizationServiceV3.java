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

import com.google.protobuf.Message;
import io.envoyproxy.envoy.service.auth.v3.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v3.CheckRequest;
import io.envoyproxy.envoy.service.auth.v3.CheckResponse;
import io.grpc.stub.StreamObserver;

/** Implements {@code envoy.service.auth.v3.Authorization}. */
final class AuthorizationServiceV3 extends AuthorizationGrpc.AuthorizationImplBase {
  private final CheckPipeline pipeline;

  AuthorizationServiceV3(CheckPipeline pipeline) {
    this.pipeline = checkNotNull(pipeline, "pipeline");
  }

  @Override
  public void check(CheckRequest request, StreamObserver<CheckResponse> responseObserver) {
    CheckResponse response;
    try {
      response = decide(request);
    } catch (DecisionException e) {
      responseObserver.onError(e.toStatus().asRuntimeException());
      return;
    }
    responseObserver.onNext(response);
    responseObserver.onCompleted();
  }

  /** Decides a v2 or v3 request. */
  CheckResponse decide(Message request) throws DecisionException {
    return pipeline.check(request);
  }
}
