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

import io.envoyproxy.envoy.service.auth.v2.AuthorizationGrpc;
import io.envoyproxy.envoy.service.auth.v2.CheckRequest;
import io.envoyproxy.envoy.service.auth.v2.CheckResponse;
import io.grpc.stub.StreamObserver;

/**
 * Implements the legacy {@code envoy.service.auth.v2.Authorization} by handing requests to the
 * v3 service and downgrading its responses.
 */
final class AuthorizationServiceV2 extends AuthorizationGrpc.AuthorizationImplBase {
  private final AuthorizationServiceV3 v3;

  AuthorizationServiceV2(AuthorizationServiceV3 v3) {
    this.v3 = checkNotNull(v3, "v3");
  }

  @Override
  public void check(CheckRequest request, StreamObserver<CheckResponse> responseObserver) {
    io.envoyproxy.envoy.service.auth.v3.CheckResponse response;
    try {
      response = v3.decide(request);
    } catch (DecisionException e) {
      responseObserver.onError(e.toStatus().asRuntimeException());
      return;
    }
    responseObserver.onNext(V2ResponseConverter.convert(response));
    responseObserver.onCompleted();
  }
}
