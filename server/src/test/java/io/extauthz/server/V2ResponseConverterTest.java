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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.rpc.Code;
import io.envoyproxy.envoy.api.v2.core.HeaderValue;
import io.envoyproxy.envoy.api.v2.core.HeaderValueOption;
import io.envoyproxy.envoy.service.auth.v2.CheckResponse;
import io.envoyproxy.envoy.type.StatusCode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class V2ResponseConverterTest {

  @Test
  public void okResponseKeepsOnlyHeaders() throws Exception {
    io.envoyproxy.envoy.service.auth.v3.CheckResponse v3 =
        CheckResponseTranslator.INSTANCE.translate(ImmutableMap.of(
            "allowed", true,
            "headers", ImmutableMap.of("x-user", "alice"),
            "request_headers_to_remove", ImmutableList.of("authorization"),
            "response_headers_to_add", ImmutableMap.of("x-trace", "abc"),
            "dynamic_metadata", ImmutableMap.of("k", "v")));

    CheckResponse v2 = V2ResponseConverter.convert(v3);

    assertThat(v2.getStatus().getCode()).isEqualTo(Code.OK_VALUE);
    assertThat(v2.getOkResponse().getHeadersList()).containsExactly(header("x-user", "alice"));
  }

  @Test
  public void deniedResponseKeepsHeadersBodyAndStatus() throws Exception {
    io.envoyproxy.envoy.service.auth.v3.CheckResponse v3 =
        CheckResponseTranslator.INSTANCE.translate(ImmutableMap.of(
            "allowed", false,
            "headers", ImmutableMap.of("x-reason", ImmutableList.of("a", "b")),
            "body", "denied",
            "http_status", 401.0));

    CheckResponse v2 = V2ResponseConverter.convert(v3);

    assertThat(v2.getStatus().getCode()).isEqualTo(Code.PERMISSION_DENIED_VALUE);
    assertThat(v2.getDeniedResponse().getHeadersList())
        .containsExactly(header("x-reason", "a"), header("x-reason", "b")).inOrder();
    assertThat(v2.getDeniedResponse().getBody()).isEqualTo("denied");
    assertThat(v2.getDeniedResponse().getStatus().getCode()).isEqualTo(StatusCode.Unauthorized);
  }

  @Test
  public void statusOnlyResponse() throws Exception {
    CheckResponse v2 =
        V2ResponseConverter.convert(CheckResponseTranslator.INSTANCE.translate(false));

    assertThat(v2.getStatus().getCode()).isEqualTo(Code.PERMISSION_DENIED_VALUE);
    assertThat(v2.getHttpResponseCase())
        .isEqualTo(CheckResponse.HttpResponseCase.HTTPRESPONSE_NOT_SET);
  }

  @Test
  public void dryRunResponseConverts() throws Exception {
    CheckResponse v2 = V2ResponseConverter.convert(CheckResponseTranslator.applyDryRun(
        CheckResponseTranslator.INSTANCE.translate(ImmutableMap.of("allowed", false))));

    assertThat(v2.getStatus().getCode()).isEqualTo(Code.OK_VALUE);
    assertThat(v2.hasOkResponse()).isTrue();
    assertThat(v2.getOkResponse().getHeadersList()).isEmpty();
  }

  private static HeaderValueOption header(String key, String value) {
    return HeaderValueOption.newBuilder()
        .setHeader(HeaderValue.newBuilder().setKey(key).setValue(value))
        .build();
  }
}
