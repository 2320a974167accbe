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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.testing.FakeTicker;
import io.extauthz.DecisionMetrics;
import io.extauthz.EntryPoint;
import io.extauthz.EvaluationException;
import io.extauthz.PolicyEngine;
import io.extauthz.PolicyStore;
import io.extauthz.PreparedQuery;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class PreparedQueryCacheTest {
  private static final EntryPoint ENTRY_POINT = EntryPoint.fromPath("envoy/authz/allow");

  @Rule
  public final MockitoRule mocks = MockitoJUnit.rule();

  @Mock
  private PolicyEngine engine;
  @Mock
  private PreparedQuery query;
  @Mock
  private PreparedQuery recompiledQuery;

  private final PolicyStore.Transaction transaction = new FakePolicyStore.FakeTransaction(1);
  private final FakeTicker ticker = new FakeTicker();
  private final ExecutorService executor = Executors.newFixedThreadPool(8);

  @After
  public void tearDown() {
    executor.shutdownNow();
  }

  @Test
  public void preparesOnce() throws Exception {
    when(engine.prepare(ENTRY_POINT, transaction)).thenReturn(query);
    PreparedQueryCache cache = new PreparedQueryCache(engine, ENTRY_POINT);

    assertThat(cache.get(transaction, new DecisionMetrics(ticker))).isSameInstanceAs(query);
    assertThat(cache.get(transaction, new DecisionMetrics(ticker))).isSameInstanceAs(query);

    verify(engine, times(1)).prepare(any(EntryPoint.class), any(PolicyStore.Transaction.class));
  }

  @Test
  public void preparationIsTimed() throws Exception {
    when(engine.prepare(ENTRY_POINT, transaction)).thenAnswer(invocation -> {
      ticker.advance(3, TimeUnit.MILLISECONDS);
      return query;
    });
    PreparedQueryCache cache = new PreparedQueryCache(engine, ENTRY_POINT);
    DecisionMetrics metrics = new DecisionMetrics(ticker);

    cache.get(transaction, metrics);

    assertThat(metrics.all())
        .containsEntry(DecisionMetrics.QUERY_PREPARE, TimeUnit.MILLISECONDS.toNanos(3));
  }

  @Test
  public void invalidateForcesRecompile() throws Exception {
    when(engine.prepare(ENTRY_POINT, transaction)).thenReturn(query, recompiledQuery);
    PreparedQueryCache cache = new PreparedQueryCache(engine, ENTRY_POINT);

    assertThat(cache.get(transaction, new DecisionMetrics(ticker))).isSameInstanceAs(query);
    cache.invalidate();
    assertThat(cache.get(transaction, new DecisionMetrics(ticker)))
        .isSameInstanceAs(recompiledQuery);
  }

  @Test
  public void failureIsNotCached() throws Exception {
    when(engine.prepare(ENTRY_POINT, transaction))
        .thenThrow(new EvaluationException("rego_parse_error"))
        .thenReturn(query);
    PreparedQueryCache cache = new PreparedQueryCache(engine, ENTRY_POINT);

    EvaluationException e = assertThrows(EvaluationException.class,
        () -> cache.get(transaction, new DecisionMetrics(ticker)));
    assertThat(e).hasMessageThat().isEqualTo("rego_parse_error");
    assertThat(cache.get(transaction, new DecisionMetrics(ticker))).isSameInstanceAs(query);
  }

  @Test
  public void concurrentCallersPrepareOnce() throws Exception {
    CountDownLatch preparing = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(engine.prepare(eq(ENTRY_POINT), any(PolicyStore.Transaction.class)))
        .thenAnswer(invocation -> {
          preparing.countDown();
          release.await();
          return query;
        });
    PreparedQueryCache cache = new PreparedQueryCache(engine, ENTRY_POINT);

    List<Future<PreparedQuery>> results = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      results.add(executor.submit(new Callable<PreparedQuery>() {
        @Override
        public PreparedQuery call() throws Exception {
          return cache.get(transaction, new DecisionMetrics());
        }
      }));
    }
    assertThat(preparing.await(5, TimeUnit.SECONDS)).isTrue();
    release.countDown();

    for (Future<PreparedQuery> result : results) {
      assertThat(result.get(5, TimeUnit.SECONDS)).isSameInstanceAs(query);
    }
    verify(engine, times(1)).prepare(any(EntryPoint.class), any(PolicyStore.Transaction.class));
  }
}
