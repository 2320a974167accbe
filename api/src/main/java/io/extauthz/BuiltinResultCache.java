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

package io.extauthz;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import javax.annotation.Nullable;

/**
 * Process wide cache of builtin function results keyed by the builtin call signature. It is
 * shared by every concurrent check call and never cleared per call; only {@link #clear()} (on
 * reconfiguration) or a restart empties it.
 */
public final class BuiltinResultCache {

  public static final long DEFAULT_MAX_ENTRIES = 10_000;

  private final Cache<String, Object> cache;

  private BuiltinResultCache(long maxEntries) {
    this.cache = CacheBuilder.newBuilder().maximumSize(maxEntries).build();
  }

  public static BuiltinResultCache create() {
    return create(DEFAULT_MAX_ENTRIES);
  }

  public static BuiltinResultCache create(long maxEntries) {
    checkArgument(maxEntries > 0, "maxEntries must be positive: %s", maxEntries);
    return new BuiltinResultCache(maxEntries);
  }

  /** Returns the cached result for {@code signature}, or {@code null} if there is none. */
  @Nullable
  public Object get(String signature) {
    return cache.getIfPresent(checkNotNull(signature, "signature"));
  }

  public void put(String signature, Object result) {
    cache.put(checkNotNull(signature, "signature"), checkNotNull(result, "result"));
  }

  public void clear() {
    cache.invalidateAll();
  }

  public long size() {
    return cache.size();
  }
}
