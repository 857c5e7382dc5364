/*
 * Copyright 2026 The pseudolru Authors. All Rights Reserved.
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
package com.github.pseudolru.cache.stats;

import java.util.Objects;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.pseudolru.cache.CacheItem;
import com.github.pseudolru.cache.PseudoLruCache;
import com.google.errorprone.annotations.Immutable;

/**
 * A snapshot of the counters kept by a {@link PseudoLruCache}.
 * <p>
 * Only {@link CacheItem#getOrCreate} is a request: it is a hit when the item still held its value
 * and a miss when the value had to be recreated. A plain {@link CacheItem#get} is not counted.
 * <p>
 * A value leaves the cache involuntarily in one of two ways. An admission into a full cache runs
 * the sampled eviction search, and a {@link PseudoLruCache#resize} below the current size
 * truncates the least recently used values without sampling. These are counted separately, and
 * only when the removed item still held a value. Invalidating an item, {@code clear} and
 * {@code evictAll} are not counted.
 */
@Immutable
public final class CacheStats {
  private static final CacheStats EMPTY = new CacheStats(0L, 0L, 0L, 0L);

  private final long hitCount;
  private final long missCount;
  private final long sampledEvictionCount;
  private final long truncationCount;

  private CacheStats(long hitCount, long missCount,
      long sampledEvictionCount, long truncationCount) {
    this.hitCount = hitCount;
    this.missCount = missCount;
    this.sampledEvictionCount = sampledEvictionCount;
    this.truncationCount = truncationCount;
  }

  /**
   * Returns a snapshot of the given counts.
   *
   * @param hitCount the requests that found the value cached
   * @param missCount the requests that recreated the value
   * @param sampledEvictionCount the values chosen by the eviction search
   * @param truncationCount the values dropped by shrinking the cache
   * @return a snapshot of the counts
   * @throws IllegalArgumentException if any count is negative
   */
  public static CacheStats of(@NonNegative long hitCount, @NonNegative long missCount,
      @NonNegative long sampledEvictionCount, @NonNegative long truncationCount) {
    if ((hitCount | missCount | sampledEvictionCount | truncationCount) < 0) {
      throw new IllegalArgumentException("counts must not be negative");
    }
    return new CacheStats(hitCount, missCount, sampledEvictionCount, truncationCount);
  }

  /** Returns the snapshot of a cache that has recorded nothing. */
  public static CacheStats empty() {
    return EMPTY;
  }

  /** Returns the number of {@link CacheItem#getOrCreate} calls, {@code hitCount + missCount}. */
  public @NonNegative long requestCount() {
    return hitCount + missCount;
  }

  /** Returns the number of requests that found the value cached. */
  public @NonNegative long hitCount() {
    return hitCount;
  }

  /**
   * Returns the number of requests that found the item empty and recreated its value. Threads
   * racing to recreate the same value each record a miss.
   */
  public @NonNegative long missCount() {
    return missCount;
  }

  /**
   * Returns {@code hitCount / requestCount}, or {@link Double#NaN} if no request was made.
   *
   * @return the fraction of requests that were hits
   */
  public double hitRate() {
    long requests = requestCount();
    return (requests == 0) ? Double.NaN : (double) hitCount / requests;
  }

  /**
   * Returns {@code missCount / requestCount}, or {@link Double#NaN} if no request was made.
   *
   * @return the fraction of requests that were misses
   */
  public double missRate() {
    long requests = requestCount();
    return (requests == 0) ? Double.NaN : (double) missCount / requests;
  }

  /** Returns the number of values discarded by the sampled eviction search. */
  public @NonNegative long sampledEvictionCount() {
    return sampledEvictionCount;
  }

  /** Returns the number of values discarded because a resize made the cache too small. */
  public @NonNegative long truncationCount() {
    return truncationCount;
  }

  /** Returns the number of values evicted by either the search or a shrinking resize. */
  public @NonNegative long evictionCount() {
    return sampledEvictionCount + truncationCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(hitCount, missCount, sampledEvictionCount, truncationCount);
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (o == this) {
      return true;
    } else if (!(o instanceof CacheStats)) {
      return false;
    }
    CacheStats other = (CacheStats) o;
    return (hitCount == other.hitCount)
        && (missCount == other.missCount)
        && (sampledEvictionCount == other.sampledEvictionCount)
        && (truncationCount == other.truncationCount);
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "hitCount=" + hitCount + ", "
        + "missCount=" + missCount + ", "
        + "sampledEvictionCount=" + sampledEvictionCount + ", "
        + "truncationCount=" + truncationCount
        + '}';
  }
}
