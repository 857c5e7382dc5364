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
package com.github.pseudolru.cache.simulator.policy;

import static java.util.Objects.requireNonNull;

import com.github.pseudolru.cache.stats.CacheStats;
import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;

/**
 * The outcome of replaying a trace against one policy. A policy is single threaded, so the counts
 * are plain fields.
 * <p>
 * Unlike {@link CacheStats}, an empty result reports a hit rate of 1.0 and a miss rate of 0.0, so
 * that a policy that was never exercised sorts as though it never missed.
 */
public final class PolicyStats {
  private final Stopwatch stopwatch;
  private final String name;

  private long hits;
  private long misses;
  private long evictions;

  public PolicyStats(String name) {
    this.name = requireNonNull(name);
    this.stopwatch = Stopwatch.createUnstarted();
  }

  /** Returns the label shown in the report. */
  public String name() {
    return name;
  }

  /** Returns the stopwatch that times the replay. */
  public Stopwatch stopwatch() {
    return stopwatch;
  }

  public void recordHit() {
    hits++;
  }

  public void recordMiss() {
    misses++;
  }

  public void recordEviction() {
    evictions++;
  }

  /** Adds the counts kept by a {@code PseudoLruCache} to this result. */
  public void recordAll(CacheStats stats) {
    hits += stats.hitCount();
    misses += stats.missCount();
    evictions += stats.evictionCount();
  }

  public long hitCount() {
    return hits;
  }

  public long missCount() {
    return misses;
  }

  public long evictionCount() {
    return evictions;
  }

  public long requestCount() {
    return hits + misses;
  }

  public double hitRate() {
    long requests = requestCount();
    return (requests == 0) ? 1.0 : (double) hits / requests;
  }

  public double missRate() {
    long requests = requestCount();
    return (requests == 0) ? 0.0 : (double) misses / requests;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("hits", hits)
        .add("misses", misses)
        .add("evictions", evictions)
        .add("elapsed", stopwatch)
        .toString();
  }
}
