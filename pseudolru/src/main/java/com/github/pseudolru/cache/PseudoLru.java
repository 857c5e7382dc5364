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
package com.github.pseudolru.cache;

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A builder of {@link PseudoLruCache} instances having any combination of the following features:
 * <ul>
 *   <li>a maximum number of values
 *   <li>the number of random items probed when choosing a value to evict
 *   <li>the source of randomness used by that search
 * </ul>
 * <p>
 * Usage example:
 * <pre>{@code
 *   PseudoLruCache<Graph> graphs = PseudoLru.newBuilder()
 *       .capacity(10_000)
 *       .sampleSize(20)
 *       .build();
 * }</pre>
 * <p>
 * Each setting may be configured at most once. This builder does not alter its state when building,
 * so it can be invoked again to create multiple independent caches.
 */
public final class PseudoLru {
  static final int UNSET_INT = -1;

  int capacity = UNSET_INT;
  int sampleSize = UNSET_INT;
  @Nullable RandomSampler sampler;

  private PseudoLru() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /**
   * Constructs a new {@code PseudoLru} instance with default settings: a sample size of
   * {@value PseudoLruCache#DEFAULT_SAMPLE_SIZE} and a randomly seeded sampler. A capacity must be
   * set before building.
   *
   * @return a new instance with default settings
   */
  public static PseudoLru newBuilder() {
    return new PseudoLru();
  }

  /**
   * Specifies the maximum number of values the cache may contain. The capacity must be at least
   * {@link PseudoLruCache#minimumCapacity} for the configured sample size, which is verified when
   * the cache is built.
   *
   * @param capacity the maximum number of values the cache may contain
   * @return this {@code PseudoLru} instance (for chaining)
   * @throws IllegalArgumentException if {@code capacity} is negative
   * @throws IllegalStateException if a capacity was already set
   */
  @CanIgnoreReturnValue
  public PseudoLru capacity(@NonNegative int capacity) {
    requireState(this.capacity == UNSET_INT, "capacity was already set to %s", this.capacity);
    requireArgument(capacity >= 0, "capacity must not be negative");
    this.capacity = capacity;
    return this;
  }

  /**
   * Specifies how many random items are compared against the eviction candidates when the cache
   * needs to evict a value. A larger sample evicts closer to the true least recently used value at
   * the cost of a slower admission.
   *
   * @param sampleSize the number of random items probed per eviction
   * @return this {@code PseudoLru} instance (for chaining)
   * @throws IllegalArgumentException if {@code sampleSize} is not positive
   * @throws IllegalStateException if a sample size was already set
   */
  @CanIgnoreReturnValue
  public PseudoLru sampleSize(int sampleSize) {
    requireState(this.sampleSize == UNSET_INT,
        "sample size was already set to %s", this.sampleSize);
    requireArgument(sampleSize > 0, "sample size must be positive");
    this.sampleSize = sampleSize;
    return this;
  }

  /**
   * Specifies the source of randomness for the eviction search. A cache only calls its sampler
   * while holding its lock, but a sampler shared by multiple caches built from this instance must
   * be thread-safe.
   *
   * @param sampler the source of uniformly distributed positions
   * @return this {@code PseudoLru} instance (for chaining)
   * @throws IllegalStateException if a sampler was already set
   */
  @CanIgnoreReturnValue
  public PseudoLru sampler(RandomSampler sampler) {
    requireState(this.sampler == null, "sampler was already set to %s", this.sampler);
    this.sampler = requireNonNull(sampler);
    return this;
  }

  int getSampleSize() {
    return (sampleSize == UNSET_INT) ? PseudoLruCache.DEFAULT_SAMPLE_SIZE : sampleSize;
  }

  RandomSampler getSampler() {
    return (sampler == null) ? RandomSampler.splittable() : sampler;
  }

  /**
   * Builds a cache with the configured settings.
   *
   * @param <V> the type of the cached values
   * @return a cache having the requested features
   * @throws IllegalStateException if the capacity was not set
   * @throws IllegalArgumentException if the capacity is less than the minimum for the sample size
   */
  public <V> PseudoLruCache<V> build() {
    requireState(capacity != UNSET_INT, "capacity must be set");
    return new PseudoLruCache<>(capacity, getSampleSize(), getSampler());
  }

  @Override
  public String toString() {
    var s = new StringBuilder(64);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (capacity != UNSET_INT) {
      s.append("capacity=").append(capacity).append(", ");
    }
    if (sampleSize != UNSET_INT) {
      s.append("sampleSize=").append(sampleSize).append(", ");
    }
    if (sampler != null) {
      s.append("sampler, ");
    }
    if (s.length() > baseLength) {
      s.setLength(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
