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

import java.util.SplittableRandom;

/**
 * A source of uniformly distributed integers used to pick the positions probed by the eviction
 * search.
 * <p>
 * The cache only calls the sampler while holding its eviction lock, so an implementation does not
 * need to be thread-safe unless it is shared across multiple caches.
 */
@FunctionalInterface
public interface RandomSampler {

  /**
   * Returns a pseudorandom value between the bounds.
   *
   * @param lowInclusive the least value that may be returned
   * @param highExclusive the upper bound (exclusive), which must be greater than
   *        {@code lowInclusive}
   * @return a uniformly distributed value in {@code [lowInclusive, highExclusive)}
   */
  int nextInRange(int lowInclusive, int highExclusive);

  /**
   * Returns a sampler backed by a {@link SplittableRandom} with an unpredictable seed.
   *
   * @return a sampler for use by a single cache
   */
  static RandomSampler splittable() {
    var random = new SplittableRandom();
    return random::nextInt;
  }

  /**
   * Returns a sampler backed by a {@link SplittableRandom} that yields a repeatable sequence.
   *
   * @param seed the initial seed
   * @return a sampler for use by a single cache
   */
  static RandomSampler seeded(long seed) {
    var random = new SplittableRandom(seed);
    return random::nextInt;
  }
}
