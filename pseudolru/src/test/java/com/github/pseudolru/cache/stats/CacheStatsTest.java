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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public final class CacheStatsTest {

  @Test(dataProvider = "negativeCounts")
  public void of_negative(long hits, long misses, long sampled, long truncated) {
    assertThrows(IllegalArgumentException.class,
        () -> CacheStats.of(hits, misses, sampled, truncated));
  }

  @Test
  public void empty() {
    var stats = CacheStats.empty();
    assertThat(stats.requestCount()).isEqualTo(0);
    assertThat(stats.evictionCount()).isEqualTo(0);
    assertThat(stats.hitRate()).isNaN();
    assertThat(stats.missRate()).isNaN();
    assertThat(stats).isEqualTo(CacheStats.of(0, 0, 0, 0));
    assertThat(stats.toString()).isEqualTo(
        "CacheStats{hitCount=0, missCount=0, sampledEvictionCount=0, truncationCount=0}");
  }

  @Test
  public void populated() {
    var stats = CacheStats.of(30, 10, 6, 2);
    assertThat(stats.requestCount()).isEqualTo(40);
    assertThat(stats.hitRate()).isEqualTo(0.75);
    assertThat(stats.missRate()).isEqualTo(0.25);
    assertThat(stats.sampledEvictionCount()).isEqualTo(6);
    assertThat(stats.truncationCount()).isEqualTo(2);
    assertThat(stats.evictionCount()).isEqualTo(8);
  }

  @Test
  public void equality_distinguishesEvictionKinds() {
    var sampled = CacheStats.of(1, 1, 2, 0);
    var truncated = CacheStats.of(1, 1, 0, 2);
    assertThat(sampled.evictionCount()).isEqualTo(truncated.evictionCount());
    assertThat(sampled).isNotEqualTo(truncated);
    assertThat(sampled).isEqualTo(CacheStats.of(1, 1, 2, 0));
    assertThat(sampled.hashCode()).isEqualTo(CacheStats.of(1, 1, 2, 0).hashCode());
    assertThat(sampled).isNotEqualTo(new Object());
  }

  @DataProvider(name = "negativeCounts")
  public Object[][] providesNegativeCounts() {
    return new Object[][] {
        { -1L,  0L,  0L,  0L },
        {  0L, -1L,  0L,  0L },
        {  0L,  0L, -1L,  0L },
        {  0L,  0L,  0L, -1L },
    };
  }
}
