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

import static java.util.Locale.US;

import com.github.pseudolru.cache.CacheItem;
import com.github.pseudolru.cache.PseudoLru;
import com.github.pseudolru.cache.PseudoLruCache;
import com.github.pseudolru.cache.RandomSampler;
import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.Policy.PolicySpec;
import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

/**
 * The Monte-Carlo approximation of LRU. Each distinct key retains the item that holds it, as a
 * caller of the cache would, and recreates the value through the item after it was evicted. The
 * first access to a key is a compulsory miss, and the hits and misses of later accesses are taken
 * from the cache's own statistics.
 */
@PolicySpec(name = "pseudo-lru")
public final class PseudoLruPolicy implements Policy {
  private final Long2ObjectMap<CacheItem<Long>> items;
  private final PseudoLruCache<Long> cache;
  private final PolicyStats policyStats;

  public PseudoLruPolicy(Config config) {
    var settings = new BasicSettings(config);
    policyStats = new PolicyStats(String.format(US, "%s (sample=%d)",
        name(), settings.pseudoLru().sampleSize()));
    cache = PseudoLru.newBuilder()
        .capacity(settings.maximumSize())
        .sampleSize(settings.pseudoLru().sampleSize())
        .sampler(RandomSampler.seeded(settings.randomSeed()))
        .build();
    items = new Long2ObjectOpenHashMap<>();
  }

  @Override
  public void record(long key) {
    var item = items.get(key);
    if (item == null) {
      items.put(key, cache.admit(key));
      policyStats.recordMiss();
    } else {
      item.getOrCreate(() -> key);
    }
  }

  @Override
  public void finished() {
    policyStats.recordAll(cache.stats());
  }

  @Override
  public PolicyStats stats() {
    return policyStats;
  }
}
