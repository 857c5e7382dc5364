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

import java.util.Random;

import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.Policy.PolicySpec;
import com.typesafe.config.Config;

import it.unimi.dsi.fastutil.longs.Long2IntMap;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * A policy that evicts a uniformly random resident key. This is the baseline that shows how much
 * of the recency signal an approximate policy captures.
 */
@PolicySpec(name = "random")
public final class RandomPolicy implements Policy {
  private final Long2IntMap indexes;
  private final PolicyStats policyStats;
  private final Random random;
  private final long[] table;

  private int size;

  public RandomPolicy(Config config) {
    var settings = new BasicSettings(config);
    this.policyStats = new PolicyStats(name());
    this.random = new Random(settings.randomSeed());
    this.table = new long[settings.maximumSize()];
    this.indexes = new Long2IntOpenHashMap();
  }

  @Override
  public void record(long key) {
    if (indexes.containsKey(key)) {
      policyStats.recordHit();
      return;
    }

    policyStats.recordMiss();
    if (size < table.length) {
      table[size] = key;
      indexes.put(key, size);
      size++;
    } else {
      int victim = random.nextInt(table.length);
      indexes.remove(table[victim]);
      policyStats.recordEviction();
      table[victim] = key;
      indexes.put(key, victim);
    }
  }

  @Override
  public PolicyStats stats() {
    return policyStats;
  }
}
