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

import java.util.LinkedHashMap;
import java.util.Map;

import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.Policy.PolicySpec;
import com.typesafe.config.Config;

/**
 * The exact least recently used policy, backed by an access ordered {@link LinkedHashMap}.
 */
@PolicySpec(name = "lru")
public final class LruPolicy implements Policy {
  private final Map<Long, Boolean> data;
  private final PolicyStats policyStats;
  private final int maximumSize;

  public LruPolicy(Config config) {
    var settings = new BasicSettings(config);
    this.policyStats = new PolicyStats(name());
    this.maximumSize = settings.maximumSize();
    this.data = new LinkedHashMap<>(16, 0.75f, /* accessOrder= */ true) {
      private static final long serialVersionUID = 1L;

      @Override
      protected boolean removeEldestEntry(Map.Entry<Long, Boolean> eldest) {
        boolean evict = (size() > maximumSize);
        if (evict) {
          policyStats.recordEviction();
        }
        return evict;
      }
    };
  }

  @Override
  public void record(long key) {
    if (data.get(key) == null) {
      data.put(key, Boolean.TRUE);
      policyStats.recordMiss();
    } else {
      policyStats.recordHit();
    }
  }

  @Override
  public PolicyStats stats() {
    return policyStats;
  }
}
