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
package com.github.pseudolru.cache.simulator;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import com.github.pseudolru.cache.simulator.Synthetic.Distribution;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;

/**
 * Typed access to the {@code pseudolru.simulator} section of the configuration. Each accessor
 * reads the value when it is called, so an invalid setting fails only when it is used.
 */
public class BasicSettings {
  private final Config config;

  public BasicSettings(Config config) {
    this.config = requireNonNull(config);
  }

  /** Returns the configuration rooted at {@code pseudolru.simulator}. */
  public Config config() {
    return config;
  }

  /** Returns the policy names in their configured order, lower cased and without repeats. */
  public ImmutableList<String> policies() {
    return config.getStringList("policies").stream()
        .map(name -> name.trim().toLowerCase(US))
        .distinct()
        .collect(toImmutableList());
  }

  /** Returns the number of entries that every policy may hold. */
  public int maximumSize() {
    int maximumSize = config.getInt("maximum-size");
    checkArgument(maximumSize > 0, "maximum-size must be positive: %s", maximumSize);
    return maximumSize;
  }

  /** Returns the seed shared by the randomized policies, so that runs are repeatable. */
  public long randomSeed() {
    return config.getLong("random-seed");
  }

  public PseudoLruSettings pseudoLru() {
    return new PseudoLruSettings();
  }

  public SyntheticSettings synthetic() {
    return new SyntheticSettings();
  }

  public ReportSettings report() {
    return new ReportSettings();
  }

  public final class PseudoLruSettings {
    /** Returns the number of random items that an eviction compares against its candidates. */
    public int sampleSize() {
      return config.getInt("pseudo-lru.sample-size");
    }
  }

  /** The trace that is generated once and replayed against every policy. */
  public final class SyntheticSettings {
    public Distribution distribution() {
      return Distribution.named(config.getString("synthetic.distribution"));
    }
    public int events() {
      int events = config.getInt("synthetic.events");
      checkArgument(events >= 0, "synthetic.events must not be negative: %s", events);
      return events;
    }
    public int counterStart() {
      return config.getInt("synthetic.counter.start");
    }
    public KeyRange uniform() {
      return keyRange("synthetic.uniform");
    }
    public KeyRange hotspot() {
      return keyRange("synthetic.hotspot");
    }
    /** Returns the fraction of the hotspot's keys that form its hot set. */
    public double hotsetFraction() {
      return config.getDouble("synthetic.hotspot.hotset-fraction");
    }
    /** Returns the fraction of the hotspot's events that draw from its hot set. */
    public double hotOpnFraction() {
      return config.getDouble("synthetic.hotspot.hot-opn-fraction");
    }
    public int zipfianItems() {
      return config.getInt("synthetic.zipfian.items");
    }
    public double zipfianConstant() {
      return config.getDouble("synthetic.zipfian.constant");
    }

    private KeyRange keyRange(String path) {
      return new KeyRange(config.getInt(path + ".lower-bound"),
          config.getInt(path + ".upper-bound"));
    }
  }

  public final class ReportSettings {
    /** Returns the name of the column that orders the rows. */
    public String sortBy() {
      return config.getString("report.sort-by").trim();
    }
    public boolean ascending() {
      return config.getBoolean("report.ascending");
    }
    /** Returns {@code console} or the path of the file to write. */
    public String output() {
      return config.getString("report.output").trim();
    }
  }

  /** An inclusive range of keys. */
  public record KeyRange(int lowerBound, int upperBound) {
    public KeyRange {
      checkArgument(lowerBound <= upperBound,
          "lower bound %s exceeds upper bound %s", lowerBound, upperBound);
    }
  }
}
