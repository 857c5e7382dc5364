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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;

import java.util.Arrays;
import java.util.function.Function;
import java.util.stream.LongStream;

import com.github.pseudolru.cache.simulator.BasicSettings.SyntheticSettings;

import site.ycsb.generator.CounterGenerator;
import site.ycsb.generator.HotspotIntegerGenerator;
import site.ycsb.generator.NumberGenerator;
import site.ycsb.generator.ScrambledZipfianGenerator;
import site.ycsb.generator.UniformLongGenerator;
import site.ycsb.generator.ZipfianGenerator;

/**
 * Synthetic access traces built from YCSB's key generators. A trace is a stream of keys in the
 * order that they are requested.
 */
public final class Synthetic {

  private Synthetic() {}

  /** Returns the trace described by the settings. */
  public static LongStream generate(SyntheticSettings settings) {
    var distribution = settings.distribution();
    return take(distribution.generatorFactory.apply(settings), settings.events());
  }

  /** Returns {@code events} consecutive keys, beginning with {@code start}. */
  public static LongStream counter(int start, int events) {
    return take(new CounterGenerator(start), events);
  }

  /** Returns keys drawn with equal probability from {@code [lowerBound, upperBound]}. */
  public static LongStream uniform(int lowerBound, int upperBound, int events) {
    return take(new UniformLongGenerator(lowerBound, upperBound), events);
  }

  /**
   * Returns keys from {@code [lowerBound, upperBound]} where the lowest {@code hotsetFraction} of
   * the keys receives {@code hotOpnFraction} of the events. Keys within the hot and the cold set
   * are drawn uniformly.
   */
  public static LongStream hotspot(int lowerBound, int upperBound,
      double hotsetFraction, double hotOpnFraction, int events) {
    return take(new HotspotIntegerGenerator(lowerBound, upperBound,
        hotsetFraction, hotOpnFraction), events);
  }

  /**
   * Returns keys from {@code [0, items)} whose popularity follows Zipf's law with the given skew,
   * so that key 0 is the most popular.
   */
  public static LongStream zipfian(int items, double constant, int events) {
    return take(new ZipfianGenerator(items, constant), events);
  }

  /** Returns a Zipfian trace whose popular keys are hashed across {@code [0, items)}. */
  public static LongStream scrambledZipfian(int items, double constant, int events) {
    return take(new ScrambledZipfianGenerator(0, items - 1, constant), events);
  }

  private static LongStream take(NumberGenerator generator, int events) {
    return LongStream.range(0, events).map(i -> generator.nextValue().longValue());
  }

  /** The shapes of trace that can be configured by name. */
  public enum Distribution {
    COUNTER(settings -> new CounterGenerator(settings.counterStart())),
    UNIFORM(settings -> new UniformLongGenerator(
        settings.uniform().lowerBound(), settings.uniform().upperBound())),
    HOTSPOT(settings -> new HotspotIntegerGenerator(settings.hotspot().lowerBound(),
        settings.hotspot().upperBound(), settings.hotsetFraction(), settings.hotOpnFraction())),
    ZIPFIAN(settings -> new ZipfianGenerator(
        settings.zipfianItems(), settings.zipfianConstant())),
    SCRAMBLED_ZIPFIAN(settings -> new ScrambledZipfianGenerator(
        0, settings.zipfianItems() - 1, settings.zipfianConstant()));

    final Function<SyntheticSettings, NumberGenerator> generatorFactory;

    Distribution(Function<SyntheticSettings, NumberGenerator> generatorFactory) {
      this.generatorFactory = generatorFactory;
    }

    /** Returns the name used in the configuration, such as {@code scrambled-zipfian}. */
    public String configName() {
      return name().toLowerCase(US).replace('_', '-');
    }

    /**
     * Returns the distribution with the configured name, ignoring case and surrounding spaces.
     *
     * @throws IllegalArgumentException if no distribution has that name
     */
    public static Distribution named(String configName) {
      String normalized = configName.trim().toLowerCase(US);
      for (var distribution : values()) {
        if (distribution.configName().equals(normalized)) {
          return distribution;
        }
      }
      throw new IllegalArgumentException(String.format(US, "Unknown distribution %s, expected %s",
          configName, Arrays.stream(values()).map(Distribution::configName)
              .collect(toImmutableList())));
    }
  }
}
