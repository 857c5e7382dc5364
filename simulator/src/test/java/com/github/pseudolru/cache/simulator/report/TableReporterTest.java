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
package com.github.pseudolru.cache.simulator.report;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;

import org.testng.annotations.Test;

import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.PolicyStats;
import com.github.pseudolru.cache.stats.CacheStats;
import com.typesafe.config.ConfigFactory;

public final class TableReporterTest {

  @Test
  public void assemble_sortedByHitRate() {
    var reporter = reporter(Map.of("report.sort-by", "hit rate", "report.ascending", false));
    String report = reporter.assemble(List.of(stats("low", 1, 9), stats("high", 9, 1)));

    assertThat(report).contains("Hit Rate");
    assertThat(report).contains("90.00 %");
    assertThat(report).contains("10.00 %");
    assertThat(report.indexOf("high")).isLessThan(report.indexOf("low"));
  }

  @Test
  public void assemble_sortedByPolicy() {
    var reporter = reporter(Map.of("report.sort-by", "Policy", "report.ascending", true));
    String report = reporter.assemble(List.of(stats("lru", 1, 1), stats("pseudo-lru", 1, 1)));
    assertThat(report.indexOf("lru")).isLessThan(report.indexOf("pseudo-lru"));
  }

  @Test
  public void assemble_unknownSortOrder() {
    var reporter = reporter(Map.of("report.sort-by", "latency"));
    assertThrows(IllegalArgumentException.class,
        () -> reporter.assemble(List.of(stats("lru", 1, 1))));
  }

  @Test
  public void print_toFile() throws IOException {
    var directory = Files.createTempDirectory("report");
    var path = directory.resolve("nested").resolve("report.txt");
    var reporter = reporter(Map.of("report.output", path.toString()));
    reporter.print(List.of(stats("lru", 3, 1)));

    String report = Files.readString(path, UTF_8);
    assertThat(report).contains("lru");
    assertThat(report).contains("75.00 %");
  }

  private static TableReporter reporter(Map<String, ?> overrides) {
    var config = ConfigFactory.parseMap(overrides)
        .withFallback(ConfigFactory.load().getConfig("pseudolru.simulator"));
    return new TableReporter(new BasicSettings(config));
  }

  private static PolicyStats stats(String name, long hits, long misses) {
    var stats = new PolicyStats(name);
    stats.recordAll(CacheStats.of(hits, misses, 0, 0));
    return stats;
  }
}
