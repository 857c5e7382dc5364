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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.PolicyStats;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.jakewharton.fliptables.FlipTable;

/**
 * A plain text report that pretty-prints to a table, written to the console or to a file.
 */
public final class TableReporter implements Reporter {
  private static final ImmutableMap<String, Comparator<PolicyStats>> COLUMNS =
      ImmutableMap.<String, Comparator<PolicyStats>>builder()
          .put("Policy", Comparator.comparing(PolicyStats::name))
          .put("Hit Rate", Comparator.comparingDouble(PolicyStats::hitRate))
          .put("Miss Rate", Comparator.comparingDouble(PolicyStats::missRate))
          .put("Hits", Comparator.comparingLong(PolicyStats::hitCount))
          .put("Misses", Comparator.comparingLong(PolicyStats::missCount))
          .put("Requests", Comparator.comparingLong(PolicyStats::requestCount))
          .put("Evictions", Comparator.comparingLong(PolicyStats::evictionCount))
          .put("Time", Comparator.comparing(stats -> stats.stopwatch().elapsed()))
          .buildOrThrow();

  private final BasicSettings settings;

  public TableReporter(BasicSettings settings) {
    this.settings = requireNonNull(settings);
  }

  @Override
  public void print(List<PolicyStats> results) {
    String report = assemble(results);
    String output = settings.report().output();
    if (output.equalsIgnoreCase("console")) {
      System.out.println(report);
      return;
    }

    try {
      var path = Path.of(output);
      var parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(path, report, UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Assembles an aggregated report. */
  String assemble(List<PolicyStats> results) {
    var sorted = ImmutableList.sortedCopyOf(comparator(), results);
    String[] headers = COLUMNS.keySet().toArray(new String[0]);
    String[][] data = new String[sorted.size()][];
    for (int i = 0; i < sorted.size(); i++) {
      PolicyStats policyStats = sorted.get(i);
      data[i] = new String[] {
          policyStats.name(),
          String.format(US, "%.2f %%", 100 * policyStats.hitRate()),
          String.format(US, "%.2f %%", 100 * policyStats.missRate()),
          String.format(US, "%,d", policyStats.hitCount()),
          String.format(US, "%,d", policyStats.missCount()),
          String.format(US, "%,d", policyStats.requestCount()),
          String.format(US, "%,d", policyStats.evictionCount()),
          policyStats.stopwatch().toString()
      };
    }
    return FlipTable.of(headers, data);
  }

  /** Returns a comparator that sorts by the configured column. */
  private Comparator<PolicyStats> comparator() {
    String sortBy = settings.report().sortBy();
    Comparator<PolicyStats> comparator = COLUMNS.entrySet().stream()
        .filter(column -> column.getKey().equalsIgnoreCase(sortBy))
        .map(column -> column.getValue())
        .findAny().orElseThrow(() -> new IllegalArgumentException(
            "Unknown sort order: " + sortBy));
    return settings.report().ascending() ? comparator : comparator.reversed();
  }
}
