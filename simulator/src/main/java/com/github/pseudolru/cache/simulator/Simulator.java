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
import static java.util.Locale.US;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.List;

import com.github.pseudolru.cache.simulator.policy.Policy;
import com.github.pseudolru.cache.simulator.policy.PolicyStats;
import com.github.pseudolru.cache.simulator.policy.Registry;
import com.github.pseudolru.cache.simulator.report.TableReporter;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A simulator that replays a synthetic access trace against each configured policy and prints an
 * aggregated report. See <tt>reference.conf</tt> for details on the configuration.
 * <p>
 * The trace is generated once and then replayed against every policy, so that all of them observe
 * the same sequence of keys. A key seen for the first time is a compulsory miss for every policy,
 * while later misses are caused by the policy having evicted the key.
 */
public final class Simulator {
  private static final Logger logger = System.getLogger(Simulator.class.getName());

  private final BasicSettings settings;

  public Simulator(Config config) {
    settings = new BasicSettings(config.getConfig("pseudolru.simulator"));
  }

  /** Replays the trace against all of the policies and reports their statistics. */
  public void run() {
    var policies = new Registry(settings).policies();
    if (policies.isEmpty()) {
      System.err.println("No active policies in the current configuration");
      return;
    }

    long[] trace = Synthetic.generate(settings.synthetic()).toArray();
    logger.log(Level.INFO, "Replaying {0} events against {1} policies",
        trace.length, policies.size());
    var results = simulate(trace, policies);
    new TableReporter(settings).print(results);
  }

  /** Returns the statistics of each policy after it recorded every key of the trace. */
  static ImmutableList<PolicyStats> simulate(long[] trace, List<Policy> policies) {
    checkArgument(!policies.isEmpty(), "No policies to simulate");
    var results = ImmutableList.<PolicyStats>builder();
    for (var policy : policies) {
      policy.stats().stopwatch().start();
      for (long key : trace) {
        policy.record(key);
      }
      policy.finished();
      policy.stats().stopwatch().stop();
      logger.log(Level.DEBUG, "Completed {0} in {1}", policy.name(), policy.stats().stopwatch());
      results.add(policy.stats());
    }
    return results.build();
  }

  public static void main(String[] args) {
    java.util.logging.Logger.getLogger("").setLevel(java.util.logging.Level.WARNING);
    var simulator = new Simulator(ConfigFactory.load());
    var stopwatch = Stopwatch.createStarted();
    simulator.run();
    System.out.printf(US, "Executed in %s%n", stopwatch);
  }
}
