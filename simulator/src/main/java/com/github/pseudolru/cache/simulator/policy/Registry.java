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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.util.Locale.US;
import static java.util.Objects.requireNonNull;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

import com.github.pseudolru.cache.simulator.BasicSettings;
import com.github.pseudolru.cache.simulator.policy.Policy.PolicySpec;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.typesafe.config.Config;

/**
 * The registry of caching policies.
 */
public final class Registry {
  private final Map<String, Factory> factories;
  private final BasicSettings settings;

  public Registry(BasicSettings settings) {
    this.settings = requireNonNull(settings);
    this.factories = new HashMap<>();
    buildRegistry();
  }

  /**
   * Returns a new instance of each of the policies that have been configured for simulation, in
   * their configured order.
   *
   * @throws IllegalArgumentException if a configured policy is not registered
   */
  public ImmutableList<Policy> policies() {
    return settings.policies().stream()
        .map(name -> {
          var factory = factories.get(name);
          checkArgument(factory != null, "%s not found", name);
          return factory.creator().apply(settings.config());
        })
        .collect(toImmutableList());
  }

  /** Returns the names of all registered policies. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(factories.keySet());
  }

  private void buildRegistry() {
    register(PseudoLruPolicy.class, PseudoLruPolicy::new);
    register(LruPolicy.class, LruPolicy::new);
    register(RandomPolicy.class, RandomPolicy::new);
  }

  /** Registers the policy based on the annotated name. */
  private void register(Class<? extends Policy> policyClass, Function<Config, Policy> creator) {
    PolicySpec policySpec = policyClass.getAnnotation(PolicySpec.class);
    checkState((policySpec != null) && !policySpec.name().isBlank(),
        "The name must be specified on %s", policyClass);
    factories.put(policySpec.name().trim().toLowerCase(US), new Factory(policyClass, creator));
  }

  record Factory(Class<? extends Policy> policyClass, Function<Config, Policy> creator) {
    Factory {
      requireNonNull(policyClass);
      requireNonNull(creator);
    }
  }
}
