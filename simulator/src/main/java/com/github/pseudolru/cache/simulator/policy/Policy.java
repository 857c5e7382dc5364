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

import static com.google.common.base.Preconditions.checkState;
import static java.lang.annotation.ElementType.TYPE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/**
 * An eviction policy that is fed one key at a time and counts whether each was already resident.
 * Implementations are created per run and are never shared between threads.
 */
public interface Policy {

  /** Requests the key, admitting it if absent. */
  void record(long key);

  /** Called once after the last key, for policies that keep their counts elsewhere. */
  default void finished() {}

  /** Returns the counts gathered so far. */
  PolicyStats stats();

  /** Returns the name from the {@link PolicySpec} on the implementing class. */
  default String name() {
    var spec = getClass().getAnnotation(PolicySpec.class);
    checkState(spec != null, "%s is missing @PolicySpec", getClass().getSimpleName());
    return spec.name().trim();
  }

  /** Names a policy so that it can be selected in the configuration. */
  @Retention(RUNTIME)
  @Target(TYPE)
  @interface PolicySpec {
    String name();
  }
}
