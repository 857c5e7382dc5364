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
package com.github.pseudolru.cache;

import static com.google.common.truth.Truth.assertAbout;

import org.jspecify.annotations.Nullable;

import com.google.common.collect.Sets;
import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;

/**
 * Propositions for {@link PseudoLruCache} subjects.
 */
final class PseudoLruCacheSubject extends Subject {
  private final PseudoLruCache<?> actual;

  private PseudoLruCacheSubject(FailureMetadata metadata, PseudoLruCache<?> subject) {
    super(metadata, subject);
    this.actual = subject;
  }

  public static Factory<PseudoLruCacheSubject, PseudoLruCache<?>> pseudoLru() {
    return PseudoLruCacheSubject::new;
  }

  public static PseudoLruCacheSubject assertThat(PseudoLruCache<?> actual) {
    return assertAbout(pseudoLru()).that(actual);
  }

  /** Fails if the cache does not have the given size. */
  public void hasSize(int expectedSize) {
    check("size()").that(actual.size()).isEqualTo(expectedSize);
  }

  /** Fails if the cache has any occupied slots. */
  public void isEmpty() {
    check("isEmpty()").that(actual.isEmpty()).isTrue();
    hasSize(0);
  }

  /** Fails if the table's slots are inconsistent with the size and the write cursor. */
  @SuppressWarnings("GuardedBy")
  public void isValid() {
    actual.evictionLock.lock();
    try {
      checkBounds();
      checkOccupancy();
      checkPositions();
    } finally {
      actual.evictionLock.unlock();
    }
  }

  @SuppressWarnings("GuardedBy")
  private void checkBounds() {
    check("table.length").that(actual.table.length).isEqualTo(actual.capacity());
    check("size()").that(actual.size()).isAtLeast(0);
    check("size()").that(actual.size()).isAtMost(actual.capacity());
    check("addPosition").that(actual.addPosition).isAtLeast(0);
    check("addPosition").that(actual.addPosition).isLessThan(actual.capacity());
    if (!actual.isFull()) {
      check("table[addPosition]").that(actual.table[actual.addPosition]).isNull();
    }
  }

  @SuppressWarnings("GuardedBy")
  private void checkOccupancy() {
    var seen = Sets.<CacheItem<?>>newIdentityHashSet();
    for (@Nullable CacheItem<?> item : actual.table) {
      if (item != null) {
        check("duplicate").withMessage("Duplicate item: %s", item)
            .that(seen.add(item)).isTrue();
        check("resident").withMessage("Non-resident item in table: %s", item)
            .that(item.resident).isTrue();
        check("cache").that(item.cache).isSameInstanceAs(actual);
      }
    }
    check("occupied slots").that(seen.size()).isEqualTo(actual.size());
  }

  @SuppressWarnings("GuardedBy")
  private void checkPositions() {
    var seen = Sets.<CacheItem<?>>newIdentityHashSet();
    for (int position = 0; position < actual.size(); position++) {
      var item = actual.table[actual.positionToIndex(position)];
      check("table[positionToIndex(%s)]", position).that(item).isNotNull();
      check("position %s", position).withMessage("Position maps to a visited item: %s", item)
          .that(seen.add(item)).isTrue();
    }
  }
}
