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

import static com.github.pseudolru.cache.PseudoLruCacheSubject.assertThat;
import static com.github.pseudolru.cache.PseudoLruCacheTest.newCache;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.util.concurrent.atomic.AtomicInteger;

import org.testng.annotations.Test;

public final class CacheItemTest {

  @Test
  public void get_present() {
    var cache = newCache(40);
    var item = cache.admit("a");
    long admitted = item.lastAccess;

    assertThat(item.get()).isEqualTo("a");
    assertThat(item.get()).isEqualTo("a");
    assertThat(item.lastAccess).isGreaterThan(admitted);
    assertThat(cache).hasSize(1);
  }

  @Test
  public void get_absent() {
    var cache = newCache(40);
    var item = cache.admit(null);
    assertThat(item.get()).isNull();
    assertThat(item.lastAccess).isEqualTo(CacheItem.UNCACHED);
  }

  @Test
  public void isCached_doesNotRefresh() {
    var cache = newCache(40);
    var item = cache.admit("a");
    long admitted = item.lastAccess;

    assertThat(item.isCached()).isTrue();
    assertThat(item.lastAccess).isEqualTo(admitted);
  }

  @Test
  public void getOrCreate_present() {
    var cache = newCache(40);
    var item = cache.admit("a");
    var value = item.getOrCreate(() -> {
      throw new AssertionError();
    });

    assertThat(value).isEqualTo("a");
    assertThat(cache.hits()).isEqualTo(1);
    assertThat(cache.misses()).isEqualTo(0);
  }

  @Test
  public void getOrCreate_absent() {
    var cache = newCache(40);
    var item = cache.admit("a");
    item.invalidate();

    var calls = new AtomicInteger();
    var value = item.getOrCreate(() -> "b" + calls.incrementAndGet());
    assertThat(value).isEqualTo("b1");
    assertThat(item.getOrCreate(() -> "b" + calls.incrementAndGet())).isEqualTo("b1");
    assertThat(calls.get()).isEqualTo(1);
    assertThat(cache.misses()).isEqualTo(1);
    assertThat(cache.hits()).isEqualTo(1);
    assertThat(cache).hasSize(1);
    assertThat(cache).isValid();
  }

  @Test
  public void getOrCreate_nullValue() {
    var cache = newCache(40);
    var item = cache.admit(null);

    assertThat(item.getOrCreate(() -> null)).isNull();
    assertThat(item.isCached()).isFalse();
    assertThat(cache.misses()).isEqualTo(1);
    assertThat(cache).isEmpty();
  }

  @Test
  public void getOrCreate_creatorFails() {
    var cache = newCache(40);
    var item = cache.admit(null);

    assertThrows(IllegalStateException.class, () -> item.getOrCreate(() -> {
      throw new IllegalStateException();
    }));
    assertThat(item.isCached()).isFalse();
    assertThat(cache.misses()).isEqualTo(0);
    assertThat(cache).isEmpty();
  }

  @Test
  public void getOrCreate_nullCreator() {
    var cache = newCache(40);
    var item = cache.admit("a");
    assertThrows(NullPointerException.class, () -> item.getOrCreate(null));
  }

  @Test
  public void set_null_keepsSlot() {
    var cache = newCache(40);
    var item = cache.admit("a");
    item.set(null);

    assertThat(item.isCached()).isFalse();
    assertThat(item.get()).isNull();
    assertThat(item.lastAccess).isEqualTo(CacheItem.UNCACHED);
    assertThat(cache).hasSize(1);
    assertThat(cache).isValid();
  }

  @Test
  public void set_afterInvalidate_doesNotReinsert() {
    var cache = newCache(40);
    var item = cache.admit("a");
    item.invalidate();
    item.set("b");

    assertThat(item.get()).isEqualTo("b");
    assertThat(cache).hasSize(1);
    assertThat(cache).isValid();
  }

  @Test
  public void set_sameValue() {
    var cache = newCache(40);
    var value = "a";
    var item = cache.admit(value);
    long admitted = item.lastAccess;
    item.set(value);

    assertThat(item.lastAccess).isEqualTo(admitted);
    assertThat(cache).hasSize(1);
    assertThat(cache).isValid();
  }

  @Test
  public void set_differentValue() {
    var cache = newCache(40);
    var item = cache.admit("a");
    long admitted = item.lastAccess;
    item.set("b");

    assertThat(item.get()).isEqualTo("b");
    assertThat(item.lastAccess).isGreaterThan(admitted);
    assertThat(cache).hasSize(1);
    assertThat(cache).isValid();
  }

  @Test
  public void isOlderThan() {
    var cache = newCache(40);
    var first = cache.admit("a");
    var second = cache.admit("b");
    var empty = cache.admit(null);

    assertThat(first.isOlderThan(second)).isTrue();
    assertThat(second.isOlderThan(first)).isFalse();
    assertThat(empty.isOlderThan(first)).isTrue();

    assertThat(first.get()).isEqualTo("a");
    assertThat(second.isOlderThan(first)).isTrue();
  }

  @Test
  public void toString_cached() {
    var cache = newCache(40);
    var item = cache.admit("a");
    assertThat(item.toString()).isEqualTo("CacheItem{cached=true, lastAccess=1}");
  }

  @Test
  public void toString_uncached() {
    var cache = newCache(40);
    var item = cache.admit(null);
    assertThat(item.toString()).isEqualTo("CacheItem{cached=false, lastAccess=none}");
  }
}
