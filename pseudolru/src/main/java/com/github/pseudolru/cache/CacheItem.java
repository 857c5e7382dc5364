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

import static java.util.Objects.requireNonNull;

import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * A holder for a value that is kept in a {@link PseudoLruCache} and may be evicted from it at any
 * time. An item is obtained from {@link PseudoLruCache#admit} and must be retained by the caller,
 * as the cache cannot be searched for it later. When the value was evicted the item reports it as
 * absent, and {@link #getOrCreate} can recreate it and put it back into the cache.
 * <p>
 * Reads synchronize on the item only, so that refreshing the access time of a hot value never
 * contends on the cache's lock. Writing a new value instead acquires the cache's lock, as it may
 * insert the item and evict another. Both fields are volatile, so a write is eventually visible to
 * a reader, but a {@link #get} that races with a {@link #set} on another thread may observe either
 * the old or the new value.
 *
 * @param <V> the type of the cached value
 */
public final class CacheItem<V> {
  /** The access time of an item that holds no value. */
  static final long UNCACHED = Long.MIN_VALUE;

  final PseudoLruCache<V> cache;

  volatile @Nullable V value;
  volatile long lastAccess;

  @GuardedBy("cache.evictionLock")
  boolean resident;

  CacheItem(PseudoLruCache<V> cache) {
    this.cache = requireNonNull(cache);
    this.lastAccess = UNCACHED;
  }

  /**
   * Returns the cached value, or {@code null} if it was evicted or never loaded. If present, the
   * value's access time is refreshed, making it less likely to be chosen for eviction.
   *
   * @return the cached value, or {@code null} if absent
   */
  public @Nullable V get() {
    synchronized (this) {
      V current = value;
      if (current != null) {
        lastAccess = cache.nextAccessTime();
      }
      return current;
    }
  }

  /**
   * Returns the cached value, recreating it with the {@code creator} if it is absent. A present
   * value is recorded as a hit. Otherwise the creator is called without holding any lock, the miss
   * is recorded, and the new value is admitted into the cache. Two threads may race to recreate
   * the same value, in which case the creator is invoked by both and the last value wins.
   * <p>
   * If the creator returns {@code null} then the item remains empty and {@code null} is returned.
   * If the creator throws an exception then no miss is recorded and the exception propagates.
   *
   * @param creator the function that recreates the value
   * @return the present or recreated value
   */
  @CanIgnoreReturnValue
  public @Nullable V getOrCreate(Supplier<? extends @Nullable V> creator) {
    requireNonNull(creator);
    synchronized (this) {
      V current = value;
      if (current != null) {
        cache.hitCount.increment();
        lastAccess = cache.nextAccessTime();
        return current;
      }
    }

    V created = creator.get();
    cache.missCount.increment();
    set(created);
    return created;
  }

  /**
   * Sets the value held by this item.
   * <p>
   * Setting {@code null} empties the item, but it remains in the cache's table until the eviction
   * search reclaims its slot. Setting a value other than the current one stamps a new access time
   * and, unless the item still occupies a slot, inserts it into the cache. That insertion evicts
   * another value when the cache is full.
   *
   * @param newValue the value to cache, or {@code null} to discard the current one
   */
  public void set(@Nullable V newValue) {
    if (newValue == null) {
      synchronized (this) {
        lastAccess = UNCACHED;
        value = null;
      }
    } else if (newValue != value) {
      cache.put(this, newValue);
    }
  }

  /** Discards the value held by this item. This is equivalent to {@code set(null)}. */
  public void invalidate() {
    set(null);
  }

  /**
   * Returns whether the value is present, without refreshing its access time.
   *
   * @return if the value is present
   */
  public boolean isCached() {
    return (value != null);
  }

  /** Returns if this item was last accessed before the {@code other} item. */
  boolean isOlderThan(CacheItem<?> other) {
    return lastAccess < other.lastAccess;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "cached=" + isCached() + ", "
        + "lastAccess=" + ((lastAccess == UNCACHED) ? "none" : Long.toString(lastAccess))
        + '}';
  }
}
