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

import static com.github.pseudolru.cache.PseudoLru.requireArgument;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

import org.checkerframework.checker.index.qual.NonNegative;
import org.jspecify.annotations.Nullable;

import com.github.pseudolru.cache.stats.CacheStats;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;

/**
 * A cache that evicts approximately the least recently used values. The values are not indexed by
 * a key: the caller stores the {@link CacheItem} returned by {@link #admit} in its own structures
 * and reads the value through it, recreating the value if it was evicted in the meantime.
 * <p>
 * The items are stored in a single array. The trailing {@value #CANDIDATE_SIZE} slots hold the
 * eviction candidates, the oldest known items, which are partially ordered so that the last slot
 * is the next victim. The remaining slots form a ring buffer that is filled from the highest index
 * downward by the write cursor. When the cache is full, an admission samples a few random items
 * from the older two thirds of the ring, swaps any that are older than a candidate into the
 * candidate zone, and then evicts the oldest candidate. The cost of an eviction is therefore
 * proportional to the sample size rather than to the capacity, at the expense of sometimes
 * evicting an item that is not the true least recently used one.
 * <p>
 * The typical use case is:
 * <pre>{@code
 * PseudoLruCache<Image> cache = new PseudoLruCache<>(1_000);
 * CacheItem<Image> item = cache.admit(load(path));
 * ...
 * Image image = item.getOrCreate(() -> load(path));
 * double hitRatio = cache.hitRatio();
 * }</pre>
 * <p>
 * A read synchronizes only on its item. All structural changes (admission, eviction, resizing and
 * clearing) are guarded by the cache's eviction lock. When both are held, the eviction lock is
 * always acquired first.
 *
 * @param <V> the type of the cached values
 */
public final class PseudoLruCache<V> {
  static final Logger logger = System.getLogger(PseudoLruCache.class.getName());

  /** The number of trailing slots that hold the eviction candidates. */
  static final int CANDIDATE_SIZE = 16;
  /** The default number of random items probed by an eviction search. */
  static final int DEFAULT_SAMPLE_SIZE = 10;
  /** The slots required beyond the candidates and the sample to leave room for sampling. */
  static final int CAPACITY_SLACK = 10;

  /** Orders the most recently used items first and the least recently used last. */
  static final Comparator<CacheItem<?>> MOST_RECENT_FIRST =
      (first, second) -> Long.compare(second.lastAccess, first.lastAccess);

  final ReentrantLock evictionLock;
  final RandomSampler sampler;
  final AtomicLong clock;
  final int sampleSize;

  final LongAdder hitCount;
  final LongAdder missCount;
  final LongAdder sampledEvictionCount;
  final LongAdder truncationCount;

  @GuardedBy("evictionLock")
  CacheItem<V>[] table;
  @GuardedBy("evictionLock")
  int addPosition;

  volatile int capacity;
  volatile int size;

  /**
   * Creates a cache that holds up to {@code capacity} values, probing
   * {@value #DEFAULT_SAMPLE_SIZE} random items per eviction.
   *
   * @param capacity the maximum number of values, at least {@link #minimumCapacity}
   *        for the default sample size
   * @throws IllegalArgumentException if the capacity is too small to sample from
   */
  public PseudoLruCache(@NonNegative int capacity) {
    this(capacity, DEFAULT_SAMPLE_SIZE, RandomSampler.splittable());
  }

  PseudoLruCache(int capacity, int sampleSize, RandomSampler sampler) {
    requireArgument(sampleSize > 0, "sample size must be positive: %s", sampleSize);
    requireArgument(capacity >= minimumCapacity(sampleSize),
        "capacity %s is less than the minimum of %s", capacity, minimumCapacity(sampleSize));
    this.sampler = requireNonNull(sampler);
    this.evictionLock = new ReentrantLock();
    this.sampledEvictionCount = new LongAdder();
    this.truncationCount = new LongAdder();
    this.missCount = new LongAdder();
    this.hitCount = new LongAdder();
    this.sampleSize = sampleSize;
    this.clock = new AtomicLong();
    init(capacity);
  }

  /**
   * Returns the smallest capacity that leaves the eviction search enough items to sample from.
   *
   * @param sampleSize the number of random items probed per eviction
   * @return the smallest capacity supported for the sample size
   */
  public static int minimumCapacity(int sampleSize) {
    return CANDIDATE_SIZE + sampleSize + CAPACITY_SLACK;
  }

  @SuppressWarnings({"unchecked", "GuardedBy"})
  private void init(int newCapacity) {
    table = (CacheItem<V>[]) new CacheItem<?>[newCapacity];
    // the table is filled from the end of the array toward its start
    addPosition = newCapacity - 1;
    capacity = newCapacity;
    size = 0;
  }

  /* --------------- Principal API --------------- */

  /**
   * Adds the value to the cache and returns the holder through which it must be accessed. If the
   * cache is full then an approximately least recently used value is evicted first.
   * <p>
   * A {@code null} value returns an empty item that is not yet in the cache. It is admitted once a
   * value is assigned to it, such as by {@link CacheItem#getOrCreate}.
   *
   * @param value the value to cache, may be {@code null}
   * @return the holder for the value
   */
  public CacheItem<V> admit(@Nullable V value) {
    var item = new CacheItem<V>(this);
    item.set(value);
    return item;
  }

  /**
   * Removes all items from the cache. The values held by outstanding items are <em>not</em>
   * discarded, so they remain readable through those items until they are invalidated or
   * garbage collected. Setting a new value on such an item inserts it into the cache again.
   */
  public void clear() {
    evictionLock.lock();
    try {
      for (CacheItem<V> item : table) {
        if (item != null) {
          item.resident = false;
        }
      }
      init(capacity);
    } finally {
      evictionLock.unlock();
    }
  }

  /** Discards the value of every item in the cache and then clears it. */
  public void evictAll() {
    evictionLock.lock();
    try {
      int discarded = 0;
      for (CacheItem<V> item : table) {
        if ((item != null) && (discard(item) != null)) {
          discarded++;
        }
      }
      clear();
      logger.log(Level.DEBUG, "Evicted all {0} values", discarded);
    } finally {
      evictionLock.unlock();
    }
  }

  /**
   * Changes the maximum number of values that the cache may hold. The capacity is silently raised
   * to {@link #minimumCapacity} if it is smaller.
   * <p>
   * The items are reordered by their last access time, with the oldest placed as the next
   * eviction candidates. If the cache shrinks below its current size then the least recently
   * used values are discarded. This truncation is deterministic rather than sampled.
   *
   * @param newCapacity the maximum number of values after resizing
   */
  public void resize(int newCapacity) {
    evictionLock.lock();
    try {
      int minimum = minimumCapacity(sampleSize);
      if (newCapacity < minimum) {
        logger.log(Level.DEBUG, "Raised the requested capacity of {0} to {1}",
            newCapacity, minimum);
        newCapacity = minimum;
      }

      // Snapshot the access times, as concurrent reads may refresh them during the sort
      int count = size;
      @SuppressWarnings("unchecked")
      var items = (CacheItem<V>[]) new CacheItem<?>[count];
      long[] accessTimes = new long[count];
      Integer[] byAge = new Integer[count];
      for (int position = 0; position < count; position++) {
        items[position] = table[positionToIndex(position)];
        accessTimes[position] = items[position].lastAccess;
        byAge[position] = position;
      }
      Arrays.sort(byAge, Comparator.comparingLong(position -> accessTimes[position]));

      int discarded = Math.max(0, count - newCapacity);
      for (int i = 0; i < discarded; i++) {
        var item = items[byAge[i]];
        item.resident = false;
        if (discard(item) != null) {
          truncationCount.increment();
        }
      }

      int oldCapacity = capacity;
      init(newCapacity);
      int index = newCapacity - 1;
      for (int i = discarded; i < count; i++) {
        table[index--] = items[byAge[i]];
      }
      size = count - discarded;
      addPosition = index;
      if (addPosition < 0) {
        addPosition = ringCapacity() - 1;
      }
      logger.log(Level.DEBUG, "Resized from {0} to {1}, discarding {2} items",
          oldCapacity, newCapacity, discarded);
    } finally {
      evictionLock.unlock();
    }
  }

  /* --------------- Status --------------- */

  /**
   * Returns the maximum number of values that may be stored in the cache.
   *
   * @return the maximum number of values
   */
  public @NonNegative int capacity() {
    return capacity;
  }

  /**
   * Returns the number of items in the cache, which is at most its capacity. This includes items
   * whose values were explicitly invalidated but whose slots have not been reclaimed yet.
   *
   * @return the number of occupied slots
   */
  public @NonNegative int size() {
    return size;
  }

  /**
   * Returns whether the next admission will evict an item.
   *
   * @return if every slot is occupied
   */
  public boolean isFull() {
    return size == capacity;
  }

  /**
   * Returns whether no items are in the cache.
   *
   * @return if no slot is occupied
   */
  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Returns the number of random items probed when searching for a value to evict.
   *
   * @return the sample size of the eviction search
   */
  public int sampleSize() {
    return sampleSize;
  }

  /* --------------- Statistics --------------- */

  /**
   * Returns a snapshot of the hit, miss and eviction counts since this cache was created. The
   * counters are read independently, so a snapshot taken under concurrent use may not correspond
   * to a single moment.
   *
   * @return the current counts
   */
  public CacheStats stats() {
    return CacheStats.of(hitCount.sum(), missCount.sum(),
        sampledEvictionCount.sum(), truncationCount.sum());
  }

  /**
   * Returns the fraction of {@link CacheItem#getOrCreate} calls that found the value cached, or
   * {@link Double#NaN} if no calls were made.
   *
   * @return the hit ratio
   */
  public double hitRatio() {
    return stats().hitRate();
  }

  /**
   * Returns the fraction of {@link CacheItem#getOrCreate} calls that had to recreate the value, or
   * {@link Double#NaN} if no calls were made.
   *
   * @return the miss ratio
   */
  public double missRatio() {
    return stats().missRate();
  }

  /** Returns the number of {@link CacheItem#getOrCreate} calls that found the value cached. */
  public long hits() {
    return hitCount.sum();
  }

  /** Returns the number of {@link CacheItem#getOrCreate} calls that recreated the value. */
  public long misses() {
    return missCount.sum();
  }

  /** Returns the number of values evicted by the eviction search or by a shrinking resize. */
  public long evictions() {
    return sampledEvictionCount.sum() + truncationCount.sum();
  }

  /** Returns the next clock value. A larger value was accessed more recently. */
  long nextAccessTime() {
    return clock.incrementAndGet();
  }

  /* --------------- Storage --------------- */

  /** Returns the number of slots that form the ring buffer. */
  int ringCapacity() {
    return capacity - CANDIDATE_SIZE;
  }

  /**
   * Returns the number of items immediately behind the write cursor that are never sampled for
   * eviction, which protects newly admitted items.
   */
  int recentlyCreatedCount() {
    return ringCapacity() / 3;
  }

  /**
   * Converts a logical position, ordered from the eviction candidates to the most recently
   * admitted item, into an index into the table. If the ring buffer has never wrapped around then
   * {@code index = capacity - position - 1}, i.e. the table is in exact reverse order.
   *
   * @param position the logical position, from {@code 0} to {@code size}
   * @return the index into the table
   */
  @GuardedBy("evictionLock")
  int positionToIndex(int position) {
    if (position < CANDIDATE_SIZE) {
      return capacity - position - 1;
    } else if (position == size) {
      return addPosition;
    }
    int ringPosition = position - CANDIDATE_SIZE;
    int ringSize = size - CANDIDATE_SIZE;
    return (addPosition + ringSize - ringPosition) % ringCapacity();
  }

  /**
   * Assigns the value to the item and inserts the item into the table if it does not occupy a
   * slot already.
   */
  void put(CacheItem<V> item, V newValue) {
    evictionLock.lock();
    try {
      item.lastAccess = nextAccessTime();
      if (item.value != newValue) {
        item.value = newValue;
        if (!item.resident) {
          add(item);
        }
      }
    } finally {
      evictionLock.unlock();
    }
  }

  /** Adds the item at the write cursor, evicting an item first if the cache is full. */
  @GuardedBy("evictionLock")
  private void add(CacheItem<V> item) {
    if (isFull()) {
      evict();
    }
    item.resident = true;
    table[addPosition--] = item;
    if (addPosition < 0) {
      addPosition = ringCapacity() - 1;
    }
    size++;
  }

  /* --------------- Eviction --------------- */

  /**
   * Evicts the approximately least recently used item if the cache is full. The item at the write
   * cursor takes over the victim's slot, leaving the cursor's slot free for the next admission.
   *
   * @return the evicted value, or {@code null} if the cache is not full or the victim was empty
   */
  @CanIgnoreReturnValue
  @GuardedBy("evictionLock")
  @Nullable V evict() {
    if (!isFull()) {
      return null;
    }
    findEvictionCandidate();

    int last = capacity - 1;
    var victim = table[last];
    table[last] = table[addPosition];
    table[addPosition] = null;
    size--;

    victim.resident = false;
    V evicted = discard(victim);
    if (evicted != null) {
      sampledEvictionCount.increment();
    }
    return evicted;
  }

  /**
   * Moves the approximately least recently used item into the last slot of the table. The
   * candidates are partially sorted and then a random sample of the older items in the ring is
   * compared against the most recently used candidate. Any that are older are swapped into the
   * candidate zone. This may move several items to new slots.
   */
  @GuardedBy("evictionLock")
  void findEvictionCandidate() {
    sortCandidatesPartially();

    // Logical positions that skip the candidates and the recently created third of the ring
    int lowestPosition = CANDIDATE_SIZE;
    int highestPosition = capacity - recentlyCreatedCount();
    int youngestIndex = capacity - CANDIDATE_SIZE;

    for (int i = 0; i < sampleSize; i++) {
      var youngestCandidate = table[youngestIndex];
      int randomIndex = positionToIndex(sampler.nextInRange(lowestPosition, highestPosition));
      var item = table[randomIndex];
      if (item.isOlderThan(youngestCandidate)) {
        table[youngestIndex] = item;
        table[randomIndex] = youngestCandidate;
        sortCandidatesPartially();
      }
    }
  }

  @GuardedBy("evictionLock")
  private void sortCandidatesPartially() {
    PartialSort.lowHigh(table, capacity - CANDIDATE_SIZE, CANDIDATE_SIZE, MOST_RECENT_FIRST);
  }

  /** Empties the item and returns the value that it held. */
  private static <V> @Nullable V discard(CacheItem<V> item) {
    synchronized (item) {
      V value = item.value;
      item.lastAccess = CacheItem.UNCACHED;
      item.value = null;
      return value;
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "size=" + size + ", "
        + "capacity=" + capacity + ", "
        + "sampleSize=" + sampleSize + ", "
        + "stats=" + stats()
        + '}';
  }
}
