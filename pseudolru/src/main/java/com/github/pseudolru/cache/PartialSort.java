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

import java.util.Comparator;

/**
 * Static utility methods for partially ordering arrays in place.
 */
public final class PartialSort {

  private PartialSort() {}

  /**
   * Moves the lowest element of the range to its first index and the highest element to its last
   * index. All other elements are left in place or in an arbitrary order, and at most two swaps
   * are performed. A {@code count} that extends past the end of the array is truncated to the
   * remaining tail, and a negative {@code count} selects the whole tail.
   *
   * @param elements the array to alter in place
   * @param startIndex the index of the first element of the range
   * @param count the number of consecutive elements in the range
   * @param comparator the ordering that defines the lowest and highest elements
   * @param <E> the type of elements
   */
  public static <E> void lowHigh(E[] elements, int startIndex,
      int count, Comparator<? super E> comparator) {
    int maxCount = elements.length - startIndex;
    int length = (count < 0) ? maxCount : Math.min(maxCount, count);
    if (length <= 1) {
      return;
    }

    int stopIndex = startIndex + length - 1;
    E low = elements[startIndex];
    E high = low;
    int lowIndex = startIndex;
    int highIndex = startIndex;
    for (int i = startIndex + 1; i <= stopIndex; i++) {
      E element = elements[i];
      if (comparator.compare(element, low) < 0) {
        lowIndex = i;
        low = element;
      } else if (comparator.compare(element, high) > 0) {
        highIndex = i;
        high = element;
      }
    }

    if (lowIndex != startIndex) {
      elements[lowIndex] = elements[startIndex];
      elements[startIndex] = low;
      if (highIndex == startIndex) {
        // the highest element was displaced by the first swap
        highIndex = lowIndex;
      }
    }
    if (highIndex != stopIndex) {
      elements[highIndex] = elements[stopIndex];
      elements[stopIndex] = high;
    }
  }
}
