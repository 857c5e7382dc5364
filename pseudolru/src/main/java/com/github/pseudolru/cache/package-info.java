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

/**
 * This package contains an approximate least-recently-used cache. A
 * {@link com.github.pseudolru.cache.PseudoLruCache} is created directly from a capacity or configured
 * with the {@link com.github.pseudolru.cache.PseudoLru} builder.
 * <p>
 * Values are not looked up by key. Admitting a value returns a
 * {@link com.github.pseudolru.cache.CacheItem} that the caller keeps in its own data structures, and
 * through which the value is read, or recreated after it was evicted.
 */
@NullMarked
@CheckReturnValue
package com.github.pseudolru.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
