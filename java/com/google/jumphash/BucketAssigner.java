/*
 * Copyright 2025 Google LLC
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

package com.google.jumphash;

import com.google.common.collect.ImmutableListMultimap;
import java.util.function.Function;

/** Assigns keys to a fixed number of buckets using jump consistent hashing. */
public interface BucketAssigner {

  /** Gets the number of buckets keys are assigned to. */
  int getNumBuckets();

  /** Returns the bucket for a 64-bit key. */
  int assign(long key);

  /** Returns the bucket for a string key. */
  int assign(String key);

  /**
   * Groups items by the bucket of the key extracted from each item. Items keep their encounter
   * order within a bucket. Buckets receiving no item are absent from the result.
   */
  <T> ImmutableListMultimap<Integer, T> groupByBucket(
      Iterable<T> items, Function<? super T, String> keyFunction);
}
