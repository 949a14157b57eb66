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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Multimaps;
import com.google.inject.Inject;
import com.google.jumphash.Annotations.NumBuckets;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BucketAssigner} backed by {@link JumpConsistentHasher}. Immutable and thread-safe. */
public final class BucketAssignerImpl implements BucketAssigner {

  private static final Logger logger = LoggerFactory.getLogger(BucketAssignerImpl.class);

  private final int numBuckets;

  /**
   * Constructs a new instance.
   *
   * @param numBuckets the number of buckets, must be positive
   * @throws IllegalArgumentException if {@code numBuckets} is less than 1
   */
  @Inject
  public BucketAssignerImpl(@NumBuckets int numBuckets) {
    JumpConsistentHasher.checkNumBuckets(numBuckets);
    this.numBuckets = numBuckets;
    logger.info("Bucket assigner configured with {} buckets.", numBuckets);
  }

  @Override
  public int getNumBuckets() {
    return numBuckets;
  }

  @Override
  public int assign(long key) {
    return JumpConsistentHasher.hash(key, numBuckets);
  }

  @Override
  public int assign(String key) {
    return JumpConsistentHasher.hash(key, numBuckets);
  }

  @Override
  public <T> ImmutableListMultimap<Integer, T> groupByBucket(
      Iterable<T> items, Function<? super T, String> keyFunction) {
    checkNotNull(items, "items");
    checkNotNull(keyFunction, "keyFunction");
    ImmutableListMultimap<Integer, T> buckets =
        Multimaps.index(items, item -> assign(keyFunction.apply(item)));
    if (logger.isDebugEnabled()) {
      logger.debug(
          "Grouped {} items into {} of {} buckets.",
          buckets.size(),
          buckets.keySet().size(),
          numBuckets);
    }
    return buckets;
  }
}
