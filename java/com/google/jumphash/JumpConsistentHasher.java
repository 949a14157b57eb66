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

import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;

/**
 * Jump Consistent Hashing, based on the algorithm by Lamping, Veach <a
 * href="https://arxiv.org/pdf/1406.2294.pdf">A Fast, Minimal Memory, Consistent Hash
 * Algorithm</a>.
 *
 * <p>Results are bit-for-bit identical to the reference C++ implementation. All methods throw
 * {@link IllegalArgumentException} when {@code numBuckets} is less than 1.
 */
public final class JumpConsistentHasher {

  // Frozen algorithm, so keys derived from bytes never change between releases
  private static final HashFunction KEY_FUNCTION = Hashing.farmHashFingerprint64();

  private static final double TWO_POW_31 = (double) (1L << 31);

  private JumpConsistentHasher() {}

  /**
   * Performs jump consistent hash for a given key and a set number of buckets. Returns the bucket
   * assigned to this key, in the range {@code [0, numBuckets)}.
   */
  public static int hash(long key, int numBuckets) {
    checkNumBuckets(numBuckets);
    long b = -1;
    long j = 0;
    long state = key;
    while (j < numBuckets) {
      b = j;
      state = LinearCongruentialGenerator.advance(state);
      j = (long) ((b + 1) * (TWO_POW_31 / (double) ((state >>> 33) + 1)));
    }
    return (int) b;
  }

  /**
   * Hashes a {@link HashCode} using its first 8 bytes (zero padded) as the key, the same way as
   * {@link Hashing#consistentHash(HashCode, int)} reads it.
   */
  public static int hash(HashCode hashCode, int numBuckets) {
    checkNotNull(hashCode, "hashCode");
    return hash(hashCode.padToLong(), numBuckets);
  }

  /** Hashes arbitrary bytes by deriving a 64-bit key with FarmHash Fingerprint64. */
  public static int hash(byte[] input, int numBuckets) {
    checkNotNull(input, "input");
    checkNumBuckets(numBuckets);
    return hash(KEY_FUNCTION.hashBytes(input).asLong(), numBuckets);
  }

  /** Hashes the UTF-8 bytes of a string. See {@link #hash(byte[], int)}. */
  public static int hash(String input, int numBuckets) {
    checkNotNull(input, "input");
    return hash(input.getBytes(StandardCharsets.UTF_8), numBuckets);
  }

  /** Throws {@link IllegalArgumentException} if {@code numBuckets} is not positive. */
  static void checkNumBuckets(int numBuckets) {
    if (numBuckets < 1) {
      throw new IllegalArgumentException(
          "Number of buckets must be positive, but was: " + numBuckets);
    }
  }
}
