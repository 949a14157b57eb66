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

/**
 * The 64-bit linear congruential generator embedded in jump consistent hashing.
 *
 * <p>Each step computes {@code state * 2862933555777941757 + 1} modulo 2<sup>64</sup>. Java
 * {@code long} arithmetic wraps on overflow, so the bit pattern of every state matches the
 * unsigned reference generator.
 *
 * <p>Instances are not thread-safe. {@link JumpConsistentHasher} uses {@link #advance(long)} on a
 * local variable and never shares an instance.
 */
public final class LinearCongruentialGenerator {

  /** Multiplier of the recurrence, as used by Lamping and Veach. */
  public static final long MULTIPLIER = 2862933555777941757L;

  /** Increment of the recurrence. */
  public static final long INCREMENT = 1L;

  private long state;

  /** Constructs a generator whose first sample is {@code advance(seed)}. */
  public LinearCongruentialGenerator(long seed) {
    this.state = seed;
  }

  /** Returns the state following {@code state}. Total over all inputs. */
  public static long advance(long state) {
    return state * MULTIPLIER + INCREMENT;
  }

  /** Advances the generator and returns the new state, which is also the sample. */
  public long nextLong() {
    state = advance(state);
    return state;
  }

  /** Gets the current state. */
  public long state() {
    return state;
  }
}
