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

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.jumphash.Annotations.NumBuckets;

/** Guice module that provides a {@link BucketAssigner} for a fixed number of buckets. */
public final class JumpHashModule extends AbstractModule {

  private final int numBuckets;

  /** Constructor for {@link JumpHashModule}. */
  public JumpHashModule(int numBuckets) {
    this.numBuckets = numBuckets;
  }

  /** Configures injected dependencies for this module. */
  @Override
  protected void configure() {
    bind(BucketAssigner.class).to(BucketAssignerImpl.class).in(Singleton.class);
  }

  @Provides
  @NumBuckets
  int provideNumBuckets() {
    return numBuckets;
  }
}
