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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.function.Function;
import java.util.stream.IntStream;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BucketAssignerImplTest {

  @Test
  public void assign_longKey_delegatesToJumpHash() {
    var assigner = new BucketAssignerImpl(19);

    assertThat(assigner.getNumBuckets()).isEqualTo(19);
    assertThat(assigner.assign(1L)).isEqualTo(17);
    assertThat(assigner.assign(0xdeadbeefL)).isEqualTo(16);
    assertThat(assigner.assign(0x0ddc0ffeebadf00dL)).isEqualTo(15);
  }

  @Test
  public void assign_stringKey_matchesStaticHash() {
    var assigner = new BucketAssignerImpl(1000);

    IntStream.range(0, 100)
        .mapToObj(i -> "key-" + i)
        .forEach(
            key ->
                assertThat(assigner.assign(key))
                    .isEqualTo(JumpConsistentHasher.hash(key, 1000)));
  }

  @Test
  public void assign_singleBucket_returnsZero() {
    var assigner = new BucketAssignerImpl(1);

    assertThat(assigner.assign(Long.MAX_VALUE)).isEqualTo(0);
    assertThat(assigner.assign("anything")).isEqualTo(0);
  }

  @Test
  public void constructor_nonPositiveBuckets_throwsIllegalArgumentException() {
    assertThrows(IllegalArgumentException.class, () -> new BucketAssignerImpl(0));
    assertThrows(IllegalArgumentException.class, () -> new BucketAssignerImpl(-1));
  }

  @Test
  public void groupByBucket_groupsItemsByAssignedBucket() {
    var assigner = new BucketAssignerImpl(8);
    ImmutableList<String> items =
        IntStream.range(0, 500).mapToObj(i -> "item" + i).collect(ImmutableList.toImmutableList());

    ImmutableListMultimap<Integer, String> grouped =
        assigner.groupByBucket(items, Function.identity());

    assertThat(grouped.size()).isEqualTo(items.size());
    grouped.forEach((bucket, item) -> assertThat(assigner.assign(item)).isEqualTo(bucket));
    assertThat(grouped.keySet()).containsExactly(0, 1, 2, 3, 4, 5, 6, 7);
  }

  @Test
  public void groupByBucket_keepsEncounterOrderWithinBucket() {
    var assigner = new BucketAssignerImpl(1);
    ImmutableList<Item> records =
        ImmutableList.of(new Item("c"), new Item("a"), new Item("b"));

    ImmutableListMultimap<Integer, Item> grouped = assigner.groupByBucket(records, Item::id);

    assertThat(grouped.get(0)).containsExactlyElementsIn(records).inOrder();
  }

  @Test
  public void groupByBucket_emptyItems_returnsEmptyMultimap() {
    var assigner = new BucketAssignerImpl(4);

    assertThat(assigner.groupByBucket(ImmutableList.<String>of(), Function.identity())).isEmpty();
  }

  @Test
  public void groupByBucket_nullArguments_throwsNullPointerException() {
    var assigner = new BucketAssignerImpl(4);

    assertThrows(
        NullPointerException.class, () -> assigner.groupByBucket(null, Function.identity()));
    assertThrows(
        NullPointerException.class, () -> assigner.groupByBucket(ImmutableList.of("a"), null));
  }

  private static final class Item {
    private final String id;

    Item(String id) {
      this.id = id;
    }

    String id() {
      return id;
    }
  }
}
