/*
 * Copyright 2025 The Retrospect Authors
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

package org.lazyarray.array;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * A rectangular sub-array: along each axis {@code d}, the elements with indices in {@code
 * [starts[d], stops[d])}. Starts and stops are constants.
 */
public final class Slice extends IndexRemapping {
  public final ImmutableList<Long> starts;
  public final ImmutableList<Long> stops;

  public Slice(
      Array array, ImmutableList<Long> starts, ImmutableList<Long> stops, ImmutableSet<Tag> tags) {
    super(Kind.SLICE, array, slicedShape(array, starts, stops), tags, starts, stops);
    this.starts = starts;
    this.stops = stops;
  }

  public Slice(Array array, ImmutableList<Long> starts, ImmutableList<Long> stops) {
    this(array, starts, stops, ImmutableSet.of());
  }

  private static ImmutableList<Dim> slicedShape(
      Array array, ImmutableList<Long> starts, ImmutableList<Long> stops) {
    Preconditions.checkArgument(
        starts.size() == array.ndim() && stops.size() == array.ndim(),
        "Slice of %s needs %s starts and stops",
        array.shapeString(),
        array.ndim());
    ImmutableList.Builder<Dim> builder = ImmutableList.builder();
    for (int i = 0; i < array.ndim(); i++) {
      long start = starts.get(i);
      long stop = stops.get(i);
      Dim extent = array.shape.get(i);
      Preconditions.checkArgument(
          start >= 0 && start <= stop && (!extent.isConstant() || stop <= extent.value()),
          "Invalid slice [%s, %s) of axis %s",
          start,
          stop,
          i);
      builder.add(Dim.of(stop - start));
    }
    return builder.build();
  }

  @Override
  boolean sameFields(Array other) {
    Slice otherSlice = (Slice) other;
    return starts.equals(otherSlice.starts)
        && stops.equals(otherSlice.stops)
        && array.equals(otherSlice.array);
  }
}
