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
 * Arrays joined end to end along an existing axis. The constituents must agree on every other
 * axis; their extents along {@link #axis} must be constants.
 */
public final class Concatenate extends Array {
  public final ImmutableList<Array> arrays;
  public final int axis;

  public Concatenate(ImmutableList<Array> arrays, int axis, ImmutableSet<Tag> tags) {
    super(Kind.CONCATENATE, resultShape(arrays, axis), arrays.get(0).dtype, tags, arrays, axis);
    this.arrays = arrays;
    this.axis = axis;
  }

  public Concatenate(ImmutableList<Array> arrays, int axis) {
    this(arrays, axis, ImmutableSet.of());
  }

  private static ImmutableList<Dim> resultShape(ImmutableList<Array> arrays, int axis) {
    Preconditions.checkArgument(!arrays.isEmpty(), "Nothing to concatenate");
    Array first = arrays.get(0);
    Preconditions.checkArgument(axis >= 0 && axis < first.ndim(), "Invalid axis %s", axis);
    long extent = 0;
    for (Array array : arrays) {
      Preconditions.checkArgument(
          array.ndim() == first.ndim() && array.dtype == first.dtype,
          "Concatenated arrays must have the same rank and dtype");
      for (int i = 0; i < first.ndim(); i++) {
        if (i == axis) {
          Preconditions.checkArgument(
              array.shape.get(i).isConstant(), "Concatenation axis must have a constant extent");
          extent += array.shape.get(i).value();
        } else {
          Preconditions.checkArgument(
              array.shape.get(i).equals(first.shape.get(i)), "Mismatched extents on axis %s", i);
        }
      }
    }
    ImmutableList.Builder<Dim> builder = ImmutableList.builder();
    for (int i = 0; i < first.ndim(); i++) {
      builder.add((i == axis) ? Dim.of(extent) : first.shape.get(i));
    }
    return builder.build();
  }

  @Override
  boolean sameFields(Array other) {
    Concatenate otherConcat = (Concatenate) other;
    return axis == otherConcat.axis && arrays.equals(otherConcat.arrays);
  }
}
