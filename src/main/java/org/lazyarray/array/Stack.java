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
 * Arrays of identical shape stacked along a new axis. The result has one more axis than the
 * constituents; along {@link #axis} its extent is the number of constituents.
 */
public final class Stack extends Array {
  public final ImmutableList<Array> arrays;
  public final int axis;

  public Stack(ImmutableList<Array> arrays, int axis, ImmutableSet<Tag> tags) {
    super(Kind.STACK, resultShape(arrays, axis), arrays.get(0).dtype, tags, arrays, axis);
    this.arrays = arrays;
    this.axis = axis;
  }

  public Stack(ImmutableList<Array> arrays, int axis) {
    this(arrays, axis, ImmutableSet.of());
  }

  private static ImmutableList<Dim> resultShape(ImmutableList<Array> arrays, int axis) {
    Preconditions.checkArgument(!arrays.isEmpty(), "Nothing to stack");
    Array first = arrays.get(0);
    for (Array array : arrays) {
      Preconditions.checkArgument(
          array.shape.equals(first.shape) && array.dtype == first.dtype,
          "Stacked arrays must have the same shape and dtype");
    }
    Preconditions.checkArgument(axis >= 0 && axis <= first.ndim(), "Invalid axis %s", axis);
    return ImmutableList.<Dim>builder()
        .addAll(first.shape.subList(0, axis))
        .add(Dim.of(arrays.size()))
        .addAll(first.shape.subList(axis, first.ndim()))
        .build();
  }

  @Override
  boolean sameFields(Array other) {
    Stack otherStack = (Stack) other;
    return axis == otherStack.axis && arrays.equals(otherStack.arrays);
  }
}
