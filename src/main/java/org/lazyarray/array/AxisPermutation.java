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
 * Reorders the axes of an array: axis {@code i} of the result is axis {@code axes.get(i)} of
 * {@link #array}.
 */
public final class AxisPermutation extends IndexRemapping {
  public final ImmutableList<Integer> axes;

  public AxisPermutation(Array array, ImmutableList<Integer> axes, ImmutableSet<Tag> tags) {
    super(Kind.AXIS_PERMUTATION, array, permutedShape(array, axes), tags, axes);
    this.axes = axes;
  }

  public AxisPermutation(Array array, ImmutableList<Integer> axes) {
    this(array, axes, ImmutableSet.of());
  }

  private static ImmutableList<Dim> permutedShape(Array array, ImmutableList<Integer> axes) {
    Preconditions.checkArgument(
        axes.size() == array.ndim() && ImmutableSet.copyOf(axes).size() == axes.size(),
        "%s is not a permutation of %s axes",
        axes,
        array.ndim());
    ImmutableList.Builder<Dim> builder = ImmutableList.builder();
    for (int axis : axes) {
      Preconditions.checkArgument(axis >= 0 && axis < array.ndim(), "Invalid axis %s", axis);
      builder.add(array.shape.get(axis));
    }
    return builder.build();
  }

  @Override
  boolean sameFields(Array other) {
    AxisPermutation otherPerm = (AxisPermutation) other;
    return axes.equals(otherPerm.axes) && array.equals(otherPerm.array);
  }
}
