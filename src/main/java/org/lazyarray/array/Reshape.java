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
 * The elements of an array, in C (row-major) order, arranged into a new shape with the same number
 * of elements. Both shapes must be constant.
 */
public final class Reshape extends IndexRemapping {

  public Reshape(Array array, ImmutableList<Dim> newShape, ImmutableSet<Tag> tags) {
    super(Kind.RESHAPE, array, checkShape(array, newShape), tags);
  }

  public Reshape(Array array, ImmutableList<Dim> newShape) {
    this(array, newShape, ImmutableSet.of());
  }

  private static ImmutableList<Dim> checkShape(Array array, ImmutableList<Dim> newShape) {
    Preconditions.checkArgument(
        size(array.shape) == size(newShape),
        "Can't reshape %s to %s elements",
        array.shapeString(),
        size(newShape));
    return newShape;
  }

  private static long size(ImmutableList<Dim> shape) {
    long result = 1;
    for (Dim dim : shape) {
      Preconditions.checkArgument(dim.isConstant(), "Reshape requires constant extents");
      result *= dim.value();
    }
    return result;
  }

  @Override
  boolean sameFields(Array other) {
    return array.equals(((Reshape) other).array);
  }
}
