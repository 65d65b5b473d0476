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
 * A named array whose value is already known: a buffer of doubles in C (row-major) order.
 *
 * <p>The buffer is compared by reference, never by content, and is never modified.
 */
public final class DataWrapper extends InputArgument {
  private final double[] data;

  public DataWrapper(String name, double[] data, ImmutableList<Dim> shape, ImmutableSet<Tag> tags) {
    super(Kind.DATA_WRAPPER, name, shape, DType.FLOAT64, tags, System.identityHashCode(data));
    long size = 1;
    boolean isConstant = true;
    for (Dim dim : shape) {
      if (dim.isConstant()) {
        size *= dim.value();
      } else {
        isConstant = false;
      }
    }
    Preconditions.checkArgument(
        !isConstant || size == data.length,
        "Shape %s doesn't match %s elements",
        shapeString(),
        data.length);
    this.data = data;
  }

  public DataWrapper(String name, double[] data, ImmutableList<Dim> shape) {
    this(name, data, shape, ImmutableSet.of());
  }

  /** Returns the wrapped buffer; callers must not modify it. */
  public double[] data() {
    return data;
  }

  @Override
  boolean sameFields(Array other) {
    DataWrapper otherWrapper = (DataWrapper) other;
    return name.equals(otherWrapper.name) && data == otherWrapper.data;
  }
}
