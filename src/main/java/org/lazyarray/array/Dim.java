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
import java.util.Arrays;
import org.jspecify.annotations.Nullable;

/**
 * The extent of one axis of an {@link Array}: either a non-negative integer constant, or a
 * reference to a zero-dimensional integer-valued Array (usually a {@link SizeParam}).
 */
public final class Dim {
  private final long value;
  private final @Nullable Array node;

  private Dim(long value, @Nullable Array node) {
    this.value = value;
    this.node = node;
  }

  /** Returns a constant Dim. */
  public static Dim of(long value) {
    Preconditions.checkArgument(value >= 0, "Negative extent %s", value);
    return new Dim(value, null);
  }

  /** Returns a Dim whose value is that of the given zero-dimensional Array. */
  public static Dim of(Array node) {
    Preconditions.checkArgument(node.ndim() == 0, "Shape component must be a scalar: %s", node);
    Preconditions.checkArgument(node.dtype.isInteger(), "Shape component must be an integer");
    return new Dim(-1, node);
  }

  /** Returns a shape with the given constant extents. */
  public static ImmutableList<Dim> shape(long... extents) {
    return Arrays.stream(extents).mapToObj(Dim::of).collect(ImmutableList.toImmutableList());
  }

  /** True if this Dim is a constant. */
  public boolean isConstant() {
    return node == null;
  }

  /** Should only be called on constant Dims. */
  public long value() {
    Preconditions.checkState(node == null, "Not a constant extent");
    return value;
  }

  /** Should only be called on non-constant Dims. */
  public Array node() {
    Preconditions.checkState(node != null, "Not a symbolic extent");
    return node;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Dim other)) {
      return false;
    }
    return (node == null) ? (other.node == null && value == other.value) : node.equals(other.node);
  }

  @Override
  public int hashCode() {
    return (node == null) ? Long.hashCode(value) : node.hashCode();
  }

  @Override
  public String toString() {
    if (node == null) {
      return String.valueOf(value);
    }
    return (node instanceof InputArgument arg) ? arg.name : node.toString();
  }
}
