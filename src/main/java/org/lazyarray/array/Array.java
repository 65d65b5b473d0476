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
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An Array is a node in a lazily-evaluated graph of array expressions. Arrays are immutable, and a
 * graph may share a node between several parents; the graph must be acyclic (which is guaranteed
 * when nodes are only constructed from already existing nodes).
 *
 * <p>Arrays implement structural equality: two nodes of the same {@link Kind}, with equal shape,
 * element type, tags and kind-specific fields (including their children, compared the same way)
 * are equal, and are interchangeable as keys when memoizing over a graph. The hash code is computed
 * once, at construction, from the (already computed) hash codes of the children.
 */
public abstract class Array {

  /** The node kinds; each is implemented by exactly one subclass of Array. */
  public enum Kind {
    PLACEHOLDER,
    DATA_WRAPPER,
    SIZE_PARAM,
    INDEX_LAMBDA,
    MATRIX_PRODUCT,
    STACK,
    CONCATENATE,
    ROLL,
    AXIS_PERMUTATION,
    SLICE,
    RESHAPE,
    DISTRIBUTED_SEND,
    DISTRIBUTED_RECV
  }

  public final Kind kind;
  public final ImmutableList<Dim> shape;
  public final DType dtype;
  public final ImmutableSet<Tag> tags;

  private final int hash;

  /**
   * @param fields the values of the subclass-specific fields, which will be included in the hash
   *     code; the subclass's {@link #sameFields} method should compare the same fields
   */
  Array(
      Kind kind, ImmutableList<Dim> shape, DType dtype, ImmutableSet<Tag> tags, Object... fields) {
    this.kind = kind;
    this.shape = Preconditions.checkNotNull(shape);
    this.dtype = Preconditions.checkNotNull(dtype);
    this.tags = Preconditions.checkNotNull(tags);
    this.hash = Objects.hash(kind, shape, dtype, tags, Arrays.hashCode(fields));
  }

  /** The number of axes. */
  public final int ndim() {
    return shape.size();
  }

  /**
   * Called by {@link #equals} with another Array of the same kind, shape, dtype and tags; should
   * return true if their subclass-specific fields are equal.
   */
  abstract boolean sameFields(Array other);

  @Override
  public final boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Array other
        && hash == other.hash
        && kind == other.kind
        && dtype == other.dtype
        && shape.equals(other.shape)
        && tags.equals(other.tags)
        && sameFields(other);
  }

  @Override
  public final int hashCode() {
    return hash;
  }

  /** Returns a string describing the shape, e.g. {@code "(2, n)"}. */
  public final String shapeString() {
    return shape.stream().map(Dim::toString).collect(Collectors.joining(", ", "(", ")"));
  }

  @Override
  public String toString() {
    return String.format("%s%s", kind.name().toLowerCase(), shapeString());
  }
}
