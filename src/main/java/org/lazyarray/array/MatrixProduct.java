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
 * The matrix product of two arrays, contracting the last axis of {@link #x1} with the first axis of
 * {@link #x2}. The result has the remaining axes of {@code x1} followed by the remaining axes of
 * {@code x2}.
 */
public final class MatrixProduct extends Array {
  public final Array x1;
  public final Array x2;

  public MatrixProduct(Array x1, Array x2, ImmutableSet<Tag> tags) {
    super(Kind.MATRIX_PRODUCT, resultShape(x1, x2), x1.dtype, tags, x1, x2);
    Preconditions.checkArgument(x1.dtype == x2.dtype, "Mismatched dtypes");
    this.x1 = x1;
    this.x2 = x2;
  }

  public MatrixProduct(Array x1, Array x2) {
    this(x1, x2, ImmutableSet.of());
  }

  private static ImmutableList<Dim> resultShape(Array x1, Array x2) {
    Preconditions.checkArgument(
        x1.ndim() >= 1 && x2.ndim() >= 1, "Matrix product operands must have at least one axis");
    Preconditions.checkArgument(
        x1.shape.get(x1.ndim() - 1).equals(x2.shape.get(0)),
        "Can't contract %s with %s",
        x1.shapeString(),
        x2.shapeString());
    return ImmutableList.<Dim>builder()
        .addAll(x1.shape.subList(0, x1.ndim() - 1))
        .addAll(x2.shape.subList(1, x2.ndim()))
        .build();
  }

  @Override
  boolean sameFields(Array other) {
    MatrixProduct otherProduct = (MatrixProduct) other;
    return x1.equals(otherProduct.x1) && x2.equals(otherProduct.x2);
  }
}
