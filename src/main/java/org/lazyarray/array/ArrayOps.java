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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.Ints;
import com.google.common.primitives.Longs;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Binary;
import org.lazyarray.scalar.ScalarExpr.Reduction;

/**
 * Static methods for building expression graphs. Elementwise arithmetic requires operands of the
 * same shape (there is no broadcasting) and builds {@link IndexLambda}s.
 */
public final class ArrayOps {

  private ArrayOps() {}

  public static Array matmul(Array x1, Array x2) {
    return new MatrixProduct(x1, x2);
  }

  /** Reverses the order of the axes. */
  public static Array transpose(Array x) {
    ImmutableList.Builder<Integer> axes = ImmutableList.builder();
    for (int i = x.ndim() - 1; i >= 0; i--) {
      axes.add(i);
    }
    return new AxisPermutation(x, axes.build());
  }

  public static Array transpose(Array x, int... axes) {
    return new AxisPermutation(x, ImmutableList.copyOf(Ints.asList(axes)));
  }

  public static Array roll(Array x, long shift, int axis) {
    return new Roll(x, shift, axis);
  }

  public static Array slice(Array x, long[] starts, long[] stops) {
    return new Slice(
        x, ImmutableList.copyOf(Longs.asList(starts)), ImmutableList.copyOf(Longs.asList(stops)));
  }

  public static Array reshape(Array x, long... newShape) {
    return new Reshape(x, Dim.shape(newShape));
  }

  public static Array stack(List<? extends Array> arrays, int axis) {
    return new Stack(ImmutableList.copyOf(arrays), axis);
  }

  public static Array stack(List<? extends Array> arrays) {
    return stack(arrays, 0);
  }

  public static Array concatenate(List<? extends Array> arrays, int axis) {
    return new Concatenate(ImmutableList.copyOf(arrays), axis);
  }

  public static Array add(Array x, Array y) {
    return elementwise(Binary.Op.ADD, x, y);
  }

  public static Array add(Array x, Number y) {
    return elementwise(Binary.Op.ADD, x, y);
  }

  public static Array add(Number x, Array y) {
    return elementwise(Binary.Op.ADD, x, y);
  }

  public static Array subtract(Array x, Array y) {
    return elementwise(Binary.Op.SUBTRACT, x, y);
  }

  public static Array subtract(Array x, Number y) {
    return elementwise(Binary.Op.SUBTRACT, x, y);
  }

  public static Array subtract(Number x, Array y) {
    return elementwise(Binary.Op.SUBTRACT, x, y);
  }

  public static Array multiply(Array x, Array y) {
    return elementwise(Binary.Op.MULTIPLY, x, y);
  }

  public static Array multiply(Array x, Number y) {
    return elementwise(Binary.Op.MULTIPLY, x, y);
  }

  public static Array multiply(Number x, Array y) {
    return elementwise(Binary.Op.MULTIPLY, x, y);
  }

  public static Array divide(Array x, Array y) {
    return elementwise(Binary.Op.DIVIDE, x, y);
  }

  public static Array divide(Array x, Number y) {
    return elementwise(Binary.Op.DIVIDE, x, y);
  }

  public static Array divide(Number x, Array y) {
    return elementwise(Binary.Op.DIVIDE, x, y);
  }

  /** Sums {@code x} along one axis, which is removed from the result. */
  public static Array sum(Array x, int axis) {
    Preconditions.checkArgument(axis >= 0 && axis < x.ndim(), "Invalid axis %s", axis);
    Map<String, Array> bindings = new LinkedHashMap<>();
    bindings.put("_in0", x);
    ImmutableList.Builder<ScalarExpr> index = ImmutableList.builder();
    ImmutableList.Builder<Dim> shape = ImmutableList.builder();
    for (int i = 0; i < x.ndim(); i++) {
      if (i == axis) {
        index.add(ScalarExpr.var("_r0"));
      } else {
        index.add(ScalarExpr.var("_" + (i < axis ? i : i - 1)));
        shape.add(x.shape.get(i));
      }
    }
    ScalarExpr body = ScalarExpr.var("_in0").index(index.build());
    ScalarExpr extent = dimExpr(x.shape.get(axis), bindings);
    return new IndexLambda(
        new Reduction(Reduction.Op.SUM, ImmutableList.of("_r0"), body),
        shape.build(),
        x.dtype,
        ImmutableMap.copyOf(bindings),
        ImmutableMap.of("_r0", Bounds.upTo(extent)),
        ImmutableSet.of());
  }

  /**
   * Builds an IndexLambda that combines two operands, each of which is an Array or a Number. If
   * both are Arrays they must have the same shape.
   */
  private static Array elementwise(Binary.Op op, Object left, Object right) {
    Array first = (left instanceof Array array) ? array : (Array) right;
    DType dtype = resultType(op, left, right);
    Map<String, Array> bindings = new LinkedHashMap<>();
    ScalarExpr leftExpr = operand(left, first, bindings);
    ScalarExpr rightExpr = operand(right, first, bindings);
    return new IndexLambda(
        new Binary(op, leftExpr, rightExpr), first.shape, dtype, ImmutableMap.copyOf(bindings));
  }

  private static ScalarExpr operand(Object operand, Array first, Map<String, Array> bindings) {
    if (operand instanceof Number n) {
      return ScalarExpr.constant(n);
    }
    Array array = (Array) operand;
    Preconditions.checkArgument(
        array.shape.equals(first.shape),
        "Shape mismatch: %s vs %s",
        array.shapeString(),
        first.shapeString());
    String name = "_in" + bindings.size();
    bindings.put(name, array);
    ScalarExpr.Variable v = ScalarExpr.var(name);
    return (array.ndim() == 0) ? v : v.index(indexVars(array.ndim()));
  }

  private static DType resultType(Binary.Op op, Object left, Object right) {
    DType result = null;
    boolean floatingConstant = false;
    for (Object operand : ImmutableList.of(left, right)) {
      if (operand instanceof Array array) {
        Preconditions.checkArgument(
            result == null || result == array.dtype, "Mixed dtypes %s and %s", result, array.dtype);
        result = array.dtype;
      } else {
        floatingConstant |= (operand instanceof Double || operand instanceof Float);
      }
    }
    if (result.isInteger() && (floatingConstant || op == Binary.Op.DIVIDE)) {
      return DType.FLOAT64;
    }
    return result;
  }

  /** Returns {@code [_0, _1, ...]}. */
  public static ImmutableList<ScalarExpr> indexVars(int ndim) {
    ImmutableList.Builder<ScalarExpr> builder = ImmutableList.builderWithExpectedSize(ndim);
    for (int i = 0; i < ndim; i++) {
      builder.add(ScalarExpr.var("_" + i));
    }
    return builder.build();
  }

  /**
   * Returns an expression for the given extent; a symbolic extent is added to {@code bindings}
   * under a new name.
   */
  private static ScalarExpr dimExpr(Dim dim, Map<String, Array> bindings) {
    if (dim.isConstant()) {
      return ScalarExpr.constant(dim.value());
    }
    String name = "_in" + bindings.size();
    bindings.put(name, dim.node());
    return ScalarExpr.var(name);
  }
}
