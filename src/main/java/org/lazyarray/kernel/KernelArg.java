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

package org.lazyarray.kernel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.stream.Collectors;
import org.lazyarray.array.DType;
import org.lazyarray.scalar.ScalarExpr;

/**
 * An argument of a {@link Kernel}, supplied by the caller when the kernel runs. There are two
 * subclasses:
 *
 * <ul>
 *   <li>{@link GlobalArg}: an array in C (row-major) order
 *   <li>{@link ValueArg}: a single scalar
 * </ul>
 */
public abstract class KernelArg {
  public final String name;
  public final DType dtype;

  private KernelArg(String name, DType dtype) {
    Preconditions.checkArgument(!name.isEmpty());
    this.name = name;
    this.dtype = Preconditions.checkNotNull(dtype);
  }

  /** An array argument in C order. */
  public static final class GlobalArg extends KernelArg {
    /** The extent of each axis; may refer to {@link ValueArg}s by name. */
    public final ImmutableList<ScalarExpr> shape;

    /** True if the kernel only writes this argument (i.e. it is one of the kernel's outputs). */
    public final boolean isOutputOnly;

    public GlobalArg(
        String name, ImmutableList<ScalarExpr> shape, DType dtype, boolean isOutputOnly) {
      super(name, dtype);
      this.shape = shape;
      this.isOutputOnly = isOutputOnly;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof GlobalArg other
          && name.equals(other.name)
          && dtype == other.dtype
          && shape.equals(other.shape)
          && isOutputOnly == other.isOutputOnly;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, dtype, shape, isOutputOnly);
    }

    @Override
    public String toString() {
      String dims = shape.stream().map(ScalarExpr::toString).collect(Collectors.joining(", "));
      return String.format(
          "%s%s: %s[%s]", isOutputOnly ? "out " : "", name, dtype.name().toLowerCase(), dims);
    }
  }

  /** A scalar argument. */
  public static final class ValueArg extends KernelArg {

    public ValueArg(String name, DType dtype) {
      super(name, dtype);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ValueArg other && name.equals(other.name) && dtype == other.dtype;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, dtype);
    }

    @Override
    public String toString() {
      return String.format("%s: %s", name, dtype.name().toLowerCase());
    }
  }
}
