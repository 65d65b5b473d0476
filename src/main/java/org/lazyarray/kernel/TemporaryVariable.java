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

import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.stream.Collectors;
import org.lazyarray.array.DType;
import org.lazyarray.scalar.ScalarExpr;

/** An array that is allocated by the kernel for intermediate results. */
public final class TemporaryVariable {

  /** Where a temporary lives. */
  public enum AddressSpace {
    /** Let the code generator decide. */
    AUTO,
    /** Device-global memory; required for temporaries with a symbolic shape. */
    GLOBAL
  }

  public final String name;
  public final DType dtype;
  public final ImmutableList<ScalarExpr> shape;
  public final AddressSpace addressSpace;

  public TemporaryVariable(
      String name, DType dtype, ImmutableList<ScalarExpr> shape, AddressSpace addressSpace) {
    this.name = name;
    this.dtype = dtype;
    this.shape = shape;
    this.addressSpace = addressSpace;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof TemporaryVariable other
        && name.equals(other.name)
        && dtype == other.dtype
        && shape.equals(other.shape)
        && addressSpace == other.addressSpace;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, dtype, shape, addressSpace);
  }

  @Override
  public String toString() {
    String dims = shape.stream().map(ScalarExpr::toString).collect(Collectors.joining(", "));
    return String.format(
        "%s: %s[%s] (%s)",
        name, dtype.name().toLowerCase(), dims, addressSpace.name().toLowerCase());
  }
}
