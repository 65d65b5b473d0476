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

package org.lazyarray.transform;

import org.lazyarray.LoweringError;
import org.lazyarray.array.Array;
import org.lazyarray.array.AxisPermutation;
import org.lazyarray.array.Concatenate;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.DistributedRecv;
import org.lazyarray.array.DistributedSend;
import org.lazyarray.array.IndexLambda;
import org.lazyarray.array.MatrixProduct;
import org.lazyarray.array.Placeholder;
import org.lazyarray.array.Reshape;
import org.lazyarray.array.Roll;
import org.lazyarray.array.SizeParam;
import org.lazyarray.array.Slice;
import org.lazyarray.array.Stack;

/**
 * A Mapper dispatches on the kind of an {@link Array}, calling the corresponding {@code map*}
 * method. Subclasses override the methods for the kinds they handle; the default implementations
 * call {@link #handleUnsupportedArray}, which throws.
 *
 * <p>Objects that aren't Arrays at all are passed to {@link #mapForeign}, so that a caller that
 * passes something other than a graph node gets a different error than one that reaches a kind
 * this Mapper doesn't implement.
 *
 * @param <R> the result type
 */
public abstract class Mapper<R> {

  /** Equivalent to {@link #rec}; the entry point for callers outside the Mapper. */
  public R apply(Object node) {
    return rec(node);
  }

  /** Calls the {@code map*} method for {@code node}'s kind. */
  public R rec(Object node) {
    if (!(node instanceof Array)) {
      return mapForeign(node);
    }
    Array array = (Array) node;
    switch (array.kind) {
      case PLACEHOLDER:
        return mapPlaceholder((Placeholder) array);
      case DATA_WRAPPER:
        return mapDataWrapper((DataWrapper) array);
      case SIZE_PARAM:
        return mapSizeParam((SizeParam) array);
      case INDEX_LAMBDA:
        return mapIndexLambda((IndexLambda) array);
      case MATRIX_PRODUCT:
        return mapMatrixProduct((MatrixProduct) array);
      case STACK:
        return mapStack((Stack) array);
      case CONCATENATE:
        return mapConcatenate((Concatenate) array);
      case ROLL:
        return mapRoll((Roll) array);
      case AXIS_PERMUTATION:
        return mapAxisPermutation((AxisPermutation) array);
      case SLICE:
        return mapSlice((Slice) array);
      case RESHAPE:
        return mapReshape((Reshape) array);
      case DISTRIBUTED_SEND:
        return mapDistributedSend((DistributedSend) array);
      case DISTRIBUTED_RECV:
        return mapDistributedRecv((DistributedRecv) array);
    }
    throw new AssertionError(array.kind);
  }

  /** Called for an Array whose kind has no {@code map*} method in this Mapper. */
  protected R handleUnsupportedArray(Array node) {
    throw LoweringError.of(
        LoweringError.Kind.UNSUPPORTED_NODE_KIND,
        "%s can't handle %s nodes",
        getClass().getSimpleName(),
        node.kind);
  }

  /** Called for anything that isn't an Array. */
  protected R mapForeign(Object node) {
    throw LoweringError.of(
        LoweringError.Kind.FOREIGN_OBJECT,
        "%s encountered invalid foreign object: %s",
        getClass().getSimpleName(),
        node);
  }

  protected R mapPlaceholder(Placeholder node) {
    return handleUnsupportedArray(node);
  }

  protected R mapDataWrapper(DataWrapper node) {
    return handleUnsupportedArray(node);
  }

  protected R mapSizeParam(SizeParam node) {
    return handleUnsupportedArray(node);
  }

  protected R mapIndexLambda(IndexLambda node) {
    return handleUnsupportedArray(node);
  }

  protected R mapMatrixProduct(MatrixProduct node) {
    return handleUnsupportedArray(node);
  }

  protected R mapStack(Stack node) {
    return handleUnsupportedArray(node);
  }

  protected R mapConcatenate(Concatenate node) {
    return handleUnsupportedArray(node);
  }

  protected R mapRoll(Roll node) {
    return handleUnsupportedArray(node);
  }

  protected R mapAxisPermutation(AxisPermutation node) {
    return handleUnsupportedArray(node);
  }

  protected R mapSlice(Slice node) {
    return handleUnsupportedArray(node);
  }

  protected R mapReshape(Reshape node) {
    return handleUnsupportedArray(node);
  }

  protected R mapDistributedSend(DistributedSend node) {
    return handleUnsupportedArray(node);
  }

  protected R mapDistributedRecv(DistributedRecv node) {
    return handleUnsupportedArray(node);
  }
}
