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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.lazyarray.array.Array;
import org.lazyarray.array.AxisPermutation;
import org.lazyarray.array.Concatenate;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.Dim;
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
 * Makes a deep copy of an expression graph. Nodes that are shared in the original are shared in
 * the copy.
 *
 * <p>CopyMapper is the starting point for graph rewrites: a subclass overrides the {@code map*}
 * methods for the kinds it wants to change, and calls {@link #rec} to get the (possibly rewritten)
 * copy of each child.
 */
public class CopyMapper extends CachedMapper<Array> {

  /** Returns the copy of {@code node}. */
  public Array copy(Array node) {
    return rec(node);
  }

  /** Returns the given shape with each symbolic extent replaced by its copy. */
  protected ImmutableList<Dim> copyShape(ImmutableList<Dim> shape) {
    return shape.stream()
        .map(dim -> dim.isConstant() ? dim : Dim.of(rec(dim.node())))
        .collect(ImmutableList.toImmutableList());
  }

  protected ImmutableList<Array> copyAll(ImmutableList<Array> nodes) {
    return nodes.stream().map(this::rec).collect(ImmutableList.toImmutableList());
  }

  @Override
  protected Array mapPlaceholder(Placeholder node) {
    return new Placeholder(node.name, copyShape(node.shape), node.dtype, node.tags);
  }

  @Override
  protected Array mapDataWrapper(DataWrapper node) {
    return new DataWrapper(node.name, node.data(), copyShape(node.shape), node.tags);
  }

  @Override
  protected Array mapSizeParam(SizeParam node) {
    return new SizeParam(node.name, node.tags);
  }

  @Override
  protected Array mapIndexLambda(IndexLambda node) {
    ImmutableMap<String, Array> bindings =
        node.bindings.entrySet().stream()
            .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, e -> rec(e.getValue())));
    return new IndexLambda(
        node.expr,
        copyShape(node.shape),
        node.dtype,
        bindings,
        node.reductionBounds,
        node.tags);
  }

  @Override
  protected Array mapMatrixProduct(MatrixProduct node) {
    return new MatrixProduct(rec(node.x1), rec(node.x2), node.tags);
  }

  @Override
  protected Array mapStack(Stack node) {
    return new Stack(copyAll(node.arrays), node.axis, node.tags);
  }

  @Override
  protected Array mapConcatenate(Concatenate node) {
    return new Concatenate(copyAll(node.arrays), node.axis, node.tags);
  }

  @Override
  protected Array mapRoll(Roll node) {
    return new Roll(rec(node.array), node.shift, node.axis, node.tags);
  }

  @Override
  protected Array mapAxisPermutation(AxisPermutation node) {
    return new AxisPermutation(rec(node.array), node.axes, node.tags);
  }

  @Override
  protected Array mapSlice(Slice node) {
    return new Slice(rec(node.array), node.starts, node.stops, node.tags);
  }

  @Override
  protected Array mapReshape(Reshape node) {
    return new Reshape(rec(node.array), node.shape, node.tags);
  }

  @Override
  protected Array mapDistributedSend(DistributedSend node) {
    return new DistributedSend(rec(node.data), node.destRank, node.tags);
  }

  @Override
  protected Array mapDistributedRecv(DistributedRecv node) {
    return new DistributedRecv(rec(node.data), node.srcRank, node.tags);
  }
}
