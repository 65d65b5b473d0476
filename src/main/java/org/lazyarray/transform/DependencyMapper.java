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
import com.google.common.collect.ImmutableSet;
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
 * Maps each node to the set of nodes it transitively depends on, including itself and the nodes
 * referenced by symbolic extents.
 */
public class DependencyMapper extends CachedMapper<ImmutableSet<Array>> {

  /** Returns the union of {@code node} and the dependencies of each of {@code children}. */
  protected ImmutableSet<Array> combine(Array node, Iterable<? extends Array> children) {
    ImmutableSet.Builder<Array> builder = ImmutableSet.builder();
    builder.add(node);
    for (Array child : children) {
      builder.addAll(rec(child));
    }
    return builder.build();
  }

  @Override
  protected ImmutableSet<Array> mapPlaceholder(Placeholder node) {
    return combine(node, WalkMapper.shapeNodes(node.shape));
  }

  @Override
  protected ImmutableSet<Array> mapDataWrapper(DataWrapper node) {
    return combine(node, WalkMapper.shapeNodes(node.shape));
  }

  @Override
  protected ImmutableSet<Array> mapSizeParam(SizeParam node) {
    return ImmutableSet.of(node);
  }

  @Override
  protected ImmutableSet<Array> mapIndexLambda(IndexLambda node) {
    return combine(
        node,
        ImmutableList.<Array>builder()
            .addAll(node.bindings.values())
            .addAll(WalkMapper.shapeNodes(node.shape))
            .build());
  }

  @Override
  protected ImmutableSet<Array> mapMatrixProduct(MatrixProduct node) {
    return combine(node, ImmutableList.of(node.x1, node.x2));
  }

  @Override
  protected ImmutableSet<Array> mapStack(Stack node) {
    return combine(node, node.arrays);
  }

  @Override
  protected ImmutableSet<Array> mapConcatenate(Concatenate node) {
    return combine(node, node.arrays);
  }

  @Override
  protected ImmutableSet<Array> mapRoll(Roll node) {
    return combine(node, ImmutableList.of(node.array));
  }

  @Override
  protected ImmutableSet<Array> mapAxisPermutation(AxisPermutation node) {
    return combine(node, ImmutableList.of(node.array));
  }

  @Override
  protected ImmutableSet<Array> mapSlice(Slice node) {
    return combine(node, ImmutableList.of(node.array));
  }

  @Override
  protected ImmutableSet<Array> mapReshape(Reshape node) {
    return combine(node, ImmutableList.of(node.array));
  }

  @Override
  protected ImmutableSet<Array> mapDistributedSend(DistributedSend node) {
    return combine(node, ImmutableList.of(node.data));
  }

  @Override
  protected ImmutableSet<Array> mapDistributedRecv(DistributedRecv node) {
    return combine(node, ImmutableList.of(node.data));
  }
}
