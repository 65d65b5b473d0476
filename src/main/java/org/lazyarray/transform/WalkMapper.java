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
import java.util.ArrayDeque;
import java.util.Deque;
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
 * Walks an expression graph depth-first, calling {@link #visit} before a node's children are walked
 * and {@link #postVisit} after.
 *
 * <p>The {@code map*} methods of a WalkMapper return the children to be walked, so subclasses can
 * change which edges are followed by overriding them.
 *
 * <p>A WalkMapper does not remember where it has been; a node that is reachable by more than one
 * path is visited once for each path, unless {@link #visit} is overridden to prune it.
 *
 * <p>The walk uses an explicit stack rather than recursion, so it can handle arbitrarily deep
 * graphs.
 */
public class WalkMapper extends Mapper<ImmutableList<Array>> {

  /**
   * Called when the walk reaches a node. If it returns false neither the node's children nor
   * {@link #postVisit} will be called for this occurrence of the node.
   */
  protected boolean visit(Array node) {
    return true;
  }

  /** Called after all of the node's children have been walked. */
  protected void postVisit(Array node) {}

  /** Walks the graph rooted at {@code root}. */
  public void walk(Object root) {
    Deque<Frame> stack = new ArrayDeque<>();
    enter(root, stack);
    while (!stack.isEmpty()) {
      Frame top = stack.peek();
      if (top.next < top.children.size()) {
        enter(top.children.get(top.next++), stack);
      } else {
        stack.pop();
        postVisit(top.node);
      }
    }
  }

  private void enter(Object node, Deque<Frame> stack) {
    // Dispatch first, so that foreign objects and unsupported kinds are reported before visit().
    ImmutableList<Array> children = rec(node);
    Array array = (Array) node;
    if (visit(array)) {
      stack.push(new Frame(array, children));
    }
  }

  /** A node whose children are being walked. */
  private static class Frame {
    final Array node;
    final ImmutableList<Array> children;
    int next;

    Frame(Array node, ImmutableList<Array> children) {
      this.node = node;
      this.children = children;
    }
  }

  /** Returns the nodes referenced by the given shape. */
  static ImmutableList<Array> shapeNodes(ImmutableList<Dim> shape) {
    return shape.stream()
        .filter(dim -> !dim.isConstant())
        .map(Dim::node)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  protected ImmutableList<Array> mapPlaceholder(Placeholder node) {
    return shapeNodes(node.shape);
  }

  @Override
  protected ImmutableList<Array> mapDataWrapper(DataWrapper node) {
    return shapeNodes(node.shape);
  }

  @Override
  protected ImmutableList<Array> mapSizeParam(SizeParam node) {
    return ImmutableList.of();
  }

  @Override
  protected ImmutableList<Array> mapIndexLambda(IndexLambda node) {
    return ImmutableList.<Array>builder()
        .addAll(node.bindings.values())
        .addAll(shapeNodes(node.shape))
        .build();
  }

  @Override
  protected ImmutableList<Array> mapMatrixProduct(MatrixProduct node) {
    return ImmutableList.of(node.x1, node.x2);
  }

  @Override
  protected ImmutableList<Array> mapStack(Stack node) {
    return node.arrays;
  }

  @Override
  protected ImmutableList<Array> mapConcatenate(Concatenate node) {
    return node.arrays;
  }

  @Override
  protected ImmutableList<Array> mapRoll(Roll node) {
    return ImmutableList.of(node.array);
  }

  @Override
  protected ImmutableList<Array> mapAxisPermutation(AxisPermutation node) {
    return ImmutableList.of(node.array);
  }

  @Override
  protected ImmutableList<Array> mapSlice(Slice node) {
    return ImmutableList.of(node.array);
  }

  @Override
  protected ImmutableList<Array> mapReshape(Reshape node) {
    return ImmutableList.of(node.array);
  }

  @Override
  protected ImmutableList<Array> mapDistributedSend(DistributedSend node) {
    return ImmutableList.of(node.data);
  }

  @Override
  protected ImmutableList<Array> mapDistributedRecv(DistributedRecv node) {
    return ImmutableList.of(node.data);
  }
}
