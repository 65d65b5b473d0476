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
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import org.lazyarray.array.Array;

/**
 * A WalkMapper that visits each node once and records the nodes in topological order (each node
 * after all of its children). Nodes for which {@code skip} returns true are neither recorded nor
 * walked through.
 *
 * <p>A single TopoSortMapper may walk several roots; nodes reached from an earlier root are not
 * recorded again.
 */
public final class TopoSortMapper extends WalkMapper {
  private final Predicate<Array> skip;
  private final Set<Array> seen = new HashSet<>();
  private final List<Array> order = new ArrayList<>();

  public TopoSortMapper(Predicate<Array> skip) {
    this.skip = skip;
  }

  public TopoSortMapper() {
    this(node -> false);
  }

  /** Returns the topologically-sorted nodes reachable from {@code root}. */
  public static ImmutableList<Array> sort(Array root, Predicate<Array> skip) {
    TopoSortMapper sorter = new TopoSortMapper(skip);
    sorter.walk(root);
    return sorter.order();
  }

  @Override
  protected boolean visit(Array node) {
    return !skip.test(node) && seen.add(node);
  }

  @Override
  protected void postVisit(Array node) {
    order.add(node);
  }

  /** The nodes recorded so far, children before parents. */
  public ImmutableList<Array> order() {
    return ImmutableList.copyOf(order);
  }
}
