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

import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lazyarray.array.Array;

/**
 * A Mapper that computes each node's result at most once.
 *
 * <p>When {@link #rec} is called with a node that has no result yet, all the nodes reachable from
 * it that have no result are first sorted topologically and then mapped in that order, so the
 * {@code map*} methods find the results for their children already cached and the Java stack
 * depth doesn't grow with the depth of the graph.
 *
 * @param <R> the result type
 */
public abstract class CachedMapper<R> extends Mapper<R> {
  private final Map<Array, R> cache = new HashMap<>();

  /** Returns the cached result for {@code node}, or null if it hasn't been mapped yet. */
  protected @Nullable R cached(Array node) {
    return cache.get(node);
  }

  /** Saves the result for {@code node}; each node's result may only be saved once. */
  protected void cache(Array node, R result) {
    R prev = cache.put(node, result);
    assert prev == null : node;
  }

  @Override
  public R rec(Object node) {
    if (!(node instanceof Array array)) {
      return super.rec(node);
    }
    R result = cached(array);
    if (result == null) {
      for (Array pending : TopoSortMapper.sort(array, n -> cached(n) != null)) {
        // A map* method may already have reached this node by another route (e.g. a name lookup).
        if (cached(pending) == null) {
          cache(pending, super.rec(pending));
        }
      }
      result = cached(array);
    }
    return result;
  }
}
