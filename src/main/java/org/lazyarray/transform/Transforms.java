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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.Map;
import org.lazyarray.array.Array;
import org.lazyarray.array.DictOfNamedArrays;
import org.lazyarray.array.InputArgument;

/** Static methods that apply the mappers in this package to a whole set of outputs. */
public final class Transforms {

  private Transforms() {}

  /** Returns a DictOfNamedArrays with the copy of each output made by {@code copyMapper}. */
  public static DictOfNamedArrays copyDictOfNamedArrays(
      DictOfNamedArrays source, CopyMapper copyMapper) {
    if (source.isEmpty()) {
      return new DictOfNamedArrays(ImmutableMap.of());
    }
    Map<String, Array> copies = new LinkedHashMap<>();
    source.outputs.forEach((name, output) -> copies.put(name, copyMapper.copy(output)));
    return new DictOfNamedArrays(copies);
  }

  /** Returns the dependencies of each output, as computed by a {@link DependencyMapper}. */
  public static ImmutableMap<String, ImmutableSet<Array>> getDependencies(
      DictOfNamedArrays outputs) {
    DependencyMapper mapper = new DependencyMapper();
    ImmutableMap.Builder<String, ImmutableSet<Array>> builder = ImmutableMap.builder();
    outputs.outputs.forEach((name, output) -> builder.put(name, mapper.apply(output)));
    return builder.buildOrThrow();
  }

  /**
   * Returns the inputs reachable from {@code roots}, keyed by name, in topological order (so an
   * input comes after any size parameters in its shape).
   *
   * @throws IllegalArgumentException if two different inputs have the same name
   */
  public static ImmutableMap<String, InputArgument> namespace(Iterable<? extends Array> roots) {
    TopoSortMapper sorter = new TopoSortMapper();
    roots.forEach(sorter::walk);
    Map<String, InputArgument> result = new LinkedHashMap<>();
    for (Array node : sorter.order()) {
      if (node instanceof InputArgument input) {
        InputArgument prev = result.putIfAbsent(input.name, input);
        Preconditions.checkArgument(
            prev == null || prev.equals(input), "Two different inputs named '%s'", input.name);
      }
    }
    return ImmutableMap.copyOf(result);
  }
}
