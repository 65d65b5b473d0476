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
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lazyarray.transform.Transforms;

/**
 * An ordered collection of named output arrays; the roots of a computation.
 *
 * <p>The namespace of a DictOfNamedArrays maps the name of each {@link InputArgument} reachable
 * from its outputs to that input. It is computed on demand.
 */
public final class DictOfNamedArrays {
  public final ImmutableMap<String, Array> outputs;

  public DictOfNamedArrays(Map<String, ? extends Array> outputs) {
    for (String name : outputs.keySet()) {
      Preconditions.checkArgument(!name.isEmpty(), "Outputs must be named");
    }
    this.outputs = ImmutableMap.copyOf(outputs);
  }

  /** Returns a DictOfNamedArrays with a single output. */
  public static DictOfNamedArrays of(String name, Array output) {
    return new DictOfNamedArrays(ImmutableMap.of(name, output));
  }

  public int size() {
    return outputs.size();
  }

  public boolean isEmpty() {
    return outputs.isEmpty();
  }

  /** Returns the output with the given name, or null if there is none. */
  public @Nullable Array get(String name) {
    return outputs.get(name);
  }

  /**
   * Returns the inputs reachable from these outputs, keyed by name, in the order that they are
   * first reached.
   *
   * @throws IllegalArgumentException if two different inputs have the same name
   */
  public ImmutableMap<String, InputArgument> namespace() {
    return Transforms.namespace(outputs.values());
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof DictOfNamedArrays other && outputs.equals(other.outputs);
  }

  @Override
  public int hashCode() {
    return outputs.hashCode();
  }

  @Override
  public String toString() {
    return outputs.toString();
  }
}
