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

package org.lazyarray.codegen;

import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.lazyarray.array.Array;
import org.lazyarray.array.InputArgument;
import org.lazyarray.kernel.Kernel;
import org.lazyarray.kernel.UniqueNameGenerator;

/**
 * The mutable state of a single call to {@link CodeGen#generate}: the kernel built so far, the
 * result for each node that has been lowered, and generators for fresh names.
 */
public final class CodeGenState {
  /** The inputs of the computation, by name. */
  public final ImmutableMap<String, InputArgument> namespace;

  public final UniqueNameGenerator varNameGen;
  public final UniqueNameGenerator insnIdGen;

  private Kernel kernel;
  private final Map<Array, ImplementedResult> results = new HashMap<>();

  /** The number of nodes lowered so far. */
  private int loweringCount;

  public CodeGenState(ImmutableMap<String, InputArgument> namespace, Kernel kernel) {
    this.namespace = namespace;
    this.kernel = kernel;
    this.varNameGen = kernel.varNameGenerator();
    this.insnIdGen = kernel.instructionIdGenerator();
  }

  public Kernel kernel() {
    return kernel;
  }

  public void updateKernel(Kernel kernel) {
    this.kernel = kernel;
  }

  /** Returns the result for the given node, or null if it has not been lowered. */
  public @Nullable ImplementedResult result(Array node) {
    return results.get(node);
  }

  /** Records the result of lowering a node; each node may only be lowered once. */
  void recordResult(Array node, ImplementedResult result) {
    ImplementedResult prev = results.put(node, result);
    if (prev != null) {
      throw new AssertionError("Lowered twice: " + node);
    }
    loweringCount++;
  }

  public int loweringCount() {
    return loweringCount;
  }
}
