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
import org.lazyarray.codegen.ImplementedResult.Stored;
import org.lazyarray.kernel.Kernel;

/** A generated kernel, together with the values of the arguments that were known in advance. */
public final class BoundProgram {
  public final Kernel kernel;

  /** The data of each DataWrapper input, keyed by argument name. */
  public final ImmutableMap<String, double[]> boundArguments;

  /** For each output of the computation, the buffer it is stored in. */
  public final ImmutableMap<String, Stored> outputs;

  BoundProgram(
      Kernel kernel,
      ImmutableMap<String, double[]> boundArguments,
      ImmutableMap<String, Stored> outputs) {
    this.kernel = kernel;
    this.boundArguments = boundArguments;
    this.outputs = outputs;
  }

  @Override
  public String toString() {
    return String.format("%sBOUND %s\n", kernel, boundArguments.keySet());
  }
}
