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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lazyarray.array.Array;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.DictOfNamedArrays;
import org.lazyarray.array.InputArgument;
import org.lazyarray.codegen.ImplementedResult.Stored;
import org.lazyarray.kernel.Kernel;

/**
 * The entry point for lowering an expression graph to a {@link Kernel}.
 *
 * <p>Each call to {@link #generate} creates its own {@link CodeGenState}, so concurrent calls
 * don't interact.
 */
public final class CodeGen {
  private static final Logger logger = LogManager.getLogger();

  private CodeGen() {}

  /** Options controlling the names that appear in the generated kernel. */
  public static final class Options {
    public static final Options DEFAULT = builder().build();

    public final String kernelName;

    /** The name given to the output when {@link #generate(Array, Options)} is called. */
    public final String outputName;

    private Options(Builder builder) {
      this.kernelName = builder.kernelName;
      this.outputName = builder.outputName;
    }

    public static Builder builder() {
      return new Builder();
    }

    /** A Builder for Options. */
    public static final class Builder {
      private String kernelName = "lazyarray_kernel";
      private String outputName = "_pt_out";

      @CanIgnoreReturnValue
      public Builder setKernelName(String kernelName) {
        Preconditions.checkArgument(!kernelName.isEmpty());
        this.kernelName = kernelName;
        return this;
      }

      @CanIgnoreReturnValue
      public Builder setOutputName(String outputName) {
        Preconditions.checkArgument(!outputName.isEmpty());
        this.outputName = outputName;
        return this;
      }

      public Options build() {
        return new Options(this);
      }
    }
  }

  /** Lowers a single array, which becomes the output named {@link Options#outputName}. */
  public static BoundProgram generate(Array result, Options options) {
    return generate(DictOfNamedArrays.of(options.outputName, result), options);
  }

  public static BoundProgram generate(Array result) {
    return generate(result, Options.DEFAULT);
  }

  public static BoundProgram generate(DictOfNamedArrays outputs) {
    return generate(outputs, Options.DEFAULT);
  }

  /**
   * Lowers the given outputs. Each output is stored to an output-only argument with the output's
   * name; each input becomes an argument with the input's name.
   *
   * @throws IllegalArgumentException if an output has the same name as an input
   * @throws org.lazyarray.LoweringError if the graph can't be lowered
   */
  public static BoundProgram generate(DictOfNamedArrays outputs, Options options) {
    ImmutableMap<String, InputArgument> namespace = outputs.namespace();
    for (String name : outputs.outputs.keySet()) {
      Preconditions.checkArgument(
          !namespace.containsKey(name), "Output '%s' has the same name as an input", name);
    }
    logger.debug("Lowering {} outputs with {} inputs", outputs.size(), namespace.size());

    CodeGenState state = new CodeGenState(namespace, Kernel.empty(options.kernelName));
    state.varNameGen.addNames(namespace.keySet());
    state.varNameGen.addNames(outputs.outputs.keySet());

    CodeGenMapper mapper = new CodeGenMapper(state);
    for (InputArgument input : namespace.values()) {
      mapper.apply(input);
    }
    ImmutableMap.Builder<String, Stored> results = ImmutableMap.builder();
    for (Map.Entry<String, Array> entry : outputs.outputs.entrySet()) {
      String name = entry.getKey();
      Array expr = entry.getValue();
      String insnId = CodeGenUtil.addStore(mapper, name, expr, mapper.apply(expr), false);
      results.put(name, new Stored(name, ImmutableSet.of(insnId)));
    }

    ImmutableMap.Builder<String, double[]> boundArguments = ImmutableMap.builder();
    namespace.forEach(
        (name, input) -> {
          if (input instanceof DataWrapper wrapper) {
            boundArguments.put(name, wrapper.data());
          }
        });
    Kernel kernel = state.kernel();
    logger.debug(
        "Generated {}: {} nodes lowered, {} instructions",
        kernel.name,
        state.loweringCount(),
        kernel.instructions.size());
    return new BoundProgram(kernel, boundArguments.buildOrThrow(), results.buildOrThrow());
  }
}
