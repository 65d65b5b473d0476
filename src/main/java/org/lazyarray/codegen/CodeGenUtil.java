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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.lazyarray.LoweringError;
import org.lazyarray.array.Array;
import org.lazyarray.kernel.Assignment;
import org.lazyarray.kernel.Domain;
import org.lazyarray.kernel.Kernel;
import org.lazyarray.kernel.KernelArg;
import org.lazyarray.kernel.TemporaryVariable;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExprs;

/** Static helpers for building domains and instructions. */
public final class CodeGenUtil {
  private static final Logger logger = LogManager.getLogger();

  private CodeGenUtil() {}

  /**
   * Returns a domain for an array of the given shape, with a dimension named {@code
   * axisNames.get(i)} ranging over {@code [0, shape.get(i))}, plus a dimension for each of the
   * given reductions. Variables in the extents and bounds become parameters of the domain.
   */
  public static Domain domainForShape(
      List<String> axisNames, List<ScalarExpr> shape, Map<String, Bounds> reductions) {
    if (axisNames.size() != shape.size()) {
      throw LoweringError.of(
          LoweringError.Kind.DOMAIN_SHAPE_MISMATCH,
          "%s axis names for a shape with %s axes",
          axisNames.size(),
          shape.size());
    }
    Domain.Builder builder = Domain.builder();
    for (int i = 0; i < shape.size(); i++) {
      builder.addDim(axisNames.get(i), Bounds.upTo(shape.get(i)));
    }
    reductions.forEach(builder::addDim);
    return builder.build();
  }

  /**
   * Adds an instruction that stores {@code result} (the lowered form of {@code expr}) to a new
   * buffer called {@code name}, which is either a temporary or an output argument of the kernel.
   *
   * @return the id of the new instruction
   */
  public static String addStore(
      CodeGenMapper mapper,
      String name,
      Array expr,
      ImplementedResult result,
      boolean outputToTemporary) {
    CodeGenState state = mapper.state;
    ImmutableList.Builder<String> inamesBuilder = ImmutableList.builder();
    for (int d = 0; d < expr.ndim(); d++) {
      inamesBuilder.add(state.varNameGen.generate(name + "_dim" + d));
    }
    ImmutableList<String> inames = inamesBuilder.build();
    ImmutableList<ScalarExpr> indices =
        inames.stream().map(ScalarExpr::var).collect(ImmutableList.toImmutableList());
    ExpressionContext context = new ExpressionContext(state);
    ScalarExpr value = result.toExpression(indices, context);
    value = renameReductions(value, context, old -> state.varNameGen.generate(name + old));

    ScalarExpr.Variable target = ScalarExpr.var(name);
    ScalarExpr assignee = indices.isEmpty() ? target : target.index(indices);
    String insnId = state.insnIdGen.generate(name + "_store");
    Assignment insn =
        new Assignment(
            insnId, assignee, value, ImmutableSet.copyOf(inames), context.dependsOn());

    ImmutableList<ScalarExpr> shape = mapper.shapeExpressions(expr);
    Domain domain = domainForShape(inames, shape, context.reductionBounds());
    Kernel kernel = state.kernel();
    if (outputToTemporary) {
      kernel = kernel.withTemporary(temporaryFor(name, expr, shape));
    } else {
      kernel = kernel.withArg(new KernelArg.GlobalArg(name, shape, expr.dtype, true));
    }
    state.updateKernel(kernel.withDomain(domain).withInstruction(insn));
    logger.debug("Stored {} as {}", name, insn);
    return insnId;
  }

  /**
   * Returns a temporary to hold {@code expr}; temporaries with a symbolic shape must be in global
   * memory.
   */
  static TemporaryVariable temporaryFor(String name, Array expr, ImmutableList<ScalarExpr> shape) {
    boolean isSymbolic = expr.shape.stream().anyMatch(dim -> !dim.isConstant());
    return new TemporaryVariable(
        name,
        expr.dtype,
        shape,
        isSymbolic ? TemporaryVariable.AddressSpace.GLOBAL : TemporaryVariable.AddressSpace.AUTO);
  }

  /**
   * Renames each of the reductions in {@code expr} and {@code context} to the name returned by
   * {@code nameGen} for it, and returns the renamed expression.
   */
  public static ScalarExpr renameReductions(
      ScalarExpr expr, ExpressionContext context, Function<String, String> nameGen) {
    Map<String, ScalarExpr> substitutions = new HashMap<>();
    Map<String, Bounds> newBounds = new LinkedHashMap<>();
    context
        .reductionBounds()
        .forEach(
            (oldName, bounds) -> {
              String newName = nameGen.apply(oldName);
              substitutions.put(oldName, ScalarExpr.var(newName));
              newBounds.put(newName, bounds);
            });
    context.setReductionBounds(newBounds);
    return ScalarExprs.substitute(expr, substitutions);
  }
}
