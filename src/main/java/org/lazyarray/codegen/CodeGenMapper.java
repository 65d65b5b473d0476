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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jspecify.annotations.Nullable;
import org.lazyarray.LoweringError;
import org.lazyarray.array.Array;
import org.lazyarray.array.AxisPermutation;
import org.lazyarray.array.Concatenate;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.Dim;
import org.lazyarray.array.IndexLambda;
import org.lazyarray.array.IndexRemapping;
import org.lazyarray.array.InputArgument;
import org.lazyarray.array.MatrixProduct;
import org.lazyarray.array.Placeholder;
import org.lazyarray.array.Reshape;
import org.lazyarray.array.Roll;
import org.lazyarray.array.SizeParam;
import org.lazyarray.array.Slice;
import org.lazyarray.array.Stack;
import org.lazyarray.codegen.ImplementedResult.Inlined;
import org.lazyarray.codegen.ImplementedResult.Stored;
import org.lazyarray.kernel.Assignment;
import org.lazyarray.kernel.Domain;
import org.lazyarray.kernel.Kernel;
import org.lazyarray.kernel.KernelArg;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Reduction;
import org.lazyarray.transform.CachedMapper;

/**
 * Lowers each node of an expression graph to an {@link ImplementedResult}, adding arguments,
 * temporaries, domains and instructions to the state's kernel as needed.
 *
 * <p>Matrix products and stacks are always stored to a temporary; index remappings and
 * IndexLambdas are inlined. Each node is lowered at most once, and its result is saved in the
 * {@link CodeGenState}.
 *
 * <p>Distributed sends and receives can't be lowered.
 */
public class CodeGenMapper extends CachedMapper<ImplementedResult> {
  private static final Logger logger = LogManager.getLogger();

  public final CodeGenState state;
  private final InlinedExpressionGenMapper exprGen;

  public CodeGenMapper(CodeGenState state) {
    this.state = state;
    this.exprGen = new InlinedExpressionGenMapper(this);
  }

  @Override
  protected @Nullable ImplementedResult cached(Array node) {
    return state.result(node);
  }

  @Override
  protected void cache(Array node, ImplementedResult result) {
    logger.debug("Lowered {} to {}", node, result);
    state.recordResult(node, result);
  }

  /**
   * Returns an expression for the given extent, which may only refer to the kernel's value
   * arguments.
   */
  public ScalarExpr dimExpression(Dim dim) {
    if (dim.isConstant()) {
      return ScalarExpr.constant(dim.value());
    }
    ExpressionContext shapeContext = new ExpressionContext(state);
    ScalarExpr result = rec(dim.node()).toExpression(ImmutableList.of(), shapeContext);
    if (!shapeContext.dependsOn().isEmpty() || shapeContext.reductionCount() != 0) {
      throw LoweringError.of(
          LoweringError.Kind.SYMBOLIC_SHAPE_VIOLATION,
          "Extent %s must not depend on computed values (got %s)",
          dim,
          result);
    }
    return result;
  }

  /** Returns an expression for each extent of {@code node}'s shape. */
  public ImmutableList<ScalarExpr> shapeExpressions(Array node) {
    return node.shape.stream().map(this::dimExpression).collect(ImmutableList.toImmutableList());
  }

  @Override
  protected ImplementedResult mapSizeParam(SizeParam node) {
    state.updateKernel(state.kernel().withArg(new KernelArg.ValueArg(node.name, node.dtype)));
    return new Stored(node.name, ImmutableSet.of());
  }

  private ImplementedResult handleArrayInput(InputArgument node) {
    ImmutableList<ScalarExpr> shape = shapeExpressions(node);
    state.updateKernel(
        state.kernel().withArg(new KernelArg.GlobalArg(node.name, shape, node.dtype, false)));
    return new Stored(node.name, ImmutableSet.of());
  }

  @Override
  protected ImplementedResult mapPlaceholder(Placeholder node) {
    return handleArrayInput(node);
  }

  @Override
  protected ImplementedResult mapDataWrapper(DataWrapper node) {
    return handleArrayInput(node);
  }

  @Override
  protected ImplementedResult mapMatrixProduct(MatrixProduct node) {
    ImplementedResult x1Result = rec(node.x1);
    ImplementedResult x2Result = rec(node.x2);
    ExpressionContext context = new ExpressionContext(state);
    context.addReduction("_r0", Bounds.upTo(dimExpression(node.x2.shape.get(0))));

    int x1Last = node.x1.ndim() - 1;
    List<ScalarExpr> x1Indices = new ArrayList<>();
    for (int i = 0; i < node.x1.ndim(); i++) {
      x1Indices.add(ScalarExpr.var((i == x1Last) ? "_r0" : "_" + i));
    }
    List<ScalarExpr> x2Indices = new ArrayList<>();
    for (int i = 0; i < node.x2.ndim(); i++) {
      x2Indices.add(ScalarExpr.var((i == 0) ? "_r0" : "_" + (i + x1Last - 1)));
    }
    ScalarExpr product =
        x1Result.toExpression(x1Indices, context).times(x2Result.toExpression(x2Indices, context));
    ScalarExpr expr = new Reduction(Reduction.Op.SUM, ImmutableList.of("_r0"), product);

    String outputName = state.varNameGen.generate("matmul");
    String insnId =
        CodeGenUtil.addStore(this, outputName, node, Inlined.from(expr, context), true);
    return new Stored(outputName, ImmutableSet.of(insnId));
  }

  @Override
  protected ImplementedResult mapStack(Stack node) {
    String outName = state.varNameGen.generate("stack");
    List<String> inames = new ArrayList<>();
    for (int j = 0; j < node.ndim() - 1; j++) {
      int axis = (j >= node.axis) ? j + 1 : j;
      inames.add(state.varNameGen.generate(outName + "_dim" + axis));
    }
    ImmutableList<ScalarExpr> indices = variables(inames);

    Map<String, Bounds> reductionBounds = new LinkedHashMap<>();
    ImmutableSet<String> dependsOn = ImmutableSet.of();
    List<Assignment> newInsns = new ArrayList<>();
    for (int i = 0; i < node.arrays.size(); i++) {
      ExpressionContext context = new ExpressionContext(state);
      ScalarExpr expr = rec(node.arrays.get(i)).toExpression(indices, context);
      expr =
          CodeGenUtil.renameReductions(
              expr, context, old -> state.varNameGen.generate(outName + old));
      reductionBounds.putAll(context.reductionBounds());

      List<ScalarExpr> assigneeIndices = new ArrayList<>(indices);
      assigneeIndices.add(node.axis, ScalarExpr.constant(i));
      String insnId = state.insnIdGen.generate(outName + "_" + i);
      newInsns.add(
          new Assignment(
              insnId,
              ScalarExpr.var(outName).index(assigneeIndices),
              expr,
              ImmutableSet.copyOf(inames),
              ImmutableSet.<String>builder()
                  .addAll(context.dependsOn())
                  .addAll(dependsOn)
                  .build()));
      dependsOn = ImmutableSet.of(insnId);
    }

    Domain domain =
        CodeGenUtil.domainForShape(
            inames, shapeExpressions(node.arrays.get(0)), reductionBounds);
    state.updateKernel(
        state
            .kernel()
            .withTemporary(CodeGenUtil.temporaryFor(outName, node, shapeExpressions(node)))
            .withDomain(domain)
            .withInstructions(newInsns));
    return new Stored(outName, dependsOn);
  }

  @Override
  protected ImplementedResult mapConcatenate(Concatenate node) {
    String outName = state.varNameGen.generate("concat");
    Kernel kernel = state.kernel();
    ImmutableSet<String> dependsOn = ImmutableSet.of();
    long offset = 0;
    List<Assignment> newInsns = new ArrayList<>();
    List<Domain> newDomains = new ArrayList<>();
    for (int i = 0; i < node.arrays.size(); i++) {
      Array array = node.arrays.get(i);
      List<String> inames = new ArrayList<>();
      for (int d = 0; d < array.ndim(); d++) {
        inames.add(state.varNameGen.generate(outName + "_dim" + d));
      }
      ImmutableList<ScalarExpr> indices = variables(inames);
      ExpressionContext context = new ExpressionContext(state);
      ScalarExpr expr = rec(array).toExpression(indices, context);
      expr =
          CodeGenUtil.renameReductions(
              expr, context, old -> state.varNameGen.generate(outName + old));

      List<ScalarExpr> assigneeIndices = new ArrayList<>(indices);
      if (offset != 0) {
        assigneeIndices.set(node.axis, indices.get(node.axis).plus(offset));
      }
      String insnId = state.insnIdGen.generate(outName + "_" + i);
      newInsns.add(
          new Assignment(
              insnId,
              ScalarExpr.var(outName).index(assigneeIndices),
              expr,
              ImmutableSet.copyOf(inames),
              ImmutableSet.<String>builder()
                  .addAll(context.dependsOn())
                  .addAll(dependsOn)
                  .build()));
      newDomains.add(
          CodeGenUtil.domainForShape(inames, shapeExpressions(array), context.reductionBounds()));
      dependsOn = ImmutableSet.of(insnId);
      offset += array.shape.get(node.axis).value();
    }

    kernel = kernel.withTemporary(CodeGenUtil.temporaryFor(outName, node, shapeExpressions(node)));
    for (Domain domain : newDomains) {
      kernel = kernel.withDomain(domain);
    }
    state.updateKernel(kernel.withInstructions(newInsns));
    return new Stored(outName, dependsOn);
  }

  /** Returns an Inlined result that reads {@code node.array} at the given indices. */
  private ImplementedResult handleIndexRemapping(IndexRemapping node, List<ScalarExpr> indices) {
    ExpressionContext context = new ExpressionContext(state);
    ScalarExpr expr = rec(node.array).toExpression(indices, context);
    return Inlined.from(expr, context);
  }

  @Override
  protected ImplementedResult mapRoll(Roll node) {
    List<ScalarExpr> indices = new ArrayList<>(positionalIndices(node.ndim()));
    ScalarExpr extent = dimExpression(node.shape.get(node.axis));
    indices.set(node.axis, indices.get(node.axis).minus(node.shift).mod(extent));
    return handleIndexRemapping(node, indices);
  }

  @Override
  protected ImplementedResult mapAxisPermutation(AxisPermutation node) {
    ScalarExpr[] indices = new ScalarExpr[node.ndim()];
    for (int i = 0; i < node.ndim(); i++) {
      indices[node.axes.get(i)] = ScalarExpr.var("_" + i);
    }
    return handleIndexRemapping(node, Arrays.asList(indices));
  }

  @Override
  protected ImplementedResult mapSlice(Slice node) {
    List<ScalarExpr> indices = new ArrayList<>();
    for (int d = 0; d < node.ndim(); d++) {
      ScalarExpr index = ScalarExpr.var("_" + d);
      long start = node.starts.get(d);
      indices.add((start == 0) ? index : index.plus(start));
    }
    return handleIndexRemapping(node, indices);
  }

  @Override
  protected ImplementedResult mapReshape(Reshape node) {
    // Compute the row-major offset of the element in the new shape, then split it up again
    // according to the original shape.
    ScalarExpr flat = ScalarExpr.Const.ZERO;
    long stride = 1;
    for (int d = node.ndim() - 1; d >= 0; d--) {
      ScalarExpr term = ScalarExpr.var("_" + d);
      if (stride != 1) {
        term = term.times(ScalarExpr.constant(stride));
      }
      flat = (flat == ScalarExpr.Const.ZERO) ? term : term.plus(flat);
      stride *= node.shape.get(d).value();
    }
    ImmutableList<Dim> oldShape = node.array.shape;
    ScalarExpr[] indices = new ScalarExpr[oldShape.size()];
    stride = 1;
    for (int d = oldShape.size() - 1; d >= 0; d--) {
      ScalarExpr index = (stride == 1) ? flat : flat.floorDiv(ScalarExpr.constant(stride));
      if (d != 0) {
        index = index.mod(ScalarExpr.constant(oldShape.get(d).value()));
      }
      indices[d] = index;
      stride *= oldShape.get(d).value();
    }
    return handleIndexRemapping(node, Arrays.asList(indices));
  }

  @Override
  protected ImplementedResult mapIndexLambda(IndexLambda node) {
    ExpressionContext context =
        new ExpressionContext(state, node.bindings, node.reductionBounds);
    ScalarExpr expr = exprGen.generate(node.expr, context);
    return Inlined.from(expr, context);
  }

  /** Returns {@code [_0, _1, ...]}. */
  static ImmutableList<ScalarExpr> positionalIndices(int ndim) {
    ImmutableList.Builder<ScalarExpr> builder = ImmutableList.builderWithExpectedSize(ndim);
    for (int i = 0; i < ndim; i++) {
      builder.add(ScalarExpr.var("_" + i));
    }
    return builder.build();
  }

  private static ImmutableList<ScalarExpr> variables(List<String> names) {
    return names.stream().map(ScalarExpr::var).collect(ImmutableList.toImmutableList());
  }
}
