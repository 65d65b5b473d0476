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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.lazyarray.LoweringError;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExprs;

/**
 * The generated code for one node of an expression graph. There are two subclasses:
 *
 * <ul>
 *   <li>{@link Stored}: the node's value has been written to a named buffer.
 *   <li>{@link Inlined}: the node's value is a scalar expression, to be substituted wherever it is
 *       used.
 * </ul>
 *
 * <p>ImplementedResults are immutable.
 */
public abstract class ImplementedResult {

  private ImplementedResult() {}

  /**
   * Returns an expression for the element of this result at the given indices.
   *
   * <p>Any instruction ids that the expression depends on are added to {@code context}, as are the
   * bounds of any reduction variables in the returned expression; those reduction variables are
   * distinct from the ones already in {@code context}.
   */
  public abstract ScalarExpr toExpression(List<ScalarExpr> indices, ExpressionContext context);

  /** A result that has been written to a buffer (a kernel argument or temporary). */
  public static final class Stored extends ImplementedResult {
    public final String name;

    /** The instructions that must complete before the buffer is read. */
    public final ImmutableSet<String> dependsOn;

    public Stored(String name, ImmutableSet<String> dependsOn) {
      this.name = name;
      this.dependsOn = dependsOn;
    }

    @Override
    public ScalarExpr toExpression(List<ScalarExpr> indices, ExpressionContext context) {
      context.updateDependsOn(dependsOn);
      ScalarExpr.Variable v = ScalarExpr.var(name);
      return indices.isEmpty() ? v : v.index(indices);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Stored other
          && name.equals(other.name)
          && dependsOn.equals(other.dependsOn);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, dependsOn);
    }

    @Override
    public String toString() {
      return String.format("stored %s %s", name, dependsOn);
    }
  }

  /**
   * A result that is a scalar expression in terms of the positional index variables {@code _0,
   * _1, ...}, the reduction variables in {@link #reductionBounds}, and stored buffers.
   */
  public static final class Inlined extends ImplementedResult {
    public final ScalarExpr expr;
    public final ImmutableMap<String, Bounds> reductionBounds;
    public final ImmutableSet<String> dependsOn;

    public Inlined(
        ScalarExpr expr,
        ImmutableMap<String, Bounds> reductionBounds,
        ImmutableSet<String> dependsOn) {
      this.expr = expr;
      this.reductionBounds = reductionBounds;
      this.dependsOn = dependsOn;
    }

    /** Returns an Inlined with the reductions and dependencies accumulated by {@code context}. */
    public static Inlined from(ScalarExpr expr, ExpressionContext context) {
      return new Inlined(expr, context.reductionBounds(), context.dependsOn());
    }

    @Override
    public ScalarExpr toExpression(List<ScalarExpr> indices, ExpressionContext context) {
      Map<String, ScalarExpr> substitutions = new HashMap<>();
      for (int d = 0; d < indices.size(); d++) {
        substitutions.put("_" + d, indices.get(d));
      }
      // Rename our reductions so that they don't conflict with those already in the context.
      int start = context.reductionCount();
      ImmutableList<Map.Entry<String, Bounds>> entries = reductionBounds.entrySet().asList();
      for (int i = 0; i < entries.size(); i++) {
        String newName = "_r" + (start + i);
        if (context.hasReduction(newName)) {
          throw LoweringError.of(
              LoweringError.Kind.REDUCTION_NAME_COLLISION,
              "Reduction variable '%s' is already in use",
              newName);
        }
        substitutions.put(entries.get(i).getKey(), ScalarExpr.var(newName));
        context.addReduction(newName, entries.get(i).getValue());
      }
      context.updateDependsOn(dependsOn);
      return ScalarExprs.substitute(expr, substitutions);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Inlined other
          && expr.equals(other.expr)
          && reductionBounds.equals(other.reductionBounds)
          && dependsOn.equals(other.dependsOn);
    }

    @Override
    public int hashCode() {
      return Objects.hash(expr, reductionBounds, dependsOn);
    }

    @Override
    public String toString() {
      return String.format("inlined %s %s %s", expr, reductionBounds, dependsOn);
    }
  }
}
