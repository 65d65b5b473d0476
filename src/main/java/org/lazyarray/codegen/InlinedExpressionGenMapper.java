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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.regex.Pattern;
import org.lazyarray.LoweringError;
import org.lazyarray.array.Array;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Reduction;
import org.lazyarray.scalar.ScalarExpr.Subscript;
import org.lazyarray.scalar.ScalarExpr.Variable;
import org.lazyarray.scalar.ScalarExprs;

/**
 * Generates the scalar expression for an IndexLambda (or for a shape component), replacing each
 * reference to a named array with the expression for that array's lowered result.
 *
 * <p>Names are looked up first in the context's local namespace and then in the state's
 * namespace. Positional index variables ({@code _0}, {@code _1}, ...) and reduction variables that
 * are in scope are left as is.
 */
class InlinedExpressionGenMapper extends ScalarExpr.IdentityMapper<ExpressionContext> {
  private static final Pattern POSITIONAL_INDEX = Pattern.compile("_\\d+");

  private final CodeGenMapper codeGenMapper;

  InlinedExpressionGenMapper(CodeGenMapper codeGenMapper) {
    this.codeGenMapper = codeGenMapper;
  }

  ScalarExpr generate(ScalarExpr expr, ExpressionContext context) {
    return rec(expr, context);
  }

  @Override
  protected ScalarExpr mapVariable(Variable expr, ExpressionContext context) {
    if (context.hasReduction(expr.name)) {
      return expr;
    }
    Array array = context.lookup(expr.name);
    if (array == null) {
      Preconditions.checkArgument(
          POSITIONAL_INDEX.matcher(expr.name).matches(), "Unknown name '%s'", expr.name);
      return expr;
    }
    return codeGenMapper.rec(array).toExpression(ImmutableList.of(), context);
  }

  @Override
  protected ScalarExpr mapSubscript(Subscript expr, ExpressionContext context) {
    String name = expr.aggregate.name;
    Array array = context.lookup(name);
    Preconditions.checkArgument(array != null, "Unknown name '%s'", name);
    return codeGenMapper.rec(array).toExpression(expr.index, context);
  }

  /**
   * Gives each reduction variable a fresh name that doesn't conflict with the reductions already in
   * the context, and adds its declared bounds (which may themselves refer to named arrays) to the
   * context.
   */
  @Override
  protected ScalarExpr mapReduction(Reduction expr, ExpressionContext context) {
    ImmutableMap.Builder<String, ScalarExpr> renames = ImmutableMap.builder();
    ImmutableList.Builder<String> newInames = ImmutableList.builder();
    for (String iname : expr.inames) {
      Bounds declared = context.declaredReduction(iname);
      Preconditions.checkArgument(declared != null, "No bounds for reduction variable '%s'", iname);
      Bounds bounds = new Bounds(rec(declared.lower, context), rec(declared.upper, context));
      String newName = "_r" + context.reductionCount();
      if (context.hasReduction(newName)) {
        throw LoweringError.of(
            LoweringError.Kind.REDUCTION_NAME_COLLISION,
            "Reduction variable '%s' is already in use",
            newName);
      }
      context.addReduction(newName, bounds);
      renames.put(iname, ScalarExpr.var(newName));
      newInames.add(newName);
    }
    ScalarExpr body = rec(ScalarExprs.substitute(expr.body, renames.buildOrThrow()), context);
    return new Reduction(expr.op, newInames.build(), body);
  }
}
