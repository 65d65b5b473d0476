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

package org.lazyarray.scalar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lazyarray.scalar.ScalarExpr.Binary;
import org.lazyarray.scalar.ScalarExpr.Const;
import org.lazyarray.scalar.ScalarExpr.Reduction;
import org.lazyarray.scalar.ScalarExpr.Subscript;
import org.lazyarray.scalar.ScalarExpr.Variable;

/** A static-only class with the basic algorithms on {@link ScalarExpr}s. */
public final class ScalarExprs {

  private ScalarExprs() {}

  /**
   * Returns the names of all variables that occur free in {@code expr}, in order of first
   * occurrence. Subscripted array names are included; reduction variables are not free within
   * their reduction.
   */
  public static ImmutableSet<String> freeVariables(ScalarExpr expr) {
    Set<String> result = new LinkedHashSet<>();
    addFreeVariables(expr, new HashSet<>(), result);
    return ImmutableSet.copyOf(result);
  }

  private static void addFreeVariables(ScalarExpr expr, Set<String> bound, Set<String> result) {
    if (expr instanceof Variable v) {
      if (!bound.contains(v.name)) {
        result.add(v.name);
      }
    } else if (expr instanceof Subscript s) {
      addFreeVariables(s.aggregate, bound, result);
      s.index.forEach(e -> addFreeVariables(e, bound, result));
    } else if (expr instanceof Binary b) {
      addFreeVariables(b.left, bound, result);
      addFreeVariables(b.right, bound, result);
    } else if (expr instanceof Reduction r) {
      Set<String> inner = new HashSet<>(bound);
      inner.addAll(r.inames);
      addFreeVariables(r.body, inner, result);
    } else {
      assert expr instanceof Const;
    }
  }

  /**
   * Simultaneously replaces each variable named in {@code substitutions} with the corresponding
   * expression. Substituted expressions are not themselves rewritten.
   *
   * <p>Array names in subscripts and reduction variable names are renamed if they are mapped to a
   * {@link Variable}; mapping one of them to anything else is an error.
   */
  public static ScalarExpr substitute(
      ScalarExpr expr, Map<String, ? extends ScalarExpr> substitutions) {
    if (substitutions.isEmpty()) {
      return expr;
    }
    return new Substituter(substitutions).rec(expr, null);
  }

  /**
   * Evaluates an integer-valued expression (such as an array extent or a loop bound) given the
   * values of its free variables. Division and remainder round toward negative infinity.
   *
   * @throws IllegalArgumentException if {@code expr} has a free variable that is not in {@code
   *     values}, or is not a purely integer expression
   */
  public static long evaluateIndex(ScalarExpr expr, Map<String, Long> values) {
    if (expr instanceof Const c) {
      Preconditions.checkArgument(c.isIntegral(), "Not an integer: %s", c);
      return c.longValue();
    } else if (expr instanceof Variable v) {
      Long value = values.get(v.name);
      Preconditions.checkArgument(value != null, "No value for '%s'", v.name);
      return value;
    }
    Preconditions.checkArgument(expr instanceof Binary, "Not an index expression: %s", expr);
    Binary b = (Binary) expr;
    long left = evaluateIndex(b.left, values);
    long right = evaluateIndex(b.right, values);
    switch (b.op) {
      case ADD:
        return left + right;
      case SUBTRACT:
        return left - right;
      case MULTIPLY:
        return left * right;
      case DIVIDE:
      case FLOOR_DIVIDE:
        return Math.floorDiv(left, right);
      case REMAINDER:
        return Math.floorMod(left, right);
      case LESS_THAN:
        return (left < right) ? 1 : 0;
      case LESS_EQUAL:
        return (left <= right) ? 1 : 0;
      case EQUAL:
        return (left == right) ? 1 : 0;
    }
    throw new AssertionError(b.op);
  }

  private static class Substituter extends ScalarExpr.IdentityMapper<Void> {
    final Map<String, ? extends ScalarExpr> substitutions;

    Substituter(Map<String, ? extends ScalarExpr> substitutions) {
      this.substitutions = substitutions;
    }

    private @Nullable Variable renamed(String name) {
      ScalarExpr replacement = substitutions.get(name);
      if (replacement == null) {
        return null;
      }
      Preconditions.checkArgument(
          replacement instanceof Variable,
          "Can only rename '%s', not substitute %s",
          name,
          replacement);
      return (Variable) replacement;
    }

    @Override
    protected ScalarExpr mapVariable(Variable expr, Void unused) {
      ScalarExpr replacement = substitutions.get(expr.name);
      return (replacement == null) ? expr : replacement;
    }

    @Override
    protected ScalarExpr mapSubscript(Subscript expr, Void unused) {
      Variable aggregate = renamed(expr.aggregate.name);
      ImmutableList<ScalarExpr> index = recAll(expr.index, null);
      if (aggregate == null && index == expr.index) {
        return expr;
      }
      return new Subscript((aggregate == null) ? expr.aggregate : aggregate, index);
    }

    @Override
    protected ScalarExpr mapReduction(Reduction expr, Void unused) {
      ImmutableList.Builder<String> inames = ImmutableList.builder();
      boolean changed = false;
      for (String iname : expr.inames) {
        Variable v = renamed(iname);
        changed |= (v != null);
        inames.add((v == null) ? iname : v.name);
      }
      ScalarExpr body = rec(expr.body, null);
      if (!changed && body == expr.body) {
        return expr;
      }
      return new Reduction(expr.op, changed ? inames.build() : expr.inames, body);
    }
  }
}
