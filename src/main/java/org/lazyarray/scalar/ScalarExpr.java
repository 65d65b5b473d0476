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
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A ScalarExpr is an immutable expression tree computing a single number from named variables,
 * subscripted arrays and constants. There are five subclasses:
 *
 * <ul>
 *   <li>{@link Const}: a numeric constant
 *   <li>{@link Variable}: a reference to a name (an index variable, a scalar argument, or a
 *       zero-dimensional array)
 *   <li>{@link Subscript}: an element of a named array
 *   <li>{@link Binary}: an arithmetic operation or comparison on two subexpressions
 *   <li>{@link Reduction}: a sum (or other reduction) of a subexpression over one or more index
 *       variables
 * </ul>
 *
 * <p>ScalarExprs implement structural {@link #equals} and {@link #hashCode}.
 */
public abstract class ScalarExpr {

  // Only the nested subclasses may extend ScalarExpr.
  private ScalarExpr() {}

  /** Returns a Variable with the given name. */
  public static Variable var(String name) {
    return new Variable(name);
  }

  /** Returns a Const for the given value. */
  public static Const constant(Number value) {
    return Const.of(value);
  }

  public final Binary plus(ScalarExpr other) {
    return new Binary(Binary.Op.ADD, this, other);
  }

  public final Binary plus(long other) {
    return plus(Const.of(other));
  }

  public final Binary minus(ScalarExpr other) {
    return new Binary(Binary.Op.SUBTRACT, this, other);
  }

  public final Binary minus(long other) {
    return minus(Const.of(other));
  }

  public final Binary times(ScalarExpr other) {
    return new Binary(Binary.Op.MULTIPLY, this, other);
  }

  public final Binary floorDiv(ScalarExpr other) {
    return new Binary(Binary.Op.FLOOR_DIVIDE, this, other);
  }

  public final Binary mod(ScalarExpr other) {
    return new Binary(Binary.Op.REMAINDER, this, other);
  }

  /** A numeric constant; the value is always a Long or a Double. */
  public static final class Const extends ScalarExpr {
    public static final Const ZERO = new Const(0L);
    public static final Const ONE = new Const(1L);

    public final Number value;

    private Const(Number value) {
      this.value = value;
    }

    /**
     * Returns a Const for the given value. Integral boxed types are widened to Long and Float is
     * widened to Double, so that equal values always have equal Consts.
     */
    public static Const of(Number value) {
      if (value instanceof Double || value instanceof Float) {
        return new Const(value.doubleValue());
      }
      Preconditions.checkArgument(
          value instanceof Long
              || value instanceof Integer
              || value instanceof Short
              || value instanceof Byte,
          "Unsupported constant type %s",
          value.getClass());
      long lng = value.longValue();
      if (lng == 0) {
        return ZERO;
      } else if (lng == 1) {
        return ONE;
      }
      return new Const(lng);
    }

    /** True if this is an integer constant. */
    public boolean isIntegral() {
      return value instanceof Long;
    }

    /** Should only be called on integer constants. */
    public long longValue() {
      Preconditions.checkState(isIntegral());
      return (Long) value;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Const other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  /** A reference to a name. */
  public static final class Variable extends ScalarExpr {
    public final String name;

    private Variable(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    /** Returns {@code this[indices]}. */
    public Subscript index(List<? extends ScalarExpr> indices) {
      return new Subscript(this, ImmutableList.copyOf(indices));
    }

    /** Returns {@code this[indices]}. */
    public Subscript index(ScalarExpr... indices) {
      return index(Arrays.asList(indices));
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Variable other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /** An element of a named array. */
  public static final class Subscript extends ScalarExpr {
    public final Variable aggregate;
    public final ImmutableList<ScalarExpr> index;

    public Subscript(Variable aggregate, ImmutableList<ScalarExpr> index) {
      Preconditions.checkArgument(!index.isEmpty(), "Subscript needs at least one index");
      this.aggregate = aggregate;
      this.index = index;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Subscript other
          && aggregate.equals(other.aggregate)
          && index.equals(other.index);
    }

    @Override
    public int hashCode() {
      return aggregate.hashCode() * 31 + index.hashCode();
    }

    @Override
    public String toString() {
      return index.stream()
          .map(ScalarExpr::toString)
          .collect(Collectors.joining(", ", aggregate.name + "[", "]"));
    }
  }

  /** An arithmetic operation or comparison. Comparisons evaluate to 1 (true) or 0 (false). */
  public static final class Binary extends ScalarExpr {

    public enum Op {
      ADD("+"),
      SUBTRACT("-"),
      MULTIPLY("*"),
      DIVIDE("/"),
      FLOOR_DIVIDE("//"),
      REMAINDER("%"),
      LESS_THAN("<"),
      LESS_EQUAL("<="),
      EQUAL("==");

      public final String symbol;

      Op(String symbol) {
        this.symbol = symbol;
      }
    }

    public final Op op;
    public final ScalarExpr left;
    public final ScalarExpr right;

    public Binary(Op op, ScalarExpr left, ScalarExpr right) {
      this.op = op;
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Binary other
          && op == other.op
          && left.equals(other.left)
          && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public String toString() {
      return String.format("(%s %s %s)", left, op.symbol, right);
    }
  }

  /**
   * A reduction of {@link #body} over every combination of values of {@link #inames}. The bounds
   * of the reduction variables are not part of the expression; they are tracked alongside it (and
   * end up in the iteration domain of the instruction that contains it).
   */
  public static final class Reduction extends ScalarExpr {

    public enum Op {
      SUM,
      PRODUCT,
      MAX,
      MIN
    }

    public final Op op;
    public final ImmutableList<String> inames;
    public final ScalarExpr body;

    public Reduction(Op op, ImmutableList<String> inames, ScalarExpr body) {
      Preconditions.checkArgument(!inames.isEmpty(), "Reduction needs at least one iname");
      this.op = op;
      this.inames = inames;
      this.body = body;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Reduction other
          && op == other.op
          && inames.equals(other.inames)
          && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, inames, body);
    }

    @Override
    public String toString() {
      return String.format("%s(%s, %s)", op.name().toLowerCase(), inames, body);
    }
  }

  /**
   * An IdentityMapper rebuilds a ScalarExpr bottom-up, returning the original objects wherever
   * nothing changed. Subclasses override the {@code map*} methods for the shapes they transform.
   *
   * @param <C> the type of an extra argument threaded through the traversal
   */
  public abstract static class IdentityMapper<C> {

    public ScalarExpr rec(ScalarExpr expr, C context) {
      if (expr instanceof Const c) {
        return mapConst(c, context);
      } else if (expr instanceof Variable v) {
        return mapVariable(v, context);
      } else if (expr instanceof Subscript s) {
        return mapSubscript(s, context);
      } else if (expr instanceof Binary b) {
        return mapBinary(b, context);
      } else {
        return mapReduction((Reduction) expr, context);
      }
    }

    protected ScalarExpr mapConst(Const expr, C context) {
      return expr;
    }

    protected ScalarExpr mapVariable(Variable expr, C context) {
      return expr;
    }

    protected ScalarExpr mapSubscript(Subscript expr, C context) {
      ImmutableList<ScalarExpr> index = recAll(expr.index, context);
      return (index == expr.index) ? expr : new Subscript(expr.aggregate, index);
    }

    protected ScalarExpr mapBinary(Binary expr, C context) {
      ScalarExpr left = rec(expr.left, context);
      ScalarExpr right = rec(expr.right, context);
      if (left == expr.left && right == expr.right) {
        return expr;
      }
      return new Binary(expr.op, left, right);
    }

    protected ScalarExpr mapReduction(Reduction expr, C context) {
      ScalarExpr body = rec(expr.body, context);
      return (body == expr.body) ? expr : new Reduction(expr.op, expr.inames, body);
    }

    /**
     * Applies {@link #rec} to each element; returns {@code exprs} itself if no element changed.
     */
    protected final ImmutableList<ScalarExpr> recAll(ImmutableList<ScalarExpr> exprs, C context) {
      ImmutableList.Builder<ScalarExpr> builder =
          ImmutableList.builderWithExpectedSize(exprs.size());
      boolean changed = false;
      for (ScalarExpr e : exprs) {
        ScalarExpr mapped = rec(e, context);
        changed |= (mapped != e);
        builder.add(mapped);
      }
      return changed ? builder.build() : exprs;
    }
  }
}
