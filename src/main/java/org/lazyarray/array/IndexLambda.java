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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.regex.Pattern;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExprs;

/**
 * An array defined elementwise by a scalar expression.
 *
 * <p>In {@link #expr}, the variables {@code _0}, {@code _1}, ... stand for the index along each
 * axis of this array, and other names refer to the arrays in {@link #bindings} (a private scope
 * for this node only), either bare (for zero-dimensional arrays) or subscripted.
 *
 * <p>{@code expr} may also contain {@link ScalarExpr.Reduction}s; the bounds of each reduction
 * variable they use must be given in {@link #reductionBounds}. Bounds may refer to the names in
 * {@code bindings} (and to {@link SizeParam}s by name), but not to the index variables.
 */
public final class IndexLambda extends Array {
  private static final Pattern POSITIONAL_INDEX = Pattern.compile("_\\d+");

  public final ScalarExpr expr;
  public final ImmutableMap<String, Array> bindings;
  public final ImmutableMap<String, Bounds> reductionBounds;

  public IndexLambda(
      ScalarExpr expr,
      ImmutableList<Dim> shape,
      DType dtype,
      ImmutableMap<String, Array> bindings,
      ImmutableMap<String, Bounds> reductionBounds,
      ImmutableSet<Tag> tags) {
    super(Kind.INDEX_LAMBDA, shape, dtype, tags, expr, bindings, reductionBounds);
    for (String name : bindings.keySet()) {
      Preconditions.checkArgument(
          !reductionBounds.containsKey(name), "'%s' is both a binding and a reduction", name);
    }
    reductionBounds.forEach(
        (name, bounds) -> {
          for (ScalarExpr bound : ImmutableList.of(bounds.lower, bounds.upper)) {
            for (String v : ScalarExprs.freeVariables(bound)) {
              Preconditions.checkArgument(
                  !POSITIONAL_INDEX.matcher(v).matches(),
                  "Bounds of reduction '%s' refer to index variable '%s'",
                  name,
                  v);
            }
          }
        });
    this.expr = expr;
    this.bindings = bindings;
    this.reductionBounds = reductionBounds;
  }

  public IndexLambda(
      ScalarExpr expr,
      ImmutableList<Dim> shape,
      DType dtype,
      ImmutableMap<String, Array> bindings) {
    this(expr, shape, dtype, bindings, ImmutableMap.of(), ImmutableSet.of());
  }

  @Override
  boolean sameFields(Array other) {
    IndexLambda otherLambda = (IndexLambda) other;
    return expr.equals(otherLambda.expr)
        && bindings.equals(otherLambda.bindings)
        && reductionBounds.equals(otherLambda.reductionBounds);
  }

  @Override
  public String toString() {
    return String.format("index_lambda%s[%s]", shapeString(), expr);
  }
}
