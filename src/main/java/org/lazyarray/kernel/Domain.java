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

package org.lazyarray.kernel;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExprs;

/**
 * A Domain is a set of integer points: for each of its named dimensions, the values in a half-open
 * {@link Bounds} range. Bounds may refer to symbolic parameters (but not to other dimensions of the
 * same domain); each free variable of a bound is a parameter of the domain.
 *
 * <p>Domains are immutable. Dimensions and parameters are kept sorted by name.
 */
public final class Domain {

  /** The bounds of each dimension, keyed by dimension name. */
  public final ImmutableSortedMap<String, Bounds> dims;

  /** The names of the symbolic parameters that occur in {@link #dims}. */
  public final ImmutableSortedSet<String> params;

  private Domain(ImmutableSortedMap<String, Bounds> dims) {
    this.dims = dims;
    ImmutableSortedSet.Builder<String> paramsBuilder = ImmutableSortedSet.naturalOrder();
    for (Bounds bounds : dims.values()) {
      for (ScalarExpr bound : ImmutableList.of(bounds.lower, bounds.upper)) {
        for (String name : ScalarExprs.freeVariables(bound)) {
          Preconditions.checkArgument(
              !dims.containsKey(name), "Bound %s refers to dimension '%s'", bounds, name);
          paramsBuilder.add(name);
        }
      }
    }
    this.params = paramsBuilder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /** A Builder accumulates the dimensions of a new Domain. */
  public static class Builder {
    private final Map<String, Bounds> dims = new TreeMap<>();

    /** Adds a dimension with the given bounds. Each dimension may only be added once. */
    @CanIgnoreReturnValue
    public Builder addDim(String name, Bounds bounds) {
      Bounds prev = dims.put(name, bounds);
      Preconditions.checkArgument(prev == null, "Duplicate dimension '%s'", name);
      return this;
    }

    public Domain build() {
      return new Domain(ImmutableSortedMap.copyOf(dims));
    }
  }

  /** True if this domain has a dimension with the given name. */
  public boolean hasDim(String name) {
    return dims.containsKey(name);
  }

  /**
   * Returns a Domain in which each parameter with an entry in {@code values} has been replaced by
   * its value.
   */
  public Domain bind(Map<String, Long> values) {
    Map<String, ScalarExpr> substitutions = new HashMap<>();
    values.forEach(
        (name, value) -> {
          if (params.contains(name)) {
            substitutions.put(name, ScalarExpr.constant(value));
          }
        });
    Builder builder = builder();
    dims.forEach(
        (name, bounds) ->
            builder.addDim(
                name,
                new Bounds(
                    ScalarExprs.substitute(bounds.lower, substitutions),
                    ScalarExprs.substitute(bounds.upper, substitutions))));
    return builder.build();
  }

  /**
   * Returns the number of points in this domain, given values for all of its parameters.
   *
   * @throws IllegalArgumentException if a parameter has no value
   */
  public long countPoints(Map<String, Long> paramValues) {
    long result = 1;
    for (Bounds bounds : dims.values()) {
      long lower = ScalarExprs.evaluateIndex(bounds.lower, paramValues);
      long upper = ScalarExprs.evaluateIndex(bounds.upper, paramValues);
      result *= Math.max(0, upper - lower);
    }
    return result;
  }

  /**
   * Calls {@code consumer} with each point in the domain, in lexicographic order of the (sorted)
   * dimension names. The map passed to consumer is reused between calls.
   */
  public void forEachPoint(Map<String, Long> paramValues, Consumer<Map<String, Long>> consumer) {
    ImmutableList<String> names = dims.keySet().asList();
    long[] lower = new long[names.size()];
    long[] upper = new long[names.size()];
    for (int i = 0; i < names.size(); i++) {
      Bounds bounds = dims.get(names.get(i));
      lower[i] = ScalarExprs.evaluateIndex(bounds.lower, paramValues);
      upper[i] = ScalarExprs.evaluateIndex(bounds.upper, paramValues);
      if (lower[i] >= upper[i]) {
        return;
      }
    }
    Map<String, Long> point = new HashMap<>(paramValues);
    long[] current = lower.clone();
    while (true) {
      for (int i = 0; i < names.size(); i++) {
        point.put(names.get(i), current[i]);
      }
      consumer.accept(point);
      // Advance like an odometer, last dimension fastest.
      int i = names.size() - 1;
      while (i >= 0 && ++current[i] == upper[i]) {
        current[i] = lower[i];
        i--;
      }
      if (i < 0) {
        return;
      }
    }
  }

  /** Returns the Domain with only the named dimensions of this one. */
  public Domain project(Iterable<String> names) {
    Builder builder = builder();
    for (String name : names) {
      Bounds bounds = dims.get(name);
      Preconditions.checkArgument(bounds != null, "No dimension '%s'", name);
      builder.addDim(name, bounds);
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Domain other && dims.equals(other.dims);
  }

  @Override
  public int hashCode() {
    return dims.hashCode();
  }

  /**
   * Returns a representation in the style of an isl set, e.g. {@code [n] -> { [i] : 0 <= i < n }}.
   */
  @Override
  public String toString() {
    String set;
    if (dims.isEmpty()) {
      set = "{ [] }";
    } else {
      String constraints =
          dims.entrySet().stream()
              .map(
                  e ->
                      String.format(
                          "%s <= %s < %s", e.getValue().lower, e.getKey(), e.getValue().upper))
              .collect(Collectors.joining(" and "));
      set = String.format("{ [%s] : %s }", String.join(", ", dims.keySet()), constraints);
    }
    return params.isEmpty() ? set : String.format("[%s] -> %s", String.join(", ", params), set);
  }
}
