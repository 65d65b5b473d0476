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
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lazyarray.array.Array;
import org.lazyarray.scalar.Bounds;

/**
 * The context in which a single scalar expression is generated. It supplies the names that the
 * expression may refer to, and accumulates the instruction ids that the expression's eventual
 * instruction must depend on and the bounds of the reduction variables the expression uses.
 *
 * <p>An ExpressionContext is short-lived: it is created to generate one expression, and discarded
 * once the expression has been stored or wrapped in an {@link ImplementedResult.Inlined}.
 */
public final class ExpressionContext {
  public final CodeGenState state;

  /** Names visible only in this expression (the bindings of an IndexLambda). */
  private final ImmutableMap<String, Array> localNamespace;

  /** Bounds declared for the reduction variables of an IndexLambda's expression. */
  private final ImmutableMap<String, Bounds> declaredReductions;

  private final Set<String> dependsOn = new LinkedHashSet<>();
  private Map<String, Bounds> reductionBounds = new LinkedHashMap<>();

  public ExpressionContext(
      CodeGenState state,
      ImmutableMap<String, Array> localNamespace,
      ImmutableMap<String, Bounds> declaredReductions) {
    this.state = state;
    this.localNamespace = localNamespace;
    this.declaredReductions = declaredReductions;
  }

  public ExpressionContext(CodeGenState state) {
    this(state, ImmutableMap.of(), ImmutableMap.of());
  }

  /**
   * Returns the array with the given name in the local namespace if there is one, otherwise in the
   * state's namespace, or null if neither has it.
   */
  public @Nullable Array lookup(String name) {
    Array result = localNamespace.get(name);
    return (result != null) ? result : state.namespace.get(name);
  }

  /** Returns the declared bounds of the given reduction variable, or null if there are none. */
  @Nullable Bounds declaredReduction(String name) {
    return declaredReductions.get(name);
  }

  public ImmutableSet<String> dependsOn() {
    return ImmutableSet.copyOf(dependsOn);
  }

  public void updateDependsOn(Set<String> ids) {
    dependsOn.addAll(ids);
  }

  /** The reduction variables used so far, in the order they were added, with their bounds. */
  public ImmutableMap<String, Bounds> reductionBounds() {
    return ImmutableMap.copyOf(reductionBounds);
  }

  public int reductionCount() {
    return reductionBounds.size();
  }

  public boolean hasReduction(String name) {
    return reductionBounds.containsKey(name);
  }

  public void addReduction(String name, Bounds bounds) {
    Bounds prev = reductionBounds.put(name, bounds);
    assert prev == null : name;
  }

  /** Replaces all the reductions; used after they have been renamed. */
  void setReductionBounds(Map<String, Bounds> newBounds) {
    reductionBounds = new LinkedHashMap<>(newBounds);
  }
}
