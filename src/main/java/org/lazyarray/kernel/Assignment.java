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
import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Subscript;
import org.lazyarray.scalar.ScalarExpr.Variable;

/**
 * An instruction that stores the value of {@link #expression} into {@link #assignee}, once for
 * each point of the iteration domain over {@link #withinInames}.
 */
public final class Assignment {
  /** Unique among the instructions of a kernel. */
  public final String id;

  /** A {@link Variable} (for a zero-dimensional buffer) or a {@link Subscript}. */
  public final ScalarExpr assignee;

  public final ScalarExpr expression;

  /** The index variables this instruction is executed over. */
  public final ImmutableSet<String> withinInames;

  /** The ids of the instructions that must be completed before this one starts. */
  public final ImmutableSet<String> dependsOn;

  public Assignment(
      String id,
      ScalarExpr assignee,
      ScalarExpr expression,
      ImmutableSet<String> withinInames,
      ImmutableSet<String> dependsOn) {
    Preconditions.checkArgument(
        assignee instanceof Variable || assignee instanceof Subscript,
        "Can't assign to %s",
        assignee);
    Preconditions.checkArgument(!dependsOn.contains(id), "%s depends on itself", id);
    this.id = id;
    this.assignee = assignee;
    this.expression = expression;
    this.withinInames = withinInames;
    this.dependsOn = dependsOn;
  }

  /** Returns the name of the buffer being assigned. */
  public String assigneeName() {
    return (assignee instanceof Subscript s) ? s.aggregate.name : ((Variable) assignee).name;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Assignment other
        && id.equals(other.id)
        && assignee.equals(other.assignee)
        && expression.equals(other.expression)
        && withinInames.equals(other.withinInames)
        && dependsOn.equals(other.dependsOn);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, assignee, expression, withinInames, dependsOn);
  }

  @Override
  public String toString() {
    return String.format(
        "%s = %s  {id=%s, inames=%s, dep=%s}",
        assignee, expression, id, withinInames, dependsOn);
  }
}
