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

/** A half-open integer range {@code [lower, upper)} whose ends may be symbolic. */
public final class Bounds {
  public final ScalarExpr lower;
  public final ScalarExpr upper;

  public Bounds(ScalarExpr lower, ScalarExpr upper) {
    this.lower = Preconditions.checkNotNull(lower);
    this.upper = Preconditions.checkNotNull(upper);
  }

  /** Returns the range {@code [0, upper)}. */
  public static Bounds upTo(ScalarExpr upper) {
    return new Bounds(ScalarExpr.Const.ZERO, upper);
  }

  /** Returns the range {@code [0, upper)}. */
  public static Bounds upTo(long upper) {
    return upTo(ScalarExpr.constant(upper));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bounds other && lower.equals(other.lower) && upper.equals(other.upper);
  }

  @Override
  public int hashCode() {
    return lower.hashCode() * 31 + upper.hashCode();
  }

  @Override
  public String toString() {
    return String.format("[%s, %s)", lower, upper);
  }
}
