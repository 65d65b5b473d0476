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
import com.google.common.collect.ImmutableSet;

/** Rotates the elements of an array along one axis by {@link #shift} positions. */
public final class Roll extends IndexRemapping {
  public final long shift;
  public final int axis;

  public Roll(Array array, long shift, int axis, ImmutableSet<Tag> tags) {
    super(Kind.ROLL, array, array.shape, tags, shift, axis);
    Preconditions.checkArgument(axis >= 0 && axis < array.ndim(), "Invalid axis %s", axis);
    this.shift = shift;
    this.axis = axis;
  }

  public Roll(Array array, long shift, int axis) {
    this(array, shift, axis, ImmutableSet.of());
  }

  @Override
  boolean sameFields(Array other) {
    Roll otherRoll = (Roll) other;
    return shift == otherRoll.shift && axis == otherRoll.axis && array.equals(otherRoll.array);
  }
}
