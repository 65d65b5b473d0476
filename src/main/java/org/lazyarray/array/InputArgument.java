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
import com.google.common.collect.ImmutableSet;

/**
 * The base class for the leaves of an expression graph: named values that are supplied from
 * outside the graph when it is evaluated.
 */
public abstract class InputArgument extends Array {
  public final String name;

  InputArgument(
      Kind kind,
      String name,
      ImmutableList<Dim> shape,
      DType dtype,
      ImmutableSet<Tag> tags,
      Object... fields) {
    super(kind, shape, dtype, tags, name, ImmutableList.copyOf(fields));
    Preconditions.checkArgument(!name.isEmpty(), "Input arguments must be named");
    this.name = name;
  }

  @Override
  public String toString() {
    return String.format("%s %s%s", kind.name().toLowerCase(), name, shapeString());
  }
}
