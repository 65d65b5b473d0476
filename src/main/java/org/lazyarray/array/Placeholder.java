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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** A named array whose value is supplied when the computation runs. */
public final class Placeholder extends InputArgument {

  public Placeholder(String name, ImmutableList<Dim> shape, DType dtype, ImmutableSet<Tag> tags) {
    super(Kind.PLACEHOLDER, name, shape, dtype, tags);
  }

  public Placeholder(String name, ImmutableList<Dim> shape, DType dtype) {
    this(name, shape, dtype, ImmutableSet.of());
  }

  @Override
  boolean sameFields(Array other) {
    return name.equals(((Placeholder) other).name);
  }
}
