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

/**
 * The base class for nodes whose elements are exactly the elements of another array, rearranged;
 * each element of the result is found by computing an index into {@link #array}.
 */
public abstract class IndexRemapping extends Array {
  public final Array array;

  IndexRemapping(
      Kind kind, Array array, ImmutableList<Dim> shape, ImmutableSet<Tag> tags, Object... fields) {
    super(kind, shape, array.dtype, tags, array, ImmutableList.copyOf(fields));
    this.array = array;
  }
}
