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

/**
 * A Tag is an annotation attached to an {@link Array} by the code that built the graph (e.g. to
 * request a particular implementation). Tags take part in equality but are otherwise ignored by
 * lowering.
 */
public final class Tag {
  public final String name;

  private Tag(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    this.name = name;
  }

  public static Tag of(String name) {
    return new Tag(name);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Tag other && name.equals(other.name);
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
