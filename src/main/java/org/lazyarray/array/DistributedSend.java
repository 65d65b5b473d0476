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

import com.google.common.collect.ImmutableSet;

/**
 * Sends {@link #data} to another rank of a distributed computation. Evaluates to {@code data}.
 *
 * <p>Distributed nodes are only carried through graph transformations; they can't be lowered to a
 * kernel.
 */
public final class DistributedSend extends Array {
  public final Array data;
  public final int destRank;

  public DistributedSend(Array data, int destRank, ImmutableSet<Tag> tags) {
    super(Kind.DISTRIBUTED_SEND, data.shape, data.dtype, tags, data, destRank);
    this.data = data;
    this.destRank = destRank;
  }

  public DistributedSend(Array data, int destRank) {
    this(data, destRank, ImmutableSet.of());
  }

  @Override
  boolean sameFields(Array other) {
    DistributedSend otherSend = (DistributedSend) other;
    return destRank == otherSend.destRank && data.equals(otherSend.data);
  }
}
