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
 * Receives an array from another rank of a distributed computation. {@link #data} is the array
 * sent by that rank; this node has its shape and dtype.
 */
public final class DistributedRecv extends Array {
  public final Array data;
  public final int srcRank;

  public DistributedRecv(Array data, int srcRank, ImmutableSet<Tag> tags) {
    super(Kind.DISTRIBUTED_RECV, data.shape, data.dtype, tags, data, srcRank);
    this.data = data;
    this.srcRank = srcRank;
  }

  public DistributedRecv(Array data, int srcRank) {
    this(data, srcRank, ImmutableSet.of());
  }

  @Override
  boolean sameFields(Array other) {
    DistributedRecv otherRecv = (DistributedRecv) other;
    return srcRank == otherRecv.srcRank && data.equals(otherRecv.data);
  }
}
