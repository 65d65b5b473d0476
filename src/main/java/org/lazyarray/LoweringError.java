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

package org.lazyarray;

import com.google.errorprone.annotations.FormatMethod;

/**
 * All failures detected while transforming or lowering an expression graph throw a LoweringError.
 * None of them are recoverable: the lowering call that raised one is abandoned, and no partially
 * built kernel is ever returned.
 */
public class LoweringError extends RuntimeException {

  /** The ways in which lowering can fail. */
  public enum Kind {
    /** A mapper has no rule for a node kind it encountered. */
    UNSUPPORTED_NODE_KIND,
    /** Something that is not an expression graph node reached a mapper. */
    FOREIGN_OBJECT,
    /** A leaf's shape still carries dependencies or reductions after lowering. */
    SYMBOLIC_SHAPE_VIOLATION,
    /** A freshly generated reduction variable name was already in use. */
    REDUCTION_NAME_COLLISION,
    /** The number of axis names passed to a domain builder doesn't match the shape. */
    DOMAIN_SHAPE_MISMATCH
  }

  public final Kind kind;

  public LoweringError(Kind kind, String msg) {
    super(msg);
    this.kind = kind;
  }

  /** Returns a new LoweringError of the given kind with a formatted message. */
  @FormatMethod
  public static LoweringError of(Kind kind, String fmt, Object... fmtArgs) {
    return new LoweringError(kind, String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    return String.format("%s: %s", kind, super.getMessage());
  }
}
