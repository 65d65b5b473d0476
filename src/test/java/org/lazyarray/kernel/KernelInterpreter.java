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
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Binary;
import org.lazyarray.scalar.ScalarExpr.Const;
import org.lazyarray.scalar.ScalarExpr.Reduction;
import org.lazyarray.scalar.ScalarExpr.Subscript;
import org.lazyarray.scalar.ScalarExpr.Variable;
import org.lazyarray.scalar.ScalarExprs;

/**
 * Executes a {@link Kernel} directly, so that tests can check the values it computes. All buffers
 * are held as arrays of doubles in C order.
 *
 * <p>Instructions are run in an order consistent with their dependencies (and otherwise in the
 * order they appear in the kernel); each instruction is run once for each point of the domain of
 * its inames.
 */
public class KernelInterpreter {
  private final Kernel kernel;
  private final Map<String, Long> values = new HashMap<>();
  private final Map<String, double[]> buffers = new HashMap<>();
  private final Map<String, long[]> shapes = new HashMap<>();

  public KernelInterpreter(Kernel kernel) {
    this.kernel = kernel;
  }

  /** Sets the value of a scalar argument. */
  @CanIgnoreReturnValue
  public KernelInterpreter setValue(String name, long value) {
    values.put(name, value);
    return this;
  }

  /** Sets the contents of an array argument. */
  @CanIgnoreReturnValue
  public KernelInterpreter setArray(String name, double[] data) {
    buffers.put(name, data);
    return this;
  }

  @CanIgnoreReturnValue
  public KernelInterpreter setArrays(Map<String, double[]> arrays) {
    buffers.putAll(arrays);
    return this;
  }

  /** Returns the contents of the named buffer after {@link #run}. */
  public double[] get(String name) {
    double[] result = buffers.get(name);
    Preconditions.checkArgument(result != null, "No buffer named '%s'", name);
    return result;
  }

  /** Allocates the outputs and temporaries, and executes each instruction. */
  @CanIgnoreReturnValue
  public KernelInterpreter run() {
    for (KernelArg arg : kernel.args) {
      if (arg instanceof KernelArg.ValueArg) {
        Preconditions.checkState(values.containsKey(arg.name), "No value for '%s'", arg.name);
      } else {
        KernelArg.GlobalArg global = (KernelArg.GlobalArg) arg;
        allocate(global.name, global.shape, !global.isOutputOnly);
      }
    }
    kernel.temporaries.values().forEach(t -> allocate(t.name, t.shape, false));
    for (Assignment insn : executionOrder()) {
      execute(insn);
    }
    return this;
  }

  private void allocate(String name, ImmutableList<ScalarExpr> shape, boolean isInput) {
    long[] extents = shape.stream().mapToLong(e -> ScalarExprs.evaluateIndex(e, values)).toArray();
    long size = 1;
    for (long extent : extents) {
      size *= extent;
    }
    shapes.put(name, extents);
    if (isInput) {
      double[] data = buffers.get(name);
      Preconditions.checkState(data != null, "No data for '%s'", name);
      Preconditions.checkState(data.length == size, "Wrong size for '%s'", name);
    } else {
      buffers.put(name, new double[Math.toIntExact(size)]);
    }
  }

  /** Returns the instructions in kernel order, except that each follows its dependencies. */
  private List<Assignment> executionOrder() {
    List<Assignment> result = new ArrayList<>();
    Set<String> done = new HashSet<>();
    List<Assignment> pending = new ArrayList<>(kernel.instructions);
    while (!pending.isEmpty()) {
      Assignment next =
          pending.stream()
              .filter(insn -> done.containsAll(insn.dependsOn))
              .findFirst()
              .orElseThrow(() -> new IllegalStateException("Dependency cycle in " + pending));
      pending.remove(next);
      done.add(next.id);
      result.add(next);
    }
    return result;
  }

  private void execute(Assignment insn) {
    Domain.Builder builder = Domain.builder();
    for (String iname : insn.withinInames) {
      Domain domain = kernel.domainFor(iname);
      Preconditions.checkState(domain != null, "No domain for '%s'", iname);
      builder.addDim(iname, domain.dims.get(iname));
    }
    builder
        .build()
        .forEachPoint(
            values,
            point -> {
              double value = evaluate(insn.expression, point);
              if (insn.assignee instanceof Subscript s) {
                buffers.get(s.aggregate.name)[offset(s, point)] = value;
              } else {
                buffers.get(insn.assigneeName())[0] = value;
              }
            });
  }

  private int offset(Subscript s, Map<String, Long> point) {
    long[] extents = shapes.get(s.aggregate.name);
    Preconditions.checkState(extents.length == s.index.size(), "Wrong rank in %s", s);
    long result = 0;
    for (int i = 0; i < extents.length; i++) {
      long index = ScalarExprs.evaluateIndex(s.index.get(i), point);
      Preconditions.checkState(index >= 0 && index < extents[i], "%s out of bounds", s);
      result = result * extents[i] + index;
    }
    return Math.toIntExact(result);
  }

  private double evaluate(ScalarExpr expr, Map<String, Long> point) {
    if (expr instanceof Const c) {
      return c.value.doubleValue();
    } else if (expr instanceof Variable v) {
      Long value = point.get(v.name);
      if (value != null) {
        return value;
      }
      double[] buffer = buffers.get(v.name);
      Preconditions.checkState(buffer != null && buffer.length == 1, "Can't evaluate %s", v);
      return buffer[0];
    } else if (expr instanceof Subscript s) {
      return buffers.get(s.aggregate.name)[offset(s, point)];
    } else if (expr instanceof Binary b) {
      double left = evaluate(b.left, point);
      double right = evaluate(b.right, point);
      switch (b.op) {
        case ADD:
          return left + right;
        case SUBTRACT:
          return left - right;
        case MULTIPLY:
          return left * right;
        case DIVIDE:
          return left / right;
        case FLOOR_DIVIDE:
          return Math.floor(left / right);
        case REMAINDER:
          return left - right * Math.floor(left / right);
        case LESS_THAN:
          return (left < right) ? 1 : 0;
        case LESS_EQUAL:
          return (left <= right) ? 1 : 0;
        case EQUAL:
          return (left == right) ? 1 : 0;
      }
      throw new AssertionError(b.op);
    }
    return reduce((Reduction) expr, point);
  }

  private double reduce(Reduction r, Map<String, Long> point) {
    Domain.Builder builder = Domain.builder();
    for (String iname : r.inames) {
      Domain domain = kernel.domainFor(iname);
      Preconditions.checkState(domain != null, "No domain for reduction '%s'", iname);
      builder.addDim(iname, domain.dims.get(iname));
    }
    double[] result = {identity(r.op)};
    builder
        .build()
        .forEachPoint(
            point,
            inner -> {
              double x = evaluate(r.body, inner);
              switch (r.op) {
                case SUM:
                  result[0] += x;
                  break;
                case PRODUCT:
                  result[0] *= x;
                  break;
                case MAX:
                  result[0] = Math.max(result[0], x);
                  break;
                case MIN:
                  result[0] = Math.min(result[0], x);
                  break;
              }
            });
    return result[0];
  }

  private static double identity(Reduction.Op op) {
    switch (op) {
      case SUM:
        return 0;
      case PRODUCT:
        return 1;
      case MAX:
        return Double.NEGATIVE_INFINITY;
      case MIN:
        return Double.POSITIVE_INFINITY;
    }
    throw new AssertionError(op);
  }
}
