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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * A Kernel is a flat program: a list of {@link Assignment}s, the {@link Domain}s they iterate
 * over, and the arguments and temporaries they read and write.
 *
 * <p>Kernels are immutable; the {@code with*} methods return a new Kernel with one more element,
 * leaving this one unchanged. The order of instructions is the order in which they were added,
 * which is not necessarily an execution order (see {@link Assignment#dependsOn}).
 */
public final class Kernel {
  public final String name;
  public final ImmutableList<KernelArg> args;
  public final ImmutableMap<String, TemporaryVariable> temporaries;
  public final ImmutableList<Domain> domains;
  public final ImmutableList<Assignment> instructions;

  private Kernel(
      String name,
      ImmutableList<KernelArg> args,
      ImmutableMap<String, TemporaryVariable> temporaries,
      ImmutableList<Domain> domains,
      ImmutableList<Assignment> instructions) {
    this.name = name;
    this.args = args;
    this.temporaries = temporaries;
    this.domains = domains;
    this.instructions = instructions;
  }

  /** Returns a Kernel with the given name and nothing else. */
  public static Kernel empty(String name) {
    return new Kernel(
        name, ImmutableList.of(), ImmutableMap.of(), ImmutableList.of(), ImmutableList.of());
  }

  /** Returns a copy of this Kernel with an additional argument. */
  public Kernel withArg(KernelArg arg) {
    Preconditions.checkArgument(!isVariableDeclared(arg.name), "'%s' already declared", arg.name);
    return new Kernel(
        name,
        ImmutableList.<KernelArg>builder().addAll(args).add(arg).build(),
        temporaries,
        domains,
        instructions);
  }

  /** Returns a copy of this Kernel with an additional temporary. */
  public Kernel withTemporary(TemporaryVariable temp) {
    Preconditions.checkArgument(!isVariableDeclared(temp.name), "'%s' already declared", temp.name);
    Map<String, TemporaryVariable> newTemps = new LinkedHashMap<>(temporaries);
    newTemps.put(temp.name, temp);
    return new Kernel(name, args, ImmutableMap.copyOf(newTemps), domains, instructions);
  }

  /** Returns a copy of this Kernel with an additional domain. */
  public Kernel withDomain(Domain domain) {
    for (String dim : domain.dims.keySet()) {
      Preconditions.checkArgument(domainFor(dim) == null, "Iname '%s' already has a domain", dim);
    }
    return new Kernel(
        name,
        args,
        temporaries,
        ImmutableList.<Domain>builder().addAll(domains).add(domain).build(),
        instructions);
  }

  /** Returns a copy of this Kernel with additional instructions, in the given order. */
  public Kernel withInstructions(List<Assignment> newInstructions) {
    Set<String> ids = new HashSet<>();
    instructions.forEach(insn -> ids.add(insn.id));
    for (Assignment insn : newInstructions) {
      Preconditions.checkArgument(ids.add(insn.id), "Duplicate instruction id '%s'", insn.id);
    }
    return new Kernel(
        name,
        args,
        temporaries,
        domains,
        ImmutableList.<Assignment>builder().addAll(instructions).addAll(newInstructions).build());
  }

  /** Returns a copy of this Kernel with one additional instruction. */
  public Kernel withInstruction(Assignment instruction) {
    return withInstructions(ImmutableList.of(instruction));
  }

  /** True if there is an argument or temporary with the given name. */
  public boolean isVariableDeclared(String varName) {
    return arg(varName) != null || temporaries.containsKey(varName);
  }

  /** Returns the argument with the given name, or null if there is none. */
  public @Nullable KernelArg arg(String argName) {
    return args.stream().filter(a -> a.name.equals(argName)).findFirst().orElse(null);
  }

  /** Returns the domain that has the given iname as a dimension, or null if there is none. */
  public @Nullable Domain domainFor(String iname) {
    return domains.stream().filter(d -> d.hasDim(iname)).findFirst().orElse(null);
  }

  /** Returns the instruction with the given id, or null if there is none. */
  public @Nullable Assignment instruction(String id) {
    return instructions.stream().filter(insn -> insn.id.equals(id)).findFirst().orElse(null);
  }

  /**
   * Returns a generator for variable names that won't collide with any argument, temporary, or
   * domain dimension or parameter of this kernel.
   */
  public UniqueNameGenerator varNameGenerator() {
    List<String> names = new ArrayList<>();
    args.forEach(a -> names.add(a.name));
    names.addAll(temporaries.keySet());
    for (Domain domain : domains) {
      names.addAll(domain.dims.keySet());
      names.addAll(domain.params);
    }
    return new UniqueNameGenerator(names);
  }

  /** Returns a generator for instruction ids that won't collide with those of this kernel. */
  public UniqueNameGenerator instructionIdGenerator() {
    return new UniqueNameGenerator(instructions.stream().map(insn -> insn.id).toList());
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("KERNEL ").append(name).append('\n');
    sb.append("ARGUMENTS\n");
    args.forEach(a -> sb.append("  ").append(a).append('\n'));
    if (!temporaries.isEmpty()) {
      sb.append("TEMPORARIES\n");
      temporaries.values().forEach(t -> sb.append("  ").append(t).append('\n'));
    }
    sb.append("DOMAINS\n");
    domains.forEach(d -> sb.append("  ").append(d).append('\n'));
    sb.append("INSTRUCTIONS\n");
    instructions.forEach(insn -> sb.append("  ").append(insn).append('\n'));
    return sb.toString();
  }
}
