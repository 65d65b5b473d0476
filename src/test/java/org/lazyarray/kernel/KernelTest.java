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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.lazyarray.scalar.ScalarExpr.var;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lazyarray.array.DType;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;

@RunWith(JUnit4.class)
public class KernelTest {

  private static final KernelArg.GlobalArg X =
      new KernelArg.GlobalArg("x", ImmutableList.of(var("n")), DType.FLOAT64, false);
  private static final KernelArg.GlobalArg OUT =
      new KernelArg.GlobalArg("out", ImmutableList.of(var("n")), DType.FLOAT64, true);

  /** Returns a kernel that computes {@code out[i] = 2 * x[i]}. */
  private static Kernel doubler() {
    Assignment insn =
        new Assignment(
            "out_store",
            var("out").index(var("i")),
            ScalarExpr.constant(2).times(var("x").index(var("i"))),
            ImmutableSet.of("i"),
            ImmutableSet.of());
    return Kernel.empty("k")
        .withArg(new KernelArg.ValueArg("n", DType.INT64))
        .withArg(X)
        .withArg(OUT)
        .withDomain(Domain.builder().addDim("i", Bounds.upTo(var("n"))).build())
        .withInstruction(insn);
  }

  @Test
  public void functionalUpdates() {
    Kernel empty = Kernel.empty("k");
    Kernel kernel = doubler();
    assertThat(empty.args).isEmpty();
    assertThat(kernel.args).containsExactly(new KernelArg.ValueArg("n", DType.INT64), X, OUT);
    assertThat(kernel.arg("x")).isEqualTo(X);
    assertThat(kernel.arg("y")).isNull();
    assertThat(kernel.domainFor("i").params).containsExactly("n");
    assertThat(kernel.instruction("out_store").assigneeName()).isEqualTo("out");
  }

  @Test
  public void duplicatesAreRejected() {
    Kernel kernel = doubler();
    assertThrows(IllegalArgumentException.class, () -> kernel.withArg(X));
    assertThrows(
        IllegalArgumentException.class,
        () ->
            kernel.withTemporary(
                new TemporaryVariable(
                    "out",
                    DType.FLOAT64,
                    ImmutableList.of(),
                    TemporaryVariable.AddressSpace.AUTO)));
    assertThrows(
        IllegalArgumentException.class,
        () -> kernel.withDomain(Domain.builder().addDim("i", Bounds.upTo(2)).build()));
    assertThrows(
        IllegalArgumentException.class,
        () -> kernel.withInstruction(kernel.instruction("out_store")));
  }

  @Test
  public void nameGenerators() {
    Kernel kernel = doubler();
    UniqueNameGenerator vars = kernel.varNameGenerator();
    assertThat(vars.generate("x")).isEqualTo("x_0");
    assertThat(vars.generate("i")).isEqualTo("i_0");
    assertThat(vars.generate("n")).isEqualTo("n_0");
    assertThat(kernel.instructionIdGenerator().generate("out_store")).isEqualTo("out_store_0");
  }

  @Test
  public void interpret() {
    double[] out =
        new KernelInterpreter(doubler())
            .setValue("n", 3)
            .setArray("x", new double[] {1, 2, 3.5})
            .run()
            .get("out");
    assertThat(out).isEqualTo(new double[] {2, 4, 7});
  }
}
