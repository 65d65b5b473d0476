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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;
import org.lazyarray.scalar.ScalarExpr.Reduction;

@RunWith(JUnit4.class)
public class ArrayTest {

  @Test
  public void structuralEquality() {
    SizeParam n = new SizeParam("n");
    Array x1 = new Placeholder("x", ImmutableList.of(Dim.of(n), Dim.of(3)), DType.FLOAT64);
    Array x2 =
        new Placeholder(
            "x", ImmutableList.of(Dim.of(new SizeParam("n")), Dim.of(3)), DType.FLOAT64);
    assertThat(x1).isEqualTo(x2);
    assertThat(x1.hashCode()).isEqualTo(x2.hashCode());
    assertThat(ArrayOps.roll(x1, 1, 0)).isEqualTo(ArrayOps.roll(x2, 1, 0));

    assertThat(ArrayOps.roll(x1, 1, 0)).isNotEqualTo(ArrayOps.roll(x1, 2, 0));
    assertThat(x1).isNotEqualTo(new Placeholder("x", x1.shape, DType.FLOAT32));
    assertThat(x1)
        .isNotEqualTo(
            new Placeholder("x", x1.shape, DType.FLOAT64, ImmutableSet.of(Tag.of("hot"))));
  }

  @Test
  public void dataWrapperComparesBufferByReference() {
    double[] data = {1, 2};
    DataWrapper a = new DataWrapper("a", data, Dim.shape(2));
    assertThat(a).isEqualTo(new DataWrapper("a", data, Dim.shape(2)));
    assertThat(a).isNotEqualTo(new DataWrapper("a", data.clone(), Dim.shape(2)));
    assertThrows(
        IllegalArgumentException.class, () -> new DataWrapper("a", data, Dim.shape(3)));
  }

  @Test
  public void shapes() {
    Array a = new Placeholder("a", Dim.shape(2, 3), DType.FLOAT64);
    Array b = new Placeholder("b", Dim.shape(3, 4), DType.FLOAT64);
    assertThat(new MatrixProduct(a, b).shapeString()).isEqualTo("(2, 4)");
    assertThat(new Stack(ImmutableList.of(a, a), 1).shapeString()).isEqualTo("(2, 2, 3)");
    assertThat(new Concatenate(ImmutableList.of(a, a), 0).shapeString()).isEqualTo("(4, 3)");
    assertThat(ArrayOps.transpose(a).shapeString()).isEqualTo("(3, 2)");
    assertThat(ArrayOps.slice(a, new long[] {1, 0}, new long[] {2, 2}).shapeString())
        .isEqualTo("(1, 2)");
    assertThat(ArrayOps.reshape(a, 6).shapeString()).isEqualTo("(6)");
    assertThat(new DistributedSend(a, 1).shape).isEqualTo(a.shape);

    assertThrows(IllegalArgumentException.class, () -> new MatrixProduct(a, a));
    assertThrows(IllegalArgumentException.class, () -> new Stack(ImmutableList.of(a, b), 0));
    assertThrows(IllegalArgumentException.class, () -> ArrayOps.reshape(a, 5));
    assertThrows(IllegalArgumentException.class, () -> ArrayOps.transpose(a, 0, 0));
    assertThrows(
        IllegalArgumentException.class,
        () -> ArrayOps.slice(a, new long[] {0, 0}, new long[] {3, 1}));
  }

  @Test
  public void dimMustBeIntegerScalar() {
    assertThrows(IllegalArgumentException.class, () -> Dim.of(-1));
    Array v = new Placeholder("v", Dim.shape(3), DType.INT64);
    assertThrows(IllegalArgumentException.class, () -> Dim.of(v));
    Array f = new Placeholder("f", ImmutableList.of(), DType.FLOAT64);
    assertThrows(IllegalArgumentException.class, () -> Dim.of(f));
    assertThat(Dim.of(new SizeParam("n")).toString()).isEqualTo("n");
  }

  @Test
  public void reductionBoundsCannotUseIndexVariables() {
    // out[i] = sum over k < i of a[i, k]
    Array a = new Placeholder("a", Dim.shape(3, 3), DType.FLOAT64);
    ScalarExpr sum =
        new Reduction(
            Reduction.Op.SUM,
            ImmutableList.of("k"),
            ScalarExpr.var("in").index(ScalarExpr.var("_0"), ScalarExpr.var("k")));
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                new IndexLambda(
                    sum,
                    Dim.shape(3),
                    DType.FLOAT64,
                    ImmutableMap.of("in", a),
                    ImmutableMap.of("k", Bounds.upTo(ScalarExpr.var("_0"))),
                    ImmutableSet.of()));
    assertThat(e).hasMessageThat().contains("'_0'");

    // Bounds may still refer to bindings.
    IndexLambda ok =
        new IndexLambda(
            sum,
            Dim.shape(3),
            DType.FLOAT64,
            ImmutableMap.of("in", a, "m", new SizeParam("m")),
            ImmutableMap.of("k", Bounds.upTo(ScalarExpr.var("m"))),
            ImmutableSet.of());
    assertThat(ok.reductionBounds).containsKey("k");
  }
}
