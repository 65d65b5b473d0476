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

package org.lazyarray.transform;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lazyarray.array.Array;
import org.lazyarray.array.ArrayOps;
import org.lazyarray.array.DType;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.Dim;
import org.lazyarray.array.DictOfNamedArrays;
import org.lazyarray.array.DistributedRecv;
import org.lazyarray.array.DistributedSend;
import org.lazyarray.array.IndexLambda;
import org.lazyarray.array.Placeholder;
import org.lazyarray.array.Roll;
import org.lazyarray.array.SizeParam;
import org.lazyarray.array.Stack;
import org.lazyarray.scalar.ScalarExpr;

@RunWith(JUnitParamsRunner.class)
public class CopyMapperTest {
  private static final SizeParam N = new SizeParam("n");
  private static final Placeholder X =
      new Placeholder("x", ImmutableList.of(Dim.of(N), Dim.of(2)), DType.FLOAT64);
  private static final DataWrapper W =
      new DataWrapper("w", new double[] {1, 2, 3, 4}, Dim.shape(2, 2));

  /** One graph rooted at each kind of node. */
  private static Object[] graphs() {
    return new Object[] {
      new Object[] {"placeholder", X},
      new Object[] {"dataWrapper", W},
      new Object[] {"sizeParam", N},
      new Object[] {"indexLambda", ArrayOps.sum(X, 0)},
      new Object[] {"matrixProduct", ArrayOps.matmul(X, W)},
      new Object[] {"stack", ArrayOps.stack(ImmutableList.of(W, W), 1)},
      new Object[] {"concatenate", ArrayOps.concatenate(ImmutableList.of(W, W), 0)},
      new Object[] {"roll", ArrayOps.roll(X, 1, 0)},
      new Object[] {"axisPermutation", ArrayOps.transpose(X)},
      new Object[] {"slice", ArrayOps.slice(W, new long[] {0, 1}, new long[] {2, 2})},
      new Object[] {"reshape", ArrayOps.reshape(W, 4)},
      new Object[] {"distributedSend", new DistributedSend(W, 1)},
      new Object[] {"distributedRecv", new DistributedRecv(W, 0)},
    };
  }

  @Test
  @Parameters(method = "graphs")
  @TestCaseName("copyEqualsOriginal_{0}")
  public void copyEqualsOriginal(String kind, Array graph) {
    Array copy = new CopyMapper().copy(graph);
    assertThat(copy).isEqualTo(graph);
    assertThat(copy.kind).isEqualTo(graph.kind);
    assertThat(new CopyMapper().copy(copy)).isEqualTo(copy);
  }

  @Test
  public void sharingIsPreserved() {
    Array shared = ArrayOps.add(X, 1);
    Array graph = ArrayOps.stack(ImmutableList.of(shared, ArrayOps.multiply(shared, shared)));
    CopyMapper mapper = new CopyMapper();
    Array copy = mapper.copy(graph);
    assertThat(copy).isNotSameInstanceAs(graph);
    Array first = ((Stack) copy).arrays.get(0);
    IndexLambda product = (IndexLambda) ((Stack) copy).arrays.get(1);
    assertThat(product.bindings.get("_in0")).isSameInstanceAs(first);
    assertThat(product.bindings.get("_in1")).isSameInstanceAs(first);
    assertThat(mapper.copy(shared)).isSameInstanceAs(first);
  }

  @Test
  public void rewrite() {
    // Replace every roll by its argument.
    CopyMapper unroll =
        new CopyMapper() {
          @Override
          protected Array mapRoll(Roll node) {
            return rec(node.array);
          }
        };
    Array graph =
        ArrayOps.add(ArrayOps.roll(X, 1, 0), ArrayOps.roll(ArrayOps.roll(X, 1, 1), 2, 0));
    assertThat(unroll.copy(graph)).isEqualTo(ArrayOps.add(X, X));
  }

  @Test
  public void copyDictOfNamedArrays() {
    DictOfNamedArrays empty = new DictOfNamedArrays(ImmutableMap.of());
    assertThat(Transforms.copyDictOfNamedArrays(empty, new CopyMapper()).isEmpty()).isTrue();

    DictOfNamedArrays outputs =
        new DictOfNamedArrays(ImmutableMap.of("b", ArrayOps.transpose(W), "a", X));
    DictOfNamedArrays copy = Transforms.copyDictOfNamedArrays(outputs, new CopyMapper());
    assertThat(copy).isEqualTo(outputs);
    assertThat(copy.outputs.keySet()).containsExactly("b", "a").inOrder();
  }

  @Test
  public void deepGraph() {
    Array graph = X;
    for (int i = 0; i < 20_000; i++) {
      graph = new Roll(graph, 1, i % 2);
    }
    Array copy = new CopyMapper().copy(graph);
    assertThat(copy).isNotSameInstanceAs(graph);
    assertThat(copy.hashCode()).isEqualTo(graph.hashCode());
    assertThat(((Roll) copy).axis).isEqualTo(1);
  }

  @Test
  public void expressionIsNotRewritten() {
    IndexLambda lambda =
        new IndexLambda(
            ScalarExpr.var("_in0").plus(1),
            ImmutableList.of(),
            DType.INT64,
            ImmutableMap.of("_in0", N));
    IndexLambda copy = (IndexLambda) new CopyMapper().copy(lambda);
    assertThat(copy.expr).isSameInstanceAs(lambda.expr);
  }
}
