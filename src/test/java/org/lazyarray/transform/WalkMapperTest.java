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
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lazyarray.array.Array;
import org.lazyarray.array.ArrayOps;
import org.lazyarray.array.DType;
import org.lazyarray.array.Dim;
import org.lazyarray.array.InputArgument;
import org.lazyarray.array.Placeholder;
import org.lazyarray.array.Roll;
import org.lazyarray.array.SizeParam;

@RunWith(JUnit4.class)
public class WalkMapperTest {
  private static final SizeParam N = new SizeParam("n");
  private static final Placeholder X =
      new Placeholder("x", ImmutableList.of(Dim.of(N)), DType.FLOAT64);
  private static final Placeholder Y = new Placeholder("y", Dim.shape(3), DType.FLOAT64);

  /** Records the calls to visit() and postVisit(), skipping the children of any Roll. */
  private static class Recorder extends WalkMapper {
    final List<String> events = new ArrayList<>();

    @Override
    protected boolean visit(Array node) {
      events.add("visit " + name(node));
      return !(node instanceof Roll);
    }

    @Override
    protected void postVisit(Array node) {
      events.add("post " + name(node));
    }

    static String name(Array node) {
      return (node instanceof InputArgument input) ? input.name : node.kind.name().toLowerCase();
    }
  }

  @Test
  public void order() {
    Recorder recorder = new Recorder();
    recorder.walk(ArrayOps.matmul(ArrayOps.reshape(Y, 3, 1), ArrayOps.reshape(Y, 1, 3)));
    assertThat(recorder.events)
        .containsExactly(
            "visit matrix_product",
            "visit reshape",
            "visit y",
            "post y",
            "post reshape",
            "visit reshape",
            "visit y",
            "post y",
            "post reshape",
            "post matrix_product")
        .inOrder();
  }

  @Test
  public void pruning() {
    Recorder recorder = new Recorder();
    recorder.walk(ArrayOps.stack(ImmutableList.of(ArrayOps.roll(X, 1, 0), X)));
    assertThat(recorder.events)
        .containsExactly(
            "visit stack",
            "visit roll",
            "visit x",
            "visit n",
            "post n",
            "post x",
            "post stack")
        .inOrder();
  }

  @Test
  public void topologicalOrder() {
    Array sum = ArrayOps.add(X, X);
    Array graph = ArrayOps.stack(ImmutableList.of(sum, ArrayOps.roll(sum, 1, 0)));
    ImmutableList<Array> order = TopoSortMapper.sort(graph, node -> false);
    assertThat(order).containsExactly(N, X, sum, ArrayOps.roll(sum, 1, 0), graph).inOrder();

    // Skipped nodes aren't recorded, and neither are nodes only reachable through them.
    order = TopoSortMapper.sort(graph, node -> node == sum);
    assertThat(order).containsExactly(ArrayOps.roll(sum, 1, 0), graph).inOrder();
  }

  @Test
  public void topoSortSeveralRoots() {
    Placeholder z = new Placeholder("z", X.shape, DType.FLOAT64);
    TopoSortMapper sorter = new TopoSortMapper();
    sorter.walk(X);
    sorter.walk(ArrayOps.add(X, z));
    assertThat(sorter.order()).containsExactly(N, X, z, ArrayOps.add(X, z)).inOrder();
  }
}
