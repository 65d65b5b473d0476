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

package org.lazyarray.codegen;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lazyarray.LoweringError;
import org.lazyarray.array.Array;
import org.lazyarray.array.ArrayOps;
import org.lazyarray.array.DataWrapper;
import org.lazyarray.array.Dim;
import org.lazyarray.array.DistributedRecv;
import org.lazyarray.kernel.Kernel;
import org.lazyarray.transform.Transforms;

@RunWith(JUnit4.class)
public class CodeGenMapperTest {
  private static final DataWrapper A =
      new DataWrapper("a", new double[] {1, 2, 3, 4}, Dim.shape(2, 2));

  private CodeGenState state;
  private CodeGenMapper mapper;

  private void setUpFor(Array root) {
    state = new CodeGenState(Transforms.namespace(ImmutableList.of(root)), Kernel.empty("k"));
    mapper = new CodeGenMapper(state);
  }

  @Before
  public void setUp() {
    setUpFor(A);
  }

  @Test
  public void sharedNodeIsLoweredOnce() {
    Array shared = ArrayOps.matmul(A, A);
    Array out = ArrayOps.add(shared, ArrayOps.multiply(shared, shared));
    setUpFor(out);

    ImplementedResult result = mapper.apply(out);
    // a, shared, the product and out
    assertThat(state.loweringCount()).isEqualTo(4);
    assertThat(mapper.apply(out)).isSameInstanceAs(result);
    assertThat(state.loweringCount()).isEqualTo(4);

    Kernel kernel = state.kernel();
    assertThat(kernel.temporaries.keySet()).containsExactly("matmul");
    assertThat(kernel.instructions).hasSize(1);
    assertThat(kernel.instructions.get(0).id).isEqualTo("matmul_store");
    assertThat(result).isInstanceOf(ImplementedResult.Inlined.class);
    assertThat(((ImplementedResult.Inlined) result).dependsOn).containsExactly("matmul_store");
  }

  @Test
  public void inputsAreStored() {
    assertThat(mapper.apply(A)).isEqualTo(new ImplementedResult.Stored("a", ImmutableSet.of()));
    assertThat(state.kernel().arg("a")).isNotNull();
  }

  @Test
  public void reductionsFromSeveralBindingsAreDisjoint() {
    Array out = ArrayOps.add(ArrayOps.sum(A, 0), ArrayOps.sum(A, 1));
    setUpFor(out);
    ImplementedResult.Inlined result = (ImplementedResult.Inlined) mapper.apply(out);
    assertThat(result.reductionBounds.keySet()).containsExactly("_r0", "_r1").inOrder();
    assertThat(result.expr.toString())
        .isEqualTo("(sum([_r0], a[_r0, _0]) + sum([_r1], a[_0, _r1]))");
  }

  @Test
  public void remappingsCompose() {
    Array sliced = ArrayOps.slice(A, new long[] {0, 1}, new long[] {2, 2});
    Array out = ArrayOps.roll(ArrayOps.transpose(sliced), 1, 1);
    setUpFor(out);
    ImplementedResult.Inlined result = (ImplementedResult.Inlined) mapper.apply(out);
    assertThat(result.expr.toString()).isEqualTo("a[((_1 - 1) % 2), (_0 + 1)]");
    assertThat(result.reductionBounds).isEmpty();
    assertThat(result.dependsOn).isEmpty();
  }

  @Test
  public void unsupportedKind() {
    LoweringError e =
        assertThrows(LoweringError.class, () -> mapper.apply(new DistributedRecv(A, 0)));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.UNSUPPORTED_NODE_KIND);
    assertThat(e).hasMessageThat().contains("CodeGenMapper");
  }

  @Test
  public void foreignObject() {
    LoweringError e = assertThrows(LoweringError.class, () -> mapper.apply("a"));
    assertThat(e.kind).isEqualTo(LoweringError.Kind.FOREIGN_OBJECT);
  }

  @Test
  public void dimExpressionOfConstant() {
    assertThat(mapper.dimExpression(Dim.of(7)).toString()).isEqualTo("7");
    assertThat(mapper.shapeExpressions(A).toString()).isEqualTo("[2, 2]");
    assertThat(state.loweringCount()).isEqualTo(0);
  }

  @Test
  public void lookupPrefersLocalNamespace() {
    DataWrapper other = new DataWrapper("b", new double[] {0}, Dim.shape(1));
    ExpressionContext context =
        new ExpressionContext(state, ImmutableMap.of("a", other), ImmutableMap.of());
    assertThat(context.lookup("a")).isSameInstanceAs(other);
    assertThat(new ExpressionContext(state).lookup("a")).isEqualTo(A);
    assertThat(context.lookup("zzz")).isNull();
  }
}
