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
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.lazyarray.scalar.Bounds;
import org.lazyarray.scalar.ScalarExpr;

@RunWith(JUnit4.class)
public class DomainTest {

  @Test
  public void symbolicParameter() {
    Domain domain =
        Domain.builder().addDim("i", Bounds.upTo(5)).addDim("j", Bounds.upTo(var("n"))).build();
    assertThat(domain.params).containsExactly("n");
    assertThat(domain.toString()).isEqualTo("[n] -> { [i, j] : 0 <= i < 5 and 0 <= j < n }");
    assertThat(domain.countPoints(ImmutableMap.of("n", 3L))).isEqualTo(15);

    Domain bound = domain.bind(ImmutableMap.of("n", 3L));
    assertThat(bound.params).isEmpty();
    assertThat(bound.countPoints(ImmutableMap.of())).isEqualTo(15);
  }

  @Test
  public void forEachPoint() {
    Domain domain =
        Domain.builder()
            .addDim("a", Bounds.upTo(2))
            .addDim("b", new Bounds(ScalarExpr.constant(1), var("m").plus(1)))
            .build();
    List<String> points = new ArrayList<>();
    domain.forEachPoint(
        ImmutableMap.of("m", 2L), p -> points.add(p.get("a") + "," + p.get("b")));
    assertThat(points).containsExactly("0,1", "0,2", "1,1", "1,2").inOrder();
  }

  @Test
  public void emptyDomainHasOnePoint() {
    Domain domain = Domain.builder().build();
    assertThat(domain.countPoints(ImmutableMap.of())).isEqualTo(1);
    int[] count = {0};
    domain.forEachPoint(ImmutableMap.of(), p -> count[0]++);
    assertThat(count[0]).isEqualTo(1);
    assertThat(domain.toString()).isEqualTo("{ [] }");
  }

  @Test
  public void emptyRangeHasNoPoints() {
    Domain domain = Domain.builder().addDim("i", Bounds.upTo(var("n"))).build();
    assertThat(domain.countPoints(ImmutableMap.of("n", 0L))).isEqualTo(0);
    domain.forEachPoint(
        ImmutableMap.of("n", 0L),
        p -> {
          throw new AssertionError(p);
        });
  }

  @Test
  public void boundMayNotReferToDimension() {
    Domain.Builder builder =
        Domain.builder().addDim("i", Bounds.upTo(3)).addDim("j", Bounds.upTo(var("i")));
    assertThrows(IllegalArgumentException.class, builder::build);
  }

  @Test
  public void project() {
    Domain domain =
        Domain.builder()
            .addDim("i", Bounds.upTo(3))
            .addDim("r", Bounds.upTo(var("n")))
            .build();
    Domain projected = domain.project(ImmutableList.of("i"));
    assertThat(projected.dims.keySet()).containsExactly("i");
    assertThat(projected.params).isEmpty();
    assertThrows(IllegalArgumentException.class, () -> domain.project(ImmutableList.of("q")));
  }
}
