/*
 * Copyright 2025 The Refold Authors
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

package org.refold.loops;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableSet;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refold.source.SourceType;
import org.refold.source.Variable;

@RunWith(JUnit4.class)
public class NameGeneratorTest {

  private final NameGenerator names = new NameGenerator();

  @Test
  public void freshIndexNames() {
    assertThat(names.freshIndexName(ImmutableSet.of())).isEqualTo("i");
    assertThat(names.freshIndexName(ImmutableSet.of("i", "j"))).isEqualTo("k");
    assertThat(names.freshIndexName(ImmutableSet.of("i", "j", "k", "l"))).isEqualTo("i2");
  }

  @Test
  public void reservedNamesAreSkipped() {
    names.reserve("i");
    names.reserve("j");
    assertThat(names.freshIndexName(ImmutableSet.of())).isEqualTo("k");
    names.release("j");
    assertThat(names.freshIndexName(ImmutableSet.of())).isEqualTo("j");
    names.release("i");
    assertThat(names.freshIndexName(ImmutableSet.of())).isEqualTo("i");
  }

  @Test
  public void unbalancedRelease() {
    names.reserve("i");
    assertThrows(IllegalStateException.class, () -> names.release("j"));
  }

  @Test
  public void syntheticVariablesAreDistinct() {
    Variable a = names.syntheticVariable("i", SourceType.INT);
    Variable b = names.syntheticVariable("i", SourceType.INT);
    assertThat(a).isNotEqualTo(b);
    assertThat(a.id).isLessThan(0);
  }
}
