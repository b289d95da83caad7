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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refold.source.SourceExpr;
import org.refold.source.SourceType;
import org.refold.source.Variable;
import org.refold.testing.SourceBuilder;

@RunWith(JUnit4.class)
public class EffectAnalyzerTest {

  private final SourceBuilder b = new SourceBuilder();
  private final EffectAnalyzer effects = new EffectAnalyzer(EngineConfig.DEFAULT);

  private final Variable acc = b.listVar("acc");
  private final Variable total = b.intVar("total");
  private final Variable s = b.var("s", SourceType.STRING);
  private final Variable x = b.intVar("x");

  @Test
  public void sideEffectsOnly() {
    assertThat(effects.hasSideEffectsOnly(b.block(b.trace(b.ref(x))))).isTrue();
    assertThat(
            effects.hasSideEffectsOnly(
                b.block(b.ifThen(b.lt(b.ref(x), b.i(3)), b.trace(b.ref(x))))))
        .isTrue();
    assertThat(effects.hasSideEffectsOnly(b.block(b.staticCall(SourceType.INT, "compute"))))
        .isFalse();
    assertThat(effects.hasSideEffectsOnly(b.block(b.addAssign(total, b.ref(x))))).isFalse();
    // An argument with an effect of its own does not qualify.
    assertThat(effects.hasSideEffectsOnly(b.block(b.trace(b.postInc(x))))).isFalse();
  }

  @Test
  public void configuredSideEffectFunctions() {
    EffectAnalyzer custom =
        new EffectAnalyzer(EngineConfig.parse("sideEffectFunctions=Out.emit"));
    SourceExpr body = b.block(b.staticCall(SourceType.VOID, "Out.emit", b.ref(x)));
    assertThat(custom.hasSideEffectsOnly(body)).isTrue();
    assertThat(effects.hasSideEffectsOnly(body)).isFalse();
  }

  private AccumulationDescriptor.Kind kindOf(SourceExpr body) {
    return effects.detectAccumulationPattern(body).orElseThrow().kind;
  }

  @Test
  public void accumulationKinds() {
    assertThat(kindOf(b.block(b.push(acc, b.ref(x)))))
        .isEqualTo(AccumulationDescriptor.Kind.LIST_APPEND);
    assertThat(kindOf(b.block(b.addAssign(s, b.str("a")))))
        .isEqualTo(AccumulationDescriptor.Kind.STRING_CONCAT);
    AccumulationDescriptor numeric =
        effects
            .detectAccumulationPattern(
                b.block(b.ifThen(b.lt(b.ref(x), b.i(0)), b.addAssign(total, b.ref(x)))))
            .orElseThrow();
    assertThat(numeric.kind).isEqualTo(AccumulationDescriptor.Kind.NUMERIC_ADD);
    assertThat(numeric.variable).isEqualTo(total);
    assertThat(numeric.conditional).isTrue();
  }

  @Test
  public void accumulationIntoLocalIsIgnored() {
    Variable local = b.intVar("local");
    assertThat(
            effects.detectAccumulationPattern(
                b.block(b.decl(local, b.i(0)), b.addAssign(local, b.ref(x)))))
        .isEmpty();
  }

  @Test
  public void mutatedVariables() {
    Variable m = b.var("m", SourceType.MAP);
    Variable local = b.intVar("local");
    Variable f = b.var("f", SourceType.FUNCTION);
    SourceExpr body =
        b.block(
            b.decl(local, b.i(0)),
            b.assign(local, b.i(1)),
            b.postInc(x),
            b.push(acc, b.i(1)),
            b.assign(b.index(SourceType.INT, b.ref(m), b.str("k")), b.i(2)),
            b.decl(f, b.function(ImmutableList.of(), b.assign(total, b.i(3)))));
    assertThat(EffectAnalyzer.detectMutatedVariables(body)).containsExactly(acc, x, m).inOrder();
  }

  @Test
  public void advancingAnIteratorMutatesIt() {
    Variable it = b.var("it", SourceType.ITERATOR);
    Variable y = b.intVar("y");
    SourceExpr body = b.block(b.decl(y, b.method(SourceType.INT, b.ref(it), "next")));
    assertThat(EffectAnalyzer.detectMutatedVariables(body)).containsExactly(it);
  }

  @Test
  public void exits() {
    Variable i = b.intVar("i");
    ExitSummary exits =
        EffectAnalyzer.findExits(
            b.block(
                b.ifThen(b.ref(x), b.brk()),
                b.forRange(i, b.i(0), b.i(3), b.cont()),
                b.function(ImmutableList.of(), b.ret(b.i(1)))));
    assertThat(exits.hasBreak).isTrue();
    assertThat(exits.hasContinue).isFalse();
    assertThat(exits.hasReturn).isFalse();
    assertThat(EffectAnalyzer.findExits(b.block(b.trace(b.ref(x)))))
        .isSameInstanceAs(ExitSummary.NONE);
    assertThat(EffectAnalyzer.findExits(b.block(b.ret(b.ref(x)))).hasReturn).isTrue();
  }
}
