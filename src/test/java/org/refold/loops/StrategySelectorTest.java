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
import static org.refold.loops.CounterLoopMatcherTest.context;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceType;
import org.refold.source.Variable;
import org.refold.testing.SourceBuilder;

/** Tests the analysis of complete loops and the strategy chosen for them. */
@RunWith(JUnit4.class)
public class StrategySelectorTest {

  private final SourceBuilder b = new SourceBuilder();
  private final LoopAnalyzer analyzer = new LoopAnalyzer(EngineConfig.DEFAULT);
  private final StrategySelector selector = new StrategySelector(EngineConfig.DEFAULT);

  private final Variable acc = b.listVar("acc");
  private final Variable total = b.intVar("total");
  private final Variable i = b.intVar("i");
  private final Variable list = b.listVar("list");

  /** Analyzes the last of {@code statements}. */
  private LoopIr analyze(SourceExpr... statements) {
    return analyzer.analyzeAt(context(ImmutableList.copyOf(statements), statements.length - 1))
        .orElseThrow();
  }

  private SourceExpr loop(SourceExpr... body) {
    return b.forRange(i, b.i(0), b.i(3), body);
  }

  @Test
  public void traceOnlyIsEach() {
    LoopIr ir = analyze(loop(b.trace(b.ref(i))));
    assertThat(ir.sideEffectOnly).isTrue();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.EACH_SIDE_EFFECT);
  }

  @Test
  public void pushIsMap() {
    LoopIr ir = analyze(b.decl(acc, b.emptyList()), loop(b.push(acc, b.ref(i))));
    assertThat(ir.yieldShape).isNotNull();
    assertThat(ir.collectTarget).isEqualTo(acc);
    assertThat(ir.seedKnownEmpty).isTrue();
    assertThat(ir.valueMode).isFalse();
    assertThat(ir.mutated).isEmpty();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.MAP_TRANSFORM);
  }

  @Test
  public void guardedPushIsComprehension() {
    LoopIr ir =
        analyze(
            b.decl(acc, b.emptyList()),
            loop(b.ifThen(b.bin(Binop.NE, b.ref(i), b.i(1)), b.push(acc, b.ref(i)))));
    assertThat(ir.hasFilters()).isTrue();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.COMPREHENSION);
  }

  @Test
  public void pushIntoUnseededListIsStillMap() {
    LoopIr ir = analyze(loop(b.push(acc, b.ref(i))));
    assertThat(ir.seedKnownEmpty).isFalse();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.MAP_TRANSFORM);
  }

  @Test
  public void accumulationIsFold() {
    LoopIr ir = analyze(b.decl(total, b.i(0)), loop(b.addAssign(total, b.ref(i))));
    assertThat(ir.mutated).containsExactly(total);
    assertThat(ir.accumulation.kind).isEqualTo(AccumulationDescriptor.Kind.NUMERIC_ADD);
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.FOLD_REDUCE);
  }

  @Test
  public void exitsForceFold() {
    LoopIr ir = analyze(loop(b.ifThen(b.bin(Binop.EQ, b.ref(i), b.i(2)), b.brk())));
    assertThat(ir.exits.hasBreak).isTrue();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.FOLD_REDUCE);
  }

  @Test
  public void pushWithReturnIsNotAYield() {
    LoopIr ir =
        analyze(
            b.decl(acc, b.emptyList()),
            loop(
                b.ifThen(b.bin(Binop.EQ, b.ref(i), b.i(2)), b.ret(b.ref(i))),
                b.push(acc, b.ref(i))));
    assertThat(ir.yieldShape).isNull();
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.FOLD_REDUCE);
  }

  @Test
  public void unknownCallFallsBack() {
    LoopIr ir = analyze(loop(b.staticCall(SourceType.INT, "compute", b.ref(i))));
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.FALLBACK);
  }

  @Test
  public void lowConfidenceFallsBack() {
    Variable it = b.var("it", SourceType.ITERATOR);
    Variable x = b.intVar("x");
    LoopIr ir =
        analyzer
            .analyzeAt(
                context(
                    ImmutableList.of(
                        b.decl(it, b.method(SourceType.ITERATOR, b.ref(list), "iterator")),
                        b.whileLoop(
                            b.method(SourceType.BOOL, b.ref(it), "hasNext"),
                            b.decl(x, b.method(SourceType.INT, b.ref(it), "next")),
                            b.trace(b.ref(x)))),
                    0))
            .orElseThrow();
    assertThat(ir.confidence).isEqualTo(IteratorCollectionMatcher.CONFIDENCE);
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.EACH_SIDE_EFFECT);
    StrategySelector strict = new StrategySelector(EngineConfig.parse("confidenceThreshold=0.9"));
    assertThat(strict.selectStrategy(ir)).isEqualTo(EmissionStrategy.FALLBACK);
  }

  @Test
  public void nestedPushFlattens() {
    Variable j = b.intVar("j");
    LoopIr ir =
        analyze(
            b.decl(acc, b.emptyList()),
            loop(b.forEach(j, b.ref(list), b.push(acc, b.add(b.ref(i), b.ref(j))))));
    assertThat(ir.generators()).hasSize(2);
    assertThat(selector.selectStrategy(ir)).isEqualTo(EmissionStrategy.COMPREHENSION);
  }
}
