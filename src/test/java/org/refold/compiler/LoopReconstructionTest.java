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

package org.refold.compiler;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.refold.loops.AccumulationDescriptor;
import org.refold.loops.CandidateShape;
import org.refold.loops.EmissionStrategy;
import org.refold.loops.EngineConfig;
import org.refold.loops.LoopProvenance;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceType;
import org.refold.source.Variable;
import org.refold.testing.RoundTrip;
import org.refold.testing.SourceBuilder;
import org.refold.testing.SourceEvaluator;
import org.refold.testing.TargetEvaluator;
import org.refold.testing.Values;

/**
 * Compiles imperative loops, checks the rendering of the reconstructed loop, and runs both the
 * source and the compiled code to check that they behave the same way.
 */
@RunWith(JUnit4.class)
public class LoopReconstructionTest {

  private final SourceBuilder b = new SourceBuilder();

  private static LoopProvenance onlyLoop(RoundTrip roundTrip) {
    assertThat(roundTrip.compiler.provenance()).hasSize(1);
    return roundTrip.compiler.provenance().get(0);
  }

  @Test
  public void foldStartsFromSeed() {
    Variable total = b.intVar("total");
    Variable n = b.intVar("n");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(total, b.i(10)),
                b.decl(n, b.i(4)),
                b.forRange(i, b.i(0), b.ref(n), b.addAssign(total, b.ref(i)))));
    assertThat(roundTrip.text())
        .isEqualTo(
            "total = 10\n"
                + "n = 4\n"
                + "total = Enum.reduce(0..n - 1//1, total, fn i, total -> total + i end)");
    roundTrip.assertSameBehavior(total);
    assertThat(Values.show(roundTrip.targetValue(total))).isEqualTo("16");
    LoopProvenance provenance = onlyLoop(roundTrip);
    assertThat(provenance.strategy).isEqualTo(EmissionStrategy.FOLD_REDUCE);
    assertThat(provenance.shapeKind).isEqualTo(CandidateShape.Kind.RANGE_FOR);
    assertThat(provenance.binderName).isEqualTo("i");
    assertThat(provenance.inferredRange).isEqualTo("0..n - 1//1");
    assertThat(provenance.capturedVariables).containsExactly("n", "total").inOrder();
    assertThat(provenance.accumulation).isEqualTo(AccumulationDescriptor.Kind.NUMERIC_ADD);
  }

  @Test
  public void filteredPushBecomesComprehension() {
    Variable acc = b.listVar("acc");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(acc, b.emptyList()),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(10),
                    b.ifThen(
                        b.bin(Binop.EQ, b.bin(Binop.MOD, b.ref(i), b.i(2)), b.i(0)),
                        b.push(acc, b.ref(i))))));
    assertThat(roundTrip.text())
        .isEqualTo("acc = []\nacc = for i <- 0..9, rem(i, 2) == 0, do: i");
    roundTrip.assertSameBehavior(acc);
    assertThat(Values.show(roundTrip.targetValue(acc))).isEqualTo("[0, 2, 4, 6, 8]");
    assertThat(onlyLoop(roundTrip).strategy).isEqualTo(EmissionStrategy.COMPREHENSION);
  }

  @Test
  public void pushWithoutFilterBecomesMap() {
    Variable out = b.listVar("out");
    Variable xs = b.listVar("xs");
    Variable x = b.intVar("x");
    Variable y = b.intVar("y");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(out, b.emptyList()),
                b.forEach(
                    x,
                    b.ref(xs),
                    b.decl(y, b.bin(Binop.MUL, b.ref(x), b.i(2))),
                    b.push(out, b.add(b.ref(y), b.i(1))))),
            RoundTrip.inputs().put(xs, List.of(1, 2, 3)).build());
    assertThat(roundTrip.text())
        .isEqualTo("out = []\nout = Enum.map(xs, fn x -> y = x * 2; y + 1 end)");
    roundTrip.assertSameBehavior(out);
    assertThat(onlyLoop(roundTrip).shapeKind).isEqualTo(CandidateShape.Kind.COLLECTION_FOR);
  }

  @Test
  public void pushOntoNonEmptySeedAppends() {
    Variable out = b.listVar("out");
    Variable xs = b.listVar("xs");
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(out, b.ints(100)), b.forEach(x, b.ref(xs), b.push(out, b.ref(x)))),
            RoundTrip.inputs().put(xs, List.of(1, 2)).build());
    assertThat(roundTrip.text())
        .isEqualTo("out = [100]\nout = out ++ Enum.map(xs, fn x -> x end)");
    roundTrip.assertSameBehavior(out);
  }

  @Test
  public void nestedListBuildingBlocks() {
    Variable result = b.var("result", SourceType.arrayOf(SourceBuilder.INT_ARRAY));
    Variable inner = b.listVar("innerAcc");
    Variable i = b.intVar("outer");
    Variable j = b.intVar("inner");
    SourceExpr row =
        b.valueBlock(
            SourceBuilder.INT_ARRAY,
            b.decl(inner, b.emptyList()),
            b.forRange(
                j,
                b.i(0),
                b.i(2),
                b.push(inner, b.add(b.bin(Binop.MUL, b.ref(i), b.i(2)), b.ref(j)))),
            b.ref(inner));
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(result, b.array(SourceBuilder.INT_ARRAY)),
                b.forRange(i, b.i(0), b.i(2), b.push(result, row))));
    assertThat(roundTrip.text())
        .isEqualTo(
            "result = []\n"
                + "result = Enum.map(0..1, fn outer ->"
                + " Enum.map(0..1, fn inner -> outer * 2 + inner end) end)");
    roundTrip.assertSameBehavior(result);
    assertThat(Values.show(roundTrip.targetValue(result))).isEqualTo("[[0, 1], [2, 3]]");
  }

  @Test
  public void directlyNestedLoopsFlattenIntoOneComprehension() {
    Variable pairs = b.listVar("pairs");
    Variable a = b.intVar("a");
    Variable c = b.intVar("c");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(pairs, b.emptyList()),
                b.forRange(
                    a,
                    b.i(0),
                    b.i(2),
                    b.forRange(
                        c,
                        b.i(0),
                        b.i(2),
                        b.ifThen(
                            b.bin(Binop.NE, b.ref(a), b.ref(c)),
                            b.push(
                                pairs,
                                b.add(b.bin(Binop.MUL, b.ref(a), b.i(10)), b.ref(c))))))));
    assertThat(roundTrip.text())
        .isEqualTo("pairs = []\npairs = for a <- 0..1, c <- 0..1, a != c, do: a * 10 + c");
    roundTrip.assertSameBehavior(pairs);
    assertThat(Values.show(roundTrip.targetValue(pairs))).isEqualTo("[1, 10]");
  }

  @Test
  public void counterLoopBecomesEach() {
    Variable g = b.intVar("g");
    Variable g1 = b.intVar("g1");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(g, b.i(0)),
                b.decl(g1, b.i(5)),
                b.whileLoop(
                    b.lt(b.ref(g), b.ref(g1)), b.decl(i, b.postInc(g)), b.trace(b.ref(i)))));
    assertThat(roundTrip.text()).isEqualTo("Enum.each(0..4, fn i -> Log.trace(i) end)");
    roundTrip.assertSameBehavior();
    assertThat(roundTrip.target.output).containsExactly("0", "1", "2", "3", "4").inOrder();
    assertThat(onlyLoop(roundTrip).shapeKind).isEqualTo(CandidateShape.Kind.COUNTER_RANGE);
  }

  @Test
  public void indexedLoopIteratesTheArray() {
    Variable arr = b.listVar("arr");
    Variable g = b.intVar("g");
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(g, b.i(0)),
                b.whileLoop(
                    b.lt(b.ref(g), b.length(arr)),
                    b.decl(x, b.index(SourceType.INT, b.ref(arr), b.ref(g))),
                    b.preInc(g),
                    b.trace(b.ref(x)))),
            RoundTrip.inputs().put(arr, List.of(7, 8, 9)).build());
    assertThat(roundTrip.text()).isEqualTo("Enum.each(arr, fn x -> Log.trace(x) end)");
    roundTrip.assertSameBehavior();
  }

  @Test
  public void keyValueIteration() {
    Variable m = b.var("m", SourceType.MAP);
    Variable it = b.var("it", SourceType.ITERATOR);
    Variable kv = b.var("kv", SourceType.DYNAMIC);
    Variable k = b.var("k", SourceType.STRING);
    Variable v = b.intVar("v");
    Variable total = b.intVar("total");
    Map<Object, Object> map = new TreeMap<>(Values.ORDER);
    map.put("a", 1);
    map.put("b", 20);
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(total, b.i(0)),
                b.decl(it, b.method(SourceType.ITERATOR, b.ref(m), "keyValueIterator")),
                b.whileLoop(
                    b.method(SourceType.BOOL, b.ref(it), "hasNext"),
                    b.decl(kv, b.method(SourceType.DYNAMIC, b.ref(it), "next")),
                    b.decl(k, b.field(SourceType.STRING, b.ref(kv), "key")),
                    b.decl(v, b.field(SourceType.INT, b.ref(kv), "value")),
                    b.trace(b.ref(k)),
                    b.addAssign(total, b.ref(v)))),
            RoundTrip.inputs().put(m, map).build());
    assertThat(roundTrip.text())
        .isEqualTo(
            "total = 0\n"
                + "total = Enum.reduce(m, total, fn {k, v}, total ->"
                + " Log.trace(k); total + v end)");
    roundTrip.assertSameBehavior(total);
    assertThat(onlyLoop(roundTrip).shapeKind)
        .isEqualTo(CandidateShape.Kind.KEY_VALUE_ITERATION);
  }

  @Test
  public void iteratorLoop() {
    Variable list = b.listVar("list");
    Variable it = b.var("it", SourceType.ITERATOR);
    Variable x = b.intVar("x");
    Variable sum = b.intVar("sum");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(sum, b.i(0)),
                b.decl(it, b.method(SourceType.ITERATOR, b.ref(list), "iterator")),
                b.whileLoop(
                    b.method(SourceType.BOOL, b.ref(it), "hasNext"),
                    b.decl(x, b.method(SourceType.INT, b.ref(it), "next")),
                    b.addAssign(sum, b.ref(x)))),
            RoundTrip.inputs().put(list, List.of(3, 4, 5)).build());
    assertThat(roundTrip.text())
        .isEqualTo("sum = 0\nsum = Enum.reduce(list, sum, fn x, sum -> sum + x end)");
    roundTrip.assertSameBehavior(sum);
  }

  @Test
  public void iteratorLoopModifyingItsCollectionFallsBack() {
    Variable list = b.listVar("list");
    Variable it = b.var("it", SourceType.ITERATOR);
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(it, b.method(SourceType.ITERATOR, b.ref(list), "iterator")),
                b.whileLoop(
                    b.method(SourceType.BOOL, b.ref(it), "hasNext"),
                    b.decl(x, b.method(SourceType.INT, b.ref(it), "next")),
                    b.trace(b.ref(x)),
                    b.ifThen(b.bin(Binop.EQ, b.ref(x), b.i(1)), b.push(list, b.i(9))))),
            RoundTrip.inputs().put(list, List.of(0, 1, 2)).build());
    assertThat(roundTrip.text()).startsWith("it = list\n");
    assertThat(roundTrip.text()).contains("if it != [] do {x, it} = List.pop_at(it, 0);");
    assertThat(onlyLoop(roundTrip).strategy).isEqualTo(EmissionStrategy.FALLBACK);
    roundTrip.assertSameBehavior(list);
    assertThat(Values.show(roundTrip.targetValue(list))).isEqualTo("[0, 1, 2, 9]");
    assertThat(roundTrip.target.output).hasSize(3);
  }

  @Test
  public void elementComputedByIncrementFolds() {
    Variable k = b.intVar("k");
    Variable acc = b.listVar("acc");
    Variable i = b.intVar("i");
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(k, b.i(10)),
                b.decl(acc, b.emptyList()),
                b.forRange(
                    i, b.i(0), b.i(3), b.decl(x, b.postInc(k)), b.push(acc, b.ref(x)))));
    assertThat(onlyLoop(roundTrip).strategy).isEqualTo(EmissionStrategy.FOLD_REDUCE);
    roundTrip.assertSameBehavior(acc, k);
    assertThat(Values.show(roundTrip.targetValue(acc))).isEqualTo("[10, 11, 12]");
    assertThat(Values.show(roundTrip.targetValue(k))).isEqualTo("13");
  }

  @Test
  public void unrolledIncrementsStayInOrder() {
    Variable r = b.listVar("r");
    Variable acc = b.listVar("acc");
    Variable k = b.intVar("k");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(k, b.i(5)),
                b.decl(
                    r,
                    b.valueBlock(
                        SourceBuilder.INT_ARRAY,
                        b.decl(acc, b.emptyList()),
                        b.push(acc, b.postInc(k)),
                        b.push(acc, b.postInc(k)),
                        b.push(acc, b.postInc(k)),
                        b.ref(acc)))));
    assertThat(roundTrip.text()).doesNotContain("for ");
    assertThat(roundTrip.compiler.provenance()).isEmpty();
    roundTrip.assertSameBehavior(r, k);
    assertThat(Values.show(roundTrip.targetValue(r))).isEqualTo("[5, 6, 7]");
  }

  @Test
  public void stringAccumulation() {
    Variable s = b.var("s", SourceType.STRING);
    Variable words = b.var("words", SourceType.arrayOf(SourceType.STRING));
    Variable w = b.var("w", SourceType.STRING);
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(s, b.str("")), b.forEach(w, b.ref(words), b.addAssign(s, b.ref(w)))),
            RoundTrip.inputs().put(words, List.of("ab", "c", "d")).build());
    assertThat(roundTrip.text())
        .isEqualTo("s = \"\"\ns = Enum.reduce(words, s, fn w, s -> s <> w end)");
    roundTrip.assertSameBehavior(s);
  }

  @Test
  public void ifElseThreadsBothBranches() {
    Variable big = b.intVar("big");
    Variable small = b.intVar("small");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(big, b.i(0)),
                b.decl(small, b.i(0)),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(5),
                    b.ifElse(
                        b.bin(Binop.GT, b.ref(i), b.i(2)),
                        b.addAssign(big, b.ref(i)),
                        b.addAssign(small, b.ref(i))))));
    assertThat(roundTrip.compiled.get(2).toString())
        .isEqualTo(
            "{big, small} = Enum.reduce(0..4, {big, small}, fn i, {big, small} ->"
                + " if i > 2 do big = big + i; {big, small}"
                + " else small = small + i; {big, small} end end)");
    roundTrip.assertSameBehavior(big, small);
  }

  @Test
  public void breakCarriesState() {
    Variable total = b.intVar("total");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(total, b.i(0)),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(10),
                    b.addAssign(total, b.ref(i)),
                    b.ifThen(b.bin(Binop.GT, b.ref(total), b.i(5)), b.brk()))));
    assertThat(roundTrip.compiled.get(1).toString())
        .isEqualTo(
            "total = Enum.reduce_while(0..9, total, fn i, total -> try do"
                + " total = total + i; if total > 5 do throw({:break, total}) end; {:cont, total}"
                + " catch :throw, {:break, break_state} -> {:halt, break_state} end end)");
    roundTrip.assertSameBehavior(total);
    assertThat(Values.show(roundTrip.targetValue(total))).isEqualTo("6");
  }

  @Test
  public void breakKeepsStateWhenBareSignalsAccepted() {
    Variable total = b.intVar("total");
    Variable i = b.intVar("i");
    EngineConfig config = EngineConfig.builder().setStateCarryingSignals(false).build();
    RoundTrip roundTrip =
        RoundTrip.run(
            config,
            ImmutableList.of(
                b.decl(total, b.i(0)),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(10),
                    b.addAssign(total, b.ref(i)),
                    b.ifThen(b.bin(Binop.GT, b.ref(total), b.i(5)), b.brk()))),
            Map.of());
    assertThat(roundTrip.compiled.get(1).toString())
        .isEqualTo(
            "total = Enum.reduce_while(0..9, total, fn i, total -> try do"
                + " total = total + i; if total > 5 do throw({:break, total}) end; {:cont, total}"
                + " catch :throw, {:break, break_state} -> {:halt, break_state};"
                + " :throw, :break -> {:halt, total} end end)");
    roundTrip.assertSameBehavior(total);
    assertThat(Values.show(roundTrip.targetValue(total))).isEqualTo("6");
  }

  @Test
  public void breakWithoutStateThrowsAtom() {
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.forRange(
                    i,
                    b.i(0),
                    b.i(10),
                    b.ifThen(b.bin(Binop.EQ, b.ref(i), b.i(3)), b.brk()),
                    b.trace(b.ref(i)))));
    assertThat(roundTrip.text())
        .isEqualTo(
            "Enum.reduce_while(0..9, :ok, fn i, _ -> try do"
                + " if i == 3 do throw(:break) end; Log.trace(i); {:cont, :ok}"
                + " catch :throw, :break -> {:halt, :ok} end end)");
    roundTrip.assertSameBehavior();
    assertThat(roundTrip.target.output).hasSize(3);
  }

  @Test
  public void continueResumesWithState() {
    Variable total = b.intVar("total");
    Variable i = b.intVar("i");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(total, b.i(0)),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(6),
                    b.ifThen(
                        b.bin(Binop.EQ, b.bin(Binop.MOD, b.ref(i), b.i(2)), b.i(1)), b.cont()),
                    b.addAssign(total, b.ref(i)))));
    assertThat(roundTrip.compiled.get(1).toString())
        .isEqualTo(
            "total = Enum.reduce(0..5, total, fn i, total -> try do"
                + " if rem(i, 2) == 1 do throw({:continue, total}) end; total + i"
                + " catch :throw, {:continue, continue_state} -> continue_state end end)");
    roundTrip.assertSameBehavior(total);
    assertThat(Values.show(roundTrip.targetValue(total))).isEqualTo("6");
  }

  @Test
  public void unrecognizedWhileFallsBack() {
    Variable x = b.intVar("x");
    ImmutableList<SourceExpr> program =
        ImmutableList.of(
            b.decl(x, b.i(1)),
            b.whileLoop(
                b.lt(b.ref(x), b.i(100)),
                b.assign(x, b.bin(Binop.MUL, b.ref(x), b.i(2)))));
    RoundTrip roundTrip = RoundTrip.run(program);
    assertThat(roundTrip.compiled.get(1).toString())
        .isEqualTo(
            "x = Enum.reduce_while(Stream.iterate(0, fn n -> n + 1 end), x, fn _, x ->"
                + " if x < 100 do x = x * 2; {:cont, x} else {:halt, x} end end)");
    roundTrip.assertSameBehavior(x);
    assertThat(Values.show(roundTrip.targetValue(x))).isEqualTo("128");
    assertThat(onlyLoop(roundTrip).strategy).isEqualTo(EmissionStrategy.FALLBACK);

    // Compiling the same program again gives the same output.
    assertThat(RoundTrip.run(program).text()).isEqualTo(roundTrip.text());
  }

  @Test
  public void doWhileRunsBodyFirst() {
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(x, b.i(1)),
                b.doWhile(
                    b.lt(b.ref(x), b.i(50)), b.assign(x, b.bin(Binop.MUL, b.ref(x), b.i(3))))));
    assertThat(roundTrip.compiled.get(1).toString())
        .isEqualTo(
            "x = Enum.reduce_while(Stream.iterate(0, fn n -> n + 1 end), x, fn _, x ->"
                + " x = x * 3; if x < 50 do {:cont, x} else {:halt, x} end end)");
    roundTrip.assertSameBehavior(x);
    assertThat(Values.show(roundTrip.targetValue(x))).isEqualTo("81");
  }

  @Test
  public void returnFromLoopInsideFunction() {
    Variable list = b.listVar("list");
    Variable x = b.intVar("x");
    SourceExpr.Function find =
        b.function(
            ImmutableList.of(list),
            b.forEach(
                x, b.ref(list), b.ifThen(b.bin(Binop.GT, b.ref(x), b.i(2)), b.ret(b.ref(x)))),
            b.ret(b.i(-1)));
    ExpressionCompiler compiler = new ExpressionCompiler();
    String compiled = compiler.compile(find).toString();
    assertThat(compiled)
        .isEqualTo(
            "fn list -> try do"
                + " Enum.reduce(list, :ok, fn x, _ ->"
                + " if x > 2 do throw({:return, x}) end; :ok end);"
                + " -1 catch :throw, {:return, return_value} -> return_value end end");
    assertThat(compiler.provenance().get(0).hasNonLocalReturn).isTrue();

    SourceEvaluator source = new SourceEvaluator();
    TargetEvaluator target = new TargetEvaluator();
    Object sourceFn = source.eval(find);
    Object targetFn = target.eval(compiler.compile(find), new HashMap<>());
    for (List<Object> input : List.<List<Object>>of(List.of(1, 5, 3), List.of(1, 2))) {
      assertThat(Values.show(target.call(targetFn, input)))
          .isEqualTo(Values.show(source.call(sourceFn, input)));
    }
  }

  @Test
  public void unrolledSequenceBecomesComprehension() {
    Variable r = b.listVar("r");
    Variable acc = b.listVar("acc");
    RoundTrip roundTrip =
        RoundTrip.run(
            ImmutableList.of(
                b.decl(
                    r,
                    b.valueBlock(
                        SourceBuilder.INT_ARRAY,
                        b.decl(acc, b.emptyList()),
                        b.push(acc, b.bin(Binop.MUL, b.i(0), b.i(2))),
                        b.push(acc, b.bin(Binop.MUL, b.i(1), b.i(2))),
                        b.push(acc, b.bin(Binop.MUL, b.i(2), b.i(2))),
                        b.ref(acc)))));
    assertThat(roundTrip.text()).isEqualTo("r = for i <- 0..2, do: i * 2");
    roundTrip.assertSameBehavior(r);
    LoopProvenance provenance = onlyLoop(roundTrip);
    assertThat(provenance.shapeKind).isEqualTo(CandidateShape.Kind.UNROLLED_RANGE);
    assertThat(provenance.loose).isFalse();
  }

  private ImmutableList<SourceExpr> looseUnrolled(Variable r, Variable acc, Variable x) {
    return ImmutableList.of(
        b.decl(
            r,
            b.valueBlock(
                SourceBuilder.INT_ARRAY,
                b.decl(acc, b.emptyList()),
                b.push(acc, b.add(b.ref(x), b.i(0))),
                b.push(acc, b.add(b.ref(x), b.i(1))),
                b.push(acc, b.add(b.ref(x), b.i(2))),
                b.ref(acc))));
  }

  @Test
  public void looseUnrolledSequence() {
    Variable r = b.listVar("r");
    Variable acc = b.listVar("acc");
    Variable x = b.intVar("x");
    RoundTrip roundTrip =
        RoundTrip.run(looseUnrolled(r, acc, x), RoundTrip.inputs().put(x, 10).build());
    assertThat(roundTrip.text()).isEqualTo("r = for i <- 0..2, do: x + i");
    roundTrip.assertSameBehavior(r);
    LoopProvenance provenance = onlyLoop(roundTrip);
    assertThat(provenance.loose).isTrue();
    assertThat(provenance.confidence).isLessThan(0.8);
  }

  @Test
  public void looseUnrolledSequenceBelowThreshold() {
    Variable r = b.listVar("r");
    Variable acc = b.listVar("acc");
    Variable x = b.intVar("x");
    EngineConfig config = EngineConfig.parse("confidenceThreshold=0.8");
    RoundTrip roundTrip =
        RoundTrip.run(config, looseUnrolled(r, acc, x), RoundTrip.inputs().put(x, 10).build());
    assertThat(roundTrip.text()).doesNotContain("for ");
    assertThat(roundTrip.text()).contains("acc = acc ++ [x + 1]");
    roundTrip.assertSameBehavior(r);
  }

  @Test
  public void nestingLimitForcesFallback() {
    Variable total = b.intVar("total");
    Variable i = b.intVar("i");
    Variable j = b.intVar("j");
    EngineConfig config = EngineConfig.builder().setMaxNestingDepth(1).build();
    RoundTrip roundTrip =
        RoundTrip.run(
            config,
            ImmutableList.of(
                b.decl(total, b.i(0)),
                b.forRange(
                    i,
                    b.i(0),
                    b.i(3),
                    b.forRange(j, b.i(0), b.i(3), b.addAssign(total, b.add(b.ref(i), b.ref(j)))))),
            Map.of());
    roundTrip.assertSameBehavior(total);
    ImmutableList<LoopProvenance> provenance = roundTrip.compiler.provenance();
    assertThat(provenance).hasSize(2);
    assertThat(provenance.get(0).strategy).isEqualTo(EmissionStrategy.FALLBACK);
    assertThat(provenance.get(1).strategy).isEqualTo(EmissionStrategy.FOLD_REDUCE);
  }
}
