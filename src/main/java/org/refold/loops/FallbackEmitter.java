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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Binary;
import org.refold.target.TargetExpr.Fn;
import org.refold.target.TargetExpr.If;
import org.refold.target.TargetExpr.Literal;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.Operator;
import org.refold.target.TargetExpr.RemoteCall;
import org.refold.target.TargetExpr.Var;

/**
 * Emits the generic form of a loop: an {@code Enum.reduce_while} over its own source (or, for a
 * while loop, over an unbounded counting stream) that threads every variable the loop assigns and
 * tests the condition on each iteration. Preserves the loop's meaning whatever its shape.
 */
final class FallbackEmitter extends LoopEmitter {

  private static final Var COUNTER = new Var("n");

  FallbackEmitter(EmitSupport support) {
    super(support);
  }

  @Override
  ImmutableList<TargetExpr> emit(LoopIr ir) {
    SourceExpr loop = ir.shape.loop;
    if (loop instanceof SourceExpr.While whileLoop) {
      return emitWhile(ir, whileLoop);
    } else if (loop instanceof SourceExpr.For forLoop) {
      return emitFor(ir, forLoop);
    }
    throw new IllegalArgumentException("No fallback for " + ir);
  }

  private ImmutableList<TargetExpr> emitWhile(LoopIr ir, SourceExpr.While loop) {
    @Nullable TargetExpr state = support.state(ir.mutated);
    TargetExpr cond = support.expr(loop.cond);
    ControlFlowLowering.Frame frame =
        support.lowering.pushLoop(state, true, loop.normalWhile ? null : cond);
    List<TargetExpr> statements;
    try {
      statements = support.statements(loop.body);
    } finally {
      support.lowering.popLoop(frame);
    }
    TargetExpr current = frame.stateValue();
    TargetExpr body;
    if (loop.normalWhile) {
      statements.add(ControlFlowLowering.cont(current));
      body =
          new If(
              cond,
              support.lowering.wrap(frame, TargetExpr.Block.of(statements)),
              ControlFlowLowering.halt(current));
    } else {
      statements.add(
          new If(cond, ControlFlowLowering.cont(current), ControlFlowLowering.halt(current)));
      body = support.lowering.wrap(frame, TargetExpr.Block.of(statements));
    }
    TargetExpr counting =
        RemoteCall.of(
            "Stream",
            "iterate",
            new Literal(0),
            new Fn(ImmutableList.of(COUNTER), new Binary(Operator.ADD, COUNTER, new Literal(1))));
    return reduceWhile(counting, TargetExpr.WILDCARD, state, current, body);
  }

  private ImmutableList<TargetExpr> emitFor(LoopIr ir, SourceExpr.For loop) {
    LoopIr.Clause generator = ir.clauses.get(0);
    TargetExpr source = support.source(generator.source);
    TargetExpr pattern = support.pattern(generator.binder, ImmutableList.of(loop.body));
    @Nullable TargetExpr state = support.state(ir.mutated);
    ControlFlowLowering.Frame frame = support.lowering.pushLoop(state, true, null);
    List<TargetExpr> statements;
    try {
      statements =
          support.withReserved(ImmutableList.of(pattern), () -> support.statements(loop.body));
    } finally {
      support.lowering.popLoop(frame);
    }
    TargetExpr current = frame.stateValue();
    statements.add(ControlFlowLowering.cont(current));
    TargetExpr body = support.lowering.wrap(frame, TargetExpr.Block.of(statements));
    return reduceWhile(source, pattern, state, current, body);
  }

  private static ImmutableList<TargetExpr> reduceWhile(
      TargetExpr source,
      TargetExpr pattern,
      @Nullable TargetExpr state,
      TargetExpr initial,
      TargetExpr body) {
    Fn fn = new Fn(ImmutableList.of(pattern, (state == null) ? TargetExpr.WILDCARD : state), body);
    TargetExpr fold = RemoteCall.of("Enum", "reduce_while", source, initial, fn);
    return ImmutableList.of((state == null) ? fold : new Match(state, fold));
  }
}
