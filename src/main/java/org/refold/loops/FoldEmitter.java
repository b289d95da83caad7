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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Fn;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.RemoteCall;

/**
 * Emits {@code Enum.reduce} (or {@code Enum.reduce_while}, if the loop can break) threading the
 * variables the body assigns through the fold, and rebinds them to the fold's result.
 */
final class FoldEmitter extends LoopEmitter {

  FoldEmitter(EmitSupport support) {
    super(support);
  }

  @Override
  ImmutableList<TargetExpr> emit(LoopIr ir) {
    Preconditions.checkArgument(ir.body != null && ir.clauses.size() == 1, "Not a fold: %s", ir);
    LoopIr.Clause generator = ir.clauses.get(0);
    TargetExpr source = support.source(generator.source);
    TargetExpr pattern = support.pattern(generator.binder, ImmutableList.of(ir.body));
    @Nullable TargetExpr state = support.state(ir.mutated);
    boolean haltable = ir.exits.hasBreak;
    ControlFlowLowering.Frame frame = support.lowering.pushLoop(state, haltable, null);
    List<TargetExpr> statements;
    try {
      statements =
          support.withReserved(ImmutableList.of(pattern), () -> support.statements(ir.body));
    } finally {
      support.lowering.popLoop(frame);
    }
    TargetExpr body = support.lowering.wrap(frame, finish(statements, frame));
    Fn fn = new Fn(ImmutableList.of(pattern, (state == null) ? TargetExpr.WILDCARD : state), body);
    TargetExpr fold =
        RemoteCall.of("Enum", haltable ? "reduce_while" : "reduce", source, frame.stateValue(), fn);
    return ImmutableList.of((state == null) ? fold : new Match(state, fold));
  }

  /**
   * Appends the fold function's result to the compiled body statements. When the last statement
   * just rebinds the state, its value is used directly.
   */
  private static TargetExpr finish(List<TargetExpr> statements, ControlFlowLowering.Frame frame) {
    TargetExpr current = frame.stateValue();
    int last = statements.size() - 1;
    if (!frame.haltable
        && frame.state != null
        && last >= 0
        && statements.get(last) instanceof Match match
        && match.pattern.equals(frame.state)) {
      statements.set(last, match.value);
    } else {
      statements.add(frame.haltable ? ControlFlowLowering.cont(current) : current);
    }
    return TargetExpr.Block.of(statements);
  }
}
