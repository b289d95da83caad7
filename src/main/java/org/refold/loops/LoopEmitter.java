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
import java.util.ArrayList;
import java.util.List;
import org.refold.source.SourceExpr;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Binary;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.Operator;
import org.refold.target.TargetExpr.Var;

/** Emits the target statements for a loop with one particular {@link EmissionStrategy}. */
abstract class LoopEmitter {
  final EmitSupport support;

  LoopEmitter(EmitSupport support) {
    this.support = support;
  }

  /**
   * Returns the target statements for the loop, or (if {@code ir.valueMode}) a single expression
   * whose value is the list it builds.
   */
  abstract ImmutableList<TargetExpr> emit(LoopIr ir);

  /** Returns the source expressions that decide whether a yielding loop's binders are used. */
  static List<SourceExpr> yieldUses(LoopIr ir) {
    YieldShape yieldShape = ir.yieldShape;
    List<SourceExpr> uses = new ArrayList<>(yieldShape.prefix);
    uses.add(yieldShape.value);
    for (LoopIr.Clause clause : ir.clauses) {
      if (clause.isGenerator()) {
        uses.addAll(clause.source.expressions());
      } else {
        uses.add(clause.filter);
      }
    }
    return uses;
  }

  /** Compiles the yield's prefix declarations followed by its value. */
  TargetExpr yieldBody(LoopIr ir) {
    YieldShape yieldShape = Preconditions.checkNotNull(ir.yieldShape);
    List<TargetExpr> statements = new ArrayList<>();
    for (SourceExpr decl : yieldShape.prefix) {
      statements.addAll(support.statements(decl));
    }
    statements.add(support.expr(yieldShape.value));
    return TargetExpr.Block.of(statements);
  }

  /**
   * Returns the statements that store {@code list} into the loop's collect target: a plain
   * assignment if the target is known to start empty, otherwise an append to its current value.
   */
  static ImmutableList<TargetExpr> collect(LoopIr ir, Var target, TargetExpr list) {
    if (ir.valueMode) {
      return ImmutableList.of(list);
    } else if (ir.seedKnownEmpty) {
      return ImmutableList.of(new Match(target, list));
    }
    return ImmutableList.of(new Match(target, new Binary(Operator.LIST_CONCAT, target, list)));
  }
}
