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
import org.refold.target.TargetExpr.For;

/**
 * Emits a {@code for} comprehension with one generator per loop level and the guards of
 * conditional appends as filters.
 */
final class ComprehensionEmitter extends LoopEmitter {

  ComprehensionEmitter(EmitSupport support) {
    super(support);
  }

  @Override
  ImmutableList<TargetExpr> emit(LoopIr ir) {
    Preconditions.checkArgument(ir.yieldShape != null, "Not a comprehension: %s", ir);
    List<SourceExpr> uses = yieldUses(ir);
    List<TargetExpr> patterns = new ArrayList<>();
    for (LoopIr.Clause clause : ir.clauses) {
      if (clause.isGenerator()) {
        patterns.add(support.pattern(clause.binder, uses));
      }
    }
    TargetExpr comprehension =
        support.withReserved(
            patterns,
            () -> {
              ImmutableList.Builder<For.Clause> clauses = ImmutableList.builder();
              int next = 0;
              for (LoopIr.Clause clause : ir.clauses) {
                if (clause.isGenerator()) {
                  clauses.add(
                      For.Clause.generator(patterns.get(next++), support.source(clause.source)));
                } else {
                  clauses.add(For.Clause.filter(support.expr(clause.filter)));
                }
              }
              return new For(clauses.build(), yieldBody(ir));
            });
    return collect(ir, support.var(ir.yieldShape.target), comprehension);
  }
}
