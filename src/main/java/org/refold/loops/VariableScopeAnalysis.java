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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/** The result of {@link ScopeAnalyzer#analyzeVariableScopes}. */
public final class VariableScopeAnalysis {

  /**
   * Variables referenced by the loop but bound outside it, by name. The emitted closure captures
   * them lexically.
   */
  public final ImmutableSortedMap<String, Variable> freeVariables;

  /** Variables bound by the loop itself or declared within its body. */
  public final ImmutableSortedSet<Variable> loopLocals;

  /** Outer variables that the body assigns, each of which must be threaded through the loop. */
  public final ImmutableSortedSet<Variable> accumulators;

  /**
   * The value each accumulator holds when the loop starts, where that can be determined from the
   * statements that precede the loop.
   */
  public final ImmutableMap<Variable, SourceExpr> seeds;

  VariableScopeAnalysis(
      ImmutableSortedMap<String, Variable> freeVariables,
      ImmutableSortedSet<Variable> loopLocals,
      ImmutableSortedSet<Variable> accumulators,
      ImmutableMap<Variable, SourceExpr> seeds) {
    this.freeVariables = freeVariables;
    this.loopLocals = loopLocals;
    this.accumulators = accumulators;
    this.seeds = seeds;
  }

  public @Nullable SourceExpr seedOf(Variable variable) {
    return seeds.get(variable);
  }

  /** Returns true if {@code variable} is known to hold an empty list when the loop starts. */
  public boolean isSeededEmpty(Variable variable) {
    SourceExpr seed = seeds.get(variable);
    return seed != null && SourceTrees.isEmptyArray(seed);
  }
}
