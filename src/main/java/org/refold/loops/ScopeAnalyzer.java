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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Assign;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/** Determines which variables a loop captures, declares and threads. */
public final class ScopeAnalyzer {

  /**
   * Analyzes a loop that binds {@code loopVars}, evaluates {@code iterator} once, and runs {@code
   * body} for each element; {@code preceding} are the statements before the loop in its enclosing
   * block, used to find the starting values of accumulators.
   */
  public static VariableScopeAnalysis analyzeVariableScopes(
      Collection<Variable> loopVars,
      List<SourceExpr> iterator,
      SourceExpr body,
      List<SourceExpr> preceding) {
    ImmutableSortedSet<Variable> loopLocals =
        ImmutableSortedSet.<Variable>naturalOrder()
            .addAll(loopVars)
            .addAll(SourceTrees.declaredVariables(body))
            .build();
    Map<String, Variable> free = new TreeMap<>();
    ImmutableList<SourceExpr> all =
        ImmutableList.<SourceExpr>builder().addAll(iterator).add(body).build();
    for (Variable v : SourceTrees.referencedVariables(all)) {
      if (!loopLocals.contains(v)) {
        // Variables are visited in declaration order, so an earlier one wins a name clash.
        free.putIfAbsent(v.name, v);
      }
    }
    ImmutableSortedSet<Variable> accumulators =
        ImmutableSortedSet.copyOf(
            EffectAnalyzer.detectMutatedVariables(body).stream()
                .filter(v -> !loopLocals.contains(v))
                .iterator());
    ImmutableMap.Builder<Variable, SourceExpr> seeds = ImmutableMap.builder();
    for (Variable v : accumulators) {
      SourceExpr seed = findSeed(v, preceding);
      if (seed != null) {
        seeds.put(v, seed);
      }
    }
    return new VariableScopeAnalysis(
        ImmutableSortedMap.copyOf(free),
        loopLocals,
        accumulators,
        seeds.buildOrThrow());
  }

  /**
   * Returns the value assigned to {@code v} by the last preceding statement that mentions it, if
   * that statement is a declaration or plain assignment of {@code v}.
   */
  private static @Nullable SourceExpr findSeed(Variable v, List<SourceExpr> preceding) {
    for (int i = preceding.size() - 1; i >= 0; i--) {
      SourceExpr stmt = preceding.get(i);
      if (stmt instanceof VarDecl decl && decl.variable.equals(v)) {
        return decl.init;
      } else if (stmt instanceof Assign assign
          && SourceTrees.isLocal(assign.target, v)
          && !SourceTrees.references(assign.value, v)) {
        return assign.value;
      } else if (SourceTrees.references(stmt, v)) {
        return null;
      }
    }
    return null;
  }

  private ScopeAnalyzer() {}
}
