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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Block;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Builds the {@link LoopIr} for a loop: runs the shape matchers in priority order, takes the first
 * match, and decorates it with the effect and scope analyzers' findings.
 */
final class LoopAnalyzer {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final EffectAnalyzer effects;
  private final PushMatcher pushes = new PushMatcher();
  private final UnrolledRangeMatcher unrolled = new UnrolledRangeMatcher();

  /**
   * In descending order of confidence; the first match wins. A loose unrolled sequence scores
   * below an indexed loop, but the two shapes never start at the same statement.
   */
  private final ImmutableList<ShapeMatcher> matchers;

  LoopAnalyzer(EngineConfig config) {
    this.effects = new EffectAnalyzer(config);
    this.matchers =
        ImmutableList.of(
            new RangeLoopMatcher(),
            new CounterLoopMatcher(),
            unrolled,
            new IndexedCollectionMatcher(),
            new KeyValueIteratorMatcher(),
            new IteratorCollectionMatcher());
  }

  /** Returns the IR for a loop shape starting at the context's current statement, if any. */
  Optional<LoopIr> analyzeAt(MatchContext context) {
    return findShape(context).map(shape -> decorate(shape, context, false));
  }

  private Optional<CandidateShape> findShape(MatchContext context) {
    for (ShapeMatcher matcher : matchers) {
      Optional<CandidateShape> shape = matcher.match(context);
      if (shape.isPresent()) {
        logger.atFine().log("Matched %s", shape.get());
        return shape;
      }
    }
    return Optional.empty();
  }

  /** Returns the IR for a standalone FOR or WHILE node. */
  LoopIr analyzeLoop(SourceExpr loop, MatchContext context) {
    if (loop instanceof SourceExpr.For forLoop) {
      return decorate(RangeLoopMatcher.matchFor(forLoop), context, false);
    }
    return decorate(CandidateShape.unrecognized((SourceExpr.While) loop), context, false);
  }

  /**
   * Returns the IR for a block whose value is a list built by a loop, or by an unrolled sequence of
   * appends. The returned IR is in value mode.
   */
  Optional<LoopIr> analyzeListBlock(Block block, MatchContext context) {
    Optional<CandidateShape> shape = unrolled.matchBlock(block, context);
    if (shape.isPresent()) {
      return Optional.of(decorate(shape.get(), context, true));
    }
    ImmutableList<SourceExpr> statements = block.statements;
    int size = statements.size();
    if (size < 3
        || !(statements.get(0) instanceof VarDecl decl)
        || decl.init == null
        || !SourceTrees.isEmptyArray(decl.init)
        || !SourceTrees.isLocal(statements.get(size - 1), decl.variable)) {
      return Optional.empty();
    }
    MatchContext loopContext =
        new MatchContext(statements, 1, context.config, context.names, context.naming);
    shape = findShape(loopContext);
    if (shape.isEmpty() || shape.get().consumed != size - 2) {
      return Optional.empty();
    }
    LoopIr ir = decorate(shape.get().asListBuildingBlock(size), loopContext, true);
    if (ir.yieldShape == null || !decl.variable.equals(ir.collectTarget)) {
      return Optional.empty();
    }
    return Optional.of(ir);
  }

  private LoopIr decorate(CandidateShape shape, MatchContext context, boolean valueMode) {
    ImmutableList<SourceExpr> preceding = context.preceding();
    ImmutableList<Variable> binderVars = shape.binder.variables();
    if (shape.presetYield != null) {
      YieldShape preset = shape.presetYield;
      return new LoopIr(
          shape,
          ImmutableList.of(LoopIr.Clause.generator(shape.binder, shape.source)),
          null,
          preset,
          valueMode,
          true,
          ImmutableSortedSet.of(),
          null,
          ScopeAnalyzer.analyzeVariableScopes(
              binderVars, shape.source.expressions(), preset.value, preceding),
          false,
          ExitSummary.NONE,
          shape.confidence);
    }
    SourceExpr body = shape.body;
    if (shape.kind == CandidateShape.Kind.UNRECOGNIZED_WHILE) {
      SourceExpr.While loop = (SourceExpr.While) shape.loop;
      return new LoopIr(
          shape,
          ImmutableList.of(),
          body,
          null,
          false,
          false,
          EffectAnalyzer.detectMutatedVariables(ImmutableList.of(loop.cond, body)),
          effects.detectAccumulationPattern(body).orElse(null),
          ScopeAnalyzer.analyzeVariableScopes(
              ImmutableList.of(), ImmutableList.of(loop.cond), body, preceding),
          effects.hasSideEffectsOnly(body),
          EffectAnalyzer.findExits(body),
          0);
    }

    VariableScopeAnalysis scope =
        ScopeAnalyzer.analyzeVariableScopes(
            binderVars, shape.source.expressions(), body, preceding);
    ImmutableList.Builder<LoopIr.Clause> clauses = ImmutableList.builder();
    clauses.add(LoopIr.Clause.generator(shape.binder, shape.source));
    YieldShape yieldShape = pushes.match(body).orElse(null);
    if (yieldShape != null && !isValidTarget(yieldShape.target, shape, scope)) {
      yieldShape = null;
    }
    if (yieldShape != null && yieldShape.guard != null) {
      clauses.add(LoopIr.Clause.filter(yieldShape.guard));
    }
    double confidence = shape.confidence;
    if (yieldShape == null) {
      LoopIr inner = nestedYield(shape, scope, body, context);
      if (inner != null) {
        logger.atFine().log("Flattening nested yield into %s", inner.collectTarget);
        clauses.addAll(inner.clauses);
        yieldShape = inner.yieldShape;
        confidence = Math.min(confidence, inner.confidence);
      }
    }

    // The accumulators already exclude the binders; erased counters and the yield target are
    // rebuilt by the emitted construct and are not threaded either.
    Set<Variable> excluded =
        (yieldShape == null)
            ? shape.erased
            : ImmutableSet.<Variable>builder().addAll(shape.erased).add(yieldShape.target).build();
    ImmutableSortedSet<Variable> mutated =
        ImmutableSortedSet.copyOf(
            scope.accumulators.stream().filter(v -> !excluded.contains(v)).iterator());
    return new LoopIr(
        shape,
        clauses.build(),
        body,
        yieldShape,
        valueMode,
        yieldShape != null && (valueMode || scope.isSeededEmpty(yieldShape.target)),
        mutated,
        effects.detectAccumulationPattern(body).orElse(null),
        scope,
        effects.hasSideEffectsOnly(body),
        EffectAnalyzer.findExits(body),
        confidence);
  }

  /**
   * Returns true if {@code target} can collect the values yielded by a loop of the given shape: it
   * must be bound outside the loop and not read by the loop's source.
   */
  private static boolean isValidTarget(
      Variable target, CandidateShape shape, VariableScopeAnalysis scope) {
    return !scope.loopLocals.contains(target)
        && !shape.erased.contains(target)
        && !SourceTrees.referencesAny(shape.source.expressions(), ImmutableSet.of(target));
  }

  /**
   * If {@code body} consists of nothing but another loop that yields into a list bound outside the
   * outer loop, returns the IR of that inner loop.
   */
  private @Nullable LoopIr nestedYield(
      CandidateShape shape, VariableScopeAnalysis scope, SourceExpr body, MatchContext context) {
    ImmutableList<SourceExpr> statements = SourceTrees.statements(body);
    if (statements.isEmpty()) {
      return null;
    }
    MatchContext innerContext = context.nested(statements);
    Optional<CandidateShape> innerShape = findShape(innerContext);
    if (innerShape.isEmpty()
        || innerShape.get().consumed != statements.size()
        || innerShape.get().kind == CandidateShape.Kind.UNROLLED_RANGE) {
      return null;
    }
    LoopIr inner = decorate(innerShape.get(), innerContext, false);
    if (inner.yieldShape == null || !isValidTarget(inner.yieldShape.target, shape, scope)) {
      return null;
    }
    return inner;
  }
}
