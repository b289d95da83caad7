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
import com.google.common.flogger.FluentLogger;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Binary;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceExpr.While;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Matches the counter-increment desugaring of a range loop:
 *
 * <pre>
 * var g = start;
 * var g1 = limit;       // optional
 * while (g < g1) {      // or g <= g1
 *   var i = g++;        // or: var i = g; g++;   or: var i = g; ...; g = g + 1
 *   ...
 * }
 * </pre>
 *
 * The counter {@code g} and limit {@code g1} are erased; {@code i} becomes the range binder.
 */
final class CounterLoopMatcher implements ShapeMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double CONFIDENCE = 0.95;

  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    VarDecl counterDecl = Shapes.initializedDecl(context.current());
    if (counterDecl == null || !counterDecl.variable.type.isNumeric()) {
      return Optional.empty();
    }
    Variable counter = counterDecl.variable;
    VarDecl limitDecl = null;
    int whileOffset = 1;
    if (!(context.at(1) instanceof While)) {
      limitDecl = Shapes.initializedDecl(context.at(1));
      whileOffset = 2;
      if (limitDecl == null) {
        return Optional.empty();
      }
    }
    if (!(context.at(whileOffset) instanceof While loop)
        || !loop.normalWhile
        || !(loop.cond instanceof Binary cond)
        || (cond.op != Binop.LT && cond.op != Binop.LE)
        || !SourceTrees.isLocal(cond.left, counter)) {
      return Optional.empty();
    }
    SourceExpr limit;
    if (limitDecl != null) {
      if (!SourceTrees.isLocal(cond.right, limitDecl.variable)) {
        return Optional.empty();
      }
      limit = limitDecl.init;
    } else {
      limit = cond.right;
    }
    if (SourceTrees.references(limit, counter)) {
      return Optional.empty();
    }

    Header header = matchHeader(SourceTrees.statements(loop.body), counter);
    if (header == null) {
      return Optional.empty();
    }
    ImmutableSet<Variable> erased =
        (limitDecl == null)
            ? ImmutableSet.of(counter)
            : ImmutableSet.of(counter, limitDecl.variable);
    if (SourceTrees.referencesAny(header.userCode, erased)) {
      logger.atFine().log("Counter loop rejected: body refers to %s", erased);
      return Optional.empty();
    }
    // Without a limit declaration the bound is re-evaluated on each iteration.
    Set<Variable> mustNotChange =
        (limitDecl == null) ? SourceTrees.referencedVariables(limit) : ImmutableSet.of();
    for (Variable v : EffectAnalyzer.detectMutatedVariables(header.userCode)) {
      if (erased.contains(v) || mustNotChange.contains(v)) {
        logger.atFine().log("Counter loop rejected: body assigns %s", v);
        return Optional.empty();
      }
    }
    int consumed = whileOffset + 1;
    if (SourceTrees.referencesAny(context.following(consumed), erased)) {
      logger.atFine().log("Counter loop rejected: %s used after the loop", erased);
      return Optional.empty();
    }
    return Optional.of(
        CandidateShape.loop(
            CandidateShape.Kind.COUNTER_RANGE,
            CONFIDENCE,
            consumed,
            loop,
            Binder.single(header.binder),
            IterationSource.range(counterDecl.init, limit, cond.op == Binop.LE),
            SourceTrees.block(loop.body.pos, header.userCode),
            erased));
  }

  /** The user's binder (if any) and the statements that remain once the counter is erased. */
  private static final class Header {
    final @Nullable Variable binder;
    final ImmutableList<SourceExpr> userCode;

    Header(@Nullable Variable binder, ImmutableList<SourceExpr> userCode) {
      this.binder = binder;
      this.userCode = userCode;
    }
  }

  private static @Nullable Header matchHeader(ImmutableList<SourceExpr> body, Variable counter) {
    int size = body.size();
    if (size == 0) {
      return null;
    }
    VarDecl first = Shapes.initializedDecl(body.get(0));
    if (first != null && Shapes.isPostIncrement(first.init, counter)) {
      // var i = g++; ...
      return new Header(first.variable, body.subList(1, size));
    }
    boolean trailingIncrement = size >= 2 && Shapes.isIncrement(body.get(size - 1), counter);
    if (first != null && SourceTrees.isLocal(first.init, counter)) {
      if (size >= 2 && Shapes.isIncrement(body.get(1), counter)) {
        // var i = g; g++; ...
        return new Header(first.variable, body.subList(2, size));
      } else if (trailingIncrement) {
        // var i = g; ...; g = g + 1
        return trailingHeader(first.variable, body.subList(1, size - 1));
      }
      return null;
    }
    if (Shapes.isIncrement(body.get(0), counter)) {
      return new Header(null, body.subList(1, size));
    } else if (trailingIncrement) {
      return trailingHeader(null, body.subList(0, size - 1));
    }
    return null;
  }

  /**
   * A trailing increment is skipped by {@code continue}, so the loop does not behave like a range
   * loop if the user code continues.
   */
  private static @Nullable Header trailingHeader(
      @Nullable Variable binder, ImmutableList<SourceExpr> userCode) {
    if (EffectAnalyzer.findExits(userCode).hasContinue) {
      logger.atFine().log("Counter loop rejected: continue skips the trailing increment");
      return null;
    }
    return new Header(binder, userCode);
  }
}
