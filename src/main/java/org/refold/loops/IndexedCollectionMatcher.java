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
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Binary;
import org.refold.source.SourceExpr.Const;
import org.refold.source.SourceExpr.Field;
import org.refold.source.SourceExpr.Index;
import org.refold.source.SourceExpr.Local;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceExpr.While;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Matches a loop over the elements of an array by index:
 *
 * <pre>
 * var g = 0;
 * var g1 = array;       // optional
 * while (g < g1.length) {
 *   var x = g1[g];      // or: var x = g1[g++];
 *   ++g;
 *   ...
 * }
 * </pre>
 */
final class IndexedCollectionMatcher implements ShapeMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double CONFIDENCE = 0.9;

  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    VarDecl indexDecl = Shapes.initializedDecl(context.current());
    if (indexDecl == null
        || !(indexDecl.init instanceof Const start)
        || !start.isInt()
        || start.intValue() != 0) {
      return Optional.empty();
    }
    Variable index = indexDecl.variable;
    VarDecl arrayDecl = null;
    int whileOffset = 1;
    if (!(context.at(1) instanceof While)) {
      arrayDecl = Shapes.initializedDecl(context.at(1));
      whileOffset = 2;
      if (arrayDecl == null) {
        return Optional.empty();
      }
    }
    if (!(context.at(whileOffset) instanceof While loop)
        || !loop.normalWhile
        || !(loop.cond instanceof Binary cond)
        || cond.op != Binop.LT
        || !SourceTrees.isLocal(cond.left, index)
        || !(cond.right instanceof Field length)
        || !length.name.equals("length")
        || !(length.object instanceof Local arrayRef)) {
      return Optional.empty();
    }
    Variable array = arrayRef.variable;
    if (arrayDecl != null && !arrayDecl.variable.equals(array)) {
      return Optional.empty();
    }

    ImmutableList<SourceExpr> body = SourceTrees.statements(loop.body);
    VarDecl elementDecl = body.isEmpty() ? null : Shapes.initializedDecl(body.get(0));
    if (elementDecl == null
        || !(elementDecl.init instanceof Index read)
        || !SourceTrees.isLocal(read.object, array)) {
      return Optional.empty();
    }
    ImmutableList<SourceExpr> userCode;
    if (Shapes.isPostIncrement(read.index, index)) {
      userCode = body.subList(1, body.size());
    } else if (SourceTrees.isLocal(read.index, index)
        && body.size() >= 2
        && Shapes.isIncrement(body.get(1), index)) {
      userCode = body.subList(2, body.size());
    } else {
      return Optional.empty();
    }

    ImmutableSet<Variable> erased =
        (arrayDecl == null) ? ImmutableSet.of(index) : ImmutableSet.of(index, array);
    if (SourceTrees.referencesAny(userCode, erased)) {
      logger.atFine().log("Indexed loop rejected: body refers to %s", erased);
      return Optional.empty();
    }
    SourceExpr collection = (arrayDecl == null) ? arrayRef : arrayDecl.init;
    ImmutableSet<Variable> collectionVars =
        ImmutableSet.<Variable>builder()
            .add(array)
            .addAll(SourceTrees.referencedVariables(collection))
            .build();
    for (Variable v : EffectAnalyzer.detectMutatedVariables(userCode)) {
      if (collectionVars.contains(v)) {
        logger.atFine().log("Indexed loop rejected: body modifies %s", v);
        return Optional.empty();
      }
    }
    int consumed = whileOffset + 1;
    if (SourceTrees.referencesAny(context.following(consumed), erased)) {
      logger.atFine().log("Indexed loop rejected: %s used after the loop", erased);
      return Optional.empty();
    }
    return Optional.of(
        CandidateShape.loop(
            CandidateShape.Kind.INDEXED_COLLECTION,
            CONFIDENCE,
            consumed,
            loop,
            Binder.single(elementDecl.variable),
            IterationSource.collection(collection),
            SourceTrees.block(loop.body.pos, userCode),
            erased));
  }
}
