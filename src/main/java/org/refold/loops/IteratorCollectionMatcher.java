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
import java.util.Collections;
import java.util.Optional;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceExpr.While;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Matches {@code var it = c.iterator(); while (it.hasNext()) { var x = it.next(); ... }}, which
 * iterates over the elements of {@code c}.
 */
final class IteratorCollectionMatcher implements ShapeMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double CONFIDENCE = 0.85;

  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    VarDecl iteratorDecl = Shapes.initializedDecl(context.current());
    if (iteratorDecl == null) {
      return Optional.empty();
    }
    SourceExpr collection = Shapes.receiverOf(iteratorDecl.init, "iterator");
    Variable iterator = iteratorDecl.variable;
    if (collection == null
        || !(context.at(1) instanceof While loop)
        || !loop.normalWhile
        || !Shapes.isMethodCall(loop.cond, iterator, "hasNext", 0)) {
      return Optional.empty();
    }
    ImmutableList<SourceExpr> body = SourceTrees.statements(loop.body);
    VarDecl elementDecl = body.isEmpty() ? null : Shapes.initializedDecl(body.get(0));
    if (elementDecl == null || !Shapes.isMethodCall(elementDecl.init, iterator, "next", 0)) {
      return Optional.empty();
    }
    ImmutableList<SourceExpr> userCode = body.subList(1, body.size());
    if (SourceTrees.referencesAny(userCode, Collections.singleton(iterator))
        || SourceTrees.referencesAny(context.following(2), Collections.singleton(iterator))) {
      logger.atFine().log("Iterator loop rejected: %s used outside the protocol", iterator);
      return Optional.empty();
    }
    if (!Collections.disjoint(
        EffectAnalyzer.detectMutatedVariables(userCode),
        SourceTrees.referencedVariables(collection))) {
      logger.atFine().log("Iterator loop rejected: body modifies the collection");
      return Optional.empty();
    }
    return Optional.of(
        CandidateShape.loop(
            CandidateShape.Kind.ITERATOR_COLLECTION,
            CONFIDENCE,
            2,
            loop,
            Binder.single(elementDecl.variable),
            IterationSource.collection(collection),
            SourceTrees.block(loop.body.pos, userCode),
            ImmutableSet.of(iterator)));
  }
}
