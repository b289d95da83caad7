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
import org.refold.source.SourceExpr.Field;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceExpr.While;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Matches iteration over the entries of a map through the key/value iterator protocol:
 *
 * <pre>
 * var it = map.keyValueIterator();
 * while (it.hasNext()) {
 *   var kv = it.next();
 *   var k = kv.key;       // either extraction may be missing
 *   var v = kv.value;
 *   ...
 * }
 * </pre>
 *
 * A single extraction may also read directly from the iterator, as in {@code var v =
 * it.next().value}.
 */
final class KeyValueIteratorMatcher implements ShapeMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double CONFIDENCE = 0.85;

  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    VarDecl iteratorDecl = Shapes.initializedDecl(context.current());
    if (iteratorDecl == null) {
      return Optional.empty();
    }
    SourceExpr map = Shapes.receiverOf(iteratorDecl.init, "keyValueIterator");
    Variable iterator = iteratorDecl.variable;
    if (map == null
        || !(context.at(1) instanceof While loop)
        || !loop.normalWhile
        || !Shapes.isMethodCall(loop.cond, iterator, "hasNext", 0)) {
      return Optional.empty();
    }
    ImmutableList<SourceExpr> body = SourceTrees.statements(loop.body);
    if (body.isEmpty()) {
      return Optional.empty();
    }
    Variable key = null;
    Variable value = null;
    Variable entry = null;
    int start;
    VarDecl first = Shapes.initializedDecl(body.get(0));
    if (first != null && Shapes.isMethodCall(first.init, iterator, "next", 0)) {
      entry = first.variable;
      start = 1;
      while (start < body.size()) {
        VarDecl extraction = Shapes.initializedDecl(body.get(start));
        if (extraction == null
            || !(extraction.init instanceof Field field)
            || !SourceTrees.isLocal(field.object, entry)) {
          break;
        }
        if (field.name.equals("key") && key == null) {
          key = extraction.variable;
        } else if (field.name.equals("value") && value == null) {
          value = extraction.variable;
        } else {
          break;
        }
        start++;
      }
    } else if (first != null
        && first.init instanceof Field field
        && Shapes.isMethodCall(field.object, iterator, "next", 0)
        && (field.name.equals("key") || field.name.equals("value"))) {
      if (field.name.equals("key")) {
        key = first.variable;
      } else {
        value = first.variable;
      }
      start = 1;
    } else {
      return Optional.empty();
    }

    ImmutableList<SourceExpr> userCode = body.subList(start, body.size());
    ImmutableSet<Variable> erased =
        (entry == null) ? ImmutableSet.of(iterator) : ImmutableSet.of(iterator, entry);
    if (SourceTrees.referencesAny(userCode, erased)) {
      logger.atFine().log("Key/value loop rejected: body refers to %s", erased);
      return Optional.empty();
    }
    if (!Collections.disjoint(
        EffectAnalyzer.detectMutatedVariables(userCode), SourceTrees.referencedVariables(map))) {
      logger.atFine().log("Key/value loop rejected: body modifies the map");
      return Optional.empty();
    }
    if (SourceTrees.referencesAny(context.following(2), ImmutableSet.of(iterator))) {
      return Optional.empty();
    }
    return Optional.of(
        CandidateShape.loop(
            CandidateShape.Kind.KEY_VALUE_ITERATION,
            CONFIDENCE,
            2,
            loop,
            Binder.keyValue(key, value),
            IterationSource.keyValue(map),
            SourceTrees.block(loop.body.pos, userCode),
            erased));
  }
}
