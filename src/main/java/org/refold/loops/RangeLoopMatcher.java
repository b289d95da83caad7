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

import com.google.common.collect.ImmutableSet;
import java.util.Optional;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.For;
import org.refold.source.SourceExpr.IntRange;

/** Matches {@code for (v in start...end)} and {@code for (v in collection)}. */
final class RangeLoopMatcher implements ShapeMatcher {

  static final double CONFIDENCE = 1.0;

  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    if (!(context.current() instanceof For loop)) {
      return Optional.empty();
    }
    return Optional.of(matchFor(loop));
  }

  /** Every FOR node has one of the two shapes recognized here. */
  static CandidateShape matchFor(For loop) {
    SourceExpr iterable = loop.iterable;
    if (iterable instanceof IntRange range) {
      return CandidateShape.loop(
          CandidateShape.Kind.RANGE_FOR,
          CONFIDENCE,
          1,
          loop,
          Binder.single(loop.variable),
          IterationSource.range(range.start, range.end, false),
          loop.body,
          ImmutableSet.of());
    }
    return CandidateShape.loop(
        CandidateShape.Kind.COLLECTION_FOR,
        CONFIDENCE,
        1,
        loop,
        Binder.single(loop.variable),
        IterationSource.collection(iterable),
        loop.body,
        ImmutableSet.of());
  }
}
