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
import com.google.common.collect.ImmutableSet;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.Variable;

/**
 * One recognized desugaring, as reported by a {@link ShapeMatcher}. A CandidateShape refers into
 * the source tree but owns none of it; it only lives for the duration of one loop's analysis.
 */
public final class CandidateShape {

  public enum Kind {
    /** {@code for (v in start...end)}. */
    RANGE_FOR,
    /** {@code for (v in collection)}. */
    COLLECTION_FOR,
    /** A counter declaration, optional limit declaration, and a {@code while} over the counter. */
    COUNTER_RANGE,
    /** A {@code while} over an index into an array, whose body starts by reading the element. */
    INDEXED_COLLECTION,
    /** A {@code keyValueIterator()} protocol loop. */
    KEY_VALUE_ITERATION,
    /** An {@code iterator()} protocol loop. */
    ITERATOR_COLLECTION,
    /** A flat sequence of appends with no loop construct at all. */
    UNROLLED_RANGE,
    /** A block that declares an empty list, fills it with a loop, and returns it. */
    LIST_BUILDING_BLOCK,
    /** A {@code while} or {@code do ... while} loop that matched no other shape. */
    UNRECOGNIZED_WHILE
  }

  public final Kind kind;

  /** How sure the matcher is that reconstruction preserves behavior, in [0, 1]. */
  public final double confidence;

  /** The number of statements of the enclosing sequence that this shape replaces. */
  public final int consumed;

  /** The original FOR or WHILE node; null for UNROLLED_RANGE. */
  public final @Nullable SourceExpr loop;

  public final Binder binder;

  /** Null for UNRECOGNIZED_WHILE. */
  public final @Nullable IterationSource source;

  /**
   * The user's loop body, with any synthetic counter or iterator statements removed. Null for
   * UNROLLED_RANGE, whose body is given by {@link #presetYield}.
   */
  public final @Nullable SourceExpr body;

  /** For UNROLLED_RANGE, the reconstructed per-element value; null for all other kinds. */
  public final @Nullable YieldShape presetYield;

  /** Synthetic variables (counters, limits, iterators) that the reconstruction removes. */
  public final ImmutableSet<Variable> erased;

  /** True if this shape was recognized by the loose unrolled extraction. */
  public final boolean loose;

  private CandidateShape(
      Kind kind,
      double confidence,
      int consumed,
      @Nullable SourceExpr loop,
      Binder binder,
      @Nullable IterationSource source,
      @Nullable SourceExpr body,
      @Nullable YieldShape presetYield,
      ImmutableSet<Variable> erased,
      boolean loose) {
    Preconditions.checkArgument(confidence >= 0 && confidence <= 1);
    Preconditions.checkArgument(consumed >= 1);
    this.kind = kind;
    this.confidence = confidence;
    this.consumed = consumed;
    this.loop = loop;
    this.binder = binder;
    this.source = source;
    this.body = body;
    this.presetYield = presetYield;
    this.erased = erased;
    this.loose = loose;
  }

  /** Returns a shape for a loop whose element binder, source and body have been identified. */
  static CandidateShape loop(
      Kind kind,
      double confidence,
      int consumed,
      SourceExpr loop,
      Binder binder,
      IterationSource source,
      SourceExpr body,
      ImmutableSet<Variable> erased) {
    return new CandidateShape(
        kind, confidence, consumed, loop, binder, source, body, null, erased, false);
  }

  static CandidateShape unrolled(
      double confidence,
      int consumed,
      Binder binder,
      IterationSource source,
      YieldShape yield,
      boolean loose) {
    return new CandidateShape(
        Kind.UNROLLED_RANGE,
        confidence,
        consumed,
        null,
        binder,
        source,
        null,
        yield,
        ImmutableSet.of(),
        loose);
  }

  static CandidateShape unrecognized(SourceExpr.While loop) {
    return new CandidateShape(
        Kind.UNRECOGNIZED_WHILE,
        0,
        1,
        loop,
        Binder.single(null),
        null,
        loop.body,
        null,
        ImmutableSet.of(),
        false);
  }

  /** Returns a copy of this shape reclassified as the loop of a list-building block. */
  CandidateShape asListBuildingBlock(int consumed) {
    return new CandidateShape(
        Kind.LIST_BUILDING_BLOCK,
        confidence,
        consumed,
        loop,
        binder,
        source,
        body,
        presetYield,
        erased,
        loose);
  }

  @Override
  public String toString() {
    return String.format("%s(%s, confidence=%s, consumed=%s)", kind, binder, confidence, consumed);
  }
}
