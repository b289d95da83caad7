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
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;

/** What a reconstructed loop iterates over. */
public final class IterationSource {

  public enum Kind {
    /** An integer range from {@code start} to {@code end}. */
    RANGE,
    /** The elements of an array (or the values of a map). */
    COLLECTION,
    /** The (key, value) pairs of a map. */
    KEY_VALUE
  }

  public final Kind kind;

  /** The first element of a RANGE; null otherwise. */
  public final @Nullable SourceExpr start;

  /** The bound of a RANGE; included in the range iff {@link #inclusive}. Null otherwise. */
  public final @Nullable SourceExpr end;

  public final boolean inclusive;

  /** The collection or map iterated by COLLECTION and KEY_VALUE sources; null for RANGE. */
  public final @Nullable SourceExpr collection;

  private IterationSource(
      Kind kind,
      @Nullable SourceExpr start,
      @Nullable SourceExpr end,
      boolean inclusive,
      @Nullable SourceExpr collection) {
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.inclusive = inclusive;
    this.collection = collection;
  }

  public static IterationSource range(SourceExpr start, SourceExpr end, boolean inclusive) {
    return new IterationSource(
        Kind.RANGE, Preconditions.checkNotNull(start), Preconditions.checkNotNull(end), inclusive,
        null);
  }

  public static IterationSource collection(SourceExpr collection) {
    return new IterationSource(
        Kind.COLLECTION, null, null, false, Preconditions.checkNotNull(collection));
  }

  public static IterationSource keyValue(SourceExpr map) {
    return new IterationSource(Kind.KEY_VALUE, null, null, false, Preconditions.checkNotNull(map));
  }

  /** Returns the source expressions this iteration source evaluates. */
  public ImmutableList<SourceExpr> expressions() {
    return (kind == Kind.RANGE) ? ImmutableList.of(start, end) : ImmutableList.of(collection);
  }
}
