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
import org.jspecify.annotations.Nullable;

/** A record of how one loop was reconstructed, kept for diagnostics and tests. */
public final class LoopProvenance {
  /** The name of the (first) element binder, or null if the loop binds none. */
  public final @Nullable String binderName;

  public final EmissionStrategy strategy;
  public final CandidateShape.Kind shapeKind;

  /** The target range enumerated by the loop, if its source is an integer range. */
  public final @Nullable String inferredRange;

  public final double confidence;

  /** True if the loop body contains a {@code return} that exits the enclosing function. */
  public final boolean hasNonLocalReturn;

  /** True if the loop was reconstructed from an unrolled sequence by loose extraction. */
  public final boolean loose;

  /** Target names of the outer variables the emitted closure captures, in name order. */
  public final ImmutableList<String> capturedVariables;

  /** How the body accumulates into an outer variable, or null if it does not. */
  public final AccumulationDescriptor.@Nullable Kind accumulation;

  LoopProvenance(
      @Nullable String binderName,
      EmissionStrategy strategy,
      CandidateShape.Kind shapeKind,
      @Nullable String inferredRange,
      double confidence,
      boolean hasNonLocalReturn,
      boolean loose,
      ImmutableList<String> capturedVariables,
      AccumulationDescriptor.@Nullable Kind accumulation) {
    this.binderName = binderName;
    this.strategy = strategy;
    this.shapeKind = shapeKind;
    this.inferredRange = inferredRange;
    this.confidence = confidence;
    this.hasNonLocalReturn = hasNonLocalReturn;
    this.loose = loose;
    this.capturedVariables = capturedVariables;
    this.accumulation = accumulation;
  }

  @Override
  public String toString() {
    return String.format(
        "%s as %s (binder=%s range=%s confidence=%s captures=%s%s%s%s)",
        shapeKind,
        strategy,
        binderName,
        inferredRange,
        confidence,
        capturedVariables,
        (accumulation == null) ? "" : " " + accumulation,
        hasNonLocalReturn ? " returns" : "",
        loose ? " loose" : "");
  }
}
