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

/** Chooses the emission strategy for a loop. The choice depends only on the LoopIr. */
public final class StrategySelector {

  private final EngineConfig config;

  public StrategySelector(EngineConfig config) {
    this.config = config;
  }

  public EmissionStrategy selectStrategy(LoopIr ir) {
    if (ir.confidence < config.confidenceThreshold || ir.clauses.isEmpty()) {
      return EmissionStrategy.FALLBACK;
    } else if (ir.yieldShape != null) {
      // An unrolled range is always reconstructed as a comprehension.
      boolean comprehension =
          ir.hasFilters()
              || ir.generators().size() > 1
              || ir.shape.kind == CandidateShape.Kind.UNROLLED_RANGE;
      return comprehension ? EmissionStrategy.COMPREHENSION : EmissionStrategy.MAP_TRANSFORM;
    } else if (ir.exits.any() || ir.accumulation != null || !ir.mutated.isEmpty()) {
      return EmissionStrategy.FOLD_REDUCE;
    } else if (ir.sideEffectOnly) {
      return EmissionStrategy.EACH_SIDE_EFFECT;
    }
    return EmissionStrategy.FALLBACK;
  }
}
