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

/** How a loop is emitted; chosen by {@link StrategySelector} from a {@link LoopIr}. */
public enum EmissionStrategy {
  /** {@code Enum.each}: the body runs only for its effects. */
  EACH_SIDE_EFFECT,
  /** {@code Enum.map}: each element yields one value. */
  MAP_TRANSFORM,
  /** {@code for ... <- ..., filter, do: ...}. */
  COMPREHENSION,
  /** {@code Enum.reduce} (or {@code reduce_while}) threading the assigned variables. */
  FOLD_REDUCE,
  /** The generic, always-correct {@code reduce_while} lowering. */
  FALLBACK
}
