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
import org.refold.target.TargetExpr;

/** The result of compiling a loop shape. */
public final class LoopEmission {
  /**
   * The target statements that replace the consumed source statements. For a list-building block
   * this is a single expression whose value is the list.
   */
  public final ImmutableList<TargetExpr> statements;

  /** The number of source statements (starting at the match index) that this emission replaces. */
  public final int consumed;

  public final LoopProvenance provenance;

  LoopEmission(ImmutableList<TargetExpr> statements, int consumed, LoopProvenance provenance) {
    this.statements = statements;
    this.consumed = consumed;
    this.provenance = provenance;
  }

  @Override
  public String toString() {
    return String.format("%s -> %s", provenance, statements);
  }
}
