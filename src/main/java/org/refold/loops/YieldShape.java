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
import org.refold.source.SourceExpr;
import org.refold.source.Variable;

/**
 * A loop body that does nothing but append one value per iteration to a list: optional loop-local
 * declarations, then a push of {@link #value} onto {@link #target}, possibly guarded by {@link
 * #guard}.
 */
public final class YieldShape {
  public final Variable target;
  public final SourceExpr value;
  public final @Nullable SourceExpr guard;

  /** Loop-local VAR_DECL statements evaluated before the value; empty if there is a guard. */
  public final ImmutableList<SourceExpr> prefix;

  YieldShape(
      Variable target,
      SourceExpr value,
      @Nullable SourceExpr guard,
      ImmutableList<SourceExpr> prefix) {
    this.target = target;
    this.value = value;
    this.guard = guard;
    this.prefix = prefix;
  }
}
