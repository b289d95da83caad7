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
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;

/**
 * The place a {@link ShapeMatcher} looks for a shape: a statement sequence and the index at which
 * the shape must start. A single loop node is matched as a one-statement sequence.
 */
public final class MatchContext {
  public final ImmutableList<SourceExpr> statements;
  public final int index;
  final EngineConfig config;
  final NameGenerator names;
  final LoopCompiler.IdentifierConverter naming;

  MatchContext(
      List<SourceExpr> statements,
      int index,
      EngineConfig config,
      NameGenerator names,
      LoopCompiler.IdentifierConverter naming) {
    Preconditions.checkElementIndex(index, statements.size());
    this.statements = ImmutableList.copyOf(statements);
    this.index = index;
    this.config = config;
    this.names = names;
    this.naming = naming;
  }

  /** Returns a context for matching at the start of another statement sequence. */
  MatchContext nested(List<SourceExpr> statements) {
    return new MatchContext(statements, 0, config, names, naming);
  }

  public SourceExpr current() {
    return statements.get(index);
  }

  /** Returns the statement {@code offset} places after the current one, or null if none. */
  public @Nullable SourceExpr at(int offset) {
    int i = index + offset;
    return (i < statements.size()) ? statements.get(i) : null;
  }

  /** Returns the statements before the current one. */
  public ImmutableList<SourceExpr> preceding() {
    return statements.subList(0, index);
  }

  /** Returns the statements following a shape that consumes {@code consumed} statements. */
  public ImmutableList<SourceExpr> following(int consumed) {
    return statements.subList(Math.min(index + consumed, statements.size()), statements.size());
  }
}
