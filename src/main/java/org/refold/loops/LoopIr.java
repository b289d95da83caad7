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
import com.google.common.collect.ImmutableSortedSet;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.Variable;

/**
 * The normalized description of one loop that is passed from analysis to emission. A LoopIr is
 * built by {@link LoopAnalyzer} from a {@link CandidateShape} and the analyzers' findings, and is
 * discarded once the loop has been emitted.
 */
public final class LoopIr {

  /** A generator (binder and source) or a filter condition. */
  public static final class Clause {
    public final @Nullable Binder binder;
    public final @Nullable IterationSource source;
    public final @Nullable SourceExpr filter;

    private Clause(
        @Nullable Binder binder, @Nullable IterationSource source, @Nullable SourceExpr filter) {
      this.binder = binder;
      this.source = source;
      this.filter = filter;
    }

    static Clause generator(Binder binder, IterationSource source) {
      return new Clause(binder, Preconditions.checkNotNull(source), null);
    }

    static Clause filter(SourceExpr cond) {
      return new Clause(null, null, cond);
    }

    public boolean isGenerator() {
      return source != null;
    }
  }

  public final CandidateShape shape;

  /** Generators and filters in order; empty only for UNRECOGNIZED_WHILE. */
  public final ImmutableList<Clause> clauses;

  /** The body run for each element; null when {@link #yieldShape} describes the whole loop. */
  public final @Nullable SourceExpr body;

  /** Non-null if each iteration appends exactly one value to {@link #collectTarget}. */
  public final @Nullable YieldShape yieldShape;

  /** The list the yielded values are appended to; non-null iff {@link #yieldShape} is. */
  public final @Nullable Variable collectTarget;

  /**
   * True if the loop is the body of a list-building block, so the emitted list is the value of an
   * expression rather than assigned to {@link #collectTarget}.
   */
  public final boolean valueMode;

  /** True if {@link #collectTarget} is known to be empty when the loop starts. */
  public final boolean seedKnownEmpty;

  /** Outer variables assigned by the body (other than the collect target), by declaration order. */
  public final ImmutableSortedSet<Variable> mutated;

  public final @Nullable AccumulationDescriptor accumulation;
  public final VariableScopeAnalysis scope;
  public final boolean sideEffectOnly;
  public final ExitSummary exits;
  public final double confidence;

  LoopIr(
      CandidateShape shape,
      ImmutableList<Clause> clauses,
      @Nullable SourceExpr body,
      @Nullable YieldShape yieldShape,
      boolean valueMode,
      boolean seedKnownEmpty,
      ImmutableSortedSet<Variable> mutated,
      @Nullable AccumulationDescriptor accumulation,
      VariableScopeAnalysis scope,
      boolean sideEffectOnly,
      ExitSummary exits,
      double confidence) {
    Preconditions.checkArgument(
        confidence >= 0 && confidence <= 1, "Bad confidence %s", confidence);
    Preconditions.checkArgument(body != null || yieldShape != null);
    Preconditions.checkArgument(!valueMode || yieldShape != null);
    this.shape = shape;
    this.clauses = clauses;
    this.body = body;
    this.yieldShape = yieldShape;
    this.collectTarget = (yieldShape == null) ? null : yieldShape.target;
    this.valueMode = valueMode;
    this.seedKnownEmpty = seedKnownEmpty;
    this.mutated = mutated;
    this.accumulation = accumulation;
    this.scope = scope;
    this.sideEffectOnly = sideEffectOnly;
    this.exits = exits;
    this.confidence = confidence;
  }

  public ImmutableList<Clause> generators() {
    return clauses.stream().filter(Clause::isGenerator).collect(ImmutableList.toImmutableList());
  }

  public boolean hasFilters() {
    return clauses.stream().anyMatch(c -> !c.isGenerator());
  }

  @Override
  public String toString() {
    return String.format(
        "%s generators=%s filters=%s yield=%s mutated=%s sideEffectOnly=%s %s",
        shape,
        generators().size(),
        hasFilters(),
        collectTarget,
        mutated,
        sideEffectOnly,
        exits);
  }
}
