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
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.FluentLogger;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.ArrayLit;
import org.refold.source.SourceExpr.Assign;
import org.refold.source.SourceExpr.AssignOp;
import org.refold.source.SourceExpr.Binary;
import org.refold.source.SourceExpr.Call;
import org.refold.source.SourceExpr.If;
import org.refold.source.SourceExpr.Kind;
import org.refold.source.SourceExpr.Local;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Recognizes loop bodies that append exactly one value to an accumulator list per iteration,
 * optionally under a single guard.
 */
final class PushMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** A statement that appends {@code value} to the list in {@code target}. */
  static final class Append {
    final Variable target;
    final SourceExpr value;

    /** True if the append is {@code target.push(value)}, which modifies the list in place. */
    final boolean isPush;

    Append(Variable target, SourceExpr value, boolean isPush) {
      this.target = target;
      this.value = value;
      this.isPush = isPush;
    }
  }

  /**
   * Matches {@code acc.push(v)}, {@code acc = acc.concat([v])}, {@code acc = acc + [v]} and {@code
   * acc += [v]}, where {@code acc} is a local variable.
   */
  static Optional<Append> matchAppend(SourceExpr stmt) {
    if (stmt instanceof Call call
        && call.receiver instanceof Local receiver
        && call.name.equals("push")
        && call.args.size() == 1) {
      return Optional.of(new Append(receiver.variable, call.args.get(0), true));
    } else if (stmt instanceof AssignOp assignOp
        && assignOp.op == Binop.ADD
        && assignOp.target instanceof Local target) {
      SourceExpr element = singleton(assignOp.value);
      if (element != null) {
        return Optional.of(new Append(target.variable, element, false));
      }
    } else if (stmt instanceof Assign assign && assign.target instanceof Local target) {
      Variable acc = target.variable;
      SourceExpr element = null;
      if (assign.value instanceof Binary sum
          && sum.op == Binop.ADD
          && SourceTrees.isLocal(sum.left, acc)) {
        element = singleton(sum.right);
      } else if (Shapes.isMethodCall(assign.value, acc, "concat", 1)) {
        element = singleton(((Call) assign.value).args.get(0));
      }
      if (element != null) {
        return Optional.of(new Append(acc, element, false));
      }
    }
    return Optional.empty();
  }

  /** If {@code expr} is a one-element array literal, returns its element. */
  private static @Nullable SourceExpr singleton(SourceExpr expr) {
    return (expr instanceof ArrayLit array && array.elements.size() == 1)
        ? array.elements.get(0)
        : null;
  }

  /** Returns the yield described by {@code body}, if it has that shape. */
  Optional<YieldShape> match(SourceExpr body) {
    ImmutableList<SourceExpr> statements = SourceTrees.statements(body);
    if (statements.isEmpty()) {
      return Optional.empty();
    }
    SourceExpr last = statements.get(statements.size() - 1);
    SourceExpr guard = null;
    ImmutableList<SourceExpr> prefix = statements.subList(0, statements.size() - 1);
    if (statements.size() == 1 && last instanceof If ifStmt && ifStmt.otherwise == null) {
      ImmutableList<SourceExpr> guarded = SourceTrees.statements(ifStmt.then);
      if (guarded.size() != 1) {
        return Optional.empty();
      }
      guard = ifStmt.cond;
      last = guarded.get(0);
    }
    for (SourceExpr stmt : prefix) {
      if (Shapes.initializedDecl(stmt) == null) {
        return Optional.empty();
      }
    }
    Optional<Append> append = matchAppend(last);
    if (append.isEmpty()) {
      return Optional.empty();
    }
    Variable acc = append.get().target;
    ImmutableList.Builder<SourceExpr> uses = ImmutableList.builder();
    uses.add(append.get().value).addAll(prefix);
    if (guard != null) {
      uses.add(guard);
    }
    ImmutableList<SourceExpr> allUses = uses.build();
    if (SourceTrees.referencesAny(allUses, ImmutableList.of(acc))) {
      logger.atFine().log("Not a yield: value refers to its own accumulator %s", acc);
      return Optional.empty();
    }
    if (SourceTrees.declaredVariables(prefix).contains(acc)) {
      return Optional.empty();
    }
    ImmutableSortedSet<Variable> mutated = EffectAnalyzer.detectMutatedVariables(allUses);
    if (!mutated.isEmpty()) {
      logger.atFine().log("Not a yield: computing the value modifies %s", mutated);
      return Optional.empty();
    }
    for (SourceExpr use : allUses) {
      if (SourceTrees.containsOutsideFunctions(use, Kind.RETURN)) {
        return Optional.empty();
      }
    }
    return Optional.of(new YieldShape(acc, append.get().value, guard, prefix));
  }
}
