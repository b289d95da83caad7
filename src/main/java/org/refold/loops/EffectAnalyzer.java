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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.ArrayLit;
import org.refold.source.SourceExpr.Assign;
import org.refold.source.SourceExpr.AssignOp;
import org.refold.source.SourceExpr.Binary;
import org.refold.source.SourceExpr.Call;
import org.refold.source.SourceExpr.Field;
import org.refold.source.SourceExpr.If;
import org.refold.source.SourceExpr.Index;
import org.refold.source.SourceExpr.Kind;
import org.refold.source.SourceExpr.Local;
import org.refold.source.SourceExpr.Unary;
import org.refold.source.SourceTrees;
import org.refold.source.Variable;

/**
 * Classifies what a loop body does: whether it only has side effects, whether it accumulates into
 * an outer variable, which outer variables it assigns, and which exits it contains. Every method is
 * total; absence is reported as {@code false} or an empty result.
 */
public final class EffectAnalyzer {

  /** Methods that modify their receiver in place. */
  static final ImmutableSet<String> MUTATING_METHODS =
      ImmutableSet.of(
          "push", "pop", "shift", "unshift", "insert", "remove", "reverse", "sort", "splice", "set",
          "clear", "next");

  private final EngineConfig config;

  public EffectAnalyzer(EngineConfig config) {
    this.config = config;
  }

  /**
   * Returns true if executing {@code body} has only side effects: it produces no value that is
   * used, and accumulates into no list, string or number.
   *
   * <p>Nested loops whose own bodies have only side effects are accepted.
   */
  public boolean hasSideEffectsOnly(SourceExpr body) {
    if (detectAccumulationPattern(body).isPresent()) {
      return false;
    }
    return isSideEffectStatement(body);
  }

  private boolean isSideEffectStatement(@Nullable SourceExpr stmt) {
    if (stmt == null) {
      return true;
    }
    switch (stmt.kind()) {
      case CONST:
      case LOCAL:
        return true;
      case BLOCK:
        return ((SourceExpr.Block) stmt).statements.stream().allMatch(this::isSideEffectStatement);
      case CALL:
        Call call = (Call) stmt;
        boolean known =
            (call.receiver == null)
                ? config.sideEffectFunctions.contains(call.name)
                : (MUTATING_METHODS.contains(call.name) && !(call.receiver instanceof Local));
        return known && call.args.stream().allMatch(EffectAnalyzer::isPure);
      case ASSIGN:
      case ASSIGN_OP:
        return true;
      case UNARY:
        return ((Unary) stmt).op.isUpdate();
      case VAR_DECL:
        SourceExpr init = ((SourceExpr.VarDecl) stmt).init;
        return init == null || isPure(init);
      case IF:
        If ifStmt = (If) stmt;
        return isPure(ifStmt.cond)
            && isSideEffectStatement(ifStmt.then)
            && isSideEffectStatement(ifStmt.otherwise);
      case FOR:
        SourceExpr.For loop = (SourceExpr.For) stmt;
        return isPure(loop.iterable) && hasSideEffectsOnly(loop.body);
      case WHILE:
        SourceExpr.While whileLoop = (SourceExpr.While) stmt;
        return isPure(whileLoop.cond) && hasSideEffectsOnly(whileLoop.body);
      default:
        return false;
    }
  }

  /** Returns true if evaluating {@code expr} assigns no variable and mutates no local. */
  static boolean isPure(SourceExpr expr) {
    return detectMutatedVariables(ImmutableList.of(expr)).isEmpty()
        && !SourceTrees.containsOutsideFunctions(expr, Kind.ASSIGN)
        && !SourceTrees.containsOutsideFunctions(expr, Kind.ASSIGN_OP);
  }

  /**
   * Looks through {@code body} (including the branches of conditionals) for a statement that
   * accumulates into a variable declared outside it, and describes the first one found.
   */
  public Optional<AccumulationDescriptor> detectAccumulationPattern(SourceExpr body) {
    return findAccumulation(body, SourceTrees.declaredVariables(body), false);
  }

  private static Optional<AccumulationDescriptor> findAccumulation(
      @Nullable SourceExpr stmt, Set<Variable> declared, boolean conditional) {
    if (stmt instanceof SourceExpr.Block block) {
      for (SourceExpr s : block.statements) {
        Optional<AccumulationDescriptor> result = findAccumulation(s, declared, conditional);
        if (result.isPresent()) {
          return result;
        }
      }
      return Optional.empty();
    } else if (stmt instanceof If ifStmt) {
      Optional<AccumulationDescriptor> result = findAccumulation(ifStmt.then, declared, true);
      return result.isPresent() ? result : findAccumulation(ifStmt.otherwise, declared, true);
    } else if (stmt == null) {
      return Optional.empty();
    }
    Optional<PushMatcher.Append> append = PushMatcher.matchAppend(stmt);
    if (append.isPresent()) {
      Variable acc = append.get().target;
      return declared.contains(acc)
          ? Optional.empty()
          : Optional.of(
              new AccumulationDescriptor(
                  acc, AccumulationDescriptor.Kind.LIST_APPEND, conditional));
    }
    Variable acc = null;
    SourceExpr addend = null;
    if (stmt instanceof AssignOp assignOp
        && assignOp.op == Binop.ADD
        && assignOp.target instanceof Local target) {
      acc = target.variable;
      addend = assignOp.value;
    } else if (stmt instanceof Assign assign
        && assign.target instanceof Local target
        && assign.value instanceof Binary sum
        && sum.op == Binop.ADD
        && SourceTrees.isLocal(sum.left, target.variable)) {
      acc = target.variable;
      addend = sum.right;
    }
    if (acc == null || declared.contains(acc)) {
      return Optional.empty();
    }
    AccumulationDescriptor.Kind kind = accumulationKind(acc, addend);
    return (kind == null)
        ? Optional.empty()
        : Optional.of(new AccumulationDescriptor(acc, kind, conditional));
  }

  /** Decides the kind from the accumulator's type, falling back to the shape of the addend. */
  private static AccumulationDescriptor.@Nullable Kind accumulationKind(
      Variable acc, SourceExpr addend) {
    if (acc.type.isArray()) {
      return AccumulationDescriptor.Kind.LIST_APPEND;
    } else if (acc.type.isString()) {
      return AccumulationDescriptor.Kind.STRING_CONCAT;
    } else if (acc.type.isNumeric()) {
      return AccumulationDescriptor.Kind.NUMERIC_ADD;
    } else if (addend instanceof ArrayLit || addend.type.isArray()) {
      return AccumulationDescriptor.Kind.LIST_APPEND;
    } else if (addend.type.isString()) {
      return AccumulationDescriptor.Kind.STRING_CONCAT;
    } else if (addend.type.isNumeric()) {
      return AccumulationDescriptor.Kind.NUMERIC_ADD;
    }
    return null;
  }

  /**
   * Returns the variables that {@code body} assigns (directly, by compound assignment, by
   * increment, through an element or field, or by calling a mutating method on them) and that are
   * not declared within it, in declaration order. Nested function bodies are not examined.
   */
  public static ImmutableSortedSet<Variable> detectMutatedVariables(SourceExpr body) {
    return detectMutatedVariables(ImmutableList.of(body));
  }

  public static ImmutableSortedSet<Variable> detectMutatedVariables(
      Collection<? extends SourceExpr> statements) {
    Set<Variable> assigned = new TreeSet<>();
    Set<Variable> declared = new TreeSet<>();
    for (SourceExpr stmt : statements) {
      SourceTrees.walk(
          stmt,
          e -> !e.is(Kind.FUNCTION),
          e -> {
            Variable target = null;
            if (e instanceof Assign assign) {
              target = rootVariable(assign.target);
            } else if (e instanceof AssignOp assignOp) {
              target = rootVariable(assignOp.target);
            } else if (e instanceof Unary unary && unary.op.isUpdate()) {
              target = rootVariable(unary.operand);
            } else if (e instanceof Call call
                && call.receiver != null
                && MUTATING_METHODS.contains(call.name)) {
              target = rootVariable(call.receiver);
            } else if (e instanceof SourceExpr.VarDecl decl) {
              declared.add(decl.variable);
            } else if (e instanceof SourceExpr.For loop) {
              declared.add(loop.variable);
            }
            if (target != null) {
              assigned.add(target);
            }
          });
    }
    assigned.removeAll(declared);
    return ImmutableSortedSet.copyOf(assigned);
  }

  /** Returns the local variable at the root of an lvalue, or null if there is none. */
  private static @Nullable Variable rootVariable(SourceExpr lvalue) {
    SourceExpr e = lvalue;
    while (true) {
      if (e instanceof Local local) {
        return local.variable;
      } else if (e instanceof Field field) {
        e = field.object;
      } else if (e instanceof Index index) {
        e = index.object;
      } else {
        return null;
      }
    }
  }

  /** Returns the exits in {@code body} that leave the loop it belongs to. */
  public static ExitSummary findExits(SourceExpr body) {
    return findExits(ImmutableList.of(body));
  }

  public static ExitSummary findExits(Collection<? extends SourceExpr> statements) {
    boolean[] found = new boolean[3];
    for (SourceExpr stmt : statements) {
      scanExits(stmt, true, found);
    }
    return (found[0] || found[1] || found[2])
        ? new ExitSummary(found[0], found[1], found[2])
        : ExitSummary.NONE;
  }

  /**
   * Sets found[0] for a break, found[1] for a continue and found[2] for a return. Breaks and
   * continues only count if {@code ownLoop} is true.
   */
  private static void scanExits(SourceExpr expr, boolean ownLoop, boolean[] found) {
    switch (expr.kind()) {
      case BREAK -> found[0] |= ownLoop;
      case CONTINUE -> found[1] |= ownLoop;
      case RETURN -> {
        found[2] = true;
        expr.children().forEach(child -> scanExits(child, ownLoop, found));
      }
      case FUNCTION -> {
        // A closure's exits belong to the closure.
      }
      case FOR, WHILE -> expr.children().forEach(child -> scanExits(child, false, found));
      default -> expr.children().forEach(child -> scanExits(child, ownLoop, found));
    }
  }
}
