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

package org.refold.source;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.refold.source.SourceExpr.Kind;

/** Static helpers for walking and rewriting source trees. */
public class SourceTrees {

  /**
   * Calls {@code visitor} on {@code root} and its descendants in pre-order. The children of a node
   * are only visited if {@code descend} returns true for it.
   */
  public static void walk(
      SourceExpr root, Predicate<SourceExpr> descend, Consumer<SourceExpr> visitor) {
    visitor.accept(root);
    if (descend.test(root)) {
      for (SourceExpr child : root.children()) {
        walk(child, descend, visitor);
      }
    }
  }

  /** Returns {@code root} and all its descendants in pre-order. */
  public static ImmutableList<SourceExpr> preOrder(SourceExpr root) {
    ImmutableList.Builder<SourceExpr> builder = ImmutableList.builder();
    walk(root, e -> true, builder::add);
    return builder.build();
  }

  /** Returns every variable referenced by a LOCAL node in {@code root}, including in closures. */
  public static ImmutableSortedSet<Variable> referencedVariables(SourceExpr root) {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    walk(
        root,
        e -> true,
        e -> {
          if (e instanceof SourceExpr.Local local) {
            builder.add(local.variable);
          }
        });
    return builder.build();
  }

  public static ImmutableSortedSet<Variable> referencedVariables(
      Collection<? extends SourceExpr> exprs) {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    exprs.forEach(e -> builder.addAll(referencedVariables(e)));
    return builder.build();
  }

  /**
   * Returns every variable bound within {@code root}: by a VAR_DECL, as the variable of a FOR, or
   * as a FUNCTION parameter.
   */
  public static ImmutableSortedSet<Variable> declaredVariables(SourceExpr root) {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    walk(
        root,
        e -> true,
        e -> {
          if (e instanceof SourceExpr.VarDecl decl) {
            builder.add(decl.variable);
          } else if (e instanceof SourceExpr.For loop) {
            builder.add(loop.variable);
          } else if (e instanceof SourceExpr.Function fn) {
            builder.addAll(fn.params);
          }
        });
    return builder.build();
  }

  public static ImmutableSortedSet<Variable> declaredVariables(
      Collection<? extends SourceExpr> exprs) {
    ImmutableSortedSet.Builder<Variable> builder = ImmutableSortedSet.naturalOrder();
    exprs.forEach(e -> builder.addAll(declaredVariables(e)));
    return builder.build();
  }

  /** Returns true if {@code root} contains a LOCAL reference to {@code variable}. */
  public static boolean references(SourceExpr root, Variable variable) {
    return referencedVariables(root).contains(variable);
  }

  /** Returns true if any of {@code exprs} has a LOCAL reference to one of {@code variables}. */
  public static boolean referencesAny(
      Collection<? extends SourceExpr> exprs, Collection<Variable> variables) {
    for (SourceExpr expr : exprs) {
      for (Variable v : referencedVariables(expr)) {
        if (variables.contains(v)) {
          return true;
        }
      }
    }
    return false;
  }

  /** Returns true if {@code root} contains a node of the given kind, not looking into closures. */
  public static boolean containsOutsideFunctions(SourceExpr root, Kind kind) {
    boolean[] found = new boolean[1];
    walk(
        root,
        e -> !e.is(Kind.FUNCTION),
        e -> {
          if (e.is(kind)) {
            found[0] = true;
          }
        });
    return found[0];
  }

  /**
   * Returns a copy of {@code root} in which each node that is a key of {@code replacements}
   * (compared by identity) has been replaced by the corresponding value.
   */
  public static SourceExpr replace(SourceExpr root, Map<SourceExpr, SourceExpr> replacements) {
    SourceExpr replacement = replacements.get(root);
    if (replacement != null) {
      return replacement;
    }
    ImmutableList<SourceExpr> children = root.children();
    if (children.isEmpty()) {
      return root;
    }
    List<SourceExpr> newChildren = new ArrayList<>(children.size());
    boolean changed = false;
    for (SourceExpr child : children) {
      SourceExpr newChild = replace(child, replacements);
      changed |= (newChild != child);
      newChildren.add(newChild);
    }
    return changed ? root.withChildren(newChildren) : root;
  }

  /** Returns the statements of a BLOCK, or a singleton list containing any other expression. */
  public static ImmutableList<SourceExpr> statements(SourceExpr expr) {
    return (expr instanceof SourceExpr.Block block) ? block.statements : ImmutableList.of(expr);
  }

  /** Returns a VOID block containing the given statements. */
  public static SourceExpr.Block block(Position pos, List<SourceExpr> statements) {
    return new SourceExpr.Block(SourceType.VOID, pos, statements);
  }

  /** Returns true if {@code expr} is the local variable {@code variable}. */
  public static boolean isLocal(SourceExpr expr, Variable variable) {
    return expr instanceof SourceExpr.Local local && local.variable.equals(variable);
  }

  /** Returns true if {@code expr} is an empty array literal. */
  public static boolean isEmptyArray(SourceExpr expr) {
    return expr instanceof SourceExpr.ArrayLit array && array.elements.isEmpty();
  }

  /** Returns true if {@code expr} is an integer constant. */
  public static boolean isIntConst(SourceExpr expr) {
    return expr instanceof SourceExpr.Const c && c.isInt();
  }

  private SourceTrees() {}
}
