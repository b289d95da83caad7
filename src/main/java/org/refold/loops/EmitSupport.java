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
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Const;
import org.refold.source.SourceTrees;
import org.refold.source.SourceType;
import org.refold.source.Variable;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Binary;
import org.refold.target.TargetExpr.Literal;
import org.refold.target.TargetExpr.Operator;
import org.refold.target.TargetExpr.Range;
import org.refold.target.TargetExpr.RemoteCall;
import org.refold.target.TargetExpr.TupleLit;
import org.refold.target.TargetExpr.Var;

/** The services shared by all emitters: compiling subexpressions, naming, and building sources. */
final class EmitSupport {
  final LoopCompiler.ExpressionBuilder builder;
  final LoopCompiler.IdentifierConverter naming;
  final NameGenerator names;
  final ControlFlowLowering lowering;

  EmitSupport(
      LoopCompiler.ExpressionBuilder builder,
      LoopCompiler.IdentifierConverter naming,
      NameGenerator names,
      ControlFlowLowering lowering) {
    this.builder = builder;
    this.naming = naming;
    this.names = names;
    this.lowering = lowering;
  }

  Var var(Variable v) {
    return new Var(naming.convert(v.name));
  }

  TargetExpr expr(SourceExpr expr) {
    return builder.build(expr);
  }

  /** Compiles {@code body} as a statement sequence and returns its statements. */
  List<TargetExpr> statements(SourceExpr body) {
    SourceExpr block =
        (body instanceof SourceExpr.Block) ? body : SourceTrees.block(body.pos, List.of(body));
    List<TargetExpr> result = new ArrayList<>();
    flatten(builder.build(block), result);
    return result;
  }

  private static void flatten(TargetExpr expr, List<TargetExpr> result) {
    if (expr instanceof TargetExpr.Block block) {
      block.statements.forEach(s -> flatten(s, result));
    } else {
      result.add(expr);
    }
  }

  /**
   * Returns the target expression that enumerates {@code source}. Integer ranges are inclusive in
   * the target; a range whose bounds are not both constant gets an explicit step, so that it is
   * empty rather than descending when the end precedes the start.
   */
  TargetExpr source(IterationSource source) {
    switch (source.kind) {
      case RANGE:
        if (source.start instanceof Const start
            && start.isInt()
            && source.end instanceof Const end
            && end.isInt()) {
          int first = start.intValue();
          int last = source.inclusive ? end.intValue() : end.intValue() - 1;
          return new Range(new Literal(first), new Literal(last), last < first);
        }
        TargetExpr last;
        if (source.inclusive) {
          last = expr(source.end);
        } else if (SourceTrees.isIntConst(source.end)) {
          last = new Literal(((Const) source.end).intValue() - 1);
        } else {
          last = new Binary(Operator.SUB, expr(source.end), new Literal(1));
        }
        return new Range(expr(source.start), last, true);
      case COLLECTION:
        TargetExpr collection = expr(source.collection);
        return (source.collection.type.kind == SourceType.Kind.MAP)
            ? RemoteCall.of("Map", "values", collection)
            : collection;
      case KEY_VALUE:
        return expr(source.collection);
    }
    throw new AssertionError(source.kind);
  }

  /**
   * Returns the pattern for {@code binder}, using {@code _} for each variable that is absent or
   * not referenced by any of {@code uses}.
   */
  TargetExpr pattern(Binder binder, Collection<? extends SourceExpr> uses) {
    ImmutableSet<Variable> used = ImmutableSet.copyOf(SourceTrees.referencedVariables(uses));
    if (binder.isKeyValue) {
      return TupleLit.of(binderVar(binder.key, used), binderVar(binder.value, used));
    }
    return binderVar(binder.element, used);
  }

  private TargetExpr binderVar(@Nullable Variable v, ImmutableSet<Variable> used) {
    return (v == null || !used.contains(v)) ? TargetExpr.WILDCARD : var(v);
  }

  /**
   * Returns the pattern (which is also an expression) for a loop's threaded state: the variable
   * itself if there is one, a tuple if there are several, or null if there are none.
   */
  @Nullable TargetExpr state(Collection<Variable> variables) {
    if (variables.isEmpty()) {
      return null;
    } else if (variables.size() == 1) {
      return var(variables.iterator().next());
    }
    return new TupleLit(variables.stream().map(this::var).collect(ImmutableList.toImmutableList()));
  }

  /**
   * Calls {@code body} with the variable names bound by {@code patterns} reserved, so that names
   * chosen while compiling it do not shadow them.
   */
  <T> T withReserved(List<TargetExpr> patterns, Supplier<T> body) {
    List<String> reserved = new ArrayList<>();
    patterns.forEach(p -> collectNames(p, reserved));
    reserved.forEach(names::reserve);
    try {
      return body.get();
    } finally {
      for (int i = reserved.size() - 1; i >= 0; i--) {
        names.release(reserved.get(i));
      }
    }
  }

  private static void collectNames(TargetExpr pattern, List<String> result) {
    if (pattern instanceof Var v) {
      result.add(v.name);
    } else if (pattern instanceof TupleLit tuple) {
      tuple.elements.forEach(e -> collectNames(e, result));
    }
  }
}
