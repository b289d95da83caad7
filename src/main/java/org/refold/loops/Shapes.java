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

import org.jspecify.annotations.Nullable;
import org.refold.source.Binop;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.AssignOp;
import org.refold.source.SourceExpr.Binary;
import org.refold.source.SourceExpr.Call;
import org.refold.source.SourceExpr.Const;
import org.refold.source.SourceExpr.Unary;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceTrees;
import org.refold.source.Unop;
import org.refold.source.Variable;

/** Small structural predicates shared by the shape matchers. */
final class Shapes {

  /**
   * Returns true if {@code stmt} increments {@code v} by one: {@code v++}, {@code ++v}, {@code v +=
   * 1} or {@code v = v + 1}.
   */
  static boolean isIncrement(@Nullable SourceExpr stmt, Variable v) {
    if (stmt instanceof Unary unary) {
      return unary.op == Unop.INCREMENT && SourceTrees.isLocal(unary.operand, v);
    } else if (stmt instanceof AssignOp assignOp) {
      return assignOp.op == Binop.ADD
          && SourceTrees.isLocal(assignOp.target, v)
          && isOne(assignOp.value);
    } else if (stmt instanceof SourceExpr.Assign assign
        && SourceTrees.isLocal(assign.target, v)
        && assign.value instanceof Binary sum) {
      return sum.op == Binop.ADD && SourceTrees.isLocal(sum.left, v) && isOne(sum.right);
    }
    return false;
  }

  /** Returns true if {@code expr} is {@code v++}. */
  static boolean isPostIncrement(SourceExpr expr, Variable v) {
    return expr instanceof Unary unary
        && unary.op == Unop.INCREMENT
        && unary.postfix
        && SourceTrees.isLocal(unary.operand, v);
  }

  private static boolean isOne(SourceExpr expr) {
    return expr instanceof Const c && c.isInt() && c.intValue() == 1;
  }

  /** Returns {@code stmt} if it is a VAR_DECL with an initializer, null otherwise. */
  static @Nullable VarDecl initializedDecl(@Nullable SourceExpr stmt) {
    return (stmt instanceof VarDecl decl && decl.init != null) ? decl : null;
  }

  /** Returns true if {@code expr} is {@code receiver.name(...)} with {@code arity} arguments. */
  static boolean isMethodCall(
      @Nullable SourceExpr expr, Variable receiver, String name, int arity) {
    return expr instanceof Call call
        && call.receiver != null
        && SourceTrees.isLocal(call.receiver, receiver)
        && call.name.equals(name)
        && call.args.size() == arity;
  }

  /**
   * If {@code expr} is a no-argument method call named {@code name}, returns its receiver;
   * otherwise returns null.
   */
  static @Nullable SourceExpr receiverOf(@Nullable SourceExpr expr, String name) {
    if (expr instanceof Call call
        && call.receiver != null
        && call.name.equals(name)
        && call.args.isEmpty()) {
      return call.receiver;
    }
    return null;
  }

  private Shapes() {}
}
