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

package org.refold.compiler;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.refold.loops.EffectAnalyzer;
import org.refold.loops.EngineConfig;
import org.refold.loops.LoopCompiler;
import org.refold.loops.LoopEmission;
import org.refold.loops.LoopProvenance;
import org.refold.source.Binop;
import org.refold.source.Position;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Kind;
import org.refold.source.SourceTrees;
import org.refold.source.SourceType;
import org.refold.source.Unop;
import org.refold.source.Variable;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Binary;
import org.refold.target.TargetExpr.Fn;
import org.refold.target.TargetExpr.If;
import org.refold.target.TargetExpr.ListLit;
import org.refold.target.TargetExpr.Literal;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.Operator;
import org.refold.target.TargetExpr.Range;
import org.refold.target.TargetExpr.RemoteCall;
import org.refold.target.TargetExpr.TupleLit;
import org.refold.target.TargetExpr.Var;

/**
 * Compiles source expressions to target expressions.
 *
 * <p>Statements that assign to a local are compiled to a match that rebinds it; since target
 * bindings made inside a branch are not visible after it, an {@code if} statement that assigns to
 * outer locals is compiled to a match of those locals against the value of the {@code if}. Loops
 * (and the statement sequences that are desugared loops) are handed to a {@link LoopCompiler},
 * which calls back here for their sources and bodies.
 *
 * <p>An ExpressionCompiler is not thread-safe; use one per compilation unit.
 */
public class ExpressionCompiler
    implements LoopCompiler.ExpressionBuilder, SourceExpr.Visitor<TargetExpr> {

  private static final Literal ONE = new Literal(1);

  final LoopCompiler loops;
  private final CallCompiler calls;

  public ExpressionCompiler(EngineConfig config) {
    this.loops = new LoopCompiler(this, Naming::toTargetIdentifier, config);
    this.calls = new CallCompiler(this);
  }

  public ExpressionCompiler() {
    this(EngineConfig.DEFAULT);
  }

  /**
   * Compiles {@code expr}.
   *
   * @throws CompileError if {@code expr} uses a construct that has no target equivalent
   */
  public TargetExpr compile(SourceExpr expr) {
    return build(expr);
  }

  /** Compiles a statement sequence, reconstructing any loops it contains. */
  public ImmutableList<TargetExpr> compileStatements(List<SourceExpr> statements) {
    List<TargetExpr> result = new ArrayList<>();
    for (int i = 0; i < statements.size(); ) {
      Optional<LoopEmission> emission = loops.tryCompileAt(statements, i);
      if (emission.isPresent()) {
        result.addAll(emission.get().statements);
        i += emission.get().consumed;
      } else {
        addStatements(statement(statements.get(i)), result);
        i++;
      }
    }
    return ImmutableList.copyOf(result);
  }

  /** Returns how each loop compiled so far was reconstructed. */
  public ImmutableList<LoopProvenance> provenance() {
    return loops.provenance();
  }

  @Override
  public TargetExpr build(SourceExpr expr) {
    return expr.accept(this);
  }

  /** Compiles {@code stmt} for its effect only; an increment's value is discarded. */
  private TargetExpr statement(SourceExpr stmt) {
    if (stmt instanceof SourceExpr.Unary unary && unary.op.isUpdate()) {
      return update(unary);
    }
    return build(stmt);
  }

  private static void addStatements(TargetExpr expr, List<TargetExpr> result) {
    if (expr instanceof TargetExpr.Block block) {
      block.statements.forEach(s -> addStatements(s, result));
    } else {
      result.add(expr);
    }
  }

  Var var(Variable v) {
    return new Var(Naming.toTargetIdentifier(v.name));
  }

  @Override
  public TargetExpr visitConst(SourceExpr.Const expr) {
    return new Literal(expr.value);
  }

  @Override
  public TargetExpr visitLocal(SourceExpr.Local expr) {
    return var(expr.variable);
  }

  @Override
  public TargetExpr visitVarDecl(SourceExpr.VarDecl expr) {
    Var v = var(expr.variable);
    if (expr.init == null) {
      return new Match(v, TargetExpr.NIL);
    } else if (expr.init instanceof SourceExpr.Unary unary
        && unary.op.isUpdate()
        && unary.postfix
        && unary.operand instanceof SourceExpr.Local counter) {
      // var x = g++
      Var g = var(counter.variable);
      return new TargetExpr.Block(
          ImmutableList.of(new Match(v, g), new Match(g, step(unary.op, g))));
    }
    TargetExpr next = calls.takeNext(v, expr.init);
    return (next != null) ? next : new Match(v, build(expr.init));
  }

  @Override
  public TargetExpr visitAssign(SourceExpr.Assign expr) {
    if (expr.target instanceof SourceExpr.Local local) {
      TargetExpr next = calls.takeNext(var(local.variable), expr.value);
      if (next != null) {
        return next;
      }
    }
    TargetExpr value = build(expr.value);
    if (expr.target instanceof SourceExpr.Local local) {
      return new Match(var(local.variable), value);
    } else if (expr.target instanceof SourceExpr.Index index
        && index.object instanceof SourceExpr.Local local) {
      Var container = var(local.variable);
      TargetExpr key = build(index.index);
      TargetExpr updated =
          (local.type.kind == SourceType.Kind.MAP)
              ? RemoteCall.of("Map", "put", container, key, value)
              : RemoteCall.of("List", "replace_at", container, key, value);
      return new Match(container, updated);
    } else if (expr.target instanceof SourceExpr.Field field
        && field.object instanceof SourceExpr.Local local) {
      Var container = var(local.variable);
      TargetExpr key = new TargetExpr.Atom(Naming.toTargetIdentifier(field.name));
      return new Match(container, RemoteCall.of("Map", "put", container, key, value));
    }
    throw CompileError.at(expr, "Cannot assign to %s", expr.target.kind());
  }

  @Override
  public TargetExpr visitAssignOp(SourceExpr.AssignOp expr) {
    SourceExpr combined =
        new SourceExpr.Binary(expr.target.type, expr.pos, expr.op, expr.target, expr.value);
    return visitAssign(new SourceExpr.Assign(expr.pos, expr.target, combined));
  }

  @Override
  public TargetExpr visitBinary(SourceExpr.Binary expr) {
    TargetExpr left = build(expr.left);
    TargetExpr right = build(expr.right);
    switch (expr.op) {
      case ADD:
        if (expr.left.type.isString() || expr.right.type.isString()) {
          return new Binary(
              Operator.CONCAT, asString(expr.left, left), asString(expr.right, right));
        } else if (expr.left.type.isArray() || expr.type.isArray()) {
          return new Binary(Operator.LIST_CONCAT, left, right);
        }
        return new Binary(Operator.ADD, left, right);
      case MOD:
        return new Binary(Operator.REM, left, right);
      default:
        return new Binary(operator(expr.op), left, right);
    }
  }

  private static TargetExpr asString(SourceExpr source, TargetExpr compiled) {
    return source.type.isString() ? compiled : RemoteCall.of("Kernel", "to_string", compiled);
  }

  private static Operator operator(Binop op) {
    return switch (op) {
      case ADD -> Operator.ADD;
      case SUB -> Operator.SUB;
      case MUL -> Operator.MUL;
      case DIV -> Operator.DIV;
      case MOD -> Operator.REM;
      case EQ -> Operator.EQ;
      case NE -> Operator.NE;
      case LT -> Operator.LT;
      case LE -> Operator.LE;
      case GT -> Operator.GT;
      case GE -> Operator.GE;
      case AND -> Operator.AND;
      case OR -> Operator.OR;
    };
  }

  @Override
  public TargetExpr visitUnary(SourceExpr.Unary expr) {
    switch (expr.op) {
      case NEG:
        return new TargetExpr.Unary(false, build(expr.operand));
      case NOT:
        return new TargetExpr.Unary(true, build(expr.operand));
      default:
        break;
    }
    // An increment or decrement whose value is used.
    if (!(expr.operand instanceof SourceExpr.Local local)) {
      throw CompileError.at(expr, "Cannot use the value of %s on an element", expr.op.symbol);
    }
    Var v = var(local.variable);
    Match rebind = new Match(v, step(expr.op, v));
    if (!expr.postfix) {
      return rebind;
    }
    // g++ is the old value: (g = g + 1; g - 1)
    Unop undo = (expr.op == Unop.INCREMENT) ? Unop.DECREMENT : Unop.INCREMENT;
    return new TargetExpr.Block(ImmutableList.of(rebind, step(undo, v)));
  }

  /** Compiles an increment or decrement statement. */
  private TargetExpr update(SourceExpr.Unary expr) {
    if (expr.operand instanceof SourceExpr.Local local) {
      Var v = var(local.variable);
      return new Match(v, step(expr.op, v));
    }
    Binop op = (expr.op == Unop.INCREMENT) ? Binop.ADD : Binop.SUB;
    return visitAssignOp(
        new SourceExpr.AssignOp(expr.pos, op, expr.operand, intConst(expr.pos, 1)));
  }

  private static TargetExpr step(Unop op, Var v) {
    return new Binary((op == Unop.INCREMENT) ? Operator.ADD : Operator.SUB, v, ONE);
  }

  @Override
  public TargetExpr visitBlock(SourceExpr.Block expr) {
    if (expr.type.isArray()) {
      Optional<TargetExpr> list = loops.tryCompileListBlock(expr);
      if (list.isPresent()) {
        return list.get();
      }
    }
    return TargetExpr.Block.of(compileStatements(expr.statements));
  }

  @Override
  public TargetExpr visitIf(SourceExpr.If expr) {
    TargetExpr cond = build(expr.cond);
    if (expr.type.kind == SourceType.Kind.VOID) {
      List<Variable> assigned = new ArrayList<>(EffectAnalyzer.detectMutatedVariables(expr));
      if (!assigned.isEmpty()) {
        TargetExpr state =
            (assigned.size() == 1)
                ? var(assigned.get(0))
                : new TupleLit(
                    assigned.stream().map(this::var).collect(ImmutableList.toImmutableList()));
        TargetExpr then = threaded(expr.then, state);
        TargetExpr otherwise = (expr.otherwise == null) ? state : threaded(expr.otherwise, state);
        return new Match(state, new If(cond, then, otherwise));
      }
    }
    return new If(cond, build(expr.then), (expr.otherwise == null) ? null : build(expr.otherwise));
  }

  /** Compiles a branch of a state-threading {@code if}, ending with the state's new value. */
  private TargetExpr threaded(SourceExpr branch, TargetExpr state) {
    List<TargetExpr> statements = new ArrayList<>();
    addStatements(statement(branch), statements);
    statements.add(state);
    return TargetExpr.Block.of(statements);
  }

  @Override
  public TargetExpr visitWhile(SourceExpr.While expr) {
    return TargetExpr.Block.of(loops.compileLoop(expr).statements);
  }

  @Override
  public TargetExpr visitFor(SourceExpr.For expr) {
    return TargetExpr.Block.of(loops.compileLoop(expr).statements);
  }

  @Override
  public TargetExpr visitIntRange(SourceExpr.IntRange expr) {
    if (SourceTrees.isIntConst(expr.start) && SourceTrees.isIntConst(expr.end)) {
      int first = ((SourceExpr.Const) expr.start).intValue();
      int last = ((SourceExpr.Const) expr.end).intValue() - 1;
      return new Range(new Literal(first), new Literal(last), last < first);
    }
    return new Range(build(expr.start), new Binary(Operator.SUB, build(expr.end), ONE), true);
  }

  @Override
  public TargetExpr visitArrayLit(SourceExpr.ArrayLit expr) {
    return new ListLit(buildAll(expr.elements));
  }

  @Override
  public TargetExpr visitMapLit(SourceExpr.MapLit expr) {
    return new TargetExpr.MapLit(buildAll(expr.keys), buildAll(expr.values));
  }

  ImmutableList<TargetExpr> buildAll(List<SourceExpr> exprs) {
    return exprs.stream().map(this::build).collect(ImmutableList.toImmutableList());
  }

  @Override
  public TargetExpr visitCall(SourceExpr.Call expr) {
    return calls.compile(expr);
  }

  @Override
  public TargetExpr visitField(SourceExpr.Field expr) {
    TargetExpr object = build(expr.object);
    if (expr.name.equals("length")) {
      return expr.object.type.isString()
          ? RemoteCall.of("String", "length", object)
          : new TargetExpr.Call("length", ImmutableList.of(object));
    }
    return new TargetExpr.FieldAccess(object, Naming.toTargetIdentifier(expr.name));
  }

  @Override
  public TargetExpr visitIndex(SourceExpr.Index expr) {
    TargetExpr object = build(expr.object);
    TargetExpr index = build(expr.index);
    return switch (expr.object.type.kind) {
      case MAP -> RemoteCall.of("Map", "get", object, index);
      case STRING -> RemoteCall.of("String", "at", object, index);
      default -> RemoteCall.of("Enum", "at", object, index);
    };
  }

  @Override
  public TargetExpr visitFunction(SourceExpr.Function expr) {
    ImmutableList<TargetExpr> params =
        expr.params.stream().map(this::var).collect(ImmutableList.toImmutableList());
    TargetExpr body;
    loops.enterFunction();
    try {
      body = functionBody(expr.body);
    } finally {
      loops.exitFunction();
    }
    return new Fn(params, body);
  }

  /**
   * Compiles the body of a function literal. A trailing {@code return} just provides the
   * function's value; any other {@code return} is thrown, and caught around the whole body.
   */
  private TargetExpr functionBody(SourceExpr body) {
    ImmutableList<SourceExpr> statements = SourceTrees.statements(body);
    int n = statements.size();
    List<TargetExpr> compiled = new ArrayList<>();
    List<SourceExpr> rest = statements;
    if (n > 0 && statements.get(n - 1) instanceof SourceExpr.Return tail) {
      rest = statements.subList(0, n - 1);
      compiled.addAll(compileStatements(rest));
      compiled.add((tail.value == null) ? TargetExpr.NIL : build(tail.value));
    } else {
      compiled.addAll(compileStatements(statements));
    }
    TargetExpr result = TargetExpr.Block.of(compiled);
    boolean throwsReturn =
        rest.stream().anyMatch(s -> SourceTrees.containsOutsideFunctions(s, Kind.RETURN));
    return throwsReturn ? LoopCompiler.catchReturn(result) : result;
  }

  @Override
  public TargetExpr visitReturn(SourceExpr.Return expr) {
    @Nullable TargetExpr value = (expr.value == null) ? null : build(expr.value);
    return loops.lowerExit(expr, value);
  }

  @Override
  public TargetExpr visitBreak(SourceExpr.Break expr) {
    if (!loops.inLoop()) {
      throw CompileError.at(expr, "break outside a loop");
    }
    return loops.lowerExit(expr, null);
  }

  @Override
  public TargetExpr visitContinue(SourceExpr.Continue expr) {
    if (!loops.inLoop()) {
      throw CompileError.at(expr, "continue outside a loop");
    }
    return loops.lowerExit(expr, null);
  }

  /** Returns an integer constant at {@code pos}. */
  static SourceExpr intConst(Position pos, int value) {
    return new SourceExpr.Const(SourceType.INT, pos, value);
  }
}
