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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node in the typed, desugared source tree produced by the front-end.
 *
 * <p>The set of node classes is closed: every subclass is nested here, and {@link Visitor} has one
 * method for each of them, so code that must handle every kind of node can implement Visitor and
 * will fail to compile if a new kind is added.
 *
 * <p>Nodes are immutable. Refold never modifies a tree it is given; when it needs a variant of a
 * subtree (e.g. a loop body with its synthetic counter statements removed) it builds a new one,
 * usually with {@link #withChildren}.
 */
public abstract class SourceExpr {

  public enum Kind {
    CONST,
    LOCAL,
    VAR_DECL,
    ASSIGN,
    ASSIGN_OP,
    BINARY,
    UNARY,
    BLOCK,
    IF,
    WHILE,
    FOR,
    INT_RANGE,
    ARRAY_LIT,
    MAP_LIT,
    CALL,
    FIELD,
    INDEX,
    FUNCTION,
    RETURN,
    BREAK,
    CONTINUE
  }

  /** One method for each concrete subclass of SourceExpr. */
  public interface Visitor<T> {
    T visitConst(Const expr);

    T visitLocal(Local expr);

    T visitVarDecl(VarDecl expr);

    T visitAssign(Assign expr);

    T visitAssignOp(AssignOp expr);

    T visitBinary(Binary expr);

    T visitUnary(Unary expr);

    T visitBlock(Block expr);

    T visitIf(If expr);

    T visitWhile(While expr);

    T visitFor(For expr);

    T visitIntRange(IntRange expr);

    T visitArrayLit(ArrayLit expr);

    T visitMapLit(MapLit expr);

    T visitCall(Call expr);

    T visitField(Field expr);

    T visitIndex(Index expr);

    T visitFunction(Function expr);

    T visitReturn(Return expr);

    T visitBreak(Break expr);

    T visitContinue(Continue expr);
  }

  public final SourceType type;
  public final Position pos;

  private SourceExpr(SourceType type, Position pos) {
    this.type = Preconditions.checkNotNull(type);
    this.pos = Preconditions.checkNotNull(pos);
  }

  public abstract Kind kind();

  /** Returns this node's immediate subexpressions, in evaluation order. */
  public abstract ImmutableList<SourceExpr> children();

  /**
   * Returns a node of the same kind with the same attributes as this one, but with the given
   * children (which must correspond one-to-one with {@link #children}; a null optional child must
   * stay absent).
   */
  public abstract SourceExpr withChildren(List<SourceExpr> children);

  public abstract <T> T accept(Visitor<T> visitor);

  /** Returns true if this is a node of the given kind. */
  public final boolean is(Kind kind) {
    return kind() == kind;
  }

  private static ImmutableList<SourceExpr> childList(@Nullable SourceExpr... children) {
    ImmutableList.Builder<SourceExpr> builder = ImmutableList.builder();
    for (SourceExpr child : children) {
      if (child != null) {
        builder.add(child);
      }
    }
    return builder.build();
  }

  final void checkArity(List<SourceExpr> children) {
    Preconditions.checkArgument(
        children.size() == children().size(), "Wrong number of children for %s", kind());
  }

  /** An Int, Float, String or Bool literal, or {@code null}. */
  public static final class Const extends SourceExpr {
    public final @Nullable Object value;

    public Const(SourceType type, Position pos, @Nullable Object value) {
      super(type, pos);
      Preconditions.checkArgument(
          value == null
              || value instanceof Integer
              || value instanceof Double
              || value instanceof String
              || value instanceof Boolean,
          "Unsupported constant %s",
          value);
      this.value = value;
    }

    public boolean isInt() {
      return value instanceof Integer;
    }

    public int intValue() {
      return (Integer) value;
    }

    @Override
    public Kind kind() {
      return Kind.CONST;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitConst(this);
    }
  }

  /** A reference to a local variable. */
  public static final class Local extends SourceExpr {
    public final Variable variable;

    public Local(Position pos, Variable variable) {
      super(variable.type, pos);
      this.variable = variable;
    }

    @Override
    public Kind kind() {
      return Kind.LOCAL;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitLocal(this);
    }
  }

  /** {@code var v = init}; {@code init} is null for a declaration without initializer. */
  public static final class VarDecl extends SourceExpr {
    public final Variable variable;
    public final @Nullable SourceExpr init;

    public VarDecl(Position pos, Variable variable, @Nullable SourceExpr init) {
      super(SourceType.VOID, pos);
      this.variable = variable;
      this.init = init;
    }

    @Override
    public Kind kind() {
      return Kind.VAR_DECL;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return childList(init);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return (init == null) ? this : new VarDecl(pos, variable, children.get(0));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitVarDecl(this);
    }
  }

  /** {@code target = value}, where target is a Local, Field or Index. */
  public static final class Assign extends SourceExpr {
    public final SourceExpr target;
    public final SourceExpr value;

    public Assign(Position pos, SourceExpr target, SourceExpr value) {
      super(target.type, pos);
      checkAssignable(target);
      this.target = target;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(target, value);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Assign(pos, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssign(this);
    }
  }

  /** {@code target op= value}. */
  public static final class AssignOp extends SourceExpr {
    public final Binop op;
    public final SourceExpr target;
    public final SourceExpr value;

    public AssignOp(Position pos, Binop op, SourceExpr target, SourceExpr value) {
      super(target.type, pos);
      checkAssignable(target);
      this.op = op;
      this.target = target;
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.ASSIGN_OP;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(target, value);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new AssignOp(pos, op, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitAssignOp(this);
    }
  }

  private static void checkAssignable(SourceExpr target) {
    Preconditions.checkArgument(
        target.is(Kind.LOCAL) || target.is(Kind.FIELD) || target.is(Kind.INDEX),
        "Not assignable: %s",
        target.kind());
  }

  public static final class Binary extends SourceExpr {
    public final Binop op;
    public final SourceExpr left;
    public final SourceExpr right;

    public Binary(SourceType type, Position pos, Binop op, SourceExpr left, SourceExpr right) {
      super(type, pos);
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    public Kind kind() {
      return Kind.BINARY;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Binary(type, pos, op, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBinary(this);
    }
  }

  /** A unary operation; {@code postfix} is only meaningful for increment and decrement. */
  public static final class Unary extends SourceExpr {
    public final Unop op;
    public final boolean postfix;
    public final SourceExpr operand;

    public Unary(SourceType type, Position pos, Unop op, boolean postfix, SourceExpr operand) {
      super(type, pos);
      if (op.isUpdate()) {
        checkAssignable(operand);
      }
      this.op = op;
      this.postfix = postfix;
      this.operand = operand;
    }

    @Override
    public Kind kind() {
      return Kind.UNARY;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Unary(type, pos, op, postfix, children.get(0));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitUnary(this);
    }
  }

  /** A sequence of statements; the value of the block is the value of its last statement. */
  public static final class Block extends SourceExpr {
    public final ImmutableList<SourceExpr> statements;

    public Block(SourceType type, Position pos, List<SourceExpr> statements) {
      super(type, pos);
      this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public Kind kind() {
      return Kind.BLOCK;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return statements;
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Block(type, pos, children);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBlock(this);
    }
  }

  public static final class If extends SourceExpr {
    public final SourceExpr cond;
    public final SourceExpr then;
    public final @Nullable SourceExpr otherwise;

    public If(
        SourceType type,
        Position pos,
        SourceExpr cond,
        SourceExpr then,
        @Nullable SourceExpr otherwise) {
      super(type, pos);
      this.cond = cond;
      this.then = then;
      this.otherwise = otherwise;
    }

    @Override
    public Kind kind() {
      return Kind.IF;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return childList(cond, then, otherwise);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      SourceExpr newOtherwise = (otherwise == null) ? null : children.get(2);
      return new If(type, pos, children.get(0), children.get(1), newOtherwise);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }
  }

  /**
   * {@code while (cond) body} if {@code normalWhile} is true, {@code do body while (cond)}
   * otherwise.
   */
  public static final class While extends SourceExpr {
    public final SourceExpr cond;
    public final SourceExpr body;
    public final boolean normalWhile;

    public While(Position pos, SourceExpr cond, SourceExpr body, boolean normalWhile) {
      super(SourceType.VOID, pos);
      this.cond = cond;
      this.body = body;
      this.normalWhile = normalWhile;
    }

    @Override
    public Kind kind() {
      return Kind.WHILE;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return normalWhile ? ImmutableList.of(cond, body) : ImmutableList.of(body, cond);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return normalWhile
          ? new While(pos, children.get(0), children.get(1), true)
          : new While(pos, children.get(1), children.get(0), false);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitWhile(this);
    }
  }

  /** {@code for (variable in iterable) body}, where iterable is an IntRange or a collection. */
  public static final class For extends SourceExpr {
    public final Variable variable;
    public final SourceExpr iterable;
    public final SourceExpr body;

    public For(Position pos, Variable variable, SourceExpr iterable, SourceExpr body) {
      super(SourceType.VOID, pos);
      this.variable = variable;
      this.iterable = iterable;
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FOR;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(iterable, body);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new For(pos, variable, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFor(this);
    }
  }

  /** The half-open integer range {@code start...end}. */
  public static final class IntRange extends SourceExpr {
    public final SourceExpr start;
    public final SourceExpr end;

    public IntRange(Position pos, SourceExpr start, SourceExpr end) {
      super(SourceType.ITERATOR, pos);
      this.start = start;
      this.end = end;
    }

    @Override
    public Kind kind() {
      return Kind.INT_RANGE;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(start, end);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new IntRange(pos, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIntRange(this);
    }
  }

  public static final class ArrayLit extends SourceExpr {
    public final ImmutableList<SourceExpr> elements;

    public ArrayLit(SourceType type, Position pos, List<SourceExpr> elements) {
      super(type, pos);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public Kind kind() {
      return Kind.ARRAY_LIT;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return elements;
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new ArrayLit(type, pos, children);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitArrayLit(this);
    }
  }

  /** {@code [k1 => v1, k2 => v2, ...]}. */
  public static final class MapLit extends SourceExpr {
    public final ImmutableList<SourceExpr> keys;
    public final ImmutableList<SourceExpr> values;

    public MapLit(Position pos, List<SourceExpr> keys, List<SourceExpr> values) {
      super(SourceType.MAP, pos);
      Preconditions.checkArgument(keys.size() == values.size());
      this.keys = ImmutableList.copyOf(keys);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    public Kind kind() {
      return Kind.MAP_LIT;
    }

    /** Returns keys and values interleaved, in evaluation order. */
    @Override
    public ImmutableList<SourceExpr> children() {
      ImmutableList.Builder<SourceExpr> builder = ImmutableList.builder();
      for (int i = 0; i < keys.size(); i++) {
        builder.add(keys.get(i), values.get(i));
      }
      return builder.build();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      ImmutableList.Builder<SourceExpr> newKeys = ImmutableList.builder();
      ImmutableList.Builder<SourceExpr> newValues = ImmutableList.builder();
      for (int i = 0; i < children.size(); i += 2) {
        newKeys.add(children.get(i));
        newValues.add(children.get(i + 1));
      }
      return new MapLit(pos, newKeys.build(), newValues.build());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitMapLit(this);
    }
  }

  /**
   * A function call. If {@code receiver} is null this is a call to a static or global function,
   * and {@code name} may be qualified (e.g. {@code "Log.trace"}); otherwise it is a method call on
   * {@code receiver}.
   */
  public static final class Call extends SourceExpr {
    public final @Nullable SourceExpr receiver;
    public final String name;
    public final ImmutableList<SourceExpr> args;

    public Call(
        SourceType type,
        Position pos,
        @Nullable SourceExpr receiver,
        String name,
        List<SourceExpr> args) {
      super(type, pos);
      this.receiver = receiver;
      this.name = name;
      this.args = ImmutableList.copyOf(args);
    }

    /** Returns true if this is a method call with the given name on a local variable. */
    public boolean isMethodOnLocal(String methodName) {
      return receiver != null && receiver.is(Kind.LOCAL) && name.equals(methodName);
    }

    @Override
    public Kind kind() {
      return Kind.CALL;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return (receiver == null)
          ? args
          : ImmutableList.<SourceExpr>builder().add(receiver).addAll(args).build();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return (receiver == null)
          ? new Call(type, pos, null, name, children)
          : new Call(type, pos, children.get(0), name, children.subList(1, children.size()));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitCall(this);
    }
  }

  public static final class Field extends SourceExpr {
    public final SourceExpr object;
    public final String name;

    public Field(SourceType type, Position pos, SourceExpr object, String name) {
      super(type, pos);
      this.object = object;
      this.name = name;
    }

    @Override
    public Kind kind() {
      return Kind.FIELD;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(object);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Field(type, pos, children.get(0), name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitField(this);
    }
  }

  /** {@code object[index]}. */
  public static final class Index extends SourceExpr {
    public final SourceExpr object;
    public final SourceExpr index;

    public Index(SourceType type, Position pos, SourceExpr object, SourceExpr index) {
      super(type, pos);
      this.object = object;
      this.index = index;
    }

    @Override
    public Kind kind() {
      return Kind.INDEX;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(object, index);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Index(type, pos, children.get(0), children.get(1));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIndex(this);
    }
  }

  /** A function literal. Its body is a closure boundary for loop exits. */
  public static final class Function extends SourceExpr {
    public final ImmutableList<Variable> params;
    public final SourceExpr body;

    public Function(Position pos, List<Variable> params, SourceExpr body) {
      super(SourceType.FUNCTION, pos);
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    @Override
    public Kind kind() {
      return Kind.FUNCTION;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of(body);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return new Function(pos, params, children.get(0));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitFunction(this);
    }
  }

  public static final class Return extends SourceExpr {
    public final @Nullable SourceExpr value;

    public Return(Position pos, @Nullable SourceExpr value) {
      super(SourceType.VOID, pos);
      this.value = value;
    }

    @Override
    public Kind kind() {
      return Kind.RETURN;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return childList(value);
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      checkArity(children);
      return (value == null) ? this : new Return(pos, children.get(0));
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitReturn(this);
    }
  }

  public static final class Break extends SourceExpr {
    public Break(Position pos) {
      super(SourceType.VOID, pos);
    }

    @Override
    public Kind kind() {
      return Kind.BREAK;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitBreak(this);
    }
  }

  public static final class Continue extends SourceExpr {
    public Continue(Position pos) {
      super(SourceType.VOID, pos);
    }

    @Override
    public Kind kind() {
      return Kind.CONTINUE;
    }

    @Override
    public ImmutableList<SourceExpr> children() {
      return ImmutableList.of();
    }

    @Override
    public SourceExpr withChildren(List<SourceExpr> children) {
      Preconditions.checkArgument(children.isEmpty());
      return this;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitContinue(this);
    }
  }
}
