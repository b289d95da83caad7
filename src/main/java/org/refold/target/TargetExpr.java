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

package org.refold.target;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A node in the functional target tree emitted by Refold.
 *
 * <p>Target trees are immutable. {@link #toString} returns a compact single-line Elixir-like
 * rendering that is used by tests and in log messages; two nodes are {@link #equals} iff their
 * renderings are identical.
 *
 * <p>Patterns (the left-hand side of a {@link Match}, {@link Fn} parameters, {@link For}
 * generators and {@link Try} catch clauses) are ordinary TargetExprs built from {@link Var}, {@link
 * Wildcard}, {@link Literal}, {@link Atom}, {@link TupleLit} and {@link ListLit}.
 */
public abstract class TargetExpr {

  // Precedence levels used when rendering; higher binds tighter.
  static final int LOWEST = 0;
  static final int OR = 1;
  static final int AND = 2;
  static final int EQUALITY = 3;
  static final int COMPARISON = 4;
  static final int CONCAT = 5;
  static final int ADDITIVE = 6;
  static final int MULTIPLICATIVE = 7;
  static final int UNARY = 8;
  static final int PRIMARY = 9;

  /** A pattern or expression that ignores its value: {@code _}. */
  public static final TargetExpr WILDCARD = new Wildcard();

  public static final TargetExpr NIL = new Literal(null);

  public static final TargetExpr OK = new Atom("ok");

  private TargetExpr() {}

  /** Returns the precedence of this node when it appears as an operand. */
  abstract int precedence();

  /** Appends this node's rendering to {@code sb}, without enclosing parentheses. */
  abstract void print(StringBuilder sb);

  /** Appends this node's rendering, parenthesized if its precedence is below {@code minPrec}. */
  final void print(StringBuilder sb, int minPrec) {
    if (precedence() < minPrec) {
      sb.append('(');
      print(sb);
      sb.append(')');
    } else {
      print(sb);
    }
  }

  /**
   * Appends the rendering of a construct body (the contents of a {@code do ... end}, {@code fn ...
   * end} or similar): the statements of a block separated by semicolons.
   */
  static void printBody(StringBuilder sb, TargetExpr body) {
    if (body instanceof Block block && block.statements.size() > 1) {
      block.print(sb);
    } else {
      body.print(sb, LOWEST);
    }
  }

  private static void printList(StringBuilder sb, List<TargetExpr> exprs) {
    for (int i = 0; i < exprs.size(); i++) {
      if (i != 0) {
        sb.append(", ");
      }
      exprs.get(i).print(sb, OR);
    }
  }

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    print(sb);
    return sb.toString();
  }

  @Override
  public final boolean equals(Object obj) {
    return obj instanceof TargetExpr && toString().equals(obj.toString());
  }

  @Override
  public final int hashCode() {
    return toString().hashCode();
  }

  /** A variable reference, or a binding occurrence in a pattern. */
  public static final class Var extends TargetExpr {
    public final String name;

    public Var(String name) {
      Preconditions.checkArgument(!name.isEmpty());
      this.name = name;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append(name);
    }
  }

  public static final class Wildcard extends TargetExpr {
    private Wildcard() {}

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append('_');
    }
  }

  /** An integer, float, string or boolean constant, or {@code nil}. */
  public static final class Literal extends TargetExpr {
    public final @Nullable Object value;

    public Literal(@Nullable Object value) {
      Preconditions.checkArgument(
          value == null
              || value instanceof Integer
              || value instanceof Double
              || value instanceof String
              || value instanceof Boolean);
      this.value = value;
    }

    @Override
    int precedence() {
      return (value instanceof Number n && n.doubleValue() < 0) ? UNARY : PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      if (value == null) {
        sb.append("nil");
      } else if (value instanceof String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
          char c = s.charAt(i);
          switch (c) {
            case '"' -> sb.append("\\\"");
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '#' -> sb.append(i + 1 < s.length() && s.charAt(i + 1) == '{' ? "\\#" : "#");
            default -> sb.append(c);
          }
        }
        sb.append('"');
      } else {
        sb.append(value);
      }
    }
  }

  public static final class Atom extends TargetExpr {
    public final String name;

    public Atom(String name) {
      this.name = name;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append(':').append(name);
    }
  }

  public static final class ListLit extends TargetExpr {
    public final ImmutableList<TargetExpr> elements;

    public ListLit(List<TargetExpr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append('[');
      printList(sb, elements);
      sb.append(']');
    }
  }

  public static final class TupleLit extends TargetExpr {
    public final ImmutableList<TargetExpr> elements;

    public TupleLit(List<TargetExpr> elements) {
      this.elements = ImmutableList.copyOf(elements);
    }

    public static TupleLit of(TargetExpr... elements) {
      return new TupleLit(ImmutableList.copyOf(elements));
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append('{');
      printList(sb, elements);
      sb.append('}');
    }
  }

  public static final class MapLit extends TargetExpr {
    public final ImmutableList<TargetExpr> keys;
    public final ImmutableList<TargetExpr> values;

    public MapLit(List<TargetExpr> keys, List<TargetExpr> values) {
      Preconditions.checkArgument(keys.size() == values.size());
      this.keys = ImmutableList.copyOf(keys);
      this.values = ImmutableList.copyOf(values);
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("%{");
      for (int i = 0; i < keys.size(); i++) {
        if (i != 0) {
          sb.append(", ");
        }
        keys.get(i).print(sb, OR);
        sb.append(" => ");
        values.get(i).print(sb, OR);
      }
      sb.append('}');
    }
  }

  /** The binary operators of the target language. */
  public enum Operator {
    ADD("+", ADDITIVE),
    SUB("-", ADDITIVE),
    MUL("*", MULTIPLICATIVE),
    DIV("/", MULTIPLICATIVE),
    EQ("==", EQUALITY),
    NE("!=", EQUALITY),
    LT("<", COMPARISON),
    LE("<=", COMPARISON),
    GT(">", COMPARISON),
    GE(">=", COMPARISON),
    AND("and", TargetExpr.AND),
    OR("or", TargetExpr.OR),
    /** String concatenation. */
    CONCAT("<>", TargetExpr.CONCAT),
    /** List concatenation. */
    LIST_CONCAT("++", TargetExpr.CONCAT),
    /** Integer remainder, rendered as {@code rem(a, b)}. */
    REM("rem", PRIMARY),
    /** Integer division, rendered as {@code div(a, b)}. */
    DIV_INT("div", PRIMARY);

    public final String symbol;
    final int precedence;

    Operator(String symbol, int precedence) {
      this.symbol = symbol;
      this.precedence = precedence;
    }

    boolean isRightAssociative() {
      return precedence == TargetExpr.CONCAT;
    }

    boolean printsAsCall() {
      return precedence == PRIMARY;
    }
  }

  public static final class Binary extends TargetExpr {
    public final Operator op;
    public final TargetExpr left;
    public final TargetExpr right;

    public Binary(Operator op, TargetExpr left, TargetExpr right) {
      this.op = op;
      this.left = left;
      this.right = right;
    }

    @Override
    int precedence() {
      return op.precedence;
    }

    @Override
    void print(StringBuilder sb) {
      if (op.printsAsCall()) {
        sb.append(op.symbol).append('(');
        printList(sb, ImmutableList.of(left, right));
        sb.append(')');
        return;
      }
      int prec = op.precedence;
      left.print(sb, op.isRightAssociative() ? prec + 1 : prec);
      sb.append(' ').append(op.symbol).append(' ');
      right.print(sb, op.isRightAssociative() ? prec : prec + 1);
    }
  }

  public static final class Unary extends TargetExpr {
    public final boolean isNot;
    public final TargetExpr operand;

    /** Creates {@code not operand} if {@code isNot} is true, {@code -operand} otherwise. */
    public Unary(boolean isNot, TargetExpr operand) {
      this.isNot = isNot;
      this.operand = operand;
    }

    @Override
    int precedence() {
      return UNARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append(isNot ? "not " : "-");
      operand.print(sb, UNARY);
    }
  }

  /** A call to a local (or auto-imported) function. */
  public static final class Call extends TargetExpr {
    public final String name;
    public final ImmutableList<TargetExpr> args;

    public Call(String name, List<TargetExpr> args) {
      this.name = name;
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append(name).append('(');
      printList(sb, args);
      sb.append(')');
    }
  }

  /** {@code Module.function(args)}. */
  public static final class RemoteCall extends TargetExpr {
    public final String module;
    public final String name;
    public final ImmutableList<TargetExpr> args;

    public RemoteCall(String module, String name, List<TargetExpr> args) {
      this.module = module;
      this.name = name;
      this.args = ImmutableList.copyOf(args);
    }

    public static RemoteCall of(String module, String name, TargetExpr... args) {
      return new RemoteCall(module, name, ImmutableList.copyOf(args));
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append(module).append('.').append(name).append('(');
      printList(sb, args);
      sb.append(')');
    }
  }

  public static final class FieldAccess extends TargetExpr {
    public final TargetExpr object;
    public final String name;

    public FieldAccess(TargetExpr object, String name) {
      this.object = object;
      this.name = name;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      object.print(sb, PRIMARY);
      sb.append('.').append(name);
    }
  }

  /** An anonymous function with a single clause. */
  public static final class Fn extends TargetExpr {
    public final ImmutableList<TargetExpr> params;
    public final TargetExpr body;

    public Fn(List<TargetExpr> params, TargetExpr body) {
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("fn ");
      if (!params.isEmpty()) {
        printList(sb, params);
        sb.append(' ');
      }
      sb.append("-> ");
      printBody(sb, body);
      sb.append(" end");
    }
  }

  /** {@code pattern = value}. */
  public static final class Match extends TargetExpr {
    public final TargetExpr pattern;
    public final TargetExpr value;

    public Match(TargetExpr pattern, TargetExpr value) {
      this.pattern = pattern;
      this.value = value;
    }

    @Override
    int precedence() {
      return LOWEST;
    }

    @Override
    void print(StringBuilder sb) {
      pattern.print(sb, OR);
      sb.append(" = ");
      value.print(sb, LOWEST);
    }
  }

  /** A sequence of expressions; its value is the value of the last one ({@code nil} if empty). */
  public static final class Block extends TargetExpr {
    public final ImmutableList<TargetExpr> statements;

    public Block(List<TargetExpr> statements) {
      this.statements = ImmutableList.copyOf(statements);
    }

    /**
     * Returns a single expression equivalent to the given statements: the statement itself if
     * there is just one, a Block otherwise.
     */
    public static TargetExpr of(List<TargetExpr> statements) {
      return (statements.size() == 1) ? statements.get(0) : new Block(statements);
    }

    @Override
    int precedence() {
      return switch (statements.size()) {
        case 0 -> PRIMARY;
        case 1 -> statements.get(0).precedence();
        default -> LOWEST - 1;
      };
    }

    @Override
    void print(StringBuilder sb) {
      if (statements.isEmpty()) {
        sb.append("nil");
        return;
      }
      for (int i = 0; i < statements.size(); i++) {
        if (i != 0) {
          sb.append("; ");
        }
        statements.get(i).print(sb, LOWEST);
      }
    }
  }

  public static final class If extends TargetExpr {
    public final TargetExpr cond;
    public final TargetExpr then;
    public final @Nullable TargetExpr otherwise;

    public If(TargetExpr cond, TargetExpr then, @Nullable TargetExpr otherwise) {
      this.cond = cond;
      this.then = then;
      this.otherwise = otherwise;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("if ");
      cond.print(sb, OR);
      sb.append(" do ");
      printBody(sb, then);
      if (otherwise != null) {
        sb.append(" else ");
        printBody(sb, otherwise);
      }
      sb.append(" end");
    }
  }

  /**
   * The inclusive range {@code first..last}. If {@code explicitStep} is true the range is rendered
   * {@code first..last//1}, and is empty when {@code last < first}; otherwise such a range counts
   * down.
   */
  public static final class Range extends TargetExpr {
    public final TargetExpr first;
    public final TargetExpr last;
    public final boolean explicitStep;

    public Range(TargetExpr first, TargetExpr last, boolean explicitStep) {
      this.first = first;
      this.last = last;
      this.explicitStep = explicitStep;
    }

    @Override
    int precedence() {
      return CONCAT;
    }

    @Override
    void print(StringBuilder sb) {
      first.print(sb, ADDITIVE);
      sb.append("..");
      last.print(sb, ADDITIVE);
      if (explicitStep) {
        sb.append("//1");
      }
    }
  }

  /** A comprehension: {@code for p <- source, filter, ..., do: body}. */
  public static final class For extends TargetExpr {

    /** A generator ({@code pattern <- expr}) if {@code pattern} is non-null, else a filter. */
    public static final class Clause {
      public final @Nullable TargetExpr pattern;
      public final TargetExpr expr;

      private Clause(@Nullable TargetExpr pattern, TargetExpr expr) {
        this.pattern = pattern;
        this.expr = expr;
      }

      public static Clause generator(TargetExpr pattern, TargetExpr source) {
        return new Clause(Preconditions.checkNotNull(pattern), source);
      }

      public static Clause filter(TargetExpr cond) {
        return new Clause(null, cond);
      }

      public boolean isGenerator() {
        return pattern != null;
      }
    }

    public final ImmutableList<Clause> clauses;
    public final TargetExpr body;

    public For(List<Clause> clauses, TargetExpr body) {
      Preconditions.checkArgument(!clauses.isEmpty() && clauses.get(0).isGenerator());
      this.clauses = ImmutableList.copyOf(clauses);
      this.body = body;
    }

    @Override
    int precedence() {
      return LOWEST;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("for ");
      for (Clause clause : clauses) {
        if (clause.pattern != null) {
          clause.pattern.print(sb, OR);
          sb.append(" <- ");
        }
        clause.expr.print(sb, OR);
        sb.append(", ");
      }
      sb.append("do: ");
      body.print(sb, OR);
    }
  }

  /** {@code try do body catch kind, pattern -> handler; ... end}. */
  public static final class Try extends TargetExpr {

    public static final class CatchClause {
      /** The kind of exit caught, e.g. {@code "throw"}. */
      public final String kind;

      public final TargetExpr pattern;
      public final TargetExpr body;

      public CatchClause(String kind, TargetExpr pattern, TargetExpr body) {
        this.kind = kind;
        this.pattern = pattern;
        this.body = body;
      }
    }

    public final TargetExpr body;
    public final ImmutableList<CatchClause> catches;

    public Try(TargetExpr body, List<CatchClause> catches) {
      Preconditions.checkArgument(!catches.isEmpty());
      this.body = body;
      this.catches = ImmutableList.copyOf(catches);
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("try do ");
      printBody(sb, body);
      sb.append(" catch ");
      for (int i = 0; i < catches.size(); i++) {
        CatchClause clause = catches.get(i);
        if (i != 0) {
          sb.append("; ");
        }
        sb.append(':').append(clause.kind).append(", ");
        clause.pattern.print(sb, OR);
        sb.append(" -> ");
        clause.body.print(sb, OR);
      }
      sb.append(" end");
    }
  }

  /** {@code throw(value)}. */
  public static final class Throw extends TargetExpr {
    public final TargetExpr value;

    public Throw(TargetExpr value) {
      this.value = value;
    }

    @Override
    int precedence() {
      return PRIMARY;
    }

    @Override
    void print(StringBuilder sb) {
      sb.append("throw(");
      value.print(sb, OR);
      sb.append(')');
    }
  }
}
