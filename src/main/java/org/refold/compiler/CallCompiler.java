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
import com.google.common.collect.ImmutableMap;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Call;
import org.refold.source.SourceType;
import org.refold.target.TargetExpr;
import org.refold.target.TargetExpr.Binary;
import org.refold.target.TargetExpr.ListLit;
import org.refold.target.TargetExpr.Literal;
import org.refold.target.TargetExpr.Match;
import org.refold.target.TargetExpr.Operator;
import org.refold.target.TargetExpr.RemoteCall;
import org.refold.target.TargetExpr.TupleLit;
import org.refold.target.TargetExpr.Var;

/** Compiles static function calls and method calls. */
class CallCompiler {

  /** Static functions with a direct target equivalent, as {@code {module, function}}. */
  private static final ImmutableMap<String, String[]> STATICS =
      ImmutableMap.of(
          "trace", new String[] {"Log", "trace"},
          "Log.trace", new String[] {"Log", "trace"},
          "Sys.println", new String[] {"IO", "puts"},
          "Sys.print", new String[] {"IO", "write"},
          "Std.print", new String[] {"IO", "write"},
          "Std.string", new String[] {"Kernel", "to_string"},
          "Std.int", new String[] {"Kernel", "trunc"});

  private final ExpressionCompiler compiler;

  CallCompiler(ExpressionCompiler compiler) {
    this.compiler = compiler;
  }

  TargetExpr compile(Call call) {
    ImmutableList<TargetExpr> args = compiler.buildAll(call.args);
    if (call.receiver == null) {
      return compileStatic(call.name, args);
    }
    TargetExpr receiver = compiler.build(call.receiver);
    switch (call.name) {
      case "push":
        checkArity(call, 1);
        return update(call, new Binary(Operator.LIST_CONCAT, receiver, new ListLit(args)));
      case "unshift":
        checkArity(call, 1);
        return update(call, new Binary(Operator.LIST_CONCAT, new ListLit(args), receiver));
      case "set":
        checkArity(call, 2);
        return update(call, remote("Map", "put", receiver, args));
      case "remove":
        checkArity(call, 1);
        return (call.receiver.type.kind == SourceType.Kind.MAP)
            ? update(call, remote("Map", "delete", receiver, args))
            : update(call, remote("List", "delete", receiver, args));
      case "concat":
        checkArity(call, 1);
        return new Binary(Operator.LIST_CONCAT, receiver, args.get(0));
      case "get":
        return remote("Map", "get", receiver, args);
      case "exists":
        return remote("Map", "has_key?", receiver, args);
      case "keys":
        return remote("Map", "keys", receiver, args);
      case "contains":
        return remote("Enum", "member?", receiver, args);
      case "join":
        return remote("Enum", "join", receiver, args);
      case "map":
        return remote("Enum", "map", receiver, args);
      case "filter":
        return remote("Enum", "filter", receiver, args);
      case "copy":
        checkArity(call, 0);
        return receiver;
      case "toString":
        return remote("Kernel", "to_string", receiver, args);
      case "toUpperCase":
        return remote("String", "upcase", receiver, args);
      case "toLowerCase":
        return remote("String", "downcase", receiver, args);
      case "charAt":
        return remote("String", "at", receiver, args);
      case "split":
        return remote("String", "split", receiver, args);
      case "iterator":
        // The iterator is the list of elements not yet visited.
        checkArity(call, 0);
        return (call.receiver.type.kind == SourceType.Kind.MAP)
            ? remote("Map", "values", receiver, args)
            : receiver;
      case "hasNext":
        checkArity(call, 0);
        return new Binary(Operator.NE, receiver, new ListLit(ImmutableList.of()));
      case "next":
        throw CompileError.at(call, "next() must initialize or assign a local variable");
      case "keyValueIterator":
        throw CompileError.at(call, "Iterator method %s outside a recognized loop", call.name);
      default:
        throw CompileError.at(call, "Unsupported method %s", call.name);
    }
  }

  private static TargetExpr compileStatic(String name, List<TargetExpr> args) {
    String[] known = STATICS.get(name);
    if (known != null) {
      return new RemoteCall(known[0], known[1], args);
    }
    int dot = name.lastIndexOf('.');
    if (dot < 0) {
      return new TargetExpr.Call(Naming.toTargetIdentifier(name), args);
    }
    return new RemoteCall(
        name.substring(0, dot), Naming.toTargetIdentifier(name.substring(dot + 1)), args);
  }

  /** Returns a call of {@code module.function} with {@code receiver} as its first argument. */
  private static TargetExpr remote(
      String module, String function, TargetExpr receiver, List<TargetExpr> args) {
    return new RemoteCall(
        module, function, ImmutableList.<TargetExpr>builder().add(receiver).addAll(args).build());
  }

  /**
   * Returns {@code {target, it} = List.pop_at(it, 0)} if {@code init} is {@code it.next()} on a
   * local iterator, or null otherwise.
   */
  @Nullable TargetExpr takeNext(TargetExpr target, SourceExpr init) {
    if (!(init instanceof Call call) || call.receiver == null || !call.name.equals("next")) {
      return null;
    }
    checkArity(call, 0);
    if (!(call.receiver instanceof SourceExpr.Local local)) {
      throw CompileError.at(call, "next on a receiver that is not a local variable");
    }
    Var iterator = compiler.var(local.variable);
    return new Match(
        TupleLit.of(target, iterator), RemoteCall.of("List", "pop_at", iterator, new Literal(0)));
  }

  /** Returns a match that rebinds the local receiver of a mutating method to {@code updated}. */
  private TargetExpr update(Call call, TargetExpr updated) {
    if (!(call.receiver instanceof SourceExpr.Local local)) {
      throw CompileError.at(call, "%s on a receiver that is not a local variable", call.name);
    }
    Var v = compiler.var(local.variable);
    return new Match(v, updated);
  }

  private static void checkArity(Call call, int arity) {
    if (call.args.size() != arity) {
      throw CompileError.at(
          call, "%s expects %s arguments, got %s", call.name, arity, call.args.size());
    }
  }
}
