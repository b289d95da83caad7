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
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.refold.source.Binop;
import org.refold.source.Position;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Assign;
import org.refold.source.SourceExpr.Block;
import org.refold.source.SourceExpr.Const;
import org.refold.source.SourceExpr.Local;
import org.refold.source.SourceExpr.VarDecl;
import org.refold.source.SourceTrees;
import org.refold.source.SourceType;
import org.refold.source.Variable;

/**
 * Matches a constant-range loop that the front-end unrolled into a flat sequence of appends, and
 * recovers the per-element template. Two forms are recognized:
 *
 * <pre>
 * { var acc = []; acc.push(f(0)); acc.push(f(1)); ...; acc; }
 *
 * var result = acc = [];
 * acc.push(f(0));
 * acc.push(f(1));
 * ...
 * [];
 * </pre>
 *
 * The appended values must be identical except for integer constants that count up by one from
 * each value to the next; those constants are replaced by a synthetic binder.
 */
final class UnrolledRangeMatcher implements ShapeMatcher {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final double STRICT_CONFIDENCE = 0.9;
  static final double LOOSE_CONFIDENCE = 0.75;

  /** Matches the chained-assignment form at the current statement. */
  @Override
  public Optional<CandidateShape> match(MatchContext context) {
    Variable result;
    SourceExpr chained;
    if (context.current() instanceof VarDecl decl && decl.init != null) {
      result = decl.variable;
      chained = decl.init;
    } else if (context.current() instanceof Assign outer && outer.target instanceof Local target) {
      result = target.variable;
      chained = outer.value;
    } else {
      return Optional.empty();
    }
    if (!(chained instanceof Assign inner)
        || !(inner.target instanceof Local accRef)
        || !SourceTrees.isEmptyArray(inner.value)
        || accRef.variable.equals(result)) {
      return Optional.empty();
    }
    Variable acc = accRef.variable;
    List<SourceExpr> values = new ArrayList<>();
    int offset = 1;
    for (SourceExpr stmt = context.at(offset); stmt != null; stmt = context.at(++offset)) {
      // Only push preserves the aliasing between result and acc.
      Optional<PushMatcher.Append> append = PushMatcher.matchAppend(stmt);
      if (append.isEmpty() || !append.get().isPush || !append.get().target.equals(acc)) {
        break;
      }
      values.add(append.get().value);
    }
    if (values.size() < 2 || !SourceTrees.isEmptyArray(context.at(offset))) {
      return Optional.empty();
    }
    int consumed = offset + 1;
    if (SourceTrees.referencesAny(context.following(consumed), ImmutableSet.of(acc))) {
      return Optional.empty();
    }
    return reconstruct(context, values, ImmutableSet.of(acc, result), result, consumed);
  }

  /** Matches the list-building block form. */
  Optional<CandidateShape> matchBlock(Block block, MatchContext context) {
    ImmutableList<SourceExpr> statements = block.statements;
    int size = statements.size();
    if (size < 4
        || !(statements.get(0) instanceof VarDecl decl)
        || decl.init == null
        || !SourceTrees.isEmptyArray(decl.init)
        || !SourceTrees.isLocal(statements.get(size - 1), decl.variable)) {
      return Optional.empty();
    }
    Variable acc = decl.variable;
    List<SourceExpr> values = new ArrayList<>();
    for (SourceExpr stmt : statements.subList(1, size - 1)) {
      Optional<PushMatcher.Append> append = PushMatcher.matchAppend(stmt);
      if (append.isEmpty() || !append.get().target.equals(acc)) {
        return Optional.empty();
      }
      values.add(append.get().value);
    }
    return reconstruct(context, values, ImmutableSet.of(acc), acc, size);
  }

  private static Optional<CandidateShape> reconstruct(
      MatchContext context,
      List<SourceExpr> values,
      Set<Variable> sequenceVars,
      Variable target,
      int consumed) {
    Alignment alignment = new Alignment(values.size());
    if (!alignment.align(values)) {
      return Optional.empty();
    }
    // A comprehension body cannot rebind outer variables.
    Set<Variable> mutated = EffectAnalyzer.detectMutatedVariables(values);
    if (!mutated.isEmpty()) {
      logger.atFine().log("Unrolled sequence rejected: values modify %s", mutated);
      return Optional.empty();
    }
    boolean loose = false;
    if (!alignment.free.isEmpty()) {
      if (!Collections.disjoint(alignment.free, sequenceVars)) {
        logger.atFine().log("Unrolled sequence rejected: values refer to %s", sequenceVars);
        return Optional.empty();
      } else if (!context.config.looseUnrolledExtraction) {
        logger.atFine().log("Unrolled sequence rejected: values refer to %s", alignment.free);
        return Optional.empty();
      }
      loose = true;
    }
    for (List<Const> consts : alignment.varying) {
      int base = consts.get(0).intValue();
      for (int j = 1; j < consts.size(); j++) {
        if (consts.get(j).intValue() != base + j) {
          logger.atFine().log("Unrolled sequence rejected: constants do not count up by one");
          return Optional.empty();
        }
      }
    }
    SourceExpr first = values.get(0);
    Position pos = first.pos;
    int start = alignment.varying.isEmpty() ? 0 : alignment.varying.get(0).get(0).intValue();
    Variable binder = null;
    SourceExpr template = first;
    if (!alignment.varying.isEmpty()) {
      Set<String> avoid = new TreeSet<>();
      for (Variable v : SourceTrees.referencedVariables(first)) {
        avoid.add(context.naming.convert(v.name));
      }
      for (Variable v : SourceTrees.declaredVariables(first)) {
        avoid.add(context.naming.convert(v.name));
      }
      binder = context.names.syntheticVariable(context.names.freshIndexName(avoid), SourceType.INT);
      Map<SourceExpr, SourceExpr> replacements = new IdentityHashMap<>();
      for (List<Const> consts : alignment.varying) {
        int delta = consts.get(0).intValue() - start;
        SourceExpr index = new Local(pos, binder);
        replacements.put(
            consts.get(0),
            (delta == 0)
                ? index
                : new SourceExpr.Binary(
                    SourceType.INT,
                    pos,
                    delta > 0 ? Binop.ADD : Binop.SUB,
                    index,
                    intConst(pos, Math.abs(delta))));
      }
      template = SourceTrees.replace(first, replacements);
    }
    return Optional.of(
        CandidateShape.unrolled(
            loose ? LOOSE_CONFIDENCE : STRICT_CONFIDENCE,
            consumed,
            Binder.single(binder),
            IterationSource.range(
                intConst(pos, start), intConst(pos, start + values.size() - 1), true),
            new YieldShape(target, template, null, ImmutableList.of()),
            loose));
  }

  private static Const intConst(Position pos, int value) {
    return new Const(SourceType.INT, pos, value);
  }

  /**
   * Walks a list of trees in parallel, checking that they have the same structure up to integer
   * constants and the renaming of variables declared within them.
   */
  private static class Alignment {
    /** For each tree after the first, maps variables declared in the first tree to its own. */
    final List<Map<Variable, Variable>> renames = new ArrayList<>();

    /** Each element lists corresponding integer constants that are not all equal. */
    final List<List<Const>> varying = new ArrayList<>();

    /** Variables referenced by the first tree but not declared within it. */
    final Set<Variable> free = new TreeSet<>();

    Alignment(int count) {
      for (int i = 0; i < count; i++) {
        renames.add(new HashMap<>());
      }
    }

    boolean align(List<SourceExpr> nodes) {
      SourceExpr first = nodes.get(0);
      int numChildren = first.children().size();
      for (SourceExpr node : nodes) {
        if (node.kind() != first.kind() || node.children().size() != numChildren) {
          return false;
        }
      }
      if (first instanceof Const c) {
        return alignConsts(c, nodes);
      }
      for (int j = 1; j < nodes.size(); j++) {
        if (!sameAttributes(first, nodes.get(j), renames.get(j))) {
          return false;
        }
      }
      for (int i = 0; i < numChildren; i++) {
        List<SourceExpr> children = new ArrayList<>(nodes.size());
        for (SourceExpr node : nodes) {
          children.add(node.children().get(i));
        }
        if (!align(children)) {
          return false;
        }
      }
      return true;
    }

    private boolean alignConsts(Const first, List<SourceExpr> nodes) {
      boolean allEqual = true;
      boolean allInts = true;
      List<Const> consts = new ArrayList<>(nodes.size());
      for (SourceExpr node : nodes) {
        Const c = (Const) node;
        allEqual &= Objects.equals(c.value, first.value);
        allInts &= c.isInt();
        consts.add(c);
      }
      if (allEqual) {
        return true;
      } else if (!allInts) {
        return false;
      }
      varying.add(consts);
      return true;
    }

    /**
     * Compares everything but the children of two nodes of the same kind, recording the
     * correspondence between the variables they declare.
     */
    private boolean sameAttributes(SourceExpr a, SourceExpr b, Map<Variable, Variable> rename) {
      switch (a.kind()) {
        case LOCAL:
          Variable v = ((Local) a).variable;
          Variable expected = rename.get(v);
          if (expected == null) {
            free.add(v);
            expected = v;
          }
          return expected.equals(((Local) b).variable);
        case VAR_DECL:
          rename.put(((VarDecl) a).variable, ((VarDecl) b).variable);
          return true;
        case FOR:
          rename.put(((SourceExpr.For) a).variable, ((SourceExpr.For) b).variable);
          return true;
        case FUNCTION:
          var params = ((SourceExpr.Function) a).params;
          var otherParams = ((SourceExpr.Function) b).params;
          if (params.size() != otherParams.size()) {
            return false;
          }
          for (int i = 0; i < params.size(); i++) {
            rename.put(params.get(i), otherParams.get(i));
          }
          return true;
        case ASSIGN_OP:
          return ((SourceExpr.AssignOp) a).op == ((SourceExpr.AssignOp) b).op;
        case BINARY:
          return ((SourceExpr.Binary) a).op == ((SourceExpr.Binary) b).op;
        case UNARY:
          SourceExpr.Unary ua = (SourceExpr.Unary) a;
          SourceExpr.Unary ub = (SourceExpr.Unary) b;
          return ua.op == ub.op && ua.postfix == ub.postfix;
        case IF:
          return (((SourceExpr.If) a).otherwise == null) == (((SourceExpr.If) b).otherwise == null);
        case WHILE:
          return ((SourceExpr.While) a).normalWhile == ((SourceExpr.While) b).normalWhile;
        case CALL:
          SourceExpr.Call ca = (SourceExpr.Call) a;
          SourceExpr.Call cb = (SourceExpr.Call) b;
          return ca.name.equals(cb.name) && (ca.receiver == null) == (cb.receiver == null);
        case FIELD:
          return ((SourceExpr.Field) a).name.equals(((SourceExpr.Field) b).name);
        default:
          // The remaining kinds have no attributes beyond their children.
          return true;
      }
    }
  }
}
