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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.refold.source.SourceExpr;
import org.refold.source.SourceExpr.Block;
import org.refold.target.TargetExpr;

/**
 * Reconstructs idiomatic target loops from lowered source loops.
 *
 * <p>A LoopCompiler is driven by an expression compiler (the {@link ExpressionBuilder}), which
 * calls {@link #tryCompileAt} for each statement of a block and {@link #tryCompileListBlock} for
 * each block used as a value. The LoopCompiler calls back into the expression compiler for the
 * non-loop parts of each loop (sources, conditions and bodies), so loops nested in loop bodies are
 * reconstructed recursively.
 *
 * <p>A LoopCompiler is not thread-safe; use one per compilation.
 */
public final class LoopCompiler {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Compiles a source expression that is not itself a recognized loop shape. */
  public interface ExpressionBuilder {
    TargetExpr build(SourceExpr expr);
  }

  /** Converts a source identifier to a target identifier. */
  public interface IdentifierConverter {
    String convert(String name);
  }

  private final EngineConfig config;
  private final IdentifierConverter naming;
  private final NameGenerator names = new NameGenerator();
  private final ControlFlowLowering lowering;
  private final LoopAnalyzer analyzer;
  private final StrategySelector selector;
  private final EmitSupport support;
  private final Map<EmissionStrategy, LoopEmitter> emitters =
      new EnumMap<>(EmissionStrategy.class);
  private final List<LoopProvenance> provenance = new ArrayList<>();

  /** The number of loops currently being emitted. */
  private int depth;

  public LoopCompiler(
      ExpressionBuilder builder, IdentifierConverter naming, EngineConfig config) {
    this.config = config;
    this.naming = naming;
    this.lowering = new ControlFlowLowering(config);
    this.analyzer = new LoopAnalyzer(config);
    this.selector = new StrategySelector(config);
    this.support = new EmitSupport(builder, naming, names, lowering);
    emitters.put(EmissionStrategy.EACH_SIDE_EFFECT, new EachEmitter(support));
    emitters.put(EmissionStrategy.MAP_TRANSFORM, new MapEmitter(support));
    emitters.put(EmissionStrategy.COMPREHENSION, new ComprehensionEmitter(support));
    emitters.put(EmissionStrategy.FOLD_REDUCE, new FoldEmitter(support));
    emitters.put(EmissionStrategy.FALLBACK, new FallbackEmitter(support));
  }

  /** Compiles a FOR or WHILE node that is not part of a larger recognized shape. */
  public LoopEmission compileLoop(SourceExpr loop) {
    Preconditions.checkArgument(
        loop.is(SourceExpr.Kind.FOR) || loop.is(SourceExpr.Kind.WHILE), "Not a loop: %s", loop);
    MatchContext context = context(ImmutableList.of(loop), 0);
    LoopIr ir = analyzer.analyzeLoop(loop, context);
    return emit(ir, choose(ir));
  }

  /**
   * If a loop shape starts at {@code statements.get(index)}, compiles it and returns the result.
   * Loops that are not part of a recognized shape are compiled with {@link #compileLoop}; other
   * statements return an empty Optional.
   *
   * <p>A multi-statement shape that would only be emitted with the generic fallback is not claimed,
   * so that its statements are compiled individually.
   */
  public Optional<LoopEmission> tryCompileAt(List<SourceExpr> statements, int index) {
    SourceExpr statement = statements.get(index);
    Optional<LoopIr> found = analyzer.analyzeAt(context(statements, index));
    if (found.isPresent()) {
      LoopIr ir = found.get();
      EmissionStrategy strategy = choose(ir);
      if (strategy != EmissionStrategy.FALLBACK || ir.shape.loop == statement) {
        return Optional.of(emit(ir, strategy));
      }
      logger.atFine().log("Not claiming %s at statement %s", ir.shape, index);
    }
    if (statement.is(SourceExpr.Kind.FOR) || statement.is(SourceExpr.Kind.WHILE)) {
      return Optional.of(compileLoop(statement));
    }
    return Optional.empty();
  }

  /**
   * If {@code block} builds a list with a loop (or an unrolled sequence of appends) and returns
   * it, returns a single expression that computes the list.
   */
  public Optional<TargetExpr> tryCompileListBlock(Block block) {
    if (block.statements.isEmpty()) {
      return Optional.empty();
    }
    Optional<LoopIr> found = analyzer.analyzeListBlock(block, context(block.statements, 0));
    if (found.isEmpty()) {
      return Optional.empty();
    }
    LoopIr ir = found.get();
    EmissionStrategy strategy = choose(ir);
    if (strategy != EmissionStrategy.MAP_TRANSFORM
        && strategy != EmissionStrategy.COMPREHENSION) {
      logger.atFine().log("Not replacing list block: %s would use %s", ir.shape, strategy);
      return Optional.empty();
    }
    return Optional.of(emit(ir, strategy).statements.get(0));
  }

  /**
   * Lowers a BREAK, CONTINUE or RETURN node that is inside a loop body or function being compiled.
   *
   * @param value the compiled return value, or null for BREAK, CONTINUE and a bare RETURN
   */
  public TargetExpr lowerExit(SourceExpr exit, @Nullable TargetExpr value) {
    return switch (exit.kind()) {
      case BREAK -> lowering.lowerBreak();
      case CONTINUE -> lowering.lowerContinue();
      case RETURN -> lowering.lowerReturn(value);
      default -> throw new IllegalArgumentException("Not an exit: " + exit);
    };
  }

  /** Returns true if a BREAK or CONTINUE at this point would exit a loop being compiled. */
  public boolean inLoop() {
    return lowering.inLoop();
  }

  /** Must be called before compiling the body of a function literal. */
  public void enterFunction() {
    lowering.enterFunction();
  }

  /** Must be called after compiling the body of a function literal. */
  public void exitFunction() {
    lowering.exitFunction();
  }

  /** Wraps a function body whose RETURNs have been lowered by {@link #lowerExit}. */
  public static TargetExpr catchReturn(TargetExpr body) {
    return ControlFlowLowering.catchReturn(body);
  }

  /** Returns how each loop compiled so far was reconstructed, in order of completion. */
  public ImmutableList<LoopProvenance> provenance() {
    return ImmutableList.copyOf(provenance);
  }

  private MatchContext context(List<SourceExpr> statements, int index) {
    return new MatchContext(statements, index, config, names, naming);
  }

  private EmissionStrategy choose(LoopIr ir) {
    if (depth >= config.maxNestingDepth) {
      logger.atInfo().log("Loops nested more than %s deep; using fallback", config.maxNestingDepth);
      return EmissionStrategy.FALLBACK;
    }
    EmissionStrategy strategy = selector.selectStrategy(ir);
    if (strategy == EmissionStrategy.FALLBACK
        && !ir.clauses.isEmpty()
        && ir.confidence < config.confidenceThreshold) {
      logger.atInfo().log(
          "%s has confidence %s (threshold %s); using fallback",
          ir.shape,
          ir.confidence,
          config.confidenceThreshold);
    }
    return strategy;
  }

  private LoopEmission emit(LoopIr ir, EmissionStrategy strategy) {
    ImmutableList<TargetExpr> statements;
    depth++;
    try {
      statements = emitters.get(strategy).emit(ir);
    } finally {
      depth--;
    }
    if (ir.shape.loose) {
      logger.atInfo().log("Reconstructed %s by loose unrolled extraction", ir.shape);
    }
    LoopProvenance record = provenanceOf(ir, strategy);
    provenance.add(record);
    logger.atFine().log("Emitted %s", record);
    return new LoopEmission(statements, ir.shape.consumed, record);
  }

  private LoopProvenance provenanceOf(LoopIr ir, EmissionStrategy strategy) {
    String binderName = null;
    String range = null;
    ImmutableList<LoopIr.Clause> generators = ir.generators();
    if (!generators.isEmpty()) {
      LoopIr.Clause first = generators.get(0);
      binderName = first.binder.primaryName();
      if (binderName != null) {
        binderName = naming.convert(binderName);
      }
      if (first.source.kind == IterationSource.Kind.RANGE) {
        range = support.source(first.source).toString();
      }
    }
    return new LoopProvenance(
        binderName,
        strategy,
        ir.shape.kind,
        range,
        ir.confidence,
        ir.exits.hasReturn,
        ir.shape.loose,
        ir.scope.freeVariables.values().stream()
            .map(v -> naming.convert(v.name))
            .sorted()
            .collect(ImmutableList.toImmutableList()),
        (ir.accumulation == null) ? null : ir.accumulation.kind);
  }
}
