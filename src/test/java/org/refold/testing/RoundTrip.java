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

package org.refold.testing;

import static com.google.common.truth.Truth.assertWithMessage;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.refold.compiler.ExpressionCompiler;
import org.refold.compiler.Naming;
import org.refold.loops.EngineConfig;
import org.refold.source.SourceExpr;
import org.refold.source.Variable;
import org.refold.target.TargetExpr;

/**
 * Compiles a statement sequence and runs both the source and the compiled statements, so that tests
 * can check that they trace the same output and leave the same values in the variables of
 * interest.
 */
public class RoundTrip {
  public final ExpressionCompiler compiler;
  public final ImmutableList<TargetExpr> compiled;
  public final SourceEvaluator source = new SourceEvaluator();
  public final TargetEvaluator target = new TargetEvaluator();
  private final Map<String, Object> targetScope;

  private RoundTrip(
      EngineConfig config, List<SourceExpr> statements, Map<Variable, Object> inputs) {
    this.compiler = new ExpressionCompiler(config);
    this.compiled = compiler.compileStatements(statements);
    Map<String, Object> targetInputs = new HashMap<>();
    inputs.forEach(
        (v, value) -> {
          source.set(v, copy(value));
          targetInputs.put(Naming.toTargetIdentifier(v.name), value);
        });
    source.run(statements);
    this.targetScope = target.run(compiled, targetInputs);
  }

  public static RoundTrip run(List<SourceExpr> statements) {
    return run(EngineConfig.DEFAULT, statements, new LinkedHashMap<>());
  }

  public static RoundTrip run(List<SourceExpr> statements, Map<Variable, Object> inputs) {
    return run(EngineConfig.DEFAULT, statements, inputs);
  }

  public static RoundTrip run(
      EngineConfig config, List<SourceExpr> statements, Map<Variable, Object> inputs) {
    return new RoundTrip(config, statements, inputs);
  }

  /** Source lists and maps are mutable, so each evaluator gets its own copy of the inputs. */
  private static Object copy(Object value) {
    if (value instanceof List<?> list) {
      List<Object> result = new ArrayList<>();
      list.forEach(x -> result.add(copy(x)));
      return result;
    } else if (value instanceof Map<?, ?> map) {
      Map<Object, Object> result = new TreeMap<>(Values.ORDER);
      map.forEach((k, v) -> result.put(k, copy(v)));
      return result;
    }
    return value;
  }

  /** Returns the compiled statements, separated by newlines. */
  public String text() {
    StringBuilder sb = new StringBuilder();
    for (TargetExpr statement : compiled) {
      if (sb.length() != 0) {
        sb.append('\n');
      }
      sb.append(statement);
    }
    return sb.toString();
  }

  public Object sourceValue(Variable v) {
    return source.get(v);
  }

  public Object targetValue(Variable v) {
    return targetScope.get(Naming.toTargetIdentifier(v.name));
  }

  /**
   * Asserts that the compiled statements traced the same output as the source, and left each of
   * the given variables with an equal value.
   */
  public void assertSameBehavior(Variable... observed) {
    assertWithMessage("trace output of %s", text())
        .that(target.output)
        .containsExactlyElementsIn(source.output)
        .inOrder();
    for (Variable v : observed) {
      assertWithMessage("value of %s after %s", v.name, text())
          .that(Values.show(targetValue(v)))
          .isEqualTo(Values.show(sourceValue(v)));
    }
  }

  /** Builds the input maps for {@link #run}, keeping the order in which inputs are given. */
  public static final class InputsBuilder {
    private final Map<Variable, Object> inputs = new LinkedHashMap<>();

    public InputsBuilder put(Variable v, Object value) {
      inputs.put(v, value);
      return this;
    }

    public Map<Variable, Object> build() {
      return inputs;
    }
  }

  public static InputsBuilder inputs() {
    return new InputsBuilder();
  }
}
