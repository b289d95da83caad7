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
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.refold.source.Binop;
import org.refold.source.SourceType;
import org.refold.source.Variable;
import org.refold.testing.RoundTrip;
import org.refold.testing.SourceBuilder;

/** Runs each source operator through the compiler and both evaluators. */
@RunWith(TestParameterInjector.class)
public class OperatorRoundTripTest {

  private final SourceBuilder b = new SourceBuilder();

  @Test
  public void arithmeticInsideFold(
      @TestParameter({"ADD", "SUB", "MUL", "DIV", "MOD"}) Binop op) {
    Variable total = b.intVar("total");
    Variable i = b.intVar("i");
    RoundTrip.run(
            ImmutableList.of(
                b.decl(total, b.i(10)),
                b.forRange(
                    i,
                    b.i(1),
                    b.i(5),
                    b.assign(total, b.bin(op, b.ref(total), b.ref(i))),
                    b.trace(b.ref(total)))))
        .assertSameBehavior(total);
  }

  @Test
  public void comparison(@TestParameter({"EQ", "NE", "LT", "LE", "GT", "GE"}) Binop op) {
    Variable x = b.intVar("x");
    Variable y = b.intVar("y");
    Variable r = b.var("r", SourceType.BOOL);
    RoundTrip.run(
            ImmutableList.of(
                b.decl(x, b.i(7)),
                b.decl(y, b.i(3)),
                b.decl(r, b.bin(op, b.ref(x), b.ref(y))),
                b.trace(b.bin(op, b.ref(y), b.ref(x)))))
        .assertSameBehavior(r);
  }

  @Test
  public void logical(@TestParameter({"AND", "OR"}) Binop op, @TestParameter boolean left) {
    Variable p = b.var("p", SourceType.BOOL);
    Variable r = b.var("r", SourceType.BOOL);
    RoundTrip.run(
            ImmutableList.of(
                b.decl(p, b.bool(left)),
                b.decl(r, b.bin(op, b.ref(p), b.bool(true))),
                b.trace(b.bin(op, b.ref(p), b.bool(false)))))
        .assertSameBehavior(r);
  }

  @Test
  public void incrementAsValue(@TestParameter boolean postfix) {
    Variable k = b.intVar("k");
    Variable y = b.intVar("y");
    RoundTrip.run(
            ImmutableList.of(
                b.decl(k, b.i(10)),
                b.decl(y, b.add(postfix ? b.postInc(k) : b.preInc(k), b.i(1))),
                b.trace(postfix ? b.postInc(k) : b.preInc(k))))
        .assertSameBehavior(k, y);
  }
}
