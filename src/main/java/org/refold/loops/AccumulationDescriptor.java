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

import org.refold.source.Variable;

/** Describes how a loop body accumulates into a variable declared outside it. */
public final class AccumulationDescriptor {

  public enum Kind {
    LIST_APPEND,
    STRING_CONCAT,
    NUMERIC_ADD
  }

  public final Variable variable;
  public final Kind kind;

  /** True if the accumulation only happens under some condition. */
  public final boolean conditional;

  public AccumulationDescriptor(Variable variable, Kind kind, boolean conditional) {
    this.variable = variable;
    this.kind = kind;
    this.conditional = conditional;
  }

  @Override
  public String toString() {
    return String.format("%s %s%s", kind, variable, conditional ? " (conditional)" : "");
  }
}
