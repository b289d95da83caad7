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

/** The unary operators of the source language. */
public enum Unop {
  INCREMENT("++"),
  DECREMENT("--"),
  NEG("-"),
  NOT("!");

  public final String symbol;

  Unop(String symbol) {
    this.symbol = symbol;
  }

  /** True for the operators that assign to their operand. */
  public boolean isUpdate() {
    return this == INCREMENT || this == DECREMENT;
  }
}
