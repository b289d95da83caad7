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

/** Which non-local exits a loop body contains. */
public final class ExitSummary {
  public static final ExitSummary NONE = new ExitSummary(false, false, false);

  /** True if the body has a {@code break} that exits this loop (not a nested one). */
  public final boolean hasBreak;

  /** True if the body has a {@code continue} that applies to this loop (not a nested one). */
  public final boolean hasContinue;

  /** True if the body has a {@code return} outside any nested function. */
  public final boolean hasReturn;

  public ExitSummary(boolean hasBreak, boolean hasContinue, boolean hasReturn) {
    this.hasBreak = hasBreak;
    this.hasContinue = hasContinue;
    this.hasReturn = hasReturn;
  }

  public boolean any() {
    return hasBreak || hasContinue || hasReturn;
  }

  @Override
  public String toString() {
    return String.format("break=%s continue=%s return=%s", hasBreak, hasContinue, hasReturn);
  }
}
