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
import org.jspecify.annotations.Nullable;
import org.refold.source.Variable;

/**
 * The variables bound to each element of an iteration: a single element variable, or a key and a
 * value for map iteration. Any of them may be absent, in which case the emitted pattern uses
 * {@code _}.
 */
public final class Binder {
  public final boolean isKeyValue;

  /** The element variable; always null if {@link #isKeyValue}. */
  public final @Nullable Variable element;

  public final @Nullable Variable key;
  public final @Nullable Variable value;

  private Binder(
      boolean isKeyValue,
      @Nullable Variable element,
      @Nullable Variable key,
      @Nullable Variable value) {
    this.isKeyValue = isKeyValue;
    this.element = element;
    this.key = key;
    this.value = value;
  }

  public static Binder single(@Nullable Variable element) {
    return new Binder(false, element, null, null);
  }

  public static Binder keyValue(@Nullable Variable key, @Nullable Variable value) {
    return new Binder(true, null, key, value);
  }

  /** Returns the variables bound, in the order key, value (or just the element). */
  public ImmutableList<Variable> variables() {
    ImmutableList.Builder<Variable> builder = ImmutableList.builder();
    for (Variable v : new Variable[] {element, key, value}) {
      if (v != null) {
        builder.add(v);
      }
    }
    return builder.build();
  }

  /** Returns the source name of the element (or key) variable, or null if there is none. */
  public @Nullable String primaryName() {
    Variable v = isKeyValue ? key : element;
    return (v == null) ? null : v.name;
  }

  @Override
  public String toString() {
    return isKeyValue ? String.format("{%s, %s}", key, value) : String.valueOf(element);
  }
}
