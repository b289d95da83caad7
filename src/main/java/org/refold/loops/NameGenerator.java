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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Set;
import org.refold.source.SourceType;
import org.refold.source.Variable;

/**
 * Chooses names for binders that Refold introduces (such as the index of a reconstructed unrolled
 * range) and allocates the Variables that stand for them in rewritten source trees.
 *
 * <p>Names that are in use by an enclosing emission are reserved until that emission completes, so
 * a nested reconstruction never shadows its parent's binder.
 */
public final class NameGenerator {

  private static final ImmutableList<String> INDEX_NAMES = ImmutableList.of("i", "j", "k", "l");

  private final Deque<String> reserved = new ArrayDeque<>();

  /** Synthetic variables get negative ids so they can never collide with the front-end's. */
  private int nextSyntheticId = -1;

  /**
   * Returns the first of {@code i}, {@code j}, {@code k}, {@code l}, {@code i2}, {@code j2}, ...
   * that is neither in {@code avoid} nor reserved.
   */
  public String freshIndexName(Set<String> avoid) {
    for (int suffix = 1; ; suffix++) {
      for (String base : INDEX_NAMES) {
        String name = (suffix == 1) ? base : base + suffix;
        if (!avoid.contains(name) && !reserved.contains(name)) {
          return name;
        }
      }
    }
  }

  /** Returns a new Variable with the given name that is distinct from every front-end Variable. */
  public Variable syntheticVariable(String name, SourceType type) {
    return new Variable(nextSyntheticId--, name, type);
  }

  /** Marks {@code name} as in use until the matching call to {@link #release}. */
  public void reserve(String name) {
    reserved.push(name);
  }

  public void release(String name) {
    Preconditions.checkState(name.equals(reserved.peek()), "Unbalanced release of %s", name);
    reserved.pop();
  }
}
