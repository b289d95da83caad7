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

import java.util.Comparator;

/**
 * The identity of a local variable. The front-end assigns each declaration a distinct id, in
 * declaration order, that is stable across the whole compilation unit; two Variables are equal iff
 * their ids are equal, regardless of their names (desugared code frequently reuses names such as
 * {@code _g} for unrelated variables).
 *
 * <p>Variables are ordered by id, so sets of them can be iterated in declaration order.
 */
public final class Variable implements Comparable<Variable> {

  private static final Comparator<Variable> BY_ID = Comparator.comparingInt(v -> v.id);

  public final int id;
  public final String name;
  public final SourceType type;

  public Variable(int id, String name, SourceType type) {
    this.id = id;
    this.name = name;
    this.type = type;
  }

  @Override
  public int compareTo(Variable other) {
    return BY_ID.compare(this, other);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Variable other && id == other.id;
  }

  @Override
  public int hashCode() {
    return Integer.hashCode(id);
  }

  @Override
  public String toString() {
    return name + "#" + id;
  }
}
