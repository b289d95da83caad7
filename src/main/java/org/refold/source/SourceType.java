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

import com.google.common.base.Preconditions;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The inferred type of a source expression. Only the distinctions that matter for loop
 * reconstruction are kept: whether a value is numeric, a string, an array (with its element type),
 * a map or an iterator.
 */
public final class SourceType {

  public enum Kind {
    INT,
    FLOAT,
    STRING,
    BOOL,
    VOID,
    DYNAMIC,
    ARRAY,
    MAP,
    ITERATOR,
    FUNCTION
  }

  public static final SourceType INT = new SourceType(Kind.INT, null);
  public static final SourceType FLOAT = new SourceType(Kind.FLOAT, null);
  public static final SourceType STRING = new SourceType(Kind.STRING, null);
  public static final SourceType BOOL = new SourceType(Kind.BOOL, null);
  public static final SourceType VOID = new SourceType(Kind.VOID, null);
  public static final SourceType DYNAMIC = new SourceType(Kind.DYNAMIC, null);
  public static final SourceType MAP = new SourceType(Kind.MAP, null);
  public static final SourceType ITERATOR = new SourceType(Kind.ITERATOR, null);
  public static final SourceType FUNCTION = new SourceType(Kind.FUNCTION, null);

  public final Kind kind;

  /** Non-null iff {@link #kind} is {@link Kind#ARRAY}. */
  public final @Nullable SourceType element;

  private SourceType(Kind kind, @Nullable SourceType element) {
    this.kind = kind;
    this.element = element;
  }

  /** Returns the type of arrays with the given element type. */
  public static SourceType arrayOf(SourceType element) {
    Preconditions.checkNotNull(element);
    return new SourceType(Kind.ARRAY, element);
  }

  public boolean isNumeric() {
    return kind == Kind.INT || kind == Kind.FLOAT;
  }

  public boolean isString() {
    return kind == Kind.STRING;
  }

  public boolean isArray() {
    return kind == Kind.ARRAY;
  }

  public boolean isDynamic() {
    return kind == Kind.DYNAMIC;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof SourceType other
        && kind == other.kind
        && Objects.equals(element, other.element);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, element);
  }

  @Override
  public String toString() {
    return (element == null) ? kind.name() : String.format("ARRAY<%s>", element);
  }
}
