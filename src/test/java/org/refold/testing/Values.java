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

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/** Formatting, ordering and comparison of the values both test interpreters produce. */
public class Values {

  /** Orders map keys: numbers (by value) before strings, which are ordered lexicographically. */
  public static final Comparator<Object> ORDER =
      (a, b) -> {
        if (a instanceof Number x && b instanceof Number y) {
          return Double.compare(x.doubleValue(), y.doubleValue());
        } else if (a instanceof Number) {
          return -1;
        } else if (b instanceof Number) {
          return 1;
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
      };

  /** Returns the text that {@code trace} prints for {@code value}. */
  public static String show(Object value) {
    if (value == null) {
      return "null";
    } else if (value instanceof List<?> list) {
      return list.stream().map(Values::show).collect(Collectors.joining(", ", "[", "]"));
    } else if (value instanceof Map<?, ?> map) {
      return map.entrySet().stream()
          .map(e -> show(e.getKey()) + " => " + show(e.getValue()))
          .collect(Collectors.joining(", ", "{", "}"));
    }
    return value.toString();
  }

  /** Compares two values, treating numbers that are equal as equal regardless of their type. */
  public static boolean equal(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) {
      return x.doubleValue() == y.doubleValue();
    } else if (a instanceof List<?> x && b instanceof List<?> y) {
      if (x.size() != y.size()) {
        return false;
      }
      for (int i = 0; i < x.size(); i++) {
        if (!equal(x.get(i), y.get(i))) {
          return false;
        }
      }
      return true;
    }
    return Objects.equals(a, b);
  }

  public static int asInt(Object value) {
    if (!(value instanceof Integer i)) {
      throw new IllegalArgumentException("Not an integer: " + show(value));
    }
    return i;
  }

  public static double asDouble(Object value) {
    if (!(value instanceof Number n)) {
      throw new IllegalArgumentException("Not a number: " + show(value));
    }
    return n.doubleValue();
  }

  private Values() {}
}
