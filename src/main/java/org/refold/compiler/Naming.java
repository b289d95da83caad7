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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/** Converts source identifiers to target identifiers. */
public class Naming {

  /** Words that cannot be used as target variable or function names. */
  private static final ImmutableSet<String> RESERVED =
      ImmutableSet.of(
          "after", "alias", "and", "case", "catch", "cond", "def", "defmodule", "defp", "do",
          "else", "end", "false", "fn", "for", "if", "import", "in", "nil", "not", "or", "quote",
          "receive", "require", "rescue", "true", "try", "unless", "unquote", "use", "when",
          "with");

  /**
   * Returns the snake_case form of a camelCase identifier, e.g. {@code "itemCount"} becomes {@code
   * "item_count"} and {@code "parseHTMLBody"} becomes {@code "parse_html_body"}. Leading
   * underscores are kept, and reserved words get a trailing underscore.
   */
  public static String toTargetIdentifier(String name) {
    Preconditions.checkArgument(!name.isEmpty(), "Empty identifier");
    StringBuilder sb = new StringBuilder(name.length() + 4);
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!Character.isUpperCase(c)) {
        sb.append(c);
        continue;
      }
      if (i > 0) {
        char prev = name.charAt(i - 1);
        boolean wordStart =
            Character.isLowerCase(prev)
                || Character.isDigit(prev)
                || (Character.isUpperCase(prev)
                    && i + 1 < name.length()
                    && Character.isLowerCase(name.charAt(i + 1)));
        if (wordStart) {
          sb.append('_');
        }
      }
      sb.append(Character.toLowerCase(c));
    }
    String result = sb.toString();
    return RESERVED.contains(result) ? result + "_" : result;
  }

  private Naming() {}
}
