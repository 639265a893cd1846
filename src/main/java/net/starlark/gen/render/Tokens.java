// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.starlark.gen.render;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigInteger;
import javax.annotation.Nullable;
import net.starlark.gen.syntax.TokenKind;

/** Source spellings of tokens, string literals and integer literals. */
final class Tokens {

  private Tokens() {}

  /**
   * Returns the source text of a token.
   *
   * @throws RenderException if the token kind has no fixed spelling, such as an identifier or the
   *     end of input
   */
  static String text(@Nullable TokenKind kind) throws RenderException {
    if (kind == null) {
      throw new RenderException("nil token not supported");
    }
    switch (kind) {
      case COMMENT:
      case EOF:
      case FLOAT:
      case IDENTIFIER:
      case ILLEGAL:
      case INDENT:
      case INT:
      case OUTDENT:
      case STRING:
        throw new RenderException(kind + " not supported");
      case NEWLINE:
        return "\n";
      default:
        return kind.toString();
    }
  }

  /** Returns a double-quoted Starlark string literal that denotes {@code s}. */
  static String quote(String s) {
    StringBuilder buf = new StringBuilder(s.length() + 2);
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      escapeCharacter(buf, s.charAt(i));
    }
    return buf.append('"').toString();
  }

  private static void escapeCharacter(StringBuilder buf, char c) {
    switch (c) {
      case '"':
        buf.append("\\\"");
        break;
      case '\\':
        buf.append("\\\\");
        break;
      case '\r':
        buf.append("\\r");
        break;
      case '\n':
        buf.append("\\n");
        break;
      case '\t':
        buf.append("\\t");
        break;
      default:
        if (c < 32 || c == 127) {
          buf.append(String.format("\\x%02x", (int) c));
        } else {
          buf.append(c); // no need to support UTF-8
        }
    }
  }

  /** Reports whether {@code value} is one of the integer representations a literal may hold. */
  static boolean isInteger(@Nullable Object value) {
    return value instanceof Integer
        || value instanceof Long
        || value instanceof UnsignedInteger
        || value instanceof UnsignedLong
        || value instanceof BigInteger;
  }

  /** Returns the decimal source text of an integer value accepted by {@link #isInteger}. */
  static String formatNumber(Number value) {
    if (value instanceof BigInteger) {
      return ((BigInteger) value).toString(10);
    }
    if (value instanceof UnsignedLong) {
      return ((UnsignedLong) value).toString(10);
    }
    if (value instanceof UnsignedInteger) {
      return ((UnsignedInteger) value).toString(10);
    }
    return Long.toString(value.longValue());
  }
}
