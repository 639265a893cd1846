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

package net.starlark.gen.syntax;

import com.google.common.base.Preconditions;
import javax.annotation.Nullable;

/**
 * Syntax node for a string or integer literal.
 *
 * <p>A literal holds its typed value, one of {@code String}, {@code Integer}, {@code Long}, {@code
 * UnsignedInteger}, {@code UnsignedLong} or {@code BigInteger}, and the raw source text it was
 * scanned from. A literal with no typed value stands for its raw text; this is how literals of
 * other kinds, such as floats, are carried.
 */
public final class Literal extends Expression {

  private final TokenKind token; // STRING | INT | FLOAT
  private final String raw;
  @Nullable private final Object value;
  @Nullable private final Location location;

  public Literal(
      TokenKind token, String raw, @Nullable Object value, @Nullable Location location) {
    super(Kind.LITERAL);
    this.token = Preconditions.checkNotNull(token);
    this.raw = Preconditions.checkNotNull(raw);
    this.value = value;
    this.location = location;
  }

  /** Returns a literal for a string value with no source position. */
  public static Literal ofString(String value) {
    return new Literal(TokenKind.STRING, "", Preconditions.checkNotNull(value), null);
  }

  /**
   * Returns a literal for an integer value with no source position. The value is one of the
   * supported integer representations.
   */
  public static Literal ofNumber(Number value) {
    return new Literal(TokenKind.INT, "", Preconditions.checkNotNull(value), null);
  }

  /** Returns a literal that is written out as the given source text. */
  public static Literal ofRaw(TokenKind token, String raw) {
    return new Literal(token, raw, null, null);
  }

  /** Returns the kind of the token this literal was scanned from. */
  public TokenKind getToken() {
    return token;
  }

  /** Returns the raw source text of the literal, or the empty string if unknown. */
  public String getRaw() {
    return raw;
  }

  /** Returns the value denoted by the literal, or null if only the raw text is known. */
  @Nullable
  public Object getValue() {
    return value;
  }

  /** Returns the position of the literal's first character, if it came from a parser. */
  @Nullable
  public Location getLocation() {
    return location;
  }
}
