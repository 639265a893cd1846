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

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.gen.syntax.Expression;
import net.starlark.gen.syntax.Statement;
import net.starlark.gen.syntax.TokenKind;

/**
 * An Item is one step of output in the small emission language shared by all renderers: a piece of
 * literal text, a token, an indentation, a nested expression or a nested block of statements. A
 * renderer describes the output for a node as a list of items, which {@link Renderer#render} then
 * writes out in order.
 *
 * <p>Each item carries a description, such as a field name, that identifies it in error messages.
 * Items refer to syntax nodes; they never copy them.
 */
@AutoValue
abstract class Item {

  /** The kind of an item. */
  enum Kind {
    TEXT,
    TOKEN,
    INDENT,
    EXTRA_INDENT,
    EXPRESSION,
    STATEMENTS,
  }

  static final Item INDENT = create(Kind.INDENT, "indent", null, null, null, null, 0);
  static final Item EXTRA_INDENT =
      create(Kind.EXTRA_INDENT, "extra indent", null, null, null, null, 0);

  static final Item SPACE = text(" ", "space");
  static final Item QUOTE = text("\"", "quote");
  static final Item COLON = token(TokenKind.COLON, "COLON");
  static final Item COMMA = token(TokenKind.COMMA, "COMMA");
  static final Item NEWLINE = token(TokenKind.NEWLINE, "NEWLINE");

  abstract Kind kind();

  abstract String description();

  /** The text of a TEXT item. */
  @Nullable
  abstract String text();

  /** The token of a TOKEN item. */
  @Nullable
  abstract TokenKind token();

  /** The node of an EXPRESSION item. Null if the referring node lacks it. */
  @Nullable
  abstract Expression expression();

  /** The block of a STATEMENTS item. */
  @Nullable
  abstract ImmutableList<Statement> statements();

  /** How many levels deeper than the enclosing node a nested node is rendered: 0 or 1. */
  abstract int extraDepth();

  private static Item create(
      Kind kind,
      String description,
      @Nullable String text,
      @Nullable TokenKind token,
      @Nullable Expression expression,
      @Nullable ImmutableList<Statement> statements,
      int extraDepth) {
    return new AutoValue_Item(kind, description, text, token, expression, statements, extraDepth);
  }

  /** Returns an item that writes the given text verbatim. */
  static Item text(String value, String description) {
    return create(Kind.TEXT, description, Preconditions.checkNotNull(value), null, null, null, 0);
  }

  /** Returns an item that writes the source spelling of a token. */
  static Item token(@Nullable TokenKind token, String description) {
    return create(Kind.TOKEN, description, null, token, null, null, 0);
  }

  /** Returns an item that renders an expression at the current depth. */
  static Item expression(@Nullable Expression expression, String description) {
    return create(Kind.EXPRESSION, description, null, null, expression, null, 0);
  }

  /** Returns an item that renders an expression one level deeper than the current depth. */
  static Item indentedExpression(@Nullable Expression expression, String description) {
    return create(Kind.EXPRESSION, description, null, null, expression, null, 1);
  }

  /**
   * Returns an item that renders a block of statements, each on its own lines, at the current
   * depth or, if {@code addIndent}, one level deeper.
   */
  static Item statements(
      List<? extends Statement> statements, String description, boolean addIndent) {
    return create(
        Kind.STATEMENTS,
        description,
        null,
        null,
        null,
        ImmutableList.copyOf(statements),
        addIndent ? 1 : 0);
  }
}
