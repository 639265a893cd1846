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

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.Arrays;
import net.starlark.gen.syntax.Statement;

/**
 * Renderer writes a sequence of {@link Item}s to an output.
 *
 * <p>Every failure is reported as a {@link RenderException} whose message starts with the caller's
 * error prefix, followed by the description of the failing item, followed by the message of the
 * underlying failure. Since nested expressions and statements are rendered through this method
 * too, a failure deep in the tree yields a path such as {@code "rendering call expression argument
 * 1: rendering binary expression Y: rendering identifier Name: broken pipe"}.
 */
final class Renderer {

  private Renderer() {}

  /** Writes {@code items} to {@code out} in order. */
  static void render(Appendable out, String errPrefix, RenderOptions options, Item... items)
      throws RenderException {
    render(out, errPrefix, options, Arrays.asList(items));
  }

  /**
   * Writes {@code items} to {@code out} in order, stopping at the first failure.
   *
   * @throws RenderException if an item cannot be rendered or the output rejects a write
   * @throws IllegalStateException if {@code items} contains null
   */
  static void render(
      Appendable out, String errPrefix, RenderOptions options, Iterable<Item> items)
      throws RenderException {
    for (Item item : items) {
      Preconditions.checkState(item != null, "null item in render, errPrefix: %s", errPrefix);
      switch (item.kind()) {
        case EXPRESSION:
          try {
            ExpressionRenderer.render(
                out, item.expression(), options.withDepthIncrement(item.extraDepth()));
          } catch (RenderException e) {
            throw RenderException.wrap(errPrefix + " " + item.description(), e);
          }
          break;
        case STATEMENTS:
          renderBlock(out, errPrefix, item, options.withDepthIncrement(item.extraDepth()));
          break;
        case INDENT:
          write(out, options.currentIndent(), errPrefix + " indent");
          break;
        case EXTRA_INDENT:
          write(out, Strings.repeat(options.indent(), options.depth() + 1), errPrefix + " indent");
          break;
        case TEXT:
          write(out, item.text(), errPrefix + " " + item.description());
          break;
        case TOKEN:
          String context = errPrefix + " " + item.description() + " token";
          String text;
          try {
            text = Tokens.text(item.token());
          } catch (RenderException e) {
            throw RenderException.wrap(context, e);
          }
          write(out, text, context);
          break;
      }
    }
  }

  private static void renderBlock(
      Appendable out, String errPrefix, Item item, RenderOptions options)
      throws RenderException {
    ImmutableList<Statement> statements = item.statements();
    for (int i = 0; i < statements.size(); i++) {
      try {
        StatementRenderer.render(out, statements.get(i), options);
      } catch (RenderException e) {
        throw RenderException.wrap(
            String.format(
                "%s, rendering %s statement index %d", errPrefix, item.description(), i),
            e);
      }
    }
  }

  /** Writes text to the output, reporting a rejected write in the given context. */
  static void write(Appendable out, String text, String context) throws RenderException {
    if (text.isEmpty()) {
      return;
    }
    try {
      out.append(text);
    } catch (IOException e) {
      throw RenderException.writeFailed(context, e);
    }
  }
}
