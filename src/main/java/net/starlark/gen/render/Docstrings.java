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

import com.google.common.collect.ImmutableList;
import net.starlark.gen.syntax.Literal;
import net.starlark.gen.syntax.Location;
import net.starlark.gen.syntax.TokenKind;

/**
 * Renders a string literal that forms an expression statement on its own, such as the docstring of
 * a function, as a triple-quoted string.
 *
 * <p>A docstring scanned from source is usually indented to line up with its opening quotes. That
 * indentation, {@code column - 1} spaces, is removed from each line after the first, and the lines
 * are reindented for the depth they are rendered at.
 */
final class Docstrings {

  private static final String TRIPLE_QUOTE = "\"\"\"";
  private static final String ESCAPED_TRIPLE_QUOTE = "\\\"\\\"\\\"";

  private Docstrings() {}

  static void render(Appendable out, Literal input, RenderOptions options) throws RenderException {
    String text = ((String) input.getValue()).replace(TRIPLE_QUOTE, ESCAPED_TRIPLE_QUOTE);
    int prefix = 0;
    Location location = input.getLocation();
    if (input.getToken() == TokenKind.STRING && location != null && location.column() > 1) {
      prefix = location.column() - 1;
    }

    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(Item.INDENT, Item.text(TRIPLE_QUOTE, "opening quotes"));
    ImmutableList<String> lines = splitLines(text);
    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      String description = "docstring line " + i;
      if (i == 0) {
        items.add(Item.text(line, description));
        continue;
      }
      if (hasSpacePrefix(line, prefix)) {
        line = line.substring(prefix);
      }
      items.add(Item.NEWLINE);
      // Blank lines get no indent, except the last one, which indents the closing quotes.
      if (!line.isEmpty() || i == lines.size() - 1) {
        items.add(Item.INDENT, Item.text(line, description));
      }
    }
    if (text.endsWith("\n")) {
      items.add(Item.NEWLINE, Item.INDENT);
    }
    items.add(Item.text(TRIPLE_QUOTE, "closing quotes"), Item.NEWLINE);
    Renderer.render(out, "rendering docstring expression statement", options, items.build());
  }

  /** Splits text at newlines. A trailing newline does not start another line. */
  static ImmutableList<String> splitLines(String text) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    int start = 0;
    int end;
    while ((end = text.indexOf('\n', start)) >= 0) {
      lines.add(text.substring(start, end));
      start = end + 1;
    }
    if (start < text.length()) {
      lines.add(text.substring(start));
    }
    return lines.build();
  }

  /** Reports whether {@code line} starts with at least {@code n} spaces. */
  static boolean hasSpacePrefix(String line, int n) {
    if (line.length() < n) {
      return false;
    }
    for (int i = 0; i < n; i++) {
      if (line.charAt(i) != ' ') {
        return false;
      }
    }
    return true;
  }
}
