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

/**
 * A Layout governs how a comma-separated sequence, such as the arguments of a call or the
 * elements of a list, dict or tuple, is formatted.
 *
 * <p>Each layout combines a {@link LineBreak} policy, which decides whether the elements are
 * written one per line, with a {@link TrailingComma} policy, which decides whether the last
 * element is followed by a comma. An empty sequence is always written as an empty pair of
 * brackets, whatever the layout.
 *
 * <p>Examples for a call with two arguments, at depth 0 with the default indent:
 *
 * <pre>
 * SINGLE_LINE                   f(a, b)
 * SINGLE_LINE_COMMA             f(a, b,)
 * MULTILINE_MULTIPLE            f(\n    a,\n    b\n)
 * MULTILINE_MULTIPLE_COMMA      f(\n    a,\n    b,\n)
 * </pre>
 */
public enum Layout {
  /** Single line, no trailing comma. The default. */
  SINGLE_LINE(LineBreak.NEVER, TrailingComma.NEVER),
  /** Single line, with a comma after the last element. */
  SINGLE_LINE_COMMA(LineBreak.NEVER, TrailingComma.IF_NOT_EMPTY),
  /** Single line, with a comma after the last element if there are two or more. */
  SINGLE_LINE_COMMA_TWO_AND_MORE(LineBreak.NEVER, TrailingComma.IF_MULTIPLE),

  /** One element on a single line, two or more elements one per line. */
  MULTILINE_MULTIPLE(LineBreak.IF_MULTIPLE, TrailingComma.NEVER),
  /**
   * One element on a single line, two or more elements one per line, with a comma after the last
   * element.
   */
  MULTILINE_MULTIPLE_COMMA(LineBreak.IF_MULTIPLE, TrailingComma.IF_NOT_EMPTY),
  /**
   * One element on a single line, two or more elements one per line, with a comma after the last
   * element if there are two or more.
   */
  MULTILINE_MULTIPLE_COMMA_TWO_AND_MORE(LineBreak.IF_MULTIPLE, TrailingComma.IF_MULTIPLE),

  /** One element per line. */
  MULTILINE(LineBreak.ALWAYS, TrailingComma.NEVER),
  /** One element per line, with a comma after the last element. */
  MULTILINE_COMMA(LineBreak.ALWAYS, TrailingComma.IF_NOT_EMPTY),
  /** One element per line, with a comma after the last element if there are two or more. */
  MULTILINE_COMMA_TWO_AND_MORE(LineBreak.ALWAYS, TrailingComma.IF_MULTIPLE);

  /** When the elements of a sequence are written one per line. */
  public enum LineBreak {
    NEVER,
    /** Only if there are two or more elements. */
    IF_MULTIPLE,
    /** Whenever there is at least one element. */
    ALWAYS,
  }

  /** When the last element of a sequence is followed by a comma. */
  public enum TrailingComma {
    NEVER,
    /** Whenever there is at least one element. */
    IF_NOT_EMPTY,
    /** Only if there are two or more elements. */
    IF_MULTIPLE,
  }

  private final LineBreak lineBreak;
  private final TrailingComma trailingComma;

  Layout(LineBreak lineBreak, TrailingComma trailingComma) {
    this.lineBreak = lineBreak;
    this.trailingComma = trailingComma;
  }

  public LineBreak lineBreak() {
    return lineBreak;
  }

  public TrailingComma trailingComma() {
    return trailingComma;
  }

  /** Returns the layout that combines the two policies. */
  public static Layout of(LineBreak lineBreak, TrailingComma trailingComma) {
    for (Layout layout : values()) {
      if (layout.lineBreak == lineBreak && layout.trailingComma == trailingComma) {
        return layout;
      }
    }
    throw new IllegalArgumentException(
        String.format("no layout for %s and %s", lineBreak, trailingComma));
  }

  /** Decides how a sequence of {@code elementCount} elements is written under this layout. */
  public LayoutDecision decide(int elementCount) {
    boolean breakLines =
        (lineBreak == LineBreak.ALWAYS && elementCount > 0)
            || (lineBreak == LineBreak.IF_MULTIPLE && elementCount > 1);
    boolean comma =
        (trailingComma == TrailingComma.IF_NOT_EMPTY && elementCount > 0)
            || (trailingComma == TrailingComma.IF_MULTIPLE && elementCount > 1);
    return LayoutDecision.create(breakLines, comma);
  }
}
