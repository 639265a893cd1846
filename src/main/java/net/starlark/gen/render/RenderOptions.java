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
import com.google.common.base.Strings;

/**
 * RenderOptions is the set of options that control how a syntax tree is written out as Starlark
 * source text: where the output starts (the indentation depth), how one level of indentation is
 * spelled, and how each kind of comma-separated sequence is laid out.
 *
 * <p>Options are immutable. A renderer descending into a nested block does not modify its options
 * but derives a copy with a greater depth (see {@link #withDepthIncrement}), so sibling subtrees
 * always start from the same depth.
 */
@AutoValue
public abstract class RenderOptions {

  /** The default options: depth 0, four-space indent, single-line sequences. */
  public static final RenderOptions DEFAULT = builder().build();

  /** The indentation depth of the rendered node, in units of {@link #indent}. Never negative. */
  public abstract int depth();

  /** The text of one level of indentation. */
  public abstract String indent();

  /**
   * Whether to write spaces around {@code =} in keyword arguments, parameter defaults and load
   * aliases ({@code f(x = 1)} rather than {@code f(x=1)}). Assignment statements are always
   * written with spaces.
   */
  public abstract boolean spaceAroundEquals();

  /** Layout of the arguments of a function call. */
  public abstract Layout callLayout();

  /** Layout of the entries of a dict expression. */
  public abstract Layout dictLayout();

  /** Layout of the elements of a list expression. */
  public abstract Layout listLayout();

  /** Layout of the elements of a tuple expression. */
  public abstract Layout tupleLayout();

  /** Returns the indentation for the current depth. */
  final String currentIndent() {
    return Strings.repeat(indent(), depth());
  }

  /** Returns a copy of these options with the depth increased by {@code n}. */
  public final RenderOptions withDepthIncrement(int n) {
    if (n == 0) {
      return this;
    }
    return toBuilder().depth(depth() + n).build();
  }

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_RenderOptions.Builder()
        .depth(0)
        .indent("    ")
        .spaceAroundEquals(false)
        .callLayout(Layout.SINGLE_LINE)
        .dictLayout(Layout.SINGLE_LINE)
        .listLayout(Layout.SINGLE_LINE)
        .tupleLayout(Layout.SINGLE_LINE);
  }

  public abstract Builder toBuilder();

  /** Builder for {@link RenderOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {

    /** Sets the initial indentation depth, which must not be negative. */
    public abstract Builder depth(int value);

    /** Replaces the default indentation sequence of four spaces. */
    public abstract Builder indent(String value);

    public abstract Builder spaceAroundEquals(boolean value);

    public abstract Builder callLayout(Layout value);

    public abstract Builder dictLayout(Layout value);

    public abstract Builder listLayout(Layout value);

    public abstract Builder tupleLayout(Layout value);

    abstract RenderOptions autoBuild();

    /**
     * Returns the options.
     *
     * @throws IllegalArgumentException if the depth is negative
     * @throws NullPointerException if the indent or a layout is null
     */
    public final RenderOptions build() {
      RenderOptions options = autoBuild();
      Preconditions.checkArgument(
          options.depth() >= 0, "invalid depth value %s, value must be >= 0", options.depth());
      return options;
    }
  }
}
