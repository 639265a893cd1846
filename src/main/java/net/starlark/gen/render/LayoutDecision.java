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

/** How one particular sequence is written, as decided by {@link Layout#decide}. */
@AutoValue
public abstract class LayoutDecision {

  /** Whether the elements are written one per line, one level deeper than the brackets. */
  public abstract boolean breakLines();

  /** Whether the last element is followed by a comma. */
  public abstract boolean trailingComma();

  static LayoutDecision create(boolean breakLines, boolean trailingComma) {
    return new AutoValue_LayoutDecision(breakLines, trailingComma);
  }
}
