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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Syntax node for an import statement, {@code load("module", "sym", local="orig")}.
 *
 * <p>The imported symbols are held as two parallel lists: {@code from[i]} is the name exported by
 * the module and {@code to[i]} the name it is bound to locally. A well-formed statement has lists
 * of equal, non-zero length.
 */
public final class LoadStatement extends Statement {

  private final Literal module;
  private final ImmutableList<Identifier> from;
  private final ImmutableList<Identifier> to;

  public LoadStatement(
      Literal module, List<? extends Identifier> from, List<? extends Identifier> to) {
    super(Kind.LOAD);
    this.module = module;
    this.from = ImmutableList.copyOf(from);
    this.to = ImmutableList.copyOf(to);
  }

  /** Returns the module label string literal. */
  public Literal getModule() {
    return module;
  }

  /** Returns the names of the loaded symbols, as exported by the module. */
  public ImmutableList<Identifier> getFrom() {
    return from;
  }

  /** Returns the local names the loaded symbols are bound to. */
  public ImmutableList<Identifier> getTo() {
    return to;
  }
}
