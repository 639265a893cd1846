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

/** Syntax node for a for loop statement, {@code for vars in iterable: ...}. */
public final class ForStatement extends Statement {

  private final Expression vars;
  private final Expression iterable;
  private final ImmutableList<Statement> body; // non-empty if well formed

  /** Constructs a for loop statement. */
  public ForStatement(Expression vars, Expression iterable, List<? extends Statement> body) {
    super(Kind.FOR);
    this.vars = vars;
    this.iterable = iterable;
    this.body = ImmutableList.copyOf(body);
  }

  /**
   * Returns variables assigned by each iteration. May be a compound target such as {@code (a[b],
   * c.d)}.
   */
  public Expression getVars() {
    return vars;
  }

  /** Returns the iterable value. */
  public Expression getIterable() {
    return iterable;
  }

  /** Returns the statements of the loop body. Non-empty if well formed. */
  public ImmutableList<Statement> getBody() {
    return body;
  }
}
