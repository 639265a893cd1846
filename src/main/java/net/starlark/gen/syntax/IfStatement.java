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
 * Syntax node for an if or elif statement.
 *
 * <p>An {@code elif} is represented as an IfStatement that is the sole statement of the enclosing
 * IfStatement's else block.
 */
public final class IfStatement extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> thenBlock; // non-empty
  private final ImmutableList<Statement> elseBlock; // empty if no else clause

  public IfStatement(
      Expression condition,
      List<? extends Statement> thenBlock,
      List<? extends Statement> elseBlock) {
    super(Kind.IF);
    this.condition = condition;
    this.thenBlock = ImmutableList.copyOf(thenBlock);
    this.elseBlock = ImmutableList.copyOf(elseBlock);
  }

  /** Constructs an if statement with no else clause. */
  public IfStatement(Expression condition, List<? extends Statement> thenBlock) {
    this(condition, thenBlock, ImmutableList.of());
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getThenBlock() {
    return thenBlock;
  }

  /** Returns the else block, which is empty if there is no else clause. */
  public ImmutableList<Statement> getElseBlock() {
    return elseBlock;
  }
}
