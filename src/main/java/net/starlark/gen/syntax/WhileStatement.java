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

/** Syntax node for a while loop statement, {@code while cond: ...}. */
public final class WhileStatement extends Statement {

  private final Expression condition;
  private final ImmutableList<Statement> body; // non-empty if well formed

  public WhileStatement(Expression condition, List<? extends Statement> body) {
    super(Kind.WHILE);
    this.condition = condition;
    this.body = ImmutableList.copyOf(body);
  }

  public Expression getCondition() {
    return condition;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }
}
