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

/** Syntax node for a 'def' statement, which defines a function. */
public final class DefStatement extends Statement {

  private final Identifier identifier;
  private final ImmutableList<Expression> parameters;
  private final ImmutableList<Statement> body; // non-empty if well formed

  /**
   * Constructs a function definition. Parameters are identifiers, {@code name=default} binary
   * expressions, or unary star expressions for {@code *args}, {@code **kwargs} and the bare
   * {@code *}.
   */
  public DefStatement(
      Identifier identifier,
      List<? extends Expression> parameters,
      List<? extends Statement> body) {
    super(Kind.DEF);
    this.identifier = identifier;
    this.parameters = ImmutableList.copyOf(parameters);
    this.body = ImmutableList.copyOf(body);
  }

  public Identifier getIdentifier() {
    return identifier;
  }

  public ImmutableList<Expression> getParameters() {
    return parameters;
  }

  public ImmutableList<Statement> getBody() {
    return body;
  }
}
