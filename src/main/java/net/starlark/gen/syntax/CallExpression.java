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

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final ImmutableList<Expression> arguments;

  /**
   * Constructs a call. Keyword arguments are {@link BinaryOperatorExpression}s with operator
   * {@link TokenKind#EQUALS}; {@code *args} and {@code **kwargs} are {@link
   * UnaryOperatorExpression}s.
   */
  public CallExpression(Expression function, List<? extends Expression> arguments) {
    super(Kind.CALL);
    this.function = function;
    this.arguments = ImmutableList.copyOf(arguments);
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return function;
  }

  /** Returns the arguments of the call, in source order. */
  public ImmutableList<Expression> getArguments() {
    return arguments;
  }
}
