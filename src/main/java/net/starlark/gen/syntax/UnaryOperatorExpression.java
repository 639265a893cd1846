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

import javax.annotation.Nullable;

/** A UnaryOperatorExpression represents a unary operator expression, 'op x'. */
public final class UnaryOperatorExpression extends Expression {

  private final TokenKind op; // NOT, TILDE, MINUS, PLUS, STAR or STAR_STAR
  @Nullable private final Expression x;

  /**
   * Constructs a unary operator expression. As a special case, a {@link TokenKind#STAR} with no
   * operand denotes the bare star that separates keyword-only parameters in {@code def f(*, x)}.
   */
  public UnaryOperatorExpression(TokenKind op, @Nullable Expression x) {
    super(Kind.UNARY_OPERATOR);
    this.op = op;
    this.x = x;
  }

  /** Returns the operator. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the operand, or null for a bare star. */
  @Nullable
  public Expression getX() {
    return x;
  }
}
