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

/**
 * Syntax node for an assignment statement ({@code lhs = rhs}) or augmented assignment statement
 * ({@code lhs op= rhs}).
 */
public final class AssignmentStatement extends Statement {

  private final Expression lhs; // = IDENTIFIER | DOT | INDEX | LIST_EXPR | TUPLE_EXPR | PAREN
  private final TokenKind op; // EQUALS for an ordinary assignment
  private final Expression rhs;

  public AssignmentStatement(Expression lhs, TokenKind op, Expression rhs) {
    super(Kind.ASSIGNMENT);
    this.lhs = lhs;
    this.op = op;
    this.rhs = rhs;
  }

  /** Returns the LHS of the assignment. */
  public Expression getLHS() {
    return lhs;
  }

  /** Returns the assignment operator: {@code =} or an augmented form such as {@code +=}. */
  public TokenKind getOperator() {
    return op;
  }

  /** Reports whether this is an augmented assignment. */
  public boolean isAugmented() {
    return op != TokenKind.EQUALS;
  }

  /** Returns the RHS of the assignment. */
  public Expression getRHS() {
    return rhs;
  }
}
