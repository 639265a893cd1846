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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import javax.annotation.Nullable;
import net.starlark.gen.syntax.AssignmentStatement;
import net.starlark.gen.syntax.DefStatement;
import net.starlark.gen.syntax.Expression;
import net.starlark.gen.syntax.ExpressionStatement;
import net.starlark.gen.syntax.FlowStatement;
import net.starlark.gen.syntax.ForStatement;
import net.starlark.gen.syntax.Identifier;
import net.starlark.gen.syntax.IfStatement;
import net.starlark.gen.syntax.Literal;
import net.starlark.gen.syntax.LoadStatement;
import net.starlark.gen.syntax.ReturnStatement;
import net.starlark.gen.syntax.Statement;
import net.starlark.gen.syntax.TokenKind;
import net.starlark.gen.syntax.WhileStatement;

/**
 * Renders statements as Starlark source text.
 *
 * <p>A statement is written starting with the indentation for the current depth and ending with a
 * newline. Compound statements write their blocks one level deeper.
 */
final class StatementRenderer {

  private static final ImmutableSet<TokenKind> ASSIGNMENT_OPERATORS =
      ImmutableSet.of(
          TokenKind.EQUALS,
          TokenKind.PLUS_EQUALS,
          TokenKind.MINUS_EQUALS,
          TokenKind.STAR_EQUALS,
          TokenKind.PERCENT_EQUALS);

  private static final ImmutableSet<TokenKind> FLOW_TOKENS =
      ImmutableSet.of(TokenKind.BREAK, TokenKind.CONTINUE, TokenKind.PASS);

  private StatementRenderer() {}

  /** Renders any statement, dispatching on its kind. */
  static void render(Appendable out, @Nullable Statement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("nil statement is not supported");
    }
    switch (input.kind()) {
      case ASSIGNMENT:
        assignment(out, (AssignmentStatement) input, options);
        return;
      case DEF:
        def(out, (DefStatement) input, options);
        return;
      case EXPRESSION:
        expression(out, (ExpressionStatement) input, options);
        return;
      case FLOW:
        flow(out, (FlowStatement) input, options);
        return;
      case FOR:
        forStatement(out, (ForStatement) input, options);
        return;
      case IF:
        ifStatement(out, (IfStatement) input, options);
        return;
      case LOAD:
        load(out, (LoadStatement) input, options);
        return;
      case RETURN:
        returnStatement(out, (ReturnStatement) input, options);
        return;
      case WHILE:
        whileStatement(out, (WhileStatement) input, options);
        return;
    }
    throw new RenderException(
        String.format("type %s is not supported", input.getClass().getSimpleName()));
  }

  static void assignment(Appendable out, AssignmentStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering assign statement: nil input");
    }
    if (!ASSIGNMENT_OPERATORS.contains(input.getOperator())) {
      throw new RenderException(
          String.format(
              "rendering assign statement: unsupported Op token %s, expected one of: =, +=, -=,"
                  + " *=, %%=",
              input.getOperator()));
    }
    Renderer.render(
        out,
        "rendering assign statement",
        options,
        Item.INDENT,
        Item.expression(input.getLHS(), "LHS"),
        Item.SPACE,
        Item.token(input.getOperator(), "Op"),
        Item.SPACE,
        Item.expression(input.getRHS(), "RHS"),
        Item.NEWLINE);
  }

  static void def(Appendable out, DefStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering def statement: nil input");
    }
    String errPrefix = "rendering def statement";
    Renderer.render(
        out,
        errPrefix,
        options,
        Item.INDENT,
        Item.token(TokenKind.DEF, "DEF"),
        Item.SPACE,
        Item.expression(input.getIdentifier(), "Name"),
        Item.token(TokenKind.LPAREN, "LPAREN"));
    Renderer.render(
        out,
        errPrefix,
        options,
        ExpressionRenderer.sequence(input.getParameters(), Layout.SINGLE_LINE, "parameter"));
    Renderer.render(
        out,
        errPrefix,
        options,
        Item.token(TokenKind.RPAREN, "RPAREN"),
        Item.COLON,
        Item.NEWLINE,
        Item.statements(input.getBody(), "Body", /* addIndent= */ true));
  }

  static void expression(Appendable out, ExpressionStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering expression statement: nil input");
    }
    Expression expr = input.getExpression();
    if (expr instanceof Literal && ((Literal) expr).getValue() instanceof String) {
      Docstrings.render(out, (Literal) expr, options);
      return;
    }
    Renderer.render(
        out,
        "rendering expression statement",
        options,
        Item.INDENT,
        Item.expression(expr, "X"),
        Item.NEWLINE);
  }

  static void flow(Appendable out, FlowStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering branch statement: nil input");
    }
    if (!FLOW_TOKENS.contains(input.getFlowKind())) {
      throw new RenderException(
          String.format(
              "rendering branch statement: unsupported token %s, expected break, continue or pass",
              input.getFlowKind()));
    }
    Renderer.render(
        out,
        "rendering branch statement",
        options,
        Item.INDENT,
        Item.token(input.getFlowKind(), "Token"),
        Item.NEWLINE);
  }

  static void forStatement(Appendable out, ForStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering for statement: nil input");
    }
    Renderer.render(
        out,
        "rendering for statement",
        options,
        Item.INDENT,
        Item.token(TokenKind.FOR, "FOR"),
        Item.SPACE,
        Item.expression(input.getVars(), "Vars"),
        Item.SPACE,
        Item.token(TokenKind.IN, "IN"),
        Item.SPACE,
        Item.expression(input.getIterable(), "Iterable"),
        Item.COLON,
        Item.NEWLINE,
        Item.statements(input.getBody(), "Body", /* addIndent= */ true));
  }

  static void ifStatement(Appendable out, IfStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering if statement: nil input");
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(
        Item.INDENT,
        Item.token(TokenKind.IF, "IF"),
        Item.SPACE,
        Item.expression(input.getCondition(), "Condition"),
        Item.COLON,
        Item.NEWLINE,
        Item.statements(input.getThenBlock(), "Then", /* addIndent= */ true));
    if (!input.getElseBlock().isEmpty()) {
      items.add(
          Item.INDENT,
          Item.token(TokenKind.ELSE, "ELSE"),
          Item.COLON,
          Item.NEWLINE,
          Item.statements(input.getElseBlock(), "Else", /* addIndent= */ true));
    }
    Renderer.render(out, "rendering if statement", options, items.build());
  }

  static void load(Appendable out, LoadStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering load statement: nil input");
    }
    ImmutableList<Identifier> from = input.getFrom();
    ImmutableList<Identifier> to = input.getTo();
    if (from.size() != to.size()) {
      throw new RenderException(
          String.format(
              "rendering load statement, lengths mismatch, From: %d, To: %d",
              from.size(), to.size()));
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(
        Item.INDENT,
        Item.token(TokenKind.LOAD, "LOAD"),
        Item.token(TokenKind.LPAREN, "LPAREN"),
        Item.expression(input.getModule(), "Module"));
    for (int i = 0; i < from.size(); i++) {
      items.add(Item.COMMA, Item.SPACE);
      // load("m", "x") binds x; load("m", y="x") binds y.
      if (!Objects.equals(from.get(i).getName(), to.get(i).getName())) {
        items.add(Item.expression(to.get(i), "To[" + i + "]"));
        if (options.spaceAroundEquals()) {
          items.add(Item.SPACE);
        }
        items.add(Item.token(TokenKind.EQUALS, "EQUALS"));
        if (options.spaceAroundEquals()) {
          items.add(Item.SPACE);
        }
      }
      items.add(Item.QUOTE, Item.expression(from.get(i), "From[" + i + "]"), Item.QUOTE);
    }
    items.add(Item.token(TokenKind.RPAREN, "RPAREN"), Item.NEWLINE);
    Renderer.render(out, "rendering load statement", options, items.build());
  }

  static void returnStatement(Appendable out, ReturnStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering return statement: nil input");
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(Item.INDENT, Item.token(TokenKind.RETURN, "RETURN"));
    if (input.getResult() != null) {
      items.add(Item.SPACE, Item.expression(input.getResult(), "Result"));
    }
    items.add(Item.NEWLINE);
    Renderer.render(out, "rendering return statement", options, items.build());
  }

  static void whileStatement(Appendable out, WhileStatement input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering while statement: nil input");
    }
    Renderer.render(
        out,
        "rendering while statement",
        options,
        Item.INDENT,
        Item.token(TokenKind.WHILE, "WHILE"),
        Item.SPACE,
        Item.expression(input.getCondition(), "Condition"),
        Item.COLON,
        Item.NEWLINE,
        Item.statements(input.getBody(), "Body", /* addIndent= */ true));
  }
}
