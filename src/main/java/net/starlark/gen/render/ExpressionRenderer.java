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
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.gen.syntax.BinaryOperatorExpression;
import net.starlark.gen.syntax.CallExpression;
import net.starlark.gen.syntax.Comprehension;
import net.starlark.gen.syntax.ConditionalExpression;
import net.starlark.gen.syntax.DictEntry;
import net.starlark.gen.syntax.DictExpression;
import net.starlark.gen.syntax.DotExpression;
import net.starlark.gen.syntax.Expression;
import net.starlark.gen.syntax.Identifier;
import net.starlark.gen.syntax.IndexExpression;
import net.starlark.gen.syntax.ListExpression;
import net.starlark.gen.syntax.Literal;
import net.starlark.gen.syntax.ParenExpression;
import net.starlark.gen.syntax.SliceExpression;
import net.starlark.gen.syntax.TokenKind;
import net.starlark.gen.syntax.TupleExpression;
import net.starlark.gen.syntax.UnaryOperatorExpression;

/**
 * Renders expressions as Starlark source text.
 *
 * <p>There is one method per expression kind. Each reports a missing node as {@code "rendering
 * <kind>: nil input"} and prefixes the failures of its children with {@code "rendering <kind>
 * <field>"}.
 */
final class ExpressionRenderer {

  private ExpressionRenderer() {}

  /** Renders any expression, dispatching on its kind. */
  static void render(Appendable out, @Nullable Expression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("nil expression is not supported");
    }
    switch (input.kind()) {
      case BINARY_OPERATOR:
        binary(out, (BinaryOperatorExpression) input, options);
        return;
      case CALL:
        call(out, (CallExpression) input, options);
        return;
      case COMPREHENSION:
        comprehension(out, (Comprehension) input, options);
        return;
      case CONDITIONAL:
        conditional(out, (ConditionalExpression) input, options);
        return;
      case DICT_ENTRY:
        dictEntry(out, (DictEntry) input, options);
        return;
      case DICT_EXPR:
        dict(out, (DictExpression) input, options);
        return;
      case DOT:
        dot(out, (DotExpression) input, options);
        return;
      case IDENTIFIER:
        identifier(out, (Identifier) input, options);
        return;
      case INDEX:
        index(out, (IndexExpression) input, options);
        return;
      case LIST_EXPR:
        list(out, (ListExpression) input, options);
        return;
      case LITERAL:
        literal(out, (Literal) input, options);
        return;
      case PAREN:
        paren(out, (ParenExpression) input, options);
        return;
      case SLICE:
        slice(out, (SliceExpression) input, options);
        return;
      case TUPLE_EXPR:
        tuple(out, (TupleExpression) input, options);
        return;
      case UNARY_OPERATOR:
        unary(out, (UnaryOperatorExpression) input, options);
        return;
      default:
        // e.g. LambdaExpression
        throw new RenderException(
            String.format("type %s is not supported", input.getClass().getSimpleName()));
    }
  }

  /**
   * Returns the items for a comma-separated sequence, laid out as {@code layout} decides for its
   * length. The items for the enclosing brackets are not included.
   */
  static ImmutableList<Item> sequence(List<Expression> elements, Layout layout, String label) {
    LayoutDecision decision = layout.decide(elements.size());
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    if (decision.breakLines()) {
      items.add(Item.NEWLINE, Item.EXTRA_INDENT);
    }
    for (int i = 0; i < elements.size(); i++) {
      if (i > 0) {
        items.add(Item.COMMA);
        if (decision.breakLines()) {
          items.add(Item.NEWLINE, Item.EXTRA_INDENT);
        } else {
          items.add(Item.SPACE);
        }
      }
      String description = label + " " + i;
      items.add(
          decision.breakLines()
              ? Item.indentedExpression(elements.get(i), description)
              : Item.expression(elements.get(i), description));
    }
    if (decision.trailingComma()) {
      items.add(Item.COMMA);
    }
    if (decision.breakLines()) {
      items.add(Item.NEWLINE, Item.INDENT);
    }
    return items.build();
  }

  static void binary(Appendable out, BinaryOperatorExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering binary expression: nil input");
    }
    // x=y is a keyword argument or a parameter default, not an assignment.
    boolean spaced = input.getOperator() != TokenKind.EQUALS || options.spaceAroundEquals();
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(Item.expression(input.getX(), "X"));
    if (spaced) {
      items.add(Item.SPACE);
    }
    items.add(Item.token(input.getOperator(), "Op"));
    if (spaced) {
      items.add(Item.SPACE);
    }
    items.add(Item.expression(input.getY(), "Y"));
    Renderer.render(out, "rendering binary expression", options, items.build());
  }

  static void call(Appendable out, CallExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering call expression: nil input");
    }
    String errPrefix = "rendering call expression";
    Renderer.render(
        out,
        errPrefix,
        options,
        Item.expression(input.getFunction(), "Function"),
        Item.token(TokenKind.LPAREN, "LPAREN"));
    Renderer.render(
        out, errPrefix, options, sequence(input.getArguments(), options.callLayout(), "argument"));
    Renderer.render(out, errPrefix, options, Item.token(TokenKind.RPAREN, "RPAREN"));
  }

  static void comprehension(Appendable out, Comprehension input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering comprehension: nil input");
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(
        input.isDict()
            ? Item.token(TokenKind.LBRACE, "LBRACE")
            : Item.token(TokenKind.LBRACKET, "LBRACKET"));
    items.add(Item.expression(input.getBody(), "Body"));
    for (Comprehension.Clause clause : input.getClauses()) {
      if (clause instanceof Comprehension.For) {
        Comprehension.For forClause = (Comprehension.For) clause;
        items.add(
            Item.SPACE,
            Item.token(TokenKind.FOR, "FOR"),
            Item.SPACE,
            Item.expression(forClause.getVars(), "for clause Vars"),
            Item.SPACE,
            Item.token(TokenKind.IN, "IN"),
            Item.SPACE,
            Item.expression(forClause.getIterable(), "for clause Iterable"));
      } else if (clause instanceof Comprehension.If) {
        Comprehension.If ifClause = (Comprehension.If) clause;
        items.add(
            Item.SPACE,
            Item.token(TokenKind.IF, "IF"),
            Item.SPACE,
            Item.expression(ifClause.getCondition(), "if clause Condition"));
      } else {
        throw new RenderException(
            String.format(
                "rendering comprehension: unexpected clause type %s",
                clause.getClass().getName()));
      }
    }
    items.add(
        input.isDict()
            ? Item.token(TokenKind.RBRACE, "RBRACE")
            : Item.token(TokenKind.RBRACKET, "RBRACKET"));
    Renderer.render(out, "rendering comprehension", options, items.build());
  }

  static void conditional(Appendable out, ConditionalExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering conditional expression: nil input");
    }
    Renderer.render(
        out,
        "rendering conditional expression",
        options,
        Item.expression(input.getThenCase(), "ThenCase"),
        Item.SPACE,
        Item.token(TokenKind.IF, "IF"),
        Item.SPACE,
        Item.expression(input.getCondition(), "Condition"),
        Item.SPACE,
        Item.token(TokenKind.ELSE, "ELSE"),
        Item.SPACE,
        Item.expression(input.getElseCase(), "ElseCase"));
  }

  static void dictEntry(Appendable out, DictEntry input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering dict entry: nil input");
    }
    Renderer.render(
        out,
        "rendering dict entry",
        options,
        Item.expression(input.getKey(), "Key"),
        Item.COLON,
        Item.SPACE,
        Item.expression(input.getValue(), "Value"));
  }

  static void dict(Appendable out, DictExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering dict expression: nil input");
    }
    for (Expression entry : input.getEntries()) {
      if (entry.kind() != Expression.Kind.DICT_ENTRY) {
        throw new RenderException(
            String.format(
                "rendering dict expression: expected DictEntry, got %s",
                entry.getClass().getSimpleName()));
      }
    }
    String errPrefix = "rendering dict expression";
    Renderer.render(out, errPrefix, options, Item.token(TokenKind.LBRACE, "LBRACE"));
    Renderer.render(
        out, errPrefix, options, sequence(input.getEntries(), options.dictLayout(), "element"));
    Renderer.render(out, errPrefix, options, Item.token(TokenKind.RBRACE, "RBRACE"));
  }

  static void dot(Appendable out, DotExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering dot expression: nil input");
    }
    Renderer.render(
        out,
        "rendering dot expression",
        options,
        Item.expression(input.getObject(), "Object"),
        Item.token(TokenKind.DOT, "DOT"),
        Item.expression(input.getField(), "Field"));
  }

  static void identifier(Appendable out, Identifier input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering identifier: nil input");
    }
    if (input.getName() == null) {
      throw new RenderException("rendering identifier: nil name");
    }
    Renderer.render(out, "rendering identifier", options, Item.text(input.getName(), "Name"));
  }

  static void index(Appendable out, IndexExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering index expression: nil input");
    }
    Renderer.render(
        out,
        "rendering index expression",
        options,
        Item.expression(input.getObject(), "Object"),
        Item.token(TokenKind.LBRACKET, "LBRACKET"),
        Item.expression(input.getKey(), "Key"),
        Item.token(TokenKind.RBRACKET, "RBRACKET"));
  }

  static void list(Appendable out, ListExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering list expression: nil input");
    }
    String errPrefix = "rendering list expression";
    Renderer.render(out, errPrefix, options, Item.token(TokenKind.LBRACKET, "LBRACKET"));
    Renderer.render(
        out, errPrefix, options, sequence(input.getElements(), options.listLayout(), "element"));
    Renderer.render(out, errPrefix, options, Item.token(TokenKind.RBRACKET, "RBRACKET"));
  }

  static void literal(Appendable out, Literal input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering literal: nil input");
    }
    Object value = input.getValue();
    Item item;
    if (value == null) {
      item = Item.text(input.getRaw(), "raw value");
    } else if (value instanceof String) {
      item = Item.text(Tokens.quote((String) value), "string value");
    } else if (Tokens.isInteger(value)) {
      item =
          Item.text(
              Tokens.formatNumber((Number) value), value.getClass().getSimpleName() + " value");
    } else {
      throw new RenderException(
          String.format(
              "rendering literal: unsupported literal value type %s, expected String, Integer,"
                  + " Long, UnsignedInteger, UnsignedLong or BigInteger",
              value.getClass().getName()));
    }
    Renderer.render(out, "rendering literal", options, item);
  }

  static void paren(Appendable out, ParenExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering paren expression: nil input");
    }
    Expression x = input.getX();
    // The empty tuple writes its own parens.
    if (x instanceof TupleExpression && ((TupleExpression) x).getElements().isEmpty()) {
      Renderer.render(out, "rendering paren expression", options, Item.expression(x, "X"));
      return;
    }
    Renderer.render(
        out,
        "rendering paren expression",
        options,
        Item.token(TokenKind.LPAREN, "LPAREN"),
        Item.expression(x, "X"),
        Item.token(TokenKind.RPAREN, "RPAREN"));
  }

  static void slice(Appendable out, SliceExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering slice expression: nil input");
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(
        Item.expression(input.getObject(), "Object"), Item.token(TokenKind.LBRACKET, "LBRACKET"));
    if (input.getStart() != null) {
      items.add(Item.expression(input.getStart(), "Start"));
    }
    items.add(Item.COLON);
    if (input.getStop() != null) {
      items.add(Item.expression(input.getStop(), "Stop"));
    }
    if (input.getStep() != null) {
      items.add(Item.COLON, Item.expression(input.getStep(), "Step"));
    }
    items.add(Item.token(TokenKind.RBRACKET, "RBRACKET"));
    Renderer.render(out, "rendering slice expression", options, items.build());
  }

  static void tuple(Appendable out, TupleExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering tuple expression: nil input");
    }
    String errPrefix = "rendering tuple expression";
    ImmutableList<Expression> elements = input.getElements();
    if (elements.isEmpty()) {
      Renderer.render(
          out,
          errPrefix,
          options,
          Item.token(TokenKind.LPAREN, "LPAREN"),
          Item.token(TokenKind.RPAREN, "RPAREN"));
      return;
    }
    Renderer.render(
        out, errPrefix, options, sequence(elements, options.tupleLayout(), "element"));
  }

  static void unary(Appendable out, UnaryOperatorExpression input, RenderOptions options)
      throws RenderException {
    if (input == null) {
      throw new RenderException("rendering unary expression: nil input");
    }
    // A bare STAR is the keyword-only parameter marker, as in def f(*, x).
    if (input.getX() == null && input.getOperator() != TokenKind.STAR) {
      throw new RenderException(
          String.format(
              "rendering unary expression, nil X value for \"%s\" token", input.getOperator()));
    }
    ImmutableList.Builder<Item> items = ImmutableList.builder();
    items.add(Item.token(input.getOperator(), "Op"));
    if (input.getOperator() == TokenKind.NOT) {
      items.add(Item.SPACE);
    }
    if (input.getX() != null) {
      items.add(Item.expression(input.getX(), "X"));
    }
    Renderer.render(out, "rendering unary expression", options, items.build());
  }
}
