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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.io.IOException;
import net.starlark.gen.syntax.AssignmentStatement;
import net.starlark.gen.syntax.BinaryOperatorExpression;
import net.starlark.gen.syntax.CallExpression;
import net.starlark.gen.syntax.DefStatement;
import net.starlark.gen.syntax.DictEntry;
import net.starlark.gen.syntax.DictExpression;
import net.starlark.gen.syntax.Expression;
import net.starlark.gen.syntax.ExpressionStatement;
import net.starlark.gen.syntax.FlowStatement;
import net.starlark.gen.syntax.ForStatement;
import net.starlark.gen.syntax.Identifier;
import net.starlark.gen.syntax.IfStatement;
import net.starlark.gen.syntax.ListExpression;
import net.starlark.gen.syntax.Literal;
import net.starlark.gen.syntax.LoadStatement;
import net.starlark.gen.syntax.ParenExpression;
import net.starlark.gen.syntax.ReturnStatement;
import net.starlark.gen.syntax.Statement;
import net.starlark.gen.syntax.TokenKind;
import net.starlark.gen.syntax.TupleExpression;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of the {@link Unparser} entry points. */
@RunWith(TestParameterInjector.class)
public final class UnparserTest {

  private static final RenderOptions MULTILINE_CALLS =
      RenderOptions.builder().callLayout(Layout.MULTILINE_MULTIPLE_COMMA_TWO_AND_MORE).build();

  private static Identifier id(String name) {
    return new Identifier(name);
  }

  private static Statement load(
      String module, ImmutableList<String> from, ImmutableList<String> to) {
    return new LoadStatement(
        Literal.ofString(module),
        from.stream().map(Identifier::new).collect(ImmutableList.toImmutableList()),
        to.stream().map(Identifier::new).collect(ImmutableList.toImmutableList()));
  }

  /** A function with a loop, a conditional and a multiline call, for whole-tree properties. */
  private static Statement sampleFunction() {
    return new DefStatement(
        id("build"),
        ImmutableList.of(
            id("ctx"), new BinaryOperatorExpression(id("deps"), TokenKind.EQUALS, id("None"))),
        ImmutableList.of(
            new ExpressionStatement(Literal.ofString("Builds the target.")),
            new ForStatement(
                id("d"),
                id("deps"),
                ImmutableList.of(
                    new IfStatement(
                        new BinaryOperatorExpression(id("d"), TokenKind.EQUALS_EQUALS, id("None")),
                        ImmutableList.of(new FlowStatement(TokenKind.CONTINUE))),
                    new ExpressionStatement(
                        new CallExpression(
                            id("use"),
                            ImmutableList.of(
                                id("d"),
                                new BinaryOperatorExpression(
                                    id("strict"), TokenKind.EQUALS, id("True"))))))),
            new ReturnStatement(
                new DictExpression(
                    ImmutableList.of(new DictEntry(Literal.ofString("ok"), id("True")))))));
  }

  @Test
  public void augmentedAssignment() throws Exception {
    Statement stmt =
        new AssignmentStatement(id("foo"), TokenKind.PLUS_EQUALS, Literal.ofNumber(2));
    assertThat(Unparser.renderStatement(stmt)).isEqualTo("foo += 2\n");
  }

  @Test
  public void singleArgumentStaysOnOneLine() throws Exception {
    Expression call = new CallExpression(id("f"), ImmutableList.of(id("a")));
    assertThat(Unparser.renderExpression(call, MULTILINE_CALLS)).isEqualTo("f(a)");
  }

  @Test
  public void twoArgumentsAreBrokenWithTrailingComma() throws Exception {
    Expression call = new CallExpression(id("f"), ImmutableList.of(id("a"), id("b")));
    assertThat(Unparser.renderExpression(call, MULTILINE_CALLS))
        .isEqualTo("f(\n    a,\n    b,\n)");
  }

  @Test
  public void loadAliasesDifferingNames() throws Exception {
    Statement stmt = load("mod", ImmutableList.of("foo", "bar"), ImmutableList.of("b", "a"));
    assertThat(Unparser.renderStatement(stmt)).isEqualTo("load(\"mod\", b=\"foo\", a=\"bar\")\n");
  }

  @Test
  public void loadOmitsAliasForSameName(@TestParameter({"x", "rule", "_private"}) String name)
      throws Exception {
    Statement stmt = load("mod", ImmutableList.of(name), ImmutableList.of(name));
    assertThat(Unparser.renderStatement(stmt)).isEqualTo("load(\"mod\", \"" + name + "\")\n");
  }

  @Test
  public void loadLengthMismatchWritesNothing() {
    Statement stmt = load("mod", ImmutableList.of("foo"), ImmutableList.of("a", "b"));
    StringBuilder out = new StringBuilder();
    RenderException e =
        assertThrows(RenderException.class, () -> Unparser.writeStatement(out, stmt));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("rendering load statement, lengths mismatch, From: 1, To: 2");
    assertThat(out.toString()).isEmpty();
  }

  @Test
  public void docstringLinesShareTheOpeningIndent() throws Exception {
    Statement stmt = new ExpressionStatement(Literal.ofString("line1\nline2"));
    RenderOptions options = RenderOptions.builder().depth(1).build();
    assertThat(Unparser.renderStatement(stmt, options))
        .isEqualTo("    \"\"\"line1\n    line2\"\"\"\n");
  }

  @Test
  public void emptySequencesIgnoreLayout(@TestParameter Layout layout) throws Exception {
    RenderOptions options =
        RenderOptions.builder()
            .callLayout(layout)
            .listLayout(layout)
            .dictLayout(layout)
            .tupleLayout(layout)
            .build();
    assertThat(
            Unparser.renderExpression(new CallExpression(id("f"), ImmutableList.of()), options))
        .isEqualTo("f()");
    assertThat(Unparser.renderExpression(new ListExpression(ImmutableList.of()), options))
        .isEqualTo("[]");
    assertThat(Unparser.renderExpression(new DictExpression(ImmutableList.of()), options))
        .isEqualTo("{}");
    Expression emptyTuple = new TupleExpression(ImmutableList.of());
    assertThat(Unparser.renderExpression(emptyTuple, options)).isEqualTo("()");
    assertThat(Unparser.renderExpression(new ParenExpression(emptyTuple), options))
        .isEqualTo("()");
  }

  @Test
  public void indentationIsLinearInDepth(
      @TestParameter({"0", "1", "3"}) int depth, @TestParameter({"1", "2", "4"}) int width)
      throws Exception {
    String indent = Strings.repeat(" ", width);
    Statement stmt =
        new IfStatement(id("a"), ImmutableList.of(new FlowStatement(TokenKind.PASS)));
    RenderOptions options = RenderOptions.builder().depth(depth).indent(indent).build();
    String outer = Strings.repeat(indent, depth);
    String inner = Strings.repeat(indent, depth + 1);
    assertThat(Unparser.renderStatement(stmt, options))
        .isEqualTo(outer + "if a:\n" + inner + "pass\n");
  }

  @Test
  public void renderingIsIdempotent() throws Exception {
    Statement stmt = sampleFunction();
    String first = Unparser.renderStatement(stmt, MULTILINE_CALLS);
    assertThat(Unparser.renderStatement(stmt, MULTILINE_CALLS)).isEqualTo(first);
    assertThat(first)
        .isEqualTo(
            "def build(ctx, deps=None):\n"
                + "    \"\"\"Builds the target.\"\"\"\n"
                + "    for d in deps:\n"
                + "        if d == None:\n"
                + "            continue\n"
                + "        use(\n"
                + "            d,\n"
                + "            strict=True,\n"
                + "        )\n"
                + "    return {\"ok\": True}\n");
  }

  @Test
  public void sinkFailureNamesEnclosingConstruct() {
    // The third "d" written is the first argument of use(...).
    FailingAppendable out = new FailingAppendable("d", 3);
    RenderException e =
        assertThrows(
            RenderException.class,
            () -> Unparser.writeStatement(out, sampleFunction(), MULTILINE_CALLS));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "rendering def statement, rendering Body statement index 1: rendering for statement,"
                + " rendering Body statement index 1: rendering expression statement X: rendering"
                + " call expression argument 0: rendering identifier Name: write of d failed");
    assertThat(e).hasCauseThat().isInstanceOf(IOException.class);
    assertThat(out.toString()).endsWith("        use(\n            ");
  }

  @Test
  public void renderReturnsNothingOnFailure() {
    Statement stmt =
        new ForStatement(
            id("x"),
            id("xs"),
            ImmutableList.of(new AssignmentStatement(id("x"), TokenKind.STAR, id("y"))));
    RenderException e = assertThrows(RenderException.class, () -> Unparser.renderStatement(stmt));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "rendering for statement, rendering Body statement index 0: rendering assign"
                + " statement: unsupported Op token *, expected one of: =, +=, -=, *=, %=");
  }

  @Test
  public void writeLeavesPartialOutputOnFailure() {
    Statement stmt =
        new ForStatement(
            id("x"),
            id("xs"),
            ImmutableList.of(new AssignmentStatement(id("x"), TokenKind.STAR, id("y"))));
    StringBuilder out = new StringBuilder();
    assertThrows(RenderException.class, () -> Unparser.writeStatement(out, stmt));
    assertThat(out.toString()).isEqualTo("for x in xs:\n");
  }

  @Test
  public void writeExpressionAppends() throws Exception {
    StringBuilder out = new StringBuilder("x = ");
    Unparser.writeExpression(out, new ListExpression(ImmutableList.of(Literal.ofNumber(1))));
    assertThat(out.toString()).isEqualTo("x = [1]");
  }

  @Test
  public void renderFileSeparatesStatementsWithBlankLines() throws Exception {
    ImmutableList<Statement> file =
        ImmutableList.of(
            load("//rules:defs.bzl", ImmutableList.of("lib"), ImmutableList.of("lib")),
            new AssignmentStatement(id("NAME"), TokenKind.EQUALS, Literal.ofString("app")),
            new ExpressionStatement(
                new CallExpression(
                    id("lib"),
                    ImmutableList.of(
                        new BinaryOperatorExpression(id("name"), TokenKind.EQUALS, id("NAME"))))));
    assertThat(Unparser.renderFile(file))
        .isEqualTo(
            "load(\"//rules:defs.bzl\", \"lib\")\n"
                + "\n"
                + "NAME = \"app\"\n"
                + "\n"
                + "lib(name=NAME)\n");
    assertThat(Unparser.renderFile(ImmutableList.of())).isEmpty();
  }

  @Test
  public void renderFileReportsStatementIndex() {
    ImmutableList<Statement> file =
        ImmutableList.of(new FlowStatement(TokenKind.PASS), new ReturnStatement(id(null)));
    RenderException e = assertThrows(RenderException.class, () -> Unparser.renderFile(file));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "rendering file statement index 1: rendering return statement Result: rendering"
                + " identifier: nil name");
  }
}
