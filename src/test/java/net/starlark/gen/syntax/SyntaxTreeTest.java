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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the syntax node classes. */
@RunWith(JUnit4.class)
public final class SyntaxTreeTest {

  @Test
  public void identifierValidity() {
    assertThat(Identifier.isValid("foo_1")).isTrue();
    assertThat(Identifier.isValid("_")).isTrue();
    assertThat(Identifier.isValid("1foo")).isFalse();
    assertThat(Identifier.isValid("a-b")).isFalse();
    assertThat(Identifier.isValid("")).isFalse();
  }

  @Test
  public void literalFactories() {
    Literal s = Literal.ofString("x");
    assertThat(s.kind()).isEqualTo(Expression.Kind.LITERAL);
    assertThat(s.getToken()).isEqualTo(TokenKind.STRING);
    assertThat(s.getValue()).isEqualTo("x");
    assertThat(s.getLocation()).isNull();

    Literal raw = Literal.ofRaw(TokenKind.FLOAT, "0.5");
    assertThat(raw.getValue()).isNull();
    assertThat(raw.getRaw()).isEqualTo("0.5");

    assertThat(Literal.ofNumber(3L).getToken()).isEqualTo(TokenKind.INT);
  }

  @Test
  public void location() {
    Location loc = Location.fromFileLineColumn("foo.bzl", 3, 17);
    assertThat(loc.toString()).isEqualTo("foo.bzl:3:17");
    assertThat(loc).isEqualTo(Location.fromFileLineColumn("foo.bzl", 3, 17));
    assertThat(Location.fromFileLineColumn("foo.bzl", 0, 0).toString()).isEqualTo("foo.bzl");
    assertThrows(
        IllegalArgumentException.class, () -> Location.fromFileLineColumn("foo.bzl", -1, 0));
  }

  @Test
  public void assignmentAugmented() {
    Identifier x = new Identifier("x");
    assertThat(new AssignmentStatement(x, TokenKind.EQUALS, x).isAugmented()).isFalse();
    assertThat(new AssignmentStatement(x, TokenKind.PLUS_EQUALS, x).isAugmented()).isTrue();
  }

  @Test
  public void blocksAreImmutableCopies() {
    List<Statement> body = new ArrayList<>();
    body.add(new FlowStatement(TokenKind.PASS));
    ForStatement stmt = new ForStatement(new Identifier("x"), new Identifier("xs"), body);
    body.add(new FlowStatement(TokenKind.BREAK));

    assertThat(stmt.getBody()).hasSize(1);
    assertThat(stmt.kind()).isEqualTo(Statement.Kind.FOR);
    assertThat(new IfStatement(new Identifier("c"), body).getElseBlock()).isEmpty();
  }

  @Test
  public void tokenSpelling() {
    assertThat(TokenKind.NOT_IN.toString()).isEqualTo("not in");
    assertThat(TokenKind.PERCENT_EQUALS.toString()).isEqualTo("%=");
  }

  @Test
  public void comprehensionClauses() {
    Comprehension comp =
        new Comprehension(
            /* isDict= */ false,
            new Identifier("x"),
            ImmutableList.of(new Comprehension.For(new Identifier("x"), new Identifier("xs"))));
    assertThat(comp.isDict()).isFalse();
    assertThat(comp.getClauses()).hasSize(1);
    assertThat(comp.kind()).isEqualTo(Expression.Kind.COMPREHENSION);
  }
}
