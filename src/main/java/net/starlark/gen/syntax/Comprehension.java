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
 * Syntax node for list and dict comprehensions.
 *
 * <p>A comprehension contains one or more clauses, e.g. [a+b for a in list if a>0 for b in list]
 * contains three clauses: "for a in list", "if a>0", "for b in list". The body expression is "a+b".
 */
public final class Comprehension extends Expression {

  /** For or If */
  public abstract static class Clause extends Node {}

  /** A for clause in a comprehension, e.g. "for a in b" in the example above. */
  public static final class For extends Clause {
    private final Expression vars;
    private final Expression iterable;

    public For(Expression vars, Expression iterable) {
      this.vars = vars;
      this.iterable = iterable;
    }

    public Expression getVars() {
      return vars;
    }

    public Expression getIterable() {
      return iterable;
    }
  }

  /** A if clause in a comprehension, e.g. "if c" in the example above. */
  public static final class If extends Clause {
    private final Expression condition;

    public If(Expression condition) {
      this.condition = condition;
    }

    public Expression getCondition() {
      return condition;
    }
  }

  private final boolean isDict; // {k: v for vars in iterable}
  private final Expression body; // or DictEntry
  private final ImmutableList<Clause> clauses;

  /**
   * Constructs a comprehension. When {@code isDict} is set the comprehension is written in curly
   * braces and its body is normally a {@link DictEntry}.
   */
  public Comprehension(boolean isDict, Expression body, List<? extends Clause> clauses) {
    super(Kind.COMPREHENSION);
    this.isDict = isDict;
    this.body = body;
    this.clauses = ImmutableList.copyOf(clauses);
  }

  public boolean isDict() {
    return isDict;
  }

  /** Returns the loop body: an expression for a list comprehension, or a DictEntry for a dict. */
  public Expression getBody() {
    return body;
  }

  public ImmutableList<Clause> getClauses() {
    return clauses;
  }
}
