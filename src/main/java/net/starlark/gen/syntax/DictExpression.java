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
 * Syntax node for dict expressions.
 *
 * <p>The entries are held as plain expressions, the way a parser produces them; a well-formed
 * dict contains only {@link DictEntry} elements.
 */
public final class DictExpression extends Expression {

  private final ImmutableList<Expression> entries;

  public DictExpression(List<? extends Expression> entries) {
    super(Kind.DICT_EXPR);
    this.entries = ImmutableList.copyOf(entries);
  }

  public ImmutableList<Expression> getEntries() {
    return entries;
  }
}
