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

/** Syntax node for a list expression, {@code [e, ...]}. */
public final class ListExpression extends Expression {

  private final ImmutableList<Expression> elements;

  public ListExpression(List<? extends Expression> elements) {
    super(Kind.LIST_EXPR);
    this.elements = ImmutableList.copyOf(elements);
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }
}
