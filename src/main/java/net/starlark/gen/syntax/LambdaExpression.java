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

/** A LambdaExpression ({@code lambda params: body}) denotes an anonymous function. */
public final class LambdaExpression extends Expression {

  private final ImmutableList<Expression> parameters;
  private final Expression body;

  public LambdaExpression(List<? extends Expression> parameters, Expression body) {
    super(Kind.LAMBDA);
    this.parameters = ImmutableList.copyOf(parameters);
    this.body = body;
  }

  public ImmutableList<Expression> getParameters() {
    return parameters;
  }

  public Expression getBody() {
    return body;
  }
}
