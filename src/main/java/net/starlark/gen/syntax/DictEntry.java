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

/** A key/value pair in a dict expression or a dict comprehension. */
public final class DictEntry extends Expression {

  private final Expression key;
  private final Expression value;

  public DictEntry(Expression key, Expression value) {
    super(Kind.DICT_ENTRY);
    this.key = key;
    this.value = value;
  }

  public Expression getKey() {
    return key;
  }

  public Expression getValue() {
    return value;
  }
}
