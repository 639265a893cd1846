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

/** Base class for all statements nodes in the AST. */
public abstract class Statement extends Node {

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public enum Kind {
    ASSIGNMENT,
    DEF,
    EXPRESSION,
    FLOW,
    FOR,
    IF,
    LOAD,
    RETURN,
    WHILE,
  }

  private final Kind kind;

  Statement(Kind kind) {
    this.kind = kind;
  }

  /**
   * Kind of the statement. This is similar to using instanceof, except that it's more efficient
   * and can be used in a switch/case.
   */
  public final Kind kind() {
    return kind;
  }
}
