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

/**
 * A Node is a node in a Starlark syntax tree.
 *
 * <p>Nodes are immutable once constructed. Child references may be null when a tree is built by
 * hand; consumers must report such trees as erroneous rather than fail with a {@link
 * NullPointerException}.
 */
public abstract class Node {

  Node() {}
}
