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

import com.google.common.base.Preconditions;
import java.io.IOException;
import javax.annotation.Nullable;

/**
 * A RenderException indicates that a syntax tree could not be rendered as Starlark source text.
 *
 * <p>The message is a path of the form {@code "outer context: inner context: ... : cause"} that
 * identifies the node, field and formatting step at which rendering failed. If the failure was
 * caused by the output rejecting a write, {@link #getCause} returns that {@link IOException}
 * however deeply the failure was nested.
 */
public class RenderException extends Exception {

  /** Constructs a RenderException with the given message. */
  public RenderException(String message) {
    this(message, /* cause= */ null);
  }

  /** Constructs a RenderException with a message and optional cause. */
  public RenderException(String message, @Nullable Throwable cause) {
    super(Preconditions.checkNotNull(message), cause);
  }

  /** Returns a RenderException for a failed write, keeping the write error as the cause. */
  static RenderException writeFailed(String context, IOException cause) {
    return new RenderException(context + ": " + getCauseMessage(cause), cause);
  }

  /**
   * Returns a copy of {@code inner} whose message is prefixed by {@code context}. The cause of
   * {@code inner}, if any, is preserved.
   */
  static RenderException wrap(String context, RenderException inner) {
    return new RenderException(context + ": " + inner.getMessage(), inner.getCause());
  }

  private static String getCauseMessage(Throwable cause) {
    String msg = cause.getMessage();
    return msg != null ? msg : cause.toString();
  }

  /** Returns the error message, which contains the full path to the failure. */
  @Override
  public final String getMessage() {
    return super.getMessage();
  }
}
