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
import com.google.common.flogger.GoogleLogger;
import java.util.List;
import net.starlark.gen.syntax.Expression;
import net.starlark.gen.syntax.Statement;

/**
 * Unparser writes syntax trees out as Starlark source text.
 *
 * <p>The {@code render} methods return the text of a node; if rendering fails, no text is
 * returned. The {@code write} methods append to any {@link Appendable}; if rendering fails, a
 * prefix of the text may already have been written.
 *
 * <p>Rendering is a function of the node and the options only. Neither is modified, so an
 * Unparser may be used from several threads as long as each writes to its own output.
 */
public final class Unparser {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private Unparser() {}

  /** Returns the source text of a statement, with the default options. */
  public static String renderStatement(Statement stmt) throws RenderException {
    return renderStatement(stmt, RenderOptions.DEFAULT);
  }

  /** Returns the source text of a statement, including its trailing newline. */
  public static String renderStatement(Statement stmt, RenderOptions options)
      throws RenderException {
    StringBuilder buf = new StringBuilder();
    writeStatement(buf, stmt, options);
    return buf.toString();
  }

  /** Appends the source text of a statement to {@code out}, with the default options. */
  public static void writeStatement(Appendable out, Statement stmt) throws RenderException {
    writeStatement(out, stmt, RenderOptions.DEFAULT);
  }

  /** Appends the source text of a statement to {@code out}. */
  public static void writeStatement(Appendable out, Statement stmt, RenderOptions options)
      throws RenderException {
    Preconditions.checkNotNull(out);
    Preconditions.checkNotNull(options);
    try {
      StatementRenderer.render(out, stmt, options);
    } catch (RenderException e) {
      logger.atFine().withCause(e).log("failed to render statement at depth %d", options.depth());
      throw e;
    }
  }

  /** Returns the source text of an expression, with the default options. */
  public static String renderExpression(Expression expr) throws RenderException {
    return renderExpression(expr, RenderOptions.DEFAULT);
  }

  /** Returns the source text of an expression. */
  public static String renderExpression(Expression expr, RenderOptions options)
      throws RenderException {
    StringBuilder buf = new StringBuilder();
    writeExpression(buf, expr, options);
    return buf.toString();
  }

  /** Appends the source text of an expression to {@code out}, with the default options. */
  public static void writeExpression(Appendable out, Expression expr) throws RenderException {
    writeExpression(out, expr, RenderOptions.DEFAULT);
  }

  /** Appends the source text of an expression to {@code out}. */
  public static void writeExpression(Appendable out, Expression expr, RenderOptions options)
      throws RenderException {
    Preconditions.checkNotNull(out);
    Preconditions.checkNotNull(options);
    try {
      ExpressionRenderer.render(out, expr, options);
    } catch (RenderException e) {
      logger.atFine().withCause(e).log("failed to render expression at depth %d", options.depth());
      throw e;
    }
  }

  /** Returns the source text of a file, with the default options. */
  public static String renderFile(List<? extends Statement> statements) throws RenderException {
    return renderFile(statements, RenderOptions.DEFAULT);
  }

  /**
   * Returns the source text of a file made of the given top-level statements. Consecutive
   * statements are separated by a blank line.
   */
  public static String renderFile(List<? extends Statement> statements, RenderOptions options)
      throws RenderException {
    StringBuilder buf = new StringBuilder();
    for (int i = 0; i < statements.size(); i++) {
      if (i > 0) {
        buf.append('\n');
      }
      try {
        StatementRenderer.render(buf, statements.get(i), options);
      } catch (RenderException e) {
        logger.atFine().withCause(e).log("failed to render statement %d of file", i);
        throw RenderException.wrap(String.format("rendering file statement index %d", i), e);
      }
    }
    return buf.toString();
  }
}
