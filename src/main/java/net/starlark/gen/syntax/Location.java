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

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/**
 * A Location denotes a position within a Starlark file: a file name, a 1-based line number and a
 * 1-based column number. A zero line or column means the value is unknown.
 */
@Immutable
public final class Location {

  private final String file;
  private final int line;
  private final int column;

  private Location(String file, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.line = line;
    this.column = column;
  }

  /** Returns a Location for the given file, line and column. */
  public static Location fromFileLineColumn(String file, int line, int column) {
    Preconditions.checkArgument(line >= 0, "invalid line %s", line);
    Preconditions.checkArgument(column >= 0, "invalid column %s", column);
    return new Location(file, line, column);
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the line number of this location. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location. */
  public int column() {
    return column;
  }

  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file);
    if (line != 0) {
      buf.append(':').append(line);
      if (column != 0) {
        buf.append(':').append(column);
      }
    }
    return buf.toString();
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location
            && this.file.equals(((Location) that).file)
            && this.line == ((Location) that).line
            && this.column == ((Location) that).column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, line, column);
  }
}
