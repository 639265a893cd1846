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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link RenderOptions}. */
@RunWith(JUnit4.class)
public final class RenderOptionsTest {

  @Test
  public void defaults() {
    RenderOptions options = RenderOptions.DEFAULT;
    assertThat(options.depth()).isEqualTo(0);
    assertThat(options.indent()).isEqualTo("    ");
    assertThat(options.spaceAroundEquals()).isFalse();
    assertThat(options.callLayout()).isEqualTo(Layout.SINGLE_LINE);
    assertThat(options.dictLayout()).isEqualTo(Layout.SINGLE_LINE);
    assertThat(options.listLayout()).isEqualTo(Layout.SINGLE_LINE);
    assertThat(options.tupleLayout()).isEqualTo(Layout.SINGLE_LINE);
  }

  @Test
  public void withDepthIncrementLeavesReceiverUnchanged() {
    RenderOptions options = RenderOptions.builder().depth(2).indent("\t").build();
    RenderOptions deeper = options.withDepthIncrement(1);

    assertThat(options.depth()).isEqualTo(2);
    assertThat(deeper.depth()).isEqualTo(3);
    assertThat(deeper.indent()).isEqualTo("\t");
    assertThat(deeper.currentIndent()).isEqualTo("\t\t\t");
    assertThat(options.withDepthIncrement(0)).isSameInstanceAs(options);
  }

  @Test
  public void negativeDepthIsRejected() {
    IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class, () -> RenderOptions.builder().depth(-1).build());
    assertThat(e).hasMessageThat().isEqualTo("invalid depth value -1, value must be >= 0");
  }

  @Test
  public void nullIndentIsRejected() {
    assertThrows(NullPointerException.class, () -> RenderOptions.builder().indent(null));
  }

  @Test
  public void nullLayoutIsRejected() {
    assertThrows(NullPointerException.class, () -> RenderOptions.builder().listLayout(null));
  }

  @Test
  public void toBuilderCopiesAllOptions() {
    RenderOptions options =
        RenderOptions.builder()
            .spaceAroundEquals(true)
            .callLayout(Layout.MULTILINE_COMMA)
            .tupleLayout(Layout.SINGLE_LINE_COMMA)
            .build();
    assertThat(options.toBuilder().build()).isEqualTo(options);
  }
}
