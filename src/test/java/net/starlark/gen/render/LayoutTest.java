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

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import net.starlark.gen.render.Layout.LineBreak;
import net.starlark.gen.render.Layout.TrailingComma;
import org.junit.Test;
import org.junit.runner.RunWith;

/** Tests of {@link Layout}. */
@RunWith(TestParameterInjector.class)
public final class LayoutTest {

  @Test
  public void emptySequenceNeverBreaksOrGetsComma(@TestParameter Layout layout) {
    LayoutDecision decision = layout.decide(0);
    assertThat(decision.breakLines()).isFalse();
    assertThat(decision.trailingComma()).isFalse();
  }

  @Test
  public void trailingCommaIsMonotonic(@TestParameter Layout layout) {
    // Once a layout wants a trailing comma, it wants one for every longer sequence too.
    boolean seen = false;
    for (int n = 0; n < 5; n++) {
      boolean comma = layout.decide(n).trailingComma();
      if (seen) {
        assertThat(comma).isTrue();
      }
      seen |= comma;
    }
  }

  @Test
  public void ofRoundTripsThePolicies(@TestParameter Layout layout) {
    assertThat(Layout.of(layout.lineBreak(), layout.trailingComma())).isSameInstanceAs(layout);
  }

  @Test
  public void lineBreakPolicies() {
    assertThat(Layout.SINGLE_LINE.decide(3).breakLines()).isFalse();
    assertThat(Layout.MULTILINE_MULTIPLE.decide(1).breakLines()).isFalse();
    assertThat(Layout.MULTILINE_MULTIPLE.decide(2).breakLines()).isTrue();
    assertThat(Layout.MULTILINE.decide(1).breakLines()).isTrue();
  }

  @Test
  public void trailingCommaPolicies() {
    assertThat(Layout.SINGLE_LINE.decide(2).trailingComma()).isFalse();
    assertThat(Layout.SINGLE_LINE_COMMA.decide(1).trailingComma()).isTrue();
    assertThat(Layout.SINGLE_LINE_COMMA_TWO_AND_MORE.decide(1).trailingComma()).isFalse();
    assertThat(Layout.SINGLE_LINE_COMMA_TWO_AND_MORE.decide(2).trailingComma()).isTrue();
    assertThat(Layout.MULTILINE_COMMA_TWO_AND_MORE.decide(1).trailingComma()).isFalse();
  }

  @Test
  public void everyCombinationHasALayout(
      @TestParameter LineBreak lineBreak, @TestParameter TrailingComma trailingComma) {
    Layout layout = Layout.of(lineBreak, trailingComma);
    assertThat(layout.lineBreak()).isEqualTo(lineBreak);
    assertThat(layout.trailingComma()).isEqualTo(trailingComma);
  }

  @Test
  public void ofRejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Layout.of(null, TrailingComma.NEVER));
  }
}
