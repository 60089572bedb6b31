/*
 * Copyright 2025 The Packforge Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.packforge.command;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.packforge.command.Condition.atom;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ConditionTest {

  @Test
  public void namedConstructorsMatchInstanceMethods() {
    Condition a = atom("a");
    Condition b = atom("b");
    assertThat(a.and(b)).isEqualTo(Condition.and(a, b));
    assertThat(a.or(b)).isEqualTo(Condition.or(a, b));
    assertThat(a.not()).isEqualTo(Condition.not(a));
    assertThat(a.and(b)).isNotEqualTo(a.or(b));
    assertThat(a.and(b)).isNotEqualTo(b.and(a));
    assertThat(a.not().hashCode()).isEqualTo(Condition.not(atom("a")).hashCode());
  }

  @Test
  public void toStringShowsStructure() {
    Condition c = atom("a").and(atom("b").or(atom("c").not()));
    assertThat(c.toString()).isEqualTo("(a & (b | !c))");
  }

  @Test
  public void nullsAreRejected() {
    assertThrows(NullPointerException.class, () -> atom(null));
    assertThrows(NullPointerException.class, () -> atom("a").and(null));
  }
}
