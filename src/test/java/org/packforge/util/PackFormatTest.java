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

package org.packforge.util;

import static com.google.common.truth.Truth.assertThat;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class PackFormatTest {

  @Test
  public void ranges() {
    assertThat(PackFormat.since(6).contains(6)).isTrue();
    assertThat(PackFormat.since(6).contains(5)).isFalse();
    assertThat(PackFormat.since(6).contains(PackFormat.LATEST)).isTrue();
    assertThat(PackFormat.until(6).contains(0)).isTrue();
    assertThat(PackFormat.until(6).contains(7)).isFalse();
    assertThat(PackFormat.any().encloses(PackFormat.since(4))).isTrue();
  }

  @Test
  public void functionDirectoryName(@TestParameter({"4", "15", "44"}) int packFormat) {
    assertThat(PackFormat.functionDirectoryName(packFormat)).isEqualTo("functions");
    assertThat(PackFormat.functionDirectoryName(packFormat + 41)).isEqualTo("function");
  }
}
