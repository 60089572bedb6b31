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

package org.packforge.tools;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.packforge.Namespace;
import org.packforge.compiler.CompileOptions;

@RunWith(JUnit4.class)
public class RunTest {

  @Test
  public void sampleIsValid() {
    Namespace sample = Run.sample("demo");
    assertThat(sample.validate(Range.closed(4, 48))).isTrue();
    assertThat(sample.functions().keySet()).containsExactly("foo", "bar").inOrder();
  }

  @Test
  public void sampleCompilesForModernFormats() {
    ImmutableMap<String, ImmutableList<String>> compiled =
        Run.sample("demo").compile(CompileOptions.DEFAULT);
    assertThat(compiled.get("foo")).hasSize(2);
    assertThat(compiled.get("foo").get(0)).isEqualTo("say Hello, world!");
    ImmutableList<String> bar = compiled.get("bar");
    assertThat(bar).hasSize(3);
    assertThat(bar.get(0)).isEqualTo("function demo:foo");
    assertThat(bar.get(1)).startsWith("execute as @a run function demo:pf/bar/");
    assertThat(bar.get(2)).startsWith("execute run function demo:pf/bar/");
    assertThat(compiled.keySet().stream().filter(k -> k.startsWith("pf/bar/")).count())
        .isAtLeast(3L);
    assertThat(
            compiled.values().stream()
                .flatMap(List::stream)
                .noneMatch(line -> line.contains("packforge:cond")))
        .isTrue();
  }

  @Test
  public void sampleCompilesForLegacyFormats() {
    ImmutableMap<String, ImmutableList<String>> compiled =
        Run.sample("demo").compile(CompileOptions.DEFAULT.withPackFormat(15).withDebug(false));
    assertThat(compiled.get("foo")).containsExactly("say Hello, world!");
    ImmutableList<String> bar = compiled.get("bar");
    assertThat(bar).contains("data remove storage packforge:cond if_success");
    assertThat(bar)
        .contains("execute as @a if data storage packforge:cond {if_success:1b} run say bar");
    assertThat(
            compiled.values().stream()
                .flatMap(List::stream)
                .noneMatch(line -> line.contains("return run")))
        .isTrue();
  }
}
