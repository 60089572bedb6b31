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

package org.packforge.compiler;

import static com.google.common.truth.Truth.assertThat;

import java.util.List;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.packforge.Function;
import org.packforge.command.Instruction;

@RunWith(JUnit4.class)
public class GroupHoisterTest {

  private FunctionWorklist worklist;
  private CompileContext context;

  @Before
  public void setup() {
    worklist = new FunctionWorklist();
    context = new CompileContext(CompileOptions.DEFAULT.withDebug(false), "test", "main", worklist);
  }

  @Test
  public void contentHash() {
    assertThat(GroupHoister.contentHash("")).isEqualTo("d41d8cd98f00b204e9800998ecf8427e");
    assertThat(GroupHoister.contentHash("abc")).isEqualTo("900150983cd24fb0d6963f7d28e17f72");
  }

  @Test
  public void hoistedPath() {
    String path = GroupHoister.hoistedPath("main", 0);
    assertThat(path).isEqualTo("pf/main/" + GroupHoister.contentHash("main:0").substring(0, 16));
    assertThat(GroupHoister.hoistedPath("main", 1)).isNotEqualTo(path);
    assertThat(GroupHoister.hoistedPath("other", 0)).isNotEqualTo(path);
  }

  @Test
  public void hoistedPathDropsStagingSegment() {
    assertThat(GroupHoister.hoistedPath("pf/main", 3))
        .isEqualTo(GroupHoister.hoistedPath("main", 3));
    String inner = GroupHoister.hoistedPath("main", 0);
    String base = inner.substring("pf/".length());
    assertThat(GroupHoister.hoistedPath(inner, 0))
        .isEqualTo("pf/" + base + "/" + GroupHoister.contentHash(base + ":0").substring(0, 16));
  }

  @Test
  public void stagingSegmentIsOnlyStrippedAsAPrefix() {
    assertThat(GroupHoister.hoistedPath("util/pf/x", 0)).startsWith("pf/util/pf/x/");
    assertThat(GroupHoister.hoistedPath("pfx", 0)).startsWith("pf/pfx/");
    assertThat(GroupHoister.isStagingPath("pf/main")).isTrue();
    assertThat(GroupHoister.isStagingPath("pfx")).isFalse();
    assertThat(GroupHoister.isStagingPath("util/pf/x")).isFalse();
  }

  @Test
  public void smallGroupsAreInlined() {
    assertThat(GroupHoister.compileGroup(List.of(), context)).isEmpty();
    assertThat(GroupHoister.compileGroup(List.of(Instruction.literal("say a")), context))
        .containsExactly("say a");
    assertThat(
            GroupHoister.compileGroup(
                List.of(
                    Instruction.comment(" note"),
                    Instruction.debug("hidden"),
                    Instruction.literal("say a")),
                context))
        .containsExactly("# note", "say a")
        .inOrder();
    assertThat(worklist.isEmpty()).isTrue();
    assertThat(context.requestUid()).isEqualTo(0);
  }

  @Test
  public void largeGroupsAreHoisted() {
    List<Instruction> instructions =
        List.of(Instruction.literal("say a"), Instruction.literal("say b"));
    assertThat(GroupHoister.compileGroup(instructions, context))
        .containsExactly("function test:" + GroupHoister.hoistedPath("main", 0));
    Function hoisted = worklist.poll();
    assertThat(hoisted.namespace()).isEqualTo("test");
    assertThat(hoisted.name()).isEqualTo(GroupHoister.hoistedPath("main", 0));
    assertThat(hoisted.instructions()).isEqualTo(instructions);
    assertThat(worklist.isEmpty()).isTrue();
  }

  @Test
  public void debugCountsWhenEnabled() {
    CompileContext debugContext =
        new CompileContext(CompileOptions.DEFAULT.withDebug(true), "test", "main", worklist);
    List<Instruction> instructions =
        List.of(Instruction.debug("shown"), Instruction.literal("say a"));
    assertThat(GroupHoister.lineCount(instructions, debugContext.options)).isEqualTo(2);
    assertThat(GroupHoister.lineCount(instructions, context.options)).isEqualTo(1);
    assertThat(GroupHoister.compileGroup(instructions, debugContext)).hasSize(1);
    assertThat(worklist.size()).isEqualTo(1);
  }

  @Test
  public void multiLineLiteralIsHoisted() {
    assertThat(GroupHoister.compileGroup(List.of(Instruction.literal("say a\nsay b")), context))
        .containsExactly("function test:" + GroupHoister.hoistedPath("main", 0));
  }

  @Test
  public void nestedGroupCountsAsOneLine() {
    Instruction inner =
        Instruction.group(Instruction.literal("say a"), Instruction.literal("say b"));
    // The outer group is inlined, leaving the inner group to be hoisted.
    assertThat(GroupHoister.compileGroup(List.of(inner), context))
        .containsExactly("function test:" + GroupHoister.hoistedPath("main", 0));
    assertThat(worklist.size()).isEqualTo(1);
  }
}
