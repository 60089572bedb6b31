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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.packforge.command.Instruction;
import org.packforge.command.Instruction.Comment;
import org.packforge.command.Instruction.DebugOnly;
import org.packforge.command.Instruction.GuardedExecute;
import org.packforge.command.Instruction.Group;
import org.packforge.command.Instruction.Literal;

/** A statics-only class that compiles Instructions into lines of the target dialect. */
public final class CommandCompiler {

  // Statics only
  private CommandCompiler() {}

  private static final Splitter LINES = Splitter.on('\n');

  /** The text that precedes a comment. */
  static final String COMMENT_PREFIX = "#";

  /**
   * Returns the lines that {@code instruction} compiles to. Any functions that must be hoisted out
   * of it are pushed onto the worklist of {@code context}.
   */
  public static ImmutableList<String> compile(Instruction instruction, CompileContext context) {
    checkNotNull(instruction);
    if (instruction instanceof Literal literal) {
      return ImmutableList.copyOf(LINES.split(literal.text));
    } else if (instruction instanceof DebugOnly debug) {
      return context.options.debug
          ? ImmutableList.of(debugLine(debug.message))
          : ImmutableList.of();
    } else if (instruction instanceof GuardedExecute execute) {
      return ExecuteChainCompiler.compile(execute.node, context);
    } else if (instruction instanceof Group group) {
      return GroupHoister.compileGroup(group.children, context);
    } else if (instruction instanceof Comment comment) {
      return ImmutableList.of(COMMENT_PREFIX + comment.text);
    }
    throw new AssertionError(instruction);
  }

  /**
   * Returns the number of lines {@code instruction} counts as when deciding whether a group must be
   * hoisted.
   *
   * <p>This is usually the number of lines it would compile to, with two exceptions: a Group always
   * counts as one line (if it is larger it will be replaced by a single call), and a Comment counts
   * as zero lines even though it is emitted.
   */
  // TODO: count a Comment as one line; this changes which groups get hoisted, so existing output
  // will change.
  public static int lineCount(Instruction instruction, CompileOptions options) {
    if (instruction instanceof Comment) {
      return 0;
    } else if (instruction instanceof DebugOnly) {
      return options.debug ? 1 : 0;
    } else if (instruction instanceof Literal literal) {
      return LINES.splitToList(literal.text).size();
    } else if (instruction instanceof GuardedExecute execute) {
      return ExecuteChainCompiler.lineCount(execute.node, options);
    } else if (instruction instanceof Group) {
      return 1;
    }
    throw new AssertionError(instruction);
  }

  /** Returns the instruction that prints a debug message. */
  static String debugLine(String message) {
    return "tellraw @a [{\"text\":\"[\",\"color\":\"dark_blue\"},{\"text\":\"DEBUG\","
        + "\"color\":\"dark_green\",\"hoverEvent\":{\"action\":\"show_text\",\"value\":["
        + "{\"text\":\"Debug message generated by Packforge\"},"
        + "{\"text\":\"\\nSet debug message to 'false' to disable\"}]}},"
        + "{\"text\":\"]\",\"color\":\"dark_blue\"},{\"text\":\" "
        + message
        + "\",\"color\":\"black\"}]";
  }
}
