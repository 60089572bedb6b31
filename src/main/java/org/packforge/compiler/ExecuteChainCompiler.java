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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.packforge.command.ExecuteNode;
import org.packforge.command.ExecuteNode.Direct;
import org.packforge.command.ExecuteNode.DirectSequence;
import org.packforge.command.ExecuteNode.Guard;
import org.packforge.command.ExecuteNode.Modifier;
import org.packforge.command.Instruction;
import org.packforge.command.Instruction.GuardedExecute;

/**
 * A statics-only class that compiles an execute chain.
 *
 * <p>Compilation walks the chain from its root, appending each modifier's subcommand to a prefix
 * (initially {@code "execute "}), until it reaches the terminal. Each line produced by the terminal
 * is prepended with the prefix and {@code "run "}, except for comments and blank lines (which are
 * emitted as-is).
 */
public final class ExecuteChainCompiler {

  // Statics only
  private ExecuteChainCompiler() {}

  /** The prefix of every compiled execute chain, other than a bare {@link Direct}. */
  static final String EXECUTE = "execute ";

  static final String RUN = "run ";

  /**
   * Returns the lines that {@code node} compiles to. If {@code node} is a {@link Direct} the
   * instruction it wraps is compiled on its own, with no {@code execute} prefix.
   */
  public static ImmutableList<String> compile(ExecuteNode node, CompileContext context) {
    if (node instanceof Direct direct) {
      return CommandCompiler.compile(direct.instruction, context);
    }
    return PrefixedLine.texts(compile(node, EXECUTE, false, context));
  }

  /**
   * Returns the lines that {@code node} compiles to when preceded by {@code prefix}. The prefix has
   * already been applied to each returned line that uses it.
   *
   * @param forceGroup if true, a {@link DirectSequence} terminal must be compiled to a single line
   *     (hoisting it if necessary) rather than one line per instruction
   */
  static ImmutableList<PrefixedLine> compile(
      ExecuteNode node, String prefix, boolean forceGroup, CompileContext context) {
    if (node instanceof Modifier modifier) {
      return compile(
          modifier.next,
          prefix + modifier.kind.prefix(modifier.argument),
          forceGroup || modifier.kind.forcesGrouping(),
          context);
    } else if (node instanceof Guard guard) {
      return ConditionalLowering.forOptions(context.options).lower(guard, prefix, context);
    } else if (node instanceof Direct direct) {
      // A nested execute continues this chain rather than starting a new one.
      if (direct.instruction instanceof GuardedExecute execute) {
        return compile(execute.node, prefix, forceGroup, context);
      }
      return runAll(CommandCompiler.compile(direct.instruction, context), prefix);
    } else if (node instanceof DirectSequence sequence) {
      if (!forceGroup) {
        return runAll(
            sequence.instructions.stream()
                .flatMap(i -> CommandCompiler.compile(i, context).stream())
                .collect(toImmutableList()),
            prefix);
      }
      return runAll(
          CommandCompiler.compile(Instruction.group(sequence.instructions), context), prefix);
    }
    throw new AssertionError(node);
  }

  /**
   * Returns the number of lines {@code node} would compile to without a prefix. Uses a scratch
   * CompileContext, so this does not consume ids or hoist anything.
   */
  public static int lineCount(ExecuteNode node, CompileOptions options) {
    return compile(node, "", false, CompileContext.scratch(options)).size();
  }

  /** Returns {@code lines}, each run after {@code prefix} (unless it is a comment or blank). */
  static ImmutableList<PrefixedLine> runAll(List<String> lines, String prefix) {
    return lines.stream().map(line -> run(line, prefix)).collect(toImmutableList());
  }

  /** Returns {@code line} run after {@code prefix}, unless it is a comment or blank. */
  static PrefixedLine run(String line, String prefix) {
    if (isPassThrough(line)) {
      return PrefixedLine.bare(line);
    }
    return new PrefixedLine(true, prefix + RUN + line);
  }

  /** True if {@code line} is a comment or blank, and so cannot follow {@code run}. */
  static boolean isPassThrough(String line) {
    return line.startsWith(CommandCompiler.COMMENT_PREFIX)
        || CharMatcher.whitespace().matchesAllOf(line);
  }
}
