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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.packforge.command.Condition;
import org.packforge.command.ExecuteNode;
import org.packforge.command.ExecuteNode.Direct;
import org.packforge.command.ExecuteNode.DirectSequence;
import org.packforge.command.ExecuteNode.Guard;
import org.packforge.command.Instruction;
import org.packforge.command.Instruction.GuardedExecute;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles the {@link Guard} at the end of an execute chain. There are two implementations, for
 * pack formats before and after {@link org.packforge.util.PackFormat#RETURN_RUN_FORMAT}.
 *
 * <p>The difficulty in both cases is that a guard's test subcommands can only gate a single
 * instruction, while the guarded branch may compile to several lines and the condition may expand
 * to several alternative tests (see {@link ConditionAlgebra#compileGuard}). Running every line
 * under every test would run the branch more than once when several tests pass, and an else
 * branch needs to know whether any of them did.
 */
public abstract class ConditionalLowering {

  private static final Logger log = LoggerFactory.getLogger(ConditionalLowering.class);

  /** Tracks success in storage; used for pack formats without {@code return run}. */
  public static final ConditionalLowering LEGACY = new Legacy();

  /** Uses early returns from a hoisted function. */
  public static final ConditionalLowering MODERN = new Modern();

  // Only the nested subclasses may extend ConditionalLowering.
  private ConditionalLowering() {}

  /** Returns the ConditionalLowering appropriate for the given options. */
  public static ConditionalLowering forOptions(CompileOptions options) {
    return options.supportsReturnRun() ? MODERN : LEGACY;
  }

  /**
   * Returns the lines that {@code guard} compiles to when reached with the given execute prefix.
   * The prefix has already been applied to each returned line that uses it.
   */
  abstract ImmutableList<PrefixedLine> lower(Guard guard, String prefix, CompileContext context);

  /** Returns the instructions that should be grouped when {@code branch} must become one call. */
  static ImmutableList<Instruction> branchInstructions(ExecuteNode branch) {
    if (branch instanceof Direct direct) {
      return ImmutableList.of(direct.instruction);
    } else if (branch instanceof DirectSequence sequence) {
      return sequence.instructions;
    }
    return ImmutableList.of(Instruction.execute(branch));
  }

  /**
   * Compiles {@code branch} as a group, with each resulting line run after {@code runPrefix}.
   * Comments and blank lines left by an inlined group are returned bare.
   */
  static ImmutableList<PrefixedLine> groupedBranch(
      List<Instruction> branch, String runPrefix, CompileContext context) {
    return GroupHoister.compileGroup(branch, context).stream()
        .map(
            line ->
                ExecuteChainCompiler.isPassThrough(line)
                    ? PrefixedLine.bare(line)
                    : new PrefixedLine(true, runPrefix + line))
        .collect(toImmutableList());
  }

  /**
   * Compiles guards by recording whether the guarded branch ran in a storage flag. This is the only
   * way an else branch can be made to depend on the outcome of the then branch in dialects that
   * lack {@code return run}.
   *
   * <p>When the condition has several clauses, each clause first sets the flag, and the then
   * branch is then guarded on the flag alone so that it runs at most once. The flag is removed both
   * before and after the whole construct so that no state survives between invocations.
   *
   * <p>The flag key depends only on the path of the function being compiled and an id drawn from
   * its CompileContext; it is not scoped by nesting depth. A guard nested in the else branch draws
   * the next id from the same counter, while one nested in a hoisted then branch is keyed by the
   * hoisted function's path. Guards that fall back to {@link #FALLBACK_FLAG} all share that key.
   */
  static final class Legacy extends ConditionalLowering {

    /** The storage used for success flags. */
    static final String STORAGE = "packforge:cond";

    /** The flag key used when a flag is needed but no unique id was allocated. */
    static final String FALLBACK_FLAG = "if_success";

    @Override
    ImmutableList<PrefixedLine> lower(Guard guard, String prefix, CompileContext context) {
      ExecuteNode then = guard.then;
      ExecuteNode orElse = guard.orElse;
      int thenCount = ExecuteChainCompiler.lineCount(then, context.options);
      ImmutableList<String> clauses = ConditionAlgebra.compileGuard(guard.condition);
      boolean multiClause = clauses.size() > 1;

      String flagId = null;
      if (orElse != null || thenCount > 1) {
        flagId = GroupHoister.contentHash(context.path() + ":" + context.requestUid());
      }

      List<PrefixedLine> thenLines;
      if (flagId != null) {
        List<Instruction> group = new ArrayList<>(branchInstructions(then));
        // With a single clause the branch itself reports success.
        if (orElse != null && !multiClause) {
          group.add(Instruction.literal(setFlag(flagId)));
        }
        thenLines = groupedBranch(group, ExecuteChainCompiler.RUN, context);
      } else {
        thenLines = ExecuteChainCompiler.compile(then, "", false, context);
      }

      boolean usesFlag = multiClause || orElse != null;
      String flag = usesFlag ? flagKey(flagId, context) : null;
      List<PrefixedLine> result = new ArrayList<>();
      if (usesFlag) {
        result.add(PrefixedLine.bare(removeFlag(flag)));
      }
      List<String> thenTests = clauses;
      if (multiClause) {
        PrefixedLine reportSuccess =
            new PrefixedLine(true, ExecuteChainCompiler.RUN + setFlag(flag));
        result.addAll(PrefixedLine.combine(clauses, ImmutableList.of(reportSuccess)));
        thenTests = ConditionAlgebra.compileGuard(flagIsSet(flag));
      }
      result.addAll(PrefixedLine.combine(thenTests, thenLines));
      if (orElse != null) {
        ImmutableList<String> elseTests = ConditionAlgebra.compileGuard(flagIsSet(flag).not());
        result.addAll(
            PrefixedLine.combine(
                elseTests,
                ExecuteChainCompiler.compile(orElse, "", elseTests.size() > 1, context)));
      }
      if (usesFlag) {
        result.add(PrefixedLine.bare(removeFlag(flag)));
      }
      return PrefixedLine.withPrefix(result, prefix);
    }

    private static String flagKey(@Nullable String flagId, CompileContext context) {
      if (flagId != null) {
        return flagId;
      }
      log.error(
          "No unique id allocated for a disjunctive guard in {}:{}; using flag '{}'",
          context.namespace(),
          context.path(),
          FALLBACK_FLAG);
      return FALLBACK_FLAG;
    }

    static String setFlag(String flag) {
      return "data modify storage " + STORAGE + " " + flag + " set value true";
    }

    static String removeFlag(String flag) {
      return "data remove storage " + STORAGE + " " + flag;
    }

    static Condition flagIsSet(String flag) {
      return Condition.atom("data storage " + STORAGE + " {" + flag + ":1b}");
    }
  }

  /**
   * Compiles guards using {@code return run}. When the guard has an else branch or more than one
   * clause, a function is hoisted containing one line per clause that runs the then branch and
   * returns, followed by the else branch; a chain of else-ifs is flattened into that same function.
   */
  static final class Modern extends ConditionalLowering {

    static final String RETURN_RUN = "run return run ";

    @Override
    ImmutableList<PrefixedLine> lower(Guard guard, String prefix, CompileContext context) {
      ImmutableList<String> clauses = ConditionAlgebra.compileGuard(guard.condition);
      if (guard.orElse != null || clauses.size() > 1) {
        List<Instruction> group = earlyReturnGroup(clauses, guard.then, guard.orElse, context);
        return groupedBranch(group, prefix + ExecuteChainCompiler.RUN, context);
      }
      List<PrefixedLine> thenLines;
      if (ExecuteChainCompiler.lineCount(guard.then, context.options) > 1) {
        thenLines =
            groupedBranch(branchInstructions(guard.then), ExecuteChainCompiler.RUN, context);
      } else {
        thenLines = ExecuteChainCompiler.compile(guard.then, "", false, context);
      }
      return PrefixedLine.withPrefix(PrefixedLine.combine(clauses, thenLines), prefix);
    }

    /**
     * Returns instructions that run {@code then} (returning immediately afterwards) if any of
     * {@code clauses} holds, and otherwise fall through to {@code orElse}.
     */
    private static List<Instruction> earlyReturnGroup(
        List<String> clauses,
        ExecuteNode then,
        @Nullable ExecuteNode orElse,
        CompileContext context) {
      List<PrefixedLine> thenLines = groupedBranch(branchInstructions(then), RETURN_RUN, context);
      List<Instruction> group = new ArrayList<>();
      for (PrefixedLine line : PrefixedLine.combine(clauses, thenLines)) {
        group.add(Instruction.literal(line.applyTo(ExecuteChainCompiler.EXECUTE)));
      }
      if (orElse != null) {
        group.addAll(elseInstructions(orElse, context));
      }
      return group;
    }

    /** Returns the instructions for an else branch, flattening any else-if. */
    private static List<Instruction> elseInstructions(ExecuteNode orElse, CompileContext context) {
      Guard elseIf = null;
      if (orElse instanceof Guard guard) {
        elseIf = guard;
      } else if (orElse instanceof Direct direct
          && direct.instruction instanceof GuardedExecute execute
          && execute.node instanceof Guard guard) {
        elseIf = guard;
      }
      if (elseIf != null) {
        return earlyReturnGroup(
            ConditionAlgebra.compileGuard(elseIf.condition), elseIf.then, elseIf.orElse, context);
      }
      return branchInstructions(orElse);
    }
  }
}
