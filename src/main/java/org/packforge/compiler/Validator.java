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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.util.List;
import org.packforge.command.ExecuteNode;
import org.packforge.command.ExecuteNode.Direct;
import org.packforge.command.ExecuteNode.DirectSequence;
import org.packforge.command.ExecuteNode.Guard;
import org.packforge.command.ExecuteNode.Modifier;
import org.packforge.command.Instruction;
import org.packforge.command.Instruction.Comment;
import org.packforge.command.Instruction.DebugOnly;
import org.packforge.command.Instruction.GuardedExecute;
import org.packforge.command.Instruction.Group;
import org.packforge.command.Instruction.Literal;
import org.packforge.util.PackFormat;

/**
 * A statics-only class that checks whether instructions can be used with every pack format in a
 * given range. Pack format ranges must be bounded and closed (e.g. {@code Range.closed(6, 9)}).
 */
public final class Validator {

  // Statics only
  private Validator() {}

  /** The lowest pack format that supports execute guards. */
  static final int GUARD_MIN_FORMAT = 4;

  /** Verbs that have been available in every pack format. */
  private static final String[] UNVERSIONED_VERBS = {
    "advancement", "ban", "ban-ip", "banlist", "clear", "clone", "debug", "defaultgamemode", "deop",
    "difficulty", "effect", "enchant", "execute", "experience", "fill", "gamemode", "gamerule",
    "give", "help", "kick", "kill", "list", "locate", "me", "msg", "op", "pardon", "pardon-ip",
    "particle", "playsound", "publish", "recipe", "reload", "save-all", "save-off", "save-on",
    "say", "scoreboard", "seed", "setblock", "setidletimeout", "setworldspawn", "spawnpoint",
    "spreadplayers", "stop", "stopsound", "summon", "teleport", "tell", "tellraw", "time",
    "title", "tp", "trigger", "w", "weather", "whitelist", "worldborder", "xp",
  };

  /**
   * Maps the first word of each known literal instruction to the pack formats that support it.
   * Literals starting with any other word are assumed to be valid everywhere.
   */
  static final ImmutableMap<String, Range<Integer>> LITERAL_FORMATS;

  static {
    ImmutableMap.Builder<String, Range<Integer>> builder = ImmutableMap.builder();
    for (String verb : UNVERSIONED_VERBS) {
      builder.put(verb, PackFormat.any());
    }
    builder.put("attribute", PackFormat.since(6));
    builder.put("bossbar", PackFormat.since(4));
    builder.put("damage", PackFormat.since(12));
    builder.put("data", PackFormat.since(4));
    builder.put("datapack", PackFormat.since(4));
    builder.put("fillbiome", PackFormat.since(12));
    builder.put("forceload", PackFormat.since(4));
    builder.put("function", PackFormat.since(4));
    builder.put("replaceitem", PackFormat.until(6));
    builder.put("item", PackFormat.since(7));
    builder.put("jfr", PackFormat.since(8));
    builder.put("loot", PackFormat.since(4));
    builder.put("perf", PackFormat.since(7));
    builder.put("place", PackFormat.since(10));
    builder.put("placefeature", Range.singleton(9));
    builder.put("random", PackFormat.since(18));
    builder.put("return", PackFormat.since(15));
    builder.put("ride", PackFormat.since(12));
    builder.put("schedule", PackFormat.since(4));
    builder.put("spectate", PackFormat.since(5));
    builder.put("tag", PackFormat.since(4));
    builder.put("team", PackFormat.since(4));
    builder.put("teammsg", PackFormat.since(4));
    builder.put("tick", PackFormat.since(22));
    builder.put("tm", PackFormat.since(4));
    builder.put("transfer", PackFormat.since(41));
    LITERAL_FORMATS = builder.buildOrThrow();
  }

  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().limit(2);

  /** Returns true if {@code instruction} is valid for every pack format in {@code formats}. */
  public static boolean validate(Instruction instruction, Range<Integer> formats) {
    checkFormats(formats);
    if (instruction instanceof Literal literal) {
      return Splitter.on('\n').splitToStream(literal.text).allMatch(l -> validateLine(l, formats));
    } else if (instruction instanceof Comment || instruction instanceof DebugOnly) {
      return true;
    } else if (instruction instanceof GuardedExecute execute) {
      return validate(execute.node, formats);
    } else if (instruction instanceof Group group) {
      return group.children.stream().allMatch(child -> validate(child, formats));
    }
    throw new AssertionError(instruction);
  }

  /** Returns true if {@code node} is valid for every pack format in {@code formats}. */
  public static boolean validate(ExecuteNode node, Range<Integer> formats) {
    checkFormats(formats);
    int lowest = formats.lowerEndpoint();
    if (node instanceof Modifier modifier) {
      return lowest >= modifier.kind.minFormat && validate(modifier.next, formats);
    } else if (node instanceof Guard guard) {
      return lowest >= GUARD_MIN_FORMAT
          && validate(guard.then, formats)
          && (guard.orElse == null || validate(guard.orElse, formats));
    } else if (node instanceof Direct direct) {
      return validate(direct.instruction, formats);
    } else if (node instanceof DirectSequence sequence) {
      return sequence.instructions.stream().allMatch(i -> validate(i, formats));
    }
    throw new AssertionError(node);
  }

  /** Checks the first word of a single line of a literal instruction against the table. */
  private static boolean validateLine(String line, Range<Integer> formats) {
    List<String> words = WORDS.splitToList(line);
    if (words.isEmpty()) {
      return true;
    }
    Range<Integer> supported = LITERAL_FORMATS.get(words.get(0));
    return supported == null || supported.encloses(formats);
  }

  private static void checkFormats(Range<Integer> formats) {
    checkArgument(
        formats.hasLowerBound() && formats.hasUpperBound(), "Unbounded format range: %s", formats);
  }
}
