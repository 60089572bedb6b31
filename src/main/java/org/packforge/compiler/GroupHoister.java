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
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import java.util.List;
import org.packforge.Function;
import org.packforge.command.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A statics-only class that decides when a sequence of instructions must be moved ("hoisted") into
 * a separate function, and creates that function.
 *
 * <p>Hoisted functions are named {@code pf/<enclosing path>/<hash>}, where the hash is computed
 * from the enclosing function's path and an id from its CompileContext. The enclosing path has any
 * leading {@code pf/} removed, so functions hoisted out of hoisted functions don't accumulate
 * staging segments.
 */
public final class GroupHoister {

  private static final Logger log = LoggerFactory.getLogger(GroupHoister.class);

  /** The first segment of the path of every hoisted function. */
  public static final String STAGING_SEGMENT = "pf";

  /** Number of hex digits of the content hash used in hoisted function paths. */
  static final int HASH_LENGTH = 16;

  // Statics only
  private GroupHoister() {}

  /** Returns true if {@code path} is in the directory reserved for hoisted functions. */
  public static boolean isStagingPath(String path) {
    return path.startsWith(STAGING_SEGMENT + "/");
  }

  /** Returns the sum of the line counts of {@code instructions}. */
  static int lineCount(List<Instruction> instructions, CompileOptions options) {
    return instructions.stream().mapToInt(i -> CommandCompiler.lineCount(i, options)).sum();
  }

  /**
   * Compiles {@code instructions} so that they run one after another. If they count as at most one
   * line, returns their compiled lines; otherwise hoists them into a new function and returns a
   * single line that calls it.
   */
  static ImmutableList<String> compileGroup(
      List<Instruction> instructions, CompileContext context) {
    if (lineCount(instructions, context.options) <= 1) {
      return instructions.stream()
          .flatMap(i -> CommandCompiler.compile(i, context).stream())
          .collect(toImmutableList());
    }
    return ImmutableList.of(hoist(instructions, context));
  }

  /** Moves {@code instructions} into a new function and returns the line that calls it. */
  static String hoist(List<Instruction> instructions, CompileContext context) {
    String path = hoistedPath(context.path(), context.requestUid());
    Function function = new Function(context.namespace(), path, instructions);
    context.enqueue(function);
    log.debug(
        "Hoisted {} instructions from {}:{} into {}",
        instructions.size(),
        context.namespace(),
        context.path(),
        path);
    return "function " + function.qualifiedName();
  }

  /** Returns the path of the function hoisted with id {@code uid} out of {@code enclosingPath}. */
  static String hoistedPath(String enclosingPath, int uid) {
    String stagingPrefix = STAGING_SEGMENT + "/";
    String base =
        isStagingPath(enclosingPath)
            ? enclosingPath.substring(stagingPrefix.length())
            : enclosingPath;
    String hash = contentHash(base + ":" + uid);
    return stagingPrefix + base + "/" + hash.substring(0, HASH_LENGTH);
  }

  /** Returns the lowercase hex MD5 digest of {@code text}. */
  @SuppressWarnings("deprecation") // MD5 is only used for naming, not security
  static String contentHash(String text) {
    return Hashing.md5().hashString(text, UTF_8).toString();
  }
}
