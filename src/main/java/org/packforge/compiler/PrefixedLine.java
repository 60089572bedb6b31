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
import java.util.List;

/**
 * A line produced while compiling an execute chain, before the chain's accumulated prefix has been
 * applied. If {@code usePrefix} is false (comments and blank lines) the prefix and any guard tests
 * are not prepended.
 */
record PrefixedLine(boolean usePrefix, String text) {

  /** Returns a line that is emitted as-is. */
  static PrefixedLine bare(String text) {
    return new PrefixedLine(false, text);
  }

  /** Returns {@code text} preceded by {@code prefix} if this line uses the prefix. */
  String applyTo(String prefix) {
    return usePrefix ? prefix + text : text;
  }

  /** Returns a copy of this line with {@code prefix} applied. */
  PrefixedLine withPrefix(String prefix) {
    return usePrefix ? new PrefixedLine(true, prefix + text) : this;
  }

  /** Applies {@code prefix} to each of {@code lines}. */
  static ImmutableList<PrefixedLine> withPrefix(List<PrefixedLine> lines, String prefix) {
    return lines.stream().map(line -> line.withPrefix(prefix)).collect(toImmutableList());
  }

  /** Returns the text of each line, ignoring {@code usePrefix}. */
  static ImmutableList<String> texts(List<PrefixedLine> lines) {
    return lines.stream().map(PrefixedLine::text).collect(toImmutableList());
  }

  /**
   * Returns the result of running each of {@code commands} under each of {@code tests}: for each
   * test (in order) a copy of {@code commands} in which each line that uses the prefix has the test
   * and a space prepended.
   */
  static ImmutableList<PrefixedLine> combine(List<String> tests, List<PrefixedLine> commands) {
    ImmutableList.Builder<PrefixedLine> result =
        ImmutableList.builderWithExpectedSize(tests.size() * commands.size());
    for (String test : tests) {
      for (PrefixedLine command : commands) {
        result.add(command.withPrefix(test + " "));
      }
    }
    return result.build();
  }
}
