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

import com.google.common.collect.Range;

/** A statics-only class with constants and helpers describing target pack format versions. */
public final class PackFormat {

  // Statics only
  private PackFormat() {}

  /** The most recent pack format known to the compiler. */
  public static final int LATEST = 48;

  /**
   * The first pack format whose dialect supports {@code return run}, which lets a called function
   * end early; guards compiled for earlier formats must track success in storage instead.
   */
  public static final int RETURN_RUN_FORMAT = 20;

  /**
   * The first pack format that stores functions under {@code function/} rather than {@code
   * functions/}.
   */
  public static final int SINGULAR_DIRECTORIES_FORMAT = 45;

  /** Returns the range of all pack formats from {@code first} to {@link #LATEST}. */
  public static Range<Integer> since(int first) {
    return Range.closed(first, LATEST);
  }

  /** Returns the range of all pack formats up to and including {@code last}. */
  public static Range<Integer> until(int last) {
    return Range.closed(0, last);
  }

  /** Returns the range containing every known pack format. */
  public static Range<Integer> any() {
    return Range.closed(0, LATEST);
  }

  /** Returns the name of the directory that holds function files for the given pack format. */
  public static String functionDirectoryName(int packFormat) {
    return (packFormat < SINGULAR_DIRECTORIES_FORMAT) ? "functions" : "function";
  }
}
