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

import org.packforge.util.PackFormat;

/** Options that apply to an entire compilation. CompileOptions are immutable. */
public final class CompileOptions {

  /** Compiles for {@link PackFormat#LATEST} with debug output enabled. */
  public static final CompileOptions DEFAULT = new CompileOptions(PackFormat.LATEST, true);

  /** The pack format of the target runtime; selects the dialect used for conditionals. */
  public final int packFormat;

  /** If true, {@link org.packforge.command.Instruction.DebugOnly} instructions emit output. */
  public final boolean debug;

  private CompileOptions(int packFormat, boolean debug) {
    checkArgument(packFormat >= 0 && packFormat <= 255, "Bad pack format: %s", packFormat);
    this.packFormat = packFormat;
    this.debug = debug;
  }

  /**
   * Returns CompileOptions determined by the {@code packforge.packFormat} and {@code
   * packforge.debug} system properties, using the defaults for either that is not set.
   */
  public static CompileOptions fromSystemProperties() {
    String packFormatProp = System.getProperty("packforge.packFormat");
    int packFormat =
        (packFormatProp == null) ? DEFAULT.packFormat : Integer.parseInt(packFormatProp.trim());
    boolean debug =
        Boolean.parseBoolean(System.getProperty("packforge.debug", String.valueOf(DEFAULT.debug)));
    return new CompileOptions(packFormat, debug);
  }

  public CompileOptions withPackFormat(int packFormat) {
    return (packFormat == this.packFormat) ? this : new CompileOptions(packFormat, debug);
  }

  public CompileOptions withDebug(boolean debug) {
    return (debug == this.debug) ? this : new CompileOptions(packFormat, debug);
  }

  /** True if the target dialect supports {@code return run}. */
  public boolean supportsReturnRun() {
    return packFormat >= PackFormat.RETURN_RUN_FORMAT;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof CompileOptions other
        && packFormat == other.packFormat
        && debug == other.debug;
  }

  @Override
  public int hashCode() {
    return packFormat * 2 + (debug ? 1 : 0);
  }

  @Override
  public String toString() {
    return String.format("CompileOptions(packFormat=%s, debug=%s)", packFormat, debug);
  }
}
