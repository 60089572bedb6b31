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

import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.packforge.Function;

/**
 * The state associated with compiling a single function: the options for the whole compilation,
 * the namespace and path of the function being compiled (which determine the names of any
 * functions hoisted out of it), a counter for generating unique ids, and the worklist that receives
 * hoisted functions.
 *
 * <p>Each function gets its own CompileContext, so ids are only unique within one function; {@link
 * GroupHoister} combines them with the function's path to make names that are unique across the
 * namespace.
 */
public final class CompileContext {

  /** Namespace and path used when compiling only to count lines. */
  private static final String SCRATCH = "[INTERNAL]";

  public final CompileOptions options;
  private final String namespace;
  private final String path;
  private final FunctionWorklist worklist;

  /** The next id to be returned by {@link #requestUid}. Never reset. */
  @GuardedBy("this")
  private int nextUid;

  public CompileContext(
      CompileOptions options, String namespace, String path, FunctionWorklist worklist) {
    this.options = checkNotNull(options);
    this.namespace = checkNotNull(namespace);
    this.path = checkNotNull(path);
    this.worklist = checkNotNull(worklist);
  }

  /** Returns a new CompileContext for compiling {@code function}. */
  public static CompileContext forFunction(
      Function function, CompileOptions options, FunctionWorklist worklist) {
    return new CompileContext(options, function.namespace(), function.name(), worklist);
  }

  /**
   * Returns a throwaway CompileContext. Compiling with it consumes none of the ids of any real
   * context, and anything it hoists is discarded.
   */
  static CompileContext scratch(CompileOptions options) {
    return new CompileContext(options, SCRATCH, SCRATCH, new FunctionWorklist());
  }

  public String namespace() {
    return namespace;
  }

  public String path() {
    return path;
  }

  /** Returns an id that has not been returned before by this CompileContext. */
  public synchronized int requestUid() {
    return nextUid++;
  }

  /** Queues a hoisted function for compilation. */
  void enqueue(Function function) {
    worklist.push(function);
  }
}
