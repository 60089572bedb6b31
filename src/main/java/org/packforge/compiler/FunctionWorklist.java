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

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import java.util.ArrayDeque;
import java.util.Queue;
import java.util.function.Consumer;
import org.jspecify.annotations.Nullable;
import org.packforge.Function;

/**
 * A FIFO queue of functions waiting to be compiled. A single FunctionWorklist is shared by every
 * {@link CompileContext} in a namespace compilation, so that functions hoisted while compiling one
 * function are compiled by the same loop that compiled it.
 *
 * <p>Functions may be pushed from any thread, including while {@link #drainAll} is in progress.
 */
public final class FunctionWorklist {

  @GuardedBy("this")
  private final Queue<Function> pending = new ArrayDeque<>();

  /** Adds a function to the end of the queue. */
  public synchronized void push(Function function) {
    pending.add(checkNotNull(function));
  }

  /** Removes and returns the function at the front of the queue, or null if it is empty. */
  public synchronized @Nullable Function poll() {
    return pending.poll();
  }

  public synchronized int size() {
    return pending.size();
  }

  public synchronized boolean isEmpty() {
    return pending.isEmpty();
  }

  /**
   * Removes functions from the front of the queue and passes each to {@code compileOne} until the
   * queue is empty. {@code compileOne} may push more functions; they will be processed by this same
   * call. Returns the number of functions processed.
   *
   * <p>The lock is not held while {@code compileOne} runs.
   */
  @CanIgnoreReturnValue
  public int drainAll(Consumer<Function> compileOne) {
    int count = 0;
    for (Function next = poll(); next != null; next = poll()) {
      compileOne.accept(next);
      count++;
    }
    return count;
  }
}
