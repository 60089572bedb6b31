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

import static com.google.common.truth.Truth.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.packforge.Function;

@RunWith(JUnit4.class)
public class CompileContextTest {

  @Test
  public void forFunction() {
    Function function = new Function("lib", "util/helper");
    FunctionWorklist worklist = new FunctionWorklist();
    CompileContext context = CompileContext.forFunction(function, CompileOptions.DEFAULT, worklist);
    assertThat(context.namespace()).isEqualTo("lib");
    assertThat(context.path()).isEqualTo("util/helper");
    assertThat(context.options).isSameInstanceAs(CompileOptions.DEFAULT);
    context.enqueue(function);
    assertThat(worklist.poll()).isSameInstanceAs(function);
  }

  @Test
  public void uidsAreSequentialPerContext() {
    CompileContext first =
        new CompileContext(CompileOptions.DEFAULT, "test", "a", new FunctionWorklist());
    CompileContext second =
        new CompileContext(CompileOptions.DEFAULT, "test", "b", new FunctionWorklist());
    assertThat(first.requestUid()).isEqualTo(0);
    assertThat(first.requestUid()).isEqualTo(1);
    assertThat(second.requestUid()).isEqualTo(0);
    assertThat(first.requestUid()).isEqualTo(2);
  }

  @Test
  public void scratchContextIsIndependent() {
    CompileContext scratch = CompileContext.scratch(CompileOptions.DEFAULT);
    assertThat(scratch.requestUid()).isEqualTo(0);
    assertThat(CompileContext.scratch(CompileOptions.DEFAULT).requestUid()).isEqualTo(0);
  }

  @Test
  public void concurrentUidRequestsAreDistinct() throws Exception {
    CompileContext context =
        new CompileContext(CompileOptions.DEFAULT, "test", "main", new FunctionWorklist());
    int numThreads = 4;
    int perThread = 1000;
    ExecutorService executor = Executors.newFixedThreadPool(numThreads);
    List<Future<List<Integer>>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < numThreads; t++) {
        futures.add(
            executor.submit(
                () -> {
                  List<Integer> uids = new ArrayList<>();
                  for (int i = 0; i < perThread; i++) {
                    uids.add(context.requestUid());
                  }
                  return uids;
                }));
      }
      Set<Integer> all = new HashSet<>();
      for (Future<List<Integer>> future : futures) {
        all.addAll(future.get());
      }
      assertThat(all).hasSize(numThreads * perThread);
      assertThat(context.requestUid()).isEqualTo(numThreads * perThread);
    } finally {
      executor.shutdown();
    }
  }
}
