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
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.packforge.Function;

@RunWith(JUnit4.class)
public class FunctionWorklistTest {

  private static final int NUM_THREADS = 8;
  private static final int PUSHES_PER_THREAD = 500;

  @Test
  public void firstInFirstOut() {
    FunctionWorklist worklist = new FunctionWorklist();
    assertThat(worklist.poll()).isNull();
    Function a = new Function("test", "a");
    Function b = new Function("test", "b");
    worklist.push(a);
    worklist.push(b);
    assertThat(worklist.size()).isEqualTo(2);
    assertThat(worklist.poll()).isSameInstanceAs(a);
    assertThat(worklist.poll()).isSameInstanceAs(b);
    assertThat(worklist.isEmpty()).isTrue();
  }

  @Test
  public void drainAllProcessesPushesMadeDuringDrain() {
    FunctionWorklist worklist = new FunctionWorklist();
    worklist.push(new Function("test", "0"));
    List<String> seen = new ArrayList<>();
    int count =
        worklist.drainAll(
            function -> {
              seen.add(function.name());
              int depth = Integer.parseInt(function.name());
              if (depth < 3) {
                worklist.push(new Function("test", String.valueOf(depth + 1)));
              }
            });
    assertThat(count).isEqualTo(4);
    assertThat(seen).containsExactly("0", "1", "2", "3").inOrder();
    assertThat(worklist.isEmpty()).isTrue();
  }

  @Test
  public void concurrentPushes() throws Exception {
    FunctionWorklist worklist = new FunctionWorklist();
    ExecutorService executor = Executors.newFixedThreadPool(NUM_THREADS);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < NUM_THREADS; t++) {
        String prefix = "t" + t + "/";
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < PUSHES_PER_THREAD; i++) {
                    worklist.push(new Function("test", prefix + i));
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }
    assertThat(worklist.size()).isEqualTo(NUM_THREADS * PUSHES_PER_THREAD);
    assertThat(worklist.drainAll(function -> {})).isEqualTo(NUM_THREADS * PUSHES_PER_THREAD);
  }
}
