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

package org.packforge;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Range;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.packforge.compiler.CompileContext;
import org.packforge.compiler.CompileOptions;
import org.packforge.compiler.FunctionWorklist;
import org.packforge.compiler.GroupHoister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A Namespace is a named collection of functions, compiled together. */
public final class Namespace {

  private static final Logger log = LoggerFactory.getLogger(Namespace.class);

  private final String name;

  /** Functions in the order they were created. */
  private final Map<String, Function> functions = new LinkedHashMap<>();

  public Namespace(String name) {
    checkArgument(!name.isEmpty(), "Empty namespace");
    this.name = name;
  }

  public String name() {
    return name;
  }

  /**
   * Returns the function with the given name, creating an empty one if there is none. Names
   * beginning with {@code "pf/"} are reserved for hoisted functions and are rejected.
   */
  public Function function(String functionName) {
    checkArgument(
        !GroupHoister.isStagingPath(functionName),
        "Function name %s is reserved for hoisted functions",
        functionName);
    return functions.computeIfAbsent(functionName, n -> new Function(name, n));
  }

  /** Returns the function with the given name, or null if there is none. */
  public @Nullable Function getFunction(String functionName) {
    return functions.get(functionName);
  }

  public ImmutableMap<String, Function> functions() {
    return ImmutableMap.copyOf(functions);
  }

  /**
   * Compiles every function in this namespace, along with any functions hoisted out of them
   * (recursively). Returns a map from function path to the lines of that function, containing the
   * namespace's own functions (in creation order) followed by the hoisted ones (in the order they
   * were hoisted).
   *
   * <p>Each function is compiled with its own CompileContext, so the ids used for hoisting restart
   * at zero in each function; the function path keeps the resulting names distinct.
   */
  public ImmutableMap<String, ImmutableList<String>> compile(CompileOptions options) {
    log.debug("Compiling namespace {} with {}", name, options);
    FunctionWorklist worklist = new FunctionWorklist();
    functions.values().forEach(worklist::push);
    ImmutableMap.Builder<String, ImmutableList<String>> result = ImmutableMap.builder();
    int compiled =
        worklist.drainAll(
            function ->
                result.put(
                    function.name(),
                    function.compile(CompileContext.forFunction(function, options, worklist))));
    log.debug(
        "Compiled namespace {}: {} functions, {} hoisted",
        name,
        compiled,
        compiled - functions.size());
    return result.buildOrThrow();
  }

  /** Returns true if every function in this namespace is valid for all of {@code formats}. */
  public boolean validate(Range<Integer> formats) {
    return functions.values().stream().allMatch(f -> f.validate(formats));
  }

  @Override
  public String toString() {
    return name;
  }
}
