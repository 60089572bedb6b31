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

package org.packforge.tools;

import static org.packforge.command.Condition.atom;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import java.util.Map;
import org.packforge.Function;
import org.packforge.Namespace;
import org.packforge.command.ExecuteNode;
import org.packforge.command.Instruction;
import org.packforge.compiler.CompileOptions;
import org.packforge.util.PackFormat;

/**
 * A simple command-line tool that compiles a small sample namespace and prints the resulting
 * functions. The target pack format and debug flag are taken from the {@code packforge.packFormat}
 * and {@code packforge.debug} system properties.
 */
public class Run {
  private Run() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: run [<namespace>]");
      System.exit(1);
    }
  }

  /** Returns a namespace that exercises guards, else branches, and hoisting. */
  static Namespace sample(String name) {
    Namespace namespace = new Namespace(name);
    Function foo = namespace.function("foo");
    foo.add("say Hello, world!");
    foo.add(Instruction.debug("debug message"));

    Function bar = namespace.function("bar");
    bar.add(foo.call());
    bar.add(
        Instruction.execute(
            ExecuteNode.as(
                "@a",
                ExecuteNode.guard(
                    atom("block ~ ~ ~ minecraft:stone")
                        .or(
                            atom("block ~ ~1 ~ minecraft:stone")
                                .not()
                                .or(atom("block ~ ~-1 ~ minecraft:stone"))
                                .not()),
                    ExecuteNode.run("say bar")))));
    bar.add(
        Instruction.execute(
            ExecuteNode.guard(
                atom("entity @s[tag=red]"),
                ExecuteNode.runAll(
                    Instruction.literal("say red"), Instruction.literal("tag @s remove red")),
                ExecuteNode.guard(
                    atom("entity @s[tag=blue]"),
                    ExecuteNode.run("say blue"),
                    ExecuteNode.run("say neither")))));
    return namespace;
  }

  public static void main(String[] args) {
    checkUsage(args.length <= 1);
    String name = (args.length == 0) ? "sample" : args[0];
    CompileOptions options = CompileOptions.fromSystemProperties();
    Namespace namespace = sample(name);
    if (!namespace.validate(Range.singleton(options.packFormat))) {
      System.err.printf("Warning: %s uses instructions not supported by %s\n", name, options);
    }
    String dir = PackFormat.functionDirectoryName(options.packFormat);
    for (Map.Entry<String, ImmutableList<String>> entry : namespace.compile(options).entrySet()) {
      System.out.printf("/* %s/%s/%s.mcfunction\n", name, dir, entry.getKey());
      entry.getValue().forEach(line -> System.out.println("  " + line));
      System.out.println("*/");
    }
  }
}
