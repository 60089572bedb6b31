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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.List;
import org.packforge.command.Instruction;
import org.packforge.compiler.CommandCompiler;
import org.packforge.compiler.CompileContext;
import org.packforge.compiler.Validator;

/**
 * A Function is a named sequence of instructions in a namespace; it compiles to a single function
 * file in the target pack. Functions are created either by the user (through {@link
 * Namespace#function}) or by the compiler, when a group of instructions is hoisted out of another
 * function.
 */
public final class Function {
  private final String namespace;

  /** The function's path within its namespace, e.g. {@code "foo"} or {@code "pf/foo/0123abcd"}. */
  private final String name;

  private final List<Instruction> instructions;

  public Function(String namespace, String name) {
    this(namespace, name, ImmutableList.of());
  }

  public Function(String namespace, String name, List<Instruction> instructions) {
    checkArgument(!namespace.isEmpty(), "Empty namespace");
    checkArgument(!name.isEmpty(), "Empty function name");
    this.namespace = namespace;
    this.name = name;
    this.instructions = new ArrayList<>(instructions);
  }

  public String namespace() {
    return namespace;
  }

  public String name() {
    return name;
  }

  /** Returns {@code "<namespace>:<name>"}, the form used to call this function. */
  public String qualifiedName() {
    return namespace + ":" + name;
  }

  /** Appends an instruction to this function. */
  @CanIgnoreReturnValue
  public Function add(Instruction instruction) {
    instructions.add(checkNotNull(instruction));
    return this;
  }

  /** Appends a literal instruction to this function. */
  @CanIgnoreReturnValue
  public Function add(String literal) {
    return add(Instruction.literal(literal));
  }

  public ImmutableList<Instruction> instructions() {
    return ImmutableList.copyOf(instructions);
  }

  /** Returns an instruction that calls this function. */
  public Instruction call() {
    return Instruction.call(this);
  }

  /**
   * Returns the lines of this function's body. Any functions hoisted out of it are added to the
   * context's worklist.
   */
  public ImmutableList<String> compile(CompileContext context) {
    return instructions.stream()
        .flatMap(i -> CommandCompiler.compile(i, context).stream())
        .collect(toImmutableList());
  }

  /** Returns true if each of this function's instructions is valid for all of {@code formats}. */
  public boolean validate(Range<Integer> formats) {
    return instructions.stream().allMatch(i -> Validator.validate(i, formats));
  }

  @Override
  public String toString() {
    return qualifiedName();
  }
}
