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

package org.packforge.command;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.packforge.Function;

/**
 * An Instruction is a node of the tree that makes up a function body. Each Instruction compiles to
 * zero or more lines of the target dialect; see {@link org.packforge.compiler.CommandCompiler}.
 *
 * <p>Instruction trees are authored by the caller and are never modified by the compiler.
 */
public abstract class Instruction {

  // Only the nested subclasses may extend Instruction.
  private Instruction() {}

  /** Returns an instruction that is emitted verbatim (one line per embedded newline). */
  public static Instruction literal(String text) {
    return new Literal(text);
  }

  /** Returns an instruction that prints {@code message} only when compiling in debug mode. */
  public static Instruction debug(String message) {
    return new DebugOnly(message);
  }

  public static Instruction execute(ExecuteNode node) {
    return new GuardedExecute(node);
  }

  public static Instruction group(List<Instruction> children) {
    return new Group(children);
  }

  public static Instruction group(Instruction... children) {
    return new Group(ImmutableList.copyOf(children));
  }

  /** Returns a comment; {@code text} should not include the leading {@code #}. */
  public static Instruction comment(String text) {
    return new Comment(text);
  }

  /** Returns a literal instruction that calls the given function. */
  public static Instruction call(Function function) {
    return new Literal("function " + function.qualifiedName());
  }

  public static final class Literal extends Instruction {
    public final String text;

    Literal(String text) {
      this.text = checkNotNull(text);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Literal other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
      return text.hashCode();
    }

    @Override
    public String toString() {
      return text;
    }
  }

  public static final class DebugOnly extends Instruction {
    public final String message;

    DebugOnly(String message) {
      this.message = checkNotNull(message);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof DebugOnly other && message.equals(other.message);
    }

    @Override
    public int hashCode() {
      return ~message.hashCode();
    }

    @Override
    public String toString() {
      return "debug(" + message + ")";
    }
  }

  public static final class GuardedExecute extends Instruction {
    public final ExecuteNode node;

    GuardedExecute(ExecuteNode node) {
      this.node = checkNotNull(node);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof GuardedExecute other && node.equals(other.node);
    }

    @Override
    public int hashCode() {
      return node.hashCode();
    }

    @Override
    public String toString() {
      return "execute " + node;
    }
  }

  /**
   * A sequence of instructions that should run one after another. If they compile to more than one
   * line they are moved into a separate function.
   */
  public static final class Group extends Instruction {
    public final ImmutableList<Instruction> children;

    Group(List<Instruction> children) {
      this.children = ImmutableList.copyOf(children);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Group other && children.equals(other.children);
    }

    @Override
    public int hashCode() {
      return children.hashCode();
    }

    @Override
    public String toString() {
      return "group" + children;
    }
  }

  public static final class Comment extends Instruction {
    public final String text;

    Comment(String text) {
      this.text = checkNotNull(text);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Comment other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
      return text.hashCode() * 31;
    }

    @Override
    public String toString() {
      return "#" + text;
    }
  }
}
