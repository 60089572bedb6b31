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
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * An ExecuteNode is one link in the chain of an {@code execute} instruction. A chain is a sequence
 * of {@link Modifier}s (each of which changes the execution context and owns exactly one successor)
 * that ends in a terminal: a {@link Guard}, a {@link Direct} instruction, or a {@link
 * DirectSequence} of instructions.
 *
 * <p>ExecuteNodes are immutable, and a chain can never be cyclic.
 */
public abstract class ExecuteNode {

  // Only the nested subclasses may extend ExecuteNode.
  private ExecuteNode() {}

  /** The modifiers that may appear in an execute chain. */
  public enum ModifierKind {
    ALIGN("align", 4),
    ANCHORED("anchored", 4),
    AS("as", 4),
    AT("at", 4),
    AS_AT("as_at", 4),
    FACING("facing", 4),
    IN("in", 4),
    ON("on", 12),
    POSITIONED("positioned", 4),
    ROTATED("rotated", 4),
    STORE("store", 4),
    SUMMON("summon", 12);

    /** The name of this modifier; also the subcommand it emits (except for {@link #AS_AT}). */
    public final String verb;

    /** The lowest pack format that supports this modifier. */
    public final int minFormat;

    ModifierKind(String verb, int minFormat) {
      this.verb = verb;
      this.minFormat = minFormat;
    }

    /** Returns the text this modifier contributes to the execute prefix, with a trailing space. */
    public String prefix(String argument) {
      if (this == AS_AT) {
        return "as " + argument + " at @s ";
      }
      return verb + " " + argument + " ";
    }

    /**
     * Returns true if everything following this modifier must be grouped into a single call.
     * {@code summon} moves the execution origin to the new entity, so splitting the rest of the
     * chain across several instructions would summon once per instruction.
     */
    public boolean forcesGrouping() {
      return this == SUMMON;
    }
  }

  /** Returns a Modifier of the given kind; the named factories below are usually clearer. */
  public static ExecuteNode modifier(ModifierKind kind, String argument, ExecuteNode next) {
    return new Modifier(kind, argument, next);
  }

  public static ExecuteNode align(String axes, ExecuteNode next) {
    return new Modifier(ModifierKind.ALIGN, axes, next);
  }

  public static ExecuteNode anchored(String anchor, ExecuteNode next) {
    return new Modifier(ModifierKind.ANCHORED, anchor, next);
  }

  public static ExecuteNode as(String selector, ExecuteNode next) {
    return new Modifier(ModifierKind.AS, selector, next);
  }

  public static ExecuteNode at(String selector, ExecuteNode next) {
    return new Modifier(ModifierKind.AT, selector, next);
  }

  /** Executes as each entity matching {@code selector}, at that entity's position. */
  public static ExecuteNode asAt(String selector, ExecuteNode next) {
    return new Modifier(ModifierKind.AS_AT, selector, next);
  }

  public static ExecuteNode facing(String target, ExecuteNode next) {
    return new Modifier(ModifierKind.FACING, target, next);
  }

  public static ExecuteNode in(String dimension, ExecuteNode next) {
    return new Modifier(ModifierKind.IN, dimension, next);
  }

  public static ExecuteNode on(String relation, ExecuteNode next) {
    return new Modifier(ModifierKind.ON, relation, next);
  }

  public static ExecuteNode positioned(String position, ExecuteNode next) {
    return new Modifier(ModifierKind.POSITIONED, position, next);
  }

  public static ExecuteNode rotated(String rotation, ExecuteNode next) {
    return new Modifier(ModifierKind.ROTATED, rotation, next);
  }

  public static ExecuteNode store(String target, ExecuteNode next) {
    return new Modifier(ModifierKind.STORE, target, next);
  }

  public static ExecuteNode summon(String entity, ExecuteNode next) {
    return new Modifier(ModifierKind.SUMMON, entity, next);
  }

  /** Returns a Guard that runs {@code then} if {@code condition} holds. */
  public static ExecuteNode guard(Condition condition, ExecuteNode then) {
    return new Guard(condition, then, null);
  }

  /** Returns a Guard that runs {@code then} if {@code condition} holds, {@code orElse} if not. */
  public static ExecuteNode guard(Condition condition, ExecuteNode then, ExecuteNode orElse) {
    return new Guard(condition, then, checkNotNull(orElse));
  }

  public static ExecuteNode run(Instruction instruction) {
    return new Direct(instruction);
  }

  /** Shorthand for {@code run(Instruction.literal(text))}. */
  public static ExecuteNode run(String text) {
    return new Direct(Instruction.literal(text));
  }

  public static ExecuteNode runAll(List<Instruction> instructions) {
    return new DirectSequence(instructions);
  }

  public static ExecuteNode runAll(Instruction... instructions) {
    return new DirectSequence(ImmutableList.copyOf(instructions));
  }

  /** A positional or contextual modifier, followed by the rest of the chain. */
  public static final class Modifier extends ExecuteNode {
    public final ModifierKind kind;
    public final String argument;
    public final ExecuteNode next;

    Modifier(ModifierKind kind, String argument, ExecuteNode next) {
      this.kind = checkNotNull(kind);
      this.argument = checkNotNull(argument);
      this.next = checkNotNull(next);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Modifier other
          && kind == other.kind
          && argument.equals(other.argument)
          && next.equals(other.next);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, argument, next);
    }

    @Override
    public String toString() {
      return kind.verb + "(" + argument + ") " + next;
    }
  }

  /** An if/else terminal. */
  public static final class Guard extends ExecuteNode {
    public final Condition condition;
    public final ExecuteNode then;
    public final @Nullable ExecuteNode orElse;

    Guard(Condition condition, ExecuteNode then, @Nullable ExecuteNode orElse) {
      this.condition = checkNotNull(condition);
      this.then = checkNotNull(then);
      this.orElse = orElse;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Guard other
          && condition.equals(other.condition)
          && then.equals(other.then)
          && Objects.equals(orElse, other.orElse);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, then, orElse);
    }

    @Override
    public String toString() {
      String s = "if(" + condition + ") {" + then + "}";
      return (orElse == null) ? s : s + " else {" + orElse + "}";
    }
  }

  /** Runs a single instruction. */
  public static final class Direct extends ExecuteNode {
    public final Instruction instruction;

    Direct(Instruction instruction) {
      this.instruction = checkNotNull(instruction);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Direct other && instruction.equals(other.instruction);
    }

    @Override
    public int hashCode() {
      return instruction.hashCode();
    }

    @Override
    public String toString() {
      return "run " + instruction;
    }
  }

  /** Runs each of a list of instructions. */
  public static final class DirectSequence extends ExecuteNode {
    public final ImmutableList<Instruction> instructions;

    DirectSequence(List<Instruction> instructions) {
      this.instructions = ImmutableList.copyOf(instructions);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof DirectSequence other && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
      return instructions.hashCode();
    }

    @Override
    public String toString() {
      return "runAll " + instructions;
    }
  }
}
