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

import java.util.Objects;

/**
 * A Condition is a boolean guard expression over atomic test strings. Atoms are opaque to the
 * compiler; they are the bodies of the target dialect's {@code if}/{@code unless} subcommands
 * (e.g. {@code "block ~ ~-1 ~ minecraft:stone"} or {@code "entity @s[tag=foo]"}).
 *
 * <p>Conditions are immutable trees. The target dialect can only test a conjunction of (possibly
 * negated) atoms in a single instruction, so before being emitted a Condition is normalized and
 * expanded into a disjunction of such conjunctions by {@link
 * org.packforge.compiler.ConditionAlgebra}.
 */
public abstract class Condition {

  // Only the nested subclasses may extend Condition.
  private Condition() {}

  /** Returns a Condition that tests the given atom. */
  public static Condition atom(String text) {
    return new Atom(text);
  }

  /** Returns a Condition that is true if {@code operand} is false. */
  public static Condition not(Condition operand) {
    return new Not(operand);
  }

  /** Returns a Condition that is true if both {@code left} and {@code right} are true. */
  public static Condition and(Condition left, Condition right) {
    return new And(left, right);
  }

  /** Returns a Condition that is true if either {@code left} or {@code right} is true. */
  public static Condition or(Condition left, Condition right) {
    return new Or(left, right);
  }

  /** Equivalent to {@code Condition.and(this, other)}. */
  public Condition and(Condition other) {
    return and(this, other);
  }

  /** Equivalent to {@code Condition.or(this, other)}. */
  public Condition or(Condition other) {
    return or(this, other);
  }

  /** Equivalent to {@code Condition.not(this)}. */
  public Condition not() {
    return not(this);
  }

  /** A single test, emitted verbatim after {@code if } or {@code unless }. */
  public static final class Atom extends Condition {
    public final String text;

    Atom(String text) {
      this.text = checkNotNull(text);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Atom other && text.equals(other.text);
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

  /** The negation of another Condition. */
  public static final class Not extends Condition {
    public final Condition operand;

    Not(Condition operand) {
      this.operand = checkNotNull(operand);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Not other && operand.equals(other.operand);
    }

    @Override
    public int hashCode() {
      return ~operand.hashCode();
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  /** The conjunction of two Conditions. */
  public static final class And extends Condition {
    public final Condition left;
    public final Condition right;

    And(Condition left, Condition right) {
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof And other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash("and", left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " & " + right + ")";
    }
  }

  /** The disjunction of two Conditions. */
  public static final class Or extends Condition {
    public final Condition left;
    public final Condition right;

    Or(Condition left, Condition right) {
      this.left = checkNotNull(left);
      this.right = checkNotNull(right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Or other && left.equals(other.left) && right.equals(other.right);
    }

    @Override
    public int hashCode() {
      return Objects.hash("or", left, right);
    }

    @Override
    public String toString() {
      return "(" + left + " | " + right + ")";
    }
  }
}
