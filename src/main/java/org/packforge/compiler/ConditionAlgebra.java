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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import org.packforge.command.Condition;
import org.packforge.command.Condition.And;
import org.packforge.command.Condition.Atom;
import org.packforge.command.Condition.Not;
import org.packforge.command.Condition.Or;

/**
 * A statics-only class that rewrites Conditions into a form the target dialect can test.
 *
 * <p>A single {@code execute} instruction can only test a conjunction of atoms, each of which may
 * be negated ({@code if a unless b if c ...}). An arbitrary Condition is therefore first normalized
 * (negations pushed down to the atoms) and then expanded into a list of such conjunctions, any one
 * of which being true makes the whole Condition true.
 */
public final class ConditionAlgebra {

  // Statics only
  private ConditionAlgebra() {}

  /**
   * Returns an equivalent Condition in which every {@link Not} wraps an {@link Atom}, by applying
   * De Morgan's laws and eliminating double negations. Idempotent.
   */
  public static Condition normalize(Condition condition) {
    if (condition instanceof Atom) {
      return condition;
    } else if (condition instanceof Not not) {
      Condition operand = not.operand;
      if (operand instanceof Atom) {
        return condition;
      } else if (operand instanceof Not inner) {
        return normalize(inner.operand);
      } else if (operand instanceof And conj) {
        return Condition.or(normalize(conj.left.not()), normalize(conj.right.not()));
      } else if (operand instanceof Or disj) {
        return Condition.and(normalize(disj.left.not()), normalize(disj.right.not()));
      }
    } else if (condition instanceof And conj) {
      return Condition.and(normalize(conj.left), normalize(conj.right));
    } else if (condition instanceof Or disj) {
      return Condition.or(normalize(disj.left), normalize(disj.right));
    }
    throw new AssertionError(condition);
  }

  /**
   * Returns a list of Conditions whose disjunction is equivalent to {@code condition}. None of the
   * returned clauses contains an {@link Or}, and each is normalized.
   *
   * <p>The clauses of {@code or(a, b)} are those of {@code a} followed by those of {@code b}; the
   * clauses of {@code and(a, b)} are the conjunctions of each clause of {@code a} with each clause
   * of {@code b}, in {@code a}-major order.
   */
  public static ImmutableList<Condition> toDisjunctiveClauses(Condition condition) {
    Condition normalized = normalize(condition);
    if (normalized instanceof Or disj) {
      return ImmutableList.<Condition>builder()
          .addAll(toDisjunctiveClauses(disj.left))
          .addAll(toDisjunctiveClauses(disj.right))
          .build();
    } else if (normalized instanceof And conj) {
      ImmutableList<Condition> left = toDisjunctiveClauses(conj.left);
      ImmutableList<Condition> right = toDisjunctiveClauses(conj.right);
      ImmutableList.Builder<Condition> result =
          ImmutableList.builderWithExpectedSize(left.size() * right.size());
      for (Condition l : left) {
        for (Condition r : right) {
          result.add(Condition.and(l, r));
        }
      }
      return result.build();
    } else {
      // An Atom, or a Not of an Atom.
      return ImmutableList.of(normalized);
    }
  }

  /**
   * Returns the test subcommands for {@code condition}, one for each of its disjunctive clauses
   * (e.g. {@code "if a unless b"}). The instruction is run once for each returned test, so a caller
   * that must not run its instruction more than once has to handle a result with more than one
   * element.
   */
  public static ImmutableList<String> compileGuard(Condition condition) {
    return toDisjunctiveClauses(condition).stream()
        .map(ConditionAlgebra::clauseText)
        .collect(toImmutableList());
  }

  /** Returns the test subcommands for a single clause, which must not contain an {@link Or}. */
  static String clauseText(Condition clause) {
    if (clause instanceof Atom atom) {
      return "if " + atom.text;
    } else if (clause instanceof Not not && not.operand instanceof Atom atom) {
      return "unless " + atom.text;
    } else if (clause instanceof And conj) {
      return clauseText(conj.left) + " " + clauseText(conj.right);
    }
    throw new AssertionError("Not a conjunctive clause: " + clause);
  }
}
