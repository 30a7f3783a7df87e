/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.crossword.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;

import java.util.Random;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Fills in a crossword: enforces node consistency and arc consistency on the
 * slots' domains, then searches for a complete assignment.
 *
 * @author Luke Blanshard
 */
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Fills the given structure from the given words, returns a summary of the
   * result.
   */
  public static Result solve(Structure structure, Iterable<String> words) {
    return solve(structure, words, Search.NO_LIMIT);
  }

  /**
   * Fills the given structure from the given words, trying at most the given
   * number of words during the search.  Returns a summary of the result.
   */
  public static Result solve(Structure structure, Iterable<String> words, int maxSteps) {
    return solve(structure, words, maxSteps, null);
  }

  /**
   * Fills the given structure from the given words, trying at most the given
   * number of words during the search, and breaking ties using the given
   * Random if it isn't null.  Returns a summary of the result.
   */
  public static Result solve(
      Structure structure, Iterable<String> words, int maxSteps, @Nullable Random random) {
    return new Solver(structure, Domains.initialize(structure, words), maxSteps, random).solve();
  }

  /** The ways a solver can finish. */
  public enum Outcome {
    SOLVED,      // Every slot has a word.
    UNSOLVABLE,  // No assignment obeys the rules.
    GAVE_UP;     // The step limit ran out first.
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    public final Structure structure;
    public final Outcome outcome;
    @Nullable public final Assignment solution;  // Not null when outcome is SOLVED
    public final int numSteps;

    Result(Structure structure, Outcome outcome, @Nullable Assignment solution, int numSteps) {
      this.structure = structure;
      this.outcome = outcome;
      this.solution = solution;
      this.numSteps = numSteps;
    }

    public boolean isSolved() {
      return outcome == Outcome.SOLVED;
    }

    /** Returns the letters of the solution, or null if there isn't one. */
    @Nullable public LetterGrid letters() {
      return solution == null ? null : LetterGrid.of(structure, solution);
    }

    @Override public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("outcome", outcome)
          .add("numSteps", numSteps)
          .add("solution", solution)
          .toString();
    }
  }

  private final Structure structure;
  private final Domains domains;
  private final int maxSteps;
  @Nullable private final Random random;

  /**
   * Creates a solver working on the given domains, which it narrows in place.
   */
  public Solver(Structure structure, Domains domains, int maxSteps, @Nullable Random random) {
    this.structure = checkNotNull(structure);
    this.domains = checkNotNull(domains);
    this.maxSteps = maxSteps;
    this.random = random;
  }

  /**
   * Narrows the domains by node consistency and then arc consistency.  Returns
   * false if that leaves some slot with no candidates.
   */
  public boolean enforceConsistency() {
    Consistency.enforceNodeConsistency(structure, domains);
    if (domains.anyEmpty()) {
      logger.fine("Some slot has no words of its length");
      return false;
    }
    return Consistency.ac3(structure, domains);
  }

  /** Runs the whole solution process. */
  public Result solve() {
    Result result;
    if (!enforceConsistency()) {
      result = new Result(structure, Outcome.UNSOLVABLE, null, 0);
    } else {
      Search search = new Search(structure, domains, maxSteps, random);
      Assignment solution = search.run();
      Outcome outcome = solution != null ? Outcome.SOLVED
          : search.gaveUp() ? Outcome.GAVE_UP : Outcome.UNSOLVABLE;
      result = new Result(structure, outcome, solution, search.getStepCount());
    }
    logger.fine("Crossword with " + structure.slots.size() + " slots: " + result.outcome
        + " after " + result.numSteps + " steps");
    return result;
  }
}
