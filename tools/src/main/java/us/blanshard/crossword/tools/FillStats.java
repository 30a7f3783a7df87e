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
package us.blanshard.crossword.tools;

import static java.util.concurrent.TimeUnit.MICROSECONDS;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.EnumMap;
import java.util.Random;

import us.blanshard.crossword.core.Search;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Structure;

/**
 * Fills the same crossword many times with differently seeded tie-breaking,
 * and spits out statistics about the searches.
 *
 * @author Luke Blanshard
 */
public class FillStats {

  public static void main(String[] args) throws IOException {
    if (args.length < 3 || args.length > 4) exitWithUsage();
    int count;
    long seed;
    try {
      count = Integer.decode(args[2]);
      seed = args.length > 3 ? Long.decode(args[3]) : System.currentTimeMillis();
    } catch (NumberFormatException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }
    Structure structure = Inputs.readStructure(new File(args[0]));
    ImmutableSet<String> words = Inputs.readWords(new File(args[1]));

    System.err.printf("Filling %d times from seed %#x%n", count, seed);
    Stats stats = generate(structure, words, count, seed, System.out);
    stats.report(System.err);
  }

  private static void exitWithUsage() {
    System.err.println("Usage: FillStats <structure> <words> <count> [<seed>]");
    System.exit(1);
  }

  /** The statistics gathered over a run of fills. */
  static class Stats {
    final SummaryStatistics steps = new SummaryStatistics();
    final SummaryStatistics micros = new SummaryStatistics();
    final EnumMap<Solver.Outcome, Integer> outcomes = Maps.newEnumMap(Solver.Outcome.class);

    void add(Solver.Result result, long elapsedMicros) {
      steps.addValue(result.numSteps);
      micros.addValue(elapsedMicros);
      Integer prev = outcomes.get(result.outcome);
      outcomes.put(result.outcome, prev == null ? 1 : prev + 1);
    }

    void report(PrintStream out) {
      out.println("Outcomes: " + outcomes);
      report(out, "Steps", steps);
      report(out, "Micros", micros);
    }

    private static void report(PrintStream out, String name, StatisticalSummary stats) {
      out.printf("%s: mean %.2f; sd %.2f; min %.0f; max %.0f%n", name, stats.getMean(),
                 stats.getStandardDeviation(), stats.getMin(), stats.getMax());
    }
  }

  /**
   * Fills the structure the given number of times, printing a line for each
   * fill if the given stream isn't null.
   */
  static Stats generate(Structure structure, ImmutableSet<String> words, int count, long seed,
                        PrintStream out) {
    if (out != null)
      out.println("Seed\tOutcome\tSteps\tMicros");
    Stats stats = new Stats();
    Random random = new Random(seed);
    while (count-- > 0) {
      long solverSeed = random.nextLong();
      Stopwatch stopwatch = Stopwatch.createStarted();
      Solver.Result result =
          Solver.solve(structure, words, Search.NO_LIMIT, new Random(solverSeed));
      stopwatch.stop();
      long micros = stopwatch.elapsed(MICROSECONDS);
      stats.add(result, micros);
      if (out != null)
        out.printf("%#x\t%s\t%d\t%d%n", solverSeed, result.outcome, result.numSteps, micros);
    }
    return stats;
  }
}
