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

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.logging.Level.WARNING;

import com.google.common.base.Charsets;
import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

import us.blanshard.crossword.core.GeometryException;
import us.blanshard.crossword.core.Search;
import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Structure;
import us.blanshard.crossword.json.CrosswordJson;

/**
 * Fills in a crossword structure from a word list and prints the result,
 * optionally saving it as json.
 *
 * @author Luke Blanshard
 */
public class Generate {
  private static final Logger logger = Logger.getLogger(Generate.class.getName());

  /** The character printed for blocked cells. */
  static final char BLOCK = '\u2588';  // Full block

  static final String USAGE =
      "Usage: Generate <structure> <words> [<output.json>] [-steps <max>] [-seed <seed>]";

  public static void main(String[] args) {
    int status = run(args, System.out, System.err);
    if (status != 0) System.exit(status);
  }

  /** Does the work of {@link #main}, returning the exit status. */
  static int run(String[] args, PrintStream out, PrintStream err) {
    List<String> files = Lists.newArrayList();
    int maxSteps = Search.NO_LIMIT;
    Random random = null;
    try {
      for (int i = 0; i < args.length; ++i) {
        if (args[i].equals("-steps") && i + 1 < args.length) {
          maxSteps = Integer.decode(args[++i]);
          if (maxSteps < 0) throw new NumberFormatException("negative step limit");
        } else if (args[i].equals("-seed") && i + 1 < args.length) {
          random = new Random(Long.decode(args[++i]));
        } else if (args[i].startsWith("-")) {
          err.println(USAGE);
          return 1;
        } else {
          files.add(args[i]);
        }
      }
    } catch (NumberFormatException e) {
      err.println(USAGE);
      return 1;
    }
    if (files.size() < 2 || files.size() > 3) {
      err.println(USAGE);
      return 1;
    }

    Structure structure;
    ImmutableSet<String> words;
    try {
      structure = Inputs.readStructure(new File(files.get(0)));
      words = Inputs.readWords(new File(files.get(1)));
    } catch (IOException e) {
      logger.log(WARNING, "Unable to read inputs", e);
      err.println("Unable to read inputs: " + e.getMessage());
      return 1;
    } catch (GeometryException e) {
      err.println("Bad structure: " + e.getMessage());
      return 1;
    }

    Stopwatch stopwatch = Stopwatch.createStarted();
    Solver.Result result = Solver.solve(structure, words, maxSteps, random);
    stopwatch.stop();
    err.printf("%d slots, %d words, %d steps, %d ms%n", structure.slots.size(), words.size(),
               result.numSteps, stopwatch.elapsed(MILLISECONDS));

    switch (result.outcome) {
      case UNSOLVABLE:
        out.println("No solution.");
        return 0;
      case GAVE_UP:
        out.println("Gave up after " + result.numSteps + " steps.");
        return 0;
      default:
        break;
    }

    for (String line : result.letters().format(BLOCK))
      out.println(line);

    if (files.size() == 3) {
      File output = new File(files.get(2));
      try {
        Files.asCharSink(output, Charsets.UTF_8)
            .write(CrosswordJson.toJsonString(structure, result.solution));
      } catch (IOException e) {
        logger.log(WARNING, "Unable to write " + output, e);
        err.println("Unable to write " + output + ": " + e.getMessage());
        return 1;
      }
    }
    return 0;
  }
}
