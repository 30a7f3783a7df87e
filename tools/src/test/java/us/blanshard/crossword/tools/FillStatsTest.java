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

import static org.junit.Assert.assertEquals;

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableSet;

import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;

import us.blanshard.crossword.core.Solver;
import us.blanshard.crossword.core.Structure;

public class FillStatsTest {
  Structure structure = Structure.fromString("____\n_##_\n_##_\n____");
  ImmutableSet<String> words = Inputs.toWords(
      Arrays.asList("stop", "seat", "part", "tent", "spot", "tops", "cats", "meow"));

  @Test public void generate() throws Exception {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream out = new PrintStream(bytes, true, "UTF-8");
    FillStats.Stats stats = FillStats.generate(structure, words, 5, 1L, out);
    assertEquals(5, stats.steps.getN());
    assertEquals(5, stats.micros.getN());
    assertEquals(Integer.valueOf(5), stats.outcomes.get(Solver.Outcome.SOLVED));
    // A header plus one line per fill.
    String[] lines = new String(bytes.toByteArray(), Charsets.UTF_8).split("\r?\n");
    assertEquals(6, lines.length);
    assertEquals("Seed\tOutcome\tSteps\tMicros", lines[0]);
  }

  @Test public void generate_isReproducible() {
    FillStats.Stats first = FillStats.generate(structure, words, 3, 17L, null);
    FillStats.Stats second = FillStats.generate(structure, words, 3, 17L, null);
    assertEquals(first.steps.getSum(), second.steps.getSum(), 0.0);
  }

  @Test public void report() throws Exception {
    FillStats.Stats stats = FillStats.generate(structure, words, 2, 3L, null);
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    stats.report(new PrintStream(bytes, true, "UTF-8"));
    String report = new String(bytes.toByteArray(), Charsets.UTF_8);
    assertEquals(true, report.startsWith("Outcomes: {SOLVED=2}"));
    assertEquals(true, report.contains("Steps: mean"));
  }
}
