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

import com.google.common.base.Charsets;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Locale;

import us.blanshard.crossword.core.Structure;

/**
 * Reads crossword structures and word lists from files.
 *
 * @author Luke Blanshard
 */
public class Inputs {

  /** Reads a structure file: one line per row, underscores for fillable cells. */
  public static Structure readStructure(File file) throws IOException {
    return Structure.fromLines(Files.asCharSource(file, Charsets.UTF_8).readLines());
  }

  /**
   * Reads a word file: one word per line.  Words are trimmed and upper-cased,
   * blank lines are skipped, and duplicates dropped; the first-seen order is
   * kept.
   */
  public static ImmutableSet<String> readWords(File file) throws IOException {
    return toWords(Files.asCharSource(file, Charsets.UTF_8).readLines());
  }

  static ImmutableSet<String> toWords(List<String> lines) {
    ImmutableSet.Builder<String> words = ImmutableSet.builder();
    for (String line : lines) {
      String word = line.trim().toUpperCase(Locale.ROOT);
      if (!word.isEmpty()) words.add(word);
    }
    return words.build();
  }

  // Static methods only.
  private Inputs() {}
}
