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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Structures and word lists shared by the tests.
 */
public class Fixtures {

  /** Two across slots joined by a down slot along the left edge. */
  public static final String HOOK = "___\n_##\n___";

  /** A four-letter down slot crossed at its second letter by a three-letter across slot. */
  public static final String CROSS = "#_#\n___\n#_#\n#_#";

  /** Four four-letter slots around the edge of a square. */
  public static final String FRAME = "____\n_##_\n_##_\n____";

  public static final ImmutableList<String> CROSS_WORDS = words("CAT,DOG,BOAT,HEAT,I");
  public static final ImmutableList<String> FRAME_WORDS =
      words("STOP,SEAT,PART,TENT,SPOT,TOPS,CATS,MEOW");

  public static Structure s(String text) { return Structure.fromString(text); }
  public static ImmutableList<String> words(String csv) {
    return ImmutableList.copyOf(Splitter.on(',').omitEmptyStrings().split(csv));
  }
  public static Slot across(int row, int column, int length) { return Slot.across(row, column, length); }
  public static Slot down(int row, int column, int length) { return Slot.down(row, column, length); }

  /** The cross structure's slots. */
  public static final Slot CROSS_DOWN = down(0, 1, 4);
  public static final Slot CROSS_ACROSS = across(1, 0, 3);

  /** The hook structure's slots. */
  public static final Slot HOOK_TOP = across(0, 0, 3);
  public static final Slot HOOK_DOWN = down(0, 0, 3);
  public static final Slot HOOK_BOTTOM = across(2, 0, 3);

  /** Returns node-consistent domains for the given structure and words. */
  public static Domains nodeConsistent(Structure structure, Iterable<String> words) {
    Domains domains = Domains.initialize(structure, words);
    Consistency.enforceNodeConsistency(structure, domains);
    return domains;
  }
}
