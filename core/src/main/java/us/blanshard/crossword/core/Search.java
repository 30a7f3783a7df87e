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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Functions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Ordering;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first backtracking search for a complete assignment.  The next slot
 * to fill is the one with the fewest remaining candidates, preferring slots
 * that cross the most others; its words are tried least-constraining first.
 *
 * <p> The domains are only read, never changed, so backing out of a failed
 * branch means just erasing that branch's word from the assignment.  With no
 * Random the search is deterministic: remaining ties go to the slot that comes
 * first in canonical order, and to the word that comes first in its domain.  A
 * Random shuffles the slot order up front and each slot's words before they
 * are ranked, which changes only how ties break.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Search {

  /** The step limit that means no limit. */
  public static final int NO_LIMIT = 0;

  private final Structure structure;
  private final Domains domains;
  private final int maxSteps;
  @Nullable private final Random random;
  private final ImmutableList<Slot> order;
  private final Assignment.Builder assignment = Assignment.builder();
  private int stepCount;
  private boolean gaveUp;
  private boolean ran;

  public Search(Structure structure, Domains domains) {
    this(structure, domains, NO_LIMIT, null);
  }

  /**
   * Creates a search that gives up after trying the given number of words, or
   * never if it is {@link #NO_LIMIT}.
   */
  public Search(Structure structure, Domains domains, int maxSteps, @Nullable Random random) {
    checkArgument(maxSteps >= 0, "Negative step limit %s", maxSteps);
    this.structure = checkNotNull(structure);
    this.domains = checkNotNull(domains);
    this.maxSteps = maxSteps;
    this.random = random;
    List<Slot> order = Lists.newArrayList(structure.slots);
    if (random != null) Collections.shuffle(order, random);
    this.order = ImmutableList.copyOf(order);
  }

  /**
   * Runs the search, returning a complete and consistent assignment, or null if
   * there is none or the step limit ran out first.  May only be called once.
   */
  @Nullable public Assignment run() {
    checkState(!ran, "Search already run");
    ran = true;
    return backtrack() ? assignment.build() : null;
  }

  /** Returns the number of words tried so far. */
  public int getStepCount() {
    return stepCount;
  }

  /** Tells whether the search stopped because it hit its step limit. */
  public boolean gaveUp() {
    return gaveUp;
  }

  private boolean backtrack() {
    if (assignment.size() == order.size()) return true;

    Slot slot = selectUnassignedSlot();
    for (String word : orderWords(slot)) {
      if (!isConsistent(slot, word)) continue;
      if (maxSteps != NO_LIMIT && stepCount >= maxSteps) {
        gaveUp = true;
        return false;
      }
      ++stepCount;
      assignment.put(slot, word);
      if (backtrack()) return true;
      assignment.remove(slot);
      if (gaveUp) return false;
    }
    return false;
  }

  /**
   * Chooses the unassigned slot with the fewest candidate words; among those,
   * the one crossing the most slots; among those, the first in search order.
   */
  Slot selectUnassignedSlot() {
    Slot best = null;
    int bestSize = Integer.MAX_VALUE;
    int bestDegree = -1;
    for (Slot slot : order) {
      if (assignment.containsKey(slot)) continue;
      int size = domains.size(slot);
      int degree = structure.degree(slot);
      if (size < bestSize || (size == bestSize && degree > bestDegree)) {
        best = slot;
        bestSize = size;
        bestDegree = degree;
      }
    }
    checkState(best != null, "No unassigned slots");
    return best;
  }

  /**
   * Returns the slot's candidate words ordered by how many candidates of the
   * unassigned crossing slots each would rule out, fewest first.
   */
  List<String> orderWords(Slot slot) {
    List<String> words = Lists.newArrayList(domains.get(slot));
    if (random != null) Collections.shuffle(words, random);

    Map<String, Integer> ruledOut = Maps.newHashMap();
    for (String word : words) {
      int count = 0;
      for (Slot neighbor : structure.neighbors(slot)) {
        if (assignment.containsKey(neighbor)) continue;
        Overlap overlap = structure.overlap(slot, neighbor);
        for (String other : domains.get(neighbor))
          if (!overlap.agrees(word, other)) ++count;
      }
      ruledOut.put(word, count);
    }
    // The sort is stable, so ties keep their domain order.
    Collections.sort(words, Ordering.natural().onResultOf(Functions.forMap(ruledOut)));
    return words;
  }

  /**
   * Tells whether the assignment would still obey the rules with the given
   * word in the given slot: the word fits, isn't used elsewhere, and agrees
   * with every assigned crossing word.
   */
  boolean isConsistent(Slot slot, String word) {
    if (word.length() != slot.length) return false;
    if (assignment.isUsed(word) && !word.equals(assignment.get(slot))) return false;
    for (Slot neighbor : structure.neighbors(slot)) {
      String other = assignment.get(neighbor);
      if (other != null && !structure.overlap(slot, neighbor).agrees(word, other))
        return false;
    }
    return true;
  }

  /** Returns the assignment being built, for tests. */
  Assignment.Builder assignment() {
    return assignment;
  }
}
