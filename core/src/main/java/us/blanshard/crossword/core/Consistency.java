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

import com.google.common.base.Predicate;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Static methods that shrink a crossword's domains without searching: node
 * consistency for the word-length constraint, and the AC-3 algorithm for the
 * constraints between crossing slots.
 *
 * @author Luke Blanshard
 */
public class Consistency {
  private static final Logger logger = Logger.getLogger(Consistency.class.getName());

  /**
   * Removes from each slot's domain the words whose length doesn't match the
   * slot.  This may leave a domain empty, which the caller must check for.
   */
  public static void enforceNodeConsistency(Structure structure, Domains domains) {
    int removed = 0;
    for (final Slot slot : structure.slots) {
      int before = domains.size(slot);
      domains.narrow(slot, new Predicate<String>() {
        @Override public boolean apply(String word) {
          return word.length() == slot.length;
        }
      });
      removed += before - domains.size(slot);
    }
    if (logger.isLoggable(Level.FINE))
      logger.fine("Node consistency removed " + removed + " words");
  }

  /**
   * Makes slot x arc consistent with slot y: removes from x's domain every word
   * that no word in y's domain agrees with where the two cross.  Does nothing
   * if the slots don't cross.  Returns true if x's domain shrank.
   */
  public static boolean revise(Structure structure, Domains domains, Slot x, Slot y) {
    final Overlap overlap = structure.overlap(x, y);
    if (overlap == null) return false;

    // The letters y's words can put in the shared cell.
    final Set<Character> supported = Sets.newHashSet();
    for (String word : domains.get(y))
      if (overlap.second < word.length())
        supported.add(word.charAt(overlap.second));

    return domains.narrow(x, new Predicate<String>() {
      @Override public boolean apply(String word) {
        return overlap.first < word.length() && supported.contains(word.charAt(overlap.first));
      }
    });
  }

  /**
   * Enforces arc consistency across the whole crossword, starting from every
   * arc between crossing slots.  Returns false if some slot's domain becomes
   * empty, true otherwise.
   */
  public static boolean ac3(Structure structure, Domains domains) {
    return ac3(structure, domains, allArcs(structure));
  }

  /**
   * Enforces arc consistency starting from the given arcs; arcs whose source
   * slot shrinks cause the arcs into that slot to be rechecked.  Returns false
   * as soon as some slot's domain becomes empty, true once no arcs remain.
   */
  public static boolean ac3(Structure structure, Domains domains, Iterable<Arc> arcs) {
    ArrayDeque<Arc> worklist = new ArrayDeque<Arc>();
    Set<Arc> queued = Sets.newHashSet();
    for (Arc arc : arcs)
      if (queued.add(arc)) worklist.addLast(arc);

    int processed = 0;
    int revisions = 0;
    while (!worklist.isEmpty()) {
      Arc arc = worklist.removeFirst();
      queued.remove(arc);
      ++processed;
      if (!revise(structure, domains, arc.from, arc.to)) continue;
      ++revisions;
      if (domains.isEmpty(arc.from)) {
        if (logger.isLoggable(Level.FINE))
          logger.fine("AC-3 emptied the domain of " + arc.from + " after " + processed + " arcs");
        return false;
      }
      for (Slot z : structure.neighbors(arc.from)) {
        if (z.equals(arc.to)) continue;
        Arc recheck = Arc.of(z, arc.from);
        if (queued.add(recheck)) worklist.addLast(recheck);
      }
    }
    if (logger.isLoggable(Level.FINE))
      logger.fine("AC-3 processed " + processed + " arcs, " + revisions + " revisions");
    return true;
  }

  /** Returns every arc between crossing slots, in both directions. */
  public static List<Arc> allArcs(Structure structure) {
    List<Arc> arcs = Lists.newArrayList();
    for (Slot x : structure.slots)
      for (Slot y : structure.neighbors(x))
        arcs.add(Arc.of(x, y));
    return arcs;
  }

  // Static methods only.
  private Consistency() {}
}
