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

import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Iterables;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * The candidate words for each slot of a crossword.  Each slot's set is
 * independent of the others, and iterates in the order the words were first
 * given.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Domains {

  private final Map<Slot, Set<String>> domains;

  /** Gives every slot of the structure the full list of words. */
  public static Domains initialize(Structure structure, Iterable<String> words) {
    Map<Slot, Set<String>> domains = Maps.newLinkedHashMap();
    for (Slot slot : structure.slots)
      domains.put(slot, Sets.newLinkedHashSet(words));
    return new Domains(domains);
  }

  private Domains(Map<Slot, Set<String>> domains) {
    this.domains = domains;
  }

  /** Returns a read-only view of the given slot's candidate words. */
  public Set<String> get(Slot slot) {
    return Collections.unmodifiableSet(domain(slot));
  }

  public int size(Slot slot) {
    return domain(slot).size();
  }

  public boolean contains(Slot slot, String word) {
    return domain(slot).contains(word);
  }

  public boolean isEmpty(Slot slot) {
    return domain(slot).isEmpty();
  }

  /** Tells whether any slot has run out of candidates. */
  public boolean anyEmpty() {
    for (Set<String> words : domains.values())
      if (words.isEmpty()) return true;
    return false;
  }

  /** Returns the slots covered, in canonical order. */
  public Set<Slot> slots() {
    return Collections.unmodifiableSet(domains.keySet());
  }

  /**
   * Removes from the given slot's domain every word that fails the predicate.
   * Returns true if any word was removed.
   */
  public boolean narrow(Slot slot, Predicate<? super String> keep) {
    checkNotNull(keep);
    return Iterables.removeIf(domain(slot), Predicates.not(keep));
  }

  /** Returns a snapshot of the number of candidates for each slot. */
  public ImmutableMap<Slot, Integer> sizes() {
    ImmutableMap.Builder<Slot, Integer> builder = ImmutableMap.builder();
    for (Map.Entry<Slot, Set<String>> entry : domains.entrySet())
      builder.put(entry.getKey(), entry.getValue().size());
    return builder.build();
  }

  /** Returns an independent copy of these domains. */
  public Domains copy() {
    Map<Slot, Set<String>> copy = Maps.newLinkedHashMap();
    for (Map.Entry<Slot, Set<String>> entry : domains.entrySet())
      copy.put(entry.getKey(), Sets.newLinkedHashSet(entry.getValue()));
    return new Domains(copy);
  }

  @Override public String toString() {
    return domains.toString();
  }

  private Set<String> domain(Slot slot) {
    Set<String> words = domains.get(slot);
    checkArgument(words != null, "No domain for %s", slot);
    return words;
  }
}
