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

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Multiset;

import java.util.AbstractMap;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * An immutable mapping from slots to the words chosen for them, iterating in
 * canonical slot order.  The nested Builder class is the mutable version the
 * search extends and backs out of; it insists that words fit their slots, but
 * otherwise does not enforce the rules of the crossword.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Assignment extends AbstractMap<Slot, String> {

  public static final Assignment EMPTY = new Assignment(ImmutableSortedMap.<Slot, String>of());

  private final ImmutableSortedMap<Slot, String> words;

  private Assignment(ImmutableSortedMap<Slot, String> words) {
    this.words = words;
  }

  /** Returns a new, empty Builder. */
  public static Builder builder() {
    return new Builder();
  }

  /** Tells whether every slot of the structure has a word. */
  public boolean isComplete(Structure structure) {
    for (Slot slot : structure.slots)
      if (!words.containsKey(slot)) return false;
    return true;
  }

  /**
   * Tells whether this assignment obeys all the rules: words fit their slots,
   * no word is used twice, and crossing words agree on their shared letters.
   */
  public boolean isConsistent(Structure structure) {
    if (ImmutableSet.copyOf(words.values()).size() != words.size())
      return false;
    for (Map.Entry<Slot, String> entry : words.entrySet()) {
      Slot slot = entry.getKey();
      String word = entry.getValue();
      if (word.length() != slot.length) return false;
      for (Slot neighbor : structure.neighbors(slot)) {
        String other = words.get(neighbor);
        if (other != null && !structure.overlap(slot, neighbor).agrees(word, other))
          return false;
      }
    }
    return true;
  }

  @Override public Set<Entry<Slot, String>> entrySet() {
    return words.entrySet();
  }

  @Override public boolean containsKey(Object key) {
    return words.containsKey(key);
  }

  @Override @Nullable public String get(Object key) {
    return words.get(key);
  }

  @Override public int size() {
    return words.size();
  }

  /**
   * A mutable assignment.  Putting a word whose length differs from its slot's
   * is a programming error, and fails.
   */
  @NotThreadSafe
  public static final class Builder {
    private final Map<Slot, String> words = Maps.newHashMap();
    private final Multiset<String> used = HashMultiset.create();

    private Builder() {}

    /** Sets the word for the given slot, replacing any previous one. */
    public Builder put(Slot slot, String word) {
      checkNotNull(slot);
      checkArgument(word.length() == slot.length, "%s doesn't fit %s", word, slot);
      String old = words.put(slot, word);
      if (old != null) used.remove(old);
      used.add(word);
      return this;
    }

    /** Erases the word for the given slot, returning it. */
    @Nullable public String remove(Slot slot) {
      String old = words.remove(slot);
      if (old != null) used.remove(old);
      return old;
    }

    public boolean containsKey(Slot slot) {
      return words.containsKey(slot);
    }

    @Nullable public String get(Slot slot) {
      return words.get(slot);
    }

    /** Tells whether some slot has the given word. */
    public boolean isUsed(String word) {
      return used.contains(word);
    }

    public int size() {
      return words.size();
    }

    /** Returns an immutable snapshot of this assignment. */
    public Assignment build() {
      return new Assignment(ImmutableSortedMap.copyOf(words));
    }
  }
}
