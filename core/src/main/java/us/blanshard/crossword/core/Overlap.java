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

import javax.annotation.concurrent.Immutable;

/**
 * Where two crossing slots share a cell: the index of the shared letter within
 * the first slot, and within the second.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Overlap {

  /** Index of the shared cell within the first slot. */
  public final int first;

  /** Index of the shared cell within the second slot. */
  public final int second;

  public static Overlap of(int first, int second) {
    return new Overlap(first, second);
  }

  private Overlap(int first, int second) {
    checkArgument(first >= 0 && second >= 0);
    this.first = first;
    this.second = second;
  }

  /** Returns the same overlap seen from the second slot. */
  public Overlap reverse() {
    return new Overlap(second, first);
  }

  /**
   * Tells whether the two words agree at this overlap.  A word too short to
   * reach its index agrees with nothing.
   */
  public boolean agrees(String firstWord, String secondWord) {
    return first < firstWord.length()
        && second < secondWord.length()
        && firstWord.charAt(first) == secondWord.charAt(second);
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Overlap)) return false;
    Overlap that = (Overlap) o;
    return this.first == that.first && this.second == that.second;
  }

  @Override public int hashCode() {
    return first * 31 + second;
  }

  @Override public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
