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
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import javax.annotation.concurrent.Immutable;

/**
 * The letters of a filled-in crossword, laid out row by row.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class LetterGrid {

  /** Marks a cell that takes no letter. */
  public static final char BLOCKED = '#';

  /** Marks a fillable cell that no assigned word covers. */
  public static final char EMPTY = ' ';

  public final int width;
  public final int height;

  private final char[][] cells;
  private final boolean[][] fillable;

  /**
   * Lays out the words of the given assignment on the given structure.  Every
   * assigned slot must belong to the structure.
   */
  public static LetterGrid of(Structure structure, Map<Slot, String> assignment) {
    ImmutableSet<Slot> known = ImmutableSet.copyOf(structure.slots);
    for (Slot slot : assignment.keySet())
      checkArgument(known.contains(slot), "Slot %s is not in the structure", slot);
    char[][] cells = new char[structure.height][structure.width];
    for (int row = 0; row < structure.height; ++row)
      for (int column = 0; column < structure.width; ++column)
        cells[row][column] = structure.isFillable(row, column) ? EMPTY : BLOCKED;
    for (Map.Entry<Slot, String> entry : assignment.entrySet()) {
      Slot slot = entry.getKey();
      String word = entry.getValue();
      for (int k = 0; k < word.length() && k < slot.length; ++k)
        cells[slot.rowAt(k)][slot.columnAt(k)] = word.charAt(k);
    }
    return new LetterGrid(cells, structure.toCellArray());
  }

  private LetterGrid(char[][] cells, boolean[][] fillable) {
    this.height = cells.length;
    this.width = cells[0].length;
    this.cells = cells;
    this.fillable = fillable;
  }

  /** Tells whether the given cell takes a letter. */
  public boolean isFillable(int row, int column) {
    checkElementIndex(row, height);
    checkElementIndex(column, width);
    return fillable[row][column];
  }

  /** Returns the character at the given cell. */
  public char get(int row, int column) {
    checkElementIndex(row, height);
    checkElementIndex(column, width);
    return cells[row][column];
  }

  /** Returns the cells as a fresh array, indexed by row then column. */
  public char[][] toArray() {
    char[][] copy = new char[height][];
    for (int row = 0; row < height; ++row)
      copy[row] = cells[row].clone();
    return copy;
  }

  /** Returns one string per row, with blocked cells shown as the given character. */
  public List<String> format(char blocked) {
    ImmutableList.Builder<String> lines = ImmutableList.builder();
    for (int row = 0; row < height; ++row) {
      StringBuilder sb = new StringBuilder(width);
      for (int column = 0; column < width; ++column) {
        char c = cells[row][column];
        // Only the structure's blocked cells, not a letter that looks like one.
        sb.append(c == BLOCKED && !fillable[row][column] ? blocked : c);
      }
      lines.add(sb.toString());
    }
    return lines.build();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof LetterGrid)) return false;
    return Arrays.deepEquals(this.cells, ((LetterGrid) o).cells);
  }

  @Override public int hashCode() {
    return Arrays.deepHashCode(cells);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (String line : format(BLOCKED))
      sb.append(line).append('\n');
    return sb.toString();
  }
}
