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

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * The fixed geometry of a crossword: its dimensions, which cells take letters,
 * the slots words go in, and where those slots cross.  Nothing here changes
 * once the structure is built.
 *
 * <p> The text form, used by {@link #fromString} and {@link #toString}, has one
 * line per row with an underscore for each fillable cell; any other character
 * is a blocked cell.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Structure {

  /** The character marking a fillable cell in the text form. */
  public static final char FILLABLE = '_';

  /** The character {@link #toString} uses for blocked cells. */
  public static final char BLOCKED = '#';

  public final int width;
  public final int height;

  /** All the slots, in canonical order. */
  public final ImmutableList<Slot> slots;

  private final boolean[][] fillable;
  private final ImmutableTable<Slot, Slot, Overlap> overlaps;
  private final ImmutableSetMultimap<Slot, Slot> neighbors;

  /**
   * Builds a structure from a matrix of fillable cells, indexed by row then
   * column.  The slots are the maximal runs of two or more fillable cells in
   * each direction.
   */
  public static Structure of(boolean[][] fillable) {
    boolean[][] cells = copyCells(fillable);
    return new Structure(cells, findSlots(cells));
  }

  /**
   * Builds a structure from a matrix of fillable cells and an explicit set of
   * slots.  Each slot must start at a numbered cell and cover exactly the
   * maximal run of fillable cells that starts there.
   *
   * @throws GeometryException if a slot does not fit the cells
   */
  public static Structure withSlots(boolean[][] fillable, Collection<Slot> slots) {
    boolean[][] cells = copyCells(fillable);
    for (Slot slot : slots)
      checkSlot(cells, slot);
    return new Structure(cells, ImmutableSortedSet.copyOf(slots).asList());
  }

  /** Parses the text form of a structure, one row per line. */
  public static Structure fromString(String text) {
    if (text.endsWith("\n")) text = text.substring(0, text.length() - 1);
    List<String> lines = Lists.newArrayList();
    for (String line : Splitter.on('\n').split(text)) {
      lines.add(line.endsWith("\r") ? line.substring(0, line.length() - 1) : line);
    }
    return fromLines(lines);
  }

  /**
   * Builds a structure from the lines of its text form.  The width is that of
   * the longest line; shorter lines are padded with blocked cells.
   */
  public static Structure fromLines(List<String> lines) {
    int width = 0;
    for (String line : lines)
      width = Math.max(width, line.length());
    boolean[][] cells = new boolean[lines.size()][width];
    for (int row = 0; row < lines.size(); ++row) {
      String line = lines.get(row);
      for (int column = 0; column < line.length(); ++column)
        cells[row][column] = line.charAt(column) == FILLABLE;
    }
    return of(cells);
  }

  private Structure(boolean[][] fillable, ImmutableList<Slot> slots) {
    this.height = fillable.length;
    this.width = fillable[0].length;
    this.fillable = fillable;
    this.slots = slots;

    ImmutableTable.Builder<Slot, Slot, Overlap> overlaps = ImmutableTable.builder();
    ImmutableSetMultimap.Builder<Slot, Slot> neighbors = ImmutableSetMultimap.builder();
    for (Slot x : slots)
      for (Slot y : slots) {
        if (x.equals(y)) continue;
        Overlap overlap = findOverlap(x, y);
        if (overlap != null) {
          overlaps.put(x, y, overlap);
          neighbors.put(x, y);
        }
      }
    this.overlaps = overlaps.build();
    this.neighbors = neighbors.build();
  }

  /** Tells whether the given cell takes a letter. */
  public boolean isFillable(int row, int column) {
    checkElementIndex(row, height);
    checkElementIndex(column, width);
    return fillable[row][column];
  }

  /**
   * Returns where the two slots cross, from the first slot's point of view, or
   * null if they don't.
   */
  @Nullable public Overlap overlap(Slot x, Slot y) {
    return overlaps.get(x, y);
  }

  /** Returns the slots that cross the given one, in canonical order. */
  public ImmutableSet<Slot> neighbors(Slot slot) {
    return neighbors.get(checkNotNull(slot));
  }

  /** Returns the number of slots crossing the given one. */
  public int degree(Slot slot) {
    return neighbors(slot).size();
  }

  /** Tells whether the two slots cross. */
  public boolean areNeighbors(Slot x, Slot y) {
    return overlaps.contains(x, y);
  }

  /** Returns the fillable-cell matrix, as a fresh copy. */
  public boolean[][] toCellArray() {
    return copyCells(fillable);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (int row = 0; row < height; ++row) {
      for (int column = 0; column < width; ++column)
        sb.append(fillable[row][column] ? FILLABLE : BLOCKED);
      sb.append('\n');
    }
    return sb.toString();
  }

  @Nullable private static Overlap findOverlap(Slot x, Slot y) {
    for (int i = 0; i < x.length; ++i) {
      int j = y.indexOf(x.rowAt(i), x.columnAt(i));
      if (j >= 0) return Overlap.of(i, j);
    }
    return null;
  }

  private static ImmutableList<Slot> findSlots(boolean[][] cells) {
    ImmutableSortedSet.Builder<Slot> slots = ImmutableSortedSet.naturalOrder();
    for (int row = 0; row < cells.length; ++row)
      for (int column = 0; column < cells[row].length; ++column)
        for (Direction direction : Direction.values()) {
          if (!isNumbered(cells, row, column, direction)) continue;
          int length = runLength(cells, row, column, direction);
          if (length > 1)
            slots.add(Slot.of(row, column, direction, length));
        }
    return slots.build().asList();
  }

  private static void checkSlot(boolean[][] cells, Slot slot) {
    int height = cells.length, width = cells[0].length;
    int lastRow = slot.row + (slot.length - 1) * slot.direction.rowStep;
    int lastColumn = slot.column + (slot.length - 1) * slot.direction.columnStep;
    if (slot.row >= height || slot.column >= width || lastRow >= height || lastColumn >= width)
      throw new GeometryException("Slot " + slot + " runs off the " + height + "x" + width + " grid");
    if (slot.length < 2)
      throw new GeometryException("Slot " + slot + " is too short to hold a word");
    if (!isNumbered(cells, slot.row, slot.column, slot.direction))
      throw new GeometryException("Slot " + slot + " does not start at a numbered cell");
    int run = runLength(cells, slot.row, slot.column, slot.direction);
    if (run < slot.length)
      throw new GeometryException(
          "Slot " + slot + " is longer than its run of " + run + " fillable cells");
    if (run > slot.length)
      throw new GeometryException(
          "Slot " + slot + " is shorter than its run of " + run + " fillable cells");
  }

  /**
   * Tells whether a word in the given direction can start at the given cell:
   * the cell is fillable and the one before it is blocked or off the grid.
   */
  private static boolean isNumbered(boolean[][] cells, int row, int column, Direction direction) {
    if (!cells[row][column]) return false;
    int prevRow = row - direction.rowStep, prevColumn = column - direction.columnStep;
    return prevRow < 0 || prevColumn < 0 || !cells[prevRow][prevColumn];
  }

  private static int runLength(boolean[][] cells, int row, int column, Direction direction) {
    int length = 0;
    while (row < cells.length && column < cells[row].length && cells[row][column]) {
      ++length;
      row += direction.rowStep;
      column += direction.columnStep;
    }
    return length;
  }

  private static boolean[][] copyCells(boolean[][] fillable) {
    checkNotNull(fillable);
    if (fillable.length == 0 || fillable[0] == null || fillable[0].length == 0)
      throw new GeometryException("Empty crossword grid");
    int width = fillable[0].length;
    boolean[][] copy = new boolean[fillable.length][];
    for (int row = 0; row < fillable.length; ++row) {
      if (fillable[row] == null || fillable[row].length != width)
        throw new GeometryException("Row " + row + " is not " + width + " cells wide");
      copy[row] = fillable[row].clone();
    }
    return copy;
  }
}
