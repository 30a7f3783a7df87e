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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ComparisonChain;

import java.util.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A place in a crossword grid where a word goes: the variable of the
 * crossword's constraint problem.  Slots are ordered by row, then column, then
 * direction, which is the canonical order used wherever ties must be broken.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Slot implements Comparable<Slot> {

  /** The zero-based row of the first letter. */
  public final int row;

  /** The zero-based column of the first letter. */
  public final int column;

  public final Direction direction;

  /** The number of letters in the slot. */
  public final int length;

  public static Slot of(int row, int column, Direction direction, int length) {
    return new Slot(row, column, direction, length);
  }

  public static Slot across(int row, int column, int length) {
    return of(row, column, Direction.ACROSS, length);
  }

  public static Slot down(int row, int column, int length) {
    return of(row, column, Direction.DOWN, length);
  }

  private Slot(int row, int column, Direction direction, int length) {
    checkArgument(row >= 0 && column >= 0, "Negative start (%s, %s)", row, column);
    checkArgument(length > 0, "Slot length must be positive: %s", length);
    this.row = row;
    this.column = column;
    this.direction = checkNotNull(direction);
    this.length = length;
  }

  /** Returns the row of the letter at the given index. */
  public int rowAt(int index) {
    checkElementIndex(index, length);
    return row + index * direction.rowStep;
  }

  /** Returns the column of the letter at the given index. */
  public int columnAt(int index) {
    checkElementIndex(index, length);
    return column + index * direction.columnStep;
  }

  /**
   * Returns the index within this slot of the given cell, or -1 if the slot
   * doesn't cover it.
   */
  public int indexOf(int row, int column) {
    int index;
    if (direction == Direction.ACROSS) {
      if (row != this.row) return -1;
      index = column - this.column;
    } else {
      if (column != this.column) return -1;
      index = row - this.row;
    }
    return index >= 0 && index < length ? index : -1;
  }

  @Override public int compareTo(Slot that) {
    return ComparisonChain.start()
        .compare(this.row, that.row)
        .compare(this.column, that.column)
        .compare(this.direction, that.direction)
        .compare(this.length, that.length)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Slot)) return false;
    Slot that = (Slot) o;
    return this.row == that.row
        && this.column == that.column
        && this.direction == that.direction
        && this.length == that.length;
  }

  @Override public int hashCode() {
    return Objects.hash(row, column, direction, length);
  }

  @Override public String toString() {
    return String.format("%d%s(%d, %d)", length, direction == Direction.ACROSS ? "A" : "D", row, column);
  }
}
