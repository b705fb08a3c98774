/*
Copyright 2016 Luke Blanshard

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
package us.blanshard.minesweeper.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ComparisonChain;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

/**
 * A cell of a Minesweeper grid, identified by its zero-based row and column.
 * Cells are ordered row-major, so sets of them iterate deterministically.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  public final int row;
  public final int column;

  private Cell(int row, int column) {
    this.row = row;
    this.column = column;
  }

  public static Cell of(int row, int column) {
    checkArgument(row >= 0 && column >= 0, "Negative coordinate: (%s, %s)", row, column);
    return new Cell(row, column);
  }

  @Override public int compareTo(@Nonnull Cell that) {
    return ComparisonChain.start()
        .compare(this.row, that.row)
        .compare(this.column, that.column)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Cell)) return false;
    Cell that = (Cell) o;
    return this.row == that.row && this.column == that.column;
  }

  @Override public int hashCode() {
    return row * 31 + column;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }
}
