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

import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;

import javax.annotation.concurrent.Immutable;

/**
 * The height and width of a Minesweeper grid.  Knows which cells lie on the
 * grid and which of them neighbor one another.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Dimensions {

  public final int height;
  public final int width;

  /** All the cells of the grid, row-major. */
  private final ImmutableList<Cell> cells;

  private Dimensions(int height, int width) {
    this.height = height;
    this.width = width;
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int row = 0; row < height; ++row)
      for (int column = 0; column < width; ++column)
        builder.add(Cell.of(row, column));
    this.cells = builder.build();
  }

  public static Dimensions of(int height, int width) {
    checkArgument(height > 0 && width > 0, "Bad dimensions: %sx%s", height, width);
    return new Dimensions(height, width);
  }

  /** The number of cells in the grid. */
  public int size() {
    return height * width;
  }

  public boolean contains(Cell cell) {
    return cell.row < height && cell.column < width;
  }

  /** Returns every cell of the grid in row-major order. */
  public ImmutableList<Cell> allCells() {
    return cells;
  }

  /**
   * Returns the cells touching the given one horizontally, vertically or
   * diagonally, clipped to the grid.  The cell itself is not included.
   */
  public ImmutableSortedSet<Cell> neighbors(Cell cell) {
    checkArgument(contains(cell), "%s is not within %s", cell, this);
    ImmutableSortedSet.Builder<Cell> builder = ImmutableSortedSet.naturalOrder();
    for (int row = cell.row - 1; row <= cell.row + 1; ++row) {
      for (int column = cell.column - 1; column <= cell.column + 1; ++column) {
        if (row < 0 || column < 0 || row >= height || column >= width) continue;
        if (row == cell.row && column == cell.column) continue;
        builder.add(Cell.of(row, column));
      }
    }
    return builder.build();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Dimensions)) return false;
    Dimensions that = (Dimensions) o;
    return this.height == that.height && this.width == that.width;
  }

  @Override public int hashCode() {
    return Objects.hashCode(height, width);
  }

  @Override public String toString() {
    return height + "x" + width;
  }
}
