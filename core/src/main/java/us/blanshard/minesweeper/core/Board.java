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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * A Minesweeper mine field: a grid of the given dimensions with mines hidden in
 * some of its cells.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Board {

  public static final int DEFAULT_HEIGHT = 8;
  public static final int DEFAULT_WIDTH = 8;
  public static final int DEFAULT_MINES = 8;

  private final Dimensions dimensions;
  private final ImmutableSortedSet<Cell> mines;

  public Board(Dimensions dimensions, Set<Cell> mines) {
    this.dimensions = checkNotNull(dimensions);
    this.mines = ImmutableSortedSet.copyOf(mines);
    for (Cell mine : this.mines)
      checkArgument(dimensions.contains(mine), "Mine %s is not within %s", mine, dimensions);
  }

  /** Creates a board of the default size, with mines placed randomly. */
  public static Board random(Random random) {
    return random(Dimensions.of(DEFAULT_HEIGHT, DEFAULT_WIDTH), DEFAULT_MINES, random);
  }

  /**
   * Creates a board of the given dimensions with the given number of mines, all
   * placed uniformly at random.
   */
  public static Board random(Dimensions dimensions, int mineCount, Random random) {
    checkArgument(mineCount >= 0 && mineCount <= dimensions.size(),
        "Can't place %s mines on a %s board", mineCount, dimensions);
    List<Cell> cells = Lists.newArrayList(dimensions.allCells());
    Collections.shuffle(cells, random);
    return new Board(dimensions, ImmutableSortedSet.copyOf(cells.subList(0, mineCount)));
  }

  /**
   * Parses a board from text: one line per row, {@code *} for a mine and
   * {@code .} for a clear cell.  Other whitespace and blank lines are ignored.
   */
  public static Board fromString(String s) {
    List<String> rows = Lists.newArrayList();
    for (String line : Splitter.on('\n').split(s)) {
      String row = CharMatcher.whitespace().removeFrom(line);
      if (!row.isEmpty()) rows.add(row);
    }
    checkArgument(!rows.isEmpty(), "Board.fromString requires at least one row");

    int width = rows.get(0).length();
    ImmutableSortedSet.Builder<Cell> mines = ImmutableSortedSet.naturalOrder();
    for (int r = 0; r < rows.size(); ++r) {
      String row = rows.get(r);
      checkArgument(row.length() == width,
          "Board.fromString requires rows of equal width, got %s in %s", row, s);
      for (int c = 0; c < width; ++c) {
        char ch = row.charAt(c);
        if (ch == '*')
          mines.add(Cell.of(r, c));
        else if (ch != '.')
          throw new IllegalArgumentException(
              String.format("Unexpected character '%c' in board %s", ch, s));
      }
    }
    return new Board(Dimensions.of(rows.size(), width), mines.build());
  }

  public Dimensions getDimensions() {
    return dimensions;
  }

  public ImmutableSortedSet<Cell> getMines() {
    return mines;
  }

  public boolean isMine(Cell cell) {
    return mines.contains(cell);
  }

  /** Returns the number of mines touching the given cell, not counting itself. */
  public int nearbyMines(Cell cell) {
    int count = 0;
    for (Cell neighbor : dimensions.neighbors(cell))
      if (mines.contains(neighbor)) ++count;
    return count;
  }

  /** Tells whether the given flags mark exactly this board's mines. */
  public boolean won(Set<Cell> flagged) {
    return mines.equals(flagged);
  }

  /** Draws the board with an X in each mined cell. */
  @Override public String toString() {
    String rule = Strings.repeat("--", dimensions.width) + "-\n";
    StringBuilder sb = new StringBuilder();
    for (int row = 0; row < dimensions.height; ++row) {
      sb.append(rule);
      for (int column = 0; column < dimensions.width; ++column)
        sb.append(isMine(Cell.of(row, column)) ? "|X" : "| ");
      sb.append("|\n");
    }
    return sb.append(rule).toString();
  }
}
