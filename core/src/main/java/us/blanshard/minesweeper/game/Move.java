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
package us.blanshard.minesweeper.game;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static us.blanshard.minesweeper.game.GameJson.JOINER;
import static us.blanshard.minesweeper.game.GameJson.SPLITTER;

import us.blanshard.minesweeper.core.Cell;

import com.google.common.base.Objects;
import com.google.common.collect.Lists;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A single reveal in a Minesweeper game: which cell, whether the player had
 * proven it safe or was guessing, and what the board said about it.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Move {

  /** The count recorded for a move that uncovered a mine. */
  public static final int EXPLODED = -1;

  private static final String GUESS = "g";
  private static final String SAFE = "s";

  public final Cell cell;
  public final boolean guess;

  /** The number of neighboring mines, or {@link #EXPLODED}. */
  public final int count;

  public Move(Cell cell, boolean guess, int count) {
    checkArgument(count >= EXPLODED, "Bad count %s", count);
    this.cell = checkNotNull(cell);
    this.guess = guess;
    this.count = count;
  }

  public boolean exploded() {
    return count == EXPLODED;
  }

  /** Renders this move as a string for json.  Can be reversed by {@link #fromJsonValue}. */
  String toJsonValue() {
    return JOINER.join(cell.row, cell.column, guess ? GUESS : SAFE, count);
  }

  static Move fromJsonValue(String value) {
    List<String> parts = Lists.newArrayList(SPLITTER.split(value));
    checkArgument(parts.size() == 4, "Bad move: %s", value);
    String kind = parts.get(2);
    checkArgument(kind.equals(GUESS) || kind.equals(SAFE), "Bad move kind: %s", value);
    Cell cell = Cell.of(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1)));
    return new Move(cell, kind.equals(GUESS), Integer.parseInt(parts.get(3)));
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Move)) return false;
    Move that = (Move) o;
    return this.cell.equals(that.cell) && this.guess == that.guess && this.count == that.count;
  }

  @Override public int hashCode() {
    return Objects.hashCode(cell, guess, count);
  }

  @Override public String toString() {
    return (guess ? "guess " : "reveal ") + cell + (exploded() ? " boom" : " -> " + count);
  }
}
