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
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.core.Dimensions;
import us.blanshard.minesweeper.inference.CellStatus;
import us.blanshard.minesweeper.inference.InferenceEngine;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A game of Minesweeper played by an {@link InferenceEngine} against a board.
 * The player reveals cells it has proven safe, and guesses only when it has
 * nothing proven left.  Not thread safe.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Game {
  private static final Logger logger = Logger.getLogger(Game.class.getName());

  public enum Status {
    IN_PROGRESS, WON, LOST;

    public boolean isOver() {
      return this != IN_PROGRESS;
    }
  }

  private final Board board;
  private final InferenceEngine engine;
  private final List<Move> history = Lists.newArrayList();
  private final Map<Cell, Integer> revealed = Maps.newHashMap();
  private Status status = Status.IN_PROGRESS;

  public Game(Board board, Random random) {
    this.board = checkNotNull(board);
    this.engine = new InferenceEngine(board.getDimensions(), random);
  }

  public Board getBoard() {
    return board;
  }

  public InferenceEngine getEngine() {
    return engine;
  }

  public Status getStatus() {
    return status;
  }

  public List<Move> getHistory() {
    return Collections.unmodifiableList(history);
  }

  /** The number of moves that were guesses rather than proven safe. */
  public int getGuessCount() {
    int count = 0;
    for (Move move : history)
      if (move.guess) ++count;
    return count;
  }

  /**
   * Makes one move: a proven-safe cell if there is one, otherwise a guess.
   * Returns the resulting status.
   */
  public Status step() {
    checkState(!status.isOver(), "Game is already over: %s", status);

    Cell cell = engine.chooseSafeMove();
    if (cell != null) return reveal(cell, false);

    // An unfinished game still has an unrevealed clear cell, and known mines
    // are real mines, so there is always a candidate.
    cell = engine.chooseRandomMove();
    checkState(cell != null, "No move left in an unfinished game");
    logger.fine("No safe moves, guessing " + cell);
    return reveal(cell, true);
  }

  /**
   * Reveals a cell of the caller's choosing.  Counts as a guess unless the
   * engine had proven the cell safe.  Returns the resulting status.
   */
  public Status reveal(Cell cell) {
    checkState(!status.isOver(), "Game is already over: %s", status);
    checkArgument(board.getDimensions().contains(cell), "%s is not on the board", cell);
    checkArgument(!engine.getMovesMade().contains(cell), "%s is already revealed", cell);
    return reveal(cell, engine.getStatus(cell) != CellStatus.SAFE);
  }

  private Status reveal(Cell cell, boolean guess) {
    if (board.isMine(cell)) {
      history.add(new Move(cell, guess, Move.EXPLODED));
      return finish(Status.LOST);
    }

    int count = board.nearbyMines(cell);
    history.add(new Move(cell, guess, count));
    revealed.put(cell, count);
    engine.recordObservation(cell, count);

    if (board.won(engine.getKnownMines()) || allClearCellsRevealed())
      return finish(Status.WON);
    return status;
  }

  /** Steps until the game is won or lost. */
  public Status play() {
    while (!status.isOver())
      step();
    return status;
  }

  /**
   * Draws the player's view of the board: the count for each revealed cell,
   * F for cells known to be mines, * for a mine that went off, and . for
   * everything else.
   */
  public String render() {
    Dimensions dimensions = board.getDimensions();
    Move last = history.isEmpty() ? null : history.get(history.size() - 1);
    StringBuilder sb = new StringBuilder();
    for (int row = 0; row < dimensions.height; ++row) {
      for (int column = 0; column < dimensions.width; ++column) {
        Cell cell = Cell.of(row, column);
        Integer count = revealed.get(cell);
        if (count != null)
          sb.append(count);
        else if (last != null && last.exploded() && last.cell.equals(cell))
          sb.append('*');
        else if (engine.getKnownMines().contains(cell))
          sb.append('F');
        else
          sb.append('.');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private boolean allClearCellsRevealed() {
    return revealed.size() == board.getDimensions().size() - board.getMines().size();
  }

  private Status finish(Status status) {
    this.status = status;
    logger.info("Game " + status + " after " + history.size() + " moves, "
        + getGuessCount() + " guesses");
    return status;
  }
}
