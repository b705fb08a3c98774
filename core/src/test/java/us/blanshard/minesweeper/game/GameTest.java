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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static us.blanshard.minesweeper.inference.TestHelper.b;
import static us.blanshard.minesweeper.inference.TestHelper.c;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.core.Dimensions;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.Set;

public class GameTest {
  Game game = new Game(b(
      "*..\n" +
      "...\n" +
      "...\n"), new Random(0));

  @Test public void reveal_thenPlay() {
    assertEquals(Game.Status.IN_PROGRESS, game.reveal(c(2, 2)));
    assertEquals(Game.Status.WON, game.play());

    assertThat(game.getEngine().getKnownMines()).containsExactly(c(0, 0));
    assertEquals(1, game.getGuessCount());
    assertThat(game.getHistory()).containsExactly(
        new Move(c(2, 2), true, 0),
        new Move(c(1, 1), false, 1),
        new Move(c(1, 2), false, 0),
        new Move(c(0, 1), false, 1),
        new Move(c(0, 2), false, 0),
        new Move(c(2, 0), false, 0)).inOrder();
    assertEquals(
        "F10\n" +
        ".10\n" +
        "0.0\n",
        game.render());
  }

  @Test(expected = IllegalStateException.class) public void step_afterGameOver() {
    game.reveal(c(2, 2));
    game.play();
    game.step();
  }

  @Test(expected = IllegalArgumentException.class) public void reveal_twice() {
    game.reveal(c(2, 2));
    game.reveal(c(2, 2));
  }

  @Test(expected = IllegalArgumentException.class) public void reveal_offBoard() {
    game.reveal(c(3, 0));
  }

  @Test public void reveal_provenSafe_notAGuess() {
    game.reveal(c(2, 2));
    game.reveal(c(1, 2));
    assertEquals(1, game.getGuessCount());
  }

  @Test public void step_lost() {
    Game lost = new Game(b("*"), new Random(0));
    assertEquals(Game.Status.LOST, lost.step());
    assertThat(lost.getHistory()).containsExactly(new Move(c(0, 0), true, Move.EXPLODED));
    assertEquals("*\n", lost.render());
  }

  @Test public void step_noMines() {
    Game clear = new Game(b("..\n.."), new Random(0));
    assertEquals(Game.Status.WON, clear.step());
    assertThat(clear.getHistory()).hasSize(1);
  }

  @Test public void step_unfinishedGameAlwaysHasAMove() {
    Dimensions[] shapes = {Dimensions.of(1, 10), Dimensions.of(4, 4), Dimensions.of(6, 6)};
    int[] mineCounts = {3, 15, 20};
    for (int shape = 0; shape < shapes.length; ++shape) {
      for (int seed = 0; seed < 40; ++seed) {
        Random random = new Random(seed);
        Board board = Board.random(shapes[shape], mineCounts[shape], random);
        Game game = new Game(board, random);
        while (!game.getStatus().isOver()) {
          assertThat(game.getEngine().chooseRandomMove()).isNotNull();
          game.step();
        }
      }
    }
  }

  @Test public void play_randomBoards() {
    for (int seed = 0; seed < 30; ++seed) {
      Random random = new Random(seed);
      Board board = Board.random(Dimensions.of(8, 8), 8, random);
      Game game = new Game(board, random);
      Game.Status status = game.play();
      assertTrue(status.isOver());

      List<Move> history = game.getHistory();
      Set<Cell> cells = Sets.newHashSet();
      int guesses = 0;
      for (int i = 0; i < history.size(); ++i) {
        Move move = history.get(i);
        assertTrue("repeated " + move, cells.add(move.cell));
        if (move.guess) ++guesses;
        else assertFalse(board.isMine(move.cell));
        assertEquals(i == history.size() - 1 && status == Game.Status.LOST, move.exploded());
      }
      assertEquals(guesses, game.getGuessCount());
      assertThat(guesses).isAtLeast(1);

      if (status == Game.Status.WON) {
        assertTrue(board.won(game.getEngine().getKnownMines())
            || history.size() == board.getDimensions().size() - board.getMines().size());
      }
      assertThat(board.getMines()).containsAtLeastElementsIn(game.getEngine().getKnownMines());
    }
  }
}
