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
package us.blanshard.minesweeper.stats;

import static java.util.concurrent.TimeUnit.MICROSECONDS;
import static java.util.logging.Level.WARNING;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Dimensions;
import us.blanshard.minesweeper.game.Game;

import com.google.common.base.Stopwatch;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.io.PrintStream;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Plays a series of random Minesweeper games with the inference engine, and
 * spits out statistics about how it fared.
 *
 * @author Luke Blanshard
 */
public class PlayStats {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  /** Held so the level we set on it sticks. */
  private static final Logger gameLogger = Logger.getLogger("us.blanshard.minesweeper");

  private final Dimensions dimensions;
  private final int mineCount;
  private final SummaryStatistics moves = new SummaryStatistics();
  private final SummaryStatistics guesses = new SummaryStatistics();
  private final SummaryStatistics micros = new SummaryStatistics();
  private int wins;

  public PlayStats(Dimensions dimensions, int mineCount) {
    this.dimensions = dimensions;
    this.mineCount = mineCount;
  }

  public static void main(String[] args) {
    if (args.length < 4 || args.length > 5) exitWithUsage();
    Dimensions dimensions;
    int mineCount, count;
    long seed;
    try {
      dimensions = Dimensions.of(Integer.decode(args[0]), Integer.decode(args[1]));
      mineCount = Integer.decode(args[2]);
      count = Integer.decode(args[3]);
      seed = args.length > 4 ? Long.decode(args[4]) : System.currentTimeMillis();
    } catch (IllegalArgumentException e) {
      exitWithUsage();
      return;  // Convince the compiler.
    }
    if (mineCount < 0 || mineCount > dimensions.size() || count < 0) exitWithUsage();

    // One line per game is plenty; keep the per-game log quiet.
    gameLogger.setLevel(WARNING);

    System.out.printf("Playing %d games on %s with %d mines from seed %#x%n",
        count, dimensions, mineCount, seed);
    PlayStats stats = new PlayStats(dimensions, mineCount);
    stats.play(count, seed, System.out);
    System.out.println(GSON.toJson(stats.summarize()));
  }

  private static void exitWithUsage() {
    System.err.println("Usage: PlayStats <height> <width> <mines> <count> [<seed>]");
    System.exit(1);
  }

  /** Plays the given number of games, printing a line per game to the given stream. */
  public void play(int count, long seed, PrintStream out) {
    out.println("Seed\tStatus\tMoves\tGuesses\tMicros");
    Random random = new Random(seed);
    while (count-- > 0) {
      long gameSeed = random.nextLong();
      Random gameRandom = new Random(gameSeed);
      Game game = new Game(Board.random(dimensions, mineCount, gameRandom), gameRandom);

      Stopwatch stopwatch = Stopwatch.createStarted();
      Game.Status status = game.play();
      stopwatch.stop();

      add(game, stopwatch.elapsed(MICROSECONDS));
      out.printf("%#x\t%s\t%d\t%d\t%d%n", gameSeed, status, game.getHistory().size(),
          game.getGuessCount(), stopwatch.elapsed(MICROSECONDS));
    }
  }

  /** Folds a finished game into the running totals. */
  void add(Game game, long elapsedMicros) {
    if (game.getStatus() == Game.Status.WON) ++wins;
    moves.addValue(game.getHistory().size());
    guesses.addValue(game.getGuessCount());
    micros.addValue(elapsedMicros);
  }

  public long getGameCount() {
    return moves.getN();
  }

  public int getWins() {
    return wins;
  }

  /** Returns the totals so far as json. */
  public JsonObject summarize() {
    JsonObject object = new JsonObject();
    object.addProperty("dimensions", dimensions.toString());
    object.addProperty("mines", mineCount);
    object.addProperty("games", getGameCount());
    object.addProperty("wins", wins);
    object.addProperty("winRate", getGameCount() == 0 ? 0.0 : (double) wins / getGameCount());
    object.add("moves", describe(moves));
    object.add("guesses", describe(guesses));
    object.add("micros", describe(micros));
    return object;
  }

  private static JsonObject describe(SummaryStatistics stats) {
    JsonObject object = new JsonObject();
    object.addProperty("mean", stats.getN() == 0 ? 0.0 : stats.getMean());
    object.addProperty("stdDev", stats.getN() < 2 ? 0.0 : stats.getStandardDeviation());
    object.addProperty("max", stats.getN() == 0 ? 0.0 : stats.getMax());
    return object;
  }
}
