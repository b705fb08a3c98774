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

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.core.Dimensions;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.lang.reflect.Type;
import java.util.List;

/**
 * Static methods that convert finished games to and from json summaries.
 *
 * @author Luke Blanshard
 */
public class GameJson {
  public static final Splitter SPLITTER = Splitter.on(',');
  public static final Joiner JOINER = Joiner.on(',');

  /** A Type to use with {@link Gson} for game histories. */
  public static final Type HISTORY_TYPE = new TypeToken<List<Move>>(){}.getType();

  /** A convenience for reading/writing history. */
  public static final Gson HISTORY_GSON = registerHistory(new GsonBuilder()).create();

  /**
   * Registers a type adapter in the given builder so that history lists can be
   * serialized and deserialized.
   */
  public static GsonBuilder registerHistory(GsonBuilder builder) {
    builder.registerTypeAdapter(Move.class, new TypeAdapter<Move>() {
      @Override public void write(JsonWriter out, Move value) throws IOException {
        out.value(value.toJsonValue());
      }
      @Override public Move read(JsonReader in) throws IOException {
        return Move.fromJsonValue(in.nextString());
      }
    });
    return builder;
  }

  /** Summarizes the given game: its board, how it ended, and every move made. */
  public static JsonObject toJson(Game game) {
    Board board = game.getBoard();
    JsonObject object = new JsonObject();
    object.addProperty("height", board.getDimensions().height);
    object.addProperty("width", board.getDimensions().width);
    JsonArray mines = new JsonArray();
    for (Cell mine : board.getMines())
      mines.add(new JsonPrimitive(JOINER.join(mine.row, mine.column)));
    object.add("mines", mines);
    object.addProperty("status", game.getStatus().name());
    object.addProperty("guesses", game.getGuessCount());
    object.add("history", HISTORY_GSON.toJsonTree(game.getHistory(), HISTORY_TYPE));
    return object;
  }

  /** Recovers the board from a summary produced by {@link #toJson}. */
  public static Board toBoard(JsonObject object) {
    Dimensions dimensions =
        Dimensions.of(object.get("height").getAsInt(), object.get("width").getAsInt());
    ImmutableSortedSet.Builder<Cell> mines = ImmutableSortedSet.naturalOrder();
    JsonArray array = object.getAsJsonArray("mines");
    for (int i = 0; i < array.size(); ++i) {
      List<String> parts = Lists.newArrayList(SPLITTER.split(array.get(i).getAsString()));
      if (parts.size() != 2)
        throw new IllegalArgumentException("Bad mine: " + array.get(i));
      mines.add(Cell.of(Integer.parseInt(parts.get(0)), Integer.parseInt(parts.get(1))));
    }
    return new Board(dimensions, mines.build());
  }

  /** Recovers the move history from a summary produced by {@link #toJson}. */
  public static List<Move> toHistory(JsonObject object) {
    return HISTORY_GSON.fromJson(object.get("history"), HISTORY_TYPE);
  }

  // Static methods only.
  private GameJson() {}
}
