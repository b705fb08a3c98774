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
package us.blanshard.minesweeper.inference;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.core.Dimensions;

import com.google.common.collect.ImmutableSortedSet;

import java.util.Arrays;
import java.util.Random;

public class TestHelper {
  public static Cell c(int row, int column) { return Cell.of(row, column); }
  public static ImmutableSortedSet<Cell> cs(Cell... cells) { return ImmutableSortedSet.copyOf(cells); }
  public static Constraint k(int count, Cell... cells) { return new Constraint(Arrays.asList(cells), count); }
  public static Dimensions d(int height, int width) { return Dimensions.of(height, width); }
  public static Board b(String s) { return Board.fromString(s); }
  public static InferenceEngine e(int height, int width) { return new InferenceEngine(d(height, width), new Random(0)); }
}
