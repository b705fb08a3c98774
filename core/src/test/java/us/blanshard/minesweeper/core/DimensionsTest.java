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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class DimensionsTest {
  Dimensions dimensions = Dimensions.of(3, 4);

  @Test public void size() {
    assertEquals(12, dimensions.size());
    assertThat(dimensions.allCells()).hasSize(12);
  }

  @Test public void allCells_rowMajor() {
    assertThat(dimensions.allCells()).isInOrder();
    assertEquals(Cell.of(0, 0), dimensions.allCells().get(0));
    assertEquals(Cell.of(2, 3), dimensions.allCells().get(11));
  }

  @Test public void contains() {
    assertTrue(dimensions.contains(Cell.of(2, 3)));
    assertFalse(dimensions.contains(Cell.of(3, 0)));
    assertFalse(dimensions.contains(Cell.of(0, 4)));
  }

  @Test public void neighbors_corner() {
    assertThat(dimensions.neighbors(Cell.of(0, 0)))
        .containsExactly(Cell.of(0, 1), Cell.of(1, 0), Cell.of(1, 1)).inOrder();
  }

  @Test public void neighbors_edge() {
    assertThat(dimensions.neighbors(Cell.of(2, 1))).containsExactly(
        Cell.of(1, 0), Cell.of(1, 1), Cell.of(1, 2), Cell.of(2, 0), Cell.of(2, 2));
  }

  @Test public void neighbors_middle() {
    assertThat(dimensions.neighbors(Cell.of(1, 1))).hasSize(8);
    assertThat(dimensions.neighbors(Cell.of(1, 1))).doesNotContain(Cell.of(1, 1));
  }

  @Test public void neighbors_single() {
    assertThat(Dimensions.of(1, 1).neighbors(Cell.of(0, 0))).isEmpty();
  }

  @Test(expected = IllegalArgumentException.class) public void neighbors_offGrid() {
    dimensions.neighbors(Cell.of(3, 3));
  }

  @Test(expected = IllegalArgumentException.class) public void badDimensions() {
    Dimensions.of(0, 4);
  }

  @Test public void equality() {
    assertEquals(Dimensions.of(3, 4), dimensions);
    assertEquals(Dimensions.of(3, 4).hashCode(), dimensions.hashCode());
    assertEquals("3x4", dimensions.toString());
  }
}
