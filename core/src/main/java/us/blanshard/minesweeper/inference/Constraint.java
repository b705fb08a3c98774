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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.minesweeper.core.Cell;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;

import java.util.Collection;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * A fact about a Minesweeper board: exactly {@link #getCount count} of the
 * given cells are mines.  Constraints are values; the engine replaces them
 * rather than changing them as it learns more about their cells.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Constraint {
  private static final Joiner JOINER = Joiner.on(", ");

  private final ImmutableSortedSet<Cell> cells;
  private final int count;
  private final int hashCode;

  public Constraint(Collection<Cell> cells, int count) {
    this.cells = ImmutableSortedSet.copyOf(cells);
    this.count = count;
    this.hashCode = Objects.hashCode(this.cells, count);
    checkArgument(count >= 0 && count <= this.cells.size(),
        "Impossible mine count %s for %s cells", count, this.cells.size());
  }

  public ImmutableSortedSet<Cell> getCells() {
    return cells;
  }

  public int getCount() {
    return count;
  }

  public boolean isEmpty() {
    return cells.isEmpty();
  }

  public boolean contains(Cell cell) {
    return cells.contains(cell);
  }

  /** Returns all the cells if every one of them must be a mine, else nothing. */
  public ImmutableSortedSet<Cell> knownMines() {
    return count == cells.size() ? cells : ImmutableSortedSet.<Cell>of();
  }

  /** Returns all the cells if none of them can be a mine, else nothing. */
  public ImmutableSortedSet<Cell> knownSafes() {
    return count == 0 ? cells : ImmutableSortedSet.<Cell>of();
  }

  public boolean isSubsetOf(Constraint that) {
    return that.cells.containsAll(this.cells);
  }

  /**
   * Given a subset of this constraint, returns the constraint on the cells that
   * are only in this one: they must hold the mines the subset doesn't.  Throws
   * IllegalStateException if the two constraints contradict each other.
   */
  public Constraint minus(Constraint subset) {
    checkArgument(subset.isSubsetOf(this), "%s is not a subset of %s", subset, this);
    Set<Cell> remaining = Sets.difference(this.cells, subset.cells);
    int remainingCount = this.count - subset.count;
    checkState(remainingCount >= 0 && remainingCount <= remaining.size(),
        "%s contradicts %s", subset, this);
    return new Constraint(remaining, remainingCount);
  }

  /** Returns this constraint with the given cell, known to be safe, removed. */
  public Constraint withoutSafe(Cell cell) {
    if (!cells.contains(cell)) return this;
    checkState(count < cells.size(), "%s can't be safe under %s", cell, this);
    return new Constraint(Sets.difference(cells, ImmutableSortedSet.of(cell)), count);
  }

  /** Returns this constraint with the given cell, known to be a mine, removed. */
  public Constraint withoutMine(Cell cell) {
    if (!cells.contains(cell)) return this;
    checkState(count > 0, "%s can't be a mine under %s", cell, this);
    return new Constraint(Sets.difference(cells, ImmutableSortedSet.of(cell)), count - 1);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Constraint)) return false;
    Constraint that = (Constraint) o;
    return this.hashCode == that.hashCode
        && this.count == that.count
        && this.cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return hashCode;
  }

  @Override public String toString() {
    return "{" + JOINER.join(cells) + "} = " + count;
  }
}
