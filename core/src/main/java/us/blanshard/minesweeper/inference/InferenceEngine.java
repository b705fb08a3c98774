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
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.core.Dimensions;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The knowledge a Minesweeper player has gathered about one game: the cells it
 * has revealed, the cells it has proven safe or mined, and the constraints it
 * holds about the rest.  Each observation is folded in and followed through to
 * every conclusion that follows from it with certainty.
 *
 * <p> Use one engine per game.  Not thread safe.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class InferenceEngine {
  private static final Logger logger = Logger.getLogger(InferenceEngine.class.getName());

  private final Dimensions dimensions;
  private final Random random;

  private final Set<Cell> movesMade = Sets.newTreeSet();
  private final Set<Cell> knownSafe = Sets.newTreeSet();
  private final Set<Cell> knownMine = Sets.newTreeSet();

  /** Live constraints, in the order they were learned; never empty or duplicated. */
  private final Set<Constraint> constraints = Sets.newLinkedHashSet();

  public InferenceEngine(Dimensions dimensions, Random random) {
    this.dimensions = checkNotNull(dimensions);
    this.random = checkNotNull(random);
  }

  public Dimensions getDimensions() {
    return dimensions;
  }

  /** The cells that have been revealed. */
  public Set<Cell> getMovesMade() {
    return Collections.unmodifiableSet(movesMade);
  }

  public Set<Cell> getKnownSafes() {
    return Collections.unmodifiableSet(knownSafe);
  }

  public Set<Cell> getKnownMines() {
    return Collections.unmodifiableSet(knownMine);
  }

  /** A snapshot of the live constraints. */
  public ImmutableList<Constraint> getConstraints() {
    return ImmutableList.copyOf(constraints);
  }

  public CellStatus getStatus(Cell cell) {
    if (knownSafe.contains(cell)) return CellStatus.SAFE;
    if (knownMine.contains(cell)) return CellStatus.MINE;
    return CellStatus.UNKNOWN;
  }

  /**
   * Records that the given cell is a mine, and takes it out of every constraint
   * that mentions it.  Does nothing if the cell is already known to be a mine.
   */
  public void markMine(Cell cell) {
    checkArgument(dimensions.contains(cell), "%s is not within %s", cell, dimensions);
    checkState(!knownSafe.contains(cell), "%s is already known to be safe", cell);
    if (knownMine.contains(cell)) return;

    List<Constraint> updated = Lists.newArrayList();
    for (Constraint constraint : constraints)
      updated.add(constraint.withoutMine(cell));
    knownMine.add(cell);
    replaceConstraints(updated);
    logger.fine("Mine at " + cell);
  }

  /**
   * Records that the given cell is safe, and takes it out of every constraint
   * that mentions it.  Does nothing if the cell is already known to be safe.
   */
  public void markSafe(Cell cell) {
    checkArgument(dimensions.contains(cell), "%s is not within %s", cell, dimensions);
    checkState(!knownMine.contains(cell), "%s is already known to be a mine", cell);
    if (knownSafe.contains(cell)) return;

    List<Constraint> updated = Lists.newArrayList();
    for (Constraint constraint : constraints)
      updated.add(constraint.withoutSafe(cell));
    knownSafe.add(cell);
    replaceConstraints(updated);
    logger.fine("Safe at " + cell);
  }

  /**
   * Takes in the fact that the given cell was revealed and found to touch the
   * given number of mines, and draws every conclusion that follows.
   */
  public void recordObservation(Cell cell, int adjacentMineCount) {
    checkArgument(dimensions.contains(cell), "%s is not within %s", cell, dimensions);
    ImmutableSortedSet<Cell> neighbors = dimensions.neighbors(cell);
    checkArgument(adjacentMineCount >= 0 && adjacentMineCount <= neighbors.size(),
        "%s can't touch %s mines", cell, adjacentMineCount);
    checkState(!knownMine.contains(cell), "%s is known to be a mine", cell);

    movesMade.add(cell);
    markSafe(cell);
    learn(new Constraint(neighbors, adjacentMineCount));
  }

  /**
   * Adds a constraint learned some other way than by revealing a cell, and
   * draws every conclusion that follows.  Cells whose status is already known
   * are taken out of it first.
   */
  public void addConstraint(Constraint constraint) {
    for (Cell cell : constraint.getCells())
      checkArgument(dimensions.contains(cell), "%s is not within %s", cell, dimensions);
    learn(constraint);
  }

  private void learn(Constraint constraint) {
    // Known mines take their share of the count with them.
    for (Cell cell : constraint.getCells()) {
      if (knownSafe.contains(cell))
        constraint = constraint.withoutSafe(cell);
      else if (knownMine.contains(cell))
        constraint = constraint.withoutMine(cell);
    }
    keep(constraint);
    propagate();
  }

  /**
   * Applies our two rules until neither produces anything new: cells that a
   * constraint settles on its own become known, and a constraint contained in
   * another one yields a constraint on the difference.
   */
  public void propagate() {
    int passes = 0;
    boolean changed = true;
    while (changed) {
      changed = false;
      ++passes;

      Set<Cell> safes = Sets.newTreeSet();
      Set<Cell> mines = Sets.newTreeSet();
      for (Constraint constraint : constraints) {
        safes.addAll(constraint.knownSafes());
        mines.addAll(constraint.knownMines());
      }
      for (Cell safe : safes) {
        if (!knownSafe.contains(safe)) {
          markSafe(safe);
          changed = true;
        }
      }
      for (Cell mine : mines) {
        if (!knownMine.contains(mine)) {
          markMine(mine);
          changed = true;
        }
      }

      List<Constraint> inferred = Lists.newArrayList();
      for (Constraint subset : constraints) {
        for (Constraint superset : constraints) {
          if (subset == superset || !subset.isSubsetOf(superset)) continue;
          Constraint difference = superset.minus(subset);
          if (!difference.isEmpty()
              && !constraints.contains(difference)
              && !inferred.contains(difference)) {
            inferred.add(difference);
          }
        }
      }
      for (Constraint constraint : inferred) {
        logger.finest("Inferred " + constraint);
        keep(constraint);
        changed = true;
      }
    }
    logger.finer("Fixed point after " + passes + " passes with " + constraints.size()
        + " constraints");
  }

  /**
   * Returns a cell known to be safe that hasn't been revealed yet, the first in
   * row-major order, or null if there is none.
   */
  @Nullable public Cell chooseSafeMove() {
    for (Cell cell : knownSafe)
      if (!movesMade.contains(cell)) return cell;
    return null;
  }

  /**
   * Returns a cell chosen at random from those neither revealed nor known to be
   * mines, or null if there are none left.
   */
  @Nullable public Cell chooseRandomMove() {
    List<Cell> candidates = Lists.newArrayList();
    for (Cell cell : dimensions.allCells())
      if (!movesMade.contains(cell) && !knownMine.contains(cell))
        candidates.add(cell);
    if (candidates.isEmpty()) return null;
    return candidates.get(random.nextInt(candidates.size()));
  }

  /** Swaps in reduced constraints, dropping those left empty or duplicated. */
  private void replaceConstraints(List<Constraint> updated) {
    constraints.clear();
    for (Constraint constraint : updated)
      keep(constraint);
  }

  private void keep(Constraint constraint) {
    if (!constraint.isEmpty()) constraints.add(constraint);
  }
}
