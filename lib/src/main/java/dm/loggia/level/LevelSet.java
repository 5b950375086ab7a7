/*
 * Copyright 2018 Davide Maestroni
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dm.loggia.level;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;

import dm.loggia.util.ConstantConditions;
import dm.loggia.util.Variants;

/**
 * Immutable set of enabled log levels.
 * <p>
 * Membership is based on variant equality. The expected number of levels is small, so lookups
 * just scan the internal list.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public final class LevelSet {

  private static final LevelSet sAll = new LevelSet(
      Collections.<LogLevel>unmodifiableList(new ArrayList<LogLevel>(EnumSet.allOf(Level.class))));

  private static final LevelSet sNone =
      new LevelSet(Collections.<LogLevel>unmodifiableList(new ArrayList<LogLevel>()));

  private final List<LogLevel> mLevels;

  private LevelSet(@NotNull final List<LogLevel> levels) {
    mLevels = levels;
  }

  /**
   * Returns the set of all the built-in levels.
   *
   * @return the level set.
   */
  @NotNull
  public static LevelSet all() {
    return sAll;
  }

  /**
   * Returns the empty set.
   *
   * @return the level set.
   */
  @NotNull
  public static LevelSet none() {
    return sNone;
  }

  /**
   * Returns a set containing the specified levels.
   * <br>
   * Duplicated variants are included only once.
   *
   * @param levels the levels.
   * @return the level set.
   */
  @NotNull
  public static LevelSet of(@NotNull final LogLevel... levels) {
    return of(Arrays.asList(ConstantConditions.notNull("levels", levels)));
  }

  /**
   * Returns a set containing the specified levels.
   * <br>
   * Duplicated variants are included only once. The returned set does not share any state with
   * the passed collection.
   *
   * @param levels the levels.
   * @return the level set.
   */
  @NotNull
  public static LevelSet of(@NotNull final Collection<? extends LogLevel> levels) {
    ConstantConditions.notNullElements("levels", levels);
    final ArrayList<LogLevel> list = new ArrayList<LogLevel>(levels.size());
    for (final LogLevel level : levels) {
      if (!Variants.containsVariant(list, level)) {
        list.add(level);
      }
    }

    return new LevelSet(Collections.unmodifiableList(list));
  }

  /**
   * Checks if the specified level is part of this set.
   *
   * @param level the level.
   * @return whether the level is contained.
   */
  public boolean contains(@NotNull final LogLevel level) {
    return Variants.containsVariant(mLevels, level);
  }

  /**
   * Returns the levels in this set.
   *
   * @return the unmodifiable list of levels.
   */
  @NotNull
  public List<LogLevel> getLevels() {
    return mLevels;
  }

  @Override
  public int hashCode() {
    int hashCode = 0;
    for (final LogLevel level : mLevels) {
      hashCode += Variants.variantHashCode(level);
    }

    return hashCode;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof LevelSet)) {
      return false;
    }

    final List<LogLevel> levels = ((LevelSet) o).mLevels;
    if (levels.size() != mLevels.size()) {
      return false;
    }

    for (final LogLevel level : levels) {
      if (!contains(level)) {
        return false;
      }
    }

    return true;
  }

  public boolean isEmpty() {
    return mLevels.isEmpty();
  }

  public int size() {
    return mLevels.size();
  }

  @NotNull
  @Override
  public String toString() {
    return "LevelSet{" + mLevels + "}";
  }

  /**
   * Returns a set containing the levels of this one, but the specified ones.
   * <br>
   * If none of the levels is part of this set, this very instance is returned.
   *
   * @param levels the levels to remove.
   * @return the level set.
   */
  @NotNull
  public LevelSet without(@NotNull final Collection<? extends LogLevel> levels) {
    ConstantConditions.notNullElements("levels", levels);
    final ArrayList<LogLevel> list = new ArrayList<LogLevel>(mLevels.size());
    for (final LogLevel level : mLevels) {
      if (!Variants.containsVariant(levels, level)) {
        list.add(level);
      }
    }

    return (list.size() != mLevels.size()) ? new LevelSet(Collections.unmodifiableList(list))
        : this;
  }

  /**
   * Returns a set containing the levels of this one, plus the specified ones.
   * <br>
   * If all the levels are already part of this set, this very instance is returned.
   *
   * @param levels the levels to add.
   * @return the level set.
   */
  @NotNull
  public LevelSet with(@NotNull final Collection<? extends LogLevel> levels) {
    ConstantConditions.notNullElements("levels", levels);
    ArrayList<LogLevel> list = null;
    for (final LogLevel level : levels) {
      if (!Variants.containsVariant((list != null) ? list : mLevels, level)) {
        if (list == null) {
          list = new ArrayList<LogLevel>(mLevels);
        }

        list.add(level);
      }
    }

    return (list != null) ? new LevelSet(Collections.unmodifiableList(list)) : this;
  }
}
