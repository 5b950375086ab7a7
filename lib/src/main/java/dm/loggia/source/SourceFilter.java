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

package dm.loggia.source;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import dm.loggia.util.ConstantConditions;
import dm.loggia.util.Variants;

/**
 * Filter deciding which log sources are suppressed.
 * <p>
 * In {@link FilterMode#BLACKLIST} mode a source is suppressed if it is part of the filter, while
 * in {@link FilterMode#WHITELIST} mode it is suppressed if it is not. Including and excluding a
 * source take the mode into account, and do nothing when the source is already in the requested
 * state.
 * <p>
 * Sources are compared by variant (see {@link LogSource}). Filters are expected to contain a few
 * sources, so lookups just scan the internal list.
 * <p>
 * The class is not thread safe.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public class SourceFilter {

  private final FilterMode mMode;

  private final ArrayList<LogSource> mSources;

  /**
   * Creates a new empty filter.
   *
   * @param mode the filter mode.
   */
  public SourceFilter(@NotNull final FilterMode mode) {
    this(mode, new ArrayList<LogSource>());
  }

  private SourceFilter(@NotNull final FilterMode mode,
      @NotNull final ArrayList<LogSource> sources) {
    mMode = ConstantConditions.notNull("mode", mode);
    mSources = sources;
  }

  /**
   * Creates a new filter suppressing only the specified sources.
   *
   * @param sources the suppressed sources.
   * @return the filter instance.
   */
  @NotNull
  public static SourceFilter blacklist(@NotNull final LogSource... sources) {
    return newFilter(FilterMode.BLACKLIST, sources);
  }

  /**
   * Creates a new filter suppressing all but the specified sources.
   *
   * @param sources the allowed sources.
   * @return the filter instance.
   */
  @NotNull
  public static SourceFilter whitelist(@NotNull final LogSource... sources) {
    return newFilter(FilterMode.WHITELIST, sources);
  }

  @NotNull
  private static SourceFilter newFilter(@NotNull final FilterMode mode,
      @NotNull final LogSource... sources) {
    final SourceFilter filter = new SourceFilter(mode);
    for (final LogSource source : ConstantConditions.notNullElements("sources",
        Arrays.asList(ConstantConditions.notNull("sources", sources)))) {
      filter.add(source);
    }

    return filter;
  }

  /**
   * Returns a copy of this filter.
   * <br>
   * The returned instance does not share any state with this one.
   *
   * @return the filter copy.
   */
  @NotNull
  public SourceFilter copy() {
    return new SourceFilter(mMode, new ArrayList<LogSource>(mSources));
  }

  /**
   * Makes the specified source be suppressed.
   *
   * @param source the source.
   */
  public void excludeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    if (mMode == FilterMode.BLACKLIST) {
      add(source);

    } else {
      remove(source);
    }
  }

  @NotNull
  public FilterMode getMode() {
    return mMode;
  }

  /**
   * Returns the sources currently part of the filter.
   *
   * @return the unmodifiable list of sources.
   */
  @NotNull
  public List<LogSource> getSources() {
    return Collections.unmodifiableList(new ArrayList<LogSource>(mSources));
  }

  @Override
  public int hashCode() {
    int hashCode = mMode.hashCode();
    for (final LogSource source : mSources) {
      hashCode += Variants.variantHashCode(source);
    }

    return hashCode;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }

    if (!(o instanceof SourceFilter)) {
      return false;
    }

    final SourceFilter that = (SourceFilter) o;
    if ((mMode != that.mMode) || (mSources.size() != that.mSources.size())) {
      return false;
    }

    for (final LogSource source : that.mSources) {
      if (!Variants.containsVariant(mSources, source)) {
        return false;
      }
    }

    return true;
  }

  @NotNull
  @Override
  public String toString() {
    return "SourceFilter{mode=" + mMode + ", sources=" + mSources + "}";
  }

  /**
   * Makes the specified source be let through.
   *
   * @param source the source.
   */
  public void includeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    if (mMode == FilterMode.BLACKLIST) {
      remove(source);

    } else {
      add(source);
    }
  }

  /**
   * Checks if the specified source is suppressed by this filter.
   *
   * @param source the source.
   * @return whether the source is suppressed.
   */
  public boolean isFiltered(@NotNull final LogSource source) {
    final boolean contained = Variants.containsVariant(mSources, source);
    return (mMode == FilterMode.BLACKLIST) == contained;
  }

  private void add(@NotNull final LogSource source) {
    if (!Variants.containsVariant(mSources, source)) {
      mSources.add(source);
    }
  }

  private void remove(@NotNull final LogSource source) {
    final Iterator<LogSource> iterator = mSources.iterator();
    while (iterator.hasNext()) {
      if (Variants.isSameVariant(iterator.next(), source)) {
        iterator.remove();
        return;
      }
    }
  }
}
