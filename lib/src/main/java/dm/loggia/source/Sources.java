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

import dm.loggia.util.ConstantConditions;

/**
 * Utility class for creating and identifying log sources.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public class Sources {

  /**
   * Avoid explicit instantiation.
   */
  protected Sources() {
    ConstantConditions.avoid();
  }

  /**
   * Checks if the specified source is the no source.
   *
   * @param source the source.
   * @return whether the source is the no source.
   */
  public static boolean isNoSource(@NotNull final LogSource source) {
    return (source == NoSource.INSTANCE);
  }

  /**
   * Returns a new source with the specified name.
   *
   * @param name the source name.
   * @return the source instance.
   * @see NamedSource
   */
  @NotNull
  public static LogSource named(@NotNull final String name) {
    return new NamedSource(name);
  }

  /**
   * Returns the no source instance.
   *
   * @return the source instance.
   */
  @NotNull
  public static LogSource noSource() {
    return NoSource.INSTANCE;
  }
}
