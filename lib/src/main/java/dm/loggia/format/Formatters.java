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

package dm.loggia.format;

import org.jetbrains.annotations.NotNull;

import dm.loggia.util.ConstantConditions;

/**
 * Utility class for creating and sharing formatter instances.
 * <p>
 * Created by davide-maestroni on 03/29/2018.
 */
public class Formatters {

  /**
   * Avoid explicit instantiation.
   */
  protected Formatters() {
    ConstantConditions.avoid();
  }

  /**
   * Returns a formatter printing the seconds elapsed since the epoch.
   *
   * @param withFraction whether to print the milliseconds fraction.
   * @return the formatter instance.
   */
  @NotNull
  public static LogFormatter absoluteTime(final boolean withFraction) {
    return new AbsoluteTimeFormatter(withFraction);
  }

  /**
   * Returns the shared instance of the ANSI formatter.
   * <p>
   * The formatter produces messages like {@code "[Level] source: message"}, coloring the level and
   * making the source bold, when styling is allowed.
   *
   * @return the formatter instance.
   */
  @NotNull
  public static LogFormatter ansi() {
    return AnsiFormatter.instance();
  }

  /**
   * Returns the shared instance of the basic formatter.
   * <p>
   * The formatter produces messages like {@code "[source] Level: message"}.
   *
   * @return the formatter instance.
   */
  @NotNull
  public static LogFormatter basic() {
    return BasicFormatter.instance();
  }

  /**
   * Returns a formatter printing the current date and time through the specified pattern.
   *
   * @param pattern the {@link java.time.format.DateTimeFormatter} pattern.
   * @return the formatter instance.
   * @see PatternTimeFormatter
   */
  @NotNull
  public static LogFormatter patternTime(@NotNull final String pattern) {
    return new PatternTimeFormatter(pattern);
  }

  /**
   * Returns a formatter printing the seconds elapsed since its creation.
   *
   * @param withFraction whether to print the milliseconds fraction.
   * @return the formatter instance.
   * @see RelativeTimeFormatter
   */
  @NotNull
  public static LogFormatter relativeTime(final boolean withFraction) {
    return new RelativeTimeFormatter(withFraction);
  }
}
