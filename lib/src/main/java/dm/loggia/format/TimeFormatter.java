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
import org.jetbrains.annotations.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

import dm.loggia.level.LogLevel;
import dm.loggia.source.LogSource;
import dm.loggia.source.Sources;
import dm.loggia.util.ConstantConditions;

/**
 * Abstract implementation of a formatter prefixing messages with a timestamp.
 * <p>
 * The produced messages look like {@code "[time] [Level] source: message"}, where the source
 * segment is omitted for the no source. The style flag is ignored.
 * <p>
 * Note that time is read from a wall clock, so the output is subject to visible jumps when the
 * system time gets adjusted.
 * <p>
 * Created by davide-maestroni on 03/30/2018.
 */
public abstract class TimeFormatter implements LogFormatter {

  private static final Locale DEFAULT_LOCALE = Locale.ENGLISH;

  private final Clock mClock;

  /**
   * Constructor.
   *
   * @param clock the clock instance.
   */
  protected TimeFormatter(@NotNull final Clock clock) {
    mClock = ConstantConditions.notNull("clock", clock);
  }

  /**
   * Prints the specified seconds, optionally followed by the milliseconds fraction.
   *
   * @param seconds      the number of seconds.
   * @param nanos        the nanoseconds adjustment, in the range 0 to 999,999,999.
   * @param withFraction whether to print the milliseconds fraction.
   * @return the printed time.
   */
  @NotNull
  protected static String printSeconds(final long seconds, final int nanos,
      final boolean withFraction) {
    if (withFraction) {
      return String.format(DEFAULT_LOCALE, "%d.%03d", seconds, nanos / 1000000);
    }

    return Long.toString(seconds);
  }

  @NotNull
  public final String format(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source, final boolean styled) {
    final StringBuilder builder = new StringBuilder();
    builder.append('[')
           .append(formatTime(mClock.instant()))
           .append("] [")
           .append(level.getName())
           .append("] ");
    if (!Sources.isNoSource(source)) {
      builder.append(source.getName()).append(": ");
    }

    return builder.append(message).toString();
  }

  /**
   * Returns the clock employed by this formatter.
   *
   * @return the clock instance.
   */
  @NotNull
  protected Clock getClock() {
    return mClock;
  }

  /**
   * Formats the specified instant.
   * <br>
   * The method must never throw.
   *
   * @param instant the current instant.
   * @return the formatted time.
   */
  @NotNull
  protected abstract String formatTime(@NotNull Instant instant);
}
