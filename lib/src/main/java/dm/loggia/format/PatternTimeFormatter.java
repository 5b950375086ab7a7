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
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import dm.loggia.util.ConstantConditions;

/**
 * Time formatter printing the current date and time through a {@link DateTimeFormatter}
 * pattern.
 * <p>
 * The time is rendered in the zone of the clock. If the pattern is invalid, or cannot be applied
 * to a date time, the time is replaced by the {@link #FORMATTING_ERROR} text, while the rest of
 * the message is still printed.
 * <p>
 * Created by davide-maestroni on 03/30/2018.
 */
public class PatternTimeFormatter extends TimeFormatter {

  /**
   * The text printed in place of the time when the pattern cannot be applied.
   */
  public static final String FORMATTING_ERROR = "FORMATTING ERROR";

  private static final Logger sLogger = Logger.getLogger(PatternTimeFormatter.class.getName());

  private final DateTimeFormatter mFormatter;

  private final String mPattern;

  /**
   * Constructor.
   *
   * @param pattern the date time pattern.
   */
  public PatternTimeFormatter(@NotNull final String pattern) {
    this(Clock.systemDefaultZone(), pattern);
  }

  /**
   * Constructor.
   *
   * @param clock   the clock instance.
   * @param pattern the date time pattern.
   */
  public PatternTimeFormatter(@NotNull final Clock clock, @NotNull final String pattern) {
    super(clock);
    mPattern = ConstantConditions.notNull("pattern", pattern);
    mFormatter = compile(pattern);
  }

  @Nullable
  private static DateTimeFormatter compile(@NotNull final String pattern) {
    try {
      return DateTimeFormatter.ofPattern(pattern, Locale.ENGLISH);

    } catch (final IllegalArgumentException e) {
      sLogger.log(Level.FINE, "invalid date time pattern: " + pattern, e);
      return null;
    }
  }

  @NotNull
  public String getPattern() {
    return mPattern;
  }

  @NotNull
  @Override
  protected String formatTime(@NotNull final Instant instant) {
    final DateTimeFormatter formatter = mFormatter;
    if (formatter == null) {
      return FORMATTING_ERROR;
    }

    try {
      return formatter.format(ZonedDateTime.ofInstant(instant, getClock().getZone()));

    } catch (final DateTimeException e) {
      sLogger.log(Level.FINE, "cannot apply date time pattern: " + mPattern, e);
      return FORMATTING_ERROR;
    }
  }
}
