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

import java.time.Clock;
import java.time.Instant;

/**
 * Time formatter printing the number of seconds elapsed since the formatter creation.
 * <p>
 * The elapsed time is computed by subtracting the creation seconds and nanoseconds from the
 * current ones, borrowing a second when the nanoseconds difference is negative. Since no
 * monotonic clock is employed, the printed time becomes negative if the system time moves back
 * before the creation instant: for example, half a second before creation is printed as
 * {@code -1.500}.
 * <p>
 * Created by davide-maestroni on 03/30/2018.
 */
public class RelativeTimeFormatter extends TimeFormatter {

  private static final int NANOS_PER_SECOND = 1000000000;

  private final Instant mCreation;

  private final boolean mWithFraction;

  /**
   * Constructor.
   *
   * @param withFraction whether to print the milliseconds fraction.
   */
  public RelativeTimeFormatter(final boolean withFraction) {
    this(Clock.systemUTC(), withFraction);
  }

  /**
   * Constructor.
   *
   * @param clock        the clock instance.
   * @param withFraction whether to print the milliseconds fraction.
   */
  public RelativeTimeFormatter(@NotNull final Clock clock, final boolean withFraction) {
    super(clock);
    mCreation = clock.instant();
    mWithFraction = withFraction;
  }

  @NotNull
  @Override
  protected String formatTime(@NotNull final Instant instant) {
    final Instant creation = mCreation;
    long seconds = instant.getEpochSecond() - creation.getEpochSecond();
    int nanos = instant.getNano() - creation.getNano();
    if (nanos < 0) {
      --seconds;
      nanos += NANOS_PER_SECOND;
    }

    return printSeconds(seconds, nanos, mWithFraction);
  }
}
