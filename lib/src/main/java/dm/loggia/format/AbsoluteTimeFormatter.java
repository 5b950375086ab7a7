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
 * Time formatter printing the number of seconds since the epoch.
 * <p>
 * Created by davide-maestroni on 03/30/2018.
 */
public class AbsoluteTimeFormatter extends TimeFormatter {

  private final boolean mWithFraction;

  /**
   * Constructor.
   *
   * @param withFraction whether to print the milliseconds fraction.
   */
  public AbsoluteTimeFormatter(final boolean withFraction) {
    this(Clock.systemUTC(), withFraction);
  }

  /**
   * Constructor.
   *
   * @param clock        the clock instance.
   * @param withFraction whether to print the milliseconds fraction.
   */
  public AbsoluteTimeFormatter(@NotNull final Clock clock, final boolean withFraction) {
    super(clock);
    mWithFraction = withFraction;
  }

  @NotNull
  @Override
  protected String formatTime(@NotNull final Instant instant) {
    return printSeconds(instant.getEpochSecond(), instant.getNano(), mWithFraction);
  }
}
