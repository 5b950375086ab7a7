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

import dm.loggia.level.Level;
import dm.loggia.level.LogLevel;
import dm.loggia.source.LogSource;
import dm.loggia.source.Sources;

/**
 * Formatter producing messages like {@code "[Level] source: message"}, optionally decorated with
 * ANSI escape sequences.
 * <p>
 * When styling is allowed, the level is colored based on its severity and the source name is
 * bold. Styling is always reset before the next segment.
 * <p>
 * Created by davide-maestroni on 03/29/2018.
 */
class AnsiFormatter implements LogFormatter {

  static final String BOLD = "\u001B[1m";

  static final String BRIGHT_BLUE = "\u001B[94m";

  static final String BRIGHT_CYAN = "\u001B[96m";

  static final String BRIGHT_GREEN = "\u001B[92m";

  static final String BRIGHT_RED = "\u001B[91m";

  static final String BRIGHT_YELLOW = "\u001B[93m";

  static final String RESET = "\u001B[0m";

  static final String YELLOW = "\u001B[33m";

  private static final AnsiFormatter sInstance = new AnsiFormatter();

  /**
   * Avoid explicit instantiation.
   */
  private AnsiFormatter() {
  }

  @NotNull
  static AnsiFormatter instance() {
    return sInstance;
  }

  @NotNull
  private static String colorOf(@NotNull final LogLevel level) {
    if (level instanceof Level) {
      switch ((Level) level) {
        case ERROR:
          return BRIGHT_RED;
        case WARN:
          return YELLOW;
        case INFO:
          return BRIGHT_GREEN;
        case DEBUG:
          return BRIGHT_BLUE;
        case TRACE:
          return BRIGHT_CYAN;
        default:
          break;
      }
    }

    return BRIGHT_YELLOW;
  }

  @NotNull
  public String format(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source, final boolean styled) {
    final StringBuilder builder = new StringBuilder();
    if (styled) {
      builder.append(colorOf(level)).append('[').append(level.getName()).append(RESET).append("] ");

    } else {
      builder.append('[').append(level.getName()).append("] ");
    }

    if (!Sources.isNoSource(source)) {
      if (styled) {
        builder.append(BOLD).append(source.getName()).append(RESET).append(": ");

      } else {
        builder.append(source.getName()).append(": ");
      }
    }

    return builder.append(message).toString();
  }
}
