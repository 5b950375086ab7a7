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

import dm.loggia.level.LogLevel;
import dm.loggia.source.LogSource;

/**
 * Interface defining an object formatting log messages into text.
 * <p>
 * Implementations must be pure and must never throw: when part of the output cannot be produced,
 * a fixed placeholder text has to be rendered in its place. Formatter instances may be shared by
 * any number of backends, and are invoked from several threads.
 * <p>
 * Created by davide-maestroni on 03/29/2018.
 */
public interface LogFormatter {

  /**
   * Formats the specified log message.
   *
   * @param level   the log level.
   * @param message the log message.
   * @param source  the log source.
   * @param styled  whether the output may contain styling (like ANSI escapes).
   * @return the formatted text.
   */
  @NotNull
  String format(@NotNull LogLevel level, @Nullable String message, @NotNull LogSource source,
      boolean styled);
}
