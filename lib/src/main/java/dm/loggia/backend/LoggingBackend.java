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

package dm.loggia.backend;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

import dm.loggia.format.LogFormatter;
import dm.loggia.level.LogLevel;
import dm.loggia.source.LogSource;
import dm.loggia.source.SourceFilter;

/**
 * Interface defining a logging backend.
 * <p>
 * All the methods are asynchronous: they return immediately, while the requested operation is
 * processed later, one at a time and in the same order as the calls. Hence, a configuration
 * change is guaranteed to apply to the log calls made after it only when both are issued by the
 * same thread.
 * <br>
 * None of the methods report failures: a suppressed message is simply not written.
 * <p>
 * Created by davide-maestroni on 04/03/2018.
 */
public interface LoggingBackend {

  /**
   * Disables the specified levels.
   *
   * @param levels the levels to disable.
   */
  void disableLevels(@NotNull Collection<? extends LogLevel> levels);

  /**
   * Enables the specified levels, in addition to the already enabled ones.
   *
   * @param levels the levels to enable.
   */
  void enableLevels(@NotNull Collection<? extends LogLevel> levels);

  /**
   * Makes the source filter suppress the specified source.
   *
   * @param source the source.
   * @see SourceFilter#excludeSource(LogSource)
   */
  void excludeSource(@NotNull LogSource source);

  /**
   * Makes the source filter let the specified source through.
   *
   * @param source the source.
   * @see SourceFilter#includeSource(LogSource)
   */
  void includeSource(@NotNull LogSource source);

  /**
   * Logs the specified message.
   * <br>
   * The message is written only if the level is enabled and the source is not filtered.
   *
   * @param level   the log level.
   * @param message the log message.
   * @param source  the log source.
   */
  void log(@NotNull LogLevel level, @Nullable String message, @NotNull LogSource source);

  /**
   * Sets the formatter of the log messages.
   *
   * @param formatter the formatter instance.
   */
  void setFormatter(@NotNull LogFormatter formatter);

  /**
   * Sets the preference about styling the log output.
   * <br>
   * The preference is just a hint, since styling is never applied when the output does not support
   * it.
   *
   * @param styled whether the output should be styled.
   */
  void setFormattingPreference(boolean styled);

  /**
   * Sets the enabled levels, replacing the current ones.
   *
   * @param levels the levels to enable.
   */
  void setLevels(@NotNull Collection<? extends LogLevel> levels);

  /**
   * Sets the source filter, replacing the current one.
   * <br>
   * A copy of the filter is retained, so that later changes to the passed instance have no effect.
   *
   * @param filter the filter instance.
   */
  void setSourceFilter(@NotNull SourceFilter filter);
}
