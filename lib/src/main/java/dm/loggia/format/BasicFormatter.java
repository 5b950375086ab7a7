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
import dm.loggia.source.Sources;

/**
 * Plain formatter producing messages like {@code "[source] Level: message"}.
 * <br>
 * The style flag is ignored.
 * <p>
 * Created by davide-maestroni on 03/29/2018.
 */
class BasicFormatter implements LogFormatter {

  private static final BasicFormatter sInstance = new BasicFormatter();

  /**
   * Avoid explicit instantiation.
   */
  private BasicFormatter() {
  }

  @NotNull
  static BasicFormatter instance() {
    return sInstance;
  }

  @NotNull
  public String format(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source, final boolean styled) {
    final StringBuilder builder = new StringBuilder();
    if (!Sources.isNoSource(source)) {
      builder.append('[').append(source.getName()).append("] ");
    }

    return builder.append(level.getName()).append(": ").append(message).toString();
  }
}
