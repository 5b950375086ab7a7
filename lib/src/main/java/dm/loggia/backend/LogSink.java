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

/**
 * Interface defining the final destination of formatted log messages.
 * <p>
 * Created by davide-maestroni on 04/03/2018.
 *
 * @see LogSinks
 */
public interface LogSink {

  /**
   * Writes the specified text as a single unit, typically a line.
   * <br>
   * The method is expected to return quickly and must not throw.
   *
   * @param text the formatted message.
   */
  void emit(@NotNull String text);

  /**
   * Checks if this sink is able to render styled text, like ANSI escape sequences.
   *
   * @return whether styling is supported.
   */
  boolean isStyleSupported();
}
