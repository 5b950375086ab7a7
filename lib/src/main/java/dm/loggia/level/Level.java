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

package dm.loggia.level;

import org.jetbrains.annotations.NotNull;

/**
 * Built-in log levels enumeration from less to more verbose.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public enum Level implements LogLevel {

  /**
   * Error logs notify unexpected events that are clearly an exception in the normal code
   * execution.
   */
  ERROR("Error"),

  /**
   * Warning logs are meant to notify events that are not completely unexpected, but might be a
   * clue that something wrong is happening.
   */
  WARN("Warn"),

  /**
   * Info logs describe the normal progress of the application.
   */
  INFO("Info"),

  /**
   * Debug logs are meant to describe in detail what's happening inside the code.
   */
  DEBUG("Debug"),

  /**
   * The most verbose log level.
   */
  TRACE("Trace");

  private final String mName;

  Level(@NotNull final String name) {
    mName = name;
  }

  @NotNull
  public String getName() {
    return mName;
  }
}
