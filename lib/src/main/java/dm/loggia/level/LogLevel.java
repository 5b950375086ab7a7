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
 * Interface defining a log severity.
 * <p>
 * Levels are compared by variant: two instances are equal when they are the same enum constant or
 * instances of the same class, independently of any data they carry. Custom levels should extend
 * {@link AbstractLogLevel}, which implements such equality.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 *
 * @see Level
 */
public interface LogLevel {

  /**
   * Returns the human readable name of the level.
   *
   * @return the level name.
   */
  @NotNull
  String getName();
}
