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
 * Base class for custom log levels.
 * <p>
 * Equality is based on the runtime class only, so that all the instances of the same level class
 * are considered equal.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public abstract class AbstractLogLevel implements LogLevel {

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }

  @Override
  public boolean equals(final Object o) {
    return (this == o) || ((o != null) && (getClass() == o.getClass()));
  }

  @NotNull
  @Override
  public String toString() {
    return getName();
  }
}
