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

package dm.loggia.source;

import org.jetbrains.annotations.NotNull;

/**
 * Interface defining the origin of a log message.
 * <p>
 * Sources are compared by variant: two instances are equal when they are the same enum constant
 * or instances of the same class, independently of any data they carry. Custom sources should
 * extend {@link AbstractLogSource}, which implements such equality.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 *
 * @see NoSource
 */
public interface LogSource {

  /**
   * Returns the name of the source as rendered in the log output.
   *
   * @return the source name.
   */
  @NotNull
  String getName();
}
