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
 * The distinguished source of messages not coming from any specific origin.
 * <p>
 * Formatters never render its name. Note that the no source is not implicitly excluded by any
 * filter: it must be explicitly added to a filter like any other source.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public enum NoSource implements LogSource {

  INSTANCE;

  @NotNull
  public String getName() {
    return "";
  }
}
