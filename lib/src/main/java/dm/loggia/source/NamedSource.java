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

import dm.loggia.util.ConstantConditions;

/**
 * Source simply identified by a name.
 * <p>
 * Note that, like any other parameterized source, all the named sources are the same variant: a
 * filter including or excluding one of them affects all of them. Define a dedicated
 * {@link AbstractLogSource} subclass for each origin that must be filtered independently.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public class NamedSource extends AbstractLogSource {

  private final String mName;

  /**
   * Constructor.
   *
   * @param name the source name.
   */
  public NamedSource(@NotNull final String name) {
    mName = ConstantConditions.notNull("name", name);
  }

  @NotNull
  public String getName() {
    return mName;
  }
}
