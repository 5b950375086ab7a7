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

/**
 * Source filter modes enumeration.
 * <p>
 * Created by davide-maestroni on 03/28/2018.
 */
public enum FilterMode {

  /**
   * Only the sources in the filter are suppressed.
   */
  BLACKLIST,

  /**
   * Only the sources in the filter are let through.
   */
  WHITELIST
}
