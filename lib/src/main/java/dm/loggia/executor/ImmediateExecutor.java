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

package dm.loggia.executor;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executor implementation just running the command in the same call to the {@code execute()}
 * method.
 * <p>
 * Created by davide-maestroni on 04/02/2018.
 */
class ImmediateExecutor implements Executor {

  private static final ImmediateExecutor sInstance = new ImmediateExecutor();

  private static final Logger sLogger = Logger.getLogger(ImmediateExecutor.class.getName());

  /**
   * Avoid explicit instantiation.
   */
  private ImmediateExecutor() {
  }

  @NotNull
  static ImmediateExecutor instance() {
    return sInstance;
  }

  public void execute(@NotNull final Runnable command) {
    try {
      command.run();

    } catch (final Throwable t) {
      sLogger.log(Level.WARNING, "Suppressed exception", t);
    }
  }
}
