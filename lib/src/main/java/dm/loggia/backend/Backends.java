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

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Executor;

import dm.loggia.util.ConstantConditions;

/**
 * Utility class for creating backend instances.
 * <p>
 * Created by davide-maestroni on 04/04/2018.
 */
@SuppressWarnings("WeakerAccess")
public class Backends {

  /**
   * Avoid explicit instantiation.
   */
  protected Backends() {
    ConstantConditions.avoid();
  }

  /**
   * Returns a new backend printing to the standard output.
   *
   * @return the backend instance.
   */
  @NotNull
  public static LoggingBackend consoleBackend() {
    return newBackend(LogSinks.standardOutput());
  }

  /**
   * Returns a new backend appending lines to the specified file.
   * <br>
   * Styling is never applied to the file content.
   *
   * @param file the file to write.
   * @return the backend instance.
   * @throws java.io.IOException if the file cannot be opened.
   */
  @NotNull
  public static LoggingBackend fileBackend(@NotNull final File file) throws IOException {
    return newBackend(LogSinks.fileSink(file));
  }

  /**
   * Returns a new backend writing to the specified sink.
   * <br>
   * The backend mailbox runs on the default executor.
   *
   * @param sink the sink instance.
   * @return the backend instance.
   * @see dm.loggia.executor.ExecutorPool#defaultExecutor()
   */
  @NotNull
  public static LoggingBackend newBackend(@NotNull final LogSink sink) {
    return new SinkBackend(sink);
  }

  /**
   * Returns a new backend writing to the specified sink.
   *
   * @param sink     the sink instance.
   * @param executor the executor running the backend mailbox.
   * @return the backend instance.
   */
  @NotNull
  public static LoggingBackend newBackend(@NotNull final LogSink sink,
      @NotNull final Executor executor) {
    return new SinkBackend(sink, executor);
  }
}
