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

package dm.loggia.sample;

import org.jetbrains.annotations.NotNull;

import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.concurrent.Executor;

import dm.loggia.Logging;
import dm.loggia.backend.Backends;
import dm.loggia.backend.FileSink;
import dm.loggia.backend.LogSinks;
import dm.loggia.backend.LoggingBackend;
import dm.loggia.executor.ExecutorPool;
import dm.loggia.format.Formatters;
import dm.loggia.level.Level;
import dm.loggia.source.AbstractLogSource;
import dm.loggia.source.Sources;

/**
 * Sample wiring a console and a file backend to the same dispatcher.
 * <p>
 * Everything runs on the immediate executor, so that all the messages are written before the
 * main method returns.
 */
public class LoggingSample {

  private final Logging mLogging;

  public LoggingSample(@NotNull final Logging logging) {
    mLogging = logging;
  }

  public static void main(final String[] args) throws IOException {
    final Executor executor = ExecutorPool.immediateExecutor();
    final Logging logging = new Logging(executor);
    final LoggingBackend console = Backends.newBackend(LogSinks.standardOutput(), executor);
    console.setFormatter(Formatters.ansi());
    console.setFormattingPreference(true);
    logging.appendBackend(console);
    if (args.length == 0) {
      new LoggingSample(logging).run();
      return;
    }

    final FileSink sink = LogSinks.fileSink(new File(args[0]), false);
    try {
      logging.appendBackend(newFileBackend(sink, executor));
      new LoggingSample(logging).run();

    } finally {
      sink.close();
    }
  }

  @NotNull
  public static LoggingBackend newFileBackend(@NotNull final FileSink sink,
      @NotNull final Executor executor) {
    final LoggingBackend backend = Backends.newBackend(sink, executor);
    backend.setFormatter(Formatters.patternTime("yyyy-MM-dd HH:mm:ss"));
    backend.disableLevels(Collections.singletonList(Level.TRACE));
    return backend;
  }

  public void run() {
    final Logging logging = mLogging;
    logging.info("starting");
    logging.debug("connecting", new DatabaseSource());
    logging.trace("handshake completed", new DatabaseSource());
    logging.excludeSource(new DatabaseSource());
    logging.debug("query executed", new DatabaseSource());
    logging.warn("cache miss", Sources.named("cache"));
    logging.err("done");
  }

  private static class DatabaseSource extends AbstractLogSource {

    @NotNull
    public String getName() {
      return "database";
    }
  }
}
