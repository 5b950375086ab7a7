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

package dm.loggia;

import org.jetbrains.annotations.NotNull;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import dm.loggia.backend.Backends;
import dm.loggia.backend.LoggingBackend;
import dm.loggia.executor.ExecutorPool;
import dm.loggia.format.Formatters;
import dm.loggia.level.Level;
import dm.loggia.level.LogLevel;
import dm.loggia.source.AbstractLogSource;
import dm.loggia.source.NoSource;
import dm.loggia.source.SourceFilter;
import dm.loggia.source.Sources;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Logging dispatcher unit tests.
 * <p>
 * Created by davide-maestroni on 04/08/2018.
 */
public class LoggingTest {

  private static final Executor sImmediate = ExecutorPool.immediateExecutor();

  @NotNull
  private static LoggingBackend newBackend(@NotNull final RecordingSink sink) {
    return Backends.newBackend(sink, sImmediate);
  }

  @Test
  public void asynchronousBroadcast() throws InterruptedException {
    final Logging logging = new Logging();
    final RecordingSink first = new RecordingSink();
    final RecordingSink second = new RecordingSink();
    logging.appendBackend(Backends.newBackend(first));
    logging.appendBackend(Backends.newBackend(second));
    logging.setLevels(Collections.singletonList(Level.ERROR));
    logging.info("lost");
    logging.err("first");
    logging.enableLevels(Collections.singletonList(Level.INFO));
    logging.info("second");
    assertThat(first.awaitLines(2, 10, TimeUnit.SECONDS)).containsExactly("Error: first",
        "Info: second");
    assertThat(second.awaitLines(2, 10, TimeUnit.SECONDS)).containsExactly("Error: first",
        "Info: second");
  }

  @Test
  public void broadcastFanOut() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink warnSink = new RecordingSink();
    final LoggingBackend warnBackend = newBackend(warnSink);
    warnBackend.setLevels(Arrays.asList(Level.ERROR, Level.WARN));
    final RecordingSink errorSink = new RecordingSink();
    final LoggingBackend errorBackend = newBackend(errorSink);
    errorBackend.setLevels(Collections.singletonList(Level.ERROR));
    final RecordingSink noSourceSink = new RecordingSink();
    final LoggingBackend noSourceBackend = newBackend(noSourceSink);
    noSourceBackend.excludeSource(NoSource.INSTANCE);
    logging.appendBackend(warnBackend);
    logging.appendBackend(errorBackend);
    logging.appendBackend(noSourceBackend);
    logging.log(Level.WARN, "m", NoSource.INSTANCE);
    assertThat(warnSink.getLines()).containsExactly("Warn: m");
    assertThat(errorSink.getLines()).isEmpty();
    assertThat(noSourceSink.getLines()).isEmpty();
  }

  @Test
  public void configurationIsBroadcast() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink first = new RecordingSink(true);
    final RecordingSink second = new RecordingSink(false);
    logging.setBackends(Arrays.asList(newBackend(first), newBackend(second)));
    logging.setFormatter(Formatters.ansi());
    logging.setFormattingPreference(true);
    logging.setSourceFilter(SourceFilter.whitelist(new DatabaseSource()));
    logging.includeSource(NoSource.INSTANCE);
    logging.disableLevels(Collections.singletonList(Level.TRACE));
    logging.trace("lost");
    logging.debug("debug");
    logging.warn("lost", new CacheSource());
    logging.err("error", new DatabaseSource());
    logging.excludeSource(new DatabaseSource());
    logging.info("lost", new DatabaseSource());
    assertThat(first.getLines()).containsExactly("\u001B[94m[Debug\u001B[0m] debug",
        "\u001B[91m[Error\u001B[0m] \u001B[1mdb\u001B[0m: error");
    assertThat(second.getLines()).containsExactly("[Debug] debug", "[Error] db: error");
  }

  @Test
  public void convenienceMethods() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink sink = new RecordingSink();
    logging.appendBackend(newBackend(sink));
    logging.err("e");
    logging.warn("w");
    logging.info("i");
    logging.debug("d");
    logging.trace("t");
    logging.err("e", Sources.named("X"));
    logging.warn("w", Sources.named("X"));
    logging.info("i", Sources.named("X"));
    logging.debug("d", Sources.named("X"));
    logging.trace("t", Sources.named("X"));
    assertThat(sink.getLines()).containsExactly("Error: e", "Warn: w", "Info: i", "Debug: d",
        "Trace: t", "[X] Error: e", "[X] Warn: w", "[X] Info: i", "[X] Debug: d",
        "[X] Trace: t");
  }

  @Test
  public void emptyDispatcher() {
    final Logging logging = new Logging(sImmediate);
    logging.setLevels(Collections.<LogLevel>emptyList());
    logging.excludeSource(NoSource.INSTANCE);
    logging.err("nobody listens");
  }

  @Test
  public void nestedDispatchers() {
    final Logging outer = new Logging(sImmediate);
    final Logging inner = new Logging(sImmediate);
    final RecordingSink sink = new RecordingSink();
    inner.appendBackend(newBackend(sink));
    outer.appendBackend(inner);
    outer.setLevels(Collections.singletonList(Level.WARN));
    outer.warn("kept");
    outer.info("lost");
    assertThat(sink.getLines()).containsExactly("Warn: kept");
  }

  @Test
  public void setBackendsReplacesTheList() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink first = new RecordingSink();
    final RecordingSink second = new RecordingSink();
    final LoggingBackend firstBackend = newBackend(first);
    final LoggingBackend secondBackend = newBackend(second);
    logging.appendBackend(firstBackend);
    logging.appendBackend(secondBackend);
    logging.setBackends(Collections.singletonList(secondBackend));
    logging.info("m");
    assertThat(first.getLines()).isEmpty();
    assertThat(second.getLines()).containsExactly("Info: m");
  }

  @Test
  public void setBackendsRetainsACopy() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink first = new RecordingSink();
    final RecordingSink second = new RecordingSink();
    final ArrayList<LoggingBackend> backends = new ArrayList<LoggingBackend>();
    backends.add(newBackend(first));
    logging.setBackends(backends);
    backends.add(newBackend(second));
    logging.info("m");
    assertThat(first.getLines()).containsExactly("Info: m");
    assertThat(second.getLines()).isEmpty();
  }

  @Test
  public void setLevelsRetainsACopy() {
    final Logging logging = new Logging(sImmediate);
    final RecordingSink sink = new RecordingSink();
    logging.appendBackend(newBackend(sink));
    final List<LogLevel> levels = new ArrayList<LogLevel>();
    levels.add(Level.ERROR);
    logging.setLevels(levels);
    levels.add(Level.INFO);
    logging.info("lost");
    logging.err("kept");
    assertThat(sink.getLines()).containsExactly("Error: kept");
  }

  @Test(expected = NullPointerException.class)
  public void nullBackendFails() {
    new Logging(sImmediate).appendBackend(null);
  }

  @Test(expected = NullPointerException.class)
  public void nullBackendElementFails() {
    new Logging(sImmediate).setBackends(Collections.<LoggingBackend>singletonList(null));
  }

  private static class CacheSource extends AbstractLogSource {

    @NotNull
    public String getName() {
      return "cache";
    }
  }

  private static class DatabaseSource extends AbstractLogSource {

    @NotNull
    public String getName() {
      return "db";
    }
  }
}
