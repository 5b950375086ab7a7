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

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import dm.loggia.Logging;
import dm.loggia.backend.FileSink;
import dm.loggia.backend.LogSinks;
import dm.loggia.executor.ExecutorPool;

import static org.assertj.core.api.Assertions.assertThat;

public class LoggingSampleTest {

  @Rule
  public TemporaryFolder mFolder = new TemporaryFolder();

  @Test
  public void fileBackend() throws IOException {
    final File file = mFolder.newFile("sample.log");
    final FileSink sink = LogSinks.fileSink(file, false);
    try {
      final Logging logging = new Logging(ExecutorPool.immediateExecutor());
      logging.appendBackend(LoggingSample.newFileBackend(sink, ExecutorPool.immediateExecutor()));
      new LoggingSample(logging).run();

    } finally {
      sink.close();
    }

    final List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertThat(lines).hasSize(4);
    assertThat(lines.get(0)).matches("\\[\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2}\\] \\[Info\\] "
        + "starting");
    assertThat(lines.get(1)).endsWith("] [Debug] database: connecting");
    assertThat(lines.get(2)).endsWith("] [Warn] cache: cache miss");
    assertThat(lines.get(3)).endsWith("] [Error] done");
  }

  @Test
  public void mainWritesTheFile() throws IOException {
    final File file = mFolder.newFile("main.log");
    LoggingSample.main(new String[]{file.getPath()});
    final List<String> lines = Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    assertThat(lines).hasSize(4);
  }
}
