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

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;

import dm.loggia.util.ConstantConditions;

/**
 * Sink appending each message as a new line of a text file.
 * <p>
 * Styling is never supported. Write failures are logged and the message is lost.
 * <p>
 * Created by davide-maestroni on 04/04/2018.
 */
public class FileSink implements LogSink, Closeable {

  private static final Charset UTF_8 = Charset.forName("UTF-8");

  private static final Logger sLogger = Logger.getLogger(FileSink.class.getName());

  private final File mFile;

  private final Object mMutex = new Object();

  private final Writer mWriter;

  /**
   * Constructor.
   *
   * @param file   the file to write.
   * @param append whether to append to the file existing content.
   * @throws java.io.IOException if the file cannot be opened.
   */
  public FileSink(@NotNull final File file, final boolean append) throws IOException {
    mFile = ConstantConditions.notNull("file", file);
    mWriter = new BufferedWriter(
        new OutputStreamWriter(new FileOutputStream(file, append), UTF_8));
  }

  public void close() throws IOException {
    synchronized (mMutex) {
      mWriter.close();
    }
  }

  public void emit(@NotNull final String text) {
    synchronized (mMutex) {
      try {
        mWriter.write(text);
        mWriter.write(System.getProperty("line.separator"));
        mWriter.flush();

      } catch (final IOException e) {
        sLogger.log(Level.WARNING, "cannot write to file: " + mFile, e);
      }
    }
  }

  @NotNull
  public File getFile() {
    return mFile;
  }

  public boolean isStyleSupported() {
    return false;
  }

  @NotNull
  @Override
  public String toString() {
    return "FileSink{" + mFile + "}";
  }
}
