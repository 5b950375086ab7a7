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
import java.io.PrintStream;
import java.util.logging.Level;
import java.util.logging.Logger;

import dm.loggia.util.ConstantConditions;

/**
 * Utility class for creating and sharing sink instances.
 * <p>
 * Created by davide-maestroni on 04/04/2018.
 */
@SuppressWarnings("WeakerAccess")
public class LogSinks {

  private static final NullSink sNullSink = new NullSink();

  /**
   * Avoid explicit instantiation.
   */
  protected LogSinks() {
    ConstantConditions.avoid();
  }

  /**
   * Returns a new sink appending lines to the specified file.
   *
   * @param file the file to write.
   * @return the sink instance.
   * @throws java.io.IOException if the file cannot be opened.
   */
  @NotNull
  public static FileSink fileSink(@NotNull final File file) throws IOException {
    return fileSink(file, true);
  }

  /**
   * Returns a new sink writing lines to the specified file.
   *
   * @param file   the file to write.
   * @param append whether to append to the file existing content.
   * @return the sink instance.
   * @throws java.io.IOException if the file cannot be opened.
   */
  @NotNull
  public static FileSink fileSink(@NotNull final File file, final boolean append) throws
      IOException {
    return new FileSink(file, append);
  }

  /**
   * Returns a new sink forwarding messages to the {@code java.util.logging} logger with the
   * specified name.
   * <br>
   * Messages are logged with the {@code INFO} level, and styling is never supported.
   *
   * @param loggerName the logger name.
   * @return the sink instance.
   */
  @NotNull
  public static LogSink javaLoggingSink(@NotNull final String loggerName) {
    return new JavaLoggingSink(Logger.getLogger(ConstantConditions.notNull("loggerName",
        loggerName)));
  }

  /**
   * Returns the shared instance of a sink discarding all the messages.
   *
   * @return the sink instance.
   */
  @NotNull
  public static LogSink nullSink() {
    return sNullSink;
  }

  /**
   * Returns a sink printing lines to the standard error stream.
   *
   * @return the sink instance.
   */
  @NotNull
  public static LogSink standardError() {
    return streamSink(System.err, true);
  }

  /**
   * Returns a sink printing lines to the standard output stream.
   *
   * @return the sink instance.
   */
  @NotNull
  public static LogSink standardOutput() {
    return streamSink(System.out, true);
  }

  /**
   * Returns a sink printing lines to the specified stream.
   *
   * @param stream         the print stream.
   * @param styleSupported whether the stream is able to render styled text.
   * @return the sink instance.
   */
  @NotNull
  public static LogSink streamSink(@NotNull final PrintStream stream,
      final boolean styleSupported) {
    return new StreamSink(stream, styleSupported);
  }

  private static class JavaLoggingSink implements LogSink {

    private final Logger mLogger;

    private JavaLoggingSink(@NotNull final Logger logger) {
      mLogger = logger;
    }

    public void emit(@NotNull final String text) {
      mLogger.log(Level.INFO, text);
    }

    public boolean isStyleSupported() {
      return false;
    }

    @NotNull
    @Override
    public String toString() {
      return "JavaLoggingSink{" + mLogger.getName() + "}";
    }
  }

  private static class NullSink implements LogSink {

    public void emit(@NotNull final String text) {
    }

    public boolean isStyleSupported() {
      return false;
    }
  }

  private static class StreamSink implements LogSink {

    private final boolean mStyleSupported;

    private final PrintStream mStream;

    private StreamSink(@NotNull final PrintStream stream, final boolean styleSupported) {
      mStream = ConstantConditions.notNull("stream", stream);
      mStyleSupported = styleSupported;
    }

    public void emit(@NotNull final String text) {
      mStream.println(text);
    }

    public boolean isStyleSupported() {
      return mStyleSupported;
    }
  }
}
