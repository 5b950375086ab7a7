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
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

import dm.loggia.backend.LoggingBackend;
import dm.loggia.executor.ExecutorPool;
import dm.loggia.format.LogFormatter;
import dm.loggia.level.Level;
import dm.loggia.level.LevelSet;
import dm.loggia.level.LogLevel;
import dm.loggia.source.LogSource;
import dm.loggia.source.NoSource;
import dm.loggia.source.SourceFilter;
import dm.loggia.util.ConstantConditions;

/**
 * Class dispatching log messages to a list of backends.
 * <p>
 * The instance behaves like an actor: each call is turned into a message processed by a private
 * mailbox, which in turn forwards the call to every registered backend, in registration order.
 * Forwarding never waits for the backends to process the call, so that, once the dispatcher is
 * done with a message, the backends might have not applied it yet.
 * <br>
 * Configuration calls are broadcast to all the backends in the same way, and each backend applies
 * them to its own state. The dispatcher never inspects the decisions taken by the backends.
 * <p>
 * Being a backend itself, a dispatcher can be registered into another one.
 * <p>
 * Created by davide-maestroni on 04/05/2018.
 */
@SuppressWarnings("WeakerAccess")
public class Logging implements LoggingBackend {

  private static final Logger sLogger = Logger.getLogger(Logging.class.getName());

  private final Executor mMailbox;

  private ArrayList<LoggingBackend> mBackends = new ArrayList<LoggingBackend>();

  /**
   * Creates a new dispatcher with no backends, running on the default executor.
   *
   * @see ExecutorPool#defaultExecutor()
   */
  public Logging() {
    this(ExecutorPool.defaultExecutor());
  }

  /**
   * Creates a new dispatcher with no backends.
   *
   * @param executor the executor running the dispatcher mailbox.
   */
  public Logging(@NotNull final Executor executor) {
    mMailbox = ExecutorPool.ordered(executor);
  }

  /**
   * Adds the specified backend to the end of the list.
   *
   * @param backend the backend instance.
   */
  public void appendBackend(@NotNull final LoggingBackend backend) {
    ConstantConditions.notNull("backend", backend);
    mMailbox.execute(new Runnable() {

      public void run() {
        mBackends.add(backend);
      }
    });
  }

  /**
   * Logs a debug message with no source.
   *
   * @param message the message.
   */
  public void debug(@Nullable final String message) {
    log(Level.DEBUG, message, NoSource.INSTANCE);
  }

  /**
   * Logs a debug message.
   *
   * @param message the message.
   * @param source  the source.
   */
  public void debug(@Nullable final String message, @NotNull final LogSource source) {
    log(Level.DEBUG, message, source);
  }

  public void disableLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final List<LogLevel> levelList = LevelSet.of(levels).getLevels();
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.disableLevels(levelList);
      }
    });
  }

  public void enableLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final List<LogLevel> levelList = LevelSet.of(levels).getLevels();
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.enableLevels(levelList);
      }
    });
  }

  /**
   * Logs an error message with no source.
   *
   * @param message the message.
   */
  public void err(@Nullable final String message) {
    log(Level.ERROR, message, NoSource.INSTANCE);
  }

  /**
   * Logs an error message.
   *
   * @param message the message.
   * @param source  the source.
   */
  public void err(@Nullable final String message, @NotNull final LogSource source) {
    log(Level.ERROR, message, source);
  }

  public void excludeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.excludeSource(source);
      }
    });
  }

  public void includeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.includeSource(source);
      }
    });
  }

  /**
   * Logs an info message with no source.
   *
   * @param message the message.
   */
  public void info(@Nullable final String message) {
    log(Level.INFO, message, NoSource.INSTANCE);
  }

  /**
   * Logs an info message.
   *
   * @param message the message.
   * @param source  the source.
   */
  public void info(@Nullable final String message, @NotNull final LogSource source) {
    log(Level.INFO, message, source);
  }

  public void log(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source) {
    ConstantConditions.notNull("level", level);
    ConstantConditions.notNull("source", source);
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.log(level, message, source);
      }
    });
  }

  /**
   * Replaces the list of backends.
   * <br>
   * A copy of the list is retained, so that later changes to the passed collection have no effect.
   * The removed backends are just discarded.
   *
   * @param backends the backend instances.
   */
  public void setBackends(@NotNull final Collection<? extends LoggingBackend> backends) {
    final ArrayList<LoggingBackend> backendList =
        new ArrayList<LoggingBackend>(ConstantConditions.notNullElements("backends", backends));
    mMailbox.execute(new Runnable() {

      public void run() {
        mBackends = backendList;
      }
    });
  }

  public void setFormatter(@NotNull final LogFormatter formatter) {
    ConstantConditions.notNull("formatter", formatter);
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.setFormatter(formatter);
      }
    });
  }

  public void setFormattingPreference(final boolean styled) {
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.setFormattingPreference(styled);
      }
    });
  }

  public void setLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final List<LogLevel> levelList = LevelSet.of(levels).getLevels();
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.setLevels(levelList);
      }
    });
  }

  public void setSourceFilter(@NotNull final SourceFilter filter) {
    final SourceFilter copy = ConstantConditions.notNull("filter", filter).copy();
    broadcast(new Broadcast() {

      public void sendTo(@NotNull final LoggingBackend backend) {
        backend.setSourceFilter(copy);
      }
    });
  }

  /**
   * Logs a trace message with no source.
   *
   * @param message the message.
   */
  public void trace(@Nullable final String message) {
    log(Level.TRACE, message, NoSource.INSTANCE);
  }

  /**
   * Logs a trace message.
   *
   * @param message the message.
   * @param source  the source.
   */
  public void trace(@Nullable final String message, @NotNull final LogSource source) {
    log(Level.TRACE, message, source);
  }

  /**
   * Logs a warning message with no source.
   *
   * @param message the message.
   */
  public void warn(@Nullable final String message) {
    log(Level.WARN, message, NoSource.INSTANCE);
  }

  /**
   * Logs a warning message.
   *
   * @param message the message.
   * @param source  the source.
   */
  public void warn(@Nullable final String message, @NotNull final LogSource source) {
    log(Level.WARN, message, source);
  }

  private void broadcast(@NotNull final Broadcast broadcast) {
    mMailbox.execute(new Runnable() {

      public void run() {
        for (final LoggingBackend backend : mBackends) {
          try {
            broadcast.sendTo(backend);

          } catch (final Throwable t) {
            sLogger.log(java.util.logging.Level.WARNING, "cannot forward call to: " + backend, t);
          }
        }
      }
    });
  }

  /**
   * Interface defining a call to be forwarded to each backend.
   */
  private interface Broadcast {

    void sendTo(@NotNull LoggingBackend backend);
  }
}
