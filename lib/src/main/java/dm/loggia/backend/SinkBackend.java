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
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import dm.loggia.executor.ExecutorPool;
import dm.loggia.format.Formatters;
import dm.loggia.format.LogFormatter;
import dm.loggia.level.LevelSet;
import dm.loggia.level.LogLevel;
import dm.loggia.source.FilterMode;
import dm.loggia.source.LogSource;
import dm.loggia.source.SourceFilter;
import dm.loggia.util.ConstantConditions;

/**
 * Backend implementation writing the formatted messages into a sink.
 * <p>
 * The instance behaves like an actor: each call is turned into a message processed by a private
 * mailbox, so that the backend state is only accessed by one thread at a time. Arguments are
 * validated and copied in the calling thread.
 * <p>
 * A new backend has all the built-in levels enabled, an empty blacklist filter, the basic
 * formatter and no styling preference.
 * <p>
 * Created by davide-maestroni on 04/03/2018.
 */
public class SinkBackend implements LoggingBackend {

  private static final Logger sLogger = Logger.getLogger(SinkBackend.class.getName());

  private final Executor mMailbox;

  private final LogSink mSink;

  private SourceFilter mFilter = new SourceFilter(FilterMode.BLACKLIST);

  private LogFormatter mFormatter = Formatters.basic();

  private LevelSet mLevels = LevelSet.all();

  private boolean mStyled;

  /**
   * Constructor.
   *
   * @param sink the sink instance.
   */
  public SinkBackend(@NotNull final LogSink sink) {
    this(sink, ExecutorPool.defaultExecutor());
  }

  /**
   * Constructor.
   *
   * @param sink     the sink instance.
   * @param executor the executor running the backend mailbox.
   */
  public SinkBackend(@NotNull final LogSink sink, @NotNull final Executor executor) {
    mSink = ConstantConditions.notNull("sink", sink);
    mMailbox = ExecutorPool.ordered(executor);
  }

  public void disableLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final LevelSet levelSet = LevelSet.of(levels);
    mMailbox.execute(new Runnable() {

      public void run() {
        final LevelSet current = mLevels;
        final LevelSet updated = current.without(levelSet.getLevels());
        if (updated != current) {
          mLevels = updated;
        }
      }
    });
  }

  public void enableLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final LevelSet levelSet = LevelSet.of(levels);
    mMailbox.execute(new Runnable() {

      public void run() {
        final LevelSet current = mLevels;
        final LevelSet updated = current.with(levelSet.getLevels());
        if (updated != current) {
          mLevels = updated;
        }
      }
    });
  }

  public void excludeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    mMailbox.execute(new Runnable() {

      public void run() {
        mFilter.excludeSource(source);
      }
    });
  }

  public void includeSource(@NotNull final LogSource source) {
    ConstantConditions.notNull("source", source);
    mMailbox.execute(new Runnable() {

      public void run() {
        mFilter.includeSource(source);
      }
    });
  }

  public void log(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source) {
    ConstantConditions.notNull("level", level);
    ConstantConditions.notNull("source", source);
    mMailbox.execute(new Runnable() {

      public void run() {
        write(level, message, source);
      }
    });
  }

  public void setFormatter(@NotNull final LogFormatter formatter) {
    ConstantConditions.notNull("formatter", formatter);
    mMailbox.execute(new Runnable() {

      public void run() {
        mFormatter = formatter;
      }
    });
  }

  public void setFormattingPreference(final boolean styled) {
    mMailbox.execute(new Runnable() {

      public void run() {
        mStyled = styled;
      }
    });
  }

  public void setLevels(@NotNull final Collection<? extends LogLevel> levels) {
    final LevelSet levelSet = LevelSet.of(levels);
    mMailbox.execute(new Runnable() {

      public void run() {
        mLevels = levelSet;
      }
    });
  }

  public void setSourceFilter(@NotNull final SourceFilter filter) {
    final SourceFilter copy = ConstantConditions.notNull("filter", filter).copy();
    mMailbox.execute(new Runnable() {

      public void run() {
        mFilter = copy;
      }
    });
  }

  @NotNull
  @Override
  public String toString() {
    return "SinkBackend{sink=" + mSink + "}";
  }

  private void write(@NotNull final LogLevel level, @Nullable final String message,
      @NotNull final LogSource source) {
    if (!mLevels.contains(level) || mFilter.isFiltered(source)) {
      return;
    }

    final LogSink sink = mSink;
    final String text;
    try {
      text = mFormatter.format(level, message, source, mStyled && sink.isStyleSupported());

    } catch (final Throwable t) {
      sLogger.log(Level.WARNING, "formatter " + mFormatter + " failed, message dropped", t);
      return;
    }

    try {
      sink.emit(text);

    } catch (final Throwable t) {
      sLogger.log(Level.WARNING, "sink " + sink + " failed, message dropped", t);
    }
  }
}
