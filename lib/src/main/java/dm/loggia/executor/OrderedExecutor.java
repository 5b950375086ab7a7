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

import java.util.ArrayDeque;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import dm.loggia.util.ConstantConditions;

/**
 * Executor decorator running the passed commands one at a time, in the same order as they are
 * submitted.
 * <p>
 * Each instance acts as the mailbox of an actor: commands are enqueued without blocking the
 * caller, and then consumed by a single command running on the wrapped executor, which keeps
 * draining the queue until it is empty. Different instances wrapping the same executor run
 * concurrently.
 * <p>
 * An exception or error thrown by a command is logged and does not prevent the following ones
 * from being run.
 * <br>
 * If the wrapped executor rejects the draining command, only the submitted command is discarded,
 * while the ones already in the queue are run by the next successful submission.
 * <p>
 * Created by davide-maestroni on 04/02/2018.
 */
class OrderedExecutor implements Executor {

  private static final Logger sLogger = Logger.getLogger(OrderedExecutor.class.getName());

  private final OrderedCommand mCommand = new OrderedCommand();

  private final Executor mExecutor;

  private final Object mMutex = new Object();

  private final ArrayDeque<Runnable> mQueue = new ArrayDeque<Runnable>();

  private boolean mIsPending;

  /**
   * Constructor.
   *
   * @param executor the wrapped instance.
   */
  private OrderedExecutor(@NotNull final Executor executor) {
    mExecutor = ConstantConditions.notNull("executor", executor);
  }

  /**
   * Returns a new ordered executor instance.
   *
   * @param executor the wrapped instance.
   * @return the executor instance.
   */
  @NotNull
  static OrderedExecutor of(@NotNull final Executor executor) {
    return new OrderedExecutor(executor);
  }

  public void execute(@NotNull final Runnable command) {
    ConstantConditions.notNull("command", command);
    synchronized (mMutex) {
      mQueue.add(command);
      if (mIsPending) {
        return;
      }

      mIsPending = true;
    }

    try {
      mExecutor.execute(mCommand);

    } catch (final RuntimeException e) {
      synchronized (mMutex) {
        mQueue.removeLastOccurrence(command);
        mIsPending = false;
      }

      throw e;
    }
  }

  /**
   * Runnable used to dequeue and run pending commands.
   */
  private class OrderedCommand implements Runnable {

    public void run() {
      while (true) {
        final Runnable command;
        synchronized (mMutex) {
          command = mQueue.poll();
          if (command == null) {
            mIsPending = false;
            return;
          }
        }

        try {
          command.run();

        } catch (final Throwable t) {
          sLogger.log(Level.WARNING, "Suppressed exception", t);
        }
      }
    }
  }
}
