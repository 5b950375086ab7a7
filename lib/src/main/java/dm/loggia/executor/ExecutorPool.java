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
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import dm.loggia.util.ConstantConditions;

/**
 * Utility class for creating and sharing executor instances.
 * <p>
 * Created by davide-maestroni on 04/02/2018.
 */
@SuppressWarnings("WeakerAccess")
public class ExecutorPool {

  private static final Object sMutex = new Object();

  private static ExecutorService sDefaultExecutor;

  /**
   * Avoid explicit instantiation.
   */
  protected ExecutorPool() {
    ConstantConditions.avoid();
  }

  /**
   * Returns the default instance of a thread pool asynchronous executor.
   * <p>
   * The pool threads are daemon ones, so that they never prevent the process from exiting.
   *
   * @return the executor instance.
   */
  @NotNull
  public static Executor defaultExecutor() {
    synchronized (sMutex) {
      if (sDefaultExecutor == null) {
        sDefaultExecutor =
            Executors.newCachedThreadPool(new DaemonThreadFactory("loggia-actor-thread"));
      }

      return sDefaultExecutor;
    }
  }

  /**
   * Returns the shared instance of an immediate executor.
   * <p>
   * The returned executor will immediately run any passed command in the calling thread.
   * <br>
   * Be careful when employing the returned executor, since all the actors using it will block the
   * caller until the messages are processed.
   *
   * @return the executor instance.
   */
  @NotNull
  public static Executor immediateExecutor() {
    return ImmediateExecutor.instance();
  }

  /**
   * Returns an executor running the passed commands one at a time, in submission order.
   * <p>
   * The returned instance is meant to be employed as an actor mailbox.
   *
   * @param executor the wrapped executor.
   * @return the executor instance.
   */
  @NotNull
  public static Executor ordered(@NotNull final Executor executor) {
    return OrderedExecutor.of(executor);
  }

  private static class DaemonThreadFactory implements ThreadFactory {

    private final AtomicInteger mCount = new AtomicInteger();

    private final String mName;

    private DaemonThreadFactory(@NotNull final String name) {
      mName = name;
    }

    public Thread newThread(@NotNull final Runnable runnable) {
      final Thread thread = new Thread(runnable, mName + "-" + mCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}
