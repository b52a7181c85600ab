/*
 * Copyright (C) 2014  Ohm Data
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU Affero General Public License as
 *  published by the Free Software Foundation, either version 3 of the
 *  License, or (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU Affero General Public License for more details.
 *
 *  You should have received a copy of the GNU Affero General Public License
 *  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package vexdb.util;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * An ExecutorService wrapper which accepts tasks with an associated string key, and guarantees
 * that all tasks associated with a given key will be run serially, in the order they are
 * submitted, by the wrapped ExecutorService.
 * <p>
 * This implementation is safe for use by multiple threads. However, if there are multiple task
 * submissions for the same key without a happens-before relationship, the implementation can make
 * no guarantee about the order in which those tasks are executed.
 */
public class WrappingKeySerializingExecutor implements KeySerializingExecutor {
  private static final Logger LOG = LoggerFactory.getLogger(WrappingKeySerializingExecutor.class);

  private final ExecutorService executorService;
  private final Map<String, KeyQueue> keyQueues = new ConcurrentHashMap<>();

  private volatile boolean shutdown = false;

  public WrappingKeySerializingExecutor(ExecutorService executorService) {
    this.executorService = executorService;
  }

  @Override
  public <T> ListenableFuture<T> submit(String key, CheckedSupplier<T, Exception> task) {
    if (shutdown) {
      throw new RejectedExecutionException("WrappingKeySerializingExecutor already shut down");
    }

    SettableFuture<T> taskFinishedFuture = SettableFuture.create();
    enqueueOrRunTask(() -> {
      try {
        taskFinishedFuture.set(task.get());
      } catch (Throwable t) {
        LOG.error("Error executing task for key {}", key, t);
        taskFinishedFuture.setException(t);
      }
    }, keyQueues.computeIfAbsent(key, k -> new KeyQueue()));

    return taskFinishedFuture;
  }

  @Override
  public void shutdownAndAwaitTermination(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
    synchronized (this) {
      if (shutdown) {
        return;
      }
      shutdown = true;
    }

    final CountDownLatch flushed = new CountDownLatch(keyQueues.size());
    for (KeyQueue queue : keyQueues.values()) {
      enqueueOrRunTask(flushed::countDown, queue);
    }
    flushed.await(timeout, unit);

    executorService.shutdown();
    if (!executorService.awaitTermination(timeout, unit)) {
      throw new TimeoutException("WrappingKeySerializingExecutor#shutdown");
    }
  }

  /**
   * Add a Runnable to the queue, and then run it if the queue was empty before adding it.
   * Otherwise it will be run as the queue is consumed.
   */
  private void enqueueOrRunTask(Runnable runnable, KeyQueue queue) {
    if (queue.checkEmptyAndAdd(runnable)) {
      runOnExecutor(runnable, queue);
    }
  }

  private void runOnExecutor(Runnable runnable, KeyQueue queue) {
    executorService.execute(() -> {
      runnable.run();
      Runnable nextTask = queue.discardHeadThenPeek();
      if (nextTask != null) {
        runOnExecutor(nextTask, queue);
      }
    });
  }

  private static class KeyQueue {
    private final Queue<Runnable> queue = new ArrayDeque<>();

    synchronized boolean checkEmptyAndAdd(Runnable item) {
      boolean empty = queue.isEmpty();
      queue.add(item);
      return empty;
    }

    synchronized Runnable discardHeadThenPeek() {
      queue.poll();
      return queue.peek();
    }
  }
}
