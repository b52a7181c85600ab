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
import org.jetbrains.annotations.NotNull;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Utilities for combining guava listenable futures with jetlang fibers.
 */
public class VexFutures {

  /**
   * Run success or failure on the fiber once the future completes. The failure consumer receives
   * the cause of the failure, not the wrapping ExecutionException.
   */
  public static <V> void addCallback(@NotNull final ListenableFuture<V> future,
                                     @NotNull final Consumer<? super V> success,
                                     @NotNull final Consumer<Throwable> failure,
                                     @NotNull Fiber fiber) {
    Runnable callbackListener = () -> {
      final V value;
      try {
        value = getUninterruptibly(future);
      } catch (ExecutionException e) {
        failure.accept(e.getCause() == null ? e : e.getCause());
        return;
      } catch (RuntimeException | Error e) {
        failure.accept(e);
        return;
      }
      success.accept(value);
    };
    future.addListener(callbackListener, fiber);
  }

  /**
   * Fail the settable future with the supplied exception if it is still pending after the given delay.
   * The timer runs on the fiber.
   */
  public static <V> SettableFuture<V> failAfter(@NotNull SettableFuture<V> future,
                                                long delay,
                                                @NotNull TimeUnit unit,
                                                @NotNull Supplier<? extends Throwable> exceptionSupplier,
                                                @NotNull Fiber fiber) {
    fiber.schedule(() -> {
      if (!future.isDone()) {
        future.setException(exceptionSupplier.get());
      }
    }, delay, unit);
    return future;
  }

  public static <V> V getUninterruptibly(@NotNull Future<V> future)
      throws ExecutionException {
    boolean interrupted = false;
    try {
      while (true) {
        try {
          return future.get();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
    } finally {
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
