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

import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.PoolFiberFactory;

import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * FiberSupplier backed by a jetlang PoolFiberFactory; every fiber gets an
 * {@link ExceptionHandlingBatchExecutor} wrapping the caller's handler.
 */
public class PoolFiberSupplier implements FiberSupplier, AutoCloseable {
  private final PoolFiberFactory fiberFactory;

  public PoolFiberSupplier(ExecutorService executorService) {
    this.fiberFactory = new PoolFiberFactory(executorService);
  }

  @Override
  public Fiber getNewFiber(Consumer<Throwable> throwableHandler) {
    return fiberFactory.create(new ExceptionHandlingBatchExecutor(throwableHandler));
  }

  @Override
  public void close() {
    fiberFactory.dispose();
  }
}
