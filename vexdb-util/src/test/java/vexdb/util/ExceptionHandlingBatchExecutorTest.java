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

import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;
import org.junit.After;
import org.junit.Test;

import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;

public class ExceptionHandlingBatchExecutorTest {
  private final MemoryChannel<Long> channel = new MemoryChannel<>();
  private final SettableFuture<Throwable> caught = SettableFuture.create();
  private final SettableFuture<Long> laterMessage = SettableFuture.create();

  private final Fiber fiber = new ThreadFiber(
      new RunnableExecutorImpl(new ExceptionHandlingBatchExecutor(caught::set)), null, true);

  @After
  public void disposeFiber() {
    fiber.dispose();
  }

  @Test
  public void passesExceptionsThrownOnTheFiberToTheHandler() throws Exception {
    channel.subscribe(fiber, (val) -> {
      throw new IndexOutOfBoundsException();
    });
    fiber.start();

    channel.publish(4L);

    assertThat(caught.get(10, TimeUnit.SECONDS), is(instanceOf(IndexOutOfBoundsException.class)));
  }

  @Test
  public void keepsRunningTasksAfterOneOfThemThrows() throws Exception {
    channel.subscribe(fiber, (val) -> {
      if (val == 1L) {
        throw new IllegalStateException();
      }
      laterMessage.set(val);
    });
    fiber.start();

    channel.publish(1L);
    channel.publish(2L);

    assertThat(laterMessage.get(10, TimeUnit.SECONDS), is(2L));
  }
}
