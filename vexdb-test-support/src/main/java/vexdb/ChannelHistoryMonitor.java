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

package vexdb;

import org.hamcrest.Matcher;
import org.hamcrest.StringDescription;
import org.jetlang.channels.Subscriber;
import org.jetlang.fibers.Fiber;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records every message published on a jetlang channel so that a test can wait for, or check
 * for, a message matching some matcher, regardless of whether the message arrived before or
 * after the test started waiting.
 */
public class ChannelHistoryMonitor<T> {
  private static final long DEFAULT_WAIT_SECONDS = 10;

  private final List<T> history = new ArrayList<>();

  public ChannelHistoryMonitor(Subscriber<T> channel, Fiber fiber) {
    channel.subscribe(fiber, this::record);
  }

  /**
   * Block until some message matching the matcher has been published, or throw an AssertionError
   * describing the messages received if none arrives in time.
   */
  public T waitFor(Matcher<? super T> matcher) {
    return waitFor(matcher, DEFAULT_WAIT_SECONDS, TimeUnit.SECONDS);
  }

  public T waitFor(Matcher<? super T> matcher, long timeout, TimeUnit unit) {
    final long deadline = System.nanoTime() + unit.toNanos(timeout);

    synchronized (history) {
      while (true) {
        for (T message : history) {
          if (matcher.matches(message)) {
            return message;
          }
        }

        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMillis <= 0) {
          throw new AssertionError(describeFailure(matcher));
        }

        try {
          history.wait(remainingMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new AssertionError("interrupted while waiting for " + StringDescription.toString(matcher));
        }
      }
    }
  }

  public boolean hasAny(Matcher<? super T> matcher) {
    synchronized (history) {
      return history.stream().anyMatch(matcher::matches);
    }
  }

  /**
   * Return the most recent message matching the matcher, or null if there is none.
   */
  public T getLatest(Matcher<? super T> matcher) {
    synchronized (history) {
      for (int i = history.size() - 1; i >= 0; i--) {
        if (matcher.matches(history.get(i))) {
          return history.get(i);
        }
      }
      return null;
    }
  }

  public void forgetHistory() {
    synchronized (history) {
      history.clear();
    }
  }

  private void record(T message) {
    synchronized (history) {
      history.add(message);
      history.notifyAll();
    }
  }

  private String describeFailure(Matcher<? super T> matcher) {
    StringDescription description = new StringDescription();
    description.appendText("timed out waiting for ").appendDescriptionOf(matcher);
    description.appendText("; received ").appendValueList("[", ", ", "]", history);
    return description.toString();
  }
}
