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

import org.junit.rules.TestRule;
import org.junit.runner.Description;
import org.junit.runners.model.MultipleFailureException;
import org.junit.runners.model.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * JUnit rule which collects exceptions thrown on fibers, so that a test fails when one of its
 * fibers threw, even though the throw happened off the test thread. Pass the rule as the
 * handler of an {@code ExceptionHandlingBatchExecutor}; the collected throwables are rethrown
 * once the test method and its After methods have run.
 */
public class JUnitRuleFiberExceptions implements TestRule, Consumer<Throwable> {
  private final List<Throwable> throwables = Collections.synchronizedList(new ArrayList<>());

  @Override
  public void accept(Throwable throwable) {
    throwables.add(throwable);
  }

  @Override
  public Statement apply(Statement base, Description description) {
    return new Statement() {
      @Override
      public void evaluate() throws Throwable {
        base.evaluate();

        synchronized (throwables) {
          MultipleFailureException.assertEmpty(new ArrayList<>(throwables));
        }
      }
    };
  }
}
