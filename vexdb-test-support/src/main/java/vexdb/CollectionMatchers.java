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

import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

import java.util.Collection;
import java.util.List;

public class CollectionMatchers {
  public static <T extends Comparable<T>> Matcher<List<T>> isStrictlyIncreasing() {
    return new TypeSafeMatcher<List<T>>() {
      @Override
      protected boolean matchesSafely(List<T> list) {
        for (int i = 1; i < list.size(); i++) {
          if (list.get(i).compareTo(list.get(i - 1)) <= 0) {
            return false;
          }
        }
        return true;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a list whose elements are strictly increasing");
      }
    };
  }

  /**
   * Matches a list of longs which runs first, first + 1, ... without gaps.
   */
  public static Matcher<List<Long>> isConsecutiveFrom(long first) {
    return new TypeSafeMatcher<List<Long>>() {
      @Override
      protected boolean matchesSafely(List<Long> list) {
        for (int i = 0; i < list.size(); i++) {
          if (list.get(i) != first + i) {
            return false;
          }
        }
        return true;
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("a list of consecutive values starting at ").appendValue(first);
      }
    };
  }

  public static <T> Matcher<T> isIn(Collection<T> collection) {
    return new TypeSafeMatcher<T>() {
      @Override
      protected boolean matchesSafely(T item) {
        return collection.contains(item);
      }

      @Override
      public void describeTo(Description description) {
        description.appendText("an item contained within the collection ")
            .appendValue(collection);
      }
    };
  }
}
