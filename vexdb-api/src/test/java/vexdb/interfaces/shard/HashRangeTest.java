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

package vexdb.interfaces.shard;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;

public class HashRangeTest {
  @Test
  public void dividesTheHashSpaceIntoContiguousRangesWithoutGaps() {
    HashRange[] ranges = HashRange.divide(3);

    assertThat(ranges[0].start, is(0L));
    assertThat(ranges[0].end, is(equalTo(ranges[1].start)));
    assertThat(ranges[1].end, is(equalTo(ranges[2].start)));
    assertThat(ranges[2].end, is(HashRange.SPACE_SIZE));
  }

  @Test
  public void everyKeyFallsInExactlyOneRangeOfADivision() {
    HashRange[] ranges = HashRange.divide(4);

    for (int i = 0; i < 200; i++) {
      String key = "point-" + i;
      int owners = 0;
      for (HashRange range : ranges) {
        if (range.containsKey(key)) {
          owners++;
        }
      }
      assertThat(owners, is(1));
    }
  }

  @Test
  public void keyHashesAreUnsignedThirtyTwoBitValues() {
    for (int i = 0; i < 200; i++) {
      long hash = HashRange.hashKey("k" + i);
      assertThat(hash, is(greaterThanOrEqualTo(0L)));
      assertThat(hash, is(lessThan(HashRange.SPACE_SIZE)));
    }
  }

  @Test
  public void theTwoHalvesOfASplitCoverTheOriginalRange() {
    HashRange range = new HashRange(100, 301);

    assertThat(range.lowerHalf(), is(equalTo(new HashRange(100, 200))));
    assertThat(range.upperHalf(), is(equalTo(new HashRange(200, 301))));
  }

  @Test(expected = IllegalArgumentException.class)
  public void rejectsAnEmptyRange() {
    new HashRange(5, 5);
  }
}
