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

import com.google.common.base.Preconditions;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;

/**
 * A half-open range {@code [start, end)} of the unsigned 32-bit key hash space. Keys are hashed
 * with Murmur3-32; the hash is read as an unsigned int, so the whole space is {@code [0, 2^32)}.
 */
public final class HashRange {
  public static final long SPACE_SIZE = 1L << 32;
  public static final HashRange FULL = new HashRange(0, SPACE_SIZE);

  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_32_fixed();

  public final long start;
  public final long end;

  public HashRange(long start, long end) {
    Preconditions.checkArgument(0 <= start && start < end && end <= SPACE_SIZE,
        "invalid hash range [%s, %s)", start, end);
    this.start = start;
    this.end = end;
  }

  public static long hashKey(String key) {
    return Integer.toUnsignedLong(HASH_FUNCTION.hashString(key, StandardCharsets.UTF_8).asInt());
  }

  /**
   * Split the whole space into count contiguous ranges of near-equal size.
   */
  public static HashRange[] divide(int count) {
    Preconditions.checkArgument(count > 0);
    HashRange[] ranges = new HashRange[count];
    for (int i = 0; i < count; i++) {
      ranges[i] = new HashRange(SPACE_SIZE * i / count, SPACE_SIZE * (i + 1) / count);
    }
    return ranges;
  }

  public boolean contains(long hash) {
    return start <= hash && hash < end;
  }

  public boolean containsKey(String key) {
    return contains(hashKey(key));
  }

  public long midpoint() {
    return start + (end - start) / 2;
  }

  public HashRange lowerHalf() {
    return new HashRange(start, midpoint());
  }

  public HashRange upperHalf() {
    return new HashRange(midpoint(), end);
  }

  public boolean isSplittable() {
    return end - start >= 2;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    HashRange that = (HashRange) o;
    return start == that.start && end == that.end;
  }

  @Override
  public int hashCode() {
    return 31 * Long.hashCode(start) + Long.hashCode(end);
  }

  @Override
  public String toString() {
    return "[" + start + ", " + end + ")";
  }
}
