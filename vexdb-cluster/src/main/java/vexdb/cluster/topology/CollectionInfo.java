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

package vexdb.cluster.topology;

public final class CollectionInfo {
  public final String name;
  public final int shardCount;
  public final int replicationFactor;
  public final int writeConsistencyFactor;

  public CollectionInfo(String name, int shardCount, int replicationFactor, int writeConsistencyFactor) {
    this.name = name;
    this.shardCount = shardCount;
    this.replicationFactor = replicationFactor;
    this.writeConsistencyFactor = writeConsistencyFactor;
  }

  public CollectionInfo withShardCount(int newShardCount) {
    return new CollectionInfo(name, newShardCount, replicationFactor, writeConsistencyFactor);
  }

  public CollectionInfo withFactors(int newReplicationFactor, int newWriteConsistencyFactor) {
    return new CollectionInfo(name, shardCount, newReplicationFactor, newWriteConsistencyFactor);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CollectionInfo that = (CollectionInfo) o;
    return shardCount == that.shardCount
        && replicationFactor == that.replicationFactor
        && writeConsistencyFactor == that.writeConsistencyFactor
        && name.equals(that.name);
  }

  @Override
  public int hashCode() {
    int result = name.hashCode();
    result = 31 * result + shardCount;
    result = 31 * result + replicationFactor;
    result = 31 * result + writeConsistencyFactor;
    return result;
  }

  @Override
  public String toString() {
    return "CollectionInfo{" +
        "name='" + name + '\'' +
        ", shardCount=" + shardCount +
        ", replicationFactor=" + replicationFactor +
        ", writeConsistencyFactor=" + writeConsistencyFactor +
        '}';
  }
}
