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

/**
 * A shard transfer registered in the committed topology: the peer toPeer is being filled with
 * the contents of shard sourceShardId, copied from fromPeer. The source differs from the shard
 * itself only for the transfers that populate the new half of a split shard.
 */
public final class ShardTransferInfo {
  public final String collection;
  public final long shardId;
  public final long fromPeer;
  public final long toPeer;
  public final long sourceShardId;

  public ShardTransferInfo(String collection, long shardId, long fromPeer, long toPeer, long sourceShardId) {
    this.collection = collection;
    this.shardId = shardId;
    this.fromPeer = fromPeer;
    this.toPeer = toPeer;
    this.sourceShardId = sourceShardId;
  }

  public boolean isSplit() {
    return sourceShardId != shardId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ShardTransferInfo that = (ShardTransferInfo) o;
    return shardId == that.shardId
        && fromPeer == that.fromPeer
        && toPeer == that.toPeer
        && sourceShardId == that.sourceShardId
        && collection.equals(that.collection);
  }

  @Override
  public int hashCode() {
    int result = collection.hashCode();
    result = 31 * result + Long.hashCode(shardId);
    result = 31 * result + Long.hashCode(fromPeer);
    result = 31 * result + Long.hashCode(toPeer);
    result = 31 * result + Long.hashCode(sourceShardId);
    return result;
  }

  @Override
  public String toString() {
    return "ShardTransferInfo{" +
        "collection='" + collection + '\'' +
        ", shardId=" + shardId +
        ", fromPeer=" + fromPeer +
        ", toPeer=" + toPeer +
        ", sourceShardId=" + sourceShardId +
        '}';
  }
}
