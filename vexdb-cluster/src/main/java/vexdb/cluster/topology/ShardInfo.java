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

import com.google.common.collect.ImmutableSortedMap;
import vexdb.interfaces.shard.HashRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * One shard of a collection: the part of the key hash space it owns and where its replicas are.
 * The shard's primary, which sequences its writes, is its active replica with the lowest peer id.
 */
public final class ShardInfo {
  public final long shardId;
  public final String collection;
  public final HashRange range;
  public final ImmutableSortedMap<Long, ReplicaRole> replicas;

  public ShardInfo(long shardId, String collection, HashRange range, Map<Long, ReplicaRole> replicas) {
    this.shardId = shardId;
    this.collection = collection;
    this.range = range;
    this.replicas = ImmutableSortedMap.copyOf(replicas);
  }

  public List<Long> activePeers() {
    return peersWithRole(ReplicaRole.ACTIVE);
  }

  public List<Long> peersWithRole(ReplicaRole role) {
    List<Long> peers = new ArrayList<>();
    for (Map.Entry<Long, ReplicaRole> replica : replicas.entrySet()) {
      if (replica.getValue() == role) {
        peers.add(replica.getKey());
      }
    }
    return peers;
  }

  /**
   * @return the peer id of the shard's primary, or zero if no replica is active.
   */
  public long primary() {
    List<Long> active = activePeers();
    return active.isEmpty() ? 0 : active.get(0);
  }

  public boolean hasReplicaOn(long peerId) {
    return replicas.containsKey(peerId);
  }

  public ReplicaRole roleOf(long peerId) {
    return replicas.get(peerId);
  }

  public ShardInfo withReplica(long peerId, ReplicaRole role) {
    Map<Long, ReplicaRole> newReplicas = new TreeMap<>(replicas);
    newReplicas.put(peerId, role);
    return new ShardInfo(shardId, collection, range, newReplicas);
  }

  public ShardInfo withoutReplica(long peerId) {
    Map<Long, ReplicaRole> newReplicas = new TreeMap<>(replicas);
    newReplicas.remove(peerId);
    return new ShardInfo(shardId, collection, range, newReplicas);
  }

  public ShardInfo withRange(HashRange newRange) {
    return new ShardInfo(shardId, collection, newRange, replicas);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ShardInfo that = (ShardInfo) o;
    return shardId == that.shardId
        && collection.equals(that.collection)
        && range.equals(that.range)
        && replicas.equals(that.replicas);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(shardId);
    result = 31 * result + collection.hashCode();
    result = 31 * result + range.hashCode();
    result = 31 * result + replicas.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "ShardInfo{" +
        "shardId=" + shardId +
        ", collection='" + collection + '\'' +
        ", range=" + range +
        ", replicas=" + replicas +
        '}';
  }
}
