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

package vexdb.cluster.command;

import vexdb.cluster.topology.Topology;
import vexdb.interfaces.TopologyRejectedException;

import java.util.ArrayList;
import java.util.List;

/**
 * Create a collection with its shards already placed. The placement is computed by the proposer,
 * one entry per shard in hash range order, so that applying the command never has to choose.
 */
public final class CreateCollection extends ClusterCommand {
  String name;
  int shardCount;
  int replicationFactor;
  int writeConsistencyFactor;
  List<ShardPlacement> placement;

  private CreateCollection() {
  }

  public CreateCollection(String name,
                          int shardCount,
                          int replicationFactor,
                          int writeConsistencyFactor,
                          List<List<Long>> placement) {
    this.name = name;
    this.shardCount = shardCount;
    this.replicationFactor = replicationFactor;
    this.writeConsistencyFactor = writeConsistencyFactor;
    this.placement = new ArrayList<>();
    for (List<Long> peers : placement) {
      this.placement.add(new ShardPlacement(peers));
    }
  }

  public List<List<Long>> getPlacement() {
    List<List<Long>> result = new ArrayList<>();
    if (placement != null) {
      for (ShardPlacement shard : placement) {
        result.add(shard.peers == null ? new ArrayList<>() : shard.peers);
      }
    }
    return result;
  }

  @Override
  public void applyTo(Topology.Builder topology) throws TopologyRejectedException {
    topology.createCollection(name, shardCount, replicationFactor, writeConsistencyFactor, getPlacement());
  }

  @Override
  public String toString() {
    return "CreateCollection{" +
        "name=" + name +
        ", shardCount=" + shardCount +
        ", replicationFactor=" + replicationFactor +
        ", writeConsistencyFactor=" + writeConsistencyFactor +
        ", placement=" + getPlacement() +
        '}';
  }

  static final class ShardPlacement {
    List<Long> peers;

    private ShardPlacement() {
    }

    ShardPlacement(List<Long> peers) {
      this.peers = new ArrayList<>(peers);
    }
  }
}
