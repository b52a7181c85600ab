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
 * Split a shard's hash range in half. The upper half becomes a new shard whose replicas, on
 * newShardPeers, are filled by transfers from the split shard's primary.
 */
public final class SplitShard extends ClusterCommand {
  long shardId;
  List<Long> newShardPeers;

  private SplitShard() {
  }

  public SplitShard(long shardId, List<Long> newShardPeers) {
    this.shardId = shardId;
    this.newShardPeers = new ArrayList<>(newShardPeers);
  }

  @Override
  public void applyTo(Topology.Builder topology) throws TopologyRejectedException {
    topology.splitShard(shardId, newShardPeers == null ? new ArrayList<>() : newShardPeers);
  }

  @Override
  public String toString() {
    return "SplitShard{" + "shardId=" + shardId + ", newShardPeers=" + newShardPeers + '}';
  }
}
