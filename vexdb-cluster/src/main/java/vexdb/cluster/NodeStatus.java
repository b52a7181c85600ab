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

package vexdb.cluster;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import vexdb.cluster.consensus.ConsensusStatus;
import vexdb.shard.ReplicaSetStatus;
import vexdb.shard.transfer.TransferState;

import java.util.List;
import java.util.Map;

/**
 * A point-in-time view of one node: its consensus state, its shard replicas, and the transfers
 * filling its new replicas, by shard id.
 */
public final class NodeStatus {
  public final ConsensusStatus consensus;
  public final ImmutableList<ReplicaSetStatus> replicaSets;
  public final ImmutableSortedMap<Long, TransferState> transfers;

  public NodeStatus(ConsensusStatus consensus, List<ReplicaSetStatus> replicaSets, Map<Long, TransferState> transfers) {
    this.consensus = consensus;
    this.replicaSets = ImmutableList.copyOf(replicaSets);
    this.transfers = ImmutableSortedMap.copyOf(transfers);
  }

  @Override
  public String toString() {
    return "NodeStatus{" +
        "consensus=" + consensus +
        ", replicaSets=" + replicaSets +
        ", transfers=" + transfers +
        '}';
  }
}
