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

import vexdb.cluster.topology.ReplicaRole;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.TopologyRejectedException;

/**
 * Record a replica as dead, or as active again once it has caught up with its primary.
 */
public final class SetReplicaState extends ClusterCommand {
  long shardId;
  long peerId;
  ReplicaRole role;

  private SetReplicaState() {
  }

  public SetReplicaState(long shardId, long peerId, ReplicaRole role) {
    this.shardId = shardId;
    this.peerId = peerId;
    this.role = role;
  }

  public long getShardId() {
    return shardId;
  }

  public long getPeerId() {
    return peerId;
  }

  public ReplicaRole getRole() {
    return role;
  }

  @Override
  public void applyTo(Topology.Builder topology) throws TopologyRejectedException {
    topology.setReplicaState(shardId, peerId, role);
  }

  @Override
  public String toString() {
    return "SetReplicaState{" + "shardId=" + shardId + ", peerId=" + peerId + ", role=" + role + '}';
  }
}
