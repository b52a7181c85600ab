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

/**
 * Begin copying a shard to a new peer, which holds an initializing replica until the transfer
 * finishes or is aborted.
 */
public final class StartTransfer extends ClusterCommand {
  long shardId;
  long fromPeer;
  long toPeer;

  private StartTransfer() {
  }

  public StartTransfer(long shardId, long fromPeer, long toPeer) {
    this.shardId = shardId;
    this.fromPeer = fromPeer;
    this.toPeer = toPeer;
  }

  @Override
  public void applyTo(Topology.Builder topology) throws TopologyRejectedException {
    topology.startTransfer(shardId, fromPeer, toPeer);
  }

  @Override
  public String toString() {
    return "StartTransfer{" + "shardId=" + shardId + ", fromPeer=" + fromPeer + ", toPeer=" + toPeer + '}';
  }
}
