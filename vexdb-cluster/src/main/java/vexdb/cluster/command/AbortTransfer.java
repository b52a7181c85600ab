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

public final class AbortTransfer extends ClusterCommand {
  long shardId;
  long toPeer;

  private AbortTransfer() {
  }

  public AbortTransfer(long shardId, long toPeer) {
    this.shardId = shardId;
    this.toPeer = toPeer;
  }

  @Override
  public void applyTo(Topology.Builder topology) throws TopologyRejectedException {
    topology.abortTransfer(shardId, toPeer);
  }

  @Override
  public String toString() {
    return "AbortTransfer{" + "shardId=" + shardId + ", toPeer=" + toPeer + '}';
  }
}
