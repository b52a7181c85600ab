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

package vexdb.cluster.rpc;

/**
 * Ask a replica of sourceShardId for a copy of its contents, to fill shardId on the requesting
 * node. The replica first applies the topology through topologyIndex, so that the copy reflects
 * the request's view of the shard's hash range.
 */
public class TransferSnapshot implements PeerMessage {
  public final long shardId;
  public final long sourceShardId;
  public final long topologyIndex;

  public TransferSnapshot(long shardId, long sourceShardId, long topologyIndex) {
    this.shardId = shardId;
    this.sourceShardId = sourceShardId;
    this.topologyIndex = topologyIndex;
  }

  @Override
  public String toString() {
    return "TransferSnapshot{" +
        "shardId=" + shardId +
        ", sourceShardId=" + sourceShardId +
        ", topologyIndex=" + topologyIndex +
        '}';
  }
}
