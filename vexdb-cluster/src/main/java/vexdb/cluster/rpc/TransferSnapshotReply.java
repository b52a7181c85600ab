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
 * A shard's contents as of cutoffOperationId; every operation after the cut-off is forwarded to
 * the transfer target separately.
 */
public class TransferSnapshotReply implements PeerMessage {
  public final long shardId;
  public final byte[] data;
  public final long cutoffOperationId;

  public TransferSnapshotReply(long shardId, byte[] data, long cutoffOperationId) {
    this.shardId = shardId;
    this.data = data;
    this.cutoffOperationId = cutoffOperationId;
  }

  @Override
  public String toString() {
    return "TransferSnapshotReply{" +
        "shardId=" + shardId +
        ", bytes=" + data.length +
        ", cutoffOperationId=" + cutoffOperationId +
        '}';
  }
}
