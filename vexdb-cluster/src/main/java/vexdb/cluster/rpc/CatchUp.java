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

import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.shard.Operation;

import java.util.List;

/**
 * Sent by a primary to a replica that fell behind: either the operations it misses, or, when the
 * primary's operation log no longer reaches back far enough, a snapshot followed by the operations
 * after it. Answered with an {@link OperationAck}.
 */
public class CatchUp implements PeerMessage {
  public final long shardId;
  @Nullable
  public final byte[] snapshot;
  public final long snapshotOperationId;
  public final List<Operation> operations;

  public CatchUp(long shardId, @Nullable byte[] snapshot, long snapshotOperationId, List<Operation> operations) {
    this.shardId = shardId;
    this.snapshot = snapshot;
    this.snapshotOperationId = snapshotOperationId;
    this.operations = operations;
  }

  public boolean hasSnapshot() {
    return snapshot != null;
  }

  @Override
  public String toString() {
    return "CatchUp{" +
        "shardId=" + shardId +
        ", snapshot=" + (snapshot == null ? "none" : "through " + snapshotOperationId) +
        ", operations=" + operations.size() +
        '}';
  }
}
