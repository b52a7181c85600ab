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

public class FetchOperationsReply implements PeerMessage {
  public final long shardId;
  /**
   * The operations asked for, in order; null if the replica's operation log no longer holds all of them.
   */
  @Nullable
  public final List<Operation> operations;
  public final long lastOperationId;

  public FetchOperationsReply(long shardId, @Nullable List<Operation> operations, long lastOperationId) {
    this.shardId = shardId;
    this.operations = operations;
    this.lastOperationId = lastOperationId;
  }

  public boolean isCovered() {
    return operations != null;
  }

  @Override
  public String toString() {
    return "FetchOperationsReply{" +
        "shardId=" + shardId +
        ", operations=" + (operations == null ? "not covered" : operations.size()) +
        ", lastOperationId=" + lastOperationId +
        '}';
  }
}
