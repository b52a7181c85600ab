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

import vexdb.interfaces.shard.Operation;

/**
 * Sent by a shard's primary to each of the shard's other replicas for every operation it
 * sequences. The replica answers with an {@link OperationAck} once it has applied the operation.
 */
public class ForwardOperation implements PeerMessage {
  public final long shardId;
  public final Operation operation;

  public ForwardOperation(long shardId, Operation operation) {
    this.shardId = shardId;
    this.operation = operation;
  }

  @Override
  public String toString() {
    return "ForwardOperation{" + "shardId=" + shardId + ", operationId=" + operation.getOperationId() + '}';
  }
}
