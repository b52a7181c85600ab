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

package vexdb.shard;

import com.google.common.collect.ImmutableList;

import java.util.Collection;

/**
 * What this node knows about one shard it holds a replica of. Only the primary tracks the other
 * replicas; elsewhere the list is empty.
 */
public final class ReplicaSetStatus {
  public final long shardId;
  public final long peerId;
  public final boolean isPrimary;
  public final boolean isReady;
  public final long lastAppliedOperationId;
  public final ImmutableList<ReplicaState> replicas;

  public ReplicaSetStatus(long shardId,
                          long peerId,
                          boolean isPrimary,
                          boolean isReady,
                          long lastAppliedOperationId,
                          Collection<ReplicaState> replicas) {
    this.shardId = shardId;
    this.peerId = peerId;
    this.isPrimary = isPrimary;
    this.isReady = isReady;
    this.lastAppliedOperationId = lastAppliedOperationId;
    this.replicas = ImmutableList.copyOf(replicas);
  }

  @Override
  public String toString() {
    return "ReplicaSetStatus{" +
        "shardId=" + shardId +
        ", peerId=" + peerId +
        ", isPrimary=" + isPrimary +
        ", isReady=" + isReady +
        ", lastAppliedOperationId=" + lastAppliedOperationId +
        ", replicas=" + replicas +
        '}';
  }
}
