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

public final class ReplicaState {
  public final long peerId;
  public final long shardId;
  public final long lastAppliedOperationId;
  public final ReplicaHealth health;

  public ReplicaState(long peerId, long shardId, long lastAppliedOperationId, ReplicaHealth health) {
    this.peerId = peerId;
    this.shardId = shardId;
    this.lastAppliedOperationId = lastAppliedOperationId;
    this.health = health;
  }

  public ReplicaState withHealth(ReplicaHealth newHealth) {
    return new ReplicaState(peerId, shardId, lastAppliedOperationId, newHealth);
  }

  public ReplicaState withLastApplied(long newLastAppliedOperationId) {
    return new ReplicaState(peerId, shardId, Math.max(lastAppliedOperationId, newLastAppliedOperationId), health);
  }

  @Override
  public String toString() {
    return "ReplicaState{" +
        "peerId=" + peerId +
        ", shardId=" + shardId +
        ", lastAppliedOperationId=" + lastAppliedOperationId +
        ", health=" + health +
        '}';
  }
}
