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
 * Health probe from a shard's primary, also used by a new primary to learn how far the other
 * replicas have got.
 */
public class ReplicaStatusRequest implements PeerMessage {
  public final long shardId;

  public ReplicaStatusRequest(long shardId) {
    this.shardId = shardId;
  }

  @Override
  public String toString() {
    return "ReplicaStatusRequest{" + "shardId=" + shardId + '}';
  }
}
