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
 * A write handed to the node its sender believes is the shard's primary.
 */
public class SubmitOperation implements PeerMessage {
  public final long shardId;
  public final String key;
  public final byte[] payload;
  public final boolean waitForAll;

  public SubmitOperation(long shardId, String key, byte[] payload, boolean waitForAll) {
    this.shardId = shardId;
    this.key = key;
    this.payload = payload;
    this.waitForAll = waitForAll;
  }

  @Override
  public String toString() {
    return "SubmitOperation{" + "shardId=" + shardId + ", key=" + key + ", waitForAll=" + waitForAll + '}';
  }
}
