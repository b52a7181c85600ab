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

package vexdb.interfaces.shard;

import vexdb.interfaces.log.SequentialEntry;

import java.util.Arrays;

/**
 * A point-level write to one shard. Operation ids are assigned by the shard's primary and are
 * strictly increasing within the shard.
 */
public final class Operation extends SequentialEntry {
  private final long shardId;
  private final String key;
  private final byte[] payload;

  public Operation(long operationId, long shardId, String key, byte[] payload) {
    super(operationId);
    this.shardId = shardId;
    this.key = key;
    this.payload = payload;
  }

  public long getOperationId() {
    return seqNum;
  }

  public long getShardId() {
    return shardId;
  }

  public String getKey() {
    return key;
  }

  public byte[] getPayload() {
    return payload;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Operation that = (Operation) o;
    return seqNum == that.seqNum
        && shardId == that.shardId
        && key.equals(that.key)
        && Arrays.equals(payload, that.payload);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(seqNum);
    result = 31 * result + Long.hashCode(shardId);
    result = 31 * result + key.hashCode();
    result = 31 * result + Arrays.hashCode(payload);
    return result;
  }

  @Override
  public String toString() {
    return "Operation{" +
        "operationId=" + seqNum +
        ", shardId=" + shardId +
        ", key='" + key + '\'' +
        ", payloadBytes=" + payload.length +
        '}';
  }
}
