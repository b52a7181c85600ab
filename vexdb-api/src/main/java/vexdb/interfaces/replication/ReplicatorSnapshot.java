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

package vexdb.interfaces.replication;

import java.util.Arrays;

/**
 * The serialized state of a replicated state machine as of some log index, together with the
 * term of that index and the quorum configuration in force there.
 */
public final class ReplicatorSnapshot {
  public final String quorumId;
  public final long lastIncludedIndex;
  public final long lastIncludedTerm;
  public final QuorumConfiguration configuration;
  private final byte[] data;

  public ReplicatorSnapshot(String quorumId,
                            long lastIncludedIndex,
                            long lastIncludedTerm,
                            QuorumConfiguration configuration,
                            byte[] data) {
    this.quorumId = quorumId;
    this.lastIncludedIndex = lastIncludedIndex;
    this.lastIncludedTerm = lastIncludedTerm;
    this.configuration = configuration;
    this.data = data;
  }

  public byte[] getData() {
    return data;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    ReplicatorSnapshot that = (ReplicatorSnapshot) o;
    return lastIncludedIndex == that.lastIncludedIndex
        && lastIncludedTerm == that.lastIncludedTerm
        && quorumId.equals(that.quorumId)
        && configuration.equals(that.configuration)
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    int result = quorumId.hashCode();
    result = 31 * result + (int) (lastIncludedIndex ^ (lastIncludedIndex >>> 32));
    result = 31 * result + (int) (lastIncludedTerm ^ (lastIncludedTerm >>> 32));
    result = 31 * result + configuration.hashCode();
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "ReplicatorSnapshot{" +
        "quorumId=" + quorumId +
        ", lastIncludedIndex=" + lastIncludedIndex +
        ", lastIncludedTerm=" + lastIncludedTerm +
        ", configuration=" + configuration +
        ", bytes=" + data.length +
        '}';
  }
}
