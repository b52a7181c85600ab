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

import com.google.common.collect.ImmutableList;
import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.log.SequentialEntry;

import java.nio.ByteBuffer;
import java.util.List;

/**
 * One entry of a replicated log: either opaque data submitted by the user of a replicator,
 * or a quorum configuration. An entry with no data and no configuration is a no-op, which
 * a newly elected leader logs to commit the entries of earlier terms.
 */
public final class LogEntry extends SequentialEntry {
  private final long term;
  private final List<ByteBuffer> data;
  @Nullable
  private final QuorumConfiguration quorumConfiguration;

  public LogEntry(long term, long index, List<ByteBuffer> data, @Nullable QuorumConfiguration quorumConfiguration) {
    super(index);
    this.term = term;
    this.data = ImmutableList.copyOf(data);
    this.quorumConfiguration = quorumConfiguration;
  }

  public long getTerm() {
    return term;
  }

  public long getIndex() {
    return seqNum;
  }

  /**
   * The data buffers of this entry. Callers must not change the position or limit of the buffers
   * returned; use {@link ByteBuffer#duplicate()} to read them.
   */
  public List<ByteBuffer> getDataList() {
    return data;
  }

  @Nullable
  public QuorumConfiguration getQuorumConfiguration() {
    return quorumConfiguration;
  }

  public boolean isConfigurationEntry() {
    return quorumConfiguration != null;
  }

  public boolean isNoOp() {
    return quorumConfiguration == null && data.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    LogEntry that = (LogEntry) o;
    return term == that.term
        && seqNum == that.seqNum
        && data.equals(that.data)
        && (quorumConfiguration == null
        ? that.quorumConfiguration == null
        : quorumConfiguration.equals(that.quorumConfiguration));
  }

  @Override
  public int hashCode() {
    int result = (int) (term ^ (term >>> 32));
    result = 31 * result + (int) (seqNum ^ (seqNum >>> 32));
    result = 31 * result + data.hashCode();
    result = 31 * result + (quorumConfiguration == null ? 0 : quorumConfiguration.hashCode());
    return result;
  }

  @Override
  public String toString() {
    return "LogEntry{" +
        "index=" + seqNum +
        ", term=" + term +
        ", data=" + data +
        ", quorumConfiguration=" + quorumConfiguration +
        '}';
  }
}
