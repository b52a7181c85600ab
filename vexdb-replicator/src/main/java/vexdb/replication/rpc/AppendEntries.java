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

package vexdb.replication.rpc;

import com.google.common.collect.ImmutableList;
import vexdb.interfaces.replication.LogEntry;

import java.util.List;

public final class AppendEntries implements ReplicationMessage {
  private final long term;
  private final long leaderId;
  private final long prevLogIndex;
  private final long prevLogTerm;
  private final List<LogEntry> entries;
  private final long commitIndex;

  public AppendEntries(long term, long leaderId, long prevLogIndex, long prevLogTerm, List<LogEntry> entries,
                       long commitIndex) {
    this.term = term;
    this.leaderId = leaderId;
    this.prevLogIndex = prevLogIndex;
    this.prevLogTerm = prevLogTerm;
    this.entries = ImmutableList.copyOf(entries);
    this.commitIndex = commitIndex;
  }

  public long getTerm() {
    return term;
  }

  public long getLeaderId() {
    return leaderId;
  }

  public long getPrevLogIndex() {
    return prevLogIndex;
  }

  public long getPrevLogTerm() {
    return prevLogTerm;
  }

  public List<LogEntry> getEntriesList() {
    return entries;
  }

  public long getCommitIndex() {
    return commitIndex;
  }

  @Override
  public String toString() {
    return "AppendEntries{" +
        "term=" + term +
        ", leaderId=" + leaderId +
        ", prevLogIndex=" + prevLogIndex +
        ", prevLogTerm=" + prevLogTerm +
        ", entries=" + entries.size() +
        ", commitIndex=" + commitIndex +
        '}';
  }
}
