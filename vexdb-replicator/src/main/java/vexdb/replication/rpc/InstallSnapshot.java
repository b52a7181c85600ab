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

import vexdb.interfaces.replication.ReplicatorSnapshot;

/**
 * Sent by a leader in place of AppendEntries to a peer that needs entries the leader has
 * already compacted away.
 */
public final class InstallSnapshot implements ReplicationMessage {
  private final long term;
  private final long leaderId;
  private final ReplicatorSnapshot snapshot;

  public InstallSnapshot(long term, long leaderId, ReplicatorSnapshot snapshot) {
    this.term = term;
    this.leaderId = leaderId;
    this.snapshot = snapshot;
  }

  public long getTerm() {
    return term;
  }

  public long getLeaderId() {
    return leaderId;
  }

  public ReplicatorSnapshot getSnapshot() {
    return snapshot;
  }

  @Override
  public String toString() {
    return "InstallSnapshot{term=" + term + ", leaderId=" + leaderId + ", snapshot=" + snapshot + '}';
  }
}
