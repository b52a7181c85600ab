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

public final class AppendEntriesReply implements ReplicationMessage {
  private final long term;
  private final boolean success;
  private final long myNextLogEntry;

  /**
   * @param myNextLogEntry on failure, the index the follower wants next; zero if it has no opinion.
   */
  public AppendEntriesReply(long term, boolean success, long myNextLogEntry) {
    this.term = term;
    this.success = success;
    this.myNextLogEntry = myNextLogEntry;
  }

  public long getTerm() {
    return term;
  }

  public boolean getSuccess() {
    return success;
  }

  public long getMyNextLogEntry() {
    return myNextLogEntry;
  }

  @Override
  public String toString() {
    return "AppendEntriesReply{term=" + term + ", success=" + success + ", myNextLogEntry=" + myNextLogEntry + '}';
  }
}
