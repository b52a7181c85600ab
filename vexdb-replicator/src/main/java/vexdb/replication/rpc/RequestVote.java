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

public final class RequestVote implements ReplicationMessage {
  private final long term;
  private final long candidateId;
  private final long lastLogIndex;
  private final long lastLogTerm;

  public RequestVote(long term, long candidateId, long lastLogIndex, long lastLogTerm) {
    this.term = term;
    this.candidateId = candidateId;
    this.lastLogIndex = lastLogIndex;
    this.lastLogTerm = lastLogTerm;
  }

  public long getTerm() {
    return term;
  }

  public long getCandidateId() {
    return candidateId;
  }

  public long getLastLogIndex() {
    return lastLogIndex;
  }

  public long getLastLogTerm() {
    return lastLogTerm;
  }

  @Override
  public String toString() {
    return "RequestVote{" +
        "term=" + term +
        ", candidateId=" + candidateId +
        ", lastLogIndex=" + lastLogIndex +
        ", lastLogTerm=" + lastLogTerm +
        '}';
  }
}
