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

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/**
 * Point-in-time view of a replicator, safe to read from any thread.
 */
public final class ReplicatorStatus {
  public static final ReplicatorStatus INITIAL =
      new ReplicatorStatus(Replicator.State.INIT, 0, 0, 0, 0, 0, QuorumConfiguration.EMPTY, ImmutableMap.of());

  public final Replicator.State state;
  public final long currentTerm;
  public final long leaderId;
  public final long lastCommittedIndex;
  public final long lastIndex;
  public final long baseIndex;
  public final QuorumConfiguration configuration;
  /**
   * Consecutive failed or timed-out requests to each peer, as seen by this replicator.
   */
  public final Map<Long, Long> peerFailureCounts;

  public ReplicatorStatus(Replicator.State state,
                          long currentTerm,
                          long leaderId,
                          long lastCommittedIndex,
                          long lastIndex,
                          long baseIndex,
                          QuorumConfiguration configuration,
                          Map<Long, Long> peerFailureCounts) {
    this.state = state;
    this.currentTerm = currentTerm;
    this.leaderId = leaderId;
    this.lastCommittedIndex = lastCommittedIndex;
    this.lastIndex = lastIndex;
    this.baseIndex = baseIndex;
    this.configuration = configuration;
    this.peerFailureCounts = ImmutableMap.copyOf(peerFailureCounts);
  }

  @Override
  public String toString() {
    return "ReplicatorStatus{" +
        "state=" + state +
        ", currentTerm=" + currentTerm +
        ", leaderId=" + leaderId +
        ", lastCommittedIndex=" + lastCommittedIndex +
        ", lastIndex=" + lastIndex +
        ", baseIndex=" + baseIndex +
        ", configuration=" + configuration +
        ", peerFailureCounts=" + peerFailureCounts +
        '}';
  }
}
