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

package vexdb.cluster.consensus;

import com.google.common.collect.ImmutableMap;
import vexdb.interfaces.replication.Replicator;

import java.util.Map;

/**
 * A point-in-time report on this node's part in cluster consensus.
 */
public final class ConsensusStatus {
  public final long peerId;
  public final long term;
  public final long commitIndex;
  public final long lastAppliedIndex;
  public final int pendingProposals;
  public final long leaderId;
  public final Replicator.State role;
  public final boolean isVoter;
  /**
   * Consecutive failed messages to each peer, as seen by the leader; empty on followers.
   */
  public final ImmutableMap<Long, Long> peerFailureCounts;

  public ConsensusStatus(long peerId,
                         long term,
                         long commitIndex,
                         long lastAppliedIndex,
                         int pendingProposals,
                         long leaderId,
                         Replicator.State role,
                         boolean isVoter,
                         Map<Long, Long> peerFailureCounts) {
    this.peerId = peerId;
    this.term = term;
    this.commitIndex = commitIndex;
    this.lastAppliedIndex = lastAppliedIndex;
    this.pendingProposals = pendingProposals;
    this.leaderId = leaderId;
    this.role = role;
    this.isVoter = isVoter;
    this.peerFailureCounts = ImmutableMap.copyOf(peerFailureCounts);
  }

  @Override
  public String toString() {
    return "ConsensusStatus{" +
        "peerId=" + peerId +
        ", term=" + term +
        ", commitIndex=" + commitIndex +
        ", lastAppliedIndex=" + lastAppliedIndex +
        ", pendingProposals=" + pendingProposals +
        ", leaderId=" + leaderId +
        ", role=" + role +
        ", isVoter=" + isVoter +
        ", peerFailureCounts=" + peerFailureCounts +
        '}';
  }
}
