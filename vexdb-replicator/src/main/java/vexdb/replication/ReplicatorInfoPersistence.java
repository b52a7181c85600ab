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

package vexdb.replication;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Persist snippets of information for the replication algorithm.  These bits are critical to recover during
 * crash-recovery, so the interface is sync and expected to durably write the data to disk before returning.
 */
public interface ReplicatorInfoPersistence {
  long readCurrentTerm(String quorumId) throws IOException;

  long readVotedFor(String quorumId) throws IOException;

  void writeCurrentTermAndVotedFor(String quorumId, long currentTerm, long votedFor) throws IOException;

  /**
   * Keeps term and vote in memory, for nodes whose whole state lives in memory.
   */
  class InRam implements ReplicatorInfoPersistence {
    private final Map<String, long[]> termAndVote = new ConcurrentHashMap<>();

    @Override
    public long readCurrentTerm(String quorumId) {
      return termAndVote.getOrDefault(quorumId, new long[2])[0];
    }

    @Override
    public long readVotedFor(String quorumId) {
      return termAndVote.getOrDefault(quorumId, new long[2])[1];
    }

    @Override
    public void writeCurrentTermAndVotedFor(String quorumId, long currentTerm, long votedFor) {
      termAndVote.put(quorumId, new long[]{currentTerm, votedFor});
    }
  }
}
