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

import java.util.Random;

import static vexdb.ReplicatorConstants.REPLICATOR_DEFAULT_ELECTION_CHECK_INTERVAL_MILLISECONDS;
import static vexdb.ReplicatorConstants.REPLICATOR_DEFAULT_LEADER_LOG_INTERVAL_MILLISECONDS;

/**
 * Wall clock with an election timeout drawn at random from [base, 2 * base).
 */
public class DefaultSystemTimeReplicatorClock implements ReplicatorClock {
  private final long electionTimeout;
  private final long electionCheckInterval;
  private final long leaderLogInterval;

  public DefaultSystemTimeReplicatorClock(int baseElectionTimeout) {
    this(baseElectionTimeout,
        REPLICATOR_DEFAULT_ELECTION_CHECK_INTERVAL_MILLISECONDS,
        REPLICATOR_DEFAULT_LEADER_LOG_INTERVAL_MILLISECONDS);
  }

  public DefaultSystemTimeReplicatorClock(int baseElectionTimeout, long electionCheckInterval, long leaderLogInterval) {
    Random r = new Random();
    this.electionTimeout = r.nextInt(baseElectionTimeout) + baseElectionTimeout;
    this.electionCheckInterval = electionCheckInterval;
    this.leaderLogInterval = leaderLogInterval;
  }

  @Override
  public long currentTimeMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public long electionCheckInterval() {
    return electionCheckInterval;
  }

  @Override
  public long electionTimeout() {
    return electionTimeout;
  }

  @Override
  public long leaderLogRequestsProcessingInterval() {
    return leaderLogInterval;
  }
}
