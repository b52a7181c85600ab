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

package vexdb.interfaces;

import com.google.common.collect.ImmutableSet;
import vexdb.interfaces.shard.UpdateStatus;

import java.util.Collection;
import java.util.Set;

/**
 * A write reached the primary but not every replica it had to reach. The failed replicas have
 * been marked dead and will be recovered; the write itself is not rolled back.
 */
public class PartialFailureException extends ClusterException {
  private final long shardId;
  private final UpdateStatus bestStatus;
  private final Set<Long> failedPeers;

  public PartialFailureException(long shardId, UpdateStatus bestStatus, Collection<Long> failedPeers) {
    super("shard " + shardId + " write reached " + bestStatus + " but failed on peers " + failedPeers);
    this.shardId = shardId;
    this.bestStatus = bestStatus;
    this.failedPeers = ImmutableSet.copyOf(failedPeers);
  }

  public long getShardId() {
    return shardId;
  }

  public UpdateStatus getBestStatus() {
    return bestStatus;
  }

  public Set<Long> getFailedPeers() {
    return failedPeers;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
