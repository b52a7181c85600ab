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

package vexdb.cluster.rpc;

import com.google.common.collect.ImmutableList;
import vexdb.ClusterConstants;
import vexdb.interfaces.ConsensusTimeoutException;
import vexdb.interfaces.MembershipChangeInProgressException;
import vexdb.interfaces.NotLeaderException;
import vexdb.interfaces.PartialFailureException;
import vexdb.interfaces.ShardNotReadyException;
import vexdb.interfaces.StaleTopologyException;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.TopologyRejectedException;
import vexdb.interfaces.shard.UpdateStatus;

import java.util.Collection;
import java.util.List;

/**
 * The reply to a request that failed on the receiving node. It carries enough of the failure for
 * the sender to rebuild an exception of the same kind, so a caller sees the same errors whether
 * its request was served locally or by another node.
 */
public class RemoteError implements PeerMessage {
  public enum Kind {
    NOT_LEADER,
    CONSENSUS_TIMEOUT,
    PARTIAL_FAILURE,
    STALE_TOPOLOGY,
    SHARD_NOT_READY,
    STORAGE,
    MEMBERSHIP_CHANGE_IN_PROGRESS,
    TOPOLOGY_REJECTED,
    INTERNAL
  }

  public final Kind kind;
  public final String message;
  /**
   * Leader hint, shard id or pending configuration index, depending on the kind.
   */
  public final long detail;
  public final List<Long> peers;
  public final UpdateStatus status;
  public final TopologyRejectedException.Reason reason;

  private RemoteError(Kind kind,
                      String message,
                      long detail,
                      Collection<Long> peers,
                      UpdateStatus status,
                      TopologyRejectedException.Reason reason) {
    this.kind = kind;
    this.message = message == null ? "" : message;
    this.detail = detail;
    this.peers = ImmutableList.copyOf(peers);
    this.status = status;
    this.reason = reason;
  }

  private static RemoteError of(Kind kind, Throwable cause, long detail) {
    return new RemoteError(kind, cause.getMessage(), detail, ImmutableList.of(), null, null);
  }

  public static RemoteError of(Throwable cause) {
    if (cause instanceof NotLeaderException) {
      return of(Kind.NOT_LEADER, cause, ((NotLeaderException) cause).getLeaderHint());
    } else if (cause instanceof ConsensusTimeoutException) {
      return of(Kind.CONSENSUS_TIMEOUT, cause, 0);
    } else if (cause instanceof PartialFailureException) {
      PartialFailureException partialFailure = (PartialFailureException) cause;
      return new RemoteError(Kind.PARTIAL_FAILURE, cause.getMessage(), partialFailure.getShardId(),
          partialFailure.getFailedPeers(), partialFailure.getBestStatus(), null);
    } else if (cause instanceof StaleTopologyException) {
      return of(Kind.STALE_TOPOLOGY, cause, 0);
    } else if (cause instanceof ShardNotReadyException) {
      return of(Kind.SHARD_NOT_READY, cause, ((ShardNotReadyException) cause).getShardId());
    } else if (cause instanceof StorageException) {
      return of(Kind.STORAGE, cause, 0);
    } else if (cause instanceof MembershipChangeInProgressException) {
      return of(Kind.MEMBERSHIP_CHANGE_IN_PROGRESS, cause, 0);
    } else if (cause instanceof TopologyRejectedException) {
      return new RemoteError(Kind.TOPOLOGY_REJECTED, cause.getMessage(), 0, ImmutableList.of(), null,
          ((TopologyRejectedException) cause).getReason());
    } else {
      return new RemoteError(Kind.INTERNAL, cause.toString(), 0, ImmutableList.of(), null, null);
    }
  }

  public Exception toException() {
    switch (kind) {
      case NOT_LEADER:
        return new NotLeaderException(0, detail);
      case CONSENSUS_TIMEOUT:
        return new ConsensusTimeoutException(message);
      case PARTIAL_FAILURE:
        return new PartialFailureException(detail, status, peers);
      case STALE_TOPOLOGY:
        return new StaleTopologyException(message);
      case SHARD_NOT_READY:
        return new ShardNotReadyException(detail);
      case STORAGE:
        return new StorageException(message);
      case MEMBERSHIP_CHANGE_IN_PROGRESS:
        return new MembershipChangeInProgressException(ClusterConstants.CLUSTER_QUORUM_ID, detail);
      case TOPOLOGY_REJECTED:
        String prefix = reason + ": ";
        return new TopologyRejectedException(reason,
            message.startsWith(prefix) ? message.substring(prefix.length()) : message);
      default:
        return new IllegalStateException("remote failure: " + message);
    }
  }

  @Override
  public String toString() {
    return "RemoteError{" + kind + ": " + message + '}';
  }
}
