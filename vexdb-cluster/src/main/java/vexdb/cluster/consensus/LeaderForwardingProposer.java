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

import com.google.common.util.concurrent.AsyncFunction;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.command.ClusterCommand;
import vexdb.cluster.rpc.ForwardProposal;
import vexdb.cluster.rpc.ForwardProposalReply;
import vexdb.cluster.rpc.PeerClient;
import vexdb.interfaces.ConsensusTimeoutException;
import vexdb.interfaces.NotLeaderException;

import java.util.concurrent.TimeoutException;

import static vexdb.ClusterConstants.CLUSTER_FORWARD_PROPOSAL_RPC_TIMEOUT_MILLISECONDS;

/**
 * Proposes commands from any node. A proposal refused locally because this node is not the leader
 * is passed once to the leader the refusal names; the result is set once this node has applied
 * the committed index too, so the caller sees its own change in {@link ClusterConsensus#getTopology()}.
 * Nothing is retried beyond that single hop.
 */
public class LeaderForwardingProposer implements CommandProposer {
  private static final Logger LOG = LoggerFactory.getLogger(LeaderForwardingProposer.class);

  private final ClusterConsensus consensus;
  private final PeerClient peerClient;

  public LeaderForwardingProposer(ClusterConsensus consensus, PeerClient peerClient) {
    this.consensus = consensus;
    this.peerClient = peerClient;
  }

  @Override
  public ListenableFuture<Long> propose(ClusterCommand command) {
    return Futures.catchingAsync(consensus.propose(command), NotLeaderException.class,
        forwardToLeader(command), MoreExecutors.directExecutor());
  }

  private AsyncFunction<NotLeaderException, Long> forwardToLeader(ClusterCommand command) {
    return (notLeader) -> {
      long leader = notLeader.getLeaderHint();
      if (!notLeader.hasLeaderHint() || leader == consensus.getMyId()) {
        throw notLeader;
      }

      LOG.debug("forwarding {} to leader {}", command, leader);
      ListenableFuture<Long> committedIndex = Futures.transform(
          peerClient.send(leader, new ForwardProposal(command), ForwardProposalReply.class,
              CLUSTER_FORWARD_PROPOSAL_RPC_TIMEOUT_MILLISECONDS),
          (reply) -> reply.index,
          MoreExecutors.directExecutor());
      committedIndex = Futures.catchingAsync(committedIndex, TimeoutException.class,
          (timeout) -> Futures.immediateFailedFuture(
              new ConsensusTimeoutException("no answer from leader " + leader + " to " + command)),
          MoreExecutors.directExecutor());

      return Futures.transformAsync(committedIndex,
          (index) -> Futures.transform(consensus.awaitApplied(index), (topology) -> index,
              MoreExecutors.directExecutor()),
          MoreExecutors.directExecutor());
    };
  }
}
