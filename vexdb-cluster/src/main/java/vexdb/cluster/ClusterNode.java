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

package vexdb.cluster;

import com.google.common.util.concurrent.AbstractService;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.jetlang.channels.MemoryRequestChannel;
import org.jetlang.channels.Request;
import org.jetlang.channels.RequestChannel;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.command.ClusterCommand;
import vexdb.cluster.command.SetReplicaState;
import vexdb.cluster.consensus.ClusterConsensus;
import vexdb.cluster.consensus.CommandProposer;
import vexdb.cluster.consensus.ConsensusStatus;
import vexdb.cluster.consensus.LeaderForwardingProposer;
import vexdb.cluster.rpc.ForwardProposal;
import vexdb.cluster.rpc.ForwardProposalReply;
import vexdb.cluster.rpc.PeerClient;
import vexdb.cluster.rpc.PeerReply;
import vexdb.cluster.rpc.PeerRequest;
import vexdb.cluster.rpc.RemoteError;
import vexdb.cluster.topology.ReplicaRole;
import vexdb.cluster.topology.ShardInfo;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.shard.UpdateStatus;
import vexdb.replication.ReplicatorClock;
import vexdb.replication.rpc.RpcReply;
import vexdb.replication.rpc.RpcRequest;
import vexdb.replication.rpc.RpcWireReply;
import vexdb.replication.rpc.RpcWireRequest;
import vexdb.shard.ReplicaSetStatus;
import vexdb.shard.ShardManager;
import vexdb.shard.transfer.TransferState;
import vexdb.util.FiberOnly;
import vexdb.util.FiberSupplier;
import vexdb.util.VexFutures;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static vexdb.ClusterConstants.CLUSTER_UNREACHABLE_PEER_CHECK_INTERVAL_MILLISECONDS;
import static vexdb.ClusterConstants.CLUSTER_UNREACHABLE_PEER_FAILURE_COUNT;

/**
 * One node of the cluster: its member of the metadata quorum and its shard replicas.
 * <p>
 * Nodes talk over two pairs of request channels, one for consensus traffic and one for shard
 * replication and forwarded proposals. Whatever connects nodes, a network transport or an
 * in-memory test harness, delivers the requests a node publishes on its outgoing channels to the
 * incoming channel of the addressed node, including requests a node addresses to itself.
 * <p>
 * While this node leads the metadata quorum, it also marks dead the active shard replicas held by
 * peers that stopped answering consensus requests, when their shard has other active replicas.
 * That lets another replica take over as primary.
 * <p>
 * The node does not own its storage; the caller closes it after the node stops.
 */
public class ClusterNode extends AbstractService {
  private static final Logger LOG = LoggerFactory.getLogger(ClusterNode.class);

  private final long myId;
  private final Fiber fiber;
  private final ClusterConsensus consensus;
  private final PeerClient peerClient;
  private final CommandProposer proposer;
  private final ShardManager shardManager;
  private final RequestChannel<PeerRequest, PeerReply> incomingPeerRequests = new MemoryRequestChannel<>();

  // Replicas this node proposed dead and whose proposal has not completed yet, as shardId:peerId.
  private final Set<String> unreachableProposals = new HashSet<>();

  /**
   * ClusterNode creates fibers; it must be stopped (or failed) in order to dispose them.
   */
  public ClusterNode(NodeConfiguration configuration,
                     NodeStorage storage,
                     FiberSupplier fiberSupplier,
                     ReplicatorClock clock,
                     RequestChannel<RpcRequest, RpcWireReply> outgoingConsensusRequests,
                     RequestChannel<PeerRequest, PeerReply> outgoingPeerRequests) {
    this.myId = configuration.nodeId;
    this.fiber = fiberSupplier.getNewFiber(this::failNode);
    this.consensus = new ClusterConsensus(configuration,
        fiberSupplier.getNewFiber(this::failNode),
        fiberSupplier.getNewFiber(this::failNode),
        storage.consensusLog(),
        clock,
        storage.consensusPersister(),
        storage.consensusSnapshots(),
        outgoingConsensusRequests);
    this.peerClient = new PeerClient(myId, fiber, outgoingPeerRequests);
    this.proposer = new LeaderForwardingProposer(consensus, peerClient);
    this.shardManager = new ShardManager(configuration, fiberSupplier.getNewFiber(this::failNode), fiberSupplier,
        storage, peerClient, proposer);

    incomingPeerRequests.subscribe(fiber, this::onPeerRequest);
  }

  public long getMyId() {
    return myId;
  }

  public RequestChannel<RpcWireRequest, RpcReply> getIncomingConsensusChannel() {
    return consensus.getIncomingChannel();
  }

  public RequestChannel<PeerRequest, PeerReply> getIncomingPeerChannel() {
    return incomingPeerRequests;
  }

  public ClusterConsensus getConsensus() {
    return consensus;
  }

  public ShardManager getShardManager() {
    return shardManager;
  }

  /**
   * Propose a topology change from this node, whether or not it leads.
   *
   * @return a future of the commit index, set once this node has applied it.
   */
  public ListenableFuture<Long> proposeMetadataChange(ClusterCommand command) {
    return proposer.propose(command);
  }

  public ListenableFuture<UpdateStatus> submitOperation(String collection,
                                                        String key,
                                                        byte[] payload,
                                                        boolean waitForAll) {
    return shardManager.submit(collection, key, payload, waitForAll);
  }

  public Topology getTopology() {
    return consensus.getTopology();
  }

  public ListenableFuture<NodeStatus> status() {
    final ConsensusStatus consensusStatus = consensus.status();
    final ListenableFuture<List<ReplicaSetStatus>> replicaSets = shardManager.replicaSetStatuses();
    final ListenableFuture<Map<Long, TransferState>> transfers = shardManager.transferStates();
    return Futures.whenAllSucceed(replicaSets, transfers)
        .call(() -> new NodeStatus(consensusStatus, Futures.getDone(replicaSets), Futures.getDone(transfers)),
            MoreExecutors.directExecutor());
  }

  @Override
  protected void doStart() {
    fiber.start();
    try {
      consensus.start();
    } catch (IOException e) {
      failNode(e);
      return;
    }
    shardManager.start(consensus.getTopologyChannel(), consensus.getTopology());
    fiber.scheduleWithFixedDelay(this::markUnreachableReplicasDead,
        CLUSTER_UNREACHABLE_PEER_CHECK_INTERVAL_MILLISECONDS, CLUSTER_UNREACHABLE_PEER_CHECK_INTERVAL_MILLISECONDS,
        TimeUnit.MILLISECONDS);
    LOG.info("node {} started", myId);
    notifyStarted();
  }

  @Override
  protected void doStop() {
    VexFutures.addCallback(shardManager.dispose(),
        (ignore) -> {
          consensus.dispose();
          fiber.dispose();
          LOG.info("node {} stopped", myId);
          notifyStopped();
        },
        this::failNode, fiber);
  }

  protected void failNode(Throwable t) {
    LOG.error("node {} failed, shutting down", myId, t);
    try {
      shardManager.dispose();
      consensus.dispose();
      fiber.dispose();
    } finally {
      if (state() == State.STARTING || state() == State.RUNNING || state() == State.STOPPING) {
        notifyFailed(t);
      }
    }
  }

  @FiberOnly
  private void onPeerRequest(Request<PeerRequest, PeerReply> request) {
    if (!(request.getRequest().message instanceof ForwardProposal)) {
      shardManager.handleRequest(request);
      return;
    }

    // Proposed here only; a forwarded proposal is never forwarded again.
    ClusterCommand command = ((ForwardProposal) request.getRequest().message).command;
    VexFutures.addCallback(consensus.propose(command),
        (index) -> request.reply(new PeerReply(new ForwardProposalReply(index))),
        (failure) -> request.reply(new PeerReply(RemoteError.of(failure))), fiber);
  }

  @FiberOnly
  private void markUnreachableReplicasDead() {
    if (!consensus.isLeader()) {
      return;
    }
    ConsensusStatus status = consensus.status();
    Topology topology = consensus.getTopology();

    for (Map.Entry<Long, Long> failures : status.peerFailureCounts.entrySet()) {
      final long peer = failures.getKey();
      if (failures.getValue() < CLUSTER_UNREACHABLE_PEER_FAILURE_COUNT) {
        continue;
      }
      for (ShardInfo shard : topology.shards.values()) {
        if (shard.roleOf(peer) != ReplicaRole.ACTIVE || shard.activePeers().size() < 2) {
          continue;
        }
        final String key = shard.shardId + ":" + peer;
        if (!unreachableProposals.add(key)) {
          continue;
        }
        LOG.warn("peer {} is unreachable; marking its replica of shard {} dead", peer, shard.shardId);
        VexFutures.addCallback(consensus.propose(new SetReplicaState(shard.shardId, peer, ReplicaRole.DEAD)),
            (index) -> unreachableProposals.remove(key),
            (failure) -> {
              unreachableProposals.remove(key);
              LOG.debug("unable to mark replica of shard {} on peer {} dead: {}", shard.shardId, peer, failure.toString());
            }, fiber);
      }
    }
  }
}
