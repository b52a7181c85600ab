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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.Channel;
import org.jetlang.channels.ChannelSubscription;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.RequestChannel;
import org.jetlang.channels.Subscriber;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.ClusterConstants;
import vexdb.ReplicatorConstants;
import vexdb.cluster.NodeConfiguration;
import vexdb.cluster.command.ClusterCommand;
import vexdb.cluster.command.CommandEnvelope;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.ConsensusTimeoutException;
import vexdb.interfaces.MembershipChangeInProgressException;
import vexdb.interfaces.replication.EntryCompactedException;
import vexdb.interfaces.replication.IndexCommitNotice;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicateSubmissionInfo;
import vexdb.interfaces.replication.Replicator;
import vexdb.interfaces.replication.ReplicatorInstanceEvent;
import vexdb.interfaces.replication.ReplicatorLog;
import vexdb.interfaces.replication.ReplicatorReceipt;
import vexdb.interfaces.replication.ReplicatorSnapshot;
import vexdb.interfaces.replication.ReplicatorStatus;
import vexdb.replication.CommitTrackingReplicator;
import vexdb.replication.ReplicatorClock;
import vexdb.replication.ReplicatorInfoPersistence;
import vexdb.replication.ReplicatorInstance;
import vexdb.replication.SnapshotStore;
import vexdb.replication.rpc.RpcReply;
import vexdb.replication.rpc.RpcRequest;
import vexdb.replication.rpc.RpcWireReply;
import vexdb.replication.rpc.RpcWireRequest;
import vexdb.util.FiberOnly;
import vexdb.util.VexFutures;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static vexdb.ClusterConstants.CLUSTER_QUORUM_ID;

/**
 * This node's member of the cluster metadata quorum. It replicates topology commands through a
 * {@link ReplicatorInstance}, applies the committed ones in index order to a
 * {@link TopologyStateMachine}, and publishes each resulting topology.
 * <p>
 * While this node leads, it also keeps the quorum configuration in line with the peers the
 * topology lists: peers that joined become learners, which the replicator promotes to voters once
 * they have caught up, and peers that were removed leave the configuration.
 */
public class ClusterConsensus {
  private final long myId;
  private final Fiber fiber;
  private final Logger logger;
  private final ReplicatorLog log;
  private final SnapshotStore snapshotStore;
  private final ReplicatorInstance replicator;
  private final CommitTrackingReplicator commitTracker;
  private final Collection<Long> bootstrapPeers;
  private final long proposalTimeoutMillis;
  private final int snapshotThreshold;

  private final Channel<ReplicatorInstanceEvent> eventChannel = new MemoryChannel<>();
  private final Channel<Topology> topologyChannel = new MemoryChannel<>();
  private final AtomicReference<Topology> currentTopology = new AtomicReference<>(Topology.EMPTY);
  private final TopologyStateMachine stateMachine = new TopologyStateMachine();

  private final Map<Long, SettableFuture<Long>> pendingProposals = new HashMap<>();
  private final NavigableMap<Long, List<SettableFuture<Topology>>> appliedWaiters = new TreeMap<>();
  private volatile int pendingProposalCount;

  private long nextProposalId = ThreadLocalRandom.current().nextLong(1, Long.MAX_VALUE / 2);
  private long knownCommitIndex;
  private boolean fetchInFlight;
  private boolean membershipChangeInFlight;
  private int appliedSinceSnapshot;

  /**
   * Both fibers are started by {@link #start()} and disposed by {@link #dispose()}.
   */
  public ClusterConsensus(NodeConfiguration configuration,
                          Fiber fiber,
                          Fiber replicatorFiber,
                          ReplicatorLog log,
                          ReplicatorClock clock,
                          ReplicatorInfoPersistence persister,
                          SnapshotStore snapshotStore,
                          RequestChannel<RpcRequest, RpcWireReply> sendRpcChannel) {
    this.myId = configuration.nodeId;
    this.fiber = fiber;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + myId + ")");
    this.log = log;
    this.snapshotStore = snapshotStore;
    this.bootstrapPeers = configuration.bootstrapPeers;
    this.proposalTimeoutMillis = configuration.proposalTimeoutMillis;
    this.snapshotThreshold = configuration.snapshotThreshold;

    Channel<IndexCommitNotice> commitNoticeChannel = new MemoryChannel<>();
    this.replicator = new ReplicatorInstance(replicatorFiber, myId, CLUSTER_QUORUM_ID, log, clock, persister,
        snapshotStore, sendRpcChannel, eventChannel, commitNoticeChannel, Replicator.State.FOLLOWER);
    this.commitTracker = new CommitTrackingReplicator(replicator, fiber);

    commitNoticeChannel.subscribe(
        new ChannelSubscription<>(fiber, this::onCommit,
            (notice) -> notice.nodeId == myId && notice.quorumId.equals(CLUSTER_QUORUM_ID)));
    replicator.getSnapshotChannel().subscribe(fiber, this::onSnapshot);
    eventChannel.subscribe(fiber, this::onReplicatorEvent);
  }

  /**
   * Start consensus. A node whose consensus log and snapshot are both empty logs the bootstrap
   * configuration first, if it was given one; a node that joins an existing cluster has none and
   * waits to hear from the leader.
   */
  public void start() throws IOException {
    boolean fresh = log.getLastIndex() == 0 && snapshotStore.load(CLUSTER_QUORUM_ID) == null;

    fiber.start();
    replicator.start();
    fiber.scheduleWithFixedDelay(this::reconcileMembership,
        ClusterConstants.CLUSTER_MEMBERSHIP_CHECK_INTERVAL_MILLISECONDS,
        ClusterConstants.CLUSTER_MEMBERSHIP_CHECK_INTERVAL_MILLISECONDS, TimeUnit.MILLISECONDS);

    if (fresh && !bootstrapPeers.isEmpty()) {
      logger.info("bootstrapping cluster quorum with peers {}", bootstrapPeers);
      replicator.bootstrapQuorum(bootstrapPeers);
    }
  }

  public void dispose() {
    replicator.dispose();
    fiber.dispose();
  }

  public long getMyId() {
    return myId;
  }

  public boolean isLeader() {
    return replicator.isLeader();
  }

  public long getLeaderHint() {
    return replicator.getStatus().leaderId;
  }

  /**
   * Inbound consensus traffic from other nodes, for the transport to deliver to.
   */
  public RequestChannel<RpcWireRequest, RpcReply> getIncomingChannel() {
    return replicator.getIncomingChannel();
  }

  public Subscriber<ReplicatorInstanceEvent> getEventChannel() {
    return eventChannel;
  }

  /**
   * Each topology as it is applied; several committed entries applied together publish once.
   */
  public Subscriber<Topology> getTopologyChannel() {
    return topologyChannel;
  }

  /**
   * The last applied topology. On a node cut off from the leader this is the last topology it
   * learned, which is still served.
   */
  public Topology getTopology() {
    return currentTopology.get();
  }

  /**
   * Replicate a command.
   *
   * @return a future of the index the command committed at, set once this node has applied it.
   * It fails with {@link vexdb.interfaces.NotLeaderException} if this node is not the leader,
   * with {@link ConsensusTimeoutException} if the outcome cannot be known, and with
   * {@link vexdb.interfaces.TopologyRejectedException} if the command committed but was invalid.
   */
  public ListenableFuture<Long> propose(ClusterCommand command) {
    final SettableFuture<Long> result = SettableFuture.create();
    fiber.execute(() -> submitProposal(command, result));
    return result;
  }

  /**
   * A future of the topology, set once this node has applied the given index.
   */
  public ListenableFuture<Topology> awaitApplied(long index) {
    Topology topology = currentTopology.get();
    if (topology.index >= index) {
      return Futures.immediateFuture(topology);
    }

    final SettableFuture<Topology> result = SettableFuture.create();
    fiber.execute(() -> {
      if (stateMachine.getLastAppliedIndex() >= index) {
        result.set(stateMachine.getTopology());
      } else {
        appliedWaiters.computeIfAbsent(index, (k) -> new ArrayList<>()).add(result);
      }
    });
    return result;
  }

  public ConsensusStatus status() {
    ReplicatorStatus replicatorStatus = replicator.getStatus();
    return new ConsensusStatus(
        myId,
        replicatorStatus.currentTerm,
        replicatorStatus.lastCommittedIndex,
        currentTopology.get().index,
        pendingProposalCount,
        replicatorStatus.leaderId,
        replicatorStatus.state,
        replicatorStatus.configuration.isVoter(myId),
        replicatorStatus.peerFailureCounts);
  }

  @FiberOnly
  private void submitProposal(ClusterCommand command, SettableFuture<Long> result) {
    final long proposalId = nextProposalId++;
    final CommandEnvelope envelope = new CommandEnvelope(myId, proposalId, command);

    final ListenableFuture<ReplicateSubmissionInfo> submission;
    try {
      submission = commitTracker.replicate(Collections.singletonList(envelope.encode()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      result.setException(e);
      return;
    }

    pendingProposals.put(proposalId, result);
    pendingProposalCount = pendingProposals.size();
    result.addListener(() -> {
      pendingProposals.remove(proposalId);
      pendingProposalCount = pendingProposals.size();
    }, fiber);

    VexFutures.failAfter(result, proposalTimeoutMillis, TimeUnit.MILLISECONDS,
        () -> new ConsensusTimeoutException("proposal " + envelope + " did not commit in time"), fiber);

    // The commit itself completes nothing; the result is set when the entry is applied.
    VexFutures.addCallback(submission,
        (info) -> {
          logger.debug("proposal {} logged at index {} term {}", proposalId, info.sequenceNumber, info.term);
          VexFutures.addCallback(info.completedFuture, (ignore) -> {
          }, result::setException, fiber);
        },
        result::setException, fiber);
  }

  @FiberOnly
  private void onCommit(IndexCommitNotice notice) {
    knownCommitIndex = Math.max(knownCommitIndex, notice.lastIndex);
    applyCommittedEntries();
  }

  @FiberOnly
  private void onSnapshot(ReplicatorSnapshot snapshot) {
    if (snapshot.lastIncludedIndex <= stateMachine.getLastAppliedIndex()) {
      return;
    }
    stateMachine.restore(snapshot);
    knownCommitIndex = Math.max(knownCommitIndex, snapshot.lastIncludedIndex);
    appliedSinceSnapshot = 0;
    publishTopology();
    applyCommittedEntries();
  }

  @FiberOnly
  private void onReplicatorEvent(ReplicatorInstanceEvent event) {
    switch (event.eventType) {
      case LEADER_DEPOSED:
        // Entries logged in the lost term may or may not commit under the next leader.
        for (SettableFuture<Long> pending : new ArrayList<>(pendingProposals.values())) {
          pending.setException(new ConsensusTimeoutException("leadership lost before the proposal was applied"));
        }
        break;
      case QUORUM_FAILURE:
        logger.error("cluster consensus replicator failed", event.error);
        break;
      case LEADER_ELECTED:
        logger.info("leader elected: {} in term {}", event.newLeader, event.leaderElectedTerm);
        break;
      default:
        logger.debug("replicator event {}", event);
        break;
    }
  }

  /**
   * Fetch and apply the committed entries not yet applied, one batch at a time. Entries already
   * folded into a snapshot are skipped; the snapshot channel delivers their state.
   */
  @FiberOnly
  private void applyCommittedEntries() {
    final long start = stateMachine.getLastAppliedIndex() + 1;
    if (fetchInFlight || start > knownCommitIndex) {
      return;
    }

    final long end = Math.min(knownCommitIndex, start + ReplicatorConstants.REPLICATOR_MAXIMUM_CATCH_UP_ENTRIES - 1) + 1;
    fetchInFlight = true;

    VexFutures.addCallback(replicator.getLogEntries(start, end),
        (entries) -> {
          fetchInFlight = false;
          applyEntries(entries);
          if (entries.isEmpty()) {
            fiber.schedule(this::applyCommittedEntries,
                ReplicatorConstants.REPLICATOR_DEFAULT_ELECTION_CHECK_INTERVAL_MILLISECONDS, TimeUnit.MILLISECONDS);
          } else {
            applyCommittedEntries();
          }
        },
        (failure) -> {
          fetchInFlight = false;
          if (failure instanceof EntryCompactedException) {
            logger.debug("entries from {} were compacted; waiting for the snapshot", start);
          } else {
            logger.error("unable to read committed entries from {}", start, failure);
            fiber.schedule(this::applyCommittedEntries,
                ReplicatorConstants.REPLICATOR_DEFAULT_ELECTION_CHECK_INTERVAL_MILLISECONDS, TimeUnit.MILLISECONDS);
          }
        }, fiber);
  }

  @FiberOnly
  private void applyEntries(List<LogEntry> entries) {
    List<TopologyStateMachine.AppliedCommand> outcomes = new ArrayList<>();
    boolean applied = false;
    for (LogEntry entry : entries) {
      if (entry.getIndex() <= stateMachine.getLastAppliedIndex()) {
        continue;
      }
      if (entry.getIndex() != stateMachine.getLastAppliedIndex() + 1) {
        // A snapshot replaced the state while the entries were being read.
        break;
      }
      outcomes.addAll(stateMachine.apply(entry));
      applied = true;
      appliedSinceSnapshot++;
    }

    if (applied) {
      // Proposers must find their change in getTopology() once their future is set.
      publishTopology();
      for (TopologyStateMachine.AppliedCommand outcome : outcomes) {
        completeProposal(outcome);
      }
      maybeTakeSnapshot();
    }
  }

  @FiberOnly
  private void completeProposal(TopologyStateMachine.AppliedCommand outcome) {
    if (outcome.envelope.getProposerId() != myId) {
      return;
    }
    SettableFuture<Long> pending = pendingProposals.get(outcome.envelope.getProposalId());
    if (pending == null) {
      return;
    }
    if (outcome.isRejected()) {
      pending.setException(outcome.rejection);
    } else {
      pending.set(outcome.index);
    }
  }

  @FiberOnly
  private void publishTopology() {
    Topology topology = stateMachine.getTopology();
    currentTopology.set(topology);
    topologyChannel.publish(topology);

    NavigableMap<Long, List<SettableFuture<Topology>>> reached = appliedWaiters.headMap(topology.index, true);
    for (List<SettableFuture<Topology>> waiters : reached.values()) {
      for (SettableFuture<Topology> waiter : waiters) {
        waiter.set(topology);
      }
    }
    reached.clear();
  }

  @FiberOnly
  private void maybeTakeSnapshot() {
    if (appliedSinceSnapshot < snapshotThreshold) {
      return;
    }
    appliedSinceSnapshot = 0;
    final long index = stateMachine.getLastAppliedIndex();
    logger.debug("taking snapshot at index {}", index);
    VexFutures.addCallback(replicator.takeSnapshot(index, stateMachine.takeSnapshot()),
        (ignore) -> logger.debug("snapshot at index {} saved", index),
        (failure) -> logger.warn("unable to take snapshot at index {}", index, failure), fiber);
  }

  @FiberOnly
  private void reconcileMembership() {
    if (!replicator.isLeader() || membershipChangeInFlight) {
      return;
    }
    QuorumConfiguration configuration = replicator.getQuorumConfiguration();
    Topology topology = stateMachine.getTopology();
    if (configuration.isEmpty() || configuration.isTransitional || topology.peers.isEmpty()) {
      return;
    }

    Set<Long> known = topology.peers.keySet();
    Set<Long> voters = configuration.allPeers();
    Set<Long> removedVoters = Sets.difference(voters, known);
    if (!removedVoters.isEmpty()) {
      Set<Long> remainingVoters = ImmutableSet.copyOf(Sets.difference(voters, removedVoters));
      if (!remainingVoters.isEmpty()) {
        logger.info("removing voters {} from the cluster quorum", removedVoters);
        try {
          submitMembershipChange(replicator.changeQuorum(remainingVoters));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return;
      }
    }

    Set<Long> learners = ImmutableSet.copyOf(Sets.difference(known, voters));
    if (!learners.equals(configuration.learners())) {
      logger.info("changing cluster quorum learners from {} to {}", configuration.learners(), learners);
      try {
        submitMembershipChange(replicator.changeLearners(learners));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @FiberOnly
  private void submitMembershipChange(ListenableFuture<ReplicatorReceipt> receiptFuture) {
    if (receiptFuture == null) {
      return;
    }
    membershipChangeInFlight = true;
    VexFutures.addCallback(receiptFuture,
        (receipt) -> membershipChangeInFlight = false,
        (failure) -> {
          membershipChangeInFlight = false;
          if (failure instanceof MembershipChangeInProgressException) {
            logger.debug("membership change deferred: {}", failure.getMessage());
          } else {
            logger.warn("membership change failed", failure);
          }
        }, fiber);
  }
}
