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

package vexdb.shard;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.Request;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.command.SetReplicaState;
import vexdb.cluster.consensus.CommandProposer;
import vexdb.cluster.rpc.CatchUp;
import vexdb.cluster.rpc.FetchOperations;
import vexdb.cluster.rpc.FetchOperationsReply;
import vexdb.cluster.rpc.ForwardOperation;
import vexdb.cluster.rpc.OperationAck;
import vexdb.cluster.rpc.PeerClient;
import vexdb.cluster.rpc.PeerMessage;
import vexdb.cluster.rpc.PeerReply;
import vexdb.cluster.rpc.PeerRequest;
import vexdb.cluster.rpc.RemoteError;
import vexdb.cluster.rpc.ReplicaStatusReply;
import vexdb.cluster.rpc.ReplicaStatusRequest;
import vexdb.cluster.rpc.SubmitOperation;
import vexdb.cluster.rpc.SubmitOperationReply;
import vexdb.cluster.rpc.TransferSnapshot;
import vexdb.cluster.rpc.TransferSnapshotReply;
import vexdb.cluster.topology.ReplicaRole;
import vexdb.cluster.topology.ShardInfo;
import vexdb.interfaces.PartialFailureException;
import vexdb.interfaces.ShardNotReadyException;
import vexdb.interfaces.StaleTopologyException;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;
import vexdb.interfaces.shard.Operation;
import vexdb.interfaces.shard.UpdateStatus;
import vexdb.util.FiberOnly;
import vexdb.util.VexFutures;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

import static vexdb.ClusterConstants.SHARD_MAXIMUM_CATCH_UP_OPERATIONS;
import static vexdb.ClusterConstants.SHARD_TAKEOVER_STATUS_ATTEMPTS;
import static vexdb.ClusterConstants.SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS;

/**
 * Keeps this node's replica of a shard in step with the shard's other replicas.
 * <p>
 * On the shard's primary, the active replica with the lowest peer id, it sequences writes: each
 * write gets the next operation id, is applied locally, and is forwarded to every other replica
 * that is active, resyncing or initializing. The primary probes replicas it has seen fail and
 * brings them back up to date. A node that becomes primary first pulls any operations the other
 * replicas applied beyond its own position, and refuses writes until it has.
 * <p>
 * On every other replica, it applies forwarded operations strictly in id order, buffering any
 * that arrive early and fetching the missing ones from the sender. An operation is acknowledged
 * once it has been applied.
 * <p>
 * All state is confined to the replica set's fiber.
 */
public class ShardReplicaSet {
  private final long myId;
  private final long shardId;
  private final Fiber fiber;
  private final Logger logger;
  private final LocalReplica local;
  private final PeerClient peerClient;
  private final CommandProposer proposer;
  private final long forwardTimeoutMillis;

  private ShardInfo shard;

  // Primary state
  private boolean primary;
  private boolean ready;
  private long takeoverGeneration;
  private long lastAssignedOperationId;
  private final Map<Long, ReplicaState> replicaStates = new TreeMap<>();
  private final Set<Long> initializingPeers = new TreeSet<>();
  private final Set<Long> resyncInFlight = new HashSet<>();
  private final Set<Long> awaitingActivation = new HashSet<>();
  private final Map<Long, PendingWrite> pendingWrites = new HashMap<>();

  // Replica state
  private boolean awaitingSnapshot;
  private final TreeMap<Long, Operation> bufferedOperations = new TreeMap<>();
  private final TreeMap<Long, List<Request<PeerRequest, PeerReply>>> deferredAcks = new TreeMap<>();
  private boolean gapFetchInFlight;

  /**
   * The fiber must be started by the caller; {@link #dispose(boolean)} disposes it.
   */
  public ShardReplicaSet(long myId,
                         ShardInfo shard,
                         Fiber fiber,
                         LocalReplica local,
                         PeerClient peerClient,
                         CommandProposer proposer,
                         long forwardTimeoutMillis,
                         long healthProbeIntervalMillis) {
    this.myId = myId;
    this.shardId = shard.shardId;
    this.fiber = fiber;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + myId + " - " + shardId + ")");
    this.local = local;
    this.peerClient = peerClient;
    this.proposer = proposer;
    this.forwardTimeoutMillis = forwardTimeoutMillis;
    this.awaitingSnapshot = shard.roleOf(myId) == ReplicaRole.INITIALIZING && local.lastAppliedOperationId() == 0;

    fiber.execute(() -> onShardUpdated(shard));
    fiber.scheduleWithFixedDelay(this::probeDeadReplicas,
        healthProbeIntervalMillis, healthProbeIntervalMillis, TimeUnit.MILLISECONDS);
  }

  public long getShardId() {
    return shardId;
  }

  /**
   * Follow the committed assignment of the shard.
   */
  public void updateShard(ShardInfo newShard) {
    fiber.execute(() -> onShardUpdated(newShard));
  }

  /**
   * Sequence and replicate a write; valid only on the shard's primary.
   *
   * @param waitForAll if false, the future is set as soon as the write is applied locally; if
   *                   true, only once every active replica has applied it.
   * @return a future of {@link UpdateStatus#ACKNOWLEDGED} or {@link UpdateStatus#COMPLETED}. When
   * waiting for all and some replica fails, it fails with a {@link PartialFailureException}.
   */
  public ListenableFuture<UpdateStatus> submit(String key, byte[] payload, boolean waitForAll) {
    final SettableFuture<UpdateStatus> result = SettableFuture.create();
    fiber.execute(() -> doSubmit(key, payload, waitForAll, result));
    return result;
  }

  public ListenableFuture<byte[]> read(String key) {
    final SettableFuture<byte[]> result = SettableFuture.create();
    fiber.execute(() -> {
      try {
        result.set(local.read(key));
      } catch (StorageException e) {
        result.setException(e);
      }
    });
    return result;
  }

  /**
   * Handle a shard replication request from another node.
   */
  public void handleRequest(Request<PeerRequest, PeerReply> request) {
    fiber.execute(() -> onRequest(request));
  }

  public ListenableFuture<ReplicaSetStatus> status() {
    final SettableFuture<ReplicaSetStatus> result = SettableFuture.create();
    fiber.execute(() -> result.set(
        new ReplicaSetStatus(shardId, myId, primary, ready, local.lastAppliedOperationId(), replicaStates.values())));
    return result;
  }

  /**
   * Hold forwarded operations until a transfer snapshot is installed. Ignored unless this
   * replica is still INITIALIZING.
   */
  public void expectSnapshot() {
    fiber.execute(() -> {
      if (shard.roleOf(myId) == ReplicaRole.INITIALIZING) {
        awaitingSnapshot = true;
      }
    });
  }

  /**
   * Replace this replica's contents with a snapshot taken for a transfer, then apply the
   * operations forwarded since the snapshot's cut-off.
   *
   * @param retainRange if not null, keep only the points in this range, for a shard split off another.
   * @return a future of the position reached.
   */
  public ListenableFuture<Long> installTransferSnapshot(byte[] data, long position, @Nullable HashRange retainRange) {
    final SettableFuture<Long> result = SettableFuture.create();
    fiber.execute(() -> {
      try {
        local.importSnapshot(data, position);
        if (retainRange != null) {
          local.retainRange(retainRange);
        }
      } catch (IOException | StorageException e) {
        result.setException(e);
        return;
      }
      awaitingSnapshot = false;
      applyBufferedOperations();
      if (!bufferedOperations.isEmpty() && shard.primary() != 0 && shard.primary() != myId) {
        fetchGap(shard.primary());
      }
      result.set(local.lastAppliedOperationId());
    });
    return result;
  }

  /**
   * Drop the points outside the shard's range, once a split of it has been fully copied.
   */
  public void retainRange(HashRange range) {
    fiber.execute(() -> {
      try {
        local.retainRange(range);
        logger.info("trimmed to {}", range);
      } catch (StorageException e) {
        logger.error("unable to trim to {}", range, e);
      }
    });
  }

  /**
   * Fetch from the shard's primary whatever operations this replica lacks.
   *
   * @return a future of the primary's position, set once this replica has reached it. A shard
   * without a primary, or whose primary is this node, is caught up already.
   */
  public ListenableFuture<Long> catchUpWithPrimary() {
    final SettableFuture<Long> result = SettableFuture.create();
    fiber.execute(() -> catchUpWithPrimary(result));
    return result;
  }

  /**
   * Stop. With dropData, the replica's contents are deleted too, because the shard no longer
   * has a replica on this node.
   */
  public ListenableFuture<Void> dispose(boolean dropData) {
    final SettableFuture<Void> result = SettableFuture.create();
    fiber.execute(() -> {
      primary = false;
      ready = false;
      for (PendingWrite write : new ArrayList<>(pendingWrites.values())) {
        write.result.setException(new StaleTopologyException("shard " + shardId + " left node " + myId));
      }
      pendingWrites.clear();
      for (List<Request<PeerRequest, PeerReply>> requests : deferredAcks.values()) {
        for (Request<PeerRequest, PeerReply> request : requests) {
          reply(request, RemoteError.of(new StaleTopologyException("shard " + shardId + " left node " + myId)));
        }
      }
      deferredAcks.clear();

      try {
        if (dropData) {
          local.drop();
        }
        local.close();
        result.set(null);
      } catch (IOException | StorageException e) {
        logger.warn("error closing replica", e);
        result.setException(e);
      } finally {
        fiber.dispose();
      }
    });
    return result;
  }

  /**
   * topology
   */

  @FiberOnly
  private void onShardUpdated(ShardInfo newShard) {
    shard = newShard;
    if (awaitingSnapshot && newShard.roleOf(myId) != ReplicaRole.INITIALIZING) {
      // The transfer finished on an earlier attempt's snapshot.
      awaitingSnapshot = false;
      applyBufferedOperations();
      if (!bufferedOperations.isEmpty() && newShard.primary() != 0 && newShard.primary() != myId) {
        fetchGap(newShard.primary());
      }
    }
    initializingPeers.clear();
    initializingPeers.addAll(newShard.peersWithRole(ReplicaRole.INITIALIZING));
    initializingPeers.remove(myId);

    boolean nowPrimary = newShard.primary() == myId;
    if (nowPrimary && !primary) {
      primary = true;
      beginTakeover();
    } else if (!nowPrimary && primary) {
      logger.info("no longer the primary");
      primary = false;
      ready = false;
      takeoverGeneration++;
      replicaStates.clear();
      resyncInFlight.clear();
      awaitingActivation.clear();
    } else if (primary && ready) {
      syncReplicaStates();
    }
  }

  @FiberOnly
  private void syncReplicaStates() {
    replicaStates.keySet().removeIf((peer) -> !shard.hasReplicaOn(peer) || initializingPeers.contains(peer));
    resyncInFlight.removeIf((peer) -> !shard.hasReplicaOn(peer));
    awaitingActivation.removeIf((peer) -> !shard.hasReplicaOn(peer));

    for (Map.Entry<Long, ReplicaRole> replica : shard.replicas.entrySet()) {
      long peer = replica.getKey();
      ReplicaRole role = replica.getValue();
      if (peer == myId || role == ReplicaRole.INITIALIZING) {
        continue;
      }

      ReplicaState state = replicaStates.get(peer);
      if (state == null) {
        // Newly assigned, or a finished transfer.
        ReplicaHealth health = role == ReplicaRole.ACTIVE ? ReplicaHealth.ACTIVE : ReplicaHealth.DEAD;
        replicaStates.put(peer, new ReplicaState(peer, shardId, 0, health));
      } else if (role == ReplicaRole.ACTIVE && awaitingActivation.remove(peer)) {
        logger.info("replica on peer {} is active again", peer);
        replicaStates.put(peer, state.withHealth(ReplicaHealth.ACTIVE));
      } else if (role == ReplicaRole.DEAD && state.health == ReplicaHealth.ACTIVE) {
        replicaStates.put(peer, state.withHealth(ReplicaHealth.DEAD));
      }
    }
  }

  /**
   * primary takeover
   */

  @FiberOnly
  private void beginTakeover() {
    ready = false;
    final long generation = ++takeoverGeneration;
    replicaStates.clear();
    resyncInFlight.clear();
    awaitingActivation.clear();

    final List<Long> others = new ArrayList<>();
    for (Map.Entry<Long, ReplicaRole> replica : shard.replicas.entrySet()) {
      if (replica.getKey() != myId && replica.getValue() != ReplicaRole.INITIALIZING) {
        others.add(replica.getKey());
      }
    }
    logger.info("taking over as primary at operation {}; asking {} for their positions",
        local.lastAppliedOperationId(), others);
    queryPositions(generation, others, 1);
  }

  /**
   * A peer that answers without the replica has not opened it yet, typically because it is
   * behind on the topology; it is asked again a few times before being counted out.
   */
  @FiberOnly
  private void queryPositions(long generation, List<Long> others, int attempt) {
    final List<ListenableFuture<ReplicaStatusReply>> replies = new ArrayList<>();
    for (long peer : others) {
      replies.add(peerClient.send(peer, new ReplicaStatusRequest(shardId), ReplicaStatusReply.class, forwardTimeoutMillis));
    }

    VexFutures.addCallback(Futures.successfulAsList(replies),
        (statuses) -> {
          if (generation != takeoverGeneration) {
            return;
          }
          final Map<Long, Long> positions = new HashMap<>();
          boolean someNotOpen = false;
          long furthestPeer = 0;
          long furthestPosition = local.lastAppliedOperationId();
          for (int i = 0; i < others.size(); i++) {
            ReplicaStatusReply status = statuses.get(i);
            if (status != null && !status.hasReplica) {
              someNotOpen = true;
            } else if (status != null) {
              positions.put(others.get(i), status.lastAppliedOperationId);
              if (status.lastAppliedOperationId > furthestPosition) {
                furthestPeer = others.get(i);
                furthestPosition = status.lastAppliedOperationId;
              }
            }
          }

          if (someNotOpen && attempt < SHARD_TAKEOVER_STATUS_ATTEMPTS) {
            fiber.schedule(() -> {
              if (generation == takeoverGeneration) {
                queryPositions(generation, others, attempt + 1);
              }
            }, forwardTimeoutMillis, TimeUnit.MILLISECONDS);
          } else if (furthestPeer == 0) {
            finishTakeover(generation, positions);
          } else {
            pullForTakeover(generation, furthestPeer, furthestPosition, positions);
          }
        },
        (failure) -> logger.error("takeover of shard {} failed", shardId, failure), fiber);
  }

  @FiberOnly
  private void pullForTakeover(long generation, long peer, long position, Map<Long, Long> positions) {
    logger.info("pulling operations {} through {} from peer {}", local.lastAppliedOperationId() + 1, position, peer);

    ListenableFuture<FetchOperationsReply> fetch = peerClient.send(peer,
        new FetchOperations(shardId, local.lastAppliedOperationId(), position),
        FetchOperationsReply.class, SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS);

    VexFutures.addCallback(fetch,
        (reply) -> {
          if (generation != takeoverGeneration) {
            return;
          }
          if (reply.isCovered()) {
            applyPulled(reply.operations);
            finishTakeover(generation, positions);
          } else {
            pullSnapshotForTakeover(generation, peer, positions);
          }
        },
        (failure) -> {
          logger.warn("unable to pull operations from peer {}; operations it applied beyond {} are lost",
              peer, local.lastAppliedOperationId(), failure);
          if (generation == takeoverGeneration) {
            finishTakeover(generation, positions);
          }
        }, fiber);
  }

  @FiberOnly
  private void pullSnapshotForTakeover(long generation, long peer, Map<Long, Long> positions) {
    ListenableFuture<TransferSnapshotReply> snapshot = peerClient.send(peer,
        new TransferSnapshot(shardId, shardId, 0), TransferSnapshotReply.class,
        SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS);

    VexFutures.addCallback(snapshot,
        (reply) -> {
          if (generation != takeoverGeneration) {
            return;
          }
          try {
            local.importSnapshot(reply.data, reply.cutoffOperationId);
          } catch (IOException | StorageException e) {
            logger.error("unable to install snapshot from peer {}", peer, e);
          }
          finishTakeover(generation, positions);
        },
        (failure) -> {
          logger.warn("unable to pull a snapshot from peer {}", peer, failure);
          if (generation == takeoverGeneration) {
            finishTakeover(generation, positions);
          }
        }, fiber);
  }

  @FiberOnly
  private void applyPulled(List<Operation> operations) {
    for (Operation operation : operations) {
      try {
        local.apply(operation);
      } catch (IOException | StorageException e) {
        logger.error("unable to apply pulled operation {}", operation.getOperationId(), e);
        return;
      }
    }
  }

  @FiberOnly
  private void finishTakeover(long generation, Map<Long, Long> positions) {
    if (generation != takeoverGeneration || !primary) {
      return;
    }
    lastAssignedOperationId = local.lastAppliedOperationId();
    ready = true;
    logger.info("primary of shard {} ready at operation {}", shardId, lastAssignedOperationId);

    for (Map.Entry<Long, ReplicaRole> replica : shard.replicas.entrySet()) {
      long peer = replica.getKey();
      if (peer == myId || replica.getValue() == ReplicaRole.INITIALIZING) {
        continue;
      }
      Long position = positions.get(peer);
      if (position == null) {
        replicaStates.put(peer, new ReplicaState(peer, shardId, 0, ReplicaHealth.ACTIVE));
        markDead(peer);
      } else if (position == lastAssignedOperationId && replica.getValue() == ReplicaRole.ACTIVE) {
        replicaStates.put(peer, new ReplicaState(peer, shardId, position, ReplicaHealth.ACTIVE));
      } else {
        replicaStates.put(peer, new ReplicaState(peer, shardId, position, ReplicaHealth.ACTIVE));
        markDead(peer);
        startResync(peer, position);
      }
    }
  }

  /**
   * writes
   */

  @FiberOnly
  private void doSubmit(String key, byte[] payload, boolean waitForAll, SettableFuture<UpdateStatus> result) {
    if (!primary) {
      result.setException(new StaleTopologyException("node " + myId + " is not the primary of shard " + shardId));
      return;
    }
    if (!ready) {
      result.setException(new ShardNotReadyException(shardId));
      return;
    }
    if (!shard.range.containsKey(key)) {
      result.setException(new StaleTopologyException("key " + key + " is outside shard " + shardId + " " + shard.range));
      return;
    }

    final Operation operation = new Operation(lastAssignedOperationId + 1, shardId, key, payload);
    try {
      local.apply(operation);
    } catch (IOException e) {
      result.setException(new StorageException("unable to log operation " + operation.getOperationId(), e));
      return;
    } catch (StorageException e) {
      // Not applied anywhere; the id goes to the next write.
      result.setException(e);
      return;
    }
    lastAssignedOperationId = operation.getOperationId();

    if (!waitForAll) {
      forwardToReplicas(operation, null);
      result.set(UpdateStatus.ACKNOWLEDGED);
      return;
    }

    Set<Long> required = new HashSet<>();
    for (ReplicaState state : replicaStates.values()) {
      if (state.health == ReplicaHealth.ACTIVE) {
        required.add(state.peerId);
      }
    }
    PendingWrite write = new PendingWrite(operation.getOperationId(), required, result);
    pendingWrites.put(write.operationId, write);
    forwardToReplicas(operation, write);
    write.completeIfDone();
    if (!result.isDone()) {
      fiber.schedule(write::expire, 2 * forwardTimeoutMillis, TimeUnit.MILLISECONDS);
    }
  }

  @FiberOnly
  private void forwardToReplicas(Operation operation, @Nullable PendingWrite write) {
    Set<Long> targets = new TreeSet<>(initializingPeers);
    for (ReplicaState state : replicaStates.values()) {
      if (state.health != ReplicaHealth.DEAD) {
        targets.add(state.peerId);
      }
    }

    for (long peer : targets) {
      ListenableFuture<OperationAck> ack = peerClient.send(peer, new ForwardOperation(shardId, operation),
          OperationAck.class, forwardTimeoutMillis);

      VexFutures.addCallback(ack,
          (reply) -> {
            ReplicaState state = replicaStates.get(peer);
            if (state != null) {
              replicaStates.put(peer, state.withLastApplied(reply.lastAppliedOperationId));
            }
            if (reply.lastAppliedOperationId >= operation.getOperationId()) {
              if (write != null) {
                write.acknowledged(peer);
              }
            } else if (state != null && state.health == ReplicaHealth.ACTIVE) {
              logger.warn("replica on peer {} answered operation {} at only {}",
                  peer, operation.getOperationId(), reply.lastAppliedOperationId);
              markDead(peer);
              if (write != null) {
                write.failed(peer);
              }
            }
          },
          (failure) -> {
            ReplicaState state = replicaStates.get(peer);
            if (state != null && state.health != ReplicaHealth.DEAD) {
              logger.warn("replica on peer {} failed operation {}: {}", peer, operation.getOperationId(), failure.toString());
              markDead(peer);
            }
            if (write != null) {
              write.failed(peer);
            }
          }, fiber);
    }
  }

  /**
   * Stop counting on a replica: it no longer receives operations and is no longer waited for.
   * If the topology still has it active, propose that it is dead.
   */
  @FiberOnly
  private void markDead(long peer) {
    ReplicaState state = replicaStates.get(peer);
    if (state == null || state.health == ReplicaHealth.DEAD) {
      return;
    }
    replicaStates.put(peer, state.withHealth(ReplicaHealth.DEAD));
    awaitingActivation.remove(peer);

    for (PendingWrite write : new ArrayList<>(pendingWrites.values())) {
      write.failed(peer);
    }

    if (shard.roleOf(peer) == ReplicaRole.ACTIVE) {
      VexFutures.addCallback(proposer.propose(new SetReplicaState(shardId, peer, ReplicaRole.DEAD)),
          (index) -> logger.info("replica on peer {} recorded dead at index {}", peer, index),
          (failure) -> logger.warn("unable to record replica on peer {} dead", peer, failure), fiber);
    }
  }

  /**
   * recovery
   */

  @FiberOnly
  private void probeDeadReplicas() {
    if (!primary || !ready) {
      return;
    }
    for (ReplicaState state : new ArrayList<>(replicaStates.values())) {
      final long peer = state.peerId;
      if (state.health != ReplicaHealth.DEAD || resyncInFlight.contains(peer)) {
        continue;
      }
      resyncInFlight.add(peer);
      VexFutures.addCallback(
          peerClient.send(peer, new ReplicaStatusRequest(shardId), ReplicaStatusReply.class, forwardTimeoutMillis),
          (reply) -> {
            if (reply.hasReplica && replicaStates.containsKey(peer)) {
              logger.info("replica on peer {} answers at operation {}; resyncing", peer, reply.lastAppliedOperationId);
              startResync(peer, reply.lastAppliedOperationId);
            } else {
              resyncInFlight.remove(peer);
            }
          },
          (failure) -> resyncInFlight.remove(peer), fiber);
    }
  }

  @FiberOnly
  private void startResync(long peer, long position) {
    ReplicaState state = replicaStates.get(peer);
    if (state == null) {
      return;
    }
    replicaStates.put(peer, new ReplicaState(peer, shardId, position, ReplicaHealth.RESYNCING));
    resyncInFlight.add(peer);
    sendCatchUp(peer, position);
  }

  @FiberOnly
  private void sendCatchUp(long peer, long position) {
    ReplicaState state = replicaStates.get(peer);
    if (!primary || !ready || state == null || state.health != ReplicaHealth.RESYNCING) {
      resyncInFlight.remove(peer);
      return;
    }

    final CatchUp catchUp;
    try {
      catchUp = buildCatchUp(position);
    } catch (IOException | StorageException e) {
      logger.error("unable to read operations for peer {}", peer, e);
      resyncFailed(peer);
      return;
    }

    VexFutures.addCallback(
        peerClient.send(peer, catchUp, OperationAck.class, SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS),
        (ack) -> {
          ReplicaState current = replicaStates.get(peer);
          if (current == null || current.health != ReplicaHealth.RESYNCING) {
            resyncInFlight.remove(peer);
            return;
          }
          replicaStates.put(peer, new ReplicaState(peer, shardId, ack.lastAppliedOperationId, ReplicaHealth.RESYNCING));
          if (ack.lastAppliedOperationId >= lastAssignedOperationId) {
            resyncInFlight.remove(peer);
            proposeActive(peer);
          } else {
            sendCatchUp(peer, ack.lastAppliedOperationId);
          }
        },
        (failure) -> {
          logger.warn("catch-up of peer {} failed: {}", peer, failure.toString());
          resyncFailed(peer);
        }, fiber);
  }

  @FiberOnly
  private CatchUp buildCatchUp(long position) throws IOException, StorageException {
    if (position <= lastAssignedOperationId) {
      long through = Math.min(lastAssignedOperationId, position + SHARD_MAXIMUM_CATCH_UP_OPERATIONS);
      List<Operation> operations = local.operationsBetween(position, through);
      if (operations != null) {
        return new CatchUp(shardId, null, 0, operations);
      }
    }
    // The log no longer reaches back to the replica's position, or the replica went further
    // than this primary did; either way its state is replaced.
    LocalReplica.ShardSnapshot snapshot = local.exportSnapshot();
    return new CatchUp(shardId, snapshot.data, snapshot.lastOperationId, Collections.emptyList());
  }

  @FiberOnly
  private void resyncFailed(long peer) {
    resyncInFlight.remove(peer);
    ReplicaState state = replicaStates.get(peer);
    if (state != null) {
      replicaStates.put(peer, state.withHealth(ReplicaHealth.DEAD));
    }
  }

  @FiberOnly
  private void proposeActive(long peer) {
    logger.info("replica on peer {} caught up at operation {}", peer, lastAssignedOperationId);
    awaitingActivation.add(peer);
    VexFutures.addCallback(proposer.propose(new SetReplicaState(shardId, peer, ReplicaRole.ACTIVE)),
        (index) -> logger.debug("replica on peer {} recorded active at index {}", peer, index),
        (failure) -> {
          logger.warn("unable to record replica on peer {} active", peer, failure);
          awaitingActivation.remove(peer);
          ReplicaState state = replicaStates.get(peer);
          if (state != null && state.health == ReplicaHealth.RESYNCING) {
            replicaStates.put(peer, state.withHealth(ReplicaHealth.DEAD));
          }
        }, fiber);
  }

  /**
   * requests from other nodes
   */

  @FiberOnly
  private void onRequest(Request<PeerRequest, PeerReply> request) {
    PeerMessage message = request.getRequest().message;
    if (message instanceof ForwardOperation) {
      onForwardOperation(request, (ForwardOperation) message);
    } else if (message instanceof FetchOperations) {
      onFetchOperations(request, (FetchOperations) message);
    } else if (message instanceof ReplicaStatusRequest) {
      reply(request, new ReplicaStatusReply(shardId, true, local.lastAppliedOperationId()));
    } else if (message instanceof TransferSnapshot) {
      onTransferSnapshot(request);
    } else if (message instanceof CatchUp) {
      onCatchUp(request, (CatchUp) message);
    } else if (message instanceof SubmitOperation) {
      onSubmitOperation(request, (SubmitOperation) message);
    } else {
      reply(request, RemoteError.of(new IllegalArgumentException("unexpected message " + message)));
    }
  }

  @FiberOnly
  private void onForwardOperation(Request<PeerRequest, PeerReply> request, ForwardOperation forward) {
    Operation operation = forward.operation;
    long operationId = operation.getOperationId();

    if (awaitingSnapshot) {
      // Held until the transfer snapshot is installed; the primary does not wait on this replica.
      bufferedOperations.put(operationId, operation);
      reply(request, new OperationAck(shardId, local.lastAppliedOperationId()));
      return;
    }
    if (operationId <= local.lastAppliedOperationId()) {
      reply(request, new OperationAck(shardId, local.lastAppliedOperationId()));
      return;
    }

    bufferedOperations.put(operationId, operation);
    deferredAcks.computeIfAbsent(operationId, (k) -> new ArrayList<>()).add(request);
    applyBufferedOperations();
    if (!bufferedOperations.isEmpty()) {
      fetchGap(request.getRequest().from);
    }
  }

  /**
   * Apply buffered operations for as long as they follow on, then acknowledge what was applied.
   */
  @FiberOnly
  private void applyBufferedOperations() {
    while (!bufferedOperations.isEmpty()) {
      Operation next = bufferedOperations.firstEntry().getValue();
      long nextId = next.getOperationId();
      if (nextId <= local.lastAppliedOperationId()) {
        bufferedOperations.pollFirstEntry();
        continue;
      }
      if (nextId != local.lastAppliedOperationId() + 1) {
        break;
      }

      bufferedOperations.pollFirstEntry();
      try {
        local.apply(next);
      } catch (IOException | StorageException e) {
        logger.error("unable to apply operation {}", nextId, e);
        replyToDeferred(nextId, RemoteError.of(e instanceof StorageException
            ? e : new StorageException("unable to log operation " + nextId, e)));
        // The primary counts this replica out and resyncs it.
        break;
      }
    }

    Map<Long, List<Request<PeerRequest, PeerReply>>> applied = deferredAcks.headMap(local.lastAppliedOperationId(), true);
    for (List<Request<PeerRequest, PeerReply>> requests : applied.values()) {
      for (Request<PeerRequest, PeerReply> request : requests) {
        reply(request, new OperationAck(shardId, local.lastAppliedOperationId()));
      }
    }
    applied.clear();
  }

  @FiberOnly
  private void replyToDeferred(long operationId, PeerMessage message) {
    List<Request<PeerRequest, PeerReply>> requests = deferredAcks.remove(operationId);
    if (requests != null) {
      for (Request<PeerRequest, PeerReply> request : requests) {
        reply(request, message);
      }
    }
  }

  /**
   * Ask the sender of an early operation for the ones before it.
   */
  @FiberOnly
  private void fetchGap(long peer) {
    if (gapFetchInFlight || bufferedOperations.isEmpty()) {
      return;
    }
    final long after = local.lastAppliedOperationId();
    final long through = bufferedOperations.firstKey() - 1;
    if (through <= after) {
      return;
    }
    gapFetchInFlight = true;
    logger.debug("fetching operations {} through {} from peer {}", after + 1, through, peer);

    VexFutures.addCallback(
        peerClient.send(peer, new FetchOperations(shardId, after, through), FetchOperationsReply.class,
            forwardTimeoutMillis),
        (reply) -> {
          gapFetchInFlight = false;
          if (!reply.isCovered()) {
            logger.warn("peer {} no longer holds operations {} through {}", peer, after + 1, through);
            return;
          }
          for (Operation operation : reply.operations) {
            bufferedOperations.putIfAbsent(operation.getOperationId(), operation);
          }
          long before = local.lastAppliedOperationId();
          applyBufferedOperations();
          if (local.lastAppliedOperationId() > before) {
            fetchGap(peer);
          }
        },
        (failure) -> {
          gapFetchInFlight = false;
          logger.debug("unable to fetch operations from peer {}: {}", peer, failure.toString());
        }, fiber);
  }

  @FiberOnly
  private void onFetchOperations(Request<PeerRequest, PeerReply> request, FetchOperations fetch) {
    try {
      List<Operation> operations = local.operationsBetween(fetch.afterOperationId, fetch.throughOperationId);
      reply(request, new FetchOperationsReply(shardId, operations, local.lastAppliedOperationId()));
    } catch (IOException e) {
      reply(request, RemoteError.of(new StorageException("unable to read operation log", e)));
    }
  }

  /**
   * The snapshot and its cut-off are taken together on this fiber, so that every operation
   * after the cut-off is one that gets forwarded.
   */
  @FiberOnly
  private void onTransferSnapshot(Request<PeerRequest, PeerReply> request) {
    if (awaitingSnapshot || (primary && !ready)) {
      reply(request, RemoteError.of(new ShardNotReadyException(shardId)));
      return;
    }
    try {
      LocalReplica.ShardSnapshot snapshot = local.exportSnapshot();
      reply(request, new TransferSnapshotReply(shardId, snapshot.data, snapshot.lastOperationId));
    } catch (IOException | StorageException e) {
      logger.error("unable to export snapshot", e);
      reply(request, RemoteError.of(e instanceof StorageException
          ? e : new StorageException("unable to export shard " + shardId, e)));
    }
  }

  @FiberOnly
  private void onCatchUp(Request<PeerRequest, PeerReply> request, CatchUp catchUp) {
    try {
      if (catchUp.hasSnapshot()) {
        local.importSnapshot(catchUp.snapshot, catchUp.snapshotOperationId);
        awaitingSnapshot = false;
      }
    } catch (IOException | StorageException e) {
      logger.error("unable to install catch-up snapshot", e);
      reply(request, RemoteError.of(e instanceof StorageException
          ? e : new StorageException("unable to install snapshot of shard " + shardId, e)));
      return;
    }

    for (Operation operation : catchUp.operations) {
      bufferedOperations.putIfAbsent(operation.getOperationId(), operation);
    }
    applyBufferedOperations();
    reply(request, new OperationAck(shardId, local.lastAppliedOperationId()));
  }

  @FiberOnly
  private void onSubmitOperation(Request<PeerRequest, PeerReply> request, SubmitOperation submit) {
    SettableFuture<UpdateStatus> result = SettableFuture.create();
    VexFutures.addCallback(result,
        (status) -> reply(request, new SubmitOperationReply(status)),
        (failure) -> reply(request, RemoteError.of(failure)), fiber);
    doSubmit(submit.key, submit.payload, submit.waitForAll, result);
  }

  /**
   * transfer target
   */

  @FiberOnly
  private void catchUpWithPrimary(SettableFuture<Long> result) {
    final long primaryPeer = shard.primary();
    if (primaryPeer == 0 || primaryPeer == myId) {
      result.set(local.lastAppliedOperationId());
      return;
    }

    VexFutures.addCallback(
        peerClient.send(primaryPeer, new ReplicaStatusRequest(shardId), ReplicaStatusReply.class, forwardTimeoutMillis),
        (status) -> {
          final long target = status.lastAppliedOperationId;
          if (local.lastAppliedOperationId() >= target) {
            result.set(target);
            return;
          }
          VexFutures.addCallback(
              peerClient.send(primaryPeer,
                  new FetchOperations(shardId, local.lastAppliedOperationId(), target),
                  FetchOperationsReply.class, SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS),
              (fetched) -> {
                if (!fetched.isCovered()) {
                  result.setException(new IllegalStateException(
                      "primary " + primaryPeer + " no longer holds the operations after " + local.lastAppliedOperationId()));
                  return;
                }
                for (Operation operation : fetched.operations) {
                  bufferedOperations.putIfAbsent(operation.getOperationId(), operation);
                }
                applyBufferedOperations();
                catchUpWithPrimary(result);
              },
              result::setException, fiber);
        },
        result::setException, fiber);
  }

  private static void reply(Request<PeerRequest, PeerReply> request, PeerMessage message) {
    request.reply(new PeerReply(message));
  }

  /**
   * A write waiting for the active replicas to apply it.
   */
  private class PendingWrite {
    final long operationId;
    final Set<Long> awaiting;
    final Set<Long> failedPeers = new TreeSet<>();
    final SettableFuture<UpdateStatus> result;

    PendingWrite(long operationId, Set<Long> awaiting, SettableFuture<UpdateStatus> result) {
      this.operationId = operationId;
      this.awaiting = awaiting;
      this.result = result;
    }

    void acknowledged(long peer) {
      if (awaiting.remove(peer)) {
        completeIfDone();
      }
    }

    void failed(long peer) {
      if (awaiting.remove(peer)) {
        failedPeers.add(peer);
        completeIfDone();
      }
    }

    /**
     * Count out the replicas that have not answered by the deadline.
     */
    void expire() {
      if (result.isDone()) {
        return;
      }
      for (long peer : new ArrayList<>(awaiting)) {
        logger.warn("replica on peer {} did not apply operation {} in time", peer, operationId);
        markDead(peer);
        failed(peer);
      }
    }

    void completeIfDone() {
      if (!awaiting.isEmpty()) {
        return;
      }
      pendingWrites.remove(operationId);
      if (failedPeers.isEmpty()) {
        result.set(UpdateStatus.COMPLETED);
      } else {
        result.setException(new PartialFailureException(shardId, UpdateStatus.ACKNOWLEDGED, failedPeers));
      }
    }
  }
}
