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
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.Request;
import org.jetlang.channels.Subscriber;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.NodeConfiguration;
import vexdb.cluster.NodeStorage;
import vexdb.cluster.command.CreateAlias;
import vexdb.cluster.command.CreateCollection;
import vexdb.cluster.command.DeleteAlias;
import vexdb.cluster.command.DropCollection;
import vexdb.cluster.command.RenameAlias;
import vexdb.cluster.command.SplitShard;
import vexdb.cluster.command.StartTransfer;
import vexdb.cluster.command.UpdateCollection;
import vexdb.cluster.consensus.CommandProposer;
import vexdb.cluster.rpc.CatchUp;
import vexdb.cluster.rpc.FetchOperations;
import vexdb.cluster.rpc.ForwardOperation;
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
import vexdb.cluster.topology.CollectionInfo;
import vexdb.cluster.topology.ShardInfo;
import vexdb.cluster.topology.ShardTransferInfo;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.ShardNotReadyException;
import vexdb.interfaces.StaleTopologyException;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;
import vexdb.interfaces.shard.UpdateStatus;
import vexdb.shard.transfer.ShardTransferTask;
import vexdb.shard.transfer.TransferState;
import vexdb.util.FiberOnly;
import vexdb.util.FiberSupplier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;

/**
 * Owns this node's shard replicas. It routes writes by collection and key to the shard whose hash
 * range holds the key, and follows the committed topology: it opens a replica set for each shard
 * assigned to this node, closes and deletes the ones no longer assigned, and runs the transfers
 * that fill this node's new replicas.
 * <p>
 * Topology changes are proposed through the {@link CommandProposer}; this class only computes
 * their content.
 */
public class ShardManager {
  private final long myId;
  private final NodeConfiguration configuration;
  private final Fiber fiber;
  private final FiberSupplier fiberSupplier;
  private final NodeStorage storage;
  private final PeerClient peerClient;
  private final CommandProposer proposer;
  private final Logger logger;

  private final Map<Long, ShardReplicaSet> replicaSets = new TreeMap<>();
  private final Map<Long, HashRange> trimmedRanges = new HashMap<>();
  private final Map<Long, ShardTransferTask> transfers = new TreeMap<>();
  private final List<Request<PeerRequest, PeerReply>> deferredSnapshotRequests = new ArrayList<>();

  private volatile Topology topology = Topology.EMPTY;

  /**
   * The fiber is started by {@link #start} and disposed by {@link #dispose()}.
   */
  public ShardManager(NodeConfiguration configuration,
                      Fiber fiber,
                      FiberSupplier fiberSupplier,
                      NodeStorage storage,
                      PeerClient peerClient,
                      CommandProposer proposer) {
    this.myId = configuration.nodeId;
    this.configuration = configuration;
    this.fiber = fiber;
    this.fiberSupplier = fiberSupplier;
    this.storage = storage;
    this.peerClient = peerClient;
    this.proposer = proposer;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + myId + ")");
  }

  public void start(Subscriber<Topology> topologyChannel, Topology initialTopology) {
    fiber.start();
    topologyChannel.subscribe(fiber, this::onTopology);
    fiber.execute(() -> onTopology(initialTopology));
  }

  public ListenableFuture<Void> dispose() {
    final SettableFuture<Void> result = SettableFuture.create();
    fiber.execute(() -> {
      for (ShardTransferTask task : transfers.values()) {
        task.cancel();
      }
      transfers.clear();
      List<ListenableFuture<Void>> closed = new ArrayList<>();
      for (ShardReplicaSet replicaSet : replicaSets.values()) {
        closed.add(replicaSet.dispose(false));
      }
      replicaSets.clear();
      result.setFuture(Futures.transform(Futures.successfulAsList(closed), (ignore) -> null,
          MoreExecutors.directExecutor()));
      fiber.dispose();
    });
    return result;
  }

  /**
   * The topology this manager last followed.
   */
  public Topology getTopology() {
    return topology;
  }

  /**
   * routing
   */

  /**
   * @return the id of the shard whose hash range holds the key.
   * @throws StaleTopologyException if the collection, or alias, is unknown.
   */
  public long route(String collection, String key) throws StaleTopologyException {
    return shardFor(topology, collection, key).shardId;
  }

  /**
   * @throws ShardNotReadyException if the shard has no active replica yet.
   */
  public ShardLocation locateForRead(String collection, String key)
      throws StaleTopologyException, ShardNotReadyException {
    ShardInfo shard = shardFor(topology, collection, key);
    List<Long> active = shard.activePeers();
    if (active.isEmpty()) {
      throw new ShardNotReadyException(shard.shardId);
    }
    return new ShardLocation(shard.collection, shard.shardId, shard.range, shard.primary(), active);
  }

  /**
   * Write to the shard holding the key, through its primary: this node's replica set if this
   * node is the primary, otherwise the primary's, by forwarding.
   */
  public ListenableFuture<UpdateStatus> submit(String collection, String key, byte[] payload, boolean waitForAll) {
    final ShardInfo shard;
    try {
      shard = shardFor(topology, collection, key);
    } catch (StaleTopologyException e) {
      return Futures.immediateFailedFuture(e);
    }

    final long primary = shard.primary();
    if (primary == 0) {
      return Futures.immediateFailedFuture(new ShardNotReadyException(shard.shardId));
    }

    if (primary == myId) {
      final SettableFuture<UpdateStatus> result = SettableFuture.create();
      fiber.execute(() -> {
        ShardReplicaSet replicaSet = replicaSets.get(shard.shardId);
        if (replicaSet == null) {
          result.setException(new ShardNotReadyException(shard.shardId));
        } else {
          result.setFuture(replicaSet.submit(key, payload, waitForAll));
        }
      });
      return result;
    }

    // The primary may itself wait up to the forward timeout for its replicas.
    ListenableFuture<SubmitOperationReply> forwarded = peerClient.send(primary,
        new SubmitOperation(shard.shardId, key, payload, waitForAll), SubmitOperationReply.class,
        2 * configuration.forwardTimeoutMillis);

    ListenableFuture<SubmitOperationReply> mapped = Futures.catchingAsync(forwarded, TimeoutException.class,
        (timeout) -> Futures.immediateFailedFuture(
            new StaleTopologyException("primary " + primary + " of shard " + shard.shardId + " did not answer")),
        MoreExecutors.directExecutor());
    return Futures.transform(mapped, (reply) -> reply.status, MoreExecutors.directExecutor());
  }

  /**
   * metadata changes
   */

  /**
   * Propose a collection whose shards are spread round-robin over the voting peers.
   */
  public ListenableFuture<Long> createCollection(String name,
                                                 int shardCount,
                                                 int replicationFactor,
                                                 int writeConsistencyFactor) {
    Topology current = topology;
    List<Long> peers = current.voters();
    if (peers.isEmpty()) {
      peers = new ArrayList<>(current.peers.keySet());
    }
    List<List<Long>> placement = placeShards(peers, shardCount, replicationFactor);
    return proposer.propose(new CreateCollection(name, shardCount, replicationFactor, writeConsistencyFactor, placement));
  }

  public ListenableFuture<Long> dropCollection(String name) {
    return proposer.propose(new DropCollection(name));
  }

  /**
   * A factor of zero leaves that factor as it is.
   */
  public ListenableFuture<Long> updateCollection(String name, int replicationFactor, int writeConsistencyFactor) {
    return proposer.propose(new UpdateCollection(name, replicationFactor, writeConsistencyFactor));
  }

  public ListenableFuture<Long> createAlias(String alias, String collection) {
    return proposer.propose(new CreateAlias(alias, collection));
  }

  public ListenableFuture<Long> deleteAlias(String alias) {
    return proposer.propose(new DeleteAlias(alias));
  }

  public ListenableFuture<Long> renameAlias(String oldAlias, String newAlias) {
    return proposer.propose(new RenameAlias(oldAlias, newAlias));
  }

  /**
   * Split a shard in two; the new upper half is placed on the same peers as the shard.
   */
  public ListenableFuture<Long> splitShard(String collection, long shardId) {
    final ShardInfo shard;
    try {
      shard = shardOf(topology, collection, shardId);
    } catch (StaleTopologyException e) {
      return Futures.immediateFailedFuture(e);
    }
    return proposer.propose(new SplitShard(shardId, new ArrayList<>(shard.replicas.keySet())));
  }

  /**
   * Add a replica of a shard on another peer, copied from the shard's primary.
   */
  public ListenableFuture<Long> replicateShard(String collection, long shardId, long toPeer) {
    final ShardInfo shard;
    try {
      shard = shardOf(topology, collection, shardId);
    } catch (StaleTopologyException e) {
      return Futures.immediateFailedFuture(e);
    }
    if (shard.primary() == 0) {
      return Futures.immediateFailedFuture(new ShardNotReadyException(shardId));
    }
    return proposer.propose(new StartTransfer(shardId, shard.primary(), toPeer));
  }

  /**
   * status
   */

  public ListenableFuture<List<ReplicaSetStatus>> replicaSetStatuses() {
    final SettableFuture<List<ReplicaSetStatus>> result = SettableFuture.create();
    fiber.execute(() -> {
      List<ListenableFuture<ReplicaSetStatus>> statuses = new ArrayList<>();
      for (ShardReplicaSet replicaSet : replicaSets.values()) {
        statuses.add(replicaSet.status());
      }
      result.setFuture(Futures.allAsList(statuses));
    });
    return result;
  }

  public ListenableFuture<Map<Long, TransferState>> transferStates() {
    final SettableFuture<Map<Long, TransferState>> result = SettableFuture.create();
    fiber.execute(() -> {
      Map<Long, TransferState> states = new TreeMap<>();
      for (Map.Entry<Long, ShardTransferTask> transfer : transfers.entrySet()) {
        states.put(transfer.getKey(), transfer.getValue().getState());
      }
      result.set(states);
    });
    return result;
  }

  /**
   * Handle a shard replication request from another node.
   */
  public void handleRequest(Request<PeerRequest, PeerReply> request) {
    fiber.execute(() -> dispatch(request));
  }

  /**
   * Spread the replicas of each shard over consecutive peers, starting one peer further for each
   * shard.
   */
  static List<List<Long>> placeShards(List<Long> peers, int shardCount, int replicationFactor) {
    List<List<Long>> placement = new ArrayList<>();
    int replicas = Math.min(replicationFactor, peers.size());
    for (int shard = 0; shard < shardCount; shard++) {
      List<Long> shardPeers = new ArrayList<>();
      for (int replica = 0; replica < replicas; replica++) {
        shardPeers.add(peers.get((shard + replica) % peers.size()));
      }
      placement.add(shardPeers);
    }
    return placement;
  }

  private static ShardInfo shardFor(Topology topology, String collection, String key) throws StaleTopologyException {
    CollectionInfo info = topology.resolveCollection(collection);
    if (info == null) {
      throw new StaleTopologyException("unknown collection " + collection);
    }
    ShardInfo shard = topology.shardForKey(info.name, key);
    if (shard == null) {
      throw new StaleTopologyException("no shard of " + info.name + " holds key " + key);
    }
    return shard;
  }

  private static ShardInfo shardOf(Topology topology, String collection, long shardId) throws StaleTopologyException {
    CollectionInfo info = topology.resolveCollection(collection);
    ShardInfo shard = topology.shard(shardId);
    if (info == null || shard == null || !shard.collection.equals(info.name)) {
      throw new StaleTopologyException("collection " + collection + " has no shard " + shardId);
    }
    return shard;
  }

  /**
   * topology
   */

  @FiberOnly
  private void onTopology(Topology newTopology) {
    if (newTopology.index < topology.index) {
      return;
    }
    topology = newTopology;

    for (ShardInfo shard : newTopology.shards.values()) {
      if (!shard.hasReplicaOn(myId)) {
        continue;
      }
      ShardReplicaSet replicaSet = replicaSets.get(shard.shardId);
      if (replicaSet == null) {
        replicaSet = openReplicaSet(shard);
        if (replicaSet == null) {
          continue;
        }
      } else {
        replicaSet.updateShard(shard);
      }
      trimAfterSplit(newTopology, shard, replicaSet);
    }

    Iterator<Map.Entry<Long, ShardReplicaSet>> iterator = replicaSets.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<Long, ShardReplicaSet> entry = iterator.next();
      ShardInfo shard = newTopology.shard(entry.getKey());
      if (shard == null || !shard.hasReplicaOn(myId)) {
        logger.info("shard {} no longer has a replica here; deleting it", entry.getKey());
        entry.getValue().dispose(true);
        trimmedRanges.remove(entry.getKey());
        iterator.remove();
      }
    }

    followTransfers(newTopology);
    releaseDeferredSnapshotRequests();
  }

  @FiberOnly
  private ShardReplicaSet openReplicaSet(ShardInfo shard) {
    final long shardId = shard.shardId;
    final LocalReplica local;
    try {
      local = storage.openReplica(shardId, configuration.retainedOperations);
    } catch (IOException | StorageException e) {
      logger.error("unable to open replica of shard {}", shardId, e);
      return null;
    }

    Fiber replicaFiber = fiberSupplier.getNewFiber(
        (throwable) -> logger.error("replica set of shard {} failed", shardId, throwable));
    replicaFiber.start();
    ShardReplicaSet replicaSet = new ShardReplicaSet(myId, shard, replicaFiber, local, peerClient, proposer,
        configuration.forwardTimeoutMillis, configuration.healthProbeIntervalMillis);
    replicaSets.put(shardId, replicaSet);
    logger.info("opened replica of shard {} at operation {}", shardId, local.lastAppliedOperationId());
    return replicaSet;
  }

  /**
   * A split shard keeps the points of its lost upper half until the new shard's replicas have
   * copied them. A replica just opened is trimmed once too, in case the node stopped before it was.
   */
  @FiberOnly
  private void trimAfterSplit(Topology newTopology, ShardInfo shard, ShardReplicaSet replicaSet) {
    if (shard.range.equals(trimmedRanges.get(shard.shardId)) || newTopology.hasTransfersFrom(shard.shardId)) {
      return;
    }
    replicaSet.retainRange(shard.range);
    trimmedRanges.put(shard.shardId, shard.range);
  }

  @FiberOnly
  private void followTransfers(Topology newTopology) {
    Set<Long> current = new HashSet<>();
    for (ShardTransferInfo transfer : newTopology.transfersTo(myId)) {
      current.add(transfer.shardId);
      ShardTransferTask task = transfers.get(transfer.shardId);
      if (task != null && task.getState() != TransferState.ABORTED) {
        continue;
      }
      ShardReplicaSet target = replicaSets.get(transfer.shardId);
      if (target == null) {
        continue;
      }
      task = new ShardTransferTask(myId, transfer, newTopology.index, target, fiber, peerClient, proposer,
          this::getTopology, configuration.transferRetryDelayMillis, configuration.maxTransferAttempts);
      transfers.put(transfer.shardId, task);
      task.start();
    }

    Iterator<Map.Entry<Long, ShardTransferTask>> iterator = transfers.entrySet().iterator();
    while (iterator.hasNext()) {
      Map.Entry<Long, ShardTransferTask> entry = iterator.next();
      if (!current.contains(entry.getKey())) {
        entry.getValue().cancel();
        iterator.remove();
      }
    }
  }

  /**
   * requests from other nodes
   */

  @FiberOnly
  private void dispatch(Request<PeerRequest, PeerReply> request) {
    PeerMessage message = request.getRequest().message;
    if (message instanceof TransferSnapshot && ((TransferSnapshot) message).topologyIndex > topology.index) {
      // The requester knows of a split or transfer this node has not applied yet.
      deferredSnapshotRequests.add(request);
      return;
    }

    long shardId = shardIdOf(message);
    ShardReplicaSet replicaSet = replicaSets.get(shardId);
    if (replicaSet != null) {
      replicaSet.handleRequest(request);
    } else if (message instanceof ReplicaStatusRequest) {
      request.reply(new PeerReply(new ReplicaStatusReply(shardId, false, 0)));
    } else {
      request.reply(new PeerReply(RemoteError.of(
          new StaleTopologyException("node " + myId + " has no replica of shard " + shardId))));
    }
  }

  @FiberOnly
  private void releaseDeferredSnapshotRequests() {
    List<Request<PeerRequest, PeerReply>> waiting = new ArrayList<>(deferredSnapshotRequests);
    deferredSnapshotRequests.clear();
    for (Request<PeerRequest, PeerReply> request : waiting) {
      dispatch(request);
    }
  }

  private static long shardIdOf(PeerMessage message) {
    if (message instanceof ForwardOperation) {
      return ((ForwardOperation) message).shardId;
    } else if (message instanceof FetchOperations) {
      return ((FetchOperations) message).shardId;
    } else if (message instanceof ReplicaStatusRequest) {
      return ((ReplicaStatusRequest) message).shardId;
    } else if (message instanceof TransferSnapshot) {
      return ((TransferSnapshot) message).sourceShardId;
    } else if (message instanceof CatchUp) {
      return ((CatchUp) message).shardId;
    } else if (message instanceof SubmitOperation) {
      return ((SubmitOperation) message).shardId;
    }
    return 0;
  }
}
