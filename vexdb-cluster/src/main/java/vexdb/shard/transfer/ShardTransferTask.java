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

package vexdb.shard.transfer;

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.command.AbortTransfer;
import vexdb.cluster.command.FinishTransfer;
import vexdb.cluster.consensus.CommandProposer;
import vexdb.cluster.rpc.PeerClient;
import vexdb.cluster.rpc.TransferSnapshot;
import vexdb.cluster.rpc.TransferSnapshotReply;
import vexdb.cluster.topology.ReplicaRole;
import vexdb.cluster.topology.ShardInfo;
import vexdb.cluster.topology.ShardTransferInfo;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.StaleTopologyException;
import vexdb.interfaces.shard.HashRange;
import vexdb.shard.ShardReplicaSet;
import vexdb.util.FiberOnly;
import vexdb.util.VexFutures;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static vexdb.ClusterConstants.SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS;

/**
 * Fills this node's INITIALIZING replica of a shard. The replica holds the operations forwarded to
 * it while a snapshot is fetched from the source shard's primary; the snapshot is installed at its
 * cut-off, the held operations applied on top, and the replica then catches up with the primary.
 * Once it has, FinishTransfer is proposed, and the committed entry makes the replica ACTIVE.
 * <p>
 * A failed attempt is retried after a delay, from the start. After too many attempts the transfer
 * is aborted, which removes the replica from the shard.
 */
public class ShardTransferTask {
  private final long myId;
  private final ShardTransferInfo transfer;
  private final long topologyIndex;
  private final ShardReplicaSet target;
  private final Fiber fiber;
  private final PeerClient peerClient;
  private final CommandProposer proposer;
  private final Supplier<Topology> topologySupplier;
  private final long retryDelayMillis;
  private final int maxAttempts;
  private final Logger logger;

  private volatile TransferState state = TransferState.QUEUED;
  private volatile boolean cancelled;
  private int attempts;

  /**
   * @param topologyIndex the index of a topology that includes the transfer. The source waits
   *                      until it has applied that index before taking the snapshot.
   * @param fiber         where the task's steps run.
   */
  public ShardTransferTask(long myId,
                           ShardTransferInfo transfer,
                           long topologyIndex,
                           ShardReplicaSet target,
                           Fiber fiber,
                           PeerClient peerClient,
                           CommandProposer proposer,
                           Supplier<Topology> topologySupplier,
                           long retryDelayMillis,
                           int maxAttempts) {
    this.myId = myId;
    this.transfer = transfer;
    this.topologyIndex = topologyIndex;
    this.target = target;
    this.fiber = fiber;
    this.peerClient = peerClient;
    this.proposer = proposer;
    this.topologySupplier = topologySupplier;
    this.retryDelayMillis = retryDelayMillis;
    this.maxAttempts = maxAttempts;
    this.logger = LoggerFactory.getLogger("(" + getClass().getSimpleName() + " - " + myId + " - "
        + transfer.shardId + ")");
  }

  public ShardTransferInfo getTransfer() {
    return transfer;
  }

  public TransferState getState() {
    return state;
  }

  public void start() {
    fiber.execute(this::attempt);
  }

  /**
   * Stop, because the transfer has left the topology: finished, aborted, or its shard dropped.
   */
  public void cancel() {
    fiber.execute(() -> cancelled = true);
  }

  @FiberOnly
  private void attempt() {
    if (cancelled || state == TransferState.ACTIVE || state == TransferState.ABORTED) {
      return;
    }
    attempts++;

    final Topology topology = topologySupplier.get();
    final ShardInfo source = topology.shard(transfer.sourceShardId);
    final ShardInfo destination = topology.shard(transfer.shardId);
    if (source == null || destination == null) {
      logger.info("shard {} is gone; stopping transfer", source == null ? transfer.sourceShardId : transfer.shardId);
      cancelled = true;
      return;
    }
    final ReplicaRole role = destination.roleOf(myId);
    if (role != ReplicaRole.INITIALIZING) {
      // A FinishTransfer from an earlier attempt committed after that attempt gave up on it.
      logger.info("replica of shard {} is {}; nothing left to transfer", transfer.shardId, role);
      if (role == ReplicaRole.ACTIVE) {
        state = TransferState.ACTIVE;
      } else {
        cancelled = true;
      }
      return;
    }
    final long sourcePeer = source.primary() != 0 ? source.primary() : transfer.fromPeer;

    state = TransferState.SNAPSHOTTING;
    logger.info("attempt {} of transfer {}: fetching snapshot of shard {} from peer {}",
        attempts, transfer, transfer.sourceShardId, sourcePeer);
    target.expectSnapshot();

    ListenableFuture<TransferSnapshotReply> snapshot = peerClient.send(sourcePeer,
        new TransferSnapshot(transfer.shardId, transfer.sourceShardId, topologyIndex),
        TransferSnapshotReply.class, SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS);

    // A split copies the parent's points into a shard with its own, fresh, operation ids.
    final long position = transfer.isSplit() ? 0 : -1;
    final HashRange retain = transfer.isSplit() ? destination.range : null;

    ListenableFuture<Long> installed = Futures.transformAsync(snapshot,
        (reply) -> {
          state = TransferState.CATCHING_UP;
          return target.installTransferSnapshot(reply.data, position < 0 ? reply.cutoffOperationId : position, retain);
        }, MoreExecutors.directExecutor());

    ListenableFuture<Long> caughtUp = Futures.transformAsync(installed,
        (ignore) -> target.catchUpWithPrimary(), MoreExecutors.directExecutor());

    ListenableFuture<Long> finished = Futures.transformAsync(caughtUp,
        (reached) -> {
          if (cancelled) {
            return Futures.immediateFailedFuture(new StaleTopologyException("transfer " + transfer + " cancelled"));
          }
          logger.info("transfer caught up at operation {}; proposing it finished", reached);
          return proposer.propose(new FinishTransfer(transfer.shardId, myId));
        }, MoreExecutors.directExecutor());

    VexFutures.addCallback(finished,
        (index) -> {
          state = TransferState.ACTIVE;
          logger.info("transfer {} finished at index {}", transfer, index);
        },
        this::attemptFailed, fiber);
  }

  @FiberOnly
  private void attemptFailed(Throwable failure) {
    if (cancelled) {
      return;
    }
    if (attempts >= maxAttempts) {
      logger.error("transfer {} failed {} times; aborting", transfer, attempts, failure);
      state = TransferState.ABORTED;
      VexFutures.addCallback(proposer.propose(new AbortTransfer(transfer.shardId, myId)),
          (index) -> logger.info("transfer {} aborted at index {}", transfer, index),
          (abortFailure) -> logger.warn("unable to abort transfer {}", transfer, abortFailure), fiber);
      return;
    }

    logger.warn("attempt {} of transfer {} failed: {}; retrying in {} ms",
        attempts, transfer, failure.toString(), retryDelayMillis);
    state = TransferState.QUEUED;
    fiber.schedule(this::attempt, retryDelayMillis, TimeUnit.MILLISECONDS);
  }
}
