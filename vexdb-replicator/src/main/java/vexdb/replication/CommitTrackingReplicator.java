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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.SettableFuture;
import org.jetbrains.annotations.Nullable;
import org.jetlang.channels.ChannelSubscription;
import org.jetlang.fibers.Fiber;
import vexdb.ReplicatorConstants;
import vexdb.interfaces.ConsensusTimeoutException;
import vexdb.interfaces.NotLeaderException;
import vexdb.interfaces.replication.IndexCommitNotice;
import vexdb.interfaces.replication.ReplicateSubmissionInfo;
import vexdb.interfaces.replication.Replicator;
import vexdb.interfaces.replication.ReplicatorInstanceEvent;
import vexdb.interfaces.replication.ReplicatorReceipt;
import vexdb.util.FiberOnly;
import vexdb.util.VexFutures;

import java.nio.ByteBuffer;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ExecutionException;

/**
 * Wraps a {@link Replicator}, matching its ReplicatorReceipts against its IndexCommitNotices so
 * that each submission gets a future completing when the submitted entry commits.
 * <p>
 * A submission whose index is committed with a different term than the one it was logged in was
 * overwritten by a later leader; its future fails with {@link ConsensusTimeoutException}, because
 * nothing can be said about whether the caller's intent will take effect some other way.
 */
public class CommitTrackingReplicator {
  private final long nodeId;
  private final Replicator replicator;
  private final Fiber fiber;

  private SettableFuture<Void> availableFuture;

  /**
   * Queue of receipts for pending log requests and their futures; access this queue only
   * from the fiber.
   */
  private final Queue<ReceiptWithCompletionFuture> receiptQueue =
      new ArrayDeque<>(ReplicatorConstants.REPLICATOR_MAXIMUM_SIMULTANEOUS_LOG_REQUESTS);

  /**
   * Both the fiber and replicator must be started by the user of this class, and the
   * user takes responsibility for their disposal.
   */
  public CommitTrackingReplicator(Replicator replicator, Fiber fiber) {
    this.nodeId = replicator.getId();
    this.replicator = replicator;
    this.fiber = fiber;

    setupCommitNoticeSubscription();
    setupEventNoticeSubscription();
  }

  /**
   * Replicate data. The returned future fails with {@link NotLeaderException} if the replicator
   * is not the leader.
   */
  public ListenableFuture<ReplicateSubmissionInfo> replicate(List<ByteBuffer> data) throws InterruptedException {
    final ListenableFuture<ReplicatorReceipt> receiptFuture = replicator.logData(data);
    if (receiptFuture == null) {
      return Futures.immediateFailedFuture(
          new NotLeaderException(nodeId, replicator.getStatus().leaderId));
    }

    final ReceiptWithCompletionFuture receiptWithCompletionFuture = new ReceiptWithCompletionFuture(receiptFuture);

    // Add to the queue on the fiber for concurrency safety
    fiber.execute(() -> receiptQueue.add(receiptWithCompletionFuture));

    return Futures.transform(receiptFuture,
        (ReplicatorReceipt receipt) ->
            new ReplicateSubmissionInfo(receipt.seqNum, receipt.term, receiptWithCompletionFuture.completionFuture),
        MoreExecutors.directExecutor());
  }

  /**
   * A future which completes the next time this node is elected leader, or immediately if it
   * is the leader now.
   */
  public ListenableFuture<Void> isAvailableFuture() {
    SettableFuture<Void> returnedFuture = SettableFuture.create();

    fiber.execute(() -> {
      if (replicator.isLeader()) {
        returnedFuture.set(null);
      } else if (this.availableFuture == null) {
        this.availableFuture = returnedFuture;
      } else {
        VexFutures.addCallback(this.availableFuture, returnedFuture::set, returnedFuture::setException, fiber);
      }
    });

    return returnedFuture;
  }

  public Replicator getReplicator() {
    return replicator;
  }

  private void setupCommitNoticeSubscription() {
    final String quorumId = replicator.getQuorumId();

    replicator.getCommitNoticeChannel().subscribe(
        new ChannelSubscription<>(this.fiber, this::handleCommitNotice,
            (notice) ->
                notice.nodeId == nodeId
                    && notice.quorumId.equals(quorumId)));
  }

  private void setupEventNoticeSubscription() {
    replicator.getEventChannel().subscribe(fiber, this::handleEventNotice);
  }

  /**
   * When we receive an IndexCommitNotice, find out which, if any, of the pending requests are
   * affected by it, by examining their receipts as they become available.
   */
  @FiberOnly
  private void handleCommitNotice(IndexCommitNotice notice) {
    while (!receiptQueue.isEmpty() && receiptQueue.peek().receiptFuture.isDone()) {
      ReceiptWithCompletionFuture receiptWithCompletionFuture = receiptQueue.peek();
      SettableFuture<Void> completionFuture = receiptWithCompletionFuture.completionFuture;

      ReplicatorReceipt receipt = getReceiptOrSetException(receiptWithCompletionFuture);

      if (receipt != null) {
        if (notice.lastIndex < receipt.seqNum) {
          // old commit notice
          return;

        } else if (receipt.seqNum < notice.firstIndex) {
          completionFuture.setException(new ConsensusTimeoutException(
              "commit notice " + notice + " skipped over entry " + receipt.seqNum));

        } else if (notice.term != receipt.term) {
          completionFuture.setException(new ConsensusTimeoutException(
              "entry " + receipt.seqNum + " of term " + receipt.term + " was replaced in term " + notice.term));

        } else {
          completionFuture.set(null);
        }
      }

      receiptQueue.poll();
    }
  }

  @FiberOnly
  private void handleEventNotice(ReplicatorInstanceEvent eventNotice) {
    if (availableFuture != null
        && eventNotice.instance == replicator
        && eventNotice.eventType == ReplicatorInstanceEvent.EventType.LEADER_ELECTED
        && eventNotice.newLeader == nodeId) {

      availableFuture.set(null);
      availableFuture = null;
    }
  }

  /**
   * This method assumes that the receiptFuture is done. A null return value guarantees the
   * completionFuture has been set with an exception.
   */
  @Nullable
  private ReplicatorReceipt getReceiptOrSetException(ReceiptWithCompletionFuture receiptWithCompletionFuture) {
    ListenableFuture<ReplicatorReceipt> receiptFuture = receiptWithCompletionFuture.receiptFuture;
    SettableFuture<?> completionFuture = receiptWithCompletionFuture.completionFuture;

    assert receiptFuture.isDone();

    try {
      ReplicatorReceipt receipt = VexFutures.getUninterruptibly(receiptFuture);
      if (receipt == null) {
        completionFuture.setException(new ConsensusTimeoutException("replicator returned a null receipt"));
      }
      return receipt;
    } catch (ExecutionException e) {
      completionFuture.setException(e.getCause() == null ? e : e.getCause());
      return null;
    }
  }

  /**
   * A receipt for a pending log request bundled with the future to complete when the entry
   * it names commits.
   */
  private static class ReceiptWithCompletionFuture {
    public final ListenableFuture<ReplicatorReceipt> receiptFuture;
    public final SettableFuture<Void> completionFuture = SettableFuture.create();

    private ReceiptWithCompletionFuture(ListenableFuture<ReplicatorReceipt> receiptFuture) {
      this.receiptFuture = receiptFuture;
    }
  }
}
