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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import org.jetlang.channels.AsyncRequest;
import org.jetlang.channels.RequestChannel;
import org.jetlang.fibers.Fiber;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends peer requests for one component and turns the replies into futures. Replies and timeouts
 * are handled on the component's fiber, so callbacks added with a direct executor run there too.
 */
public class PeerClient {
  private final long myId;
  private final Fiber fiber;
  private final RequestChannel<PeerRequest, PeerReply> sendChannel;

  public PeerClient(long myId, Fiber fiber, RequestChannel<PeerRequest, PeerReply> sendChannel) {
    this.myId = myId;
    this.fiber = fiber;
    this.sendChannel = sendChannel;
  }

  public long getMyId() {
    return myId;
  }

  /**
   * Send a message to a peer.
   *
   * @return a future of the peer's reply. It fails with the peer's error if the peer answered with
   * a {@link RemoteError}, or with a {@link TimeoutException} if no reply arrived in time.
   */
  public <T extends PeerMessage> ListenableFuture<T> send(long to,
                                                          PeerMessage message,
                                                          Class<T> replyType,
                                                          long timeoutMillis) {
    final SettableFuture<T> replyFuture = SettableFuture.create();
    final PeerRequest request = new PeerRequest(to, myId, message);

    AsyncRequest.withOneReply(fiber, sendChannel, request,
        reply -> {
          if (reply.message instanceof RemoteError) {
            replyFuture.setException(((RemoteError) reply.message).toException());
          } else if (replyType.isInstance(reply.message)) {
            replyFuture.set(replyType.cast(reply.message));
          } else {
            replyFuture.setException(new IllegalStateException("unexpected reply " + reply + " to " + request));
          }
        },
        timeoutMillis, TimeUnit.MILLISECONDS,
        () -> replyFuture.setException(new TimeoutException("no reply to " + request)));

    return replyFuture;
  }
}
