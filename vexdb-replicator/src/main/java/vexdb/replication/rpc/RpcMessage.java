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

package vexdb.replication.rpc;

/**
 * Wrap a rpc message, addressed by peer and quorum. A network transport serializes these; the
 * in-memory transports used by tests pass them through as they are.
 * <p/>
 * The subclasses exist so we can properly type the Jetlang channels and be clear about our intentions.
 * <p/>
 * There is 4 subclasses in 2 categories:
 * * Wire   -- for messages off the wire from other folks
 * * Non-wire  -- for messages to be sent to other folks
 */
public class RpcMessage {
  public final long to;
  public final long from;
  public final String quorumId;

  public final ReplicationMessage message;

  protected RpcMessage(long to, long from, String quorumId, ReplicationMessage message) {
    this.to = to;
    this.from = from;
    this.quorumId = quorumId;

    this.message = message;
  }

  @Override
  public String toString() {
    return String.format("From: %d to: %d quorum: %s contents: %s", from, to, quorumId, message);
  }

  public boolean isAppendMessage() {
    return message instanceof AppendEntries;
  }

  public boolean isRequestVoteMessage() {
    return message instanceof RequestVote;
  }

  public boolean isPreElectionPollMessage() {
    return message instanceof PreElectionPoll;
  }

  public boolean isInstallSnapshotMessage() {
    return message instanceof InstallSnapshot;
  }

  public boolean isAppendReplyMessage() {
    return message instanceof AppendEntriesReply;
  }

  public boolean isRequestVoteReplyMessage() {
    return message instanceof RequestVoteReply;
  }

  public boolean isPreElectionReplyMessage() {
    return message instanceof PreElectionReply;
  }

  public boolean isInstallSnapshotReplyMessage() {
    return message instanceof InstallSnapshotReply;
  }

  public AppendEntries getAppendMessage() {
    if (isAppendMessage()) {
      return (AppendEntries) message;
    }
    return null;
  }

  public AppendEntriesReply getAppendReplyMessage() {
    if (isAppendReplyMessage()) {
      return (AppendEntriesReply) message;
    }
    return null;
  }

  public RequestVote getRequestVoteMessage() {
    if (isRequestVoteMessage()) {
      return (RequestVote) message;
    }
    return null;
  }

  public RequestVoteReply getRequestVoteReplyMessage() {
    if (isRequestVoteReplyMessage()) {
      return (RequestVoteReply) message;
    }
    return null;
  }

  public PreElectionPoll getPreElectionPollMessage() {
    if (isPreElectionPollMessage()) {
      return (PreElectionPoll) message;
    }
    return null;
  }

  public PreElectionReply getPreElectionReplyMessage() {
    if (isPreElectionReplyMessage()) {
      return (PreElectionReply) message;
    }
    return null;
  }

  public InstallSnapshot getInstallSnapshotMessage() {
    if (isInstallSnapshotMessage()) {
      return (InstallSnapshot) message;
    }
    return null;
  }

  public InstallSnapshotReply getInstallSnapshotReplyMessage() {
    if (isInstallSnapshotReplyMessage()) {
      return (InstallSnapshotReply) message;
    }
    return null;
  }
}
