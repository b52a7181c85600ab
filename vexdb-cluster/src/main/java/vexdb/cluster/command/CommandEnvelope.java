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

package vexdb.cluster.command;

import vexdb.codec.ProtostuffCodec;

import java.nio.ByteBuffer;

/**
 * What a cluster consensus log entry carries: a command, and who proposed it. The proposer and
 * proposal id let the proposing node match the applied entry to its pending proposal, so that it
 * alone learns if the command was rejected.
 */
public final class CommandEnvelope {
  private static final ProtostuffCodec<CommandEnvelope> CODEC = new ProtostuffCodec<>(CommandEnvelope.class);

  long proposerId;
  long proposalId;
  ClusterCommand command;

  private CommandEnvelope() {
  }

  public CommandEnvelope(long proposerId, long proposalId, ClusterCommand command) {
    this.proposerId = proposerId;
    this.proposalId = proposalId;
    this.command = command;
  }

  public long getProposerId() {
    return proposerId;
  }

  public long getProposalId() {
    return proposalId;
  }

  public ClusterCommand getCommand() {
    return command == null ? new Nop() : command;
  }

  public ByteBuffer encode() {
    return ByteBuffer.wrap(CODEC.encode(this));
  }

  public static CommandEnvelope decode(ByteBuffer buffer) {
    ByteBuffer copy = buffer.duplicate();
    byte[] bytes = new byte[copy.remaining()];
    copy.get(bytes);
    return CODEC.decode(bytes);
  }

  @Override
  public String toString() {
    return "CommandEnvelope{" +
        "proposerId=" + proposerId +
        ", proposalId=" + proposalId +
        ", command=" + command +
        '}';
  }
}
