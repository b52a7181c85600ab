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

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.command.CommandEnvelope;
import vexdb.cluster.topology.Topology;
import vexdb.cluster.topology.TopologyCodec;
import vexdb.interfaces.TopologyRejectedException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.ReplicatorSnapshot;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Applies committed cluster consensus log entries to the topology, one index at a time and in
 * index order. An invalid command leaves the topology as it was, apart from its index, and the
 * rejection is returned to the caller so that it can be reported to the command's proposer.
 * <p>
 * Not thread safe; it is driven from the cluster consensus fiber.
 */
public class TopologyStateMachine {
  private static final Logger LOG = LoggerFactory.getLogger(TopologyStateMachine.class);

  private Topology topology = Topology.EMPTY;

  public Topology getTopology() {
    return topology;
  }

  public long getLastAppliedIndex() {
    return topology.index;
  }

  /**
   * Apply the next committed entry.
   *
   * @return the outcome of each command the entry carried; empty for a no-op or configuration entry,
   * or for an entry at or below the last applied index, which is skipped.
   * @throws IllegalStateException if the entry would skip an index.
   */
  public List<AppliedCommand> apply(LogEntry entry) {
    if (entry.getIndex() <= topology.index) {
      return Collections.emptyList();
    }
    if (entry.getIndex() != topology.index + 1) {
      throw new IllegalStateException("entry " + entry.getIndex() + " does not follow applied index " + topology.index);
    }

    Topology.Builder builder = topology.toBuilder();
    List<AppliedCommand> outcomes = new ArrayList<>();

    if (entry.isConfigurationEntry()) {
      builder.applyConfiguration(entry.getQuorumConfiguration());
    } else {
      for (ByteBuffer data : entry.getDataList()) {
        CommandEnvelope envelope = CommandEnvelope.decode(data);
        outcomes.add(applyCommand(builder, envelope, entry.getIndex()));
      }
    }

    topology = builder.build(entry.getIndex());
    return outcomes;
  }

  public byte[] takeSnapshot() {
    return TopologyCodec.encode(topology);
  }

  /**
   * Replace the topology with the one captured in a snapshot, if it is ahead of this one.
   */
  public void restore(ReplicatorSnapshot snapshot) {
    if (snapshot.lastIncludedIndex <= topology.index) {
      return;
    }
    Topology restored = TopologyCodec.decode(snapshot.getData());
    Topology.Builder builder = restored.toBuilder();
    builder.applyConfiguration(snapshot.configuration);
    topology = builder.build(snapshot.lastIncludedIndex);
    LOG.info("restored topology at index {} from snapshot", topology.index);
  }

  private AppliedCommand applyCommand(Topology.Builder builder, CommandEnvelope envelope, long index) {
    try {
      envelope.getCommand().applyTo(builder);
      LOG.debug("applied {} at index {}", envelope, index);
      return new AppliedCommand(envelope, index, null);
    } catch (TopologyRejectedException e) {
      LOG.info("rejected {} at index {}: {}", envelope, index, e.getMessage());
      return new AppliedCommand(envelope, index, e);
    }
  }

  public static final class AppliedCommand {
    public final CommandEnvelope envelope;
    public final long index;
    @Nullable
    public final TopologyRejectedException rejection;

    public AppliedCommand(CommandEnvelope envelope, long index, @Nullable TopologyRejectedException rejection) {
      this.envelope = envelope;
      this.index = index;
      this.rejection = rejection;
    }

    public boolean isRejected() {
      return rejection != null;
    }
  }
}
