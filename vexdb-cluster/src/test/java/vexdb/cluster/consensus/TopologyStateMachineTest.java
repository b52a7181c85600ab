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

import com.google.common.collect.Lists;
import org.junit.Before;
import org.junit.Test;
import vexdb.cluster.command.AddPeer;
import vexdb.cluster.command.ClusterCommand;
import vexdb.cluster.command.CommandEnvelope;
import vexdb.cluster.command.CreateAlias;
import vexdb.cluster.command.CreateCollection;
import vexdb.cluster.command.Nop;
import vexdb.cluster.command.SplitShard;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.TopologyRejectedException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorSnapshot;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;

public class TopologyStateMachineTest {
  private static final QuorumConfiguration BOOTSTRAP = QuorumConfiguration.of(Arrays.asList(1L, 2L, 3L));

  private final List<LogEntry> log = new ArrayList<>();
  private TopologyStateMachine stateMachine;

  @Before
  public void setUp() {
    stateMachine = new TopologyStateMachine();
    log.add(new LogEntry(1, 1, new ArrayList<>(), BOOTSTRAP));
    log.add(new LogEntry(1, 2, new ArrayList<>(), null));
    log.add(commandEntry(3, new CreateCollection("docs", 2, 2, 1,
        Arrays.asList(Arrays.asList(1L, 2L), Arrays.asList(2L, 3L)))));
    log.add(commandEntry(4, new CreateAlias("latest", "docs")));
    log.add(commandEntry(5, new CreateAlias("latest", "docs")));
    log.add(commandEntry(6, new SplitShard(1, Arrays.asList(3L))));
  }

  @Test
  public void configurationAndNoOpEntriesAdvanceTheIndexWithoutOutcomes() {
    assertThat(stateMachine.apply(log.get(0)), is(empty()));
    assertThat(stateMachine.apply(log.get(1)), is(empty()));

    assertThat(stateMachine.getLastAppliedIndex(), is(2L));
    assertThat(stateMachine.getTopology().voters(), contains(1L, 2L, 3L));
  }

  @Test
  public void aRejectedCommandLeavesTheTopologyUnchangedApartFromItsIndex() {
    applyThrough(4);
    Topology before = stateMachine.getTopology();

    List<TopologyStateMachine.AppliedCommand> outcomes = stateMachine.apply(log.get(4));

    assertThat(outcomes, hasSize(1));
    assertThat(outcomes.get(0).isRejected(), is(true));
    assertThat(outcomes.get(0).rejection.getReason(), is(TopologyRejectedException.Reason.ALIAS_EXISTS));
    assertThat(outcomes.get(0).envelope.getProposalId(), is(5L));
    assertThat(stateMachine.getTopology(), is(equalTo(before.atIndex(5))));
  }

  @Test
  public void twoNodesApplyingTheSameEntriesHoldEqualTopologies() {
    applyThrough(6);
    TopologyStateMachine other = new TopologyStateMachine();
    for (LogEntry entry : log) {
      other.apply(entry);
    }

    assertThat(other.getTopology(), is(equalTo(stateMachine.getTopology())));
    assertThat(other.getTopology().shards.keySet(), contains(1L, 2L, 3L));
  }

  @Test
  public void entriesAtOrBelowTheAppliedIndexAreSkipped() {
    applyThrough(4);
    Topology before = stateMachine.getTopology();

    assertThat(stateMachine.apply(log.get(2)), is(empty()));
    assertThat(stateMachine.getTopology(), is(equalTo(before)));
  }

  @Test(expected = IllegalStateException.class)
  public void anEntryThatWouldSkipAnIndexIsRefused() {
    stateMachine.apply(log.get(0));
    stateMachine.apply(log.get(2));
  }

  @Test
  public void aRestoredSnapshotReproducesTheTopologyAndFollowingEntriesApplyOnTopOfIt() {
    applyThrough(4);
    ReplicatorSnapshot snapshot = new ReplicatorSnapshot("cluster", 4, 1, BOOTSTRAP, stateMachine.takeSnapshot());

    TopologyStateMachine restored = new TopologyStateMachine();
    restored.restore(snapshot);
    assertThat(restored.getTopology(), is(equalTo(stateMachine.getTopology())));

    restored.apply(log.get(4));
    restored.apply(log.get(5));
    applyThrough(6);
    assertThat(restored.getTopology(), is(equalTo(stateMachine.getTopology())));
  }

  @Test
  public void aSnapshotBehindTheAppliedIndexIsIgnored() {
    applyThrough(2);
    ReplicatorSnapshot old = new ReplicatorSnapshot("cluster", 2, 1, BOOTSTRAP, stateMachine.takeSnapshot());
    applyThrough(4);
    Topology current = stateMachine.getTopology();

    stateMachine.restore(old);

    assertThat(stateMachine.getTopology(), is(equalTo(current)));
  }

  @Test
  public void anEntryCanCarrySeveralCommandsEachWithItsOwnOutcome() {
    applyThrough(2);
    List<ByteBuffer> data = Lists.newArrayList(
        new CommandEnvelope(7, 1, new AddPeer(4, "node-4")).encode(),
        new CommandEnvelope(7, 2, new AddPeer(4, "node-4")).encode(),
        new CommandEnvelope(7, 3, new Nop("marker")).encode());

    List<TopologyStateMachine.AppliedCommand> outcomes = stateMachine.apply(new LogEntry(1, 3, data, null));

    assertThat(outcomes, hasSize(3));
    assertThat(outcomes.get(0).isRejected(), is(false));
    assertThat(outcomes.get(1).rejection.getReason(), is(TopologyRejectedException.Reason.PEER_EXISTS));
    assertThat(outcomes.get(2).isRejected(), is(false));
    assertThat(stateMachine.getTopology().peers.containsKey(4L), is(true));
  }

  private void applyThrough(long index) {
    for (LogEntry entry : log) {
      if (entry.getIndex() <= index) {
        stateMachine.apply(entry);
      }
    }
  }

  private static LogEntry commandEntry(long index, ClusterCommand command) {
    List<ByteBuffer> data = Lists.newArrayList(new CommandEnvelope(1, index, command).encode());
    return new LogEntry(1, index, data, null);
  }
}
