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

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;
import vexdb.interfaces.shard.Operation;
import vexdb.interfaces.storage.ShardStorage;
import vexdb.log.AppliedPositionStore;
import vexdb.log.InRamOperationLog;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.Assert.fail;

public class LocalReplicaTest {
  private static final long SHARD_ID = 5;
  private static final int RETAINED = 4;

  @Rule
  public JUnitRuleMockery context = new JUnitRuleMockery();

  private final InRamOperationLog operationLog = new InRamOperationLog();
  private final AppliedPositionStore.InRam positionStore = new AppliedPositionStore.InRam();
  private final InRamShardStorage storage = new InRamShardStorage();
  private LocalReplica replica;

  @Before
  public void setUp() throws Exception {
    replica = new LocalReplica(SHARD_ID, operationLog, positionStore, storage, RETAINED);
  }

  @Test
  public void operationsApplyInIdOrderAndReappliedOnesAreIgnored() throws Exception {
    assertThat(replica.apply(op(1, "a", "one")), is(true));
    assertThat(replica.apply(op(2, "b", "two")), is(true));

    assertThat(replica.apply(op(1, "a", "changed")), is(false));

    assertThat(replica.lastAppliedOperationId(), is(2L));
    assertThat(text(replica.read("a")), is("one"));
  }

  @Test
  public void anOperationThatSkipsAnIdIsRefusedAndChangesNothing() throws Exception {
    replica.apply(op(1, "a", "one"));

    try {
      replica.apply(op(3, "c", "three"));
      fail("expected the gap to be refused");
    } catch (IllegalArgumentException expected) {
      assertThat(replica.lastAppliedOperationId(), is(1L));
      assertThat(replica.read("c"), is(nullValue()));
    }
  }

  @Test
  public void anEmptyPayloadDeletesThePoint() throws Exception {
    replica.apply(op(1, "a", "one"));
    replica.apply(new Operation(2, SHARD_ID, "a", new byte[0]));

    assertThat(replica.read("a"), is(nullValue()));
  }

  @Test
  public void theLogKeepsOnlyTheMostRecentOperations() throws Exception {
    for (long id = 1; id <= 8; id++) {
      replica.apply(op(id, "k" + id, "v" + id));
    }

    List<Operation> recent = replica.operationsBetween(4, 8);
    assertThat(recent, is(notNullValue()));
    assertThat(recent, hasSize(4));
    assertThat(recent.get(0).getOperationId(), is(5L));
    assertThat(replica.operationsBetween(1, 8), is(nullValue()));
  }

  @Test
  public void operationsBetweenStopsAtTheLastAppliedOperation() throws Exception {
    replica.apply(op(1, "a", "one"));
    replica.apply(op(2, "b", "two"));

    assertThat(replica.operationsBetween(0, 10), hasSize(2));
  }

  @Test
  public void aReopenedReplicaResumesFromItsLoggedPosition() throws Exception {
    replica.apply(op(1, "a", "one"));
    replica.apply(op(2, "b", "two"));
    replica.close();

    LocalReplica reopened = new LocalReplica(SHARD_ID, operationLog, positionStore, storage, RETAINED);

    assertThat(reopened.lastAppliedOperationId(), is(2L));
    assertThat(reopened.apply(op(2, "b", "again")), is(false));
    assertThat(reopened.apply(op(3, "c", "three")), is(true));
  }

  @Test
  public void reopeningReappliesTheLastLoggedOperationInCaseStorageMissedIt() throws Exception {
    operationLog.append(op(1, "a", "one"));

    new LocalReplica(SHARD_ID, operationLog, positionStore, storage, RETAINED);

    assertThat(text(storage.read(SHARD_ID, "a")), is("one"));
  }

  @Test
  public void anImportedSnapshotReplacesStateAndSetsThePosition() throws Exception {
    InRamShardStorage source = new InRamShardStorage();
    source.apply(SHARD_ID, 1, "x", bytes("ex"));
    source.apply(SHARD_ID, 2, "y", bytes("why"));
    LocalReplica sourceReplica = new LocalReplica(SHARD_ID, new InRamOperationLog(),
        new AppliedPositionStore.InRam(), source, RETAINED);
    replica.apply(op(1, "a", "one"));

    replica.importSnapshot(sourceReplica.exportSnapshot().data, 40);

    assertThat(replica.lastAppliedOperationId(), is(40L));
    assertThat(replica.read("a"), is(nullValue()));
    assertThat(text(replica.read("y")), is("why"));
    assertThat(replica.apply(op(41, "z", "zed")), is(true));

    LocalReplica reopened = new LocalReplica(SHARD_ID, operationLog, positionStore, storage, RETAINED);
    assertThat(reopened.lastAppliedOperationId(), is(41L));
  }

  @Test
  public void retainingARangeDropsPointsOutsideIt() throws Exception {
    for (long id = 1; id <= 50; id++) {
      replica.apply(op(id, "point-" + id, "v"));
    }
    HashRange lower = HashRange.FULL.lowerHalf();

    replica.retainRange(lower);

    for (long id = 1; id <= 50; id++) {
      String key = "point-" + id;
      assertThat(replica.read(key) != null, is(equalTo(lower.containsKey(key))));
    }
  }

  @Test
  public void droppingForgetsThePosition() throws Exception {
    replica.apply(op(1, "a", "one"));

    replica.drop();

    assertThat(replica.lastAppliedOperationId(), is(0L));
    assertThat(storage.hasShard(SHARD_ID), is(false));
    assertThat(replica.apply(op(1, "a", "one")), is(true));
  }

  @Test
  public void anOperationStorageFailsToApplyIsNotAppliedAndItsIdStaysNext() throws Exception {
    ShardStorage failingStorage = context.mock(ShardStorage.class);
    context.checking(new Expectations() {{
      oneOf(failingStorage).apply(SHARD_ID, 1, "bad", bytes("one"));
      will(throwException(new StorageException("disk full")));
      oneOf(failingStorage).apply(SHARD_ID, 1, "good", bytes("two"));
    }});
    InRamOperationLog log = new InRamOperationLog();
    LocalReplica failing = new LocalReplica(SHARD_ID, log, new AppliedPositionStore.InRam(), failingStorage, RETAINED);

    try {
      failing.apply(op(1, "bad", "one"));
      fail("expected the storage failure to be reported");
    } catch (StorageException expected) {
      assertThat(failing.lastAppliedOperationId(), is(0L));
      assertThat(log.lastOperationId(), is(0L));
    }

    assertThat(failing.apply(op(1, "good", "two")), is(true));
    assertThat(failing.lastAppliedOperationId(), is(1L));
    assertThat(log.getRange(0, 1).get(0).getKey(), is("good"));
  }

  private static Operation op(long id, String key, String value) {
    return new Operation(id, SHARD_ID, key, bytes(value));
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  private static String text(byte[] payload) {
    return new String(payload, StandardCharsets.UTF_8);
  }
}
