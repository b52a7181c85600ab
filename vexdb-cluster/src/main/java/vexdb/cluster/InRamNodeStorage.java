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

package vexdb.cluster;

import vexdb.interfaces.StorageException;
import vexdb.interfaces.replication.ReplicatorLog;
import vexdb.log.AppliedPositionStore;
import vexdb.log.InRamLog;
import vexdb.log.InRamOperationLog;
import vexdb.log.OperationLog;
import vexdb.replication.ReplicatorInfoPersistence;
import vexdb.replication.SnapshotStore;
import vexdb.shard.InRamShardStorage;
import vexdb.shard.LocalReplica;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Node storage held in memory. Closing it loses nothing, so a node restarted on the same
 * instance finds whatever it had stored, as it would on disk.
 */
public class InRamNodeStorage implements NodeStorage {
  private final ReplicatorLog consensusLog = new InRamLog();
  private final ReplicatorInfoPersistence persister = new ReplicatorInfoPersistence.InRam();
  private final SnapshotStore snapshots = new SnapshotStore.InRam();
  private final InRamShardStorage shardStorage = new InRamShardStorage();
  private final Map<Long, OperationLog> operationLogs = new HashMap<>();
  private final Map<Long, AppliedPositionStore> positions = new HashMap<>();

  @Override
  public ReplicatorLog consensusLog() {
    return consensusLog;
  }

  @Override
  public ReplicatorInfoPersistence consensusPersister() {
    return persister;
  }

  @Override
  public SnapshotStore consensusSnapshots() {
    return snapshots;
  }

  public InRamShardStorage getShardStorage() {
    return shardStorage;
  }

  @Override
  public synchronized LocalReplica openReplica(long shardId, int retainedOperations)
      throws IOException, StorageException {
    OperationLog operationLog = operationLogs.computeIfAbsent(shardId, (id) -> new InRamOperationLog());
    AppliedPositionStore position = positions.computeIfAbsent(shardId, (id) -> new AppliedPositionStore.InRam());
    return new LocalReplica(shardId, operationLog, position, shardStorage, retainedOperations);
  }

  @Override
  public void close() {
  }
}
