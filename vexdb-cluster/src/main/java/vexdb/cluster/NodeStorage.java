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
import vexdb.replication.ReplicatorInfoPersistence;
import vexdb.replication.SnapshotStore;
import vexdb.shard.LocalReplica;

import java.io.IOException;

/**
 * Everything a node keeps across restarts: the consensus log, term and vote, and snapshot, and
 * the state of each of its shard replicas.
 */
public interface NodeStorage extends AutoCloseable {
  ReplicatorLog consensusLog();

  ReplicatorInfoPersistence consensusPersister();

  SnapshotStore consensusSnapshots();

  /**
   * Open this node's replica of a shard, creating it empty if the node has none.
   */
  LocalReplica openReplica(long shardId, int retainedOperations) throws IOException, StorageException;

  @Override
  void close() throws IOException;
}
