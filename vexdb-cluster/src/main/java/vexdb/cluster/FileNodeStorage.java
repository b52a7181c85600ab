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
import vexdb.interfaces.storage.ShardStorage;
import vexdb.log.FileAppliedPositionStore;
import vexdb.log.FileOperationLog;
import vexdb.log.FileReplicatorLog;
import vexdb.replication.FileSnapshotStore;
import vexdb.replication.NioQuorumFileReaderWriter;
import vexdb.replication.Persister;
import vexdb.replication.ReplicatorInfoPersistence;
import vexdb.replication.SnapshotStore;
import vexdb.shard.LocalReplica;
import vexdb.util.WrappingKeySerializingExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static vexdb.ClusterConstants.CLUSTER_LOG_THREAD_POOL_SIZE;
import static vexdb.ClusterConstants.CLUSTER_QUORUM_ID;
import static vexdb.ClusterConstants.SHARD_APPLIED_POSITION_FILE_NAME;
import static vexdb.ClusterConstants.SHARD_DIRECTORY_NAME;
import static vexdb.ClusterConstants.SHARD_OPERATION_LOG_FILE_NAME;

/**
 * Node storage under a data directory:
 * <pre>
 *   repl/cluster-meta/             consensus log, term and vote, snapshot
 *   shards/&lt;shardId&gt;/operations        a replica's operation log
 *   shards/&lt;shardId&gt;/applied-position  the position of its last snapshot install
 * </pre>
 * The shard contents themselves belong to the storage engine.
 */
public class FileNodeStorage implements NodeStorage {
  private final Path dataDirectory;
  private final ShardStorage shardStorage;
  private final WrappingKeySerializingExecutor logExecutor;
  private final FileReplicatorLog consensusLog;
  private final Persister persister;
  private final FileSnapshotStore snapshots;

  public FileNodeStorage(Path dataDirectory, ShardStorage shardStorage) throws IOException {
    this.dataDirectory = dataDirectory;
    this.shardStorage = shardStorage;

    NioQuorumFileReaderWriter readerWriter = new NioQuorumFileReaderWriter(dataDirectory);
    this.logExecutor = new WrappingKeySerializingExecutor(Executors.newFixedThreadPool(CLUSTER_LOG_THREAD_POOL_SIZE));
    this.consensusLog = new FileReplicatorLog(CLUSTER_QUORUM_ID,
        readerWriter.getQuorumDirectory(CLUSTER_QUORUM_ID), logExecutor);
    this.persister = new Persister(readerWriter);
    this.snapshots = new FileSnapshotStore(readerWriter);
  }

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

  @Override
  public LocalReplica openReplica(long shardId, int retainedOperations) throws IOException, StorageException {
    Path shardDirectory = dataDirectory.resolve(SHARD_DIRECTORY_NAME).resolve(Long.toString(shardId));
    Files.createDirectories(shardDirectory);
    return new LocalReplica(shardId,
        new FileOperationLog(shardDirectory.resolve(SHARD_OPERATION_LOG_FILE_NAME)),
        new FileAppliedPositionStore(shardDirectory.resolve(SHARD_APPLIED_POSITION_FILE_NAME)),
        shardStorage,
        retainedOperations);
  }

  @Override
  public void close() throws IOException {
    consensusLog.close();
    try {
      logExecutor.shutdownAndAwaitTermination(10, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (TimeoutException e) {
      throw new IOException("consensus log writes did not finish", e);
    }
  }
}
