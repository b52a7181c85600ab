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

import com.google.common.io.ByteStreams;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;
import vexdb.interfaces.shard.Operation;
import vexdb.interfaces.storage.ShardStorage;
import vexdb.log.AppliedPositionStore;
import vexdb.log.OperationLog;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * This node's copy of one shard: the storage engine's state for the shard, the operation log
 * recording what was applied to it, and the position up to which it has applied.
 * <p>
 * Operations are applied strictly in id order. An operation is appended to the log before it is
 * applied to storage, so after a crash the log can only be ahead of storage, and storage
 * tolerates an operation applied twice.
 * <p>
 * Not thread safe; used from the fiber of the shard's replica set.
 */
public class LocalReplica implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(LocalReplica.class);

  private final long shardId;
  private final OperationLog operationLog;
  private final AppliedPositionStore positionStore;
  private final ShardStorage storage;
  private final int retainedOperations;

  private long lastAppliedOperationId;

  public LocalReplica(long shardId,
                      OperationLog operationLog,
                      AppliedPositionStore positionStore,
                      ShardStorage storage,
                      int retainedOperations) throws IOException, StorageException {
    this.shardId = shardId;
    this.operationLog = operationLog;
    this.positionStore = positionStore;
    this.storage = storage;
    this.retainedOperations = retainedOperations;
    this.lastAppliedOperationId = Math.max(positionStore.read(), operationLog.lastOperationId());
    reapplyLastLoggedOperation();
  }

  public long getShardId() {
    return shardId;
  }

  public long lastAppliedOperationId() {
    return lastAppliedOperationId;
  }

  /**
   * Apply the next operation. If storage fails to apply it, the operation is removed from the log
   * again and the position does not move, so the next operation to apply is still this one.
   *
   * @return false if the operation was applied before, in which case nothing is done.
   * @throws IllegalArgumentException if the operation does not immediately follow the last applied one.
   */
  public boolean apply(Operation operation) throws IOException, StorageException {
    long operationId = operation.getOperationId();
    if (operationId <= lastAppliedOperationId) {
      return false;
    }
    if (operationId != lastAppliedOperationId + 1) {
      throw new IllegalArgumentException("shard " + shardId + " cannot apply operation " + operationId
          + " after " + lastAppliedOperationId);
    }

    operationLog.append(operation);
    try {
      storage.apply(shardId, operationId, operation.getKey(), operation.getPayload());
    } catch (StorageException e) {
      operationLog.truncateFrom(operationId);
      throw e;
    }
    lastAppliedOperationId = operationId;

    if (operationId % retainedOperations == 0) {
      operationLog.retainLast(retainedOperations);
    }
    return true;
  }

  /**
   * The applied operations with ids in (afterId, throughId], or null if the log no longer holds them all.
   */
  @Nullable
  public List<Operation> operationsBetween(long afterId, long throughId) throws IOException {
    return operationLog.getRange(afterId, Math.min(throughId, lastAppliedOperationId));
  }

  public ShardSnapshot exportSnapshot() throws IOException, StorageException {
    try (InputStream in = storage.exportSnapshot(shardId)) {
      return new ShardSnapshot(ByteStreams.toByteArray(in), lastAppliedOperationId);
    }
  }

  /**
   * Replace this replica's state with a snapshot, taking position as the id of the last
   * operation the snapshot reflects.
   */
  public void importSnapshot(byte[] data, long position) throws IOException, StorageException {
    storage.importSnapshot(shardId, new ByteArrayInputStream(data));
    operationLog.clear();
    positionStore.write(position);
    lastAppliedOperationId = position;
    LOG.info("shard {} replaced by a snapshot through operation {}", shardId, position);
  }

  /**
   * Keep only the points whose keys hash into the range, after this replica's shard was split.
   */
  public void retainRange(HashRange range) throws StorageException {
    storage.retainRange(shardId, range);
  }

  @Nullable
  public byte[] read(String key) throws StorageException {
    return storage.read(shardId, key);
  }

  /**
   * Delete this replica's state, when the shard no longer has a replica on this node.
   */
  public void drop() throws IOException, StorageException {
    storage.drop(shardId);
    operationLog.clear();
    positionStore.write(0);
    lastAppliedOperationId = 0;
  }

  @Override
  public void close() throws IOException {
    operationLog.close();
  }

  /**
   * Only the last logged operation can be missing from storage, if the node stopped between
   * logging and applying it.
   */
  private void reapplyLastLoggedOperation() throws IOException, StorageException {
    long lastLogged = operationLog.lastOperationId();
    if (lastLogged == 0) {
      return;
    }
    List<Operation> last = operationLog.getRange(lastLogged - 1, lastLogged);
    if (last != null && !last.isEmpty()) {
      Operation operation = last.get(0);
      storage.apply(shardId, operation.getOperationId(), operation.getKey(), operation.getPayload());
    }
  }

  public static final class ShardSnapshot {
    public final byte[] data;
    public final long lastOperationId;

    public ShardSnapshot(byte[] data, long lastOperationId) {
      this.data = data;
      this.lastOperationId = lastOperationId;
    }
  }
}
