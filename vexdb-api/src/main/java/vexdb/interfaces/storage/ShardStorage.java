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

package vexdb.interfaces.storage;

import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;

import java.io.InputStream;

/**
 * The storage engine that holds the points of the shards on one node. The replication layer
 * decides which operations reach it, and in what order; the engine only executes them.
 * Implementations must be safe to call from several threads, though calls for one shard are
 * never concurrent.
 */
public interface ShardStorage {
  /**
   * Apply an operation. Applying the same operation id twice must leave the shard as if it had
   * been applied once.
   */
  void apply(long shardId, long operationId, String key, byte[] payload) throws StorageException;

  /**
   * A consistent copy of the shard's contents. The returned stream is independent of later writes.
   */
  InputStream exportSnapshot(long shardId) throws StorageException;

  /**
   * Replace the shard's contents with those of a snapshot produced by exportSnapshot.
   *
   * @return the id of the last operation the snapshot reflects.
   */
  long importSnapshot(long shardId, InputStream snapshot) throws StorageException;

  /**
   * Delete every point of the shard whose key hashes outside the given range.
   */
  void retainRange(long shardId, HashRange range) throws StorageException;

  @Nullable
  byte[] read(long shardId, String key) throws StorageException;

  /**
   * Delete the shard and all its points.
   */
  void drop(long shardId) throws StorageException;
}
