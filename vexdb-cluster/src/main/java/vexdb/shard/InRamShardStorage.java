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
import vexdb.codec.ProtostuffCodec;
import vexdb.interfaces.StorageException;
import vexdb.interfaces.shard.HashRange;
import vexdb.interfaces.storage.ShardStorage;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shard storage held in memory: each shard is a sorted map from point key to payload. An empty
 * payload deletes the point. Used by tests and by nodes that embed the cluster without an index.
 */
public class InRamShardStorage implements ShardStorage {
  private static final ProtostuffCodec<SnapshotRecord> CODEC = new ProtostuffCodec<>(SnapshotRecord.class);

  private final Map<Long, Shard> shards = new HashMap<>();

  @Override
  public synchronized void apply(long shardId, long operationId, String key, byte[] payload) {
    Shard shard = shard(shardId);
    if (operationId <= shard.lastOperationId) {
      return;
    }
    if (payload.length == 0) {
      shard.points.remove(key);
    } else {
      shard.points.put(key, payload.clone());
    }
    shard.lastOperationId = operationId;
  }

  @Override
  public synchronized InputStream exportSnapshot(long shardId) {
    Shard shard = shard(shardId);
    SnapshotRecord record = new SnapshotRecord();
    record.lastOperationId = shard.lastOperationId;
    record.points = new ArrayList<>();
    for (Map.Entry<String, byte[]> point : shard.points.entrySet()) {
      PointRecord pointRecord = new PointRecord();
      pointRecord.key = point.getKey();
      pointRecord.payload = point.getValue();
      record.points.add(pointRecord);
    }
    return new ByteArrayInputStream(CODEC.encode(record));
  }

  @Override
  public synchronized long importSnapshot(long shardId, InputStream snapshot) throws StorageException {
    final SnapshotRecord record;
    try {
      record = CODEC.decode(readFully(snapshot));
    } catch (IOException | RuntimeException e) {
      throw new StorageException("unable to read snapshot of shard " + shardId, e);
    }

    Shard shard = new Shard();
    shard.lastOperationId = record.lastOperationId;
    if (record.points != null) {
      for (PointRecord point : record.points) {
        shard.points.put(point.key, point.payload == null ? new byte[0] : point.payload);
      }
    }
    shards.put(shardId, shard);
    return shard.lastOperationId;
  }

  @Override
  public synchronized void retainRange(long shardId, HashRange range) {
    shard(shardId).points.keySet().removeIf((key) -> !range.containsKey(key));
  }

  @Nullable
  @Override
  public synchronized byte[] read(long shardId, String key) {
    Shard shard = shards.get(shardId);
    if (shard == null) {
      return null;
    }
    byte[] payload = shard.points.get(key);
    return payload == null ? null : payload.clone();
  }

  @Override
  public synchronized void drop(long shardId) {
    shards.remove(shardId);
  }

  /**
   * A copy of every point of the shard, by key.
   */
  public synchronized SortedMap<String, byte[]> contents(long shardId) {
    Shard shard = shards.get(shardId);
    return shard == null ? new TreeMap<>() : new TreeMap<>(shard.points);
  }

  public synchronized boolean hasShard(long shardId) {
    return shards.containsKey(shardId);
  }

  private Shard shard(long shardId) {
    return shards.computeIfAbsent(shardId, (id) -> new Shard());
  }

  private static byte[] readFully(InputStream inputStream) throws IOException {
    try (InputStream in = inputStream) {
      return ByteStreams.toByteArray(in);
    }
  }

  private static final class Shard {
    final SortedMap<String, byte[]> points = new TreeMap<>();
    long lastOperationId;
  }

  static final class SnapshotRecord {
    long lastOperationId;
    List<PointRecord> points;
  }

  static final class PointRecord {
    String key;
    byte[] payload;
  }
}
