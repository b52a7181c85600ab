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

package vexdb.replication;

import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.replication.ReplicatorSnapshot;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable home of the latest snapshot of each quorum. Like {@link ReplicatorInfoPersistence},
 * the interface is synchronous: save returns only once the snapshot is durable.
 */
public interface SnapshotStore {
  /**
   * @return the latest snapshot saved for the quorum, or null if there is none.
   */
  @Nullable
  ReplicatorSnapshot load(String quorumId) throws IOException;

  void save(ReplicatorSnapshot snapshot) throws IOException;

  class InRam implements SnapshotStore {
    private final Map<String, ReplicatorSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public ReplicatorSnapshot load(String quorumId) {
      return snapshots.get(quorumId);
    }

    @Override
    public void save(ReplicatorSnapshot snapshot) {
      snapshots.put(snapshot.quorumId, snapshot);
    }
  }
}
