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

package vexdb.log;

import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.shard.Operation;

import java.io.IOException;
import java.util.List;

/**
 * The durable record of the operations a shard replica has applied, in operation id order.
 * Only the most recent operations are retained; older ones are covered by the storage engine's
 * own state and reach other replicas through a snapshot.
 * <p>
 * Implementations are not thread-safe; a replica uses its log from its own fiber only.
 */
public interface OperationLog extends AutoCloseable {
  /**
   * Durably append an operation whose id exceeds every id in the log.
   */
  void append(Operation operation) throws IOException;

  /**
   * The operations with ids in {@code (afterId, throughId]}, or null if the log does not hold
   * all of them.
   */
  @Nullable
  List<Operation> getRange(long afterId, long throughId) throws IOException;

  /**
   * Id of the oldest operation retained, or zero if the log is empty.
   */
  long firstOperationId();

  /**
   * Id of the newest operation, or zero if the log is empty.
   */
  long lastOperationId();

  /**
   * Discard the oldest operations so that at most count remain.
   */
  void retainLast(int count) throws IOException;

  /**
   * Discard the operations with ids at or above operationId, such as one whose application to
   * storage failed.
   */
  void truncateFrom(long operationId) throws IOException;

  /**
   * Discard every operation, for instance because the replica's state was replaced by a snapshot.
   */
  void clear() throws IOException;

  @Override
  void close() throws IOException;
}
