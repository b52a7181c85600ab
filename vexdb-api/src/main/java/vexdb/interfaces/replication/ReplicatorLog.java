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

package vexdb.interfaces.replication;

import com.google.common.util.concurrent.ListenableFuture;

import java.util.List;

/**
 * The log a replicator keeps for a single quorum. Methods returning futures may perform IO on
 * another thread; the remaining methods answer from memory and are meant to be called from the
 * replicator's fiber.
 * <p>
 * After a snapshot the log is compacted: entries up to and including the base index are gone,
 * and only the base index, base term and the quorum configuration in force at the base survive.
 */
public interface ReplicatorLog {
  /**
   * Append entries to the log. The entries must have consecutive indexes, starting with one
   * more than the current last index.
   *
   * @return a future which will be set to true once the entries are durable.
   */
  ListenableFuture<Boolean> logEntries(List<LogEntry> entries);

  /**
   * Retrieve entries from the log. The future fails with {@link EntryCompactedException} if
   * any of the requested entries precede the base index.
   *
   * @param start index of the first entry to retrieve.
   * @param end   one beyond the index of the last entry to retrieve.
   */
  ListenableFuture<List<LogEntry>> getLogEntries(long start, long end);

  /**
   * The term of the entry at the given index; the base term for the base index, and zero for
   * index zero or for an index not in the log.
   */
  long getLogTerm(long index);

  long getLastTerm();

  long getLastIndex();

  /**
   * The index of the last entry covered by the latest snapshot; zero if the log was never compacted.
   */
  long getBaseIndex();

  long getBaseTerm();

  /**
   * Remove the entry at entryIndex and every entry after it. Entries at or before the base
   * index can never be truncated.
   */
  ListenableFuture<Boolean> truncateLog(long entryIndex);

  /**
   * Discard every entry up to and including index, which becomes the new base index.
   */
  ListenableFuture<Boolean> compactThrough(long index);

  /**
   * Discard the whole log and start again from a snapshot received from another peer.
   */
  ListenableFuture<Boolean> resetToSnapshot(long index, long term, QuorumConfiguration configuration);

  /**
   * The most recent quorum configuration in the log, which takes effect as soon as it is logged,
   * whether or not it has been committed. Falls back to the configuration at the base index.
   */
  QuorumConfiguration getLastConfiguration();

  long getLastConfigurationIndex();

  /**
   * The quorum configuration in force at the given index; that is, the most recent one logged at
   * or before it.
   */
  QuorumConfiguration getConfigurationAt(long index);
}
