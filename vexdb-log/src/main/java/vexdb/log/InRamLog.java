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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import vexdb.interfaces.replication.EntryCompactedException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorLog;

import java.util.ArrayList;
import java.util.List;

/**
 * ReplicatorLog hosted in memory, e.g. for unit testing ReplicatorInstance in-memory, or for
 * simulating a peer whose disk survives a restart. This implementation just provides the
 * basics needed to make the consensus algorithm work.
 */
public class InRamLog implements ReplicatorLog {
  private final List<LogEntry> log = new ArrayList<>();
  private final LogEntryOracle oracle = new LogEntryOracle();

  @Override
  public synchronized ListenableFuture<Boolean> logEntries(List<LogEntry> entries) {
    for (LogEntry entry : entries) {
      oracle.notifyLogging(entry);
      log.add(entry);
    }
    return Futures.immediateFuture(true);
  }

  @Override
  public synchronized ListenableFuture<List<LogEntry>> getLogEntries(long start, long end) {
    if (start <= oracle.getBaseIndex()) {
      return Futures.immediateFailedFuture(new EntryCompactedException(start, oracle.getBaseIndex()));
    }
    if (end - 1 > oracle.getLastIndex() || end < start) {
      return Futures.immediateFailedFuture(new IllegalArgumentException(
          "requested [" + start + ", " + end + ") but last index is " + oracle.getLastIndex()));
    }

    final int offset = listPosition(start);
    return Futures.immediateFuture(new ArrayList<>(log.subList(offset, offset + (int) (end - start))));
  }

  @Override
  public synchronized long getLogTerm(long index) {
    return oracle.getTermAt(index);
  }

  @Override
  public synchronized long getLastTerm() {
    return oracle.getLastTerm();
  }

  @Override
  public synchronized long getLastIndex() {
    return oracle.getLastIndex();
  }

  @Override
  public synchronized long getBaseIndex() {
    return oracle.getBaseIndex();
  }

  @Override
  public synchronized long getBaseTerm() {
    return oracle.getBaseTerm();
  }

  @Override
  public synchronized ListenableFuture<Boolean> truncateLog(long entryIndex) {
    if (entryIndex > oracle.getLastIndex()) {
      return Futures.immediateFuture(true);
    }
    oracle.notifyTruncation(entryIndex);
    log.subList(listPosition(entryIndex), log.size()).clear();
    return Futures.immediateFuture(true);
  }

  @Override
  public synchronized ListenableFuture<Boolean> compactThrough(long index) {
    if (index > oracle.getBaseIndex()) {
      final int removeCount = listPosition(index) + 1;
      oracle.compactThrough(index);
      log.subList(0, removeCount).clear();
    }
    return Futures.immediateFuture(true);
  }

  @Override
  public synchronized ListenableFuture<Boolean> resetToSnapshot(long index, long term,
                                                                QuorumConfiguration configuration) {
    log.clear();
    oracle.reset(index, term, configuration);
    return Futures.immediateFuture(true);
  }

  @Override
  public synchronized QuorumConfiguration getLastConfiguration() {
    return oracle.getLastConfiguration();
  }

  @Override
  public synchronized long getLastConfigurationIndex() {
    return oracle.getLastConfigurationIndex();
  }

  @Override
  public synchronized QuorumConfiguration getConfigurationAt(long index) {
    return oracle.getConfigurationAt(index);
  }

  private int listPosition(long index) {
    return (int) (index - oracle.getBaseIndex() - 1);
  }
}
