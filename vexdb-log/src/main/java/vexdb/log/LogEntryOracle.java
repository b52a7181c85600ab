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

import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Keeps, in memory, the information about a replicator log that the consensus algorithm needs
 * synchronously: the term of every index and the quorum configurations logged, plus the base
 * (the index, term and configuration the latest snapshot covers). Terms are stored as a map from
 * the first index of each term, and configurations by the index they were logged at.
 * <p>
 * This class is not thread-safe.
 */
class LogEntryOracle {
  private final NavigableMap<Long, Long> termStarts = new TreeMap<>();
  private final NavigableMap<Long, QuorumConfiguration> configurations = new TreeMap<>();

  private long baseIndex = 0;
  private long baseTerm = 0;
  private QuorumConfiguration baseConfiguration = QuorumConfiguration.EMPTY;
  private long lastIndex = 0;

  void notifyLogging(LogEntry entry) {
    final long index = entry.getIndex();
    if (index != lastIndex + 1) {
      throw new IllegalArgumentException("entry " + index + " does not follow last index " + lastIndex);
    }

    if (entry.getTerm() < getLastTerm()) {
      throw new IllegalArgumentException("entry " + index + " has term " + entry.getTerm()
          + " but the log's last term is " + getLastTerm());
    }

    if (entry.getTerm() != getLastTerm() || termStarts.isEmpty()) {
      termStarts.put(index, entry.getTerm());
    }
    if (entry.getQuorumConfiguration() != null) {
      configurations.put(index, entry.getQuorumConfiguration());
    }
    lastIndex = index;
  }

  void notifyTruncation(long fromIndex) {
    if (fromIndex <= baseIndex) {
      throw new IllegalArgumentException("cannot truncate at " + fromIndex + ", at or before base " + baseIndex);
    }
    termStarts.tailMap(fromIndex, true).clear();
    configurations.tailMap(fromIndex, true).clear();
    lastIndex = Math.min(lastIndex, fromIndex - 1);
  }

  void compactThrough(long index) {
    if (index <= baseIndex) {
      return;
    }
    if (index > lastIndex) {
      throw new IllegalArgumentException("cannot compact through " + index + ", beyond last index " + lastIndex);
    }

    final long nextTerm = getTermAt(index + 1);
    baseTerm = getTermAt(index);
    baseConfiguration = getConfigurationAt(index);
    baseIndex = index;

    termStarts.headMap(index, true).clear();
    configurations.headMap(index, true).clear();
    if (lastIndex > index && !termStarts.containsKey(index + 1)) {
      termStarts.put(index + 1, nextTerm);
    }
  }

  void reset(long index, long term, QuorumConfiguration configuration) {
    termStarts.clear();
    configurations.clear();
    baseIndex = index;
    baseTerm = term;
    baseConfiguration = configuration;
    lastIndex = index;
  }

  long getTermAt(long index) {
    if (index == baseIndex) {
      return baseTerm;
    }
    if (index < baseIndex || index > lastIndex) {
      return 0;
    }
    final Map.Entry<Long, Long> termStart = termStarts.floorEntry(index);
    return termStart == null ? baseTerm : termStart.getValue();
  }

  long getLastTerm() {
    return getTermAt(lastIndex);
  }

  long getLastIndex() {
    return lastIndex;
  }

  long getBaseIndex() {
    return baseIndex;
  }

  long getBaseTerm() {
    return baseTerm;
  }

  QuorumConfiguration getBaseConfiguration() {
    return baseConfiguration;
  }

  QuorumConfiguration getConfigurationAt(long index) {
    final Map.Entry<Long, QuorumConfiguration> configuration = configurations.floorEntry(index);
    return configuration == null ? baseConfiguration : configuration.getValue();
  }

  QuorumConfiguration getLastConfiguration() {
    return getConfigurationAt(lastIndex);
  }

  long getLastConfigurationIndex() {
    return configurations.isEmpty() ? baseIndex : configurations.lastKey();
  }
}
