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

import com.google.common.collect.Lists;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.interfaces.replication.EntryCompactedException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorLog;
import vexdb.util.KeySerializingExecutor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * ReplicatorLog persisted to a directory of its quorum. The entries live in one file; the base
 * of the log (the index, term and quorum configuration covered by the latest snapshot) lives in
 * a second, small file which is replaced atomically.
 * <p>
 * The information the consensus algorithm reads synchronously is kept in memory and updated as
 * soon as a method is called. The file IO itself runs on a KeySerializingExecutor, keyed by the
 * quorum ID, so IO requests for one log execute in the order they were made.
 */
public class FileReplicatorLog implements ReplicatorLog, AutoCloseable {
  public static final String LOG_FILE_NAME = "log";
  public static final String BASE_FILE_NAME = "log-base";

  private static final Logger LOG = LoggerFactory.getLogger(FileReplicatorLog.class);

  private final String quorumId;
  private final Path logPath;
  private final Path basePath;
  private final KeySerializingExecutor executor;
  private final LogEntryCodec codec = new LogEntryCodec();
  private final LogEntryOracle oracle = new LogEntryOracle();

  private volatile SequentialLog<LogEntry> sequentialLog;

  /**
   * Open, or create, the log stored in the given directory, reading its contents into memory.
   */
  public FileReplicatorLog(String quorumId, Path directory, KeySerializingExecutor executor) throws IOException {
    this.quorumId = quorumId;
    this.logPath = directory.resolve(LOG_FILE_NAME);
    this.basePath = directory.resolve(BASE_FILE_NAME);
    this.executor = executor;

    Files.createDirectories(directory);
    recover();
  }

  @Override
  public synchronized ListenableFuture<Boolean> logEntries(List<LogEntry> entries) {
    entries.forEach(oracle::notifyLogging);

    return executor.submit(quorumId, () -> {
      sequentialLog.append(entries);
      sequentialLog.sync();
      return true;
    });
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

    return executor.submit(quorumId, () -> sequentialLog.subSequence(start, end));
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

    return executor.submit(quorumId, () -> {
      sequentialLog.truncate(entryIndex);
      sequentialLog.sync();
      return true;
    });
  }

  @Override
  public synchronized ListenableFuture<Boolean> compactThrough(long index) {
    if (index <= oracle.getBaseIndex()) {
      return Futures.immediateFuture(true);
    }
    oracle.compactThrough(index);
    final LogEntry base = baseRecord();

    return executor.submit(quorumId, () -> {
      writeBase(base);
      dropEntriesThrough(index);
      return true;
    });
  }

  @Override
  public synchronized ListenableFuture<Boolean> resetToSnapshot(long index, long term,
                                                                QuorumConfiguration configuration) {
    oracle.reset(index, term, configuration);
    final LogEntry base = baseRecord();

    return executor.submit(quorumId, () -> {
      writeBase(base);
      if (!sequentialLog.isEmpty()) {
        sequentialLog.truncate(sequentialLog.firstSeqNum());
        sequentialLog.sync();
      }
      return true;
    });
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

  /**
   * Close the underlying file. IO previously requested is completed first only if the caller
   * has waited for it; the executor is owned by the caller.
   */
  @Override
  public void close() throws IOException {
    sequentialLog.close();
  }

  private LogEntry baseRecord() {
    return new LogEntry(oracle.getBaseTerm(), oracle.getBaseIndex(), new ArrayList<>(),
        oracle.getBaseConfiguration());
  }

  private void recover() throws IOException {
    if (Files.exists(basePath)) {
      try (InputStream input = Files.newInputStream(basePath)) {
        final LogEntry base = codec.decode(input);
        oracle.reset(base.getIndex(), base.getTerm(), base.getQuorumConfiguration());
      }
    }

    sequentialLog = new EncodedSequentialLog<>(new FilePersistence(logPath), codec);

    final long baseIndex = oracle.getBaseIndex();
    if (!sequentialLog.isEmpty() && sequentialLog.firstSeqNum() <= baseIndex) {
      LOG.info("quorum {}: discarding entries up to base index {} left behind by an interrupted compaction",
          quorumId, baseIndex);
      dropEntriesThrough(baseIndex);
    }

    for (LogEntry entry : sequentialLog.readAll()) {
      oracle.notifyLogging(entry);
    }

    LOG.debug("quorum {}: recovered log with base {} and last index {}", quorumId, baseIndex,
        oracle.getLastIndex());
  }

  private void writeBase(LogEntry base) throws IOException {
    final Path tempPath = basePath.resolveSibling(BASE_FILE_NAME + ".tmp");
    try (FilePersistence persistence = new FilePersistence(tempPath)) {
      persistence.truncate(0);
      persistence.append(codec.encode(base));
      persistence.sync();
    }
    Files.move(tempPath, basePath, ATOMIC_MOVE, REPLACE_EXISTING);
  }

  /**
   * Rewrite the log file without the entries at or before the given index.
   */
  private void dropEntriesThrough(long index) throws IOException {
    final List<LogEntry> retained;
    if (sequentialLog.lastSeqNum() > index) {
      final long start = Math.max(index + 1, sequentialLog.firstSeqNum());
      try {
        retained = sequentialLog.subSequence(start, sequentialLog.lastSeqNum() + 1);
      } catch (SequentialLog.LogEntryNotFound | SequentialLog.LogEntryNotInSequence e) {
        throw new IOException("unable to read back the log of quorum " + quorumId, e);
      }
    } else {
      retained = Lists.newArrayList();
    }

    final Path tempPath = logPath.resolveSibling(LOG_FILE_NAME + ".tmp");
    Files.deleteIfExists(tempPath);
    try (SequentialLog<LogEntry> compacted = new EncodedSequentialLog<>(new FilePersistence(tempPath), codec)) {
      compacted.append(retained);
      compacted.sync();
    }

    sequentialLog.close();
    Files.move(tempPath, logPath, ATOMIC_MOVE, REPLACE_EXISTING);
    sequentialLog = new EncodedSequentialLog<>(new FilePersistence(logPath), codec);
  }
}
