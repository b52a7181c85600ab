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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.interfaces.shard.Operation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * OperationLog persisted to a single file with the same framing and CRCs as the consensus log.
 */
public class FileOperationLog implements OperationLog {
  private static final Logger LOG = LoggerFactory.getLogger(FileOperationLog.class);

  private final Path path;
  private final OperationCodec codec = new OperationCodec();
  private SequentialLog<Operation> sequentialLog;

  public FileOperationLog(Path path) throws IOException {
    this.path = path;
    Files.createDirectories(path.getParent());
    this.sequentialLog = new EncodedSequentialLog<>(new FilePersistence(path), codec);
    LOG.debug("opened operation log {} holding operations [{}, {}]", path, firstOperationId(), lastOperationId());
  }

  @Override
  public void append(Operation operation) throws IOException {
    sequentialLog.append(Collections.singletonList(operation));
    sequentialLog.sync();
  }

  @Override
  public List<Operation> getRange(long afterId, long throughId) throws IOException {
    if (throughId <= afterId) {
      return new ArrayList<>();
    }
    if (sequentialLog.isEmpty() || afterId + 1 < firstOperationId() || throughId > lastOperationId()) {
      return null;
    }

    try {
      return sequentialLog.subSequence(afterId + 1, throughId + 1);
    } catch (SequentialLog.LogEntryNotFound | SequentialLog.LogEntryNotInSequence e) {
      throw new IOException("operation log " + path + " is missing operations in (" + afterId + ", "
          + throughId + "]", e);
    }
  }

  @Override
  public long firstOperationId() {
    return sequentialLog.firstSeqNum();
  }

  @Override
  public long lastOperationId() {
    return sequentialLog.lastSeqNum();
  }

  @Override
  public void retainLast(int count) throws IOException {
    final long first = firstOperationId();
    final long last = lastOperationId();
    if (sequentialLog.isEmpty() || last - first + 1 <= count) {
      return;
    }

    final List<Operation> retained = getRange(last - count, last);
    rewrite(retained == null ? new ArrayList<>() : retained);
  }

  @Override
  public void truncateFrom(long operationId) throws IOException {
    if (sequentialLog.isEmpty() || operationId > lastOperationId()) {
      return;
    }
    try {
      sequentialLog.truncate(Math.max(operationId, firstOperationId()));
    } catch (SequentialLog.LogEntryNotFound e) {
      throw new IOException(e);
    }
    sequentialLog.sync();
  }

  @Override
  public void clear() throws IOException {
    truncateFrom(firstOperationId());
  }

  @Override
  public void close() throws IOException {
    sequentialLog.close();
  }

  private void rewrite(List<Operation> retained) throws IOException {
    final Path tempPath = path.resolveSibling(path.getFileName() + ".tmp");
    Files.deleteIfExists(tempPath);
    try (SequentialLog<Operation> rewritten = new EncodedSequentialLog<>(new FilePersistence(tempPath), codec)) {
      rewritten.append(retained);
      rewritten.sync();
    }

    sequentialLog.close();
    Files.move(tempPath, path, ATOMIC_MOVE, REPLACE_EXISTING);
    sequentialLog = new EncodedSequentialLog<>(new FilePersistence(path), codec);
  }
}
