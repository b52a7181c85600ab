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

import com.google.common.collect.Iterables;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import vexdb.ReplicatorConstants;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorSnapshot;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.TRUNCATE_EXISTING;
import static java.nio.file.StandardOpenOption.WRITE;
import static vexdb.log.EntryEncodingUtil.appendCrcToBufferList;
import static vexdb.log.EntryEncodingUtil.decodeAndCheckCrc;
import static vexdb.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static vexdb.log.EntryEncodingUtil.getAndCheckContent;

/**
 * SnapshotStore keeping one file per quorum, next to the quorum's replication data. The file is
 * a CRC-checked header describing the snapshot followed by the CRC-checked snapshot bytes, and
 * is replaced atomically.
 */
public class FileSnapshotStore implements SnapshotStore {
  private static final Schema<Header> SCHEMA = RuntimeSchema.getSchema(Header.class);

  private final NioQuorumFileReaderWriter readerWriter;

  public FileSnapshotStore(NioQuorumFileReaderWriter readerWriter) {
    this.readerWriter = readerWriter;
  }

  @Override
  public ReplicatorSnapshot load(String quorumId) throws IOException {
    final Path path = snapshotPath(quorumId);
    try (InputStream input = new BufferedInputStream(Files.newInputStream(path))) {
      final Header header = decodeAndCheckCrc(input, SCHEMA);
      final ByteBuffer content = getAndCheckContent(input, header.dataLength);

      final QuorumConfiguration configuration = QuorumConfiguration.fromParts(
          header.transitional,
          orEmpty(header.allPeers),
          orEmpty(header.prevPeers),
          orEmpty(header.nextPeers),
          orEmpty(header.learners));
      return new ReplicatorSnapshot(quorumId, header.lastIncludedIndex, header.lastIncludedTerm,
          configuration, content.array());
    } catch (NoSuchFileException e) {
      return null;
    }
  }

  @Override
  public void save(ReplicatorSnapshot snapshot) throws IOException {
    final Path path = snapshotPath(snapshot.quorumId);
    final Path tempPath = path.resolveSibling(ReplicatorConstants.REPLICATOR_SNAPSHOT_FILE_NAME + ".tmp");
    Files.createDirectories(path.getParent());

    final List<ByteBuffer> buffers = new ArrayList<>(encodeWithLengthAndCrc(SCHEMA, headerOf(snapshot)));
    buffers.addAll(appendCrcToBufferList(Collections.singletonList(ByteBuffer.wrap(snapshot.getData()))));

    try (FileChannel channel = FileChannel.open(tempPath, CREATE, WRITE, TRUNCATE_EXISTING)) {
      final ByteBuffer[] toWrite = Iterables.toArray(buffers, ByteBuffer.class);
      long remaining = 0;
      for (ByteBuffer buffer : toWrite) {
        remaining += buffer.remaining();
      }
      while (remaining > 0) {
        remaining -= channel.write(toWrite);
      }
      channel.force(true);
    }
    Files.move(tempPath, path, ATOMIC_MOVE, REPLACE_EXISTING);
  }

  private Path snapshotPath(String quorumId) {
    return readerWriter.getQuorumDirectory(quorumId).resolve(ReplicatorConstants.REPLICATOR_SNAPSHOT_FILE_NAME);
  }

  private static Header headerOf(ReplicatorSnapshot snapshot) {
    final Header header = new Header();
    header.lastIncludedIndex = snapshot.lastIncludedIndex;
    header.lastIncludedTerm = snapshot.lastIncludedTerm;
    header.dataLength = snapshot.getData().length;
    header.transitional = snapshot.configuration.isTransitional;
    header.allPeers = new ArrayList<>(snapshot.configuration.allPeers());
    header.prevPeers = new ArrayList<>(snapshot.configuration.prevPeers());
    header.nextPeers = new ArrayList<>(snapshot.configuration.nextPeers());
    header.learners = new ArrayList<>(snapshot.configuration.learners());
    return header;
  }

  // protostuff does not write empty collections.
  private static <T> Collection<T> orEmpty(Collection<T> collection) {
    return collection == null ? Collections.emptyList() : collection;
  }

  static final class Header {
    long lastIncludedIndex;
    long lastIncludedTerm;
    int dataLength;
    boolean transitional;
    List<Long> allPeers;
    List<Long> prevPeers;
    List<Long> nextPeers;
    List<Long> learners;

    @Override
    public String toString() {
      return "Header{lastIncludedIndex=" + lastIncludedIndex + ", lastIncludedTerm=" + lastIncludedTerm
          + ", dataLength=" + dataLength + '}';
    }
  }
}
