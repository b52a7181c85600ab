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

import com.google.common.collect.Iterables;
import com.google.common.math.IntMath;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import vexdb.interfaces.log.SequentialEntryCodec;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static vexdb.log.EntryEncodingUtil.CRC_BYTES;
import static vexdb.log.EntryEncodingUtil.appendCrcToBufferList;
import static vexdb.log.EntryEncodingUtil.decodeAndCheckCrc;
import static vexdb.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static vexdb.log.EntryEncodingUtil.getAndCheckContent;
import static vexdb.log.EntryEncodingUtil.skip;
import static vexdb.log.EntryEncodingUtil.sumRemaining;

/**
 * Codec for replicator log entries. Each entry is a header, which carries the index, the term,
 * the lengths of the data buffers and the quorum configuration if there is one, followed by the
 * concatenated data buffers.
 */
public class LogEntryCodec implements SequentialEntryCodec<LogEntry> {
  private static final Schema<Header> SCHEMA = RuntimeSchema.getSchema(Header.class);

  @Override
  public ByteBuffer[] encode(LogEntry entry) {
    final List<ByteBuffer> contentBufs = entry.getDataList();
    final List<ByteBuffer> entryBufs = new ArrayList<>(encodeWithLengthAndCrc(SCHEMA, createHeader(entry)));
    entryBufs.addAll(appendCrcToBufferList(contentBufs));

    return Iterables.toArray(entryBufs, ByteBuffer.class);
  }

  @Override
  public LogEntry decode(InputStream inputStream) throws IOException {
    final Header header = decodeAndCheckCrc(inputStream, SCHEMA);
    final ByteBuffer contentBuf = getAndCheckContent(inputStream, header.contentLength);

    final List<ByteBuffer> data = new ArrayList<>();
    for (int length : orEmpty(header.bufferLengths)) {
      final ByteBuffer buffer = contentBuf.duplicate();
      buffer.limit(buffer.position() + length);
      data.add(buffer.slice());
      contentBuf.position(contentBuf.position() + length);
    }

    return new LogEntry(header.term, header.seqNum, data, configurationOf(header));
  }

  @Override
  public long skipEntryAndReturnSeqNum(InputStream inputStream) throws IOException {
    final Header header = decodeAndCheckCrc(inputStream, SCHEMA);
    skip(inputStream, IntMath.checkedAdd(header.contentLength, CRC_BYTES));
    return header.seqNum;
  }

  private static Header createHeader(LogEntry entry) {
    final Header header = new Header();
    header.seqNum = entry.getIndex();
    header.term = entry.getTerm();
    header.contentLength = sumRemaining(entry.getDataList());
    header.bufferLengths = new ArrayList<>();
    for (ByteBuffer buffer : entry.getDataList()) {
      header.bufferLengths.add(buffer.remaining());
    }

    final QuorumConfiguration config = entry.getQuorumConfiguration();
    if (config != null) {
      header.hasConfiguration = true;
      header.transitional = config.isTransitional;
      header.allPeers = new ArrayList<>(config.allPeers());
      header.prevPeers = new ArrayList<>(config.prevPeers());
      header.nextPeers = new ArrayList<>(config.nextPeers());
      header.learners = new ArrayList<>(config.learners());
    }
    return header;
  }

  private static QuorumConfiguration configurationOf(Header header) {
    if (!header.hasConfiguration) {
      return null;
    }
    return QuorumConfiguration.fromParts(
        header.transitional,
        orEmpty(header.allPeers),
        orEmpty(header.prevPeers),
        orEmpty(header.nextPeers),
        orEmpty(header.learners));
  }

  // protostuff does not write empty collections, so they read back as null.
  static <T> Collection<T> orEmpty(Collection<T> collection) {
    return collection == null ? Collections.emptyList() : collection;
  }

  static final class Header {
    long seqNum;
    long term;
    int contentLength;
    List<Integer> bufferLengths;
    boolean hasConfiguration;
    boolean transitional;
    List<Long> allPeers;
    List<Long> prevPeers;
    List<Long> nextPeers;
    List<Long> learners;

    @Override
    public String toString() {
      return "Header{seqNum=" + seqNum + ", term=" + term + ", contentLength=" + contentLength + '}';
    }
  }
}
