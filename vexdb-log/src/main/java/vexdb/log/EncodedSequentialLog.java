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

import com.google.common.io.CountingInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.interfaces.log.SequentialEntry;
import vexdb.interfaces.log.SequentialEntryCodec;

import java.io.BufferedInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Sequential log that encodes and decodes its entries to bytes, persisting them to a BytePersistence.
 * It keeps an index from every entry's sequence number to its address in memory. The index is
 * rebuilt by scanning the persistence when the log is opened; an entry that cannot be read back at
 * the end of the persistence (left partially written by a crash) is truncated away at that time.
 * <p>
 * This class is not thread-safe; callers serialize access to it.
 */
public class EncodedSequentialLog<E extends SequentialEntry> implements SequentialLog<E> {
  private static final Logger LOG = LoggerFactory.getLogger(EncodedSequentialLog.class);

  private final BytePersistence persistence;
  private final SequentialEntryCodec<E> codec;
  private final NavigableMap<Long, Long> addressIndex = new TreeMap<>();

  public EncodedSequentialLog(BytePersistence persistence, SequentialEntryCodec<E> codec) throws IOException {
    this.persistence = persistence;
    this.codec = codec;
    rebuildIndex();
  }

  @Override
  public void append(List<E> entries) throws IOException {
    for (E entry : entries) {
      if (!addressIndex.isEmpty() && entry.getSeqNum() <= addressIndex.lastKey()) {
        throw new IllegalArgumentException("entry " + entry.getSeqNum() + " does not follow " + addressIndex.lastKey());
      }
      final long address = persistence.size();
      persistence.append(codec.encode(entry));
      addressIndex.put(entry.getSeqNum(), address);
    }
  }

  @Override
  public List<E> subSequence(long start, long end) throws IOException, LogEntryNotFound, LogEntryNotInSequence {
    final List<E> readEntries = new ArrayList<>();
    if (end <= start) {
      return readEntries;
    }

    final Long address = addressIndex.get(start);
    if (address == null) {
      throw new LogEntryNotFound("no entry with seqNum " + start);
    }

    try (InputStream reader = streamAt(address)) {
      long seqNum;
      do {
        E entry = codec.decode(reader);
        readEntries.add(entry);
        seqNum = entry.getSeqNum();
      } while (seqNum < end - 1);
    } catch (EOFException e) {
      throw new LogEntryNotFound("EOF reached before finding all requested entries: seqNum range ["
          + start + ", " + end + ")");
    }

    ensureAscendingWithNoGaps(readEntries);
    return readEntries;
  }

  @Override
  public List<E> readAll() throws IOException {
    final List<E> entries = new ArrayList<>(addressIndex.size());
    if (addressIndex.isEmpty()) {
      return entries;
    }

    try (InputStream reader = streamAt(addressIndex.firstEntry().getValue())) {
      for (int i = 0; i < addressIndex.size(); i++) {
        entries.add(codec.decode(reader));
      }
    }
    return entries;
  }

  @Override
  public boolean isEmpty() throws IOException {
    return addressIndex.isEmpty();
  }

  @Override
  public long firstSeqNum() {
    return addressIndex.isEmpty() ? 0 : addressIndex.firstKey();
  }

  @Override
  public long lastSeqNum() {
    return addressIndex.isEmpty() ? 0 : addressIndex.lastKey();
  }

  @Override
  public void truncate(long seqNum) throws IOException, LogEntryNotFound {
    final Long truncationPos = addressIndex.get(seqNum);
    if (truncationPos == null) {
      throw new LogEntryNotFound("cannot truncate at missing seqNum " + seqNum);
    }
    persistence.truncate(truncationPos);
    addressIndex.tailMap(seqNum, true).clear();
  }

  @Override
  public void sync() throws IOException {
    persistence.sync();
  }

  @Override
  public void close() throws IOException {
    persistence.close();
  }

  private InputStream streamAt(long address) throws IOException {
    final BytePersistence.Reader reader = persistence.getReader();
    reader.position(address);
    return new BufferedInputStream(Channels.newInputStream(reader));
  }

  private void rebuildIndex() throws IOException {
    final long size = persistence.size();
    long address = 0;

    try (CountingInputStream input = new CountingInputStream(streamAt(0))) {
      while (address < size) {
        try {
          final long seqNum = codec.skipEntryAndReturnSeqNum(input);
          addressIndex.put(seqNum, address);
          address = input.getCount();
        } catch (IOException e) {
          LOG.warn("discarding {} unreadable bytes at the end of the log after entry {}",
              size - address, lastSeqNum(), e);
          break;
        }
      }
    }

    if (address < size) {
      persistence.truncate(address);
    }
  }

  private void ensureAscendingWithNoGaps(List<E> entries) throws LogEntryNotInSequence {
    for (int i = 1; i < entries.size(); i++) {
      if (entries.get(i).getSeqNum() != entries.get(i - 1).getSeqNum() + 1) {
        throw new LogEntryNotInSequence("entry " + entries.get(i).getSeqNum()
            + " follows " + entries.get(i - 1).getSeqNum());
      }
    }
  }
}
