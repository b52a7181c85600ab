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

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

/**
 * Represents a single store of persisted log data; a file-like abstraction. Data can only be
 * appended to the end, or truncated from the end.
 */
public interface BytePersistence extends AutoCloseable {
  boolean isEmpty() throws IOException;

  /**
   * Get the size in bytes of the data, equal to the position/address of
   * next byte to be appended.
   */
  long size() throws IOException;

  void append(ByteBuffer[] buffers) throws IOException;

  /**
   * Get a new reader of the data. Each reader is independent of any other,
   * and the caller takes responsibility for releasing associated resources.
   */
  Reader getReader() throws IOException;

  /**
   * Truncate data from the end, to a certain size.
   *
   * @param size New size of the data, equal to the position/address of the next
   *             byte to be appended after the truncation.
   */
  void truncate(long size) throws IOException;

  /**
   * Sync previous operations to the underlying medium.
   */
  void sync() throws IOException;

  @Override
  void close() throws IOException;

  /**
   * Seekable reader of a BytePersistence that keeps track of its own position within
   * the data.
   */
  interface Reader extends ReadableByteChannel {
    long position() throws IOException;

    void position(long newPos) throws IOException;
  }
}
