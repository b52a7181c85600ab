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
import java.nio.channels.FileChannel;
import java.nio.file.Path;

import static java.nio.file.StandardOpenOption.APPEND;
import static java.nio.file.StandardOpenOption.CREATE;
import static java.nio.file.StandardOpenOption.READ;

/**
 * A BytePersistence using a File, accessed by FileChannels.
 */
public class FilePersistence implements BytePersistence {
  private final FileChannel appendChannel;
  final Path path;
  private long filePosition;

  public FilePersistence(Path path) throws IOException {
    this.path = path;
    appendChannel = FileChannel.open(path, CREATE, APPEND);
    filePosition = appendChannel.size();
  }

  @Override
  public boolean isEmpty() throws IOException {
    return filePosition == 0;
  }

  @Override
  public long size() throws IOException {
    return filePosition;
  }

  @Override
  public void append(ByteBuffer[] buffers) throws IOException {
    final long toWrite = totalBytesToBeWritten(buffers);
    long written = 0;
    while (written < toWrite) {
      written += appendChannel.write(buffers);
    }
    filePosition += toWrite;
  }

  @Override
  public Reader getReader() throws IOException {
    return new NioReader(FileChannel.open(path, READ));
  }

  @Override
  public void truncate(long size) throws IOException {
    if (size > this.size()) {
      throw new IllegalArgumentException("Truncation may not grow the file");
    }
    appendChannel.truncate(size);
    filePosition = size;
  }

  @Override
  public void sync() throws IOException {
    appendChannel.force(true);
  }

  @Override
  public void close() throws IOException {
    appendChannel.close();
  }

  private static long totalBytesToBeWritten(ByteBuffer[] buffers) {
    long sum = 0;
    for (ByteBuffer b : buffers) {
      sum += b.remaining();
    }
    return sum;
  }

  private static class NioReader implements Reader {
    private final FileChannel fileChannel;

    NioReader(FileChannel fileChannel) {
      this.fileChannel = fileChannel;
    }

    @Override
    public long position() throws IOException {
      return fileChannel.position();
    }

    @Override
    public void position(long newPos) throws IOException {
      fileChannel.position(newPos);
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
      return fileChannel.read(dst);
    }

    @Override
    public boolean isOpen() {
      return fileChannel.isOpen();
    }

    @Override
    public void close() throws IOException {
      fileChannel.close();
    }
  }
}
