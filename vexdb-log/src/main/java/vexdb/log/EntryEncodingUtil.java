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

import com.google.common.primitives.Ints;
import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import vexdb.util.CrcInputStream;

import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.Adler32;

import static com.google.common.math.IntMath.checkedAdd;

/**
 * Contains methods used for encoding and decoding log entries on disk: a length-prefixed protostuff
 * header followed by a 4-byte CRC, then raw content followed by its own 4-byte CRC.
 */
public class EntryEncodingUtil {
  public static final int CRC_BYTES = 4;

  /**
   * Exception indicating that a CRC has been read which does not match up with
   * the CRC computed from the associated data.
   */
  public static class CrcError extends IOException {
    public CrcError(String s) {
      super(s);
    }
  }

  /**
   * Serialize a protostuff message object, prefixed with message length, and suffixed with a 4-byte CRC.
   *
   * @return A list of ByteBuffers containing a varInt length, followed by the message, followed by a 4-byte CRC.
   */
  public static <T> List<ByteBuffer> encodeWithLengthAndCrc(Schema<T> schema, T message) {
    final ByteArrayOutputStream messageBytes = new ByteArrayOutputStream();
    final LinkedBuffer buffer = LinkedBuffer.allocate(256);

    try {
      ProtostuffIOUtil.writeDelimitedTo(messageBytes, message, schema, buffer);
    } catch (IOException e) {
      // Writing to a ByteArrayOutputStream performs no IO.
      throw new RuntimeException(e);
    } finally {
      buffer.clear();
    }

    final List<ByteBuffer> buffers = new ArrayList<>();
    buffers.add(ByteBuffer.wrap(messageBytes.toByteArray()));
    return appendCrcToBufferList(buffers);
  }

  /**
   * Decode a message from the passed input stream, and compute and verify its CRC. This method reads
   * data written by the method {@link EntryEncodingUtil#encodeWithLengthAndCrc}.
   *
   * @throws java.io.EOFException if the stream ends before the first byte of the message
   * @throws CrcError             if the recorded CRC of the message does not match its computed CRC.
   */
  public static <T> T decodeAndCheckCrc(InputStream inputStream, Schema<T> schema) throws IOException {
    final T message = schema.newMessage();
    final CrcInputStream crcStream = new CrcInputStream(inputStream, new Adler32());
    ProtostuffIOUtil.mergeDelimitedFrom(crcStream, message, schema);

    final long computedCrc = crcStream.getValue();
    final long diskCrc = readCrc(inputStream);
    if (diskCrc != computedCrc) {
      throw new CrcError("CRC mismatch on deserialized message " + message.toString());
    }

    return message;
  }

  /**
   * Given a list of ByteBuffers, compute the combined CRC and then append it to the list as an
   * additional ByteBuffer. Return the entire resulting collection as a new list, including the original
   * ByteBuffers; those are not mutated.
   */
  public static List<ByteBuffer> appendCrcToBufferList(List<ByteBuffer> content) {
    assert content != null;

    final Adler32 crc = new Adler32();
    content.forEach((ByteBuffer buffer) -> crc.update(buffer.duplicate()));

    final List<ByteBuffer> buffers = new ArrayList<>(content.size() + 1);
    content.forEach((ByteBuffer buffer) -> buffers.add(buffer.duplicate()));
    buffers.add(crcBuffer(crc.getValue()));
    return buffers;
  }

  /**
   * Read a specified number of bytes from the input stream (the "content"), then read the CRC and
   * check the validity of the data.
   */
  public static ByteBuffer getAndCheckContent(InputStream inputStream, int contentLength) throws IOException {
    final CrcInputStream crcStream = new CrcInputStream(inputStream, new Adler32());
    final byte[] content = new byte[contentLength];
    new DataInputStream(crcStream).readFully(content);

    final long computedCrc = crcStream.getValue();
    final long diskCrc = readCrc(inputStream);
    if (diskCrc != computedCrc) {
      throw new CrcError("CRC mismatch on log entry contents");
    }

    return ByteBuffer.wrap(content);
  }

  public static void skip(InputStream inputStream, int numBytes) throws IOException {
    final int skipped = new DataInputStream(inputStream).skipBytes(numBytes);
    if (skipped < numBytes) {
      throw new EOFException("Unable to skip requested number of bytes");
    }
  }

  /**
   * Add up the lengths of the content of each buffer in the passed list, and return the sum of the lengths.
   */
  public static int sumRemaining(List<ByteBuffer> buffers) {
    int length = 0;
    if (buffers != null) {
      for (ByteBuffer b : buffers) {
        length = checkedAdd(length, b.remaining());
      }
    }
    return length;
  }

  /**
   * The CRC is a 4-byte unsigned integer stored in a long; to store it in an int, subtract to
   * convert it from unsigned to signed.
   */
  private static ByteBuffer crcBuffer(long crc) {
    final long shiftedCrc = crc + Integer.MIN_VALUE;
    final ByteBuffer crcBuf = ByteBuffer.allocate(CRC_BYTES);
    crcBuf.putInt(Ints.checkedCast(shiftedCrc));
    crcBuf.flip();
    return crcBuf;
  }

  private static long readCrc(InputStream inputStream) throws IOException {
    int shiftedCrc = (new DataInputStream(inputStream)).readInt();
    return ((long) shiftedCrc) - Integer.MIN_VALUE;
  }
}
