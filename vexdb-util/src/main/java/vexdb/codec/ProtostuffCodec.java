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

package vexdb.codec;

import io.protostuff.LinkedBuffer;
import io.protostuff.ProtostuffIOUtil;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Serializes plain objects in protobuf format using a protostuff runtime schema. Fields declared
 * with an abstract type carry their concrete class name, so a command hierarchy can share one codec.
 * <p>
 * Instances are safe for use by multiple threads; each call allocates its own buffer.
 */
public class ProtostuffCodec<T> {
  private static final int BUFFER_SIZE = 512;

  private final Schema<T> schema;

  public ProtostuffCodec(Class<T> type) {
    this.schema = RuntimeSchema.getSchema(type);
  }

  public Schema<T> schema() {
    return schema;
  }

  public byte[] encode(T message) {
    final LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
    try {
      return ProtostuffIOUtil.toByteArray(message, schema, buffer);
    } finally {
      buffer.clear();
    }
  }

  public T decode(byte[] bytes) {
    final T message = schema.newMessage();
    ProtostuffIOUtil.mergeFrom(bytes, message, schema);
    return message;
  }

  /**
   * Write the message prefixed with its varint length.
   */
  public void writeDelimited(OutputStream outputStream, T message) throws IOException {
    final LinkedBuffer buffer = LinkedBuffer.allocate(BUFFER_SIZE);
    try {
      ProtostuffIOUtil.writeDelimitedTo(outputStream, message, schema, buffer);
    } finally {
      buffer.clear();
    }
  }

  public T readDelimited(InputStream inputStream) throws IOException {
    final T message = schema.newMessage();
    ProtostuffIOUtil.mergeDelimitedFrom(inputStream, message, schema);
    return message;
  }
}
