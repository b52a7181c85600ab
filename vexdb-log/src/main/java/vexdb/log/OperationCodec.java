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
import com.google.common.collect.Lists;
import com.google.common.math.IntMath;
import io.protostuff.Schema;
import io.protostuff.runtime.RuntimeSchema;
import vexdb.interfaces.log.SequentialEntryCodec;
import vexdb.interfaces.shard.Operation;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static vexdb.log.EntryEncodingUtil.CRC_BYTES;
import static vexdb.log.EntryEncodingUtil.appendCrcToBufferList;
import static vexdb.log.EntryEncodingUtil.decodeAndCheckCrc;
import static vexdb.log.EntryEncodingUtil.encodeWithLengthAndCrc;
import static vexdb.log.EntryEncodingUtil.getAndCheckContent;
import static vexdb.log.EntryEncodingUtil.skip;

/**
 * Codec for the operations in a shard replica's operation log: a header with the operation id,
 * shard and key, followed by the payload.
 */
public class OperationCodec implements SequentialEntryCodec<Operation> {
  private static final Schema<Header> SCHEMA = RuntimeSchema.getSchema(Header.class);

  @Override
  public ByteBuffer[] encode(Operation operation) {
    final Header header = new Header();
    header.operationId = operation.getOperationId();
    header.shardId = operation.getShardId();
    header.key = operation.getKey();
    header.payloadLength = operation.getPayload().length;

    final List<ByteBuffer> buffers = new ArrayList<>(encodeWithLengthAndCrc(SCHEMA, header));
    buffers.addAll(appendCrcToBufferList(Lists.newArrayList(ByteBuffer.wrap(operation.getPayload()))));
    return Iterables.toArray(buffers, ByteBuffer.class);
  }

  @Override
  public Operation decode(InputStream inputStream) throws IOException {
    final Header header = decodeAndCheckCrc(inputStream, SCHEMA);
    final ByteBuffer payload = getAndCheckContent(inputStream, header.payloadLength);
    return new Operation(header.operationId, header.shardId, header.key == null ? "" : header.key, payload.array());
  }

  @Override
  public long skipEntryAndReturnSeqNum(InputStream inputStream) throws IOException {
    final Header header = decodeAndCheckCrc(inputStream, SCHEMA);
    skip(inputStream, IntMath.checkedAdd(header.payloadLength, CRC_BYTES));
    return header.operationId;
  }

  static final class Header {
    long operationId;
    long shardId;
    String key;
    int payloadLength;
  }
}
