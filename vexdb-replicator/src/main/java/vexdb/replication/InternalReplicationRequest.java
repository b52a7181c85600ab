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

import com.google.common.util.concurrent.SettableFuture;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorReceipt;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Represents a log request, for internal use by ReplicatorInstance.
 */
class InternalReplicationRequest {
  public final List<ByteBuffer> data;
  public final QuorumConfiguration config;
  public final SettableFuture<ReplicatorReceipt> logReceiptFuture;

  public static InternalReplicationRequest toLogData(List<ByteBuffer> data) {
    return new InternalReplicationRequest(data, null);
  }

  public static InternalReplicationRequest toChangeConfig(QuorumConfiguration config) {
    return new InternalReplicationRequest(new ArrayList<>(), config);
  }

  /**
   * The empty entry a new leader logs in its own term.
   */
  public static InternalReplicationRequest toNoOp() {
    return new InternalReplicationRequest(new ArrayList<>(), null);
  }

  public boolean isConfigurationChange() {
    return config != null;
  }

  public LogEntry getEntry(long term, long index) {
    return new LogEntry(term, index, data, config);
  }

  private InternalReplicationRequest(List<ByteBuffer> data, QuorumConfiguration config) {
    this.data = data;
    this.config = config;
    this.logReceiptFuture = SettableFuture.create();
  }
}
