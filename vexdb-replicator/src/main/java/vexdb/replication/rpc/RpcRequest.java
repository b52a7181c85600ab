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

package vexdb.replication.rpc;

/**
 * An outbound request for the transport. It names the sender as well as the receiver, because
 * certain transports (e.g. in-ram simulations) don't know who 'we' are.
 */
public class RpcRequest extends RpcMessage {

  public RpcRequest(long to, long from, String quorumId, ReplicationMessage message) {
    super(to, from, quorumId, message);
  }
}
