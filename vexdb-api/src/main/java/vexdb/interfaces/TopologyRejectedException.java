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

package vexdb.interfaces;

/**
 * A committed metadata command could not be applied to the topology. The command was a no-op
 * on every node; only its proposer learns why.
 */
public class TopologyRejectedException extends ClusterException {
  public enum Reason {
    COLLECTION_EXISTS,
    UNKNOWN_COLLECTION,
    UNKNOWN_ALIAS,
    ALIAS_EXISTS,
    UNKNOWN_PEER,
    PEER_EXISTS,
    PEER_HOLDS_LAST_REPLICA,
    UNKNOWN_SHARD,
    TRANSFER_EXISTS,
    UNKNOWN_TRANSFER,
    INVALID_ARGUMENT,
    LAST_ACTIVE_REPLICA,
  }

  private final Reason reason;

  public TopologyRejectedException(Reason reason, String message) {
    super(reason + ": " + message);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }

  @Override
  public boolean isRetryable() {
    return false;
  }
}
