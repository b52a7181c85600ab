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

package vexdb;

public class ClusterConstants {
  public static final String CLUSTER_QUORUM_ID = "cluster-meta";

  public static final int CLUSTER_DEFAULT_BASE_ELECTION_TIMEOUT_MILLISECONDS = 1000;
  public static final int CLUSTER_DEFAULT_PROPOSAL_TIMEOUT_MILLISECONDS = 10000;
  public static final int CLUSTER_DEFAULT_SNAPSHOT_THRESHOLD = 1000;
  public static final int CLUSTER_MEMBERSHIP_CHECK_INTERVAL_MILLISECONDS = 500;
  public static final int CLUSTER_FORWARD_PROPOSAL_RPC_TIMEOUT_MILLISECONDS = 10000;
  public static final int CLUSTER_LOG_THREAD_POOL_SIZE = 1;

  // Consecutive failed consensus requests after which the leader treats a peer as unreachable.
  public static final int CLUSTER_UNREACHABLE_PEER_FAILURE_COUNT = 3;
  public static final int CLUSTER_UNREACHABLE_PEER_CHECK_INTERVAL_MILLISECONDS = 1000;

  public static final int SHARD_DEFAULT_FORWARD_RPC_TIMEOUT_MILLISECONDS = 2000;
  public static final int SHARD_DEFAULT_HEALTH_PROBE_INTERVAL_MILLISECONDS = 1000;
  public static final int SHARD_DEFAULT_RETAINED_OPERATIONS = 10000;
  public static final int SHARD_TRANSFER_SNAPSHOT_RPC_TIMEOUT_MILLISECONDS = 30000;
  public static final int SHARD_DEFAULT_TRANSFER_RETRY_DELAY_MILLISECONDS = 1000;
  public static final int SHARD_DEFAULT_MAX_TRANSFER_ATTEMPTS = 5;

  // Largest number of operations sent in one catch-up or fetch reply.
  public static final int SHARD_MAXIMUM_CATCH_UP_OPERATIONS = 1000;
  public static final int SHARD_TAKEOVER_STATUS_ATTEMPTS = 10;

  public static final String SHARD_DIRECTORY_NAME = "shards";
  public static final String SHARD_OPERATION_LOG_FILE_NAME = "operations";
  public static final String SHARD_APPLIED_POSITION_FILE_NAME = "applied-position";
}
