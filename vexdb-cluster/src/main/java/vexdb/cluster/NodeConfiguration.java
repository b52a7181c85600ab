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

package vexdb.cluster;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.Properties;
import java.util.Set;

import static vexdb.ClusterConstants.CLUSTER_DEFAULT_BASE_ELECTION_TIMEOUT_MILLISECONDS;
import static vexdb.ClusterConstants.CLUSTER_DEFAULT_PROPOSAL_TIMEOUT_MILLISECONDS;
import static vexdb.ClusterConstants.CLUSTER_DEFAULT_SNAPSHOT_THRESHOLD;
import static vexdb.ClusterConstants.SHARD_DEFAULT_FORWARD_RPC_TIMEOUT_MILLISECONDS;
import static vexdb.ClusterConstants.SHARD_DEFAULT_HEALTH_PROBE_INTERVAL_MILLISECONDS;
import static vexdb.ClusterConstants.SHARD_DEFAULT_MAX_TRANSFER_ATTEMPTS;
import static vexdb.ClusterConstants.SHARD_DEFAULT_RETAINED_OPERATIONS;
import static vexdb.ClusterConstants.SHARD_DEFAULT_TRANSFER_RETRY_DELAY_MILLISECONDS;

/**
 * Immutable settings of one cluster node. Anything not set explicitly takes its default from
 * {@link vexdb.ClusterConstants}.
 */
public final class NodeConfiguration {
  public static final String NODE_ID = "vexdb.node.id";
  public static final String DATA_DIRECTORY = "vexdb.data.directory";
  public static final String BOOTSTRAP_PEERS = "vexdb.bootstrap.peers";
  public static final String ELECTION_TIMEOUT = "vexdb.consensus.election.timeout.ms";
  public static final String PROPOSAL_TIMEOUT = "vexdb.consensus.proposal.timeout.ms";
  public static final String SNAPSHOT_THRESHOLD = "vexdb.consensus.snapshot.threshold";
  public static final String FORWARD_TIMEOUT = "vexdb.shard.forward.timeout.ms";
  public static final String HEALTH_PROBE_INTERVAL = "vexdb.shard.health.probe.interval.ms";
  public static final String RETAINED_OPERATIONS = "vexdb.shard.retained.operations";
  public static final String TRANSFER_RETRY_DELAY = "vexdb.shard.transfer.retry.delay.ms";
  public static final String MAX_TRANSFER_ATTEMPTS = "vexdb.shard.transfer.max.attempts";

  public final long nodeId;
  @Nullable
  public final Path dataDirectory;
  public final Set<Long> bootstrapPeers;
  public final int electionTimeoutMillis;
  public final long proposalTimeoutMillis;
  public final int snapshotThreshold;
  public final long forwardTimeoutMillis;
  public final long healthProbeIntervalMillis;
  public final int retainedOperations;
  public final long transferRetryDelayMillis;
  public final int maxTransferAttempts;

  private NodeConfiguration(Builder builder) {
    this.nodeId = builder.nodeId;
    this.dataDirectory = builder.dataDirectory;
    this.bootstrapPeers = ImmutableSet.copyOf(builder.bootstrapPeers);
    this.electionTimeoutMillis = builder.electionTimeoutMillis;
    this.proposalTimeoutMillis = builder.proposalTimeoutMillis;
    this.snapshotThreshold = builder.snapshotThreshold;
    this.forwardTimeoutMillis = builder.forwardTimeoutMillis;
    this.healthProbeIntervalMillis = builder.healthProbeIntervalMillis;
    this.retainedOperations = builder.retainedOperations;
    this.transferRetryDelayMillis = builder.transferRetryDelayMillis;
    this.maxTransferAttempts = builder.maxTransferAttempts;
  }

  public static Builder builder(long nodeId) {
    return new Builder(nodeId);
  }

  public Builder toBuilder() {
    return new Builder(nodeId)
        .setDataDirectory(dataDirectory)
        .setBootstrapPeers(bootstrapPeers)
        .setElectionTimeoutMillis(electionTimeoutMillis)
        .setProposalTimeoutMillis(proposalTimeoutMillis)
        .setSnapshotThreshold(snapshotThreshold)
        .setForwardTimeoutMillis(forwardTimeoutMillis)
        .setHealthProbeIntervalMillis(healthProbeIntervalMillis)
        .setRetainedOperations(retainedOperations)
        .setTransferRetryDelayMillis(transferRetryDelayMillis)
        .setMaxTransferAttempts(maxTransferAttempts);
  }

  public static NodeConfiguration load(Path propertiesFile) throws IOException {
    Properties properties = new Properties();
    try (Reader reader = Files.newBufferedReader(propertiesFile, StandardCharsets.UTF_8)) {
      properties.load(reader);
    }
    return fromProperties(properties);
  }

  /**
   * Read a configuration from properties. Only the node id is required; a missing data
   * directory means the node keeps everything in memory.
   */
  public static NodeConfiguration fromProperties(Properties properties) {
    String nodeId = properties.getProperty(NODE_ID);
    Preconditions.checkArgument(nodeId != null, "missing property %s", NODE_ID);

    Builder builder = builder(parseLong(NODE_ID, nodeId));
    String dataDirectory = properties.getProperty(DATA_DIRECTORY);
    if (dataDirectory != null) {
      builder.setDataDirectory(Paths.get(dataDirectory));
    }
    String peers = properties.getProperty(BOOTSTRAP_PEERS);
    if (peers != null) {
      ImmutableSet.Builder<Long> peerIds = ImmutableSet.builder();
      for (String peer : Splitter.on(',').trimResults().omitEmptyStrings().split(peers)) {
        peerIds.add(parseLong(BOOTSTRAP_PEERS, peer));
      }
      builder.setBootstrapPeers(peerIds.build());
    }

    builder.setElectionTimeoutMillis((int) longProperty(properties, ELECTION_TIMEOUT, builder.electionTimeoutMillis));
    builder.setProposalTimeoutMillis(longProperty(properties, PROPOSAL_TIMEOUT, builder.proposalTimeoutMillis));
    builder.setSnapshotThreshold((int) longProperty(properties, SNAPSHOT_THRESHOLD, builder.snapshotThreshold));
    builder.setForwardTimeoutMillis(longProperty(properties, FORWARD_TIMEOUT, builder.forwardTimeoutMillis));
    builder.setHealthProbeIntervalMillis(
        longProperty(properties, HEALTH_PROBE_INTERVAL, builder.healthProbeIntervalMillis));
    builder.setRetainedOperations((int) longProperty(properties, RETAINED_OPERATIONS, builder.retainedOperations));
    builder.setTransferRetryDelayMillis(
        longProperty(properties, TRANSFER_RETRY_DELAY, builder.transferRetryDelayMillis));
    builder.setMaxTransferAttempts((int) longProperty(properties, MAX_TRANSFER_ATTEMPTS, builder.maxTransferAttempts));
    return builder.build();
  }

  private static long longProperty(Properties properties, String name, long defaultValue) {
    String value = properties.getProperty(name);
    return value == null ? defaultValue : parseLong(name, value);
  }

  private static long parseLong(String name, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("property " + name + " is not a number: " + value, e);
    }
  }

  @Override
  public String toString() {
    return "NodeConfiguration{" +
        "nodeId=" + nodeId +
        ", dataDirectory=" + dataDirectory +
        ", bootstrapPeers=" + bootstrapPeers +
        ", electionTimeoutMillis=" + electionTimeoutMillis +
        ", proposalTimeoutMillis=" + proposalTimeoutMillis +
        ", snapshotThreshold=" + snapshotThreshold +
        ", forwardTimeoutMillis=" + forwardTimeoutMillis +
        ", healthProbeIntervalMillis=" + healthProbeIntervalMillis +
        ", retainedOperations=" + retainedOperations +
        ", transferRetryDelayMillis=" + transferRetryDelayMillis +
        ", maxTransferAttempts=" + maxTransferAttempts +
        '}';
  }

  public static final class Builder {
    private final long nodeId;
    private Path dataDirectory;
    private Set<Long> bootstrapPeers = ImmutableSet.of();
    private int electionTimeoutMillis = CLUSTER_DEFAULT_BASE_ELECTION_TIMEOUT_MILLISECONDS;
    private long proposalTimeoutMillis = CLUSTER_DEFAULT_PROPOSAL_TIMEOUT_MILLISECONDS;
    private int snapshotThreshold = CLUSTER_DEFAULT_SNAPSHOT_THRESHOLD;
    private long forwardTimeoutMillis = SHARD_DEFAULT_FORWARD_RPC_TIMEOUT_MILLISECONDS;
    private long healthProbeIntervalMillis = SHARD_DEFAULT_HEALTH_PROBE_INTERVAL_MILLISECONDS;
    private int retainedOperations = SHARD_DEFAULT_RETAINED_OPERATIONS;
    private long transferRetryDelayMillis = SHARD_DEFAULT_TRANSFER_RETRY_DELAY_MILLISECONDS;
    private int maxTransferAttempts = SHARD_DEFAULT_MAX_TRANSFER_ATTEMPTS;

    private Builder(long nodeId) {
      Preconditions.checkArgument(nodeId > 0, "node ids must be positive, got %s", nodeId);
      this.nodeId = nodeId;
    }

    public Builder setDataDirectory(@Nullable Path dataDirectory) {
      this.dataDirectory = dataDirectory;
      return this;
    }

    public Builder setBootstrapPeers(Collection<Long> bootstrapPeers) {
      this.bootstrapPeers = ImmutableSet.copyOf(bootstrapPeers);
      return this;
    }

    public Builder setElectionTimeoutMillis(int electionTimeoutMillis) {
      Preconditions.checkArgument(electionTimeoutMillis > 0);
      this.electionTimeoutMillis = electionTimeoutMillis;
      return this;
    }

    public Builder setProposalTimeoutMillis(long proposalTimeoutMillis) {
      Preconditions.checkArgument(proposalTimeoutMillis > 0);
      this.proposalTimeoutMillis = proposalTimeoutMillis;
      return this;
    }

    public Builder setSnapshotThreshold(int snapshotThreshold) {
      Preconditions.checkArgument(snapshotThreshold > 0);
      this.snapshotThreshold = snapshotThreshold;
      return this;
    }

    public Builder setForwardTimeoutMillis(long forwardTimeoutMillis) {
      Preconditions.checkArgument(forwardTimeoutMillis > 0);
      this.forwardTimeoutMillis = forwardTimeoutMillis;
      return this;
    }

    public Builder setHealthProbeIntervalMillis(long healthProbeIntervalMillis) {
      Preconditions.checkArgument(healthProbeIntervalMillis > 0);
      this.healthProbeIntervalMillis = healthProbeIntervalMillis;
      return this;
    }

    public Builder setRetainedOperations(int retainedOperations) {
      Preconditions.checkArgument(retainedOperations > 0);
      this.retainedOperations = retainedOperations;
      return this;
    }

    public Builder setTransferRetryDelayMillis(long transferRetryDelayMillis) {
      Preconditions.checkArgument(transferRetryDelayMillis >= 0);
      this.transferRetryDelayMillis = transferRetryDelayMillis;
      return this;
    }

    public Builder setMaxTransferAttempts(int maxTransferAttempts) {
      Preconditions.checkArgument(maxTransferAttempts > 0);
      this.maxTransferAttempts = maxTransferAttempts;
      return this;
    }

    public NodeConfiguration build() {
      return new NodeConfiguration(this);
    }
  }
}
