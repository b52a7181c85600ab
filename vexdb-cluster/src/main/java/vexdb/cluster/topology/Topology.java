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

package vexdb.cluster.topology;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import org.jetbrains.annotations.Nullable;
import vexdb.interfaces.TopologyRejectedException;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.shard.HashRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static vexdb.interfaces.TopologyRejectedException.Reason;

/**
 * Immutable view of the cluster as of some consensus log index: its peers, collections, aliases,
 * shards and in-flight shard transfers. Peers and shards refer to each other by id only.
 * <p>
 * A Topology is only ever produced by applying committed log entries, in order, starting from
 * {@link #EMPTY} or from a snapshot, so every node that has applied the same prefix of the log
 * holds an equal Topology.
 */
public final class Topology {
  public static final Topology EMPTY = new Topology(0, 1,
      ImmutableSortedMap.of(), ImmutableSortedMap.of(), ImmutableSortedMap.of(), ImmutableSortedMap.of(),
      ImmutableList.of());

  public final long index;
  public final long nextShardId;
  public final ImmutableSortedMap<Long, PeerInfo> peers;
  public final ImmutableSortedMap<String, CollectionInfo> collections;
  public final ImmutableSortedMap<String, String> aliases;
  public final ImmutableSortedMap<Long, ShardInfo> shards;
  public final ImmutableList<ShardTransferInfo> transfers;

  public Topology(long index,
                  long nextShardId,
                  Map<Long, PeerInfo> peers,
                  Map<String, CollectionInfo> collections,
                  Map<String, String> aliases,
                  Map<Long, ShardInfo> shards,
                  List<ShardTransferInfo> transfers) {
    this.index = index;
    this.nextShardId = nextShardId;
    this.peers = ImmutableSortedMap.copyOf(peers);
    this.collections = ImmutableSortedMap.copyOf(collections);
    this.aliases = ImmutableSortedMap.copyOf(aliases);
    this.shards = ImmutableSortedMap.copyOf(shards);
    this.transfers = ImmutableList.copyOf(transfers);
  }

  /**
   * The collection a name refers to, following an alias if there is one; null if there is none.
   */
  @Nullable
  public CollectionInfo resolveCollection(String nameOrAlias) {
    CollectionInfo collection = collections.get(nameOrAlias);
    if (collection == null && aliases.containsKey(nameOrAlias)) {
      collection = collections.get(aliases.get(nameOrAlias));
    }
    return collection;
  }

  public List<ShardInfo> shardsOf(String collection) {
    List<ShardInfo> result = new ArrayList<>();
    for (ShardInfo shard : shards.values()) {
      if (shard.collection.equals(collection)) {
        result.add(shard);
      }
    }
    return result;
  }

  /**
   * The shard of the collection whose hash range holds the key, or null if there is none.
   */
  @Nullable
  public ShardInfo shardForKey(String collection, String key) {
    long hash = HashRange.hashKey(key);
    for (ShardInfo shard : shardsOf(collection)) {
      if (shard.range.contains(hash)) {
        return shard;
      }
    }
    return null;
  }

  @Nullable
  public ShardInfo shard(long shardId) {
    return shards.get(shardId);
  }

  public List<Long> voters() {
    List<Long> voters = new ArrayList<>();
    for (PeerInfo peer : peers.values()) {
      if (peer.role == PeerRole.VOTER) {
        voters.add(peer.peerId);
      }
    }
    return voters;
  }

  @Nullable
  public ShardTransferInfo transfer(long shardId, long toPeer) {
    for (ShardTransferInfo transfer : transfers) {
      if (transfer.shardId == shardId && transfer.toPeer == toPeer) {
        return transfer;
      }
    }
    return null;
  }

  public List<ShardTransferInfo> transfersTo(long peerId) {
    List<ShardTransferInfo> result = new ArrayList<>();
    for (ShardTransferInfo transfer : transfers) {
      if (transfer.toPeer == peerId) {
        result.add(transfer);
      }
    }
    return result;
  }

  public boolean hasTransfersFrom(long sourceShardId) {
    for (ShardTransferInfo transfer : transfers) {
      if (transfer.sourceShardId == sourceShardId && transfer.isSplit()) {
        return true;
      }
    }
    return false;
  }

  public Topology atIndex(long newIndex) {
    return new Topology(newIndex, nextShardId, peers, collections, aliases, shards, transfers);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Topology that = (Topology) o;
    return index == that.index
        && nextShardId == that.nextShardId
        && peers.equals(that.peers)
        && collections.equals(that.collections)
        && aliases.equals(that.aliases)
        && shards.equals(that.shards)
        && transfers.equals(that.transfers);
  }

  @Override
  public int hashCode() {
    int result = Long.hashCode(index);
    result = 31 * result + Long.hashCode(nextShardId);
    result = 31 * result + peers.hashCode();
    result = 31 * result + collections.hashCode();
    result = 31 * result + aliases.hashCode();
    result = 31 * result + shards.hashCode();
    result = 31 * result + transfers.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return "Topology{" +
        "index=" + index +
        ", peers=" + peers.values() +
        ", collections=" + collections.values() +
        ", aliases=" + aliases +
        ", shards=" + shards.values() +
        ", transfers=" + transfers +
        '}';
  }

  /**
   * Mutable copy of a topology that commands change one step at a time. Every method either
   * makes its change or throws without having changed anything.
   */
  public static final class Builder {
    private long nextShardId;
    private final TreeMap<Long, PeerInfo> peers;
    private final TreeMap<String, CollectionInfo> collections;
    private final TreeMap<String, String> aliases;
    private final TreeMap<Long, ShardInfo> shards;
    private final List<ShardTransferInfo> transfers;

    private Builder(Topology topology) {
      this.nextShardId = topology.nextShardId;
      this.peers = new TreeMap<>(topology.peers);
      this.collections = new TreeMap<>(topology.collections);
      this.aliases = new TreeMap<>(topology.aliases);
      this.shards = new TreeMap<>(topology.shards);
      this.transfers = new ArrayList<>(topology.transfers);
    }

    public Topology build(long index) {
      return new Topology(index, nextShardId, peers, collections, aliases, shards, transfers);
    }

    public void addPeer(long peerId, String address) throws TopologyRejectedException {
      if (peers.containsKey(peerId)) {
        throw new TopologyRejectedException(Reason.PEER_EXISTS, "peer " + peerId + " is already a member");
      }
      peers.put(peerId, new PeerInfo(peerId, address, PeerRole.LEARNER));
    }

    public void removePeer(long peerId) throws TopologyRejectedException {
      requirePeer(peerId);
      for (ShardInfo shard : shards.values()) {
        if (shard.hasReplicaOn(peerId) && lastCopyIsOn(shard, peerId)) {
          throw new TopologyRejectedException(Reason.PEER_HOLDS_LAST_REPLICA,
              "peer " + peerId + " holds the last replica of shard " + shard.shardId);
        }
      }
      peers.remove(peerId);
      for (ShardInfo shard : new ArrayList<>(shards.values())) {
        if (shard.hasReplicaOn(peerId)) {
          shards.put(shard.shardId, shard.withoutReplica(peerId));
        }
      }
      transfers.removeIf(transfer -> transfer.toPeer == peerId || transfer.fromPeer == peerId);
    }

    /**
     * Make peer roles follow a committed quorum configuration. The first configuration, the one a
     * cluster is bootstrapped with, also introduces its members; after that peers only join
     * through AddPeer, so that a configuration still listing a removed peer cannot bring it back.
     */
    public void applyConfiguration(QuorumConfiguration configuration) {
      if (peers.isEmpty()) {
        for (long peerId : configuration.allMembers()) {
          peers.put(peerId, new PeerInfo(peerId, "", PeerRole.LEARNER));
        }
      }
      for (PeerInfo peer : new ArrayList<>(peers.values())) {
        PeerRole role = configuration.isVoter(peer.peerId) ? PeerRole.VOTER : PeerRole.LEARNER;
        if (peer.role != role) {
          peers.put(peer.peerId, peer.withRole(role));
        }
      }
    }

    public void createCollection(String name,
                                 int shardCount,
                                 int replicationFactor,
                                 int writeConsistencyFactor,
                                 List<List<Long>> placement) throws TopologyRejectedException {
      if (collections.containsKey(name) || aliases.containsKey(name)) {
        throw new TopologyRejectedException(Reason.COLLECTION_EXISTS, "collection " + name + " exists");
      }
      if (shardCount <= 0 || replicationFactor <= 0 || placement.size() != shardCount) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT,
            "collection " + name + " needs a placement for each of its " + shardCount + " shards");
      }
      for (List<Long> shardPeers : placement) {
        if (shardPeers.isEmpty()) {
          throw new TopologyRejectedException(Reason.INVALID_ARGUMENT, "a shard of " + name + " has no replica");
        }
        for (long peerId : shardPeers) {
          requirePeer(peerId);
        }
      }

      collections.put(name, new CollectionInfo(name, shardCount, replicationFactor, writeConsistencyFactor));
      HashRange[] ranges = HashRange.divide(shardCount);
      for (int i = 0; i < shardCount; i++) {
        Map<Long, ReplicaRole> replicas = new TreeMap<>();
        for (long peerId : placement.get(i)) {
          replicas.put(peerId, ReplicaRole.ACTIVE);
        }
        long shardId = nextShardId++;
        shards.put(shardId, new ShardInfo(shardId, name, ranges[i], replicas));
      }
    }

    /**
     * Zero for either factor leaves it unchanged.
     */
    public void updateCollection(String name, int replicationFactor, int writeConsistencyFactor)
        throws TopologyRejectedException {
      CollectionInfo collection = requireCollection(name);
      if (replicationFactor < 0 || writeConsistencyFactor < 0) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT, "negative factor for " + name);
      }
      collections.put(name, collection.withFactors(
          replicationFactor == 0 ? collection.replicationFactor : replicationFactor,
          writeConsistencyFactor == 0 ? collection.writeConsistencyFactor : writeConsistencyFactor));
    }

    public void dropCollection(String name) throws TopologyRejectedException {
      requireCollection(name);
      collections.remove(name);
      shards.values().removeIf(shard -> shard.collection.equals(name));
      aliases.values().removeIf(name::equals);
      transfers.removeIf(transfer -> transfer.collection.equals(name));
    }

    public void createAlias(String alias, String collection) throws TopologyRejectedException {
      if (aliases.containsKey(alias)) {
        throw new TopologyRejectedException(Reason.ALIAS_EXISTS, "alias " + alias + " exists");
      }
      if (collections.containsKey(alias)) {
        throw new TopologyRejectedException(Reason.COLLECTION_EXISTS, "a collection is named " + alias);
      }
      requireCollection(collection);
      aliases.put(alias, collection);
    }

    public void deleteAlias(String alias) throws TopologyRejectedException {
      requireAlias(alias);
      aliases.remove(alias);
    }

    public void renameAlias(String oldAlias, String newAlias) throws TopologyRejectedException {
      String collection = requireAlias(oldAlias);
      if (aliases.containsKey(newAlias)) {
        throw new TopologyRejectedException(Reason.ALIAS_EXISTS, "alias " + newAlias + " exists");
      }
      if (collections.containsKey(newAlias)) {
        throw new TopologyRejectedException(Reason.COLLECTION_EXISTS, "a collection is named " + newAlias);
      }
      aliases.remove(oldAlias);
      aliases.put(newAlias, collection);
    }

    /**
     * Split a shard in two. The shard keeps the lower half of its range; a new shard takes the
     * upper half, with an initializing replica on each of the given peers, to be filled from the
     * split shard's primary.
     */
    public void splitShard(long shardId, List<Long> newShardPeers) throws TopologyRejectedException {
      ShardInfo shard = requireShard(shardId);
      long primary = shard.primary();
      if (primary == 0) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT, "shard " + shardId + " has no active replica");
      }
      if (!shard.range.isSplittable() || newShardPeers.isEmpty()) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT, "shard " + shardId + " cannot be split");
      }
      if (hasTransferFor(shardId)) {
        throw new TopologyRejectedException(Reason.TRANSFER_EXISTS, "shard " + shardId + " is being transferred");
      }
      for (long peerId : newShardPeers) {
        requirePeer(peerId);
      }

      long newShardId = nextShardId++;
      Map<Long, ReplicaRole> replicas = new TreeMap<>();
      for (long peerId : newShardPeers) {
        replicas.put(peerId, ReplicaRole.INITIALIZING);
        transfers.add(new ShardTransferInfo(shard.collection, newShardId, primary, peerId, shardId));
      }
      shards.put(shardId, shard.withRange(shard.range.lowerHalf()));
      shards.put(newShardId, new ShardInfo(newShardId, shard.collection, shard.range.upperHalf(), replicas));
      CollectionInfo collection = collections.get(shard.collection);
      collections.put(collection.name, collection.withShardCount(collection.shardCount + 1));
    }

    public void startTransfer(long shardId, long fromPeer, long toPeer) throws TopologyRejectedException {
      ShardInfo shard = requireShard(shardId);
      requirePeer(toPeer);
      if (shard.roleOf(fromPeer) != ReplicaRole.ACTIVE) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT,
            "peer " + fromPeer + " has no active replica of shard " + shardId);
      }
      if (shard.hasReplicaOn(toPeer) || transfer(shardId, toPeer) != null) {
        throw new TopologyRejectedException(Reason.TRANSFER_EXISTS,
            "peer " + toPeer + " already has a replica of shard " + shardId);
      }
      shards.put(shardId, shard.withReplica(toPeer, ReplicaRole.INITIALIZING));
      transfers.add(new ShardTransferInfo(shard.collection, shardId, fromPeer, toPeer, shardId));
    }

    public void finishTransfer(long shardId, long toPeer) throws TopologyRejectedException {
      ShardTransferInfo transfer = requireTransfer(shardId, toPeer);
      transfers.remove(transfer);
      ShardInfo shard = shards.get(shardId);
      shards.put(shardId, shard.withReplica(toPeer, ReplicaRole.ACTIVE));
    }

    public void abortTransfer(long shardId, long toPeer) throws TopologyRejectedException {
      ShardTransferInfo transfer = requireTransfer(shardId, toPeer);
      transfers.remove(transfer);
      ShardInfo shard = shards.get(shardId);
      shards.put(shardId, shard.withoutReplica(toPeer));
    }

    public void setReplicaState(long shardId, long peerId, ReplicaRole role) throws TopologyRejectedException {
      ShardInfo shard = requireShard(shardId);
      if (!shard.hasReplicaOn(peerId)) {
        throw new TopologyRejectedException(Reason.UNKNOWN_PEER,
            "peer " + peerId + " has no replica of shard " + shardId);
      }
      if (shard.roleOf(peerId) == ReplicaRole.INITIALIZING || role == ReplicaRole.INITIALIZING) {
        throw new TopologyRejectedException(Reason.INVALID_ARGUMENT,
            "initializing replicas change state only through their transfer");
      }
      if (role == ReplicaRole.DEAD && shard.peersWithRole(ReplicaRole.ACTIVE).equals(ImmutableList.of(peerId))) {
        throw new TopologyRejectedException(Reason.LAST_ACTIVE_REPLICA,
            "peer " + peerId + " holds the only active replica of shard " + shardId);
      }
      shards.put(shardId, shard.withReplica(peerId, role));
    }

    private boolean lastCopyIsOn(ShardInfo shard, long peerId) {
      for (Map.Entry<Long, ReplicaRole> replica : shard.replicas.entrySet()) {
        if (replica.getKey() != peerId && replica.getValue() != ReplicaRole.INITIALIZING) {
          return false;
        }
      }
      return true;
    }

    private boolean hasTransferFor(long shardId) {
      for (ShardTransferInfo transfer : transfers) {
        if (transfer.shardId == shardId || transfer.sourceShardId == shardId) {
          return true;
        }
      }
      return false;
    }

    @Nullable
    private ShardTransferInfo transfer(long shardId, long toPeer) {
      for (ShardTransferInfo transfer : transfers) {
        if (transfer.shardId == shardId && transfer.toPeer == toPeer) {
          return transfer;
        }
      }
      return null;
    }

    private void requirePeer(long peerId) throws TopologyRejectedException {
      if (!peers.containsKey(peerId)) {
        throw new TopologyRejectedException(Reason.UNKNOWN_PEER, "no peer " + peerId);
      }
    }

    private CollectionInfo requireCollection(String name) throws TopologyRejectedException {
      CollectionInfo collection = collections.get(name);
      if (collection == null) {
        throw new TopologyRejectedException(Reason.UNKNOWN_COLLECTION, "no collection " + name);
      }
      return collection;
    }

    private String requireAlias(String alias) throws TopologyRejectedException {
      String collection = aliases.get(alias);
      if (collection == null) {
        throw new TopologyRejectedException(Reason.UNKNOWN_ALIAS, "no alias " + alias);
      }
      return collection;
    }

    private ShardInfo requireShard(long shardId) throws TopologyRejectedException {
      ShardInfo shard = shards.get(shardId);
      if (shard == null) {
        throw new TopologyRejectedException(Reason.UNKNOWN_SHARD, "no shard " + shardId);
      }
      return shard;
    }

    private ShardTransferInfo requireTransfer(long shardId, long toPeer) throws TopologyRejectedException {
      ShardTransferInfo transfer = transfer(shardId, toPeer);
      if (transfer == null) {
        throw new TopologyRejectedException(Reason.UNKNOWN_TRANSFER,
            "no transfer of shard " + shardId + " to peer " + toPeer);
      }
      return transfer;
    }
  }
}
