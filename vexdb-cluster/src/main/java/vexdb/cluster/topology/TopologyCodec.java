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

import vexdb.codec.ProtostuffCodec;
import vexdb.interfaces.shard.HashRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Serializes a topology for cluster consensus snapshots. The topology is copied into plain
 * records first; the runtime schema writes an empty list as nothing, so lists are normalized on
 * the way back.
 */
public final class TopologyCodec {
  private static final ProtostuffCodec<TopologyRecord> CODEC = new ProtostuffCodec<>(TopologyRecord.class);

  private TopologyCodec() {
  }

  public static byte[] encode(Topology topology) {
    TopologyRecord record = new TopologyRecord();
    record.index = topology.index;
    record.nextShardId = topology.nextShardId;
    record.peers = new ArrayList<>();
    for (PeerInfo peer : topology.peers.values()) {
      PeerRecord peerRecord = new PeerRecord();
      peerRecord.peerId = peer.peerId;
      peerRecord.address = peer.address;
      peerRecord.role = peer.role;
      record.peers.add(peerRecord);
    }
    record.collections = new ArrayList<>();
    for (CollectionInfo collection : topology.collections.values()) {
      CollectionRecord collectionRecord = new CollectionRecord();
      collectionRecord.name = collection.name;
      collectionRecord.shardCount = collection.shardCount;
      collectionRecord.replicationFactor = collection.replicationFactor;
      collectionRecord.writeConsistencyFactor = collection.writeConsistencyFactor;
      record.collections.add(collectionRecord);
    }
    record.aliases = new ArrayList<>();
    for (Map.Entry<String, String> alias : topology.aliases.entrySet()) {
      AliasRecord aliasRecord = new AliasRecord();
      aliasRecord.alias = alias.getKey();
      aliasRecord.collection = alias.getValue();
      record.aliases.add(aliasRecord);
    }
    record.shards = new ArrayList<>();
    for (ShardInfo shard : topology.shards.values()) {
      ShardRecord shardRecord = new ShardRecord();
      shardRecord.shardId = shard.shardId;
      shardRecord.collection = shard.collection;
      shardRecord.rangeStart = shard.range.start;
      shardRecord.rangeEnd = shard.range.end;
      shardRecord.replicas = new ArrayList<>();
      for (Map.Entry<Long, ReplicaRole> replica : shard.replicas.entrySet()) {
        ReplicaRecord replicaRecord = new ReplicaRecord();
        replicaRecord.peerId = replica.getKey();
        replicaRecord.role = replica.getValue();
        shardRecord.replicas.add(replicaRecord);
      }
      record.shards.add(shardRecord);
    }
    record.transfers = new ArrayList<>();
    for (ShardTransferInfo transfer : topology.transfers) {
      TransferRecord transferRecord = new TransferRecord();
      transferRecord.collection = transfer.collection;
      transferRecord.shardId = transfer.shardId;
      transferRecord.fromPeer = transfer.fromPeer;
      transferRecord.toPeer = transfer.toPeer;
      transferRecord.sourceShardId = transfer.sourceShardId;
      record.transfers.add(transferRecord);
    }
    return CODEC.encode(record);
  }

  public static Topology decode(byte[] bytes) {
    TopologyRecord record = CODEC.decode(bytes);

    Map<Long, PeerInfo> peers = new TreeMap<>();
    for (PeerRecord peer : orEmpty(record.peers)) {
      peers.put(peer.peerId, new PeerInfo(peer.peerId, orEmpty(peer.address), peer.role));
    }
    Map<String, CollectionInfo> collections = new TreeMap<>();
    for (CollectionRecord collection : orEmpty(record.collections)) {
      collections.put(collection.name, new CollectionInfo(collection.name, collection.shardCount,
          collection.replicationFactor, collection.writeConsistencyFactor));
    }
    Map<String, String> aliases = new TreeMap<>();
    for (AliasRecord alias : orEmpty(record.aliases)) {
      aliases.put(alias.alias, alias.collection);
    }
    Map<Long, ShardInfo> shards = new TreeMap<>();
    for (ShardRecord shard : orEmpty(record.shards)) {
      Map<Long, ReplicaRole> replicas = new TreeMap<>();
      for (ReplicaRecord replica : orEmpty(shard.replicas)) {
        replicas.put(replica.peerId, replica.role);
      }
      shards.put(shard.shardId, new ShardInfo(shard.shardId, shard.collection,
          new HashRange(shard.rangeStart, shard.rangeEnd), replicas));
    }
    List<ShardTransferInfo> transfers = new ArrayList<>();
    for (TransferRecord transfer : orEmpty(record.transfers)) {
      transfers.add(new ShardTransferInfo(transfer.collection, transfer.shardId, transfer.fromPeer,
          transfer.toPeer, transfer.sourceShardId));
    }

    return new Topology(record.index, record.nextShardId, peers, collections, aliases, shards, transfers);
  }

  private static <T> List<T> orEmpty(List<T> list) {
    return list == null ? Collections.emptyList() : list;
  }

  private static String orEmpty(String string) {
    return string == null ? "" : string;
  }

  static final class TopologyRecord {
    long index;
    long nextShardId;
    List<PeerRecord> peers;
    List<CollectionRecord> collections;
    List<AliasRecord> aliases;
    List<ShardRecord> shards;
    List<TransferRecord> transfers;
  }

  static final class PeerRecord {
    long peerId;
    String address;
    PeerRole role;
  }

  static final class CollectionRecord {
    String name;
    int shardCount;
    int replicationFactor;
    int writeConsistencyFactor;
  }

  static final class AliasRecord {
    String alias;
    String collection;
  }

  static final class ShardRecord {
    long shardId;
    String collection;
    long rangeStart;
    long rangeEnd;
    List<ReplicaRecord> replicas;
  }

  static final class ReplicaRecord {
    long peerId;
    ReplicaRole role;
  }

  static final class TransferRecord {
    String collection;
    long shardId;
    long fromPeer;
    long toPeer;
    long sourceShardId;
  }
}
