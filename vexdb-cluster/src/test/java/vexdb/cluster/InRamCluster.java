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

import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import org.jetlang.channels.AsyncRequest;
import org.jetlang.channels.MemoryRequestChannel;
import org.jetlang.channels.Request;
import org.jetlang.fibers.Fiber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vexdb.cluster.rpc.PeerReply;
import vexdb.cluster.rpc.PeerRequest;
import vexdb.cluster.topology.Topology;
import vexdb.interfaces.ClusterException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.ReplicatorInstanceEvent;
import vexdb.interfaces.replication.ReplicatorLog;
import vexdb.interfaces.shard.UpdateStatus;
import vexdb.log.InRamLog;
import vexdb.replication.DefaultSystemTimeReplicatorClock;
import vexdb.replication.rpc.RpcRequest;
import vexdb.replication.rpc.RpcWireReply;
import vexdb.replication.rpc.RpcWireRequest;
import vexdb.shard.InRamShardStorage;
import vexdb.util.PoolFiberSupplier;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Several cluster nodes in one JVM, connected by in-memory channels. Links between nodes can be
 * cut to partition the cluster, and nodes can be stopped and started again on the same storage.
 */
public class InRamCluster {
  private static final Logger LOG = LoggerFactory.getLogger(InRamCluster.class);
  private static final long WAIT_MILLIS = 20000;

  private final List<Long> peerIds;
  private final Consumer<Throwable> fiberExceptionHandler;
  private final PoolFiberSupplier fiberSupplier = new PoolFiberSupplier(Executors.newCachedThreadPool());
  private final Fiber rpcFiber;

  private final Map<Long, ClusterNode> nodes = new ConcurrentHashMap<>();
  private final Map<Long, ReadFailingNodeStorage> storages = new ConcurrentHashMap<>();
  private final Set<String> cutLinks = ConcurrentHashMap.newKeySet();
  private final Map<Long, Set<Long>> leadersByTerm = new ConcurrentHashMap<>();

  public InRamCluster(Collection<Long> peerIds, Consumer<Throwable> fiberExceptionHandler) {
    this.peerIds = new ArrayList<>(peerIds);
    this.fiberExceptionHandler = fiberExceptionHandler;
    this.rpcFiber = fiberSupplier.getNewFiber(fiberExceptionHandler);
  }

  public void start() {
    rpcFiber.start();
    for (long peerId : peerIds) {
      storages.put(peerId, new ReadFailingNodeStorage());
      startNode(peerId);
    }
  }

  public void dispose() {
    for (long peerId : new ArrayList<>(nodes.keySet())) {
      stopNode(peerId);
    }
    rpcFiber.dispose();
    fiberSupplier.close();
  }

  /**
   * Start a node on whatever its storage holds, a fresh node the first time.
   */
  public ClusterNode startNode(long peerId) {
    NodeConfiguration configuration = NodeConfiguration.builder(peerId)
        .setBootstrapPeers(peerIds)
        .setElectionTimeoutMillis(300)
        .setProposalTimeoutMillis(5000)
        .setForwardTimeoutMillis(300)
        .setHealthProbeIntervalMillis(200)
        .setTransferRetryDelayMillis(200)
        .setRetainedOperations(1000)
        .build();

    MemoryRequestChannel<RpcRequest, RpcWireReply> consensusRequests = new MemoryRequestChannel<>();
    MemoryRequestChannel<PeerRequest, PeerReply> peerRequests = new MemoryRequestChannel<>();
    consensusRequests.subscribe(rpcFiber, this::forwardConsensusRequest);
    peerRequests.subscribe(rpcFiber, this::forwardPeerRequest);

    ClusterNode node = new ClusterNode(configuration, storages.get(peerId),
        (handler) -> fiberSupplier.getNewFiber(handler.andThen(fiberExceptionHandler)),
        new DefaultSystemTimeReplicatorClock(configuration.electionTimeoutMillis),
        consensusRequests, peerRequests);
    node.getConsensus().getEventChannel().subscribe(rpcFiber, this::recordLeader);

    node.startAsync().awaitRunning();
    nodes.put(peerId, node);
    return node;
  }

  public void stopNode(long peerId) {
    ClusterNode node = nodes.remove(peerId);
    if (node != null) {
      try {
        node.stopAsync().awaitTerminated(WAIT_MILLIS, TimeUnit.MILLISECONDS);
      } catch (java.util.concurrent.TimeoutException e) {
        throw new AssertionError("node " + peerId + " did not stop", e);
      }
    }
  }

  public ClusterNode node(long peerId) {
    return nodes.get(peerId);
  }

  public InRamShardStorage shardStorage(long peerId) {
    return storages.get(peerId).getShardStorage();
  }

  /**
   * Fail the next reads of a node's consensus log, as a disk that errors for a while would.
   */
  public void failConsensusLogReads(long peerId, int reads) {
    storages.get(peerId).consensusLog.failNextReads(reads);
  }

  /**
   * Cut every link between the given nodes and the rest, in both directions.
   */
  public void partition(Collection<Long> side) {
    for (long inside : side) {
      for (long outside : peerIds) {
        if (!side.contains(outside)) {
          cutLinks.add(inside + ">" + outside);
          cutLinks.add(outside + ">" + inside);
        }
      }
    }
    LOG.info("partitioned {} from the rest", side);
  }

  public void heal() {
    cutLinks.clear();
    LOG.info("healed all partitions");
  }

  /**
   * Terms in which some node saw a leader elected, with every leader seen in each.
   */
  public Map<Long, Set<Long>> leadersByTerm() {
    return leadersByTerm;
  }

  public ClusterNode awaitLeader() throws Exception {
    return awaitLeaderAmong(peerIds);
  }

  public ClusterNode awaitLeaderAmong(Collection<Long> candidates) throws Exception {
    final ClusterNode[] leader = new ClusterNode[1];
    waitUntil("a leader among " + candidates, () -> {
      for (long peerId : candidates) {
        ClusterNode node = nodes.get(peerId);
        if (node != null && node.getConsensus().isLeader()) {
          leader[0] = node;
          return true;
        }
      }
      return false;
    });
    return leader[0];
  }

  /**
   * Wait until every running node has applied a topology that satisfies the condition.
   */
  public void awaitTopology(String description, Predicate<Topology> condition) throws Exception {
    waitUntil(description, () -> {
      for (ClusterNode node : nodes.values()) {
        if (!condition.test(node.getTopology())) {
          return false;
        }
      }
      return true;
    });
  }

  /**
   * Wait until every running node holds the same topology, and return it.
   */
  public Topology awaitIdenticalTopologies() throws Exception {
    final Topology[] agreed = new Topology[1];
    waitUntil("identical topologies", () -> {
      Set<Topology> topologies = ConcurrentHashMap.newKeySet();
      for (ClusterNode node : nodes.values()) {
        topologies.add(node.getTopology());
      }
      if (topologies.size() != 1) {
        return false;
      }
      agreed[0] = topologies.iterator().next();
      return true;
    });
    return agreed[0];
  }

  /**
   * Write through a node, retrying for as long as the failure says a retry may succeed.
   */
  public UpdateStatus submit(long throughPeer, String collection, String key, byte[] payload, boolean waitForAll)
      throws Exception {
    long deadline = System.currentTimeMillis() + WAIT_MILLIS;
    while (true) {
      try {
        return nodes.get(throughPeer).submitOperation(collection, key, payload, waitForAll)
            .get(WAIT_MILLIS, TimeUnit.MILLISECONDS);
      } catch (ExecutionException e) {
        boolean retryable = e.getCause() instanceof ClusterException && ((ClusterException) e.getCause()).isRetryable();
        if (!retryable || System.currentTimeMillis() > deadline) {
          throw e;
        }
        LOG.debug("retrying write of {}: {}", key, e.getCause().toString());
        Thread.sleep(50);
      }
    }
  }

  public static void waitUntil(String description, Callable<Boolean> condition) throws Exception {
    long deadline = System.currentTimeMillis() + WAIT_MILLIS;
    while (!condition.call()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("timed out waiting for " + description);
      }
      Thread.sleep(25);
    }
  }

  private boolean isCut(long from, long to) {
    return cutLinks.contains(from + ">" + to);
  }

  private void forwardConsensusRequest(Request<RpcRequest, RpcWireReply> origMsg) {
    final RpcRequest request = origMsg.getRequest();
    final ClusterNode destination = nodes.get(request.to);
    if (destination == null || isCut(request.from, request.to)) {
      // Let the request time out.
      return;
    }

    final RpcWireRequest wireRequest = new RpcWireRequest(request.from, request.quorumId, request.message);
    AsyncRequest.withOneReply(rpcFiber, destination.getIncomingConsensusChannel(), wireRequest, reply -> {
      if (!isCut(request.to, request.from)) {
        origMsg.reply(new RpcWireReply(request.from, request.to, request.quorumId, reply.message));
      }
    });
  }

  private void forwardPeerRequest(Request<PeerRequest, PeerReply> origMsg) {
    final PeerRequest request = origMsg.getRequest();
    final ClusterNode destination = nodes.get(request.to);
    if (destination == null || isCut(request.from, request.to)) {
      return;
    }

    AsyncRequest.withOneReply(rpcFiber, destination.getIncomingPeerChannel(), request, reply -> {
      if (!isCut(request.to, request.from)) {
        origMsg.reply(reply);
      }
    });
  }

  private static class ReadFailingNodeStorage extends InRamNodeStorage {
    private final ReadFailingLog consensusLog = new ReadFailingLog();

    @Override
    public ReplicatorLog consensusLog() {
      return consensusLog;
    }
  }

  private static class ReadFailingLog extends InRamLog {
    private int failingReads;

    synchronized void failNextReads(int reads) {
      failingReads = reads;
    }

    @Override
    public synchronized ListenableFuture<List<LogEntry>> getLogEntries(long start, long end) {
      if (failingReads > 0) {
        failingReads--;
        return Futures.immediateFailedFuture(new IOException("unable to read entries from " + start));
      }
      return super.getLogEntries(start, end);
    }
  }

  private void recordLeader(ReplicatorInstanceEvent event) {
    if (event.eventType == ReplicatorInstanceEvent.EventType.LEADER_ELECTED) {
      leadersByTerm.computeIfAbsent(event.leaderElectedTerm, (term) -> new TreeSet<>()).add(event.newLeader);
    }
  }
}
