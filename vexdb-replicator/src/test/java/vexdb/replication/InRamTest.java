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

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.google.common.util.concurrent.ListenableFuture;
import org.hamcrest.Matcher;
import org.jetlang.channels.MemoryChannel;
import org.jetlang.channels.Request;
import org.jetlang.core.BatchExecutor;
import org.jetlang.core.RunnableExecutor;
import org.jetlang.core.RunnableExecutorImpl;
import org.jetlang.fibers.Fiber;
import org.jetlang.fibers.ThreadFiber;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import vexdb.ChannelHistoryMonitor;
import vexdb.interfaces.MembershipChangeInProgressException;
import vexdb.interfaces.replication.IndexCommitNotice;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorInstanceEvent;
import vexdb.interfaces.replication.ReplicatorLog;
import vexdb.interfaces.replication.ReplicatorReceipt;
import vexdb.interfaces.replication.ReplicatorSnapshot;
import vexdb.interfaces.replication.ReplicatorStatus;
import vexdb.replication.rpc.RpcMessage;
import vexdb.replication.rpc.RpcRequest;
import vexdb.replication.rpc.RpcWireReply;
import vexdb.util.CheckedConsumer;
import vexdb.util.ExceptionHandlingBatchExecutor;
import vexdb.util.JUnitRuleFiberExceptions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.anyOf;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.any;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.core.IsNot.not;
import static vexdb.CollectionMatchers.isIn;
import static vexdb.FutureMatchers.resultsIn;
import static vexdb.FutureMatchers.resultsInException;
import static vexdb.IndexCommitMatcher.aCommitNotice;
import static vexdb.RpcMatchers.ReplyMatcher.aPreElectionReply;
import static vexdb.RpcMatchers.ReplyMatcher.anAppendReply;
import static vexdb.RpcMatchers.RequestMatcher;
import static vexdb.RpcMatchers.RequestMatcher.aPreElectionPoll;
import static vexdb.RpcMatchers.RequestMatcher.anAppendRequest;
import static vexdb.RpcMatchers.RequestMatcher.anInstallSnapshotRequest;
import static vexdb.RpcMatchers.containsQuorumConfiguration;
import static vexdb.interfaces.replication.Replicator.State.FOLLOWER;
import static vexdb.interfaces.replication.Replicator.State.LEADER;
import static vexdb.interfaces.replication.ReplicatorInstanceEvent.EventType.ELECTION_TIMEOUT;
import static vexdb.interfaces.replication.ReplicatorInstanceEvent.EventType.LEADER_DEPOSED;
import static vexdb.interfaces.replication.ReplicatorInstanceEvent.EventType.SNAPSHOT_INSTALLED;
import static vexdb.replication.ReplicationMatchers.aQuorumChangeCommittedEvent;
import static vexdb.replication.ReplicationMatchers.aReplicatorEvent;
import static vexdb.replication.ReplicationMatchers.hasCommittedEntriesUpTo;
import static vexdb.replication.ReplicationMatchers.leaderElectedEvent;
import static vexdb.replication.ReplicationMatchers.theLeader;
import static vexdb.replication.ReplicationMatchers.willCommitConfiguration;
import static vexdb.replication.ReplicationMatchers.willCommitEntriesUpTo;
import static vexdb.replication.ReplicationMatchers.willRespondToAnAppendRequest;
import static vexdb.replication.ReplicationMatchers.willSend;
import static vexdb.replication.ReplicationMatchers.wonAnElectionWithTerm;

/**
 * Tests of the behavior of multiple interacting ReplicatorInstance nodes.
 */
public class InRamTest {
  private static final int ELECTION_TIMEOUT_MILLIS = 50; // election timeout (milliseconds)
  private static final long OFFSET_STAGGERING_MILLIS = 50; // offset between different peers' clocks

  // The bootstrap configuration entry is index 1; the first leader's no-op follows it.
  private static final long FIRST_NO_OP_INDEX = 2;

  @Rule
  public JUnitRuleFiberExceptions fiberExceptionHandler = new JUnitRuleFiberExceptions();

  private final BatchExecutor batchExecutor = new ExceptionHandlingBatchExecutor(fiberExceptionHandler);
  private final RunnableExecutor runnableExecutor = new RunnableExecutorImpl(batchExecutor);
  private final Fiber fiber = new ThreadFiber(runnableExecutor, "InRamTest-ThreadFiber", true);
  private InRamSim sim;

  private ChannelHistoryMonitor<IndexCommitNotice> commitMonitor;
  private ChannelHistoryMonitor<ReplicatorInstanceEvent> eventMonitor;
  private ChannelHistoryMonitor<RpcMessage> replyMonitor;
  private ChannelHistoryMonitor<ReplicatorSnapshot> snapshotMonitor;
  private long lastIndexLogged;

  private final MemoryChannel<Request<RpcRequest, RpcWireReply>> requestLog = new MemoryChannel<>();
  private final ChannelHistoryMonitor<Request<RpcRequest, RpcWireReply>> requestMonitor =
      new ChannelHistoryMonitor<>(requestLog, fiber);

  @Before
  public final void setUpSimulationAndFibers() throws Exception {
    sim = new InRamSim(ELECTION_TIMEOUT_MILLIS, OFFSET_STAGGERING_MILLIS, batchExecutor);

    sim.getRpcChannel().subscribe(fiber, requestLog::publish);
    commitMonitor = new ChannelHistoryMonitor<>(sim.getCommitNotices(), fiber);
    eventMonitor = new ChannelHistoryMonitor<>(sim.getEventChannel(), fiber);
    replyMonitor = new ChannelHistoryMonitor<>(sim.getReplyChannel(), fiber);
    snapshotMonitor = new ChannelHistoryMonitor<>(sim.getSnapshotChannel(), fiber);

    fiber.start();
    sim.start(initialPeerSet());
  }

  @After
  public final void disposeResources() {
    sim.dispose();
    fiber.dispose();
  }

  @Test
  public void aLeaderWillBeElectedInATimelyMannerInANewQuorum() throws Exception {
    waitForALeader(term(1));
  }

  @Test
  public void aNewLeaderWillBeElectedIfAnExistingLeaderDies() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    leader().die();
    waitForANewLeader();
  }

  @Test
  public void ifAKilledLeaderIsRestartedItWillBecomeAFollower() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    LeaderController firstLeader = leader();
    firstLeader.die();

    waitForANewLeader();
    assertThat(leader(), is(not(equalTo(firstLeader))));

    firstLeader.restart();
    assertThat(firstLeader, willRespondToAnAppendRequest(currentTerm()));
  }

  @Test
  public void aNewLeaderCommitsANoOpEntryFromItsOwnTermWithoutWaitingForAClient() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    allPeers((peer) -> assertThat(peer, willCommitEntriesUpTo(index(FIRST_NO_OP_INDEX))));

    List<LogEntry> entries = leader().log.getLogEntries(FIRST_NO_OP_INDEX, FIRST_NO_OP_INDEX + 1).get();
    assertThat(entries.get(0).isNoOp(), is(true));
    assertThat(entries.get(0).getTerm(), is(equalTo(currentTerm())));
  }

  @Test
  public void ifAnElectionOccursWhileAPeerIsOfflineThenThePeerWillRecognizeTheNewLeaderWhenThePeerRestarts()
      throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    LeaderController firstLeader = leader();
    PeerController follower = pickFollower().die();

    leader().log(someData())
        .waitForCommit(lastIndexLogged())
        .die();

    waitForANewLeader();
    assertThat(leader(), not(equalTo(firstLeader)));

    // The second leader logs some entry, then the first node to go offline comes back
    leader().log(someData());
    follower.restart()
        .waitForCommit(lastIndexLogged());

    leader().log(someData());
    firstLeader.restart();

    allPeers((peer) -> assertThat(peer, willCommitEntriesUpTo(lastIndexLogged())));
  }

  @Test
  public void aFollowerMaintainsItsCommitIndexWhenItBecomesLeader() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    leader().log(someData());
    allPeers((peer) -> peer.waitForCommit(lastIndexLogged()));

    // Kill the first leader; wait for a second leader to come to power
    leader().die();
    waitForANewLeader();
    leader().log(someData());

    assertThat(leader(), willSend(anAppendRequest().withCommitIndex(equalTo(lastIndexLogged()))));
  }

  @Test
  public void aLeaderSendsDataToAllOtherPeersResultingInAllPeersCommitting() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    leader().log(someData());

    allPeers((peer) -> assertThat(peer, willCommitEntriesUpTo(lastIndexLogged())));
  }

  @Test
  public void theLeaderReportsItsRoleTermAndCommitIndexInItsStatus() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    leader().log(someData()).waitForCommit(lastIndexLogged());

    ReplicatorStatus status = leader().instance.getStatus();
    assertThat(status.state, is(LEADER));
    assertThat(status.leaderId, is(equalTo(leader().id)));
    assertThat(status.currentTerm, is(equalTo(currentTerm())));
    assertThat(status.lastCommittedIndex, is(greaterThanOrEqualTo(lastIndexLogged())));
    assertThat(status.configuration, is(equalTo(QuorumConfiguration.of(initialPeerSet()))));
  }

  @Test
  public void aFollowerWillStageANewElectionIfItTimesOutWaitingToHearFromTheLeader() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    final long firstLeaderTerm = currentTerm();

    PeerController follower = pickFollower();

    follower.willDropIncomingAppendsUntil(leader(), is(not(theLeader())));
    follower.allowToTimeout();

    waitForALeader(firstLeaderTerm + 1);
    assertThat(follower, anyOf(is(theLeader()), willRespondToAnAppendRequest(currentTerm())));
  }

  @Test
  public void ifAFollowerFallsBehindInReceivingAndLoggingEntriesItIsAbleToCatchUp() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    final long secondEntryIndex = FIRST_NO_OP_INDEX + 2;

    PeerController follower = pickFollower();
    follower.willDropIncomingAppendsUntil(leader(), hasCommittedEntriesUpTo(secondEntryIndex));

    leader()
        .log(someData())
        .log(someData());
    assertThat(follower, willCommitEntriesUpTo(secondEntryIndex));
  }

  @Test
  public void aLeaderThatCannotReachAMajorityOfItsPeersStepsDown() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    final long isolatedLeaderId = currentLeader();

    sim.dropMessages(
        (message) -> message.from == isolatedLeaderId && message.to != isolatedLeaderId,
        (message) -> false);

    eventMonitor.waitFor(aReplicatorEvent(LEADER_DEPOSED, equalTo(isolatedLeaderId)));
    assertThat(sim.getReplicators().get(isolatedLeaderId).isLeader(), is(false));
  }

  @Test
  public void aReplicatorReturnsNullIfAskedToChangeQuorumsWhenItIsNotInTheLeaderState() throws Exception {
    final Set<Long> newPeerIds = smallerPeerSetWithOneInCommonWithInitialSet();
    havingElectedALeaderAtOrAfter(term(1));

    assertThat(pickFollower().changeQuorum(newPeerIds), nullValue());
  }

  @Test
  public void aLeaderCanCoordinateAQuorumMembershipChange() throws Exception {
    final Set<Long> newPeerIds = smallerPeerSetWithNoneInCommonWithInitialSet();
    final QuorumConfiguration finalConfig = QuorumConfiguration.of(newPeerIds);

    havingElectedALeaderAtOrAfter(term(1));

    leader().changeQuorum(newPeerIds);
    sim.createAndStartReplicators(newPeerIds);

    waitForANewLeader();
    leader().log(someData());

    peers(newPeerIds).forEach((peer) ->
        assertThat(peer, willCommitConfiguration(finalConfig)));
    assertThat(newPeerIds, hasItem(equalTo(leader().id)));
  }

  @Test
  public void aSecondQuorumChangeIsRefusedWhileTheFirstIsStillInProgress() throws Exception {
    final Set<Long> firstPeerSet = smallerPeerSetWithOneInCommonWithInitialSet();
    final Set<Long> secondPeerSet = largerPeerSetWithSomeInCommonWithInitialSet();

    havingElectedALeaderAtOrAfter(term(1));

    ListenableFuture<ReplicatorReceipt> firstChange = leader().changeQuorum(firstPeerSet);
    ListenableFuture<ReplicatorReceipt> secondChange = leader().changeQuorum(secondPeerSet);
    sim.createAndStartReplicators(firstPeerSet);

    assertThat(secondChange, resultsInException(MembershipChangeInProgressException.class));
    assertThat(firstChange, resultsIn(any(ReplicatorReceipt.class)));

    waitForALeaderWithId(isIn(firstPeerSet));
    leader().log(someData());

    peers(firstPeerSet).forEach((peer) ->
        assertThat(peer, willCommitConfiguration(QuorumConfiguration.of(firstPeerSet))));
  }

  @Test
  public void theFutureReturnedByAQuorumChangeRequestWillReturnTheReceiptOfTheTransitionalConfigurationEntry()
      throws Exception {
    final Set<Long> newPeerIds = smallerPeerSetWithOneInCommonWithInitialSet();
    final long lastIndexBeforeQuorumChange = 4;

    havingElectedALeaderAtOrAfter(term(1));
    final long electionTerm = currentTerm();

    sim.createAndStartReplicators(newPeerIds);
    leader().logDataUpToIndex(lastIndexBeforeQuorumChange)
        .waitForCommit(lastIndexBeforeQuorumChange);

    assertThat(leader().changeQuorum(newPeerIds),
        resultsIn(equalTo(
            new ReplicatorReceipt(electionTerm, lastIndexBeforeQuorumChange + 1))));
  }

  @Test
  public void aQuorumChangeWillGoThroughEvenIfTheLeaderDiesBeforeItCommitsTheTransitionalConfiguration()
      throws Exception {
    // Leader dies before it can commit the transitional configuration, but as long as the next leader
    // has already received the transitional configuration entry, it can complete the view change.

    final Set<Long> newPeerIds = smallerPeerSetWithNoneInCommonWithInitialSet();
    final QuorumConfiguration transitionalConfig =
        QuorumConfiguration.of(initialPeerSet()).getTransitionalConfiguration(newPeerIds);

    havingElectedALeaderAtOrAfter(term(1));
    final long nextLogIndex = leader().log.getLastIndex() + 1;
    leader().changeQuorum(newPeerIds);

    allPeersExceptLeader((peer) ->
        assertThat(leader(), willSend(
            anAppendRequest()
                .containingQuorumConfig(transitionalConfig)
                .to(peer.id))));

    ignoringPreviousReplies();
    allPeers((peer) -> peer.waitForAppendReply(greaterThanOrEqualTo(currentTerm())));
    assertThat(leader().hasCommittedEntriesUpTo(nextLogIndex), is(false));

    // As of this point, all peers have replicated the transitional config, but the leader has not committed.
    // It would be impossible to commit because the new peers have not come online, and their votes are
    // necessary to commit the transitional configuration.

    leader().die();
    sim.createAndStartReplicators(newPeerIds);
    waitForANewLeader();
    assertThat(leader().currentConfiguration(), equalTo(transitionalConfig));

    peers(newPeerIds).forEach((peer) ->
        assertThat(peer, willCommitConfiguration(QuorumConfiguration.of(newPeerIds))));
  }

  @Test
  public void afterAQuorumChangeTheNewNodesWillCatchUpToThePreexistingOnes() throws Exception {
    final Set<Long> newPeerIds = largerPeerSetWithSomeInCommonWithInitialSet();
    final long maximumIndex = 5;

    havingElectedALeaderAtOrAfter(term(1));

    leader()
        .logDataUpToIndex(maximumIndex)
        .waitForCommit(maximumIndex);

    sim.createAndStartReplicators(newPeerIds);
    leader().changeQuorum(newPeerIds);

    peers(newPeerIds).forEach((peer) -> {
      assertThat(peer, willCommitEntriesUpTo(maximumIndex));
      assertThat(peer, willCommitConfiguration(QuorumConfiguration.of(newPeerIds)));
    });
  }

  @Test
  public void aLearnerReceivesEntriesAndIsPromotedToVoterOnceCaughtUp() throws Exception {
    final long learnerId = 8;
    final long maximumIndex = 5;
    final Set<Long> votersAfterPromotion = Sets.union(initialPeerSet(), Sets.newHashSet(learnerId));

    havingElectedALeaderAtOrAfter(term(1));
    leader()
        .logDataUpToIndex(maximumIndex)
        .waitForCommit(maximumIndex);

    sim.createAndStartReplicators(Sets.newHashSet(learnerId));
    assertThat(leader().changeLearners(Sets.newHashSet(learnerId)),
        resultsIn(equalTo(new ReplicatorReceipt(currentTerm(), maximumIndex + 1))));

    assertThat(peer(learnerId), willCommitEntriesUpTo(maximumIndex));
    assertThat(leader(), willCommitConfiguration(QuorumConfiguration.of(votersAfterPromotion)));
    assertThat(peer(learnerId), willCommitConfiguration(QuorumConfiguration.of(votersAfterPromotion)));
  }

  @Test
  public void aQuorumCanMakeProgressEvenIfAFollowerCanSendRequestsButNotReceiveReplies() throws Exception {
    final long maximumIndex = 5;
    havingElectedALeaderAtOrAfter(term(1));

    pickFollower()
        .willDropAllIncomingTraffic()
        .allowToTimeout();

    waitForAnElectionTimeout();

    leader().logDataUpToIndex(maximumIndex);
    assertThat(leader(), willCommitEntriesUpTo(maximumIndex));
  }

  @Test
  public void aQuorumChangeCanCompleteEvenIfARemovedPeerTimesOutDuringIt() throws Exception {
    final Set<Long> newPeerIds = smallerPeerSetWithNoneInCommonWithInitialSet();
    final QuorumConfiguration transitionalConfig =
        QuorumConfiguration.of(initialPeerSet()).getTransitionalConfiguration(newPeerIds);
    final QuorumConfiguration finalConfig = transitionalConfig.getCompletedConfiguration();

    havingElectedALeaderAtOrAfter(term(1));
    final long firstLeaderTerm = currentTerm();
    final long leaderId = currentLeader();

    dropAllAppendsWithThisConfigurationUntilAPreElectionPollTakesPlace(finalConfig);

    leader().changeQuorum(newPeerIds);
    sim.createAndStartReplicators(newPeerIds);

    allPeersExceptLeader((peer) ->
        assertThat(leader(), willSend(
            anAppendRequest()
                .containingQuorumConfig(transitionalConfig)
                .to(peer.id))));

    peers(newPeerIds).forEach((peer) ->
        assertThat(peer, willCommitConfiguration(transitionalConfig)));

    peersBeingRemoved(transitionalConfig).forEach(PeerController::allowToTimeout);
    waitForAnElectionTimeout();

    peersBeingRemoved(transitionalConfig).forEach((peer) -> {
      if (peer.id != leaderId) {
        assertThat(peer, willSend(aPreElectionPoll()));
      }
    });

    waitForALeaderWithId(isIn(newPeerIds));
    leader().log(someData());

    peers(newPeerIds).forEach((peer) ->
        assertThat(peer, willCommitConfiguration(finalConfig)));

    peersBeingRemoved(transitionalConfig).forEach((peer) ->
        assertThat(peer, not(wonAnElectionWithTerm(greaterThan(firstLeaderTerm)))));
  }

  @Test
  public void aLateBootstrapCallWillBeDisregarded() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    leader().logDataUpToIndex(4);
    allPeers((peer) -> assertThat(peer, willCommitEntriesUpTo(lastIndexLogged())));

    // Bootstrap calls to both leader and a non-leader -- both will be no-ops
    pickNonLeader().instance.bootstrapQuorum(smallerPeerSetWithNoneInCommonWithInitialSet());
    leader().instance.bootstrapQuorum(smallerPeerSetWithNoneInCommonWithInitialSet());

    // Verify that quorum is still in a working state
    assertThat(sim.getLog(leader().id).getLastIndex(), is(equalTo(4L)));

    leader().logDataUpToIndex(5);
    allPeers((peer) -> assertThat(peer, willCommitEntriesUpTo(lastIndexLogged())));
  }

  @Test
  public void aSnapshotCannotCoverEntriesThatHaveNotCommitted() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    leader().log(someData()).waitForCommit(lastIndexLogged());

    assertThat(leader().instance.takeSnapshot(lastIndexLogged() + 10, someState()),
        resultsInException(IllegalArgumentException.class));
  }

  @Test
  public void takingASnapshotCompactsTheLogThroughTheSnapshotIndex() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    leader().logDataUpToIndex(6).waitForCommit(6);

    leader().instance.takeSnapshot(5, someState()).get();

    ReplicatorLog leaderLog = leader().log;
    assertThat(leaderLog.getBaseIndex(), is(equalTo(5L)));
    assertThat(leaderLog.getLastIndex(), is(equalTo(6L)));

    ReplicatorSnapshot saved = sim.getSnapshotStore(leader().id).load(InRamSim.QUORUM_ID);
    assertThat(saved.lastIncludedIndex, is(equalTo(5L)));
    assertThat(saved.lastIncludedTerm, is(equalTo(currentTerm())));
    assertThat(saved.configuration, is(equalTo(QuorumConfiguration.of(initialPeerSet()))));
  }

  @Test
  public void aFollowerWhoseNextEntryWasCompactedAwayIsSentASnapshot() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));

    PeerController follower = pickFollower();
    follower.waitForCommit(FIRST_NO_OP_INDEX).die();

    leader().logDataUpToIndex(6).waitForCommit(6);
    leader().instance.takeSnapshot(6, someState()).get();

    follower.restart();
    leader().log(someData());

    assertThat(leader(), willSend(anInstallSnapshotRequest().to(follower.id).withSnapshotThrough(equalTo(6L))));
    eventMonitor.waitFor(aReplicatorEvent(SNAPSHOT_INSTALLED, equalTo(follower.id)));
    assertThat(follower, willCommitEntriesUpTo(lastIndexLogged()));

    assertThat(sim.getSnapshotStore(follower.id).load(InRamSim.QUORUM_ID).getData(), is(equalTo(someState())));
    assertThat(sim.getLog(follower.id).getBaseIndex(), is(equalTo(6L)));
  }

  @Test
  public void aRestartedPeerPublishesItsLatestSnapshotBeforeReplicatingFurther() throws Exception {
    havingElectedALeaderAtOrAfter(term(1));
    leader().logDataUpToIndex(4);

    PeerController follower = pickFollower();
    follower.waitForCommit(4);
    follower.instance.takeSnapshot(4, someState()).get();
    follower.die();

    snapshotMonitor.forgetHistory();
    follower.restart();

    ReplicatorSnapshot restored = snapshotMonitor.waitFor(any(ReplicatorSnapshot.class));
    assertThat(restored.lastIncludedIndex, is(equalTo(4L)));
    assertThat(restored.getData(), is(equalTo(someState())));

    leader().log(someData());
    assertThat(follower, willCommitEntriesUpTo(lastIndexLogged()));
  }

  /**
   * Private methods
   */

  // Blocks until a leader is elected during some term >= minimumTerm.
  // Throws an AssertionError if that does not occur within the time limit.
  private void waitForALeader(long minimumTerm) {
    waitForALeaderElectedEventMatching(anyLeader(), greaterThanOrEqualTo(minimumTerm));
  }

  private void waitForALeaderWithId(Matcher<Long> leaderIdMatcher) {
    waitForALeaderElectedEventMatching(leaderIdMatcher, anyTerm());
  }

  private void waitForALeaderElectedEventMatching(Matcher<Long> leaderIdMatcher, Matcher<Long> termMatcher) {
    sim.startAllTimeouts();
    eventMonitor.waitFor(leaderElectedEvent(leaderIdMatcher, termMatcher));
    sim.stopAllTimeouts();

    // Wait for at least one other node to recognize the new leader. This is necessary because
    // some tests want to be able to identify a follower right away.
    pickNonLeader().waitForAppendReply(termMatcher);

    final long leaderId = currentLeader();
    assertThat(leaderCount(), is(equalTo(1)));

    sim.startTimeout(leaderId);
  }

  // Also waits for the leader's no-op to commit, after which it accepts configuration changes.
  private void havingElectedALeaderAtOrAfter(long minimumTerm) {
    waitForALeader(minimumTerm);
    leader().waitForCommit(FIRST_NO_OP_INDEX);
  }

  private void waitForANewLeader() {
    waitForALeader(currentTerm() + 1);
  }

  // Counts leaders in the current term. Used to verify a sensible state.
  // If the simulation is running correctly, this should only ever return 0 or 1.
  private int leaderCount() {
    final long currentTerm = currentTerm();
    int leaderCount = 0;
    for (ReplicatorInstance replicatorInstance : sim.getReplicators().values()) {
      if (replicatorInstance.isLeader() && replicatorInstance.currentTerm >= currentTerm) {
        leaderCount++;
      }
    }
    return leaderCount;
  }

  private void waitForAnElectionTimeout() {
    eventMonitor.waitFor(aReplicatorEvent(ELECTION_TIMEOUT));
  }

  private void ignoringPreviousReplies() {
    replyMonitor.forgetHistory();
  }

  private static List<ByteBuffer> someData() {
    return Lists.newArrayList(
        ByteBuffer.wrap("test".getBytes(StandardCharsets.UTF_8)));
  }

  private static byte[] someState() {
    return "collections: 1".getBytes(StandardCharsets.UTF_8);
  }

  private LeaderController leader() {
    return new LeaderController();
  }

  private long lastIndexLogged() {
    return lastIndexLogged;
  }

  // Syntactic sugar for manipulating leaders

  class LeaderController extends PeerController {
    public LeaderController() {
      super(currentLeader());
    }

    public LeaderController log(List<ByteBuffer> buffers) throws Exception {
      lastIndexLogged = currentLeaderInstance().logData(buffers).get().seqNum;
      return this;
    }

    public LeaderController logDataUpToIndex(long index) throws Exception {
      while (lastIndexLogged < index) {
        log(someData());
      }
      return this;
    }

    @Override
    public LeaderController waitForCommit(long commitIndex) {
      super.waitForCommit(commitIndex);
      return this;
    }

    private ReplicatorInstance currentLeaderInstance() {
      return sim.getReplicators().get(currentLeader());
    }
  }

  // Syntactic sugar for manipulating peers
  class PeerController {
    public final long id;
    public final ReplicatorLog log;
    public final ReplicatorInstance instance;

    public PeerController(long id) {
      this.id = id;
      this.log = sim.getLog(id);
      this.instance = sim.getReplicators().get(id);
    }

    @Override
    public String toString() {
      return instance.toString();
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof PeerController && ((PeerController) o).id == id;
    }

    @Override
    public int hashCode() {
      return Long.hashCode(id);
    }

    public boolean isCurrentLeader() {
      return instance.isLeader()
          && instance.currentTerm >= currentTerm();
    }

    public QuorumConfiguration currentConfiguration() {
      return instance.getQuorumConfiguration();
    }

    public ListenableFuture<ReplicatorReceipt> changeQuorum(Collection<Long> newPeerIds) throws Exception {
      return instance.changeQuorum(newPeerIds);
    }

    public ListenableFuture<ReplicatorReceipt> changeLearners(Collection<Long> newLearnerIds) throws Exception {
      return instance.changeLearners(newLearnerIds);
    }

    public PeerController die() {
      sim.killPeer(id);
      return this;
    }

    public PeerController restart() {
      sim.restartPeer(id);
      return this;
    }

    public boolean isOnline() {
      return !sim.getOfflinePeers().contains(id);
    }

    public PeerController allowToTimeout() {
      sim.startTimeout(id);
      return this;
    }

    public PeerController waitForCommit(long commitIndex) {
      commitMonitor.waitFor(aCommitNotice().withIndex(greaterThanOrEqualTo(commitIndex)).issuedFromPeer(id));
      return this;
    }

    public PeerController waitForQuorumCommit(QuorumConfiguration quorumConfiguration) {
      eventMonitor.waitFor(aQuorumChangeCommittedEvent(quorumConfiguration, equalTo(id)));
      return this;
    }

    public PeerController waitForAppendReply(Matcher<Long> termMatcher) {
      replyMonitor.waitFor(anAppendReply().withTerm(termMatcher));
      return this;
    }

    public PeerController waitForRequest(RequestMatcher requestMatcher) {
      requestMonitor.waitFor(requestMatcher.from(id));
      return this;
    }

    public boolean hasCommittedEntriesUpTo(long index) {
      return commitMonitor.hasAny(aCommitNotice().withIndex(greaterThanOrEqualTo(index)).issuedFromPeer(id));
    }

    public boolean hasWonAnElection(Matcher<Long> termMatcher) {
      return eventMonitor.hasAny(leaderElectedEvent(equalTo(id), termMatcher));
    }

    public void willDropIncomingAppendsUntil(PeerController peer, Matcher<PeerController> matcher) {
      sim.dropMessages(
          (message) -> message.to == id && message.isAppendMessage(),
          (message) -> matcher.matches(peer));
    }

    public PeerController willDropAllIncomingTraffic() {
      sim.dropMessages(
          (message) -> (message.to == id) && (message.to != message.from),
          (message) -> false);
      return this;
    }
  }


  private PeerController peer(long peerId) {
    return new PeerController(peerId);
  }

  private Set<PeerController> peers(Collection<Long> peerIds) {
    return peerIds.stream()
        .map(this::peer)
        .collect(Collectors.toSet());
  }

  private <Ex extends Throwable> void allPeers(CheckedConsumer<PeerController, Ex> forEach) throws Ex {
    for (long peerId : sim.getOnlinePeers()) {
      forEach.accept(new PeerController(peerId));
    }
  }

  private <Ex extends Throwable> void allPeersExceptLeader(CheckedConsumer<PeerController, Ex> forEach) throws Ex {
    for (long peerId : sim.getOnlinePeers()) {
      if (peerId == currentLeader()) {
        continue;
      }
      forEach.accept(new PeerController(peerId));
    }
  }

  private PeerController anyPeerSuchThat(Predicate<PeerController> predicate) {
    for (long peerId : sim.getOnlinePeers()) {
      if (predicate.test(peer(peerId))) {
        return peer(peerId);
      }
    }
    return null;
  }

  private Set<PeerController> peersBeingRemoved(QuorumConfiguration configuration) {
    assert configuration.isTransitional;

    return Sets.difference(configuration.prevPeers(), configuration.nextPeers())
        .stream()
        .map(PeerController::new)
        .collect(Collectors.toSet());
  }

  private PeerController pickFollower() {
    PeerController chosenPeer = anyPeerSuchThat((peer) -> peer.instance.myState == FOLLOWER && peer.isOnline());
    assertThat(chosenPeer, not(nullValue()));
    return chosenPeer;
  }

  private PeerController pickNonLeader() {
    PeerController chosenPeer = anyPeerSuchThat((peer) -> not(theLeader()).matches(peer) && peer.isOnline());
    assertThat(chosenPeer, not(nullValue()));
    return chosenPeer;
  }

  private long currentTerm() {
    return eventMonitor.getLatest(leaderElectedEvent(anyLeader(), anyTerm())).leaderElectedTerm;
  }

  private long currentLeader() {
    return eventMonitor.getLatest(leaderElectedEvent(anyLeader(), anyTerm())).newLeader;
  }

  private static long term(long term) {
    return term;
  }

  private static long index(long index) {
    return index;
  }

  private static Matcher<Long> anyLeader() {
    return any(Long.class);
  }

  private static Matcher<Long> anyTerm() {
    return any(Long.class);
  }

  private void dropAllAppendsWithThisConfigurationUntilAPreElectionPollTakesPlace(QuorumConfiguration configuration) {
    sim.dropMessages(
        (message) ->
            message.isAppendMessage()
                && containsQuorumConfiguration(message.getAppendMessage().getEntriesList(), configuration),
        aPreElectionReply()::matches);
  }

  private static Set<Long> initialPeerSet() {
    return Sets.newHashSet(1L, 2L, 3L, 4L, 5L, 6L, 7L);
  }

  private static Set<Long> smallerPeerSetWithOneInCommonWithInitialSet() {
    return Sets.newHashSet(7L, 8L, 9L);
  }

  private static Set<Long> smallerPeerSetWithNoneInCommonWithInitialSet() {
    return Sets.newHashSet(8L, 9L, 10L);
  }

  private static Set<Long> largerPeerSetWithSomeInCommonWithInitialSet() {
    return Sets.newHashSet(4L, 5L, 6L, 7L, 8L, 9L, 10L);
  }
}
