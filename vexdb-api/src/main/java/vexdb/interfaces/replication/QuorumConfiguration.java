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

package vexdb.interfaces.replication;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Sets;
import com.google.common.collect.SortedMultiset;
import com.google.common.collect.TreeMultiset;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable value type representing a configuration of which peers are members of a quorum.
 * It satisfies the following invariants: if isTransitional is true, then allPeers is
 * the union of prevPeers and nextPeers. If isTransitional is false, then prevPeers
 * and nextPeers are empty.
 * <p>
 * Learners receive the log like any other member but never vote, never stand for election
 * and are never counted toward a majority. No peer is both a learner and a voter.
 */
public final class QuorumConfiguration {

  public final boolean isTransitional;

  private final Set<Long> allPeers;
  private final Set<Long> prevPeers;
  private final Set<Long> nextPeers;
  private final Set<Long> learners;

  public static final QuorumConfiguration EMPTY = new QuorumConfiguration(ImmutableSet.of(), ImmutableSet.of());

  public static QuorumConfiguration of(Collection<Long> peerCollection) {
    return new QuorumConfiguration(peerCollection, ImmutableSet.of());
  }

  public static QuorumConfiguration of(Collection<Long> peerCollection, Collection<Long> learnerCollection) {
    return new QuorumConfiguration(peerCollection, learnerCollection);
  }

  /**
   * Rebuild a configuration from its serialized parts.
   */
  public static QuorumConfiguration fromParts(boolean isTransitional,
                                              Collection<Long> allPeers,
                                              Collection<Long> prevPeers,
                                              Collection<Long> nextPeers,
                                              Collection<Long> learners) {
    if (isTransitional) {
      return new QuorumConfiguration(prevPeers, nextPeers, learners);
    } else {
      return new QuorumConfiguration(allPeers, learners);
    }
  }

  /**
   * Joint configuration leading from the current voters to newPeerCollection. Any learner
   * named in newPeerCollection is on its way to becoming a voter and so stops being a learner.
   */
  public QuorumConfiguration getTransitionalConfiguration(Collection<Long> newPeerCollection) {
    if (isTransitional) {
      return new QuorumConfiguration(prevPeers, newPeerCollection, learners);
    } else {
      return new QuorumConfiguration(allPeers, newPeerCollection, learners);
    }
  }

  public QuorumConfiguration getCompletedConfiguration() {
    assert isTransitional;

    return new QuorumConfiguration(nextPeers, learners);
  }

  public QuorumConfiguration withLearners(Collection<Long> newLearners) {
    if (isTransitional) {
      return new QuorumConfiguration(prevPeers, nextPeers, newLearners);
    } else {
      return new QuorumConfiguration(allPeers, newLearners);
    }
  }

  public Set<Long> allPeers() {
    return allPeers;
  }

  public Set<Long> prevPeers() {
    return prevPeers;
  }

  public Set<Long> nextPeers() {
    return nextPeers;
  }

  public Set<Long> learners() {
    return learners;
  }

  /**
   * Every peer the log is replicated to: voters and learners.
   */
  public Set<Long> allMembers() {
    return Sets.union(allPeers, learners);
  }

  public boolean isVoter(long peerId) {
    return allPeers.contains(peerId);
  }

  public boolean isEmpty() {
    return allPeers.size() == 0
        && prevPeers.size() == 0
        && nextPeers.size() == 0
        && learners.size() == 0;
  }

  /**
   * Determine if the peers in sourceSet include a majority of the peers in this configuration.
   */
  public boolean setContainsMajority(Set<Long> sourceSet) {
    if (isTransitional) {
      return setComprisesMajorityOfAnotherSet(sourceSet, prevPeers)
          && setComprisesMajorityOfAnotherSet(sourceSet, nextPeers);
    } else {
      return setComprisesMajorityOfAnotherSet(sourceSet, allPeers);
    }
  }

  /**
   * Given a map which tells the last acknowledged entry index for different peers, find the maximum
   * index value which is less than or equal to a majority of this configuration's peers' indexes.
   * Acknowledgements from learners are ignored.
   */
  public long calculateCommittedIndex(Map<Long, Long> peersLastAckedIndex) {
    if (isTransitional) {
      return Math.min(
          getGreatestIndexCommittedByMajority(prevPeers, peersLastAckedIndex),
          getGreatestIndexCommittedByMajority(nextPeers, peersLastAckedIndex));
    } else {
      return getGreatestIndexCommittedByMajority(allPeers, peersLastAckedIndex);
    }
  }

  private QuorumConfiguration(Collection<Long> peers, Collection<Long> learners) {
    this.isTransitional = false;
    allPeers = ImmutableSet.copyOf(peers);
    prevPeers = nextPeers = ImmutableSet.of();
    this.learners = Sets.difference(ImmutableSet.copyOf(learners), allPeers).immutableCopy();
  }

  private QuorumConfiguration(Collection<Long> prevPeers, Collection<Long> nextPeers, Collection<Long> learners) {
    this.isTransitional = true;
    this.prevPeers = ImmutableSet.copyOf(prevPeers);
    this.nextPeers = ImmutableSet.copyOf(nextPeers);
    this.allPeers = Sets.union(this.prevPeers, this.nextPeers).immutableCopy();
    this.learners = Sets.difference(ImmutableSet.copyOf(learners), allPeers).immutableCopy();
  }

  private static long getGreatestIndexCommittedByMajority(Set<Long> peers, Map<Long, Long> peersLastAckedIndex) {
    if (peers.isEmpty()) {
      return 0;
    }
    SortedMultiset<Long> committedIndexes = TreeMultiset.create();
    committedIndexes.addAll(peers.stream().map(peerId
        -> peersLastAckedIndex.getOrDefault(peerId, 0L)).collect(Collectors.toList()));
    return Iterables.get(committedIndexes.descendingMultiset(), calculateNumericalMajority(peers.size()) - 1);
  }

  private static <T> boolean setComprisesMajorityOfAnotherSet(Set<T> sourceSet, Set<T> destinationSet) {
    return Sets.intersection(sourceSet, destinationSet).size() >= calculateNumericalMajority(destinationSet.size());
  }

  private static int calculateNumericalMajority(int setSize) {
    return (setSize / 2) + 1;
  }

  @Override
  public String toString() {
    return "QuorumConfiguration{" +
        "isTransitional=" + isTransitional +
        ", allPeers=" + allPeers +
        ", prevPeers=" + prevPeers +
        ", nextPeers=" + nextPeers +
        ", learners=" + learners +
        '}';
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }

    QuorumConfiguration that = (QuorumConfiguration) o;

    return isTransitional == that.isTransitional
        && allPeers.equals(that.allPeers)
        && nextPeers.equals(that.nextPeers)
        && prevPeers.equals(that.prevPeers)
        && learners.equals(that.learners);
  }

  @Override
  public int hashCode() {
    int result = (isTransitional ? 1 : 0);
    result = 31 * result + allPeers.hashCode();
    result = 31 * result + prevPeers.hashCode();
    result = 31 * result + nextPeers.hashCode();
    result = 31 * result + learners.hashCode();
    return result;
  }
}
