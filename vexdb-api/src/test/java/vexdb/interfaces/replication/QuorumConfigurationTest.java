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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import org.junit.Test;

import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

public class QuorumConfigurationTest {
  private final QuorumConfiguration stableConfiguration = aStableConfiguration();
  private final QuorumConfiguration transitionalConfiguration = aTransitionalConfiguration();

  @Test
  public void canBeRebuiltFromTheSerializedPartsOfAStableConfiguration() {
    QuorumConfiguration configuration = stableConfiguration.withLearners(Sets.newHashSet(7L));

    assertThat(rebuild(configuration), is(equalTo(configuration)));
  }

  @Test
  public void canBeRebuiltFromTheSerializedPartsOfATransitionalConfiguration() {
    assertThat(rebuild(transitionalConfiguration), is(equalTo(transitionalConfiguration)));
  }

  @Test
  public void returnsNewConfigurationsRepresentingTransitionsToADifferentPeerSet() {
    final QuorumConfiguration transitional = stableConfiguration.getTransitionalConfiguration(aDestinationPeerSet());
    final QuorumConfiguration destinationConfiguration = QuorumConfiguration.of(aDestinationPeerSet());

    assertThat(transitional.isTransitional, is(equalTo(true)));
    assertThat(transitional.getCompletedConfiguration(), is(equalTo(destinationConfiguration)));
  }

  @Test
  public void returnsBeforeAndAfterPeerSetsFromATransitionalConfiguration() {
    final QuorumConfiguration transitional =
        QuorumConfiguration.of(aPeerSet())
            .getTransitionalConfiguration(aDestinationPeerSet());

    assertThat(transitional.prevPeers(), equalTo(aPeerSet()));
    assertThat(transitional.nextPeers(), equalTo(aDestinationPeerSet()));
  }

  @Test
  public void aLearnerPromotedToVoterStopsBeingALearner() {
    final QuorumConfiguration withLearner = QuorumConfiguration.of(aPeerSet(), Sets.newHashSet(6L, 7L));

    final QuorumConfiguration promoted = withLearner
        .getTransitionalConfiguration(Sets.union(aPeerSet(), Sets.newHashSet(6L)))
        .getCompletedConfiguration();

    assertThat(promoted.allPeers(), containsInAnyOrder(1L, 2L, 3L, 4L, 5L, 6L));
    assertThat(promoted.learners(), contains(7L));
  }

  @Test
  public void aPeerIsNeverBothLearnerAndVoter() {
    final QuorumConfiguration configuration = QuorumConfiguration.of(aPeerSet(), Sets.newHashSet(1L, 2L));

    assertThat(configuration.learners(), is(empty()));
  }

  @Test
  public void learnersNeverCountTowardAMajority() {
    final QuorumConfiguration configuration = QuorumConfiguration.of(Sets.newHashSet(1L, 2L, 3L),
        Sets.newHashSet(4L, 5L, 6L));

    assertThat(configuration.setContainsMajority(Sets.newHashSet(1L, 4L, 5L, 6L)), is(false));
    assertThat(configuration.setContainsMajority(Sets.newHashSet(1L, 2L)), is(true));
  }

  @Test
  public void calculatesTheGreatestIndexAcknowledgedByAMajorityOfVoters() {
    final QuorumConfiguration configuration = QuorumConfiguration.of(Sets.newHashSet(1L, 2L, 3L),
        Sets.newHashSet(4L));

    assertThat(configuration.calculateCommittedIndex(ImmutableMap.of(1L, 10L, 2L, 7L, 3L, 2L, 4L, 20L)),
        is(equalTo(7L)));
  }

  @Test
  public void requiresAMajorityOfBothHalvesOfATransitionalConfiguration() {
    final QuorumConfiguration transitional = QuorumConfiguration.of(Sets.newHashSet(1L, 2L, 3L))
        .getTransitionalConfiguration(Sets.newHashSet(3L, 4L, 5L));

    assertThat(transitional.setContainsMajority(Sets.newHashSet(1L, 2L, 3L)), is(false));
    assertThat(transitional.setContainsMajority(Sets.newHashSet(2L, 3L, 4L)), is(true));
    assertThat(transitional.calculateCommittedIndex(ImmutableMap.of(1L, 9L, 2L, 9L, 3L, 5L, 4L, 4L, 5L, 1L)),
        is(equalTo(4L)));
  }

  private static QuorumConfiguration rebuild(QuorumConfiguration configuration) {
    return QuorumConfiguration.fromParts(
        configuration.isTransitional,
        configuration.allPeers(),
        configuration.prevPeers(),
        configuration.nextPeers(),
        configuration.learners());
  }

  private Set<Long> aPeerSet() {
    return Sets.newHashSet(1L, 2L, 3L, 4L, 5L);
  }

  private QuorumConfiguration aStableConfiguration() {
    return QuorumConfiguration.of(aPeerSet());
  }

  private Set<Long> aDestinationPeerSet() {
    return Sets.newHashSet(3L, 4L, 5L, 6L);
  }

  private QuorumConfiguration aTransitionalConfiguration() {
    return aStableConfiguration().getTransitionalConfiguration(Sets.newHashSet(3L, 4L, 5L, 6L, 7L, 8L, 9L));
  }
}
