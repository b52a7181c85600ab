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

package vexdb.log;

import com.google.common.collect.Lists;
import org.junit.Test;
import vexdb.interfaces.replication.EntryCompactedException;
import vexdb.interfaces.replication.QuorumConfiguration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static vexdb.FutureMatchers.resultsIn;
import static vexdb.FutureMatchers.resultsInException;
import static vexdb.log.LogTestUtil.makeConfigurationEntry;
import static vexdb.log.LogTestUtil.someConsecutiveEntries;
import static vexdb.log.LogTestUtil.term;

public class InRamLogTest {
  private final InRamLog log = new InRamLog();

  @Test
  public void reportsTheTermOfEachEntryIncludingTheBaseAfterCompaction() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 4, term(1)));
    log.logEntries(someConsecutiveEntries(4, 8, term(3)));
    log.compactThrough(5);

    assertThat(log.getBaseIndex(), is(equalTo(5L)));
    assertThat(log.getLogTerm(5), is(equalTo(3L)));
    assertThat(log.getLogTerm(3), is(equalTo(0L)));
    assertThat(log.getLastTerm(), is(equalTo(3L)));
    assertThat(log.getLogEntries(6, 8), resultsIn(equalTo(someConsecutiveEntries(6, 8, term(3)))));
    assertThat(log.getLogEntries(5, 8), resultsInException(EntryCompactedException.class));
  }

  @Test
  public void fallsBackToTheEarlierConfigurationWhenALaterOneIsTruncated() throws Exception {
    final QuorumConfiguration first = QuorumConfiguration.of(Lists.newArrayList(1L, 2L, 3L));
    final QuorumConfiguration second = first.getTransitionalConfiguration(Lists.newArrayList(1L, 2L, 4L));

    log.logEntries(Lists.newArrayList(makeConfigurationEntry(1, term(1), first)));
    log.logEntries(someConsecutiveEntries(2, 5, term(1)));
    log.logEntries(Lists.newArrayList(makeConfigurationEntry(5, term(2), second)));
    assertThat(log.getLastConfiguration(), is(equalTo(second)));

    log.truncateLog(5);

    assertThat(log.getLastConfiguration(), is(equalTo(first)));
    assertThat(log.getLastConfigurationIndex(), is(equalTo(1L)));
  }

  @Test
  public void keepsTheConfigurationInForceAtTheBaseAfterCompactingItAway() throws Exception {
    final QuorumConfiguration configuration = QuorumConfiguration.of(Lists.newArrayList(1L, 2L, 3L));
    log.logEntries(Lists.newArrayList(makeConfigurationEntry(1, term(1), configuration)));
    log.logEntries(someConsecutiveEntries(2, 6, term(1)));

    log.compactThrough(4);

    assertThat(log.getLastConfiguration(), is(equalTo(configuration)));
    assertThat(log.getConfigurationAt(5), is(equalTo(configuration)));
  }

  @Test
  public void discardsEverythingWhenResetToASnapshot() throws Exception {
    final QuorumConfiguration configuration = QuorumConfiguration.of(Lists.newArrayList(1L, 2L));
    log.logEntries(someConsecutiveEntries(1, 4, term(1)));

    log.resetToSnapshot(30, term(5), configuration);

    assertThat(log.getLastIndex(), is(equalTo(30L)));
    assertThat(log.getLastTerm(), is(equalTo(5L)));
    assertThat(log.getLogTerm(2), is(equalTo(0L)));
    assertThat(log.getLastConfiguration(), is(equalTo(configuration)));
  }

  @Test
  public void returnsTheEmptyConfigurationWhenNoneWasEverLogged() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 3, term(1)));

    assertThat(log.getConfigurationAt(2), is(equalTo(QuorumConfiguration.EMPTY)));
  }
}
