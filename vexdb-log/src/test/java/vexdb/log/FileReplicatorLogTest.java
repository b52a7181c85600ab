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
import com.google.common.util.concurrent.MoreExecutors;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import vexdb.interfaces.replication.EntryCompactedException;
import vexdb.interfaces.replication.LogEntry;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.util.KeySerializingExecutor;
import vexdb.util.WrappingKeySerializingExecutor;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static vexdb.FutureMatchers.resultsIn;
import static vexdb.FutureMatchers.resultsInException;
import static vexdb.log.LogTestUtil.makeConfigurationEntry;
import static vexdb.log.LogTestUtil.someConsecutiveEntries;
import static vexdb.log.LogTestUtil.term;

public class FileReplicatorLogTest {
  private static final String QUORUM_ID = "cluster";
  private static final QuorumConfiguration CONFIGURATION = QuorumConfiguration.of(Lists.newArrayList(1L, 2L, 3L));

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private final KeySerializingExecutor executor =
      new WrappingKeySerializingExecutor(MoreExecutors.listeningDecorator(Executors.newSingleThreadExecutor()));
  private Path directory;
  private FileReplicatorLog log;

  @Before
  public void openLog() throws Exception {
    directory = temporaryFolder.newFolder("quorum").toPath();
    log = new FileReplicatorLog(QUORUM_ID, directory, executor);
  }

  @After
  public void shutDown() throws Exception {
    executor.shutdownAndAwaitTermination(5, TimeUnit.SECONDS);
    log.close();
  }

  @Test
  public void recoversItsEntriesAndTermsAfterBeingReopened() throws Exception {
    final List<LogEntry> entries = someConsecutiveEntries(1, 6, term(4));
    assertThat(log.logEntries(entries), resultsIn(equalTo(true)));

    final FileReplicatorLog reopened = reopen();

    assertThat(reopened.getLastIndex(), is(equalTo(5L)));
    assertThat(reopened.getLastTerm(), is(equalTo(4L)));
    assertThat(reopened.getLogEntries(2, 5), resultsIn(equalTo(entries.subList(1, 4))));
  }

  @Test
  public void recoversTheLastConfigurationAfterBeingReopened() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 3, term(1)));
    assertThat(log.logEntries(Lists.newArrayList(
        makeConfigurationEntry(3, term(1), CONFIGURATION))), resultsIn(equalTo(true)));

    final FileReplicatorLog reopened = reopen();

    assertThat(reopened.getLastConfiguration(), is(equalTo(CONFIGURATION)));
    assertThat(reopened.getLastConfigurationIndex(), is(equalTo(3L)));
  }

  @Test
  public void forgetsTruncatedEntriesAcrossARestart() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 10, term(1)));
    assertThat(log.truncateLog(4), resultsIn(equalTo(true)));
    assertThat(log.logEntries(someConsecutiveEntries(4, 6, term(2))), resultsIn(equalTo(true)));

    final FileReplicatorLog reopened = reopen();

    assertThat(reopened.getLastIndex(), is(equalTo(5L)));
    assertThat(reopened.getLogTerm(3), is(equalTo(1L)));
    assertThat(reopened.getLogTerm(4), is(equalTo(2L)));
  }

  @Test
  public void keepsTheBaseIndexTermAndConfigurationAfterCompactionAndRestart() throws Exception {
    log.logEntries(Lists.newArrayList(makeConfigurationEntry(1, term(1), CONFIGURATION)));
    log.logEntries(someConsecutiveEntries(2, 11, term(2)));
    assertThat(log.compactThrough(6), resultsIn(equalTo(true)));

    final FileReplicatorLog reopened = reopen();

    assertThat(reopened.getBaseIndex(), is(equalTo(6L)));
    assertThat(reopened.getBaseTerm(), is(equalTo(2L)));
    assertThat(reopened.getLogTerm(6), is(equalTo(2L)));
    assertThat(reopened.getLastIndex(), is(equalTo(10L)));
    assertThat(reopened.getLastConfiguration(), is(equalTo(CONFIGURATION)));
    assertThat(reopened.getLogEntries(7, 11).get().size(), is(equalTo(4)));
  }

  @Test
  public void failsRequestsForEntriesThatHaveBeenCompacted() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 11, term(1)));
    log.compactThrough(5);

    assertThat(log.getLogEntries(3, 8), resultsInException(EntryCompactedException.class));
    assertThat(log.getLogEntries(6, 8).get().size(), is(equalTo(2)));
  }

  @Test
  public void startsAfreshFromASnapshotWhenReset() throws Exception {
    log.logEntries(someConsecutiveEntries(1, 4, term(1)));
    assertThat(log.resetToSnapshot(20, term(3), CONFIGURATION), resultsIn(equalTo(true)));
    assertThat(log.logEntries(someConsecutiveEntries(21, 23, term(3))), resultsIn(equalTo(true)));

    final FileReplicatorLog reopened = reopen();

    assertThat(reopened.getBaseIndex(), is(equalTo(20L)));
    assertThat(reopened.getLastIndex(), is(equalTo(22L)));
    assertThat(reopened.getLastConfiguration(), is(equalTo(CONFIGURATION)));
  }

  private FileReplicatorLog reopen() throws Exception {
    // Wait for any outstanding IO for the quorum before closing.
    executor.submit(QUORUM_ID, () -> null).get();
    log.close();
    log = new FileReplicatorLog(QUORUM_ID, directory, executor);
    return log;
  }
}
