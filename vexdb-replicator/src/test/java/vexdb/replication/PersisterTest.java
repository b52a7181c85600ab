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
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import vexdb.ReplicatorConstants;

import java.io.IOException;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

public class PersisterTest {
  private static final String QUORUM_ID = "collection-meta";

  @Rule
  public TemporaryFolder testFolder = new TemporaryFolder();

  private NioQuorumFileReaderWriter readerWriter;
  private Persister persister;

  @Before
  public void createPersister() throws Exception {
    readerWriter = new NioQuorumFileReaderWriter(testFolder.getRoot().toPath());
    persister = new Persister(readerWriter);
  }

  @Test
  public void aQuorumWithNoPersistedDataReadsAsTermZeroWithNoVote() throws Exception {
    assertThat(persister.readCurrentTerm(QUORUM_ID), is(equalTo(0L)));
    assertThat(persister.readVotedFor(QUORUM_ID), is(equalTo(0L)));
  }

  @Test
  public void theTermAndVoteWrittenByOnePersisterAreReadBackByAnother() throws Exception {
    persister.writeCurrentTermAndVotedFor(QUORUM_ID, 7, 3);

    Persister reopened = new Persister(new NioQuorumFileReaderWriter(testFolder.getRoot().toPath()));
    assertThat(reopened.readCurrentTerm(QUORUM_ID), is(equalTo(7L)));
    assertThat(reopened.readVotedFor(QUORUM_ID), is(equalTo(3L)));
  }

  @Test
  public void laterWritesReplaceEarlierOnes() throws Exception {
    persister.writeCurrentTermAndVotedFor(QUORUM_ID, 1, 2);
    persister.writeCurrentTermAndVotedFor(QUORUM_ID, 2, 0);

    assertThat(persister.readCurrentTerm(QUORUM_ID), is(equalTo(2L)));
    assertThat(persister.readVotedFor(QUORUM_ID), is(equalTo(0L)));
  }

  @Test
  public void quorumsAreKeptApart() throws Exception {
    persister.writeCurrentTermAndVotedFor(QUORUM_ID, 5, 1);

    assertThat(persister.readCurrentTerm("another-quorum"), is(equalTo(0L)));
  }

  @Test(expected = IOException.class)
  public void aMalformedDataFileIsReportedRatherThanReadAsZero() throws Exception {
    readerWriter.writeQuorumFile(QUORUM_ID, ReplicatorConstants.REPLICATOR_PERSISTER_FILE_NAME,
        Lists.newArrayList("not-a-term", "4"));

    persister.readCurrentTerm(QUORUM_ID);
  }
}
