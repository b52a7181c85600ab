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

import com.google.common.collect.Sets;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import vexdb.ReplicatorConstants;
import vexdb.interfaces.replication.QuorumConfiguration;
import vexdb.interfaces.replication.ReplicatorSnapshot;
import vexdb.log.EntryEncodingUtil;

import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

public class FileSnapshotStoreTest {
  private static final String QUORUM_ID = "collection-meta";

  @Rule
  public TemporaryFolder testFolder = new TemporaryFolder();

  private NioQuorumFileReaderWriter readerWriter;
  private FileSnapshotStore store;

  @Before
  public void createStore() throws Exception {
    readerWriter = new NioQuorumFileReaderWriter(testFolder.getRoot().toPath());
    store = new FileSnapshotStore(readerWriter);
  }

  @Test
  public void aQuorumWithoutASnapshotLoadsAsNull() throws Exception {
    assertThat(store.load(QUORUM_ID), is(nullValue()));
  }

  @Test
  public void aSavedSnapshotIsLoadedBackByANewStore() throws Exception {
    ReplicatorSnapshot snapshot = aSnapshot(12, 3, QuorumConfiguration.of(Sets.newHashSet(1L, 2L, 3L)));
    store.save(snapshot);

    FileSnapshotStore reopened = new FileSnapshotStore(new NioQuorumFileReaderWriter(testFolder.getRoot().toPath()));
    assertThat(reopened.load(QUORUM_ID), is(equalTo(snapshot)));
  }

  @Test
  public void aTransitionalConfigurationWithLearnersSurvivesTheRoundTrip() throws Exception {
    QuorumConfiguration configuration = QuorumConfiguration
        .of(Sets.newHashSet(1L, 2L, 3L))
        .getTransitionalConfiguration(Sets.newHashSet(2L, 3L, 4L))
        .withLearners(Sets.newHashSet(9L));
    store.save(aSnapshot(40, 6, configuration));

    assertThat(store.load(QUORUM_ID).configuration, is(equalTo(configuration)));
  }

  @Test
  public void savingAgainReplacesThePreviousSnapshot() throws Exception {
    store.save(aSnapshot(5, 1, QuorumConfiguration.of(Sets.newHashSet(1L))));
    ReplicatorSnapshot later = aSnapshot(9, 2, QuorumConfiguration.of(Sets.newHashSet(1L, 2L)));
    store.save(later);

    assertThat(store.load(QUORUM_ID), is(equalTo(later)));
  }

  @Test(expected = EntryEncodingUtil.CrcError.class)
  public void aCorruptedSnapshotFileIsDetected() throws Exception {
    store.save(aSnapshot(12, 3, QuorumConfiguration.of(Sets.newHashSet(1L, 2L, 3L))));

    Path file = readerWriter.getQuorumDirectory(QUORUM_ID).resolve(ReplicatorConstants.REPLICATOR_SNAPSHOT_FILE_NAME);
    try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "rw")) {
      long position = raf.length() - 6;
      raf.seek(position);
      int original = raf.read();
      raf.seek(position);
      raf.write(original ^ 0xFF);
    }

    store.load(QUORUM_ID);
  }

  private static ReplicatorSnapshot aSnapshot(long index, long term, QuorumConfiguration configuration) {
    byte[] data = ("state through " + index).getBytes(StandardCharsets.UTF_8);
    return new ReplicatorSnapshot(QUORUM_ID, index, term, configuration, data);
  }
}
