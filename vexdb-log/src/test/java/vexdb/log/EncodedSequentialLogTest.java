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
import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.Rule;
import org.junit.Test;
import vexdb.interfaces.log.SequentialEntryCodec;
import vexdb.interfaces.replication.LogEntry;

import java.nio.ByteBuffer;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static vexdb.log.LogTestUtil.makeEntry;
import static vexdb.log.LogTestUtil.seqNum;
import static vexdb.log.LogTestUtil.someConsecutiveEntries;
import static vexdb.log.LogTestUtil.term;

public class EncodedSequentialLogTest {
  @Rule
  public JUnitRuleMockery context = new JUnitRuleMockery();

  private final InRamBytePersistence persistence = new InRamBytePersistence();
  private final LogEntryCodec codec = new LogEntryCodec();

  @Test
  @SuppressWarnings("unchecked")
  public void writesToTheSuppliedPersistenceObjectUsingTheSuppliedCodec() throws Exception {
    final SequentialEntryCodec<LogEntry> mockCodec = context.mock(SequentialEntryCodec.class);
    final LogEntry entry = makeEntry(seqNum(1), term(2), "data");

    context.checking(new Expectations() {{
      oneOf(mockCodec).encode(with(equalTo(entry)));
      will(returnValue(new ByteBuffer[]{ByteBuffer.wrap(new byte[]{1, 2, 3})}));
    }});

    new EncodedSequentialLog<>(persistence, mockCodec).append(Lists.newArrayList(entry));

    assertThat(persistence.size(), is(equalTo(3L)));
  }

  @Test
  public void returnsExactlyTheRequestedSubSequenceOfEntries() throws Exception {
    final SequentialLog<LogEntry> log = new EncodedSequentialLog<>(persistence, codec);
    final List<LogEntry> entries = someConsecutiveEntries(1, 20, term(3));
    log.append(entries);

    assertThat(log.subSequence(5, 9), is(equalTo(entries.subList(4, 8))));
    assertThat(log.firstSeqNum(), is(equalTo(1L)));
    assertThat(log.lastSeqNum(), is(equalTo(19L)));
  }

  @Test
  public void rebuildsItsIndexFromThePersistenceWhenReopened() throws Exception {
    final List<LogEntry> entries = someConsecutiveEntries(10, 15, term(1));
    new EncodedSequentialLog<>(persistence, codec).append(entries);

    final SequentialLog<LogEntry> reopened = new EncodedSequentialLog<>(persistence, codec);

    assertThat(reopened.readAll(), is(equalTo(entries)));
    assertThat(reopened.subSequence(12, 13), is(equalTo(entries.subList(2, 3))));
  }

  @Test
  public void discardsAnEntryLeftPartiallyWrittenAtTheEndOfThePersistence() throws Exception {
    final List<LogEntry> entries = someConsecutiveEntries(1, 4, term(1));
    new EncodedSequentialLog<>(persistence, codec).append(entries);
    persistence.truncate(persistence.size() - 3);

    final SequentialLog<LogEntry> reopened = new EncodedSequentialLog<>(persistence, codec);

    assertThat(reopened.lastSeqNum(), is(equalTo(2L)));
    assertThat(reopened.readAll(), is(equalTo(entries.subList(0, 2))));

    reopened.append(someConsecutiveEntries(3, 5, term(2)));
    assertThat(new EncodedSequentialLog<>(persistence, codec).lastSeqNum(), is(equalTo(4L)));
  }

  @Test(expected = EntryEncodingUtil.CrcError.class)
  public void detectsCorruptedEntryContentWhenReading() throws Exception {
    final SequentialLog<LogEntry> log = new EncodedSequentialLog<>(persistence, codec);
    log.append(Lists.newArrayList(makeEntry(seqNum(1), term(1), "some data which will be corrupted")));

    persistence.flipBitAt((int) persistence.size() - 10);

    log.subSequence(1, 2);
  }

  @Test
  public void removesEntriesFromTheTailWhenTruncated() throws Exception {
    final SequentialLog<LogEntry> log = new EncodedSequentialLog<>(persistence, codec);
    log.append(someConsecutiveEntries(1, 10, term(1)));

    log.truncate(seqNum(6));
    log.append(someConsecutiveEntries(6, 8, term(2)));

    assertThat(log.lastSeqNum(), is(equalTo(7L)));
    assertThat(log.subSequence(6, 7).get(0).getTerm(), is(equalTo(2L)));
  }

  @Test(expected = SequentialLog.LogEntryNotFound.class)
  public void throwsWhenTheRequestedSubSequenceExtendsBeyondTheEndOfTheLog() throws Exception {
    final SequentialLog<LogEntry> log = new EncodedSequentialLog<>(persistence, codec);
    log.append(someConsecutiveEntries(1, 5, term(1)));

    log.subSequence(3, 8);
  }

  @Test(expected = IllegalArgumentException.class)
  public void refusesToAppendAnEntryWhoseSequenceNumberDoesNotFollowTheLastOne() throws Exception {
    final SequentialLog<LogEntry> log = new EncodedSequentialLog<>(persistence, codec);
    log.append(someConsecutiveEntries(1, 5, term(1)));

    log.append(someConsecutiveEntries(3, 4, term(1)));
  }
}
