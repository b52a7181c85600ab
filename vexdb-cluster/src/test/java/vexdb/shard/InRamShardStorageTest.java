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

package vexdb.shard;

import org.junit.Test;
import vexdb.interfaces.StorageException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class InRamShardStorageTest {
  private final InRamShardStorage storage = new InRamShardStorage();

  @Test
  public void shardsAreKeptApart() {
    storage.apply(1, 1, "a", bytes("one"));
    storage.apply(2, 1, "b", bytes("two"));

    assertThat(storage.contents(1).keySet(), contains("a"));
    assertThat(storage.contents(2).keySet(), contains("b"));
  }

  @Test
  public void anExportedSnapshotImportsIntoAnotherShardWithItsPosition() throws Exception {
    storage.apply(1, 1, "a", bytes("one"));
    storage.apply(1, 2, "b", bytes("two"));
    InRamShardStorage other = new InRamShardStorage();
    other.apply(7, 1, "stale", bytes("x"));

    long position = other.importSnapshot(7, storage.exportSnapshot(1));

    assertThat(position, is(2L));
    assertThat(other.contents(7).keySet(), contains("a", "b"));
  }

  @Test(expected = StorageException.class)
  public void aCorruptSnapshotIsReportedAsAStorageFailure() throws Exception {
    storage.importSnapshot(1, new ByteArrayInputStream(new byte[]{(byte) 0xff, (byte) 0xff, 0x01}));
  }

  @Test
  public void reapplyingAnOlderOperationLeavesTheLaterValue() {
    storage.apply(1, 1, "k", bytes("a"));
    storage.apply(1, 2, "k", bytes("b"));

    storage.apply(1, 1, "k", bytes("a"));

    assertThat(new String(storage.read(1, "k"), StandardCharsets.UTF_8), is("b"));
  }

  @Test
  public void readsReturnCopies() {
    storage.apply(1, 1, "a", bytes("one"));

    storage.read(1, "a")[0] = 'X';

    assertThat(new String(storage.read(1, "a"), StandardCharsets.UTF_8), is("one"));
  }

  private static byte[] bytes(String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }
}
